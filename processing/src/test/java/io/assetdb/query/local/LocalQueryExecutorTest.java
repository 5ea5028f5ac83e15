/*
 * Licensed to SK Telecom Co., LTD. (SK Telecom) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  SK Telecom licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.assetdb.query.local;

import com.google.common.collect.ImmutableMap;
import io.assetdb.common.config.JsonConfigurator;
import io.assetdb.jackson.DefaultObjectMapper;
import io.assetdb.query.AggregateQueryAssembler;
import io.assetdb.query.AggregateRequest;
import io.assetdb.query.PlannerConfig;
import io.assetdb.query.PlannerTestHelper;
import io.assetdb.query.QueryPlan;
import io.assetdb.query.SelectRequest;
import io.assetdb.query.aggregation.AggregateSpec;
import io.assetdb.query.execution.RowSet;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;

import static io.assetdb.query.PlannerTestHelper.CONFIG;
import static io.assetdb.query.PlannerTestHelper.DIMENSION;
import static io.assetdb.query.PlannerTestHelper.END;
import static io.assetdb.query.PlannerTestHelper.START;
import static io.assetdb.query.PlannerTestHelper.TABLE;
import static io.assetdb.query.PlannerTestHelper.TIMESTAMP;
import static io.assetdb.query.PlannerTestHelper.time;

public class LocalQueryExecutorTest
{
  private final AggregateQueryAssembler assembler = PlannerTestHelper.assembler();

  private static LocalQueryExecutor executor(PlannerConfig config)
  {
    return new LocalQueryExecutor(config).register(TABLE, PlannerTestHelper.sensorRows())
                                         .register(DIMENSION, PlannerTestHelper.dimensionRows());
  }

  private QueryPlan aggregate(String column, String... kinds)
  {
    AggregateSpec spec = AggregateSpec.builder().add(column, kinds).build();
    return assembler.assemble(AggregateRequest.builder(TABLE, spec).build());
  }

  @Test
  public void testStdDev()
  {
    // temps 20, 22, 30, 31, 40, 25 deviate from 28 by a sum of squares of 266
    QueryPlan plan = aggregate("temp", "std");
    RowSet sample = executor(CONFIG).execute(plan);
    Assert.assertEquals(1, sample.size());
    Assert.assertEquals(Math.sqrt(53.2), (Double) sample.get(0).get("temp"), 1e-9);

    PlannerConfig population = CONFIG.withOverrides(
        ImmutableMap.<String, Object>of(PlannerConfig.CTX_KEY_SAMPLE_STDDEV, false)
    );
    RowSet rows = executor(population).execute(plan);
    Assert.assertEquals(Math.sqrt(266.0 / 6), (Double) rows.get(0).get("temp"), 1e-9);
  }

  @Test
  public void testAggregates()
  {
    RowSet rows = executor(CONFIG).execute(aggregate("pressure", "count", "sum", "mean", "min", "max"));
    Assert.assertEquals(
        Arrays.asList("pressure_count", "pressure_sum", "pressure_mean", "pressure_min", "pressure_max"),
        rows.getColumns()
    );
    Map<String, Object> row = rows.get(0);
    Assert.assertEquals(6L, row.get("pressure_count"));
    Assert.assertEquals(61.0, (Double) row.get("pressure_sum"), 1e-9);
    Assert.assertEquals(61.0 / 6, (Double) row.get("pressure_mean"), 1e-9);
    Assert.assertEquals(1.0, row.get("pressure_min"));
    Assert.assertEquals(40.0, row.get("pressure_max"));

    RowSet last = executor(CONFIG).execute(aggregate(TIMESTAMP, "max"));
    Assert.assertEquals(time("2023-01-02T00:00:00"), last.get(0).get(TIMESTAMP));
  }

  @Test
  public void testNoMatchingRows()
  {
    QueryPlan plan = assembler.assemble(
        AggregateRequest.builder(TABLE, AggregateSpec.builder().add("temp", "count", "mean").build())
                        .entities(Collections.singletonList("d3"))
                        .build()
    );
    RowSet rows = executor(CONFIG).execute(plan);
    Assert.assertEquals(1, rows.size());
    Assert.assertEquals(0L, rows.get(0).get("temp_count"));
    Assert.assertNull(rows.get(0).get("temp_mean"));

    QueryPlan grouped = assembler.assemble(
        AggregateRequest.builder(TABLE, AggregateSpec.builder().add("temp", "count").build())
                        .groupBy("site")
                        .entities(Collections.singletonList("d3"))
                        .build()
    );
    Assert.assertTrue(executor(CONFIG).execute(grouped).isEmpty());
  }

  @Test
  public void testDimensionAndEntities()
  {
    QueryPlan plan = assembler.assemble(
        AggregateRequest.builder(TABLE, AggregateSpec.builder().add("temp", "mean").add("model", "count").build())
                        .groupBy("region")
                        .dimension(DIMENSION)
                        .entities(Collections.singletonList("d1"))
                        .build()
    );
    RowSet rows = executor(CONFIG).execute(plan);
    Assert.assertEquals(1, rows.size());
    Map<String, Object> east = rows.get(0);
    Assert.assertEquals("east", east.get("region"));
    Assert.assertEquals(67.0 / 3, (Double) east.get("temp"), 1e-9);
    // every d1 row has a model
    Assert.assertEquals(5L, east.get("model"));
  }

  @Test
  public void testSelect()
  {
    QueryPlan plan = assembler.select(
        SelectRequest.builder(TABLE)
                     .columns("deviceid", TIMESTAMP, "region")
                     .timestampColumn(TIMESTAMP)
                     .dimension(DIMENSION)
                     .interval(START, END)
                     .entities(Collections.singletonList("d2"))
                     .build()
    );
    RowSet rows = executor(CONFIG).execute(plan);
    Assert.assertEquals(Arrays.asList("deviceid", TIMESTAMP, "region"), rows.getColumns());
    Assert.assertEquals(2, rows.size());
    Assert.assertEquals(Arrays.asList("west", "west"), rows.column("region"));
    Assert.assertEquals(
        Arrays.asList(time("2023-01-01T00:05:00"), time("2023-01-01T01:47:00")),
        rows.column(TIMESTAMP)
    );
  }

  @Test
  public void testBucketsFollowTimeZone()
  {
    Properties props = new Properties();
    props.setProperty("assetdb.planner.timeZone", "Asia/Seoul");
    props.setProperty("assetdb.planner.sampleStdDev", "false");
    PlannerConfig seoul = new JsonConfigurator(new DefaultObjectMapper()).configurate(
        props, "assetdb.planner", PlannerConfig.class
    );
    Assert.assertEquals(DateTimeZone.forID("Asia/Seoul"), seoul.getTimeZone());
    Assert.assertFalse(seoul.isSampleStdDev());
    Assert.assertEquals("deviceid", seoul.getEntityKey());

    QueryPlan plan = assembler.assemble(
        AggregateRequest.builder(TABLE, AggregateSpec.builder().add("energy", "sum").build())
                        .timestampColumn(TIMESTAMP)
                        .timeGrain("day")
                        .build()
    );
    Map<Object, Map<String, Object>> utc = byMillis(executor(CONFIG).execute(plan));
    Assert.assertEquals(28.0, utc.get(time("2023-01-01T00:00:00").getMillis()).get("energy"));
    Assert.assertEquals(9.0, utc.get(time("2023-01-02T00:00:00").getMillis()).get("energy"));

    // 00:00 UTC is 09:00 in seoul, so days start at 15:00 UTC of the day before
    Map<Object, Map<String, Object>> local = byMillis(executor(seoul).execute(plan));
    Assert.assertEquals(28.0, local.get(time("2022-12-31T15:00:00").getMillis()).get("energy"));
    Assert.assertEquals(9.0, local.get(time("2023-01-01T15:00:00").getMillis()).get("energy"));
  }

  @Test
  public void testHourBucketsAcrossDaylightSaving()
  {
    Properties props = new Properties();
    props.setProperty("assetdb.planner.timeZone", "America/New_York");
    PlannerConfig newYork = new JsonConfigurator(new DefaultObjectMapper()).configurate(
        props, "assetdb.planner", PlannerConfig.class
    );
    // 01:30 EST, then 03:10, 05:30 and 05:50 EDT
    LocalQueryExecutor executor = new LocalQueryExecutor(newYork).register(
        TABLE,
        Arrays.asList(
            PlannerTestHelper.row("deviceid", "d1", TIMESTAMP, time("2023-03-12T06:30:00"), "energy", 1.0),
            PlannerTestHelper.row("deviceid", "d1", TIMESTAMP, time("2023-03-12T07:10:00"), "energy", 2.0),
            PlannerTestHelper.row("deviceid", "d1", TIMESTAMP, time("2023-03-12T09:30:00"), "energy", 4.0),
            PlannerTestHelper.row("deviceid", "d1", TIMESTAMP, time("2023-03-12T09:50:00"), "energy", 8.0)
        )
    );
    QueryPlan plan = assembler.assemble(
        AggregateRequest.builder(TABLE, AggregateSpec.builder().add("energy", "sum").build())
                        .timestampColumn(TIMESTAMP)
                        .timeGrain("1H")
                        .build()
    );
    Map<Object, Map<String, Object>> hours = byMillis(executor.execute(plan));
    Assert.assertEquals(3, hours.size());
    Assert.assertEquals(1.0, hours.get(time("2023-03-12T06:00:00").getMillis()).get("energy"));
    Assert.assertEquals(2.0, hours.get(time("2023-03-12T07:00:00").getMillis()).get("energy"));
    Assert.assertEquals(12.0, hours.get(time("2023-03-12T09:00:00").getMillis()).get("energy"));
  }

  @Test(expected = IllegalStateException.class)
  public void testUnregisteredTable()
  {
    new LocalQueryExecutor(CONFIG).execute(aggregate("temp", "mean"));
  }

  private static Map<Object, Map<String, Object>> byMillis(RowSet rows)
  {
    ImmutableMap.Builder<Object, Map<String, Object>> builder = ImmutableMap.builder();
    for (Map<String, Object> row : rows) {
      builder.put(((DateTime) row.get(TIMESTAMP)).getMillis(), row);
    }
    return builder.build();
  }
}
