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

package io.assetdb.query;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import io.assetdb.data.ValueType;
import io.assetdb.query.aggregation.AggregateKind;
import io.assetdb.query.aggregation.AggregateSpec;
import io.assetdb.query.execution.RowSet;
import io.assetdb.query.expression.ColumnRef;
import io.assetdb.query.filter.BoundDimFilter;
import io.assetdb.query.filter.NotNullDimFilter;
import io.assetdb.query.filter.OrDimFilter;
import io.assetdb.query.granularity.TimeBucketExpression;
import org.joda.time.DateTime;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static io.assetdb.query.PlannerTestHelper.END;
import static io.assetdb.query.PlannerTestHelper.START;
import static io.assetdb.query.PlannerTestHelper.TABLE;
import static io.assetdb.query.PlannerTestHelper.TIMESTAMP;
import static io.assetdb.query.PlannerTestHelper.time;

public class AggregateQueryAssemblerTest
{
  private final AggregateQueryAssembler assembler = PlannerTestHelper.assembler();

  private AggregateRequest.Builder minMaxMean()
  {
    AggregateSpec spec = AggregateSpec.builder()
                                      .add("pressure", "min", "max")
                                      .add("temp", "mean")
                                      .build();
    return AggregateRequest.builder(TABLE, spec)
                           .groupBy("site")
                           .timestampColumn(TIMESTAMP)
                           .interval(START, END);
  }

  @Test
  public void testFifteenMinuteBuckets()
  {
    QueryPlan plan = assembler.assemble(minMaxMean().timeGrain("15min").build());

    Assert.assertFalse(plan.isFallback());
    Assert.assertTrue(plan.isAggregate());
    Assert.assertEquals(
        Arrays.asList("pressure_min", "pressure_max", "temp", TIMESTAMP, "site"),
        plan.getOutputNames()
    );
    ColumnRef timestamp = ColumnRef.of(TABLE, TIMESTAMP, ValueType.TIMESTAMP);
    Assert.assertEquals(
        Arrays.asList(
            new TimeBucketExpression(timestamp, "15min", TIMESTAMP),
            ColumnRef.of(TABLE, "site", ValueType.TEXT)
        ),
        plan.getGroupBy()
    );
    Assert.assertEquals(
        Arrays.asList(
            BoundDimFilter.range(timestamp, START, END),
            OrDimFilter.of(
                NotNullDimFilter.of(ColumnRef.of(TABLE, "pressure", ValueType.NUMERIC)),
                NotNullDimFilter.of(ColumnRef.of(TABLE, "temp", ValueType.NUMERIC))
            )
        ),
        plan.getFilters()
    );

    RowSet rows = PlannerTestHelper.executor().execute(plan);
    Assert.assertEquals(5, rows.size());
    for (Map<String, Object> row : rows) {
      DateTime bucket = (DateTime) row.get(TIMESTAMP);
      Assert.assertEquals(0, bucket.getMinuteOfHour() % 15);
      Assert.assertEquals(0, bucket.getSecondOfMinute());
      Assert.assertFalse(row.get("pressure_min") == null && row.get("temp") == null);
      Assert.assertTrue(START.compareTo(bucket) <= 0 && END.compareTo(bucket) > 0);
    }
    Map<String, Object> first = rows.get(0);
    Assert.assertEquals(time("2023-01-01T00:00:00"), first.get(TIMESTAMP));
    Assert.assertEquals("A", first.get("site"));
    Assert.assertEquals(1.0, (Double) first.get("pressure_min"), 0.0001);
    Assert.assertEquals(3.0, (Double) first.get("pressure_max"), 0.0001);
    Assert.assertEquals(21.0, (Double) first.get("temp"), 0.0001);

    // the 00:16 reading has pressure only
    Map<String, Object> second = rows.get(1);
    Assert.assertEquals(time("2023-01-01T00:15:00"), second.get(TIMESTAMP));
    Assert.assertEquals(2.0, (Double) second.get("pressure_max"), 0.0001);
    Assert.assertNull(second.get("temp"));
  }

  @Test
  public void testUnsupportedGrainFallsBack()
  {
    QueryPlan pushDown = assembler.assemble(minMaxMean().timeGrain("15min").build());
    QueryPlan plan = assembler.assemble(minMaxMean().timeGrain("W-MON").build());

    Assert.assertTrue(plan.isFallback());
    Assert.assertFalse(plan.isAggregate());
    Assert.assertEquals("W-MON", plan.getResampleFrequency());
    Assert.assertEquals(TIMESTAMP, plan.getTimestampColumn());
    Assert.assertEquals(Collections.singletonList("site"), plan.getGroupByNames());
    Assert.assertEquals(minMaxMean().build().getAggregates(), plan.getAggregateSpec());
    Assert.assertTrue(plan.getGroupBy().isEmpty());
    Assert.assertEquals(pushDown.getFilters(), plan.getFilters());
    Assert.assertEquals(
        Arrays.asList("deviceid", TIMESTAMP, "temp", "pressure", "energy", "site"),
        plan.getOutputNames()
    );

    // raw rows inside the range having pressure or temp
    RowSet rows = PlannerTestHelper.executor().execute(plan);
    Assert.assertEquals(6, rows.size());
    for (Map<String, Object> row : rows) {
      Assert.assertFalse(row.get("pressure") == null && row.get("temp") == null);
      Assert.assertTrue(END.isAfter((DateTime) row.get(TIMESTAMP)));
    }
  }

  @Test
  public void testDefaultAliasesAreUnique()
  {
    AggregateSpec spec = AggregateSpec.builder()
                                      .add("pressure", AggregateKind.values())
                                      .add("temp", AggregateKind.values())
                                      .add(TIMESTAMP, "min", "max")
                                      .build();
    QueryPlan plan = assembler.assemble(AggregateRequest.builder(TABLE, spec).timestampColumn(TIMESTAMP).build());
    List<String> names = plan.getOutputNames();
    Assert.assertEquals(14, names.size());
    Assert.assertEquals(14, Sets.newHashSet(names).size());
    Assert.assertTrue(names.contains("pressure_std"));
    Assert.assertTrue(names.contains("temp_count"));
    Assert.assertTrue(names.contains(TIMESTAMP + "_min"));
  }

  @Test
  public void testSingleKindKeepsColumnName()
  {
    AggregateSpec spec = AggregateSpec.of(ImmutableMap.of("temp", "mean", "pressure", "max"));
    QueryPlan plan = assembler.assemble(AggregateRequest.builder(TABLE, spec).build());
    Assert.assertEquals(Arrays.asList("temp", "pressure"), plan.getOutputNames());
    Assert.assertEquals(
        NotNullDimFilter.of(ColumnRef.of(TABLE, "temp", ValueType.NUMERIC)),
        assembler.assemble(AggregateRequest.builder(TABLE, AggregateSpec.of(ImmutableMap.of("temp", "mean"))).build())
                 .getFilter()
    );
  }

  @Test
  public void testListOfOneUsesDefaultName()
  {
    AggregateSpec spec = AggregateSpec.of(ImmutableMap.of("temp", "mean", "pressure", Arrays.asList("max")));
    QueryPlan plan = assembler.assemble(AggregateRequest.builder(TABLE, spec).build());
    Assert.assertEquals(Arrays.asList("temp", "pressure_max"), plan.getOutputNames());

    AggregateSpec named = AggregateSpec.of(
        ImmutableMap.of("pressure", Arrays.asList("max")),
        ImmutableMap.of("pressure", Arrays.asList("peak"))
    );
    plan = assembler.assemble(AggregateRequest.builder(TABLE, named).build());
    Assert.assertEquals(Collections.singletonList("peak"), plan.getOutputNames());
  }

  @Test
  public void testMissingOutputNamesDefault()
  {
    AggregateSpec spec = AggregateSpec.of(
        ImmutableMap.of("pressure", Arrays.asList("min", "max")),
        ImmutableMap.of("pressure", Collections.singletonList("low"))
    );
    QueryPlan plan = assembler.assemble(AggregateRequest.builder(TABLE, spec).build());
    Assert.assertEquals(Arrays.asList("low", "pressure_max"), plan.getOutputNames());
  }

  @Test
  public void testDimensionColumns()
  {
    AggregateSpec spec = AggregateSpec.builder().add("energy", "sum").build();
    QueryPlan plan = assembler.assemble(
        AggregateRequest.builder(TABLE, spec)
                        .groupBy("region")
                        .dimension(PlannerTestHelper.DIMENSION)
                        .entities(Arrays.asList("d1", "d2", "d3"))
                        .build()
    );
    Assert.assertEquals(PlannerTestHelper.SENSOR_DIM, plan.getDimension());
    Assert.assertEquals("deviceid", plan.getEntityKey());
    Assert.assertEquals(
        ColumnRef.of(PlannerTestHelper.DIMENSION, "region", ValueType.TEXT),
        plan.getGroupBy().get(0)
    );

    Map<Object, Map<String, Object>> byRegion = PlannerTestHelper.indexBy(
        PlannerTestHelper.executor().execute(plan),
        "region"
    );
    Assert.assertEquals(2, byRegion.size());
    Assert.assertEquals(23.0, (Double) byRegion.get("east").get("energy"), 0.0001);
    Assert.assertEquals(14.0, (Double) byRegion.get("west").get("energy"), 0.0001);
  }

  @Test
  public void testMissingTimestampColumn()
  {
    AggregateSpec spec = AggregateSpec.builder().add("temp", "mean").build();
    try {
      assembler.assemble(AggregateRequest.builder(TABLE, spec).timeGrain("day").build());
      Assert.fail("time grain without timestamp column");
    }
    catch (PlanningException e) {
      Assert.assertEquals(PlanningException.Code.MISSING_TIMESTAMP_COLUMN, e.getErrorCode());
    }
    try {
      assembler.assemble(AggregateRequest.builder(TABLE, spec).interval(START, null).build());
      Assert.fail("date filter without timestamp column");
    }
    catch (PlanningException e) {
      Assert.assertEquals(PlanningException.Code.MISSING_TIMESTAMP_COLUMN, e.getErrorCode());
    }
  }

  @Test
  public void testDuplicateOutputName()
  {
    AggregateSpec spec = AggregateSpec.builder().add("temp", "mean").build();
    AggregateRequest request = AggregateRequest.builder(TABLE, spec)
                                               .groupBy(TIMESTAMP)
                                               .timestampColumn(TIMESTAMP)
                                               .timeGrain("day")
                                               .build();
    try {
      assembler.assemble(request);
      Assert.fail("bucket and group-by share a name");
    }
    catch (PlanningException e) {
      Assert.assertEquals(PlanningException.Code.DUPLICATE_OUTPUT_NAME, e.getErrorCode());
      Assert.assertEquals(TIMESTAMP, e.getTarget());
    }

    PlannerConfig lenient = PlannerTestHelper.CONFIG.withOverrides(
        ImmutableMap.<String, Object>of(PlannerConfig.CTX_KEY_UNIQUE_OUTPUT_NAMES, false)
    );
    QueryPlan plan = new AggregateQueryAssembler(PlannerTestHelper.resolver(), lenient).assemble(request);
    Assert.assertEquals(Arrays.asList("temp", TIMESTAMP, TIMESTAMP), plan.getOutputNames());
  }

  @Test
  public void testTableNotFound()
  {
    AggregateSpec spec = AggregateSpec.builder().add("temp", "mean").build();
    try {
      assembler.assemble(AggregateRequest.builder("no_such_table", spec).build());
      Assert.fail();
    }
    catch (PlanningException e) {
      Assert.assertEquals(PlanningException.Code.TABLE_NOT_FOUND, e.getErrorCode());
    }
    try {
      assembler.assemble(AggregateRequest.builder(TABLE, spec).dimension("no_such_dim").build());
      Assert.fail();
    }
    catch (PlanningException e) {
      Assert.assertEquals(PlanningException.Code.TABLE_NOT_FOUND, e.getErrorCode());
    }
  }

  @Test
  public void testSelect()
  {
    QueryPlan plan = assembler.select(
        SelectRequest.builder(TABLE)
                     .dimension(PlannerTestHelper.DIMENSION)
                     .timestampColumn(TIMESTAMP)
                     .interval(START, END)
                     .entities(Collections.singletonList("d2"))
                     .build()
    );
    Assert.assertFalse(plan.isAggregate());
    Assert.assertEquals(
        Arrays.asList("deviceid", TIMESTAMP, "temp", "pressure", "energy", "site", "region", "model"),
        plan.getOutputNames()
    );
    RowSet rows = PlannerTestHelper.executor().execute(plan);
    Assert.assertEquals(2, rows.size());
    Assert.assertEquals(Arrays.asList("west", "west"), rows.column("region"));

    plan = assembler.select(SelectRequest.builder(TABLE).columns("temp", "model").dimension("sensor_dim").build());
    Assert.assertEquals(Arrays.asList("temp", "model"), plan.getOutputNames());
    Assert.assertEquals(8, PlannerTestHelper.executor().execute(plan).size());

    try {
      assembler.select(SelectRequest.builder(TABLE).columns("temp", "model").build());
      Assert.fail("model is on the dimension only");
    }
    catch (PlanningException e) {
      Assert.assertEquals(PlanningException.Code.COLUMN_NOT_FOUND, e.getErrorCode());
      Assert.assertEquals("model", e.getTarget());
    }
  }
}
