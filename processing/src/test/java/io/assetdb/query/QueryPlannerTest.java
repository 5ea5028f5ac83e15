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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import io.assetdb.jackson.DefaultObjectMapper;
import io.assetdb.query.aggregation.AggregateSpec;
import io.assetdb.query.execution.RowSet;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static io.assetdb.query.PlannerTestHelper.END;
import static io.assetdb.query.PlannerTestHelper.START;
import static io.assetdb.query.PlannerTestHelper.TABLE;
import static io.assetdb.query.PlannerTestHelper.TIMESTAMP;
import static io.assetdb.query.PlannerTestHelper.assertCode;
import static io.assetdb.query.PlannerTestHelper.time;

public class QueryPlannerTest
{
  private final QueryPlanner planner = PlannerTestHelper.planner();

  @Test
  public void testDailyEnergyWithLastTimestamp()
  {
    PlanResult result = planner.timeAggregate(
        TimeAggregateRequest.builder(TABLE, "energy")
                            .aggregates("sum", "last")
                            .groupBy("site")
                            .timestampColumn(TIMESTAMP)
                            .regularGrain("day")
                            .timeGrain("day")
                            .interval(START, END)
                            .build()
    );
    Assert.assertTrue(result.isSuccess());
    QueryPlan plan = result.getPlan();
    Assert.assertTrue(plan.isJoin());
    Assert.assertEquals(Arrays.asList(TIMESTAMP, "site"), plan.getJoin().getLeftJoinColumns());
    Assert.assertEquals(Arrays.asList(TIMESTAMP, "site"), plan.getJoin().getRightJoinColumns());
    Assert.assertEquals(
        Arrays.asList("last_" + TIMESTAMP, "energy", TIMESTAMP, "site"),
        plan.getOutputNames()
    );

    Map<Object, Map<String, Object>> bySite = PlannerTestHelper.indexBy(
        PlannerTestHelper.executor().execute(plan),
        "site"
    );
    Assert.assertEquals(2, bySite.size());
    Map<String, Object> siteA = bySite.get("A");
    Assert.assertEquals(time("2023-01-01T00:00:00"), siteA.get(TIMESTAMP));
    Assert.assertEquals(23.0, (Double) siteA.get("energy"), 0.0001);
    Assert.assertEquals(time("2023-01-01T13:30:00"), siteA.get("last_" + TIMESTAMP));
    Map<String, Object> siteB = bySite.get("B");
    Assert.assertEquals(5.0, (Double) siteB.get("energy"), 0.0001);
    Assert.assertEquals(time("2023-01-01T01:47:00"), siteB.get("last_" + TIMESTAMP));
  }

  @Test
  public void testValueAtFirstTimestamp()
  {
    // regular side keeps raw timestamps, so the join picks the reading at the first timestamp of each day
    PlanResult result = planner.timeAggregate(
        TimeAggregateRequest.builder(TABLE, "energy")
                            .aggregates("sum", "first")
                            .groupBy("site")
                            .timestampColumn(TIMESTAMP)
                            .timeGrain("day")
                            .interval(START, END)
                            .output("energy_at_first")
                            .build()
    );
    QueryPlan plan = result.get();
    Assert.assertEquals(Arrays.asList(TIMESTAMP, "site"), plan.getJoin().getLeftJoinColumns());
    Assert.assertEquals(Arrays.asList("first_" + TIMESTAMP, "site"), plan.getJoin().getRightJoinColumns());
    Assert.assertEquals(
        Arrays.asList("first_" + TIMESTAMP, TIMESTAMP, "energy_at_first", "site"),
        plan.getOutputNames()
    );

    Map<Object, Map<String, Object>> bySite = PlannerTestHelper.indexBy(
        PlannerTestHelper.executor().execute(plan),
        "site"
    );
    Assert.assertEquals(5.0, (Double) bySite.get("A").get("energy_at_first"), 0.0001);
    Assert.assertEquals(time("2023-01-01T00:00:00"), bySite.get("A").get(TIMESTAMP));
    Assert.assertEquals(time("2023-01-01T00:03:00"), bySite.get("A").get("first_" + TIMESTAMP));
    Assert.assertEquals(2.0, (Double) bySite.get("B").get("energy_at_first"), 0.0001);
  }

  @Test
  public void testTimeAggregateFailures()
  {
    TimeAggregateRequest.Builder builder = TimeAggregateRequest.builder(TABLE, "energy")
                                                               .timestampColumn(TIMESTAMP)
                                                               .timeGrain("day");
    assertCode(
        PlanningException.Code.INVALID_TIME_AGGREGATE,
        planner.timeAggregate(builder.aggregates("sum", "median").build())
    );
    assertCode(
        PlanningException.Code.UNSUPPORTED_AGGREGATE,
        planner.timeAggregate(builder.aggregates("median", "last").build())
    );
    assertCode(
        PlanningException.Code.FALLBACK_NOT_JOINABLE,
        planner.timeAggregate(builder.aggregates("sum", "last").timeGrain("W-MON").build())
    );
    assertCode(
        PlanningException.Code.FALLBACK_NOT_JOINABLE,
        planner.timeAggregate(builder.aggregates("sum", "last").regularGrain("2W").build())
    );
    assertCode(
        PlanningException.Code.MISSING_TIMESTAMP_COLUMN,
        planner.timeAggregate(TimeAggregateRequest.builder(TABLE, "energy").aggregates("sum", "last").build())
    );
  }

  @Test
  public void testTimeAggregateNeedsTimeGrain()
  {
    TimeAggregateRequest request = TimeAggregateRequest.builder(TABLE, "energy")
                                                       .aggregates("sum", "last")
                                                       .timestampColumn(TIMESTAMP)
                                                       .regularGrain("day")
                                                       .build();
    PlanResult result = planner.timeAggregate(request);
    assertCode(PlanningException.Code.MISSING_TIME_GRAIN, result);
    Assert.assertEquals("last", result.getError().getTarget());
  }

  @Test
  public void testGroupColumnNotFound()
  {
    AggregateSpec spec = AggregateSpec.builder().add("temp", "mean").build();
    PlanResult result = planner.assemble(AggregateRequest.builder(TABLE, spec).groupBy("region").build());
    assertCode(PlanningException.Code.GROUP_COLUMN_NOT_FOUND, result);
    Assert.assertTrue(result.getError().isNoDimension());

    result = planner.assemble(
        AggregateRequest.builder(TABLE, spec).groupBy("floor").dimension(PlannerTestHelper.DIMENSION).build()
    );
    assertCode(PlanningException.Code.GROUP_COLUMN_NOT_FOUND, result);
    Assert.assertFalse(result.getError().isNoDimension());
    Assert.assertEquals("floor", result.getError().getTarget());

    result = planner.assemble(
        AggregateRequest.builder(TABLE, spec).groupBy("region").dimension(PlannerTestHelper.DIMENSION).build()
    );
    Assert.assertTrue(result.isSuccess());
    Assert.assertNull(result.getErrorCode());
  }

  @Test
  public void testFailedResult()
  {
    AggregateSpec spec = AggregateSpec.builder().add("humidity", "mean").build();
    PlanResult result = planner.assemble(AggregateRequest.builder(TABLE, spec).build());
    assertCode(PlanningException.Code.COLUMN_NOT_FOUND, result);
    Assert.assertFalse(result.isFallback());
    try {
      result.get();
      Assert.fail();
    }
    catch (PlanningException e) {
      Assert.assertSame(result.getError(), e);
    }
    try {
      result.getPlan();
      Assert.fail();
    }
    catch (IllegalStateException e) {
      Assert.assertSame(result.getError(), e.getCause());
    }
  }

  @Test
  public void testColumnAggregate()
  {
    PlanResult result = planner.columnAggregate(TABLE, null, "temp", "count", null, null, null, null);
    RowSet rows = PlannerTestHelper.executor().execute(result.getPlan());
    Assert.assertEquals(Collections.singletonList("temp"), rows.getColumns());
    Assert.assertEquals(1, rows.size());
    Assert.assertEquals(6L, rows.get(0).get("temp"));

    result = planner.columnAggregate(
        TABLE, null, "energy", "max", TIMESTAMP, START, END, Collections.singletonList("d2")
    );
    rows = PlannerTestHelper.executor().execute(result.getPlan());
    Assert.assertEquals(3.0, (Double) rows.get(0).get("energy"), 0.0001);

    result = planner.columnAggregate(TABLE, null, "energy", "max", null, START, END, null);
    assertCode(PlanningException.Code.MISSING_TIMESTAMP_COLUMN, result);
  }

  @Test
  public void testPlanSerializes() throws Exception
  {
    ObjectMapper mapper = new DefaultObjectMapper();
    AggregateSpec spec = AggregateSpec.builder().add("pressure", "min", "max").add("temp", "mean").build();
    QueryPlan plan = planner.assemble(
        AggregateRequest.builder(TABLE, spec)
                        .groupBy("site")
                        .timestampColumn(TIMESTAMP)
                        .timeGrain("W-MON")
                        .interval(START, END)
                        .build()
    ).get();
    String json = mapper.writeValueAsString(plan);
    Assert.assertTrue(json, json.contains("\"resampleFrequency\":\"W-MON\""));
    Assert.assertTrue(json, json.contains("\"fallback\":true"));
    Assert.assertTrue(json, json.contains("\"type\":\"notNull\""));
    Assert.assertTrue(json, json.contains("\"lower\":\"2023-01-01T00:00:00.000Z\""));

    QueryPlanner dumping = planner.withContext(ImmutableMap.<String, Object>of(PlannerConfig.CTX_KEY_DUMP_PLAN, true));
    Assert.assertTrue(dumping.getConfig().isDumpPlan());
    Assert.assertFalse(planner.getConfig().isDumpPlan());
    Assert.assertSame(planner, planner.withContext(null));
    Assert.assertEquals(plan, dumping.assemble(
        AggregateRequest.builder(TABLE, spec)
                        .groupBy("site")
                        .timestampColumn(TIMESTAMP)
                        .timeGrain("W-MON")
                        .interval(START, END)
                        .build()
    ).get());
  }

  @Test
  public void testRequestFromJson() throws Exception
  {
    ObjectMapper mapper = new DefaultObjectMapper();
    AggregateRequest request = mapper.readValue(
        "{\"table\": \"sensor_data\","
        + " \"aggregates\": {\"aggregates\": {\"pressure\": [\"min\", \"max\"], \"temp\": \"mean\"}},"
        + " \"groupBy\": [\"site\"], \"timestampColumn\": \"evt_timestamp\", \"timeGrain\": \"15min\","
        + " \"startTs\": \"2023-01-01T00:00:00Z\", \"endTs\": \"2023-01-02T00:00:00Z\"}",
        AggregateRequest.class
    );
    QueryPlan plan = planner.assemble(request).get();
    Assert.assertEquals(
        Arrays.asList("pressure_min", "pressure_max", "temp", TIMESTAMP, "site"),
        plan.getOutputNames()
    );
    Assert.assertEquals(5, PlannerTestHelper.executor().execute(plan).size());
  }

  @Test
  public void testJoinAggregates()
  {
    QueryPlan energy = planner.assemble(
        AggregateRequest.builder(TABLE, AggregateSpec.builder().add("energy", "sum").build())
                        .groupBy("site")
                        .timestampColumn(TIMESTAMP)
                        .interval(START, END)
                        .build()
    ).get();
    QueryPlan temp = planner.assemble(
        AggregateRequest.builder(TABLE, AggregateSpec.builder().add("temp", "max").build())
                        .groupBy("site")
                        .timestampColumn(TIMESTAMP)
                        .interval(START, END)
                        .build()
    ).get();

    PlanResult result = planner.joinAggregates(
        energy, temp, Collections.singletonList(JoinKey.of("site")), ImmutableMap.of("temp", "max_temp")
    );
    Assert.assertTrue(result.isSuccess());
    Assert.assertFalse(result.isFallback());
    Assert.assertEquals(Arrays.asList("max_temp", "energy", "site"), result.getPlan().getOutputNames());

    Map<Object, Map<String, Object>> sites = PlannerTestHelper.indexBy(
        PlannerTestHelper.executor().execute(result.getPlan()), "site"
    );
    Assert.assertEquals(23.0, (Double) sites.get("A").get("energy"), 0.0001);
    Assert.assertEquals(25.0, (Double) sites.get("A").get("max_temp"), 0.0001);
    Assert.assertEquals(5.0, (Double) sites.get("B").get("energy"), 0.0001);
    Assert.assertEquals(31.0, (Double) sites.get("B").get("max_temp"), 0.0001);

    assertCode(
        PlanningException.Code.COLUMN_NOT_FOUND,
        planner.joinAggregates(energy, temp, Collections.singletonList(JoinKey.of("region")), ImmutableMap.of())
    );
  }
}
