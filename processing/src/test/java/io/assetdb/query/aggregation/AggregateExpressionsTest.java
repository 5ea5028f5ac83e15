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

package io.assetdb.query.aggregation;

import io.assetdb.data.ValueType;
import io.assetdb.query.PlanningException;
import io.assetdb.query.expression.ColumnRef;
import org.junit.Assert;
import org.junit.Test;

import static io.assetdb.query.PlannerTestHelper.DIMENSION;
import static io.assetdb.query.PlannerTestHelper.SENSOR_DATA;
import static io.assetdb.query.PlannerTestHelper.SENSOR_DIM;
import static io.assetdb.query.PlannerTestHelper.TABLE;
import static io.assetdb.query.PlannerTestHelper.TIMESTAMP;

public class AggregateExpressionsTest
{
  @Test
  public void testBuild()
  {
    AggregateExpression mean = AggregateExpressions.build(SENSOR_DATA, SENSOR_DIM, "temp", "mean", null, TIMESTAMP);
    Assert.assertEquals(AggregateKind.MEAN, mean.getKind());
    Assert.assertEquals(ColumnRef.of(TABLE, "temp", ValueType.NUMERIC), mean.getField());
    Assert.assertEquals("temp", mean.getOutputName());
    Assert.assertEquals("AVG(sensor_data.temp)", mean.toSql());

    AggregateExpression renamed = AggregateExpressions.build(SENSOR_DATA, null, "temp", "max", "hottest", TIMESTAMP);
    Assert.assertEquals("hottest", renamed.getOutputName());
    Assert.assertEquals("MAX(sensor_data.temp)", renamed.toSql());

    AggregateExpression models = AggregateExpressions.build(SENSOR_DATA, SENSOR_DIM, "model", "count", null, null);
    Assert.assertEquals(ColumnRef.of(DIMENSION, "model", ValueType.TEXT), models.getField());
    Assert.assertEquals(ValueType.NUMERIC, models.getType());
    Assert.assertEquals("COUNT(sensor_dim.model)", models.toSql());
  }

  @Test
  public void testTimestampAliases()
  {
    AggregateExpression first = AggregateExpressions.build(SENSOR_DATA, null, TIMESTAMP, "min", null, TIMESTAMP);
    Assert.assertEquals("first_evt_timestamp", first.getOutputName());
    Assert.assertEquals(ValueType.TIMESTAMP, first.getType());

    AggregateExpression last = AggregateExpressions.build(SENSOR_DATA, null, TIMESTAMP, "max", null, TIMESTAMP);
    Assert.assertEquals("last_evt_timestamp", last.getOutputName());

    Assert.assertEquals(
        "count_evt_timestamp",
        AggregateExpressions.defaultAlias(TIMESTAMP, AggregateKind.COUNT, TIMESTAMP)
    );
    Assert.assertEquals(TIMESTAMP, AggregateExpressions.defaultAlias(TIMESTAMP, AggregateKind.MAX, null));
    Assert.assertEquals("temp", AggregateExpressions.defaultAlias("temp", AggregateKind.MAX, TIMESTAMP));
    Assert.assertEquals("temp_std", AggregateExpressions.defaultOutput("temp", AggregateKind.STD));
    Assert.assertEquals("last_evt_timestamp", TimeExtreme.LAST.aliasOf(TIMESTAMP));
  }

  @Test
  public void testErrors()
  {
    try {
      AggregateExpressions.build(SENSOR_DATA, null, "region", "max", null, TIMESTAMP);
      Assert.fail();
    }
    catch (PlanningException e) {
      Assert.assertEquals(PlanningException.Code.COLUMN_NOT_FOUND, e.getErrorCode());
    }
    try {
      AggregateExpressions.build(SENSOR_DATA, null, "temp", "avg", null, TIMESTAMP);
      Assert.fail();
    }
    catch (PlanningException e) {
      Assert.assertEquals(PlanningException.Code.UNSUPPORTED_AGGREGATE, e.getErrorCode());
    }
    try {
      TimeExtreme.fromString("middle");
      Assert.fail();
    }
    catch (PlanningException e) {
      Assert.assertEquals(PlanningException.Code.INVALID_TIME_AGGREGATE, e.getErrorCode());
    }
    Assert.assertSame(TimeExtreme.FIRST, TimeExtreme.fromString("first"));
    Assert.assertNull(AggregateKind.find("AVG"));
  }
}
