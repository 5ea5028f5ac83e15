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

package io.assetdb.query.expression;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.assetdb.data.ValueType;
import io.assetdb.query.aggregation.AggregateExpression;
import io.assetdb.query.granularity.TimeBucketExpression;

/**
 * An item of a projection or group-by list, bound to the table (or subquery) it reads from.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes(value = {
    @JsonSubTypes.Type(name = "column", value = ColumnRef.class),
    @JsonSubTypes.Type(name = "aggregate", value = AggregateExpression.class),
    @JsonSubTypes.Type(name = "bucket", value = TimeBucketExpression.class),
})
public interface ColumnExpression
{
  /**
   * @return name of the column this expression produces in a result row
   */
  String getOutputName();

  ValueType getType();

  /**
   * @return sql text of the expression, without the output alias
   */
  String toSql();
}
