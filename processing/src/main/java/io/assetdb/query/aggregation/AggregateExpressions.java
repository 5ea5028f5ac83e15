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

import io.assetdb.metadata.TableRef;
import io.assetdb.query.PlanningException;
import io.assetdb.query.expression.ColumnResolution;

import javax.annotation.Nullable;

/**
 * Binds (column, aggregate kind) pairs to aggregate expressions.
 */
public class AggregateExpressions
{
  public static AggregateExpression build(
      TableRef table,
      @Nullable TableRef dimension,
      String column,
      String kind,
      @Nullable String alias,
      @Nullable String timestampColumn
  )
  {
    return build(table, dimension, column, AggregateKind.fromString(kind), alias, timestampColumn);
  }

  /**
   * Resolves the column on the table, then on the dimension.
   * Without an explicit alias, the minimum of the timestamp column is labeled {@code first_<timestamp>}, its maximum
   * {@code last_<timestamp>}, any other aggregate of it {@code <kind>_<timestamp>}. Other columns keep their own name.
   */
  public static AggregateExpression build(
      TableRef table,
      @Nullable TableRef dimension,
      String column,
      AggregateKind kind,
      @Nullable String alias,
      @Nullable String timestampColumn
  )
  {
    ColumnResolution resolution = ColumnResolution.resolve(table, dimension, column);
    if (!resolution.isFound()) {
      throw PlanningException.columnNotFound(column);
    }
    String name = alias == null ? defaultAlias(column, kind, timestampColumn) : alias;
    return new AggregateExpression(kind, resolution.getColumn(), name);
  }

  public static String defaultAlias(String column, AggregateKind kind, @Nullable String timestampColumn)
  {
    if (!column.equals(timestampColumn)) {
      return column;
    }
    switch (kind) {
      case MIN:
        return TimeExtreme.FIRST.aliasOf(timestampColumn);
      case MAX:
        return TimeExtreme.LAST.aliasOf(timestampColumn);
      default:
        return kind.getName() + "_" + timestampColumn;
    }
  }

  /**
   * name used for one of several aggregates on the same column when none was supplied
   */
  public static String defaultOutput(String column, AggregateKind kind)
  {
    return column + "_" + kind.getName();
  }

  private AggregateExpressions()
  {
  }
}
