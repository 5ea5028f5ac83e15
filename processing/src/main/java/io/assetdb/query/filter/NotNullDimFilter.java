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

package io.assetdb.query.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import io.assetdb.query.expression.ColumnRef;

import java.util.Map;
import java.util.function.Predicate;

public class NotNullDimFilter implements DimFilter
{
  public static NotNullDimFilter of(ColumnRef column)
  {
    return new NotNullDimFilter(column);
  }

  private final ColumnRef column;

  @JsonCreator
  public NotNullDimFilter(@JsonProperty("column") ColumnRef column)
  {
    this.column = Preconditions.checkNotNull(column, "'column' cannot be null");
  }

  @JsonProperty
  public ColumnRef getColumn()
  {
    return column;
  }

  @Override
  public Predicate<Map<String, Object>> toPredicate()
  {
    final String key = column.getQualifiedName();
    return row -> row.get(key) != null;
  }

  @Override
  public String toSql()
  {
    return column.toSql() + " IS NOT NULL";
  }

  @Override
  public boolean equals(Object o)
  {
    return o instanceof NotNullDimFilter && column.equals(((NotNullDimFilter) o).column);
  }

  @Override
  public int hashCode()
  {
    return column.hashCode();
  }

  @Override
  public String toString()
  {
    return column.getQualifiedName() + "!=NULL";
  }
}
