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
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import io.assetdb.query.expression.ColumnRef;
import io.assetdb.query.sql.SqlStrings;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Membership in a list of values, compared by their string form. Used for entity filters.
 */
public class InDimFilter implements DimFilter
{
  public static InDimFilter of(ColumnRef column, String... values)
  {
    return new InDimFilter(column, Arrays.asList(values));
  }

  private final ColumnRef column;
  private final List<String> values;

  @JsonCreator
  public InDimFilter(
      @JsonProperty("column") ColumnRef column,
      @JsonProperty("values") List<String> values
  )
  {
    this.column = Preconditions.checkNotNull(column, "'column' cannot be null");
    this.values = ImmutableList.copyOf(Preconditions.checkNotNull(values, "'values' cannot be null"));
  }

  @JsonProperty
  public ColumnRef getColumn()
  {
    return column;
  }

  @JsonProperty
  public List<String> getValues()
  {
    return values;
  }

  @Override
  public Predicate<Map<String, Object>> toPredicate()
  {
    final String key = column.getQualifiedName();
    final Set<String> set = ImmutableSet.copyOf(values);
    return row -> {
      Object value = row.get(key);
      return value != null && set.contains(String.valueOf(value));
    };
  }

  @Override
  public String toSql()
  {
    if (values.isEmpty()) {
      return "1 = 0";
    }
    List<String> literals = Lists.newArrayList();
    for (String value : values) {
      literals.add(SqlStrings.literal(value));
    }
    return column.toSql() + " IN (" + Joiner.on(", ").join(literals) + ")";
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    InDimFilter that = (InDimFilter) o;
    return column.equals(that.column) && values.equals(that.values);
  }

  @Override
  public int hashCode()
  {
    return 31 * column.hashCode() + values.hashCode();
  }

  @Override
  public String toString()
  {
    return column.getQualifiedName() + " IN " + values;
  }
}
