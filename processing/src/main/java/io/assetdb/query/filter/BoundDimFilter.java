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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import io.assetdb.data.Rows;
import io.assetdb.query.expression.ColumnRef;
import io.assetdb.query.sql.SqlStrings;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Range predicate on one column. Nulls never match.
 */
public class BoundDimFilter implements DimFilter
{
  /**
   * half open range [lower, upper), the shape of date filters
   */
  public static BoundDimFilter range(ColumnRef column, @Nullable Object lower, @Nullable Object upper)
  {
    return new BoundDimFilter(column, lower, upper, false, true);
  }

  private final ColumnRef column;
  private final Object lower;
  private final Object upper;
  private final boolean lowerStrict;
  private final boolean upperStrict;

  @JsonCreator
  public BoundDimFilter(
      @JsonProperty("column") ColumnRef column,
      @JsonProperty("lower") @Nullable Object lower,
      @JsonProperty("upper") @Nullable Object upper,
      @JsonProperty("lowerStrict") boolean lowerStrict,
      @JsonProperty("upperStrict") boolean upperStrict
  )
  {
    this.column = Preconditions.checkNotNull(column, "'column' cannot be null");
    Preconditions.checkArgument(lower != null || upper != null, "lower and upper bounds cannot both be null");
    this.lower = lower;
    this.upper = upper;
    this.lowerStrict = lowerStrict;
    this.upperStrict = upperStrict;
  }

  @JsonProperty
  public ColumnRef getColumn()
  {
    return column;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public Object getLower()
  {
    return lower;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public Object getUpper()
  {
    return upper;
  }

  @JsonProperty
  public boolean isLowerStrict()
  {
    return lowerStrict;
  }

  @JsonProperty
  public boolean isUpperStrict()
  {
    return upperStrict;
  }

  @Override
  public Predicate<Map<String, Object>> toPredicate()
  {
    final String key = column.getQualifiedName();
    return row -> {
      final Object value = row.get(key);
      if (value == null) {
        return false;
      }
      if (lower != null) {
        int compare = Rows.compare(value, lower);
        if (compare < 0 || (lowerStrict && compare == 0)) {
          return false;
        }
      }
      if (upper != null) {
        int compare = Rows.compare(value, upper);
        if (compare > 0 || (upperStrict && compare == 0)) {
          return false;
        }
      }
      return true;
    };
  }

  @Override
  public String toSql()
  {
    final String field = column.toSql();
    final StringBuilder builder = new StringBuilder();
    if (lower != null) {
      builder.append(field).append(lowerStrict ? " > " : " >= ").append(SqlStrings.literal(lower));
    }
    if (upper != null) {
      if (builder.length() > 0) {
        builder.append(" AND ");
      }
      builder.append(field).append(upperStrict ? " < " : " <= ").append(SqlStrings.literal(upper));
    }
    return builder.toString();
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
    BoundDimFilter that = (BoundDimFilter) o;
    return lowerStrict == that.lowerStrict &&
           upperStrict == that.upperStrict &&
           column.equals(that.column) &&
           Objects.equals(lower, that.lower) &&
           Objects.equals(upper, that.upper);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(column, lower, upper, lowerStrict, upperStrict);
  }

  @Override
  public String toString()
  {
    StringBuilder builder = new StringBuilder();
    if (lower != null) {
      builder.append(lower).append(lowerStrict ? " < " : " <= ");
    }
    builder.append(column.getQualifiedName());
    if (upper != null) {
      builder.append(upperStrict ? " < " : " <= ").append(upper);
    }
    return builder.toString();
  }
}
