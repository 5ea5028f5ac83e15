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
import com.google.common.collect.Lists;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 */
public class AndDimFilter implements DimFilter
{
  // do nothing but creates instance (see DimFilters.and)
  public static AndDimFilter of(DimFilter... filters)
  {
    return new AndDimFilter(Arrays.asList(filters));
  }

  private static final Joiner AND_JOINER = Joiner.on(" && ");

  private final List<DimFilter> fields;

  @JsonCreator
  public AndDimFilter(
      @JsonProperty("fields") List<DimFilter> fields
  )
  {
    fields = DimFilters.filterNulls(fields);
    Preconditions.checkArgument(fields.size() > 0, "AND operator requires at least one field");
    this.fields = ImmutableList.copyOf(fields);
  }

  @JsonProperty
  public List<DimFilter> getFields()
  {
    return fields;
  }

  public List<DimFilter> getChildren()
  {
    return fields;
  }

  @Override
  public Predicate<Map<String, Object>> toPredicate()
  {
    Predicate<Map<String, Object>> predicate = null;
    for (DimFilter field : fields) {
      Predicate<Map<String, Object>> child = field.toPredicate();
      predicate = predicate == null ? child : predicate.and(child);
    }
    return predicate;
  }

  @Override
  public String toSql()
  {
    List<String> clauses = Lists.newArrayList();
    for (DimFilter field : fields) {
      clauses.add(field.toSql());
    }
    return "(" + Joiner.on(" AND ").join(clauses) + ")";
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

    AndDimFilter that = (AndDimFilter) o;

    return fields.equals(that.fields);
  }

  @Override
  public int hashCode()
  {
    return fields.hashCode();
  }

  @Override
  public String toString()
  {
    return String.format("(%s)", AND_JOINER.join(fields));
  }
}
