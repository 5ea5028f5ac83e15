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

import com.google.common.base.Predicates;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import io.assetdb.metadata.TableRef;
import io.assetdb.query.PlanningException;
import io.assetdb.query.expression.ColumnRef;
import io.assetdb.query.expression.ColumnResolution;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/**
 */
public class DimFilters
{
  /**
   * is-not-null condition for the column, bound to the table or else to the dimension
   */
  public static NotNullDimFilter notNull(TableRef table, @Nullable TableRef dimension, String column)
  {
    ColumnResolution resolution = ColumnResolution.resolve(table, dimension, column);
    if (!resolution.isFound()) {
      throw PlanningException.columnNotFound(column);
    }
    return NotNullDimFilter.of(resolution.getColumn());
  }

  @Nullable
  public static DimFilter range(ColumnRef column, @Nullable Object lower, @Nullable Object upper)
  {
    return lower == null && upper == null ? null : BoundDimFilter.range(column, lower, upper);
  }

  public static DimFilter and(DimFilter... filters)
  {
    return and(Arrays.asList(filters));
  }

  /**
   * @return null for no filter, the filter itself for one
   */
  @Nullable
  public static DimFilter and(List<DimFilter> filters)
  {
    List<DimFilter> list = Lists.newArrayList();
    for (DimFilter filtered : Iterables.filter(filters, Predicates.notNull())) {
      if (filtered instanceof AndDimFilter) {
        list.addAll(((AndDimFilter) filtered).getChildren());
      } else {
        list.add(filtered);
      }
    }
    return list.isEmpty() ? null : list.size() == 1 ? list.get(0) : new AndDimFilter(list);
  }

  public static DimFilter or(DimFilter... filters)
  {
    return or(Arrays.asList(filters));
  }

  @Nullable
  public static DimFilter or(List<DimFilter> filters)
  {
    List<DimFilter> list = Lists.newArrayList();
    for (DimFilter filtered : Iterables.filter(filters, Predicates.notNull())) {
      if (filtered instanceof OrDimFilter) {
        list.addAll(((OrDimFilter) filtered).getChildren());
      } else {
        list.add(filtered);
      }
    }
    return list.isEmpty() ? null : list.size() == 1 ? list.get(0) : new OrDimFilter(list);
  }

  public static List<DimFilter> filterNulls(List<DimFilter> optimized)
  {
    return Lists.newArrayList(Iterables.filter(optimized, Predicates.notNull()));
  }

  private DimFilters()
  {
  }
}
