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

package io.assetdb.query.execution;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Ordered result rows keyed by the output names of the plan that produced them.
 */
public class RowSet implements Iterable<Map<String, Object>>
{
  public static RowSet of(List<String> columns, List<Map<String, Object>> rows)
  {
    return new RowSet(columns, rows);
  }

  private final List<String> columns;
  private final List<Map<String, Object>> rows;

  public RowSet(List<String> columns, List<Map<String, Object>> rows)
  {
    this.columns = ImmutableList.copyOf(Preconditions.checkNotNull(columns, "'columns' cannot be null"));
    List<Map<String, Object>> copy = Lists.newArrayListWithCapacity(rows.size());
    for (Map<String, Object> row : rows) {
      copy.add(Collections.unmodifiableMap(Maps.newLinkedHashMap(row)));
    }
    this.rows = Collections.unmodifiableList(copy);
  }

  public List<String> getColumns()
  {
    return columns;
  }

  public List<Map<String, Object>> getRows()
  {
    return rows;
  }

  public int size()
  {
    return rows.size();
  }

  public boolean isEmpty()
  {
    return rows.isEmpty();
  }

  public Map<String, Object> get(int index)
  {
    return rows.get(index);
  }

  /**
   * @return values of one column, in row order
   */
  public List<Object> column(String name)
  {
    Preconditions.checkArgument(columns.contains(name), "no column %s in %s", name, columns);
    List<Object> values = Lists.newArrayListWithCapacity(rows.size());
    for (Map<String, Object> row : rows) {
      values.add(row.get(name));
    }
    return values;
  }

  @Override
  public Iterator<Map<String, Object>> iterator()
  {
    return rows.iterator();
  }

  @Override
  public String toString()
  {
    return "RowSet{columns=" + columns + ", rows=" + rows.size() + '}';
  }
}
