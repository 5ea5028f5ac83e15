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

package io.assetdb.query.groupby;

import com.google.common.collect.Lists;
import io.assetdb.metadata.TableRef;
import io.assetdb.query.PlanningException;
import io.assetdb.query.expression.ColumnRef;
import io.assetdb.query.expression.ColumnResolution;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;

/**
 */
public class GroupByResolver
{
  /**
   * Binds each name to the fact table, or to the dimension when the fact table lacks it.
   *
   * @throws PlanningException GROUP_COLUMN_NOT_FOUND, flagged {@code noDimension} when no dimension was given
   */
  public static List<ColumnRef> resolve(TableRef table, @Nullable TableRef dimension, @Nullable List<String> names)
  {
    if (names == null || names.isEmpty()) {
      return Collections.emptyList();
    }
    List<ColumnRef> resolved = Lists.newArrayListWithCapacity(names.size());
    for (String name : names) {
      ColumnResolution resolution = ColumnResolution.resolve(table, dimension, name);
      if (!resolution.isFound()) {
        throw PlanningException.groupColumnNotFound(name, dimension == null);
      }
      resolved.add(resolution.getColumn());
    }
    return resolved;
  }

  private GroupByResolver()
  {
  }
}
