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

package io.assetdb.query.join;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import io.assetdb.java.util.common.logger.Logger;
import io.assetdb.query.JoinKey;
import io.assetdb.query.JoinSpec;
import io.assetdb.query.PlannerConfig;
import io.assetdb.query.PlanningException;
import io.assetdb.query.QueryPlan;
import io.assetdb.query.expression.ColumnExpression;
import io.assetdb.query.expression.ColumnRef;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Equi-joins two aggregated plans executed as independent subqueries. The joined projection is every right hand
 * column named in the alias map, under its alias, followed by every left hand column whose name is not taken by
 * one of those aliases.
 */
public class DualAggregateJoin
{
  private static final Logger LOG = new Logger(DualAggregateJoin.class);

  private final PlannerConfig config;

  public DualAggregateJoin(PlannerConfig config)
  {
    this.config = config;
  }

  /**
   * @param rightAliases right hand output name to output name in the joined plan, in projection order
   */
  public QueryPlan join(QueryPlan left, QueryPlan right, List<JoinKey> joinKeys, Map<String, String> rightAliases)
  {
    if (left.isFallback()) {
      throw PlanningException.fallbackNotJoinable(left.getResampleFrequency());
    }
    if (right.isFallback()) {
      throw PlanningException.fallbackNotJoinable(right.getResampleFrequency());
    }

    final List<String> leftJoinColumns = Lists.newArrayList();
    final List<String> rightJoinColumns = Lists.newArrayList();
    for (JoinKey key : joinKeys) {
      outputOf(left, key.getLeft());
      outputOf(right, key.getRight());
      leftJoinColumns.add(key.getLeft());
      rightJoinColumns.add(key.getRight());
    }

    final List<ColumnExpression> projection = Lists.newArrayList();
    final Set<String> covered = Sets.newHashSet();
    for (Map.Entry<String, String> entry : rightAliases.entrySet()) {
      final ColumnExpression column = outputOf(right, entry.getKey());
      final String alias = entry.getValue();
      if (!covered.add(alias)) {
        if (config.isUniqueOutputNames()) {
          throw PlanningException.duplicateOutputName(alias);
        }
        LOG.warn("Right hand alias %s is used more than once. Keeping the first.", alias);
        continue;
      }
      projection.add(ColumnRef.of(JoinSpec.RIGHT_ALIAS, column.getOutputName(), column.getType()).as(alias));
    }
    for (ColumnExpression column : left.getProjection()) {
      if (!covered.contains(column.getOutputName())) {
        projection.add(ColumnRef.of(JoinSpec.LEFT_ALIAS, column.getOutputName(), column.getType()));
      }
    }

    final Map<String, String> aliases = Maps.newLinkedHashMap(rightAliases);
    return QueryPlan.builder()
                    .join(new JoinSpec(left, right, leftJoinColumns, rightJoinColumns, aliases))
                    .projection(projection)
                    .timestampColumn(left.getTimestampColumn())
                    .groupByNames(left.getGroupByNames())
                    .build();
  }

  private static ColumnExpression outputOf(QueryPlan plan, String name)
  {
    ColumnExpression column = plan.getOutput(name);
    if (column == null) {
      throw PlanningException.columnNotFound(name);
    }
    return column;
  }
}
