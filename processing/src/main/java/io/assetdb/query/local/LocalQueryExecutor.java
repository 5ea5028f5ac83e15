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

package io.assetdb.query.local;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import io.assetdb.data.Rows;
import io.assetdb.java.util.common.ISE;
import io.assetdb.java.util.common.logger.Logger;
import io.assetdb.metadata.TableRef;
import io.assetdb.query.JoinSpec;
import io.assetdb.query.PlannerConfig;
import io.assetdb.query.QueryPlan;
import io.assetdb.query.aggregation.AggregateExpression;
import io.assetdb.query.execution.QueryExecutor;
import io.assetdb.query.execution.RowSet;
import io.assetdb.query.expression.ColumnExpression;
import io.assetdb.query.expression.ColumnRef;
import io.assetdb.query.filter.DimFilter;
import io.assetdb.query.granularity.TimeBucketExpression;
import org.joda.time.DateTimeZone;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Evaluates plans over rows held in memory, keyed by table name. Scans, dimension joins, filters, time buckets,
 * grouped aggregation and subquery equi-joins behave as the rendered SQL would.
 */
public class LocalQueryExecutor implements QueryExecutor
{
  private static final Logger LOG = new Logger(LocalQueryExecutor.class);

  private final PlannerConfig config;
  private final Map<String, List<Map<String, Object>>> tables = new ConcurrentHashMap<>();

  public LocalQueryExecutor(PlannerConfig config)
  {
    this.config = Preconditions.checkNotNull(config, "'config' cannot be null");
  }

  public LocalQueryExecutor register(String table, List<Map<String, Object>> rows)
  {
    tables.put(table, Collections.unmodifiableList(Lists.newArrayList(rows)));
    return this;
  }

  @Override
  public RowSet execute(QueryPlan plan)
  {
    final List<Map<String, Object>> rows = plan.isJoin() ? join(plan.getJoin()) : scan(plan);
    final List<Map<String, Object>> filtered = filter(rows, plan.getFilter());
    final List<Map<String, Object>> results;
    if (plan.isAggregate()) {
      results = aggregate(plan, filtered);
    } else {
      results = Lists.newArrayListWithCapacity(filtered.size());
      for (Map<String, Object> row : filtered) {
        Map<String, Object> result = Maps.newLinkedHashMap();
        for (ColumnExpression expression : plan.getProjection()) {
          result.put(expression.getOutputName(), evaluate(expression, row));
        }
        results.add(result);
      }
    }
    LOG.debug("%d rows scanned, %d rows returned", rows.size(), results.size());
    return RowSet.of(plan.getOutputNames(), results);
  }

  private List<Map<String, Object>> scan(QueryPlan plan)
  {
    final TableRef table = plan.getTable();
    final List<Map<String, Object>> facts = qualify(table.getName(), rowsOf(table));
    final TableRef dimension = plan.getDimension();
    if (dimension == null) {
      return facts;
    }
    final String key = plan.getEntityKey();
    final Map<Object, List<Map<String, Object>>> index = index(
        qualify(dimension.getName(), rowsOf(dimension)),
        Collections.singletonList(dimension.getName() + "." + key)
    );
    final List<String> factKey = Collections.singletonList(table.getName() + "." + key);
    final List<Map<String, Object>> joined = Lists.newArrayList();
    for (Map<String, Object> fact : facts) {
      for (Map<String, Object> match : index.getOrDefault(keyOf(fact, factKey), Collections.emptyList())) {
        Map<String, Object> row = Maps.newHashMap(fact);
        row.putAll(match);
        joined.add(row);
      }
    }
    return joined;
  }

  private List<Map<String, Object>> join(JoinSpec join)
  {
    final List<Map<String, Object>> left = qualify(JoinSpec.LEFT_ALIAS, execute(join.getLeft()).getRows());
    final List<Map<String, Object>> right = qualify(JoinSpec.RIGHT_ALIAS, execute(join.getRight()).getRows());
    final List<String> leftKeys = Lists.transform(join.getLeftJoinColumns(), c -> JoinSpec.LEFT_ALIAS + "." + c);
    final List<String> rightKeys = Lists.transform(join.getRightJoinColumns(), c -> JoinSpec.RIGHT_ALIAS + "." + c);
    final Map<Object, List<Map<String, Object>>> index = index(right, rightKeys);
    final List<Map<String, Object>> joined = Lists.newArrayList();
    for (Map<String, Object> row : left) {
      List<Object> key = keyOf(row, leftKeys);
      if (key.contains(null)) {
        continue;
      }
      for (Map<String, Object> match : index.getOrDefault(key, Collections.emptyList())) {
        Map<String, Object> combined = Maps.newHashMap(row);
        combined.putAll(match);
        joined.add(combined);
      }
    }
    return joined;
  }

  private List<Map<String, Object>> aggregate(QueryPlan plan, List<Map<String, Object>> rows)
  {
    final Map<List<Object>, Group> groups = Maps.newLinkedHashMap();
    for (Map<String, Object> row : rows) {
      final List<Object> key = Lists.newArrayList();
      final Map<String, Object> values = Maps.newHashMap();
      for (ColumnExpression expression : plan.getGroupBy()) {
        Object value = evaluate(expression, row);
        key.add(Rows.normalize(value));
        values.put(expression.getOutputName(), value);
      }
      groups.computeIfAbsent(key, k -> new Group(plan, values)).aggregate(row);
    }
    if (groups.isEmpty() && plan.getGroupBy().isEmpty()) {
      groups.put(Collections.emptyList(), new Group(plan, Collections.emptyMap()));
    }
    final List<Map<String, Object>> results = Lists.newArrayListWithCapacity(groups.size());
    for (Group group : groups.values()) {
      results.add(group.toRow(plan));
    }
    return results;
  }

  private class Group
  {
    private final Map<String, Object> keys;
    private final Map<AggregateExpression, LocalAggregator> aggregators = Maps.newLinkedHashMap();

    private Group(QueryPlan plan, Map<String, Object> keys)
    {
      this.keys = keys;
      for (ColumnExpression expression : plan.getProjection()) {
        if (expression instanceof AggregateExpression) {
          AggregateExpression aggregate = (AggregateExpression) expression;
          aggregators.put(aggregate, LocalAggregators.create(aggregate.getKind(), config.isSampleStdDev()));
        }
      }
    }

    private void aggregate(Map<String, Object> row)
    {
      for (Map.Entry<AggregateExpression, LocalAggregator> entry : aggregators.entrySet()) {
        entry.getValue().aggregate(evaluate(entry.getKey().getField(), row));
      }
    }

    private Map<String, Object> toRow(QueryPlan plan)
    {
      Map<String, Object> row = Maps.newLinkedHashMap();
      for (ColumnExpression expression : plan.getProjection()) {
        if (expression instanceof AggregateExpression) {
          row.put(expression.getOutputName(), aggregators.get(expression).get());
        } else {
          row.put(expression.getOutputName(), keys.get(expression.getOutputName()));
        }
      }
      return row;
    }
  }

  private Object evaluate(ColumnExpression expression, Map<String, Object> row)
  {
    if (expression instanceof ColumnRef) {
      return row.get(((ColumnRef) expression).getQualifiedName());
    }
    if (expression instanceof TimeBucketExpression) {
      TimeBucketExpression bucket = (TimeBucketExpression) expression;
      DateTimeZone timeZone = config.getTimeZone();
      return bucket.apply(row.get(bucket.getField().getQualifiedName()), timeZone);
    }
    throw new ISE("Cannot evaluate %s per row", expression);
  }

  private List<Map<String, Object>> rowsOf(TableRef table)
  {
    List<Map<String, Object>> rows = tables.get(table.getName());
    if (rows == null) {
      throw new ISE("No rows registered for table %s", table.getName());
    }
    return rows;
  }

  private static List<Map<String, Object>> filter(List<Map<String, Object>> rows, DimFilter filter)
  {
    if (filter == null) {
      return rows;
    }
    final Predicate<Map<String, Object>> predicate = filter.toPredicate();
    final List<Map<String, Object>> filtered = Lists.newArrayList();
    for (Map<String, Object> row : rows) {
      if (predicate.test(row)) {
        filtered.add(row);
      }
    }
    return filtered;
  }

  private static List<Map<String, Object>> qualify(String source, List<Map<String, Object>> rows)
  {
    List<Map<String, Object>> qualified = Lists.newArrayListWithCapacity(rows.size());
    for (Map<String, Object> row : rows) {
      Map<String, Object> mapped = Maps.newHashMap();
      for (Map.Entry<String, Object> entry : row.entrySet()) {
        mapped.put(source + "." + entry.getKey(), entry.getValue());
      }
      qualified.add(mapped);
    }
    return qualified;
  }

  private static Map<Object, List<Map<String, Object>>> index(List<Map<String, Object>> rows, List<String> keys)
  {
    Map<Object, List<Map<String, Object>>> index = Maps.newHashMap();
    for (Map<String, Object> row : rows) {
      List<Object> key = keyOf(row, keys);
      if (!key.contains(null)) {
        index.computeIfAbsent(key, k -> Lists.newArrayList()).add(row);
      }
    }
    return index;
  }

  private static List<Object> keyOf(Map<String, Object> row, List<String> keys)
  {
    List<Object> key = Lists.newArrayListWithCapacity(keys.size());
    for (String column : keys) {
      key.add(Rows.normalize(row.get(column)));
    }
    return key;
  }
}
