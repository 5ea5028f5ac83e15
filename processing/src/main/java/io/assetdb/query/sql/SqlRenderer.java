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

package io.assetdb.query.sql;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;
import io.assetdb.metadata.TableRef;
import io.assetdb.query.JoinSpec;
import io.assetdb.query.QueryPlan;
import io.assetdb.query.expression.ColumnExpression;
import io.assetdb.query.expression.ColumnRef;
import io.assetdb.query.filter.DimFilter;

import java.util.List;

/**
 * Renders plans as DB2 flavored SQL with literal bound values.
 */
public class SqlRenderer
{
  private static final Joiner COMMA = Joiner.on(", ");
  private static final Joiner AND = Joiner.on(" AND ");

  public static String render(QueryPlan plan)
  {
    final StringBuilder builder = new StringBuilder("SELECT ");
    final List<String> items = Lists.newArrayList();
    for (ColumnExpression expression : plan.getProjection()) {
      items.add(projectionItem(expression));
    }
    builder.append(COMMA.join(items));

    if (plan.isJoin()) {
      final JoinSpec join = plan.getJoin();
      builder.append(" FROM (").append(render(join.getLeft())).append(") AS ").append(JoinSpec.LEFT_ALIAS);
      builder.append(" INNER JOIN (").append(render(join.getRight())).append(") AS ").append(JoinSpec.RIGHT_ALIAS);
      final List<String> conditions = Lists.newArrayList();
      for (int i = 0; i < join.getLeftJoinColumns().size(); i++) {
        conditions.add(
            JoinSpec.LEFT_ALIAS + "." + SqlStrings.identifier(join.getLeftJoinColumns().get(i)) + " = " +
            JoinSpec.RIGHT_ALIAS + "." + SqlStrings.identifier(join.getRightJoinColumns().get(i))
        );
      }
      if (!conditions.isEmpty()) {
        builder.append(" ON ").append(AND.join(conditions));
      }
    } else {
      final TableRef table = plan.getTable();
      builder.append(" FROM ").append(tableReference(table));
      final TableRef dimension = plan.getDimension();
      if (dimension != null) {
        final String key = SqlStrings.identifier(plan.getEntityKey());
        builder.append(" INNER JOIN ").append(tableReference(dimension))
               .append(" ON ").append(SqlStrings.identifier(dimension.getName())).append('.').append(key)
               .append(" = ").append(SqlStrings.identifier(table.getName())).append('.').append(key);
      }
    }

    if (!plan.getFilters().isEmpty()) {
      final List<String> clauses = Lists.newArrayList();
      for (DimFilter filter : plan.getFilters()) {
        clauses.add(filter.toSql());
      }
      builder.append(" WHERE ").append(AND.join(clauses));
    }
    if (!plan.getGroupBy().isEmpty()) {
      final List<String> groups = Lists.newArrayList();
      for (ColumnExpression expression : plan.getGroupBy()) {
        groups.add(expression.toSql());
      }
      builder.append(" GROUP BY ").append(COMMA.join(groups));
    }
    return builder.toString();
  }

  private static String projectionItem(ColumnExpression expression)
  {
    if (expression instanceof ColumnRef && ((ColumnRef) expression).getAlias() == null) {
      return expression.toSql();
    }
    return expression.toSql() + " AS " + SqlStrings.identifier(expression.getOutputName());
  }

  private static String tableReference(TableRef table)
  {
    if (table.getSchema() == null) {
      return SqlStrings.identifier(table.getName());
    }
    return SqlStrings.identifier(table.getSchema()) + "." + SqlStrings.identifier(table.getName())
           + " AS " + SqlStrings.identifier(table.getName());
  }

  private SqlRenderer()
  {
  }
}
