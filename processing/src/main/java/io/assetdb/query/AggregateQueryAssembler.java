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

package io.assetdb.query;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import io.assetdb.java.util.common.logger.Logger;
import io.assetdb.metadata.ColumnMeta;
import io.assetdb.metadata.TableRef;
import io.assetdb.metadata.TableResolver;
import io.assetdb.query.aggregation.AggregateExpressions;
import io.assetdb.query.aggregation.AggregateKind;
import io.assetdb.query.aggregation.AggregateSpec;
import io.assetdb.query.expression.ColumnExpression;
import io.assetdb.query.expression.ColumnRef;
import io.assetdb.query.expression.ColumnResolution;
import io.assetdb.query.filter.DimFilter;
import io.assetdb.query.filter.DimFilters;
import io.assetdb.query.filter.InDimFilter;
import io.assetdb.query.granularity.BucketPlan;
import io.assetdb.query.granularity.TimeGrainResolver;
import io.assetdb.query.groupby.GroupByResolver;
import org.joda.time.DateTime;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Set;

/**
 * Builds query plans from aggregate and select requests. Every resolution error is raised here, so no partial
 * plan reaches the execution layer.
 */
public class AggregateQueryAssembler
{
  private static final Logger LOG = new Logger(AggregateQueryAssembler.class);

  private final TableResolver resolver;
  private final PlannerConfig config;

  public AggregateQueryAssembler(TableResolver resolver, PlannerConfig config)
  {
    this.resolver = Preconditions.checkNotNull(resolver, "'resolver' cannot be null");
    this.config = Preconditions.checkNotNull(config, "'config' cannot be null");
  }

  public PlannerConfig getConfig()
  {
    return config;
  }

  public QueryPlan assemble(AggregateRequest request)
  {
    final String schema = schemaOf(request.getSchema());
    final TableRef table = resolveTable(request.getTable(), schema);
    final TableRef dimension = request.getDimension() == null ? null : resolveTable(request.getDimension(), schema);
    final String timestamp = request.getTimestampColumn();
    final AggregateSpec spec = request.getAggregates();

    final List<ColumnExpression> aggregates = Lists.newArrayList();
    final List<DimFilter> metricFilters = Lists.newArrayList();
    for (String column : spec.getColumns()) {
      final boolean listed = spec.isListed(column);
      for (AggregateKind kind : spec.getKinds(column)) {
        String output = spec.getOutput(column, kind);
        if (output == null && listed) {
          output = AggregateExpressions.defaultOutput(column, kind);
          LOG.warn("No output item name specified for %s, %s. Using default %s.", column, kind, output);
        }
        aggregates.add(AggregateExpressions.build(table, dimension, column, kind, output, timestamp));
      }
      metricFilters.add(DimFilters.notNull(table, dimension, column));
    }

    BucketPlan bucket = null;
    if (request.getTimeGrain() != null) {
      bucket = TimeGrainResolver.resolve(table, timestamp, request.getTimeGrain());
    }
    final List<ColumnRef> groupColumns = GroupByResolver.resolve(table, dimension, request.getGroupBy());

    if (bucket != null && bucket.isFallback()) {
      LOG.info(
          "Time grain %s cannot be pushed down to the database. Rows of %s will be resampled after retrieval.",
          bucket.getFrequency(), table.getQualifiedName()
      );
      QueryPlan.Builder builder = QueryPlan.builder()
                                           .table(table)
                                           .projection(selectAll(table, dimension))
                                           .fallback(bucket.getFrequency())
                                           .timestampColumn(timestamp)
                                           .groupByNames(request.getGroupBy())
                                           .aggregateSpec(spec);
      applyDimensionAndFilters(
          builder, table, dimension, timestamp, request.getStartTs(), request.getEndTs(), request.getEntities()
      );
      return builder.filter(DimFilters.or(metricFilters)).build();
    }

    final List<ColumnExpression> groupBy = Lists.newArrayList();
    if (bucket != null) {
      groupBy.add(bucket.getExpression());
    }
    groupBy.addAll(groupColumns);

    final List<ColumnExpression> projection = Lists.newArrayList(aggregates);
    projection.addAll(groupBy);
    checkOutputNames(projection);

    QueryPlan.Builder builder = QueryPlan.builder()
                                         .table(table)
                                         .projection(projection)
                                         .groupBy(groupBy)
                                         .timestampColumn(timestamp)
                                         .groupByNames(request.getGroupBy())
                                         .aggregateSpec(spec);
    applyDimensionAndFilters(
        builder, table, dimension, timestamp, request.getStartTs(), request.getEndTs(), request.getEntities()
    );
    return builder.filter(DimFilters.or(metricFilters)).build();
  }

  public QueryPlan select(SelectRequest request)
  {
    final String schema = schemaOf(request.getSchema());
    final TableRef table = resolveTable(request.getTable(), schema);
    final TableRef dimension = request.getDimension() == null ? null : resolveTable(request.getDimension(), schema);

    final List<ColumnExpression> projection;
    if (request.getColumns() == null) {
      projection = selectAll(table, dimension);
    } else {
      projection = Lists.newArrayList();
      for (String column : request.getColumns()) {
        ColumnResolution resolution = ColumnResolution.resolve(table, dimension, column);
        if (!resolution.isFound()) {
          throw PlanningException.columnNotFound(column);
        }
        projection.add(resolution.getColumn());
      }
    }
    checkOutputNames(projection);

    QueryPlan.Builder builder = QueryPlan.builder()
                                         .table(table)
                                         .projection(projection)
                                         .timestampColumn(request.getTimestampColumn());
    applyDimensionAndFilters(
        builder,
        table,
        dimension,
        request.getTimestampColumn(),
        request.getStartTs(),
        request.getEndTs(),
        request.getEntities()
    );
    return builder.build();
  }

  TableRef resolveTable(String name, @Nullable String schema)
  {
    TableRef table = resolver.resolve(name, schema);
    if (table == null) {
      throw PlanningException.tableNotFound(name, schema);
    }
    return table;
  }

  @Nullable
  String schemaOf(@Nullable String schema)
  {
    return schema == null ? config.getDefaultSchema() : schema;
  }

  // fact columns, then dimension columns except the join key
  private List<ColumnExpression> selectAll(TableRef table, @Nullable TableRef dimension)
  {
    List<ColumnExpression> columns = Lists.newArrayList();
    for (ColumnMeta column : table.getColumns()) {
      columns.add(ColumnRef.of(table.getName(), column.getName(), column.getType()));
    }
    if (dimension != null) {
      for (ColumnMeta column : dimension.getColumns()) {
        if (!column.getName().equals(config.getEntityKey()) && !table.hasColumn(column.getName())) {
          columns.add(ColumnRef.of(dimension.getName(), column.getName(), column.getType()));
        }
      }
    }
    return columns;
  }

  private void applyDimensionAndFilters(
      QueryPlan.Builder builder,
      TableRef table,
      @Nullable TableRef dimension,
      @Nullable String timestamp,
      @Nullable DateTime startTs,
      @Nullable DateTime endTs,
      @Nullable List<String> entities
  )
  {
    final String entityKey = config.getEntityKey();
    if (dimension != null) {
      if (!table.hasColumn(entityKey)) {
        throw PlanningException.columnNotFound(entityKey);
      }
      if (!dimension.hasColumn(entityKey)) {
        throw PlanningException.columnNotFound(entityKey);
      }
      builder.dimension(dimension, entityKey);
    }
    if (startTs != null || endTs != null) {
      if (timestamp == null) {
        throw PlanningException.missingTimestampColumn("applying a date filter");
      }
      builder.filter(DimFilters.range(tableColumn(table, timestamp), startTs, endTs));
    }
    if (entities != null) {
      builder.filter(new InDimFilter(tableColumn(table, entityKey), entities));
    }
  }

  private static ColumnRef tableColumn(TableRef table, String column)
  {
    ColumnMeta meta = table.getColumn(column);
    if (meta == null) {
      throw PlanningException.columnNotFound(column);
    }
    return ColumnRef.of(table.getName(), column, meta.getType());
  }

  private void checkOutputNames(List<? extends ColumnExpression> projection)
  {
    Set<String> names = Sets.newHashSet();
    for (ColumnExpression expression : projection) {
      if (!names.add(expression.getOutputName())) {
        if (config.isUniqueOutputNames()) {
          throw PlanningException.duplicateOutputName(expression.getOutputName());
        }
        LOG.warn("Output name %s appears more than once in the projection", expression.getOutputName());
      }
    }
  }
}
