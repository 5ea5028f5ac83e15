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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import io.assetdb.java.util.common.logger.Logger;
import io.assetdb.metadata.TableResolver;
import io.assetdb.query.aggregation.AggregateExpressions;
import io.assetdb.query.aggregation.AggregateKind;
import io.assetdb.query.aggregation.AggregateSpec;
import io.assetdb.query.aggregation.TimeExtreme;
import io.assetdb.query.join.DualAggregateJoin;
import org.joda.time.DateTime;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point of the planner. Planning errors come back as failed {@link PlanResult}s carrying their code.
 */
public class QueryPlanner
{
  private static final Logger LOG = new Logger(QueryPlanner.class);

  private final TableResolver resolver;
  private final PlannerConfig config;
  private final ObjectMapper jsonMapper;
  private final AggregateQueryAssembler assembler;
  private final DualAggregateJoin joiner;

  public QueryPlanner(TableResolver resolver, PlannerConfig config, ObjectMapper jsonMapper)
  {
    this.resolver = Preconditions.checkNotNull(resolver, "'resolver' cannot be null");
    this.config = Preconditions.checkNotNull(config, "'config' cannot be null");
    this.jsonMapper = jsonMapper;
    this.assembler = new AggregateQueryAssembler(resolver, config);
    this.joiner = new DualAggregateJoin(config);
  }

  public PlannerConfig getConfig()
  {
    return config;
  }

  /**
   * @return planner configured with per request overrides, or this if there is none
   */
  public QueryPlanner withContext(@Nullable Map<String, Object> context)
  {
    PlannerConfig overridden = config.withOverrides(context);
    return overridden == config ? this : new QueryPlanner(resolver, overridden, jsonMapper);
  }

  public PlanResult assemble(AggregateRequest request)
  {
    return plan(() -> assembler.assemble(request));
  }

  public PlanResult select(SelectRequest request)
  {
    return plan(() -> assembler.select(request));
  }

  public PlanResult joinAggregates(
      QueryPlan left,
      QueryPlan right,
      List<JoinKey> joinKeys,
      Map<String, String> rightAliases
  )
  {
    return plan(() -> joiner.join(left, right, joinKeys, rightAliases));
  }

  /**
   * Single aggregate of a single column over the whole table, one row.
   */
  public PlanResult columnAggregate(
      String table,
      @Nullable String schema,
      String column,
      String aggregate,
      @Nullable String timestampColumn,
      @Nullable DateTime startTs,
      @Nullable DateTime endTs,
      @Nullable List<String> entities
  )
  {
    return plan(
        () -> assembler.assemble(
            AggregateRequest.builder(table, AggregateSpec.builder().add(column, aggregate).build())
                            .schema(schema)
                            .timestampColumn(timestampColumn)
                            .interval(startTs, endTs)
                            .entities(entities)
                            .build()
        )
    );
  }

  /**
   * Regular aggregate of a column joined with the first or last timestamp of each bucket.
   * When the regular side keeps the raw timestamp, it is joined on the extreme timestamp of the other side, so that
   * each output row carries the aggregate at that extreme, labeled with the bucket timestamp.
   * Otherwise both sides are joined on the bucket timestamp.
   */
  public PlanResult timeAggregate(TimeAggregateRequest request)
  {
    return plan(() -> buildTimeAggregate(request));
  }

  private QueryPlan buildTimeAggregate(TimeAggregateRequest request)
  {
    final String timestamp = request.getTimestampColumn();
    if (timestamp == null) {
      throw PlanningException.missingTimestampColumn("doing a time-based aggregate");
    }
    final TimeExtreme extreme = TimeExtreme.fromString(request.getTimeAggregate());
    final String timeGrain = request.getTimeGrain();
    if (timeGrain == null) {
      throw PlanningException.missingTimeGrain(request.getTimeAggregate());
    }
    final String regularGrain = request.getRegularGrain() == null ? timestamp : request.getRegularGrain();

    final AggregateKind kind = AggregateKind.fromString(request.getRegularAggregate());
    final AggregateSpec.Builder regular = AggregateSpec.builder().add(request.getColumn(), kind);
    if (request.getOutput() != null) {
      regular.output(request.getColumn(), kind, request.getOutput());
    }
    final QueryPlan left = assembler.assemble(toRequest(request, regular.build()).timeGrain(regularGrain).build());
    if (left.isFallback()) {
      throw PlanningException.fallbackNotJoinable(left.getResampleFrequency());
    }
    final AggregateSpec extremes = AggregateSpec.builder().add(timestamp, extreme.getKind()).build();
    final QueryPlan right = assembler.assemble(toRequest(request, extremes).timeGrain(timeGrain).build());

    final String extremeAlias = AggregateExpressions.defaultAlias(timestamp, extreme.getKind(), timestamp);
    final List<JoinKey> keys = Lists.newArrayList();
    final Map<String, String> rightAliases = Maps.newLinkedHashMap();
    rightAliases.put(extremeAlias, extremeAlias);
    if (regularGrain.equals(timestamp)) {
      keys.add(JoinKey.of(timestamp, extremeAlias));
      rightAliases.put(timestamp, timestamp);
    } else {
      keys.add(JoinKey.of(timestamp));
    }
    for (String group : request.getGroupBy()) {
      keys.add(JoinKey.of(group));
    }
    return joiner.join(left, right, keys, ImmutableMap.copyOf(rightAliases));
  }

  private static AggregateRequest.Builder toRequest(TimeAggregateRequest request, AggregateSpec aggregates)
  {
    return AggregateRequest.builder(request.getTable(), aggregates)
                           .schema(request.getSchema())
                           .groupBy(request.getGroupBy())
                           .timestampColumn(request.getTimestampColumn())
                           .dimension(request.getDimension())
                           .interval(request.getStartTs(), request.getEndTs())
                           .entities(request.getEntities());
  }

  private PlanResult plan(Supplier<QueryPlan> planner)
  {
    final QueryPlan plan;
    try {
      plan = planner.get();
    }
    catch (PlanningException e) {
      LOG.debug("Planning failed with %s: %s", e.getErrorCode(), e.getMessage());
      return PlanResult.failure(e);
    }
    if (config.isDumpPlan() && jsonMapper != null && LOG.isDebugEnabled()) {
      try {
        LOG.debug("Planned %s", jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(plan));
      }
      catch (JsonProcessingException e) {
        LOG.warn(e, "Failed to dump plan %s", plan);
      }
    }
    return PlanResult.success(plan);
  }
}
