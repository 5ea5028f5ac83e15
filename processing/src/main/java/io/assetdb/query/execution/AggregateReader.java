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
import io.assetdb.java.util.common.ISE;
import io.assetdb.java.util.common.logger.Logger;
import io.assetdb.query.AggregateRequest;
import io.assetdb.query.QueryPlan;
import io.assetdb.query.QueryPlanner;
import io.assetdb.query.sql.SqlRenderer;

import javax.annotation.Nullable;

/**
 * Plans, executes and, for grains the store cannot evaluate, resamples an aggregate request.
 */
public class AggregateReader
{
  private static final Logger LOG = new Logger(AggregateReader.class);

  private final QueryPlanner planner;
  private final QueryExecutor executor;
  private final Resampler resampler;

  public AggregateReader(QueryPlanner planner, QueryExecutor executor, @Nullable Resampler resampler)
  {
    this.planner = Preconditions.checkNotNull(planner, "'planner' cannot be null");
    this.executor = Preconditions.checkNotNull(executor, "'executor' cannot be null");
    this.resampler = resampler;
  }

  /**
   * @throws io.assetdb.query.PlanningException when the request cannot be planned, before anything is executed
   */
  public RowSet read(AggregateRequest request)
  {
    return read(planner.assemble(request).get());
  }

  public RowSet read(QueryPlan plan)
  {
    if (plan.isFallback() && resampler == null) {
      throw new ISE("Time grain %s needs a resampler", plan.getResampleFrequency());
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug(SqlRenderer.render(plan));
    }
    final RowSet rows = executor.execute(plan);
    if (!plan.isFallback()) {
      return rows;
    }
    LOG.info("Resampling %d rows with frequency %s", rows.size(), plan.getResampleFrequency());
    return resampler.resample(
        rows,
        plan.getResampleFrequency(),
        plan.getTimestampColumn(),
        plan.getGroupByNames(),
        plan.getAggregateSpec()
    );
  }
}
