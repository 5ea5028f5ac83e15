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
import io.assetdb.java.util.common.ISE;

import javax.annotation.Nullable;

/**
 * Outcome of planning: a plan, or the typed reason no plan could be built.
 */
public class PlanResult
{
  public static PlanResult success(QueryPlan plan)
  {
    return new PlanResult(Preconditions.checkNotNull(plan), null);
  }

  public static PlanResult failure(PlanningException error)
  {
    return new PlanResult(null, Preconditions.checkNotNull(error));
  }

  private final QueryPlan plan;
  private final PlanningException error;

  private PlanResult(QueryPlan plan, PlanningException error)
  {
    this.plan = plan;
    this.error = error;
  }

  public boolean isSuccess()
  {
    return plan != null;
  }

  /**
   * @return true if planned but the time grain has to be applied after retrieval
   */
  public boolean isFallback()
  {
    return plan != null && plan.isFallback();
  }

  public QueryPlan getPlan()
  {
    if (plan == null) {
      throw new ISE(error, "No plan, failed with %s", error.getErrorCode());
    }
    return plan;
  }

  @Nullable
  public PlanningException.Code getErrorCode()
  {
    return error == null ? null : error.getErrorCode();
  }

  @Nullable
  public PlanningException getError()
  {
    return error;
  }

  /**
   * @return the plan
   * @throws PlanningException the planning error, as is
   */
  public QueryPlan get()
  {
    if (error != null) {
      throw error;
    }
    return plan;
  }

  @Override
  public String toString()
  {
    return plan != null ? "success[" + plan + "]" : "failure[" + error.getErrorCode() + ": " + error.getMessage() + "]";
  }
}
