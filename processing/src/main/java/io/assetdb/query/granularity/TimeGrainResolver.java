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

package io.assetdb.query.granularity;

import io.assetdb.metadata.ColumnMeta;
import io.assetdb.metadata.TableRef;
import io.assetdb.query.PlanningException;
import io.assetdb.query.expression.ColumnRef;

import javax.annotation.Nullable;

/**
 * Decides whether a time grain can be evaluated by the store or has to be resampled after retrieval.
 */
public class TimeGrainResolver
{
  public static BucketPlan resolve(TableRef table, @Nullable String timestampColumn, String grain)
  {
    if (timestampColumn == null) {
      throw PlanningException.missingTimestampColumn("doing a time-based aggregate");
    }
    ColumnMeta meta = table.getColumn(timestampColumn);
    if (meta == null) {
      throw PlanningException.columnNotFound(timestampColumn);
    }
    ColumnRef timestamp = ColumnRef.of(table.getName(), timestampColumn, meta.getType());
    if (grain.equals(timestampColumn)) {
      return BucketPlan.noBucket(timestamp);
    }
    TimeGrain parsed = TimeGrain.parse(grain);
    if (parsed.isOpaque()) {
      return BucketPlan.fallback(grain);
    }
    return BucketPlan.pushDown(new TimeBucketExpression(timestamp, grain, timestampColumn));
  }

  private TimeGrainResolver()
  {
  }
}
