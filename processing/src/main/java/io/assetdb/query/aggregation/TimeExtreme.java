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

package io.assetdb.query.aggregation;

import io.assetdb.java.util.common.StringUtils;
import io.assetdb.query.PlanningException;

/**
 * first or last timestamp of a bucket, computed as min or max of the timestamp column
 */
public enum TimeExtreme
{
  FIRST(AggregateKind.MIN),
  LAST(AggregateKind.MAX);

  private final AggregateKind kind;

  TimeExtreme(AggregateKind kind)
  {
    this.kind = kind;
  }

  public AggregateKind getKind()
  {
    return kind;
  }

  public String getName()
  {
    return StringUtils.toLowerCase(name());
  }

  public String aliasOf(String timestampColumn)
  {
    return getName() + "_" + timestampColumn;
  }

  public static TimeExtreme fromString(String name)
  {
    if (name != null) {
      for (TimeExtreme extreme : values()) {
        if (extreme.getName().equals(name)) {
          return extreme;
        }
      }
    }
    throw PlanningException.invalidTimeAggregate(name);
  }
}
