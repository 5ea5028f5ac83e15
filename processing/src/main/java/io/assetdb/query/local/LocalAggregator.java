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

import javax.annotation.Nullable;

/**
 * Accumulates the values of one group for one aggregate. Nulls are ignored, as SQL aggregates do.
 */
public interface LocalAggregator
{
  void aggregate(@Nullable Object value);

  /**
   * @return aggregated value, null when nothing but nulls were seen (except count)
   */
  @Nullable
  Object get();
}
