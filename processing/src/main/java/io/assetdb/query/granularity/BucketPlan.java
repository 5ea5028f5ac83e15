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

import com.google.common.base.Preconditions;
import io.assetdb.query.expression.ColumnExpression;
import io.assetdb.query.expression.ColumnRef;

import javax.annotation.Nullable;

/**
 * How the time grain of a request is applied. Push-down plans carry an expression, fallback plans carry the
 * frequency to resample with after retrieval. Never both.
 */
public class BucketPlan
{
  public enum Type
  {
    NO_BUCKET,
    PUSH_DOWN,
    FALLBACK
  }

  /**
   * the raw timestamp is the group key
   */
  public static BucketPlan noBucket(ColumnRef timestamp)
  {
    return new BucketPlan(Type.NO_BUCKET, timestamp, null);
  }

  public static BucketPlan pushDown(TimeBucketExpression expression)
  {
    return new BucketPlan(Type.PUSH_DOWN, expression, null);
  }

  public static BucketPlan fallback(String frequency)
  {
    return new BucketPlan(Type.FALLBACK, null, Preconditions.checkNotNull(frequency));
  }

  private final Type type;
  private final ColumnExpression expression;
  private final String frequency;

  private BucketPlan(Type type, ColumnExpression expression, String frequency)
  {
    this.type = type;
    this.expression = expression;
    this.frequency = frequency;
  }

  public Type getType()
  {
    return type;
  }

  public boolean isFallback()
  {
    return type == Type.FALLBACK;
  }

  /**
   * @return group key labeled with the timestamp column name, null for fallback
   */
  @Nullable
  public ColumnExpression getExpression()
  {
    return expression;
  }

  /**
   * @return resampling frequency, null unless fallback
   */
  @Nullable
  public String getFrequency()
  {
    return frequency;
  }

  @Override
  public String toString()
  {
    return type == Type.FALLBACK ? type + "[" + frequency + "]" : type + "[" + expression + "]";
  }
}
