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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.assetdb.data.ValueType;
import io.assetdb.java.util.common.StringUtils;
import io.assetdb.query.PlanningException;

import javax.annotation.Nullable;

/**
 */
public enum AggregateKind
{
  COUNT("COUNT") {
    @Override
    public ValueType resultType(ValueType input)
    {
      return ValueType.NUMERIC;
    }
  },
  MAX("MAX"),
  MEAN("AVG") {
    @Override
    public ValueType resultType(ValueType input)
    {
      return ValueType.NUMERIC;
    }
  },
  MIN("MIN"),
  STD("STDDEV") {
    @Override
    public ValueType resultType(ValueType input)
    {
      return ValueType.NUMERIC;
    }
  },
  SUM("SUM") {
    @Override
    public ValueType resultType(ValueType input)
    {
      return ValueType.NUMERIC;
    }
  };

  private final String sqlFunction;

  AggregateKind(String sqlFunction)
  {
    this.sqlFunction = sqlFunction;
  }

  public String getSqlFunction()
  {
    return sqlFunction;
  }

  // min and max keep the type of their input
  public ValueType resultType(ValueType input)
  {
    return input;
  }

  @JsonValue
  public String getName()
  {
    return StringUtils.toLowerCase(name());
  }

  @Override
  public String toString()
  {
    return getName();
  }

  /**
   * @return the kind, or null if the name is not one of count, max, mean, min, std, sum
   */
  @Nullable
  public static AggregateKind find(@Nullable String name)
  {
    if (name != null) {
      for (AggregateKind kind : values()) {
        if (kind.getName().equals(name)) {
          return kind;
        }
      }
    }
    return null;
  }

  @JsonCreator
  public static AggregateKind fromString(String name)
  {
    AggregateKind kind = find(name);
    if (kind == null) {
      throw PlanningException.unsupportedAggregate(name);
    }
    return kind;
  }
}
