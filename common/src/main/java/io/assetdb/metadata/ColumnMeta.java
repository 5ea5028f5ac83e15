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

package io.assetdb.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import io.assetdb.data.ValueType;

import java.util.Objects;

/**
 */
public class ColumnMeta
{
  public static ColumnMeta of(String name, ValueType type)
  {
    return new ColumnMeta(name, type);
  }

  private final String name;
  private final ValueType type;

  @JsonCreator
  public ColumnMeta(
      @JsonProperty("name") String name,
      @JsonProperty("type") ValueType type
  )
  {
    this.name = Preconditions.checkNotNull(name, "'name' cannot be null");
    this.type = type == null ? ValueType.OTHER : type;
  }

  @JsonProperty
  public String getName()
  {
    return name;
  }

  @JsonProperty
  public ValueType getType()
  {
    return type;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ColumnMeta that = (ColumnMeta) o;
    return name.equals(that.name) && type == that.type;
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(name, type);
  }

  @Override
  public String toString()
  {
    return name + ":" + type.getName();
  }
}
