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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import io.assetdb.data.ValueType;
import io.assetdb.query.expression.ColumnExpression;
import io.assetdb.query.expression.ColumnRef;

import java.util.Objects;

/**
 * Aggregate function over one bound column, labeled with its output name.
 */
public class AggregateExpression implements ColumnExpression
{
  private final AggregateKind kind;
  private final ColumnRef field;
  private final String name;

  @JsonCreator
  public AggregateExpression(
      @JsonProperty("kind") AggregateKind kind,
      @JsonProperty("field") ColumnRef field,
      @JsonProperty("name") String name
  )
  {
    this.kind = Preconditions.checkNotNull(kind, "'kind' cannot be null");
    this.field = Preconditions.checkNotNull(field, "'field' cannot be null");
    this.name = Preconditions.checkNotNull(name, "Must have a valid, non-null aggregator name");
  }

  @JsonProperty
  public AggregateKind getKind()
  {
    return kind;
  }

  @JsonProperty
  public ColumnRef getField()
  {
    return field;
  }

  @JsonProperty
  public String getName()
  {
    return name;
  }

  @Override
  @JsonIgnore
  public String getOutputName()
  {
    return name;
  }

  @Override
  @JsonIgnore
  public ValueType getType()
  {
    return kind.resultType(field.getType());
  }

  @Override
  public String toSql()
  {
    return kind.getSqlFunction() + "(" + field.toSql() + ")";
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
    AggregateExpression that = (AggregateExpression) o;
    return kind == that.kind && field.equals(that.field) && name.equals(that.name);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(kind, field, name);
  }

  @Override
  public String toString()
  {
    return kind + "(" + field.getQualifiedName() + ") AS " + name;
  }
}
