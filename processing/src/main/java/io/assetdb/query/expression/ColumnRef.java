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

package io.assetdb.query.expression;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import io.assetdb.data.ValueType;
import io.assetdb.query.sql.SqlStrings;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Plain column of a table or a subquery, optionally renamed.
 */
public class ColumnRef implements ColumnExpression
{
  public static ColumnRef of(String source, String name, ValueType type)
  {
    return new ColumnRef(source, name, type, null);
  }

  private final String source;
  private final String name;
  private final ValueType type;
  private final String alias;

  @JsonCreator
  public ColumnRef(
      @JsonProperty("source") String source,
      @JsonProperty("name") String name,
      @JsonProperty("valueType") ValueType type,
      @JsonProperty("alias") @Nullable String alias
  )
  {
    this.source = Preconditions.checkNotNull(source, "'source' cannot be null");
    this.name = Preconditions.checkNotNull(name, "'name' cannot be null");
    this.type = type == null ? ValueType.OTHER : type;
    this.alias = alias;
  }

  /**
   * table name or subquery alias the column belongs to
   */
  @JsonProperty
  public String getSource()
  {
    return source;
  }

  @JsonProperty
  public String getName()
  {
    return name;
  }

  @Override
  @JsonProperty("valueType")
  public ValueType getType()
  {
    return type;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String getAlias()
  {
    return alias;
  }

  public ColumnRef as(String alias)
  {
    return new ColumnRef(source, name, type, name.equals(alias) ? null : alias);
  }

  @Override
  @JsonIgnore
  public String getOutputName()
  {
    return alias == null ? name : alias;
  }

  /**
   * key of this column in a row carrying columns of several sources
   */
  @JsonIgnore
  public String getQualifiedName()
  {
    return source + "." + name;
  }

  @Override
  public String toSql()
  {
    return SqlStrings.identifier(source) + "." + SqlStrings.identifier(name);
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
    ColumnRef that = (ColumnRef) o;
    return source.equals(that.source) && name.equals(that.name) && type == that.type
           && Objects.equals(alias, that.alias);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(source, name, type, alias);
  }

  @Override
  public String toString()
  {
    return alias == null ? getQualifiedName() : getQualifiedName() + " AS " + alias;
  }
}
