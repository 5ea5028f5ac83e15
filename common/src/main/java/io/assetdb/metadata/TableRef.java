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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import io.assetdb.data.ValueType;
import io.assetdb.java.util.common.IAE;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved shape of a fact or dimension table. Immutable once built.
 */
public class TableRef
{
  public static Builder builder(String name)
  {
    return new Builder(name);
  }

  private final String name;
  private final String schema;
  private final Map<String, ColumnMeta> columns;

  @JsonCreator
  public TableRef(
      @JsonProperty("name") String name,
      @JsonProperty("schema") @Nullable String schema,
      @JsonProperty("columns") List<ColumnMeta> columns
  )
  {
    this.name = Preconditions.checkNotNull(name, "'name' cannot be null");
    this.schema = schema;
    Map<String, ColumnMeta> mapping = Maps.newLinkedHashMap();
    for (ColumnMeta column : Preconditions.checkNotNull(columns, "'columns' cannot be null")) {
      if (mapping.put(column.getName(), column) != null) {
        throw new IAE("duplicate column [%s] in table [%s]", column.getName(), name);
      }
    }
    this.columns = Collections.unmodifiableMap(mapping);
  }

  @JsonProperty
  public String getName()
  {
    return name;
  }

  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String getSchema()
  {
    return schema;
  }

  @JsonProperty
  public List<ColumnMeta> getColumns()
  {
    return ImmutableList.copyOf(columns.values());
  }

  @JsonIgnore
  public String getQualifiedName()
  {
    return schema == null ? name : schema + "." + name;
  }

  @Nullable
  public ColumnMeta getColumn(String column)
  {
    return columns.get(column);
  }

  public boolean hasColumn(String column)
  {
    return columns.containsKey(column);
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
    TableRef that = (TableRef) o;
    return name.equals(that.name) && Objects.equals(schema, that.schema) && columns.equals(that.columns);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(name, schema, columns);
  }

  @Override
  public String toString()
  {
    return getQualifiedName() + columns.values();
  }

  public static class Builder
  {
    private final String name;
    private String schema;
    private final List<ColumnMeta> columns = Lists.newArrayList();

    private Builder(String name)
    {
      this.name = name;
    }

    public Builder schema(String schema)
    {
      this.schema = schema;
      return this;
    }

    public Builder column(String column, ValueType type)
    {
      columns.add(ColumnMeta.of(column, type));
      return this;
    }

    public TableRef build()
    {
      return new TableRef(name, schema, columns);
    }
  }
}
