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
import com.google.common.collect.ImmutableList;
import org.joda.time.DateTime;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/**
 * Plain projection over a fact table, optionally joined to a dimension.
 */
public class SelectRequest
{
  public static Builder builder(String table)
  {
    return new Builder(table);
  }

  private final String table;
  private final String schema;
  private final List<String> columns;
  private final String timestampColumn;
  private final String dimension;
  private final DateTime startTs;
  private final DateTime endTs;
  private final List<String> entities;

  private SelectRequest(
      String table,
      String schema,
      List<String> columns,
      String timestampColumn,
      String dimension,
      DateTime startTs,
      DateTime endTs,
      List<String> entities
  )
  {
    this.table = Preconditions.checkNotNull(table, "'table' cannot be null");
    this.schema = schema;
    this.columns = columns == null ? null : ImmutableList.copyOf(columns);
    this.timestampColumn = timestampColumn;
    this.dimension = dimension;
    this.startTs = startTs;
    this.endTs = endTs;
    this.entities = entities == null ? null : ImmutableList.copyOf(entities);
  }

  public String getTable()
  {
    return table;
  }

  @Nullable
  public String getSchema()
  {
    return schema;
  }

  /**
   * @return null to select every fact column plus the dimension columns
   */
  @Nullable
  public List<String> getColumns()
  {
    return columns;
  }

  @Nullable
  public String getTimestampColumn()
  {
    return timestampColumn;
  }

  @Nullable
  public String getDimension()
  {
    return dimension;
  }

  @Nullable
  public DateTime getStartTs()
  {
    return startTs;
  }

  @Nullable
  public DateTime getEndTs()
  {
    return endTs;
  }

  @Nullable
  public List<String> getEntities()
  {
    return entities;
  }

  public static class Builder
  {
    private final String table;
    private String schema;
    private List<String> columns;
    private String timestampColumn;
    private String dimension;
    private DateTime startTs;
    private DateTime endTs;
    private List<String> entities;

    private Builder(String table)
    {
      this.table = table;
    }

    public Builder schema(String schema)
    {
      this.schema = schema;
      return this;
    }

    public Builder columns(String... columns)
    {
      return columns(Arrays.asList(columns));
    }

    public Builder columns(List<String> columns)
    {
      this.columns = columns;
      return this;
    }

    public Builder timestampColumn(String timestampColumn)
    {
      this.timestampColumn = timestampColumn;
      return this;
    }

    public Builder dimension(String dimension)
    {
      this.dimension = dimension;
      return this;
    }

    public Builder interval(DateTime startTs, DateTime endTs)
    {
      this.startTs = startTs;
      this.endTs = endTs;
      return this;
    }

    public Builder entities(List<String> entities)
    {
      this.entities = entities;
      return this;
    }

    public SelectRequest build()
    {
      return new SelectRequest(table, schema, columns, timestampColumn, dimension, startTs, endTs, entities);
    }
  }
}
