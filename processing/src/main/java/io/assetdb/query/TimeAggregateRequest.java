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
import java.util.Collections;
import java.util.List;

/**
 * Regular aggregate of one column combined with the first or last timestamp of each bucket.
 * The regular side is bucketed at {@code regularGrain}, the raw timestamp when unset, and the timestamp side
 * at {@code timeGrain}.
 */
public class TimeAggregateRequest
{
  public static Builder builder(String table, String column)
  {
    return new Builder(table, column);
  }

  private final String table;
  private final String schema;
  private final String column;
  private final String regularAggregate;
  private final String timeAggregate;
  private final List<String> groupBy;
  private final String timestampColumn;
  private final String timeGrain;
  private final String regularGrain;
  private final String dimension;
  private final DateTime startTs;
  private final DateTime endTs;
  private final List<String> entities;
  private final String output;

  private TimeAggregateRequest(Builder builder)
  {
    this.table = Preconditions.checkNotNull(builder.table, "'table' cannot be null");
    this.column = Preconditions.checkNotNull(builder.column, "'column' cannot be null");
    this.regularAggregate = Preconditions.checkNotNull(builder.regularAggregate, "'regularAggregate' cannot be null");
    this.timeAggregate = Preconditions.checkNotNull(builder.timeAggregate, "'timeAggregate' cannot be null");
    this.schema = builder.schema;
    this.groupBy = builder.groupBy == null ? Collections.emptyList() : ImmutableList.copyOf(builder.groupBy);
    this.timestampColumn = builder.timestampColumn;
    this.timeGrain = builder.timeGrain;
    this.regularGrain = builder.regularGrain;
    this.dimension = builder.dimension;
    this.startTs = builder.startTs;
    this.endTs = builder.endTs;
    this.entities = builder.entities == null ? null : ImmutableList.copyOf(builder.entities);
    this.output = builder.output;
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

  public String getColumn()
  {
    return column;
  }

  public String getRegularAggregate()
  {
    return regularAggregate;
  }

  /**
   * first or last
   */
  public String getTimeAggregate()
  {
    return timeAggregate;
  }

  public List<String> getGroupBy()
  {
    return groupBy;
  }

  @Nullable
  public String getTimestampColumn()
  {
    return timestampColumn;
  }

  @Nullable
  public String getTimeGrain()
  {
    return timeGrain;
  }

  @Nullable
  public String getRegularGrain()
  {
    return regularGrain;
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

  /**
   * @return output name of the regular aggregate, null for the default
   */
  @Nullable
  public String getOutput()
  {
    return output;
  }

  public static class Builder
  {
    private final String table;
    private final String column;
    private String schema;
    private String regularAggregate;
    private String timeAggregate;
    private List<String> groupBy;
    private String timestampColumn;
    private String timeGrain;
    private String regularGrain;
    private String dimension;
    private DateTime startTs;
    private DateTime endTs;
    private List<String> entities;
    private String output;

    private Builder(String table, String column)
    {
      this.table = table;
      this.column = column;
    }

    public Builder schema(String schema)
    {
      this.schema = schema;
      return this;
    }

    public Builder aggregates(String regularAggregate, String timeAggregate)
    {
      this.regularAggregate = regularAggregate;
      this.timeAggregate = timeAggregate;
      return this;
    }

    public Builder groupBy(String... groupBy)
    {
      this.groupBy = Arrays.asList(groupBy);
      return this;
    }

    public Builder groupBy(List<String> groupBy)
    {
      this.groupBy = groupBy;
      return this;
    }

    public Builder timestampColumn(String timestampColumn)
    {
      this.timestampColumn = timestampColumn;
      return this;
    }

    public Builder timeGrain(String timeGrain)
    {
      this.timeGrain = timeGrain;
      return this;
    }

    public Builder regularGrain(String regularGrain)
    {
      this.regularGrain = regularGrain;
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

    public Builder output(String output)
    {
      this.output = output;
      return this;
    }

    public TimeAggregateRequest build()
    {
      return new TimeAggregateRequest(this);
    }
  }
}
