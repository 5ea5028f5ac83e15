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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.assetdb.query.aggregation.AggregateSpec;
import org.joda.time.DateTime;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Declarative aggregation over a fact table: which aggregates, grouped by what, at which time grain,
 * restricted to which time range and entities.
 */
public class AggregateRequest
{
  public static Builder builder(String table, AggregateSpec aggregates)
  {
    return new Builder(table, aggregates);
  }

  private final String table;
  private final String schema;
  private final AggregateSpec aggregates;
  private final List<String> groupBy;
  private final String timestampColumn;
  private final String timeGrain;
  private final String dimension;
  private final DateTime startTs;
  private final DateTime endTs;
  private final List<String> entities;

  @JsonCreator
  public AggregateRequest(
      @JsonProperty("table") String table,
      @JsonProperty("schema") @Nullable String schema,
      @JsonProperty("aggregates") AggregateSpec aggregates,
      @JsonProperty("groupBy") @Nullable List<String> groupBy,
      @JsonProperty("timestampColumn") @Nullable String timestampColumn,
      @JsonProperty("timeGrain") @Nullable String timeGrain,
      @JsonProperty("dimension") @Nullable String dimension,
      @JsonProperty("startTs") @Nullable DateTime startTs,
      @JsonProperty("endTs") @Nullable DateTime endTs,
      @JsonProperty("entities") @Nullable List<String> entities
  )
  {
    this.table = Preconditions.checkNotNull(table, "'table' cannot be null");
    this.schema = schema;
    this.aggregates = Preconditions.checkNotNull(aggregates, "'aggregates' cannot be null");
    Preconditions.checkArgument(!aggregates.isEmpty(), "no aggregates requested");
    this.groupBy = groupBy == null ? Collections.emptyList() : ImmutableList.copyOf(groupBy);
    this.timestampColumn = timestampColumn;
    this.timeGrain = timeGrain;
    this.dimension = dimension;
    this.startTs = startTs;
    this.endTs = endTs;
    this.entities = entities == null ? null : ImmutableList.copyOf(entities);
  }

  @JsonProperty
  public String getTable()
  {
    return table;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String getSchema()
  {
    return schema;
  }

  @JsonProperty
  public AggregateSpec getAggregates()
  {
    return aggregates;
  }

  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public List<String> getGroupBy()
  {
    return groupBy;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String getTimestampColumn()
  {
    return timestampColumn;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String getTimeGrain()
  {
    return timeGrain;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String getDimension()
  {
    return dimension;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public DateTime getStartTs()
  {
    return startTs;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public DateTime getEndTs()
  {
    return endTs;
  }

  /**
   * @return entity ids to restrict to, null for all entities
   */
  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public List<String> getEntities()
  {
    return entities;
  }

  public Builder toBuilder()
  {
    return new Builder(table, aggregates)
        .schema(schema)
        .groupBy(groupBy)
        .timestampColumn(timestampColumn)
        .timeGrain(timeGrain)
        .dimension(dimension)
        .interval(startTs, endTs)
        .entities(entities);
  }

  @Override
  public String toString()
  {
    return "AggregateRequest{" +
           "table='" + table + '\'' +
           ", aggregates=" + aggregates +
           (groupBy.isEmpty() ? "" : ", groupBy=" + groupBy) +
           (timeGrain == null ? "" : ", timeGrain='" + timeGrain + '\'') +
           (dimension == null ? "" : ", dimension='" + dimension + '\'') +
           '}';
  }

  public static class Builder
  {
    private final String table;
    private final AggregateSpec aggregates;
    private String schema;
    private List<String> groupBy;
    private String timestampColumn;
    private String timeGrain;
    private String dimension;
    private DateTime startTs;
    private DateTime endTs;
    private List<String> entities;

    private Builder(String table, AggregateSpec aggregates)
    {
      this.table = table;
      this.aggregates = aggregates;
    }

    public Builder schema(String schema)
    {
      this.schema = schema;
      return this;
    }

    public Builder groupBy(String... groupBy)
    {
      return groupBy(Arrays.asList(groupBy));
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

    public Builder dimension(String dimension)
    {
      this.dimension = dimension;
      return this;
    }

    /**
     * @param startTs inclusive, nullable
     * @param endTs   exclusive, nullable
     */
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

    public AggregateRequest build()
    {
      return new AggregateRequest(
          table,
          schema,
          aggregates,
          groupBy,
          timestampColumn,
          timeGrain,
          dimension,
          startTs,
          endTs,
          entities
      );
    }
  }
}
