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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import io.assetdb.metadata.TableRef;
import io.assetdb.query.aggregation.AggregateExpression;
import io.assetdb.query.aggregation.AggregateSpec;
import io.assetdb.query.expression.ColumnExpression;
import io.assetdb.query.filter.DimFilter;
import io.assetdb.query.filter.DimFilters;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable query handed to the execution layer. Reads either a fact table (optionally joined to a dimension on
 * the entity key) or the equi-join of two sub plans.
 * <p>
 * A fallback plan carries the raw filtered rows shape plus what the resampler needs to finish the aggregation:
 * frequency, timestamp column, group-by names and the aggregate spec.
 */
public class QueryPlan
{
  public static Builder builder()
  {
    return new Builder();
  }

  private final TableRef table;
  private final TableRef dimension;
  private final String entityKey;
  private final JoinSpec join;
  private final List<ColumnExpression> projection;
  private final List<ColumnExpression> groupBy;
  private final List<DimFilter> filters;
  private final String resampleFrequency;
  private final String timestampColumn;
  private final List<String> groupByNames;
  private final AggregateSpec aggregateSpec;

  private QueryPlan(
      TableRef table,
      TableRef dimension,
      String entityKey,
      JoinSpec join,
      List<ColumnExpression> projection,
      List<ColumnExpression> groupBy,
      List<DimFilter> filters,
      String resampleFrequency,
      String timestampColumn,
      List<String> groupByNames,
      AggregateSpec aggregateSpec
  )
  {
    Preconditions.checkArgument(table == null ^ join == null, "either table or join should be specified");
    Preconditions.checkArgument(dimension == null || entityKey != null, "dimension needs entity key");
    this.table = table;
    this.dimension = dimension;
    this.entityKey = entityKey;
    this.join = join;
    this.projection = ImmutableList.copyOf(projection);
    this.groupBy = ImmutableList.copyOf(groupBy);
    this.filters = ImmutableList.copyOf(filters);
    this.resampleFrequency = resampleFrequency;
    this.timestampColumn = timestampColumn;
    this.groupByNames = groupByNames == null ? Collections.emptyList() : ImmutableList.copyOf(groupByNames);
    this.aggregateSpec = aggregateSpec;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public TableRef getTable()
  {
    return table;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public TableRef getDimension()
  {
    return dimension;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String getEntityKey()
  {
    return entityKey;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public JoinSpec getJoin()
  {
    return join;
  }

  @JsonProperty
  public List<ColumnExpression> getProjection()
  {
    return projection;
  }

  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public List<ColumnExpression> getGroupBy()
  {
    return groupBy;
  }

  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public List<DimFilter> getFilters()
  {
    return filters;
  }

  /**
   * @return frequency to resample with after retrieval, null for push-down plans
   */
  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String getResampleFrequency()
  {
    return resampleFrequency;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String getTimestampColumn()
  {
    return timestampColumn;
  }

  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public List<String> getGroupByNames()
  {
    return groupByNames;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public AggregateSpec getAggregateSpec()
  {
    return aggregateSpec;
  }

  @JsonProperty
  public boolean isFallback()
  {
    return resampleFrequency != null;
  }

  @JsonIgnore
  public boolean isJoin()
  {
    return join != null;
  }

  @JsonIgnore
  public boolean isAggregate()
  {
    return Iterables.any(projection, expression -> expression instanceof AggregateExpression);
  }

  /**
   * @return conjunction of all filters, null if there is none
   */
  @Nullable
  @JsonIgnore
  public DimFilter getFilter()
  {
    return DimFilters.and(filters);
  }

  @JsonIgnore
  public List<String> getOutputNames()
  {
    return Lists.newArrayList(Lists.transform(projection, ColumnExpression::getOutputName));
  }

  @Nullable
  public ColumnExpression getOutput(String name)
  {
    for (ColumnExpression expression : projection) {
      if (expression.getOutputName().equals(name)) {
        return expression;
      }
    }
    return null;
  }

  public Builder toBuilder()
  {
    return new Builder(this);
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
    QueryPlan that = (QueryPlan) o;
    return Objects.equals(table, that.table) &&
           Objects.equals(dimension, that.dimension) &&
           Objects.equals(entityKey, that.entityKey) &&
           Objects.equals(join, that.join) &&
           projection.equals(that.projection) &&
           groupBy.equals(that.groupBy) &&
           filters.equals(that.filters) &&
           Objects.equals(resampleFrequency, that.resampleFrequency) &&
           Objects.equals(timestampColumn, that.timestampColumn) &&
           groupByNames.equals(that.groupByNames) &&
           Objects.equals(aggregateSpec, that.aggregateSpec);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(
        table, dimension, entityKey, join, projection, groupBy, filters,
        resampleFrequency, timestampColumn, groupByNames, aggregateSpec
    );
  }

  @Override
  public String toString()
  {
    StringBuilder builder = new StringBuilder("QueryPlan{");
    if (join != null) {
      builder.append("join=").append(join);
    } else {
      builder.append("table=").append(table.getQualifiedName());
      if (dimension != null) {
        builder.append(", dimension=").append(dimension.getQualifiedName());
      }
    }
    builder.append(", projection=").append(projection);
    if (!groupBy.isEmpty()) {
      builder.append(", groupBy=").append(groupBy);
    }
    if (!filters.isEmpty()) {
      builder.append(", filters=").append(filters);
    }
    if (resampleFrequency != null) {
      builder.append(", resampleFrequency=").append(resampleFrequency);
    }
    return builder.append('}').toString();
  }

  public static class Builder
  {
    private TableRef table;
    private TableRef dimension;
    private String entityKey;
    private JoinSpec join;
    private List<ColumnExpression> projection = Lists.newArrayList();
    private List<ColumnExpression> groupBy = Lists.newArrayList();
    private List<DimFilter> filters = Lists.newArrayList();
    private String resampleFrequency;
    private String timestampColumn;
    private List<String> groupByNames;
    private AggregateSpec aggregateSpec;

    private Builder()
    {
    }

    private Builder(QueryPlan plan)
    {
      table = plan.table;
      dimension = plan.dimension;
      entityKey = plan.entityKey;
      join = plan.join;
      projection = Lists.newArrayList(plan.projection);
      groupBy = Lists.newArrayList(plan.groupBy);
      filters = Lists.newArrayList(plan.filters);
      resampleFrequency = plan.resampleFrequency;
      timestampColumn = plan.timestampColumn;
      groupByNames = plan.groupByNames;
      aggregateSpec = plan.aggregateSpec;
    }

    public Builder table(TableRef table)
    {
      this.table = table;
      return this;
    }

    public Builder dimension(TableRef dimension, String entityKey)
    {
      this.dimension = dimension;
      this.entityKey = entityKey;
      return this;
    }

    public Builder join(JoinSpec join)
    {
      this.join = join;
      return this;
    }

    public Builder projection(List<? extends ColumnExpression> projection)
    {
      this.projection = Lists.newArrayList(projection);
      return this;
    }

    public Builder groupBy(List<? extends ColumnExpression> groupBy)
    {
      this.groupBy = Lists.newArrayList(groupBy);
      return this;
    }

    public Builder filter(@Nullable DimFilter filter)
    {
      if (filter != null) {
        filters.add(filter);
      }
      return this;
    }

    public Builder fallback(String resampleFrequency)
    {
      this.resampleFrequency = resampleFrequency;
      return this;
    }

    public Builder timestampColumn(String timestampColumn)
    {
      this.timestampColumn = timestampColumn;
      return this;
    }

    public Builder groupByNames(List<String> groupByNames)
    {
      this.groupByNames = groupByNames;
      return this;
    }

    public Builder aggregateSpec(AggregateSpec aggregateSpec)
    {
      this.aggregateSpec = aggregateSpec;
      return this;
    }

    public QueryPlan build()
    {
      return new QueryPlan(
          table,
          dimension,
          entityKey,
          join,
          projection,
          groupBy,
          filters,
          resampleFrequency,
          timestampColumn,
          groupByNames,
          aggregateSpec
      );
    }
  }
}
