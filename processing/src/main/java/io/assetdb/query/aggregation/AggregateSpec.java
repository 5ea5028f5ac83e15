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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import io.assetdb.java.util.common.IAE;
import io.assetdb.java.util.common.logger.Logger;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregate kinds requested per column, e.g. {@code {"temp": "mean", "pressure": ["min", "max"]}}, with optional
 * output names keyed by (column, kind).
 */
public class AggregateSpec
{
  private static final Logger LOG = new Logger(AggregateSpec.class);

  public static Builder builder()
  {
    return new Builder();
  }

  /**
   * @param aggregates column to a single kind name or a list of kind names
   */
  public static AggregateSpec of(Map<String, ?> aggregates)
  {
    return of(aggregates, null);
  }

  /**
   * @param aggregates column to a single kind name or a list of kind names
   * @param outputs    column to output names, positionally matched to the listed kinds
   */
  public static AggregateSpec of(Map<String, ?> aggregates, @Nullable Map<String, List<String>> outputs)
  {
    Builder builder = parse(aggregates);
    if (outputs != null) {
      for (Map.Entry<String, List<String>> entry : outputs.entrySet()) {
        builder.outputs(entry.getKey(), entry.getValue());
      }
    }
    return builder.build();
  }

  private static Builder parse(Map<String, ?> aggregates)
  {
    Builder builder = new Builder();
    for (Map.Entry<String, ?> entry : aggregates.entrySet()) {
      Object value = entry.getValue();
      if (value instanceof String) {
        builder.add(entry.getKey(), (String) value);
      } else if (value instanceof List) {
        List<String> kinds = Lists.newArrayList();
        for (Object kind : (List<?>) value) {
          kinds.add(String.valueOf(kind));
        }
        builder.addList(entry.getKey(), kinds);
      } else {
        throw new IAE(
            "Aggregate dictionary is not in the correct form for [%s]. "
            + "Supply a single aggregate function as a string or a list of strings.", entry.getKey()
        );
      }
    }
    return builder;
  }

  private final Map<String, List<AggregateKind>> aggregates;
  private final Map<String, Map<AggregateKind, String>> outputs;
  private final Set<String> listed;

  private AggregateSpec(
      Map<String, List<AggregateKind>> aggregates,
      Map<String, Map<AggregateKind, String>> outputs,
      Set<String> listed
  )
  {
    this.aggregates = aggregates;
    this.outputs = outputs;
    this.listed = listed;
  }

  @JsonCreator
  public static AggregateSpec fromJson(
      @JsonProperty("aggregates") Map<String, Object> aggregates,
      @JsonProperty("outputs") @Nullable Map<String, Map<String, String>> outputs
  )
  {
    Builder builder = parse(Preconditions.checkNotNull(aggregates, "'aggregates' cannot be null"));
    if (outputs != null) {
      for (Map.Entry<String, Map<String, String>> entry : outputs.entrySet()) {
        for (Map.Entry<String, String> output : entry.getValue().entrySet()) {
          builder.output(entry.getKey(), AggregateKind.fromString(output.getKey()), output.getValue());
        }
      }
    }
    return builder.build();
  }

  public List<String> getColumns()
  {
    return ImmutableList.copyOf(aggregates.keySet());
  }

  public List<AggregateKind> getKinds(String column)
  {
    List<AggregateKind> kinds = aggregates.get(column);
    return kinds == null ? Collections.emptyList() : kinds;
  }

  /**
   * @return true if the kinds for the column were given in list form, even a list of one. Listed aggregates are
   * named per (column, kind) while a single string form keeps the column name as its output.
   */
  public boolean isListed(String column)
  {
    return listed.contains(column);
  }

  /**
   * @return explicitly given output name, or null
   */
  @Nullable
  public String getOutput(String column, AggregateKind kind)
  {
    Map<AggregateKind, String> mapping = outputs.get(column);
    return mapping == null ? null : mapping.get(kind);
  }

  public boolean isEmpty()
  {
    return aggregates.isEmpty();
  }

  @JsonProperty("aggregates")
  public Map<String, Object> getAggregatesForJson()
  {
    Map<String, Object> json = Maps.newLinkedHashMap();
    for (Map.Entry<String, List<AggregateKind>> entry : aggregates.entrySet()) {
      List<AggregateKind> kinds = entry.getValue();
      if (listed.contains(entry.getKey()) || kinds.size() != 1) {
        json.put(entry.getKey(), Lists.transform(kinds, AggregateKind::getName));
      } else {
        json.put(entry.getKey(), kinds.get(0).getName());
      }
    }
    return json;
  }

  @JsonProperty("outputs")
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public Map<String, Map<String, String>> getOutputsForJson()
  {
    Map<String, Map<String, String>> json = Maps.newLinkedHashMap();
    for (Map.Entry<String, Map<AggregateKind, String>> entry : outputs.entrySet()) {
      Map<String, String> mapping = Maps.newLinkedHashMap();
      for (Map.Entry<AggregateKind, String> output : entry.getValue().entrySet()) {
        mapping.put(output.getKey().getName(), output.getValue());
      }
      json.put(entry.getKey(), mapping);
    }
    return json;
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
    AggregateSpec that = (AggregateSpec) o;
    return aggregates.equals(that.aggregates) && outputs.equals(that.outputs) && listed.equals(that.listed);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(aggregates, outputs, listed);
  }

  @Override
  public String toString()
  {
    String kinds = listed.isEmpty() ? aggregates.toString() : aggregates + " listed " + listed;
    return outputs.isEmpty() ? kinds : kinds + " outputs " + outputs;
  }

  public static class Builder
  {
    private final Map<String, List<AggregateKind>> aggregates = Maps.newLinkedHashMap();
    private final Map<String, Map<AggregateKind, String>> outputs = Maps.newLinkedHashMap();
    private final Map<String, List<String>> positional = Maps.newLinkedHashMap();
    private final Set<String> listed = Sets.newHashSet();

    /**
     * more than one kind, or a second call on the same column, makes the column a listed one
     */
    public Builder add(String column, String... kinds)
    {
      AggregateKind[] resolved = new AggregateKind[kinds.length];
      for (int i = 0; i < kinds.length; i++) {
        resolved[i] = AggregateKind.fromString(kinds[i]);
      }
      return add(column, resolved);
    }

    public Builder add(String column, AggregateKind... kinds)
    {
      Preconditions.checkNotNull(column, "'column' cannot be null");
      List<AggregateKind> current = aggregates.computeIfAbsent(column, k -> Lists.newArrayList());
      if (!current.isEmpty() || kinds.length > 1) {
        listed.add(column);
      }
      current.addAll(Lists.newArrayList(kinds));
      return this;
    }

    /**
     * list form, e.g. {@code "energy": ["sum"]}, which names outputs per kind even for a single entry
     */
    public Builder addList(String column, List<String> kinds)
    {
      add(column, kinds.toArray(new String[0]));
      listed.add(column);
      return this;
    }

    public Builder output(String column, AggregateKind kind, String output)
    {
      outputs.computeIfAbsent(column, k -> Maps.newEnumMap(AggregateKind.class)).put(kind, output);
      return this;
    }

    /**
     * legacy form: output names matched by position to the kinds listed for the column
     */
    public Builder outputs(String column, List<String> names)
    {
      positional.put(column, ImmutableList.copyOf(names));
      return this;
    }

    public AggregateSpec build()
    {
      for (Map.Entry<String, List<String>> entry : positional.entrySet()) {
        String column = entry.getKey();
        List<String> names = entry.getValue();
        List<AggregateKind> kinds = aggregates.getOrDefault(column, Collections.emptyList());
        if (names.size() != kinds.size()) {
          LOG.warn(
              "%d output names supplied for %d aggregates on %s. Defaults are used where names are missing.",
              names.size(), kinds.size(), column
          );
        }
        for (int i = 0; i < Math.min(names.size(), kinds.size()); i++) {
          outputs.computeIfAbsent(column, k -> Maps.newEnumMap(AggregateKind.class))
                 .putIfAbsent(kinds.get(i), names.get(i));
        }
      }
      ImmutableMap.Builder<String, List<AggregateKind>> kinds = ImmutableMap.builder();
      for (Map.Entry<String, List<AggregateKind>> entry : aggregates.entrySet()) {
        kinds.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
      }
      ImmutableMap.Builder<String, Map<AggregateKind, String>> names = ImmutableMap.builder();
      for (Map.Entry<String, Map<AggregateKind, String>> entry : outputs.entrySet()) {
        names.put(entry.getKey(), Collections.unmodifiableMap(Maps.newEnumMap(entry.getValue())));
      }
      return new AggregateSpec(kinds.build(), names.build(), ImmutableSet.copyOf(listed));
    }
  }
}
