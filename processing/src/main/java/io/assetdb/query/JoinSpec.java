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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Equi-join of two independently executed plans. Left rows are exposed under {@link #LEFT_ALIAS}, right rows
 * under {@link #RIGHT_ALIAS}.
 */
public class JoinSpec
{
  public static final String LEFT_ALIAS = "a";
  public static final String RIGHT_ALIAS = "b";

  private final QueryPlan left;
  private final QueryPlan right;
  private final List<String> leftJoinColumns;
  private final List<String> rightJoinColumns;
  private final Map<String, String> rightAliases;

  public JoinSpec(
      QueryPlan left,
      QueryPlan right,
      List<String> leftJoinColumns,
      List<String> rightJoinColumns,
      Map<String, String> rightAliases
  )
  {
    this.left = Preconditions.checkNotNull(left, "'left' cannot be null");
    this.right = Preconditions.checkNotNull(right, "'right' cannot be null");
    this.leftJoinColumns = ImmutableList.copyOf(leftJoinColumns);
    this.rightJoinColumns = ImmutableList.copyOf(rightJoinColumns);
    Preconditions.checkArgument(
        this.leftJoinColumns.size() == this.rightJoinColumns.size(),
        "join columns should be paired"
    );
    this.rightAliases = ImmutableMap.copyOf(rightAliases);
  }

  @JsonProperty
  public QueryPlan getLeft()
  {
    return left;
  }

  @JsonProperty
  public QueryPlan getRight()
  {
    return right;
  }

  @JsonProperty
  public List<String> getLeftJoinColumns()
  {
    return leftJoinColumns;
  }

  @JsonProperty
  public List<String> getRightJoinColumns()
  {
    return rightJoinColumns;
  }

  /**
   * right hand output name to the name it takes in the joined output, in projection order
   */
  @JsonProperty
  public Map<String, String> getRightAliases()
  {
    return rightAliases;
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
    JoinSpec that = (JoinSpec) o;
    return left.equals(that.left) &&
           right.equals(that.right) &&
           leftJoinColumns.equals(that.leftJoinColumns) &&
           rightJoinColumns.equals(that.rightJoinColumns) &&
           rightAliases.equals(that.rightAliases);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(left, right, leftJoinColumns, rightJoinColumns, rightAliases);
  }

  @Override
  public String toString()
  {
    return "JoinSpec{" +
           "leftJoinColumns=" + leftJoinColumns +
           ", rightJoinColumns=" + rightJoinColumns +
           ", rightAliases=" + rightAliases +
           '}';
  }
}
