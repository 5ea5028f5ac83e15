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

import java.util.Objects;

/**
 * Pair of columns compared for equality in a join, left output name to right output name.
 */
public class JoinKey
{
  public static JoinKey of(String column)
  {
    return new JoinKey(column, column);
  }

  public static JoinKey of(String left, String right)
  {
    return new JoinKey(left, right);
  }

  private final String left;
  private final String right;

  private JoinKey(String left, String right)
  {
    this.left = Preconditions.checkNotNull(left, "'left' cannot be null");
    this.right = Preconditions.checkNotNull(right, "'right' cannot be null");
  }

  public String getLeft()
  {
    return left;
  }

  public String getRight()
  {
    return right;
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
    JoinKey that = (JoinKey) o;
    return left.equals(that.left) && right.equals(that.right);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(left, right);
  }

  @Override
  public String toString()
  {
    return left.equals(right) ? left : left + "=" + right;
  }
}
