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

import io.assetdb.metadata.ColumnMeta;
import io.assetdb.metadata.TableRef;

import javax.annotation.Nullable;

/**
 * Outcome of looking a column up on the fact table, then on the dimension table.
 */
public class ColumnResolution
{
  public enum Source
  {
    TABLE, DIMENSION, MISSING
  }

  /**
   * fact table first, then the dimension if one is given
   */
  public static ColumnResolution resolve(TableRef table, @Nullable TableRef dimension, String column)
  {
    ColumnMeta meta = table.getColumn(column);
    if (meta != null) {
      return new ColumnResolution(Source.TABLE, ColumnRef.of(table.getName(), column, meta.getType()));
    }
    if (dimension != null) {
      meta = dimension.getColumn(column);
      if (meta != null) {
        return new ColumnResolution(Source.DIMENSION, ColumnRef.of(dimension.getName(), column, meta.getType()));
      }
    }
    return new ColumnResolution(Source.MISSING, null);
  }

  private final Source source;
  private final ColumnRef column;

  private ColumnResolution(Source source, ColumnRef column)
  {
    this.source = source;
    this.column = column;
  }

  public Source getSource()
  {
    return source;
  }

  public boolean isFound()
  {
    return source != Source.MISSING;
  }

  /**
   * @return bound column, null when missing
   */
  @Nullable
  public ColumnRef getColumn()
  {
    return column;
  }
}
