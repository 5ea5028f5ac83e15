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

import com.google.common.collect.ImmutableMap;

import java.util.Arrays;
import java.util.Map;

/**
 */
public class TableResolvers
{
  /**
   * resolver over a fixed set of tables. a null schema in the request matches any schema.
   */
  public static TableResolver of(TableRef... tables)
  {
    return of(Arrays.asList(tables));
  }

  public static TableResolver of(Iterable<TableRef> tables)
  {
    final ImmutableMap.Builder<String, TableRef> builder = ImmutableMap.builder();
    for (TableRef table : tables) {
      builder.put(table.getQualifiedName(), table);
    }
    final Map<String, TableRef> mapping = builder.build();
    return (name, schema) -> {
      if (schema != null) {
        return mapping.get(schema + "." + name);
      }
      for (TableRef table : mapping.values()) {
        if (table.getName().equals(name)) {
          return table;
        }
      }
      return null;
    };
  }

  public static CachingTableResolver caching(TableResolver resolver)
  {
    if (resolver instanceof CachingTableResolver) {
      return (CachingTableResolver) resolver;
    }
    return new CachingTableResolver(resolver);
  }

  private TableResolvers()
  {
  }
}
