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

import com.google.common.base.Preconditions;
import io.assetdb.java.util.common.logger.Logger;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caches resolved tables per (name, schema) for the life of a connection context.
 * Lookups that miss are not cached.
 */
public class CachingTableResolver implements TableResolver
{
  private static final Logger LOG = new Logger(CachingTableResolver.class);

  private final TableResolver delegate;
  private final ConcurrentMap<TableKey, TableRef> cache = new ConcurrentHashMap<>();

  public CachingTableResolver(TableResolver delegate)
  {
    this.delegate = Preconditions.checkNotNull(delegate, "'delegate' cannot be null");
  }

  @Nullable
  @Override
  public TableRef resolve(String name, @Nullable String schema)
  {
    return cache.computeIfAbsent(new TableKey(name, schema), this::load);
  }

  private TableRef load(TableKey key)
  {
    TableRef resolved = delegate.resolve(key.name, key.schema);
    if (resolved != null) {
      LOG.debug("Resolved table %s", resolved.getQualifiedName());
    }
    return resolved;
  }

  public int size()
  {
    return cache.size();
  }

  public void clear()
  {
    cache.clear();
  }

  private static final class TableKey
  {
    private final String name;
    private final String schema;

    private TableKey(String name, String schema)
    {
      this.name = Preconditions.checkNotNull(name, "'name' cannot be null");
      this.schema = schema;
    }

    @Override
    public boolean equals(Object o)
    {
      if (!(o instanceof TableKey)) {
        return false;
      }
      TableKey other = (TableKey) o;
      return name.equals(other.name) && Objects.equals(schema, other.schema);
    }

    @Override
    public int hashCode()
    {
      return Objects.hash(name, schema);
    }
  }
}
