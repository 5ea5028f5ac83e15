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

package io.assetdb.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.assetdb.java.util.common.StringUtils;

/**
 * semantic type of a stored column
 */
public enum ValueType
{
  NUMERIC,
  TEXT,
  TIMESTAMP,
  BOOLEAN,
  OTHER;

  @JsonValue
  public String getName()
  {
    return StringUtils.toLowerCase(name());
  }

  @JsonCreator
  public static ValueType fromString(String name)
  {
    if (name == null) {
      return null;
    }
    switch (StringUtils.toLowerCase(name)) {
      case "numeric":
      case "number":
      case "double":
      case "float":
      case "long":
      case "integer":
      case "decimal":
        return NUMERIC;
      case "text":
      case "string":
      case "varchar":
        return TEXT;
      case "timestamp":
      case "datetime":
        return TIMESTAMP;
      case "boolean":
        return BOOLEAN;
      default:
        return OTHER;
    }
  }
}
