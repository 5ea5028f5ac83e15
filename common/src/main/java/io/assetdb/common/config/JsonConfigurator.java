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

package io.assetdb.common.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.Maps;
import io.assetdb.java.util.common.IAE;
import io.assetdb.java.util.common.logger.Logger;

import java.io.IOException;
import java.util.Map;
import java.util.Properties;

/**
 * Binds prefixed properties to a jackson annotated config bean.
 * {@code assetdb.planner.entityKey=id} sets {@code entityKey} of the bean bound to prefix {@code assetdb.planner}.
 */
public class JsonConfigurator
{
  private static final Logger log = new Logger(JsonConfigurator.class);

  private final ObjectMapper jsonMapper;

  public JsonConfigurator(ObjectMapper jsonMapper)
  {
    this.jsonMapper = jsonMapper;
  }

  public <T> T configurate(Properties props, String propertyPrefix, Class<T> clazz)
  {
    // Make it end with a period so we only include properties with sub-object thingies.
    final String propertyBase = propertyPrefix.endsWith(".") ? propertyPrefix : propertyPrefix + ".";

    final Map<String, Object> values = Maps.newHashMap();
    for (String prop : props.stringPropertyNames()) {
      if (!prop.startsWith(propertyBase)) {
        continue;
      }
      final String propValue = props.getProperty(prop);
      Object value;
      try {
        // If it's a String Jackson wants it to be quoted, so check if it's not an object or array and quote.
        String modifiedPropValue = propValue;
        if (!(modifiedPropValue.startsWith("[") || modifiedPropValue.startsWith("{"))) {
          modifiedPropValue = jsonMapper.writeValueAsString(propValue);
        }
        value = jsonMapper.readValue(modifiedPropValue, Object.class);
      }
      catch (IOException e) {
        log.info(e, "Unable to parse [%s]=[%s] as a json object, using as is.", prop, propValue);
        value = propValue;
      }
      values.put(prop.substring(propertyBase.length()), value);
    }

    try {
      final T config = jsonMapper.convertValue(values, clazz);
      log.info("Loaded class[%s] from props[%s] as [%s]", clazz, propertyBase, config);
      return config;
    }
    catch (IllegalArgumentException e) {
      throw new IAE(e, "Unable to bind properties[%s] to class[%s]", propertyBase, clazz.getName());
    }
  }
}
