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
import io.assetdb.java.util.common.IAE;
import org.joda.time.DateTimeZone;

import java.util.Map;
import java.util.Objects;

public class PlannerConfig
{
  public static final String CTX_KEY_DUMP_PLAN = "dumpPlan";
  public static final String CTX_KEY_UNIQUE_OUTPUT_NAMES = "uniqueOutputNames";
  public static final String CTX_KEY_SAMPLE_STDDEV = "sampleStdDev";

  @JsonProperty
  private String entityKey = "deviceid";

  @JsonProperty
  private String defaultSchema = null;

  @JsonProperty
  private DateTimeZone timeZone = DateTimeZone.UTC;

  @JsonProperty
  private boolean dumpPlan = false;

  @JsonProperty
  private boolean uniqueOutputNames = true;

  @JsonProperty
  private boolean sampleStdDev = true;

  /**
   * column joining fact rows to dimension rows, also the target of entity filters
   */
  public String getEntityKey()
  {
    return entityKey;
  }

  public String getDefaultSchema()
  {
    return defaultSchema;
  }

  public DateTimeZone getTimeZone()
  {
    return timeZone;
  }

  public boolean isDumpPlan()
  {
    return dumpPlan;
  }

  public boolean isUniqueOutputNames()
  {
    return uniqueOutputNames;
  }

  public boolean isSampleStdDev()
  {
    return sampleStdDev;
  }

  public PlannerConfig withOverrides(final Map<String, Object> context)
  {
    if (context == null || context.isEmpty()) {
      return this;
    }

    final PlannerConfig newConfig = new PlannerConfig();
    newConfig.entityKey = getEntityKey();
    newConfig.defaultSchema = getDefaultSchema();
    newConfig.timeZone = getTimeZone();
    newConfig.dumpPlan = getContextBoolean(context, CTX_KEY_DUMP_PLAN, isDumpPlan());
    newConfig.uniqueOutputNames = getContextBoolean(context, CTX_KEY_UNIQUE_OUTPUT_NAMES, isUniqueOutputNames());
    newConfig.sampleStdDev = getContextBoolean(context, CTX_KEY_SAMPLE_STDDEV, isSampleStdDev());
    return newConfig;
  }

  private static boolean getContextBoolean(
      final Map<String, Object> context,
      final String parameter,
      final boolean defaultValue
  )
  {
    final Object value = context.get(parameter);
    if (value == null) {
      return defaultValue;
    } else if (value instanceof String) {
      return Boolean.parseBoolean((String) value);
    } else if (value instanceof Boolean) {
      return (Boolean) value;
    } else {
      throw new IAE("Expected parameter[%s] to be boolean", parameter);
    }
  }

  @Override
  public boolean equals(final Object o)
  {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final PlannerConfig that = (PlannerConfig) o;
    return dumpPlan == that.dumpPlan &&
           uniqueOutputNames == that.uniqueOutputNames &&
           sampleStdDev == that.sampleStdDev &&
           Objects.equals(entityKey, that.entityKey) &&
           Objects.equals(defaultSchema, that.defaultSchema) &&
           Objects.equals(timeZone, that.timeZone);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(entityKey, defaultSchema, timeZone, dumpPlan, uniqueOutputNames, sampleStdDev);
  }

  @Override
  public String toString()
  {
    return "PlannerConfig{" +
           "entityKey='" + entityKey + '\'' +
           ", defaultSchema='" + defaultSchema + '\'' +
           ", timeZone=" + timeZone +
           ", dumpPlan=" + dumpPlan +
           ", uniqueOutputNames=" + uniqueOutputNames +
           ", sampleStdDev=" + sampleStdDev +
           '}';
  }
}
