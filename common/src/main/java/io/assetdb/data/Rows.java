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

import io.assetdb.java.util.common.IAE;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import javax.annotation.Nullable;
import java.util.Date;

/**
 * value coercions shared by filters, bucketing and local evaluation
 */
public class Rows
{
  @Nullable
  public static DateTime toDateTime(@Nullable Object value, DateTimeZone timeZone)
  {
    if (value == null) {
      return null;
    }
    if (value instanceof DateTime) {
      return ((DateTime) value).withZone(timeZone);
    }
    if (value instanceof Date) {
      return new DateTime(((Date) value).getTime(), timeZone);
    }
    if (value instanceof Number) {
      return new DateTime(((Number) value).longValue(), timeZone);
    }
    if (value instanceof String) {
      return new DateTime(value, timeZone);
    }
    throw new IAE("Cannot convert [%s] of %s to timestamp", value, value.getClass().getSimpleName());
  }

  @Nullable
  public static Double toDouble(@Nullable Object value)
  {
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof String) {
      String string = ((String) value).trim();
      return string.isEmpty() ? null : Double.valueOf(string);
    }
    throw new IAE("Cannot convert [%s] of %s to number", value, value.getClass().getSimpleName());
  }

  private static boolean isTime(Object value)
  {
    return value instanceof DateTime || value instanceof Date;
  }

  private static long toMillis(Object value)
  {
    return value instanceof DateTime ? ((DateTime) value).getMillis() : ((Date) value).getTime();
  }

  /**
   * null first. timestamps compare by instant regardless of zone.
   */
  @SuppressWarnings("unchecked")
  public static int compare(@Nullable Object left, @Nullable Object right)
  {
    if (left == right) {
      return 0;
    }
    if (left == null) {
      return -1;
    }
    if (right == null) {
      return 1;
    }
    if (isTime(left) || isTime(right)) {
      return Long.compare(toMillis(toTime(left)), toMillis(toTime(right)));
    }
    if (left instanceof Number && right instanceof Number) {
      return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
    }
    if (left.getClass() == right.getClass() && left instanceof Comparable) {
      return ((Comparable) left).compareTo(right);
    }
    return String.valueOf(left).compareTo(String.valueOf(right));
  }

  private static Object toTime(Object value)
  {
    return isTime(value) ? value : toDateTime(value, DateTimeZone.UTC);
  }

  /**
   * canonical form for equality on grouping and join keys
   */
  @Nullable
  public static Object normalize(@Nullable Object value)
  {
    if (isTime(value)) {
      return new DateTime(toMillis(value), DateTimeZone.UTC);
    }
    if (value instanceof Number) {
      double doubleValue = ((Number) value).doubleValue();
      if (doubleValue == Math.rint(doubleValue) && !Double.isInfinite(doubleValue)) {
        return (long) doubleValue;
      }
      return doubleValue;
    }
    return value;
  }

  private Rows()
  {
  }
}
