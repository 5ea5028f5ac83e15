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

package io.assetdb.query.sql;

import io.assetdb.java.util.common.StringUtils;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

import java.util.Date;
import java.util.regex.Pattern;

/**
 */
public class SqlStrings
{
  private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss.SSS")
                                                                          .withZoneUTC();

  public static String identifier(String name)
  {
    return SIMPLE_IDENTIFIER.matcher(name).matches() ? name : StringUtils.identifier(name);
  }

  // timestamps are bound in UTC
  public static String literal(Object value)
  {
    if (value == null) {
      return "NULL";
    }
    if (value instanceof DateTime) {
      return "TIMESTAMP " + StringUtils.literal(TIMESTAMP_FORMAT.print((DateTime) value));
    }
    if (value instanceof Date) {
      return literal(new DateTime(((Date) value).getTime(), DateTimeZone.UTC));
    }
    if (value instanceof Number) {
      return value.toString();
    }
    if (value instanceof Boolean) {
      return (Boolean) value ? "TRUE" : "FALSE";
    }
    return StringUtils.literal(String.valueOf(value));
  }

  private SqlStrings()
  {
  }
}
