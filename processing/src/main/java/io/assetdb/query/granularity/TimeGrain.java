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

package io.assetdb.query.granularity;

import com.google.common.base.Preconditions;
import io.assetdb.java.util.common.StringUtils;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed time grain token. {@code <N>min}, {@code <N>H}, {@code day}, {@code week}, {@code month} and {@code year}
 * have a unit. Any other token is kept as an opaque resampling frequency.
 */
public class TimeGrain
{
  public enum Unit
  {
    MINUTE, HOUR, DAY, WEEK, MONTH, YEAR;

    public String getName()
    {
      return StringUtils.toLowerCase(name());
    }
  }

  private static final Pattern MINUTES = Pattern.compile("([1-9][0-9]*)min");
  private static final Pattern HOURS = Pattern.compile("([1-9][0-9]*)H");

  public static TimeGrain parse(String token)
  {
    Preconditions.checkNotNull(token, "'token' cannot be null");
    Matcher matcher = MINUTES.matcher(token);
    if (matcher.matches()) {
      return of(token, Unit.MINUTE, matcher.group(1));
    }
    matcher = HOURS.matcher(token);
    if (matcher.matches()) {
      return of(token, Unit.HOUR, matcher.group(1));
    }
    switch (token) {
      case "day":
        return new TimeGrain(token, Unit.DAY, 1);
      case "week":
        return new TimeGrain(token, Unit.WEEK, 1);
      case "month":
        return new TimeGrain(token, Unit.MONTH, 1);
      case "year":
        return new TimeGrain(token, Unit.YEAR, 1);
      default:
        return new TimeGrain(token, null, 0);
    }
  }

  private static TimeGrain of(String token, Unit unit, String multiple)
  {
    try {
      return new TimeGrain(token, unit, Integer.parseInt(multiple));
    }
    catch (NumberFormatException e) {
      // too many digits for an int
      return new TimeGrain(token, null, 0);
    }
  }

  private final String token;
  private final Unit unit;
  private final int multiple;

  private TimeGrain(String token, @Nullable Unit unit, int multiple)
  {
    this.token = token;
    this.unit = unit;
    this.multiple = multiple;
  }

  public String getToken()
  {
    return token;
  }

  /**
   * @return null for opaque tokens
   */
  @Nullable
  public Unit getUnit()
  {
    return unit;
  }

  public int getMultiple()
  {
    return multiple;
  }

  public boolean isOpaque()
  {
    return unit == null;
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
    TimeGrain that = (TimeGrain) o;
    return multiple == that.multiple && token.equals(that.token) && unit == that.unit;
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(token, unit, multiple);
  }

  @Override
  public String toString()
  {
    return token;
  }
}
