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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import io.assetdb.data.Rows;
import io.assetdb.data.ValueType;
import io.assetdb.java.util.common.IAE;
import io.assetdb.query.expression.ColumnExpression;
import io.assetdb.query.expression.ColumnRef;
import org.joda.time.DateTime;
import org.joda.time.DateTimeConstants;
import org.joda.time.DateTimeZone;
import org.joda.time.LocalDateTime;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Timestamp column truncated to the start of its bucket, labeled with the name of the timestamp column.
 * Weeks start on sunday.
 */
public class TimeBucketExpression implements ColumnExpression
{
  private final ColumnRef field;
  private final TimeGrain grain;
  private final String name;

  @JsonCreator
  public TimeBucketExpression(
      @JsonProperty("field") ColumnRef field,
      @JsonProperty("grain") String grain,
      @JsonProperty("name") @Nullable String name
  )
  {
    this.field = Preconditions.checkNotNull(field, "'field' cannot be null");
    this.grain = TimeGrain.parse(grain);
    if (this.grain.isOpaque()) {
      throw new IAE("[%s] cannot be expressed as a bucket", grain);
    }
    this.name = name == null ? field.getName() : name;
  }

  public TimeBucketExpression(ColumnRef field, String grain)
  {
    this(field, grain, null);
  }

  @JsonProperty
  public ColumnRef getField()
  {
    return field;
  }

  @JsonProperty("grain")
  public String getGrainToken()
  {
    return grain.getToken();
  }

  @JsonProperty
  public String getName()
  {
    return name;
  }

  @Override
  @JsonIgnore
  public String getOutputName()
  {
    return name;
  }

  @Override
  @JsonIgnore
  public ValueType getType()
  {
    return ValueType.TIMESTAMP;
  }

  /**
   * @return start of the bucket holding the value, in the given zone
   */
  @Nullable
  public DateTime apply(@Nullable Object value, DateTimeZone timeZone)
  {
    DateTime time = Rows.toDateTime(value, timeZone);
    return time == null ? null : apply(time);
  }

  public DateTime apply(DateTime time)
  {
    final int multiple = grain.getMultiple();
    switch (grain.getUnit()) {
      case MINUTE:
        DateTime hour = time.hourOfDay().roundFloorCopy();
        return hour.plusMinutes((time.getMinuteOfHour() / multiple) * multiple);
      case HOUR:
        return floorHour(time, (time.getHourOfDay() / multiple) * multiple);
      case DAY:
        return time.withTimeAtStartOfDay();
      case WEEK:
        int dayOfWeek = time.getDayOfWeek();
        return time.withTimeAtStartOfDay().minusDays(dayOfWeek == DateTimeConstants.SUNDAY ? 0 : dayOfWeek);
      case MONTH:
        return time.withTimeAtStartOfDay().withDayOfMonth(1);
      case YEAR:
        return time.withTimeAtStartOfDay().withDayOfYear(1);
      default:
        throw new IAE("unsupported unit %s", grain.getUnit());
    }
  }

  // wall clock hour of the same day. a start hour skipped by a DST gap moves to the first valid hour after it
  private static DateTime floorHour(DateTime time, int hourOfDay)
  {
    final DateTime hour = time.hourOfDay().roundFloorCopy();
    if (hour.getHourOfDay() == hourOfDay) {
      return hour;
    }
    final DateTimeZone zone = time.getZone();
    LocalDateTime local = hour.toLocalDateTime().withHourOfDay(hourOfDay);
    while (zone.isLocalDateTimeGap(local)) {
      local = local.plusHours(1);
    }
    return local.toDateTime(zone);
  }

  @Override
  public String toSql()
  {
    final String column = field.toSql();
    final int multiple = grain.getMultiple();
    switch (grain.getUnit()) {
      case MINUTE:
        return "ADD_MINUTES(ADD_HOURS(TIMESTAMP(DATE(" + column + ")), HOUR(" + column + ")), "
               + "(MINUTE(" + column + ") / " + multiple + ") * " + multiple + ")";
      case HOUR:
        return "ADD_HOURS(TIMESTAMP(DATE(" + column + ")), "
               + "(HOUR(" + column + ") / " + multiple + ") * " + multiple + ")";
      case DAY:
        return "TIMESTAMP(DATE(" + column + "))";
      case WEEK:
        return "THIS_WEEK(" + column + ")";
      case MONTH:
        return "THIS_MONTH(" + column + ")";
      case YEAR:
        return "THIS_YEAR(" + column + ")";
      default:
        throw new IAE("unsupported unit %s", grain.getUnit());
    }
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
    TimeBucketExpression that = (TimeBucketExpression) o;
    return field.equals(that.field) && grain.equals(that.grain) && name.equals(that.name);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(field, grain, name);
  }

  @Override
  public String toString()
  {
    return "bucket(" + field.getQualifiedName() + ", " + grain + ") AS " + name;
  }
}
