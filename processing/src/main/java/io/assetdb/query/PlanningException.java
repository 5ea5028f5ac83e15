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

import io.assetdb.java.util.common.StringUtils;

import javax.annotation.Nullable;

/**
 * Raised while assembling a plan, before anything is handed to the execution layer.
 * Callers branch on {@link #getErrorCode()} rather than on the message.
 */
public class PlanningException extends RuntimeException
{
  public enum Code
  {
    TABLE_NOT_FOUND,
    COLUMN_NOT_FOUND,
    GROUP_COLUMN_NOT_FOUND,
    UNSUPPORTED_AGGREGATE,
    MISSING_TIMESTAMP_COLUMN,
    MISSING_TIME_GRAIN,
    INVALID_TIME_AGGREGATE,
    FALLBACK_NOT_JOINABLE,
    DUPLICATE_OUTPUT_NAME
  }

  public static PlanningException tableNotFound(String table, @Nullable String schema)
  {
    return new PlanningException(
        Code.TABLE_NOT_FOUND, table, false,
        "Table %s doesn't exist in the database", schema == null ? table : schema + "." + table
    );
  }

  public static PlanningException columnNotFound(String column)
  {
    return new PlanningException(
        Code.COLUMN_NOT_FOUND, column, false,
        "Column %s not found on time series or dimension table", column
    );
  }

  public static PlanningException groupColumnNotFound(String column, boolean noDimension)
  {
    if (noDimension) {
      return new PlanningException(
          Code.GROUP_COLUMN_NOT_FOUND, column, true,
          "group by column %s not found in main table and no dimension table specified", column
      );
    }
    return new PlanningException(
        Code.GROUP_COLUMN_NOT_FOUND, column, false,
        "group by column %s not found in main table or dimension table", column
    );
  }

  public static PlanningException unsupportedAggregate(String aggregate)
  {
    return new PlanningException(
        Code.UNSUPPORTED_AGGREGATE, aggregate, false,
        "Unsupported database aggregate function %s", aggregate
    );
  }

  public static PlanningException missingTimestampColumn(String reason)
  {
    return new PlanningException(
        Code.MISSING_TIMESTAMP_COLUMN, null, false,
        "You must supply a timestamp column when %s", reason
    );
  }

  public static PlanningException missingTimeGrain(String timeAggregate)
  {
    return new PlanningException(
        Code.MISSING_TIME_GRAIN, timeAggregate, false,
        "You must supply a time grain for the %s rollup of a time-based aggregate", timeAggregate
    );
  }

  public static PlanningException invalidTimeAggregate(String aggregate)
  {
    return new PlanningException(
        Code.INVALID_TIME_AGGREGATE, aggregate, false,
        "Invalid time aggregate %s. Use \"first\" or \"last\"", aggregate
    );
  }

  public static PlanningException fallbackNotJoinable(String frequency)
  {
    return new PlanningException(
        Code.FALLBACK_NOT_JOINABLE, frequency, false,
        "Time grain %s cannot be pushed to the database and its plan cannot be joined. Resample first.", frequency
    );
  }

  public static PlanningException duplicateOutputName(String name)
  {
    return new PlanningException(
        Code.DUPLICATE_OUTPUT_NAME, name, false,
        "Output name %s appears more than once in the projection", name
    );
  }

  private final Code errorCode;
  private final String target;
  private final boolean noDimension;

  private PlanningException(Code errorCode, String target, boolean noDimension, String format, Object... args)
  {
    super(StringUtils.nonStrictFormat(format, args));
    this.errorCode = errorCode;
    this.target = target;
    this.noDimension = noDimension;
  }

  public Code getErrorCode()
  {
    return errorCode;
  }

  /**
   * @return the column, aggregate or frequency the error is about
   */
  @Nullable
  public String getTarget()
  {
    return target;
  }

  /**
   * @return true when a group-by column was missing and no dimension table was supplied at all
   */
  public boolean isNoDimension()
  {
    return noDimension;
  }
}
