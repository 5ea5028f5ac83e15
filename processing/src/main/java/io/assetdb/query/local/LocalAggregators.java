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

package io.assetdb.query.local;

import io.assetdb.data.Rows;
import io.assetdb.java.util.common.IAE;
import io.assetdb.query.aggregation.AggregateKind;

import javax.annotation.Nullable;

/**
 */
public class LocalAggregators
{
  public static LocalAggregator create(AggregateKind kind, boolean sampleStdDev)
  {
    switch (kind) {
      case COUNT:
        return new CountAggregator();
      case MAX:
        return new ExtremeAggregator(true);
      case MEAN:
        return new MeanAggregator();
      case MIN:
        return new ExtremeAggregator(false);
      case STD:
        return new StdDevAggregator(sampleStdDev);
      case SUM:
        return new SumAggregator();
      default:
        throw new IAE("Unsupported aggregate %s", kind);
    }
  }

  static class CountAggregator implements LocalAggregator
  {
    private long count;

    @Override
    public void aggregate(@Nullable Object value)
    {
      if (value != null) {
        count++;
      }
    }

    @Override
    public Object get()
    {
      return count;
    }
  }

  static class SumAggregator implements LocalAggregator
  {
    private double sum;
    private boolean seen;

    @Override
    public void aggregate(@Nullable Object value)
    {
      Double doubleValue = Rows.toDouble(value);
      if (doubleValue != null) {
        sum += doubleValue;
        seen = true;
      }
    }

    @Override
    public Object get()
    {
      return seen ? sum : null;
    }
  }

  static class MeanAggregator implements LocalAggregator
  {
    private double sum;
    private long count;

    @Override
    public void aggregate(@Nullable Object value)
    {
      Double doubleValue = Rows.toDouble(value);
      if (doubleValue != null) {
        sum += doubleValue;
        count++;
      }
    }

    @Override
    public Object get()
    {
      return count == 0 ? null : sum / count;
    }
  }

  // keeps the winning value as is, so timestamps stay timestamps
  static class ExtremeAggregator implements LocalAggregator
  {
    private final boolean max;
    private Object current;

    ExtremeAggregator(boolean max)
    {
      this.max = max;
    }

    @Override
    public void aggregate(@Nullable Object value)
    {
      if (value == null) {
        return;
      }
      if (current == null) {
        current = value;
        return;
      }
      int compare = Rows.compare(value, current);
      if (max ? compare > 0 : compare < 0) {
        current = value;
      }
    }

    @Override
    public Object get()
    {
      return current;
    }
  }

  // welford
  static class StdDevAggregator implements LocalAggregator
  {
    private final boolean sample;
    private long count;
    private double mean;
    private double m2;

    StdDevAggregator(boolean sample)
    {
      this.sample = sample;
    }

    @Override
    public void aggregate(@Nullable Object value)
    {
      Double doubleValue = Rows.toDouble(value);
      if (doubleValue == null) {
        return;
      }
      count++;
      double delta = doubleValue - mean;
      mean += delta / count;
      m2 += delta * (doubleValue - mean);
    }

    @Override
    public Object get()
    {
      if (count == 0 || (sample && count == 1)) {
        return null;
      }
      return Math.sqrt(m2 / (sample ? count - 1 : count));
    }
  }

  private LocalAggregators()
  {
  }
}
