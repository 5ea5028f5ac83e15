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

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.Assert;
import org.junit.Test;

import java.util.Date;

public class RowsTest
{
  private static final DateTimeZone SEOUL = DateTimeZone.forID("Asia/Seoul");

  @Test
  public void testToDateTime()
  {
    DateTime utc = new DateTime("2023-01-01T00:00:00Z", DateTimeZone.UTC);
    Assert.assertNull(Rows.toDateTime(null, DateTimeZone.UTC));
    Assert.assertEquals(utc, Rows.toDateTime("2023-01-01T00:00:00Z", DateTimeZone.UTC));
    Assert.assertEquals(utc, Rows.toDateTime(utc.getMillis(), DateTimeZone.UTC));
    Assert.assertEquals(utc, Rows.toDateTime(new Date(utc.getMillis()), DateTimeZone.UTC));

    DateTime seoul = Rows.toDateTime(utc, SEOUL);
    Assert.assertEquals(utc.getMillis(), seoul.getMillis());
    Assert.assertEquals(9, seoul.getHourOfDay());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testToDateTimeUnsupported()
  {
    Rows.toDateTime(Boolean.TRUE, DateTimeZone.UTC);
  }

  @Test
  public void testToDouble()
  {
    Assert.assertNull(Rows.toDouble(null));
    Assert.assertNull(Rows.toDouble(" "));
    Assert.assertEquals(3.5, Rows.toDouble(" 3.5 "), 0.0);
    Assert.assertEquals(7.0, Rows.toDouble(7L), 0.0);
  }

  @Test
  public void testCompare()
  {
    Assert.assertEquals(0, Rows.compare(null, null));
    Assert.assertTrue(Rows.compare(null, 1) < 0);
    Assert.assertTrue(Rows.compare(1, null) > 0);
    Assert.assertEquals(0, Rows.compare(3, 3.0));
    Assert.assertTrue(Rows.compare(2L, 2.5f) < 0);
    Assert.assertTrue(Rows.compare("a", "b") < 0);

    DateTime time = new DateTime("2023-01-01T09:00:00", SEOUL);
    Assert.assertEquals(0, Rows.compare(time, time.withZone(DateTimeZone.UTC)));
    Assert.assertEquals(0, Rows.compare(time, "2023-01-01T00:00:00Z"));
    Assert.assertTrue(Rows.compare(new Date(time.getMillis() - 1), time) < 0);
  }

  @Test
  public void testNormalize()
  {
    Assert.assertNull(Rows.normalize(null));
    Assert.assertEquals(3L, Rows.normalize(3.0));
    Assert.assertEquals(3L, Rows.normalize(3));
    Assert.assertEquals(Rows.normalize(3.0), Rows.normalize(3L));
    Assert.assertEquals(2.5, Rows.normalize(2.5f));
    Assert.assertEquals("d1", Rows.normalize("d1"));

    DateTime time = new DateTime("2023-01-01T09:00:00", SEOUL);
    Assert.assertEquals(Rows.normalize(time), Rows.normalize(new Date(time.getMillis())));
    Assert.assertEquals(Rows.normalize(time), Rows.normalize(time.withZone(DateTimeZone.UTC)));
  }
}
