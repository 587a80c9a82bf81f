// This file is part of ClimAgg.
// Copyright (C) 2026  The ClimAgg Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.climagg.data;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.Lists;

public class TestSeriesDescriptor {
  
  private static SeriesDescriptor raw() {
    return SeriesDescriptor.newBuilder()
        .setName("precipitation")
        .setCode("r")
        .setStation(6030)
        .setSource("DMI")
        .setUnit("mm/10")
        .setType(ValueType.INT)
        .addFlag(new Flag(-1, "trace", true))
        .addFlag(new Flag(99, "unknown window", false))
        .build();
  }

  @Test
  public void builderDefaults() throws Exception {
    final SeriesDescriptor series = SeriesDescriptor.newBuilder()
        .setCode("t")
        .build();
    assertEquals("t", series.name());
    assertEquals(0, series.station());
    assertNull(series.source());
    assertSame(ValueType.FLOAT, series.type());
    assertNull(series.interval());
    assertFalse(series.isAggregate());
    assertEquals(SeriesDescriptor.DEFAULT_ZERO_HOUR, series.zeroHour());
    assertFalse(series.zeroInclusive());
    assertEquals(Duration.ZERO, series.postpone());
    assertTrue(series.flags().isEmpty());
    assertTrue(series.ancestors().isEmpty());
  }
  
  @Test
  public void builderValidation() throws Exception {
    try {
      SeriesDescriptor.newBuilder().build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      SeriesDescriptor.newBuilder().setCode("t").setZeroHour(24).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      SeriesDescriptor.newBuilder().setCode("t")
          .setPostpone(Duration.ofHours(-1)).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      SeriesDescriptor.newBuilder().setCode("t")
          .setInterval(IntervalKind.DAY).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void sentinels() throws Exception {
    final List<Double> sentinels = raw().sentinels();
    assertEquals(1, sentinels.size());
    assertEquals(-1.0, sentinels.get(0), 0.0000001);
  }
  
  @Test
  public void aggregateOfInheritsAndNames() throws Exception {
    final SeriesDescriptor parent = raw();
    final SeriesDescriptor day = SeriesDescriptor.aggregateOf(parent)
        .setInterval(IntervalKind.DAY)
        .setReduction("rain_XT")
        .build();
    assertEquals("precipitation day", day.name());
    assertEquals("r", day.code());
    assertEquals(6030, day.station());
    assertEquals("DMI", day.source());
    assertEquals("mm/10", day.unit());
    assertSame(ValueType.INT, day.type());
    assertEquals(parent.flags(), day.flags());
    assertSame(parent, day.parent());
    assertTrue(day.isAggregate());
    assertEquals(parent.key(), day.key());
    
    // the name comes from the earliest ancestor
    final SeriesDescriptor month = SeriesDescriptor.aggregateOf(day)
        .setInterval(IntervalKind.MONTH)
        .setReduction("rain_month")
        .build();
    assertEquals("precipitation month", month.name());
    assertEquals(Lists.newArrayList(day, parent), month.ancestors());
  }
  
  @Test
  public void addFlagSkipsDuplicates() throws Exception {
    final SeriesDescriptor series = raw().toBuilder()
        .addFlag(new Flag(-1, "trace", true))
        .addFlag(new Flag(990, "variable", true))
        .build();
    assertEquals(3, series.flags().size());
    assertEquals(Lists.newArrayList(-1.0, 990.0), series.sentinels());
  }
  
  @Test
  public void key() throws Exception {
    final SeriesKey key = raw().key();
    assertEquals(new SeriesKey("r", 6030, "DMI"), key);
    assertEquals(new SeriesKey("f", 6030, "DMI"), key.withCode("f"));
    assertFalse(key.equals(new SeriesKey("r", 6030, null)));
    assertEquals("r / 6030 / DMI", key.toString());
  }
}
