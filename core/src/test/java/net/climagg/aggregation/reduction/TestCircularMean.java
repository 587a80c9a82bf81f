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
package net.climagg.aggregation.reduction;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDateTime;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.climagg.aggregation.channel.AuxiliaryChannel;
import net.climagg.data.Bin;
import net.climagg.data.RawRecord;

public class TestCircularMean {
  private static final LocalDateTime T = LocalDateTime.of(2000, 1, 2, 6, 0);
  
  /** Directions one hour apart, ending at T. */
  private static Bin bin(final Double... values) {
    final RawRecord[] records = new RawRecord[values.length];
    for (int i = 0; i < values.length; i++) {
      records[i] = RawRecord.of(hour(i - values.length + 1), values[i]);
    }
    return Bin.of(records);
  }
  
  private static LocalDateTime hour(final int offset) {
    return T.plusHours(offset);
  }
  
  private static ReductionResult reduce(final Bin bin) throws Exception {
    return new CircularMean().reduce(
        new ReductionContext(bin, T, null, null, null));
  }
  
  private static ReductionResult reduce(final Bin bin, final Bin speeds) 
      throws Exception {
    final AuxiliaryChannel channel = mock(AuxiliaryChannel.class);
    when(channel.code()).thenReturn("f");
    when(channel.read(T)).thenReturn(speeds);
    final Map<String, AuxiliaryChannel> aux = ImmutableMap.of("f", channel);
    final ReductionResult result = new CircularMean().reduce(
        new ReductionContext(bin, T, null, null, aux));
    verify(channel).read(T);
    return result;
  }
  
  @Test
  public void wrapsAroundNorth() throws Exception {
    final ReductionResult result = reduce(bin(350.0, 10.0));
    assertEquals(0, result.value(), 0.0000001);
    assertEquals(2, (int) result.info());
  }
  
  @Test
  public void quadrants() throws Exception {
    assertEquals(135, reduce(bin(90.0, 180.0)).value(), 0.0000001);
    assertEquals(315, reduce(bin(270.0, 0.0)).value(), 0.0000001);
    assertEquals(90, reduce(bin(90.0)).value(), 0.0000001);
    assertEquals(180, reduce(bin(180.0, 180.0)).value(), 0.0000001);
  }
  
  @Test
  public void rounds() throws Exception {
    assertEquals(11, reduce(bin(10.0, 11.0, 13.0)).value(), 0.0000001);
    assertEquals(352, reduce(bin(355.0, 350.0, 350.0)).value(), 0.0000001);
  }
  
  @Test
  public void emptyBin() throws Exception {
    assertSame(ReductionResult.NONE, reduce(Bin.EMPTY));
  }
  
  @Test
  public void sentinelsOnly() throws Exception {
    final ReductionResult result = new CircularMean().reduce(
        new ReductionContext(bin(990.0, 990.0), T, 
            Lists.newArrayList(990.0), null, null));
    assertEquals(CircularMean.NO_DIRECTION, result.value(), 0.0000001);
    assertEquals(2, (int) result.info());
  }
  
  @Test
  public void calmHoursAreDropped() throws Exception {
    final Bin speeds = Bin.of(
        RawRecord.of(hour(-2), 0.0), 
        RawRecord.of(hour(-1), 4.0), 
        RawRecord.of(hour(0), 6.0));
    final ReductionResult result = reduce(bin(180.0, 90.0, 90.0), speeds);
    assertEquals(90, result.value(), 0.0000001);
    assertEquals(2, (int) result.info());
  }
  
  @Test
  public void unmatchedHoursAreDropped() throws Exception {
    final Bin speeds = Bin.of(
        RawRecord.of(hour(-1), null), 
        RawRecord.of(hour(0), 6.0));
    final ReductionResult result = reduce(bin(180.0, 270.0, 90.0), speeds);
    assertEquals(90, result.value(), 0.0000001);
    assertEquals(1, (int) result.info());
  }
  
  @Test
  public void allCalm() throws Exception {
    final Bin speeds = Bin.of(
        RawRecord.of(hour(-1), 0.0), 
        RawRecord.of(hour(0), 0.0));
    final ReductionResult result = reduce(bin(180.0, 90.0), speeds);
    assertEquals(CircularMean.NO_DIRECTION, result.value(), 0.0000001);
    assertEquals(0, (int) result.info());
  }
  
  @Test
  public void noAuxiliaryBin() throws Exception {
    final ReductionResult result = reduce(bin(180.0, 90.0), Bin.EMPTY);
    assertEquals(CircularMean.NO_DIRECTION, result.value(), 0.0000001);
    assertEquals(0, (int) result.info());
  }
  
  @Test
  public void otherAuxiliaryCode() throws Exception {
    final AuxiliaryChannel channel = mock(AuxiliaryChannel.class);
    when(channel.read(T)).thenReturn(Bin.of(RawRecord.of(hour(0), 0.0)));
    final Map<String, AuxiliaryChannel> aux = ImmutableMap.of("ff", channel);
    
    // the default code isn't open so everything is kept
    ReductionResult result = new CircularMean().reduce(
        new ReductionContext(bin(90.0), T, null, null, aux));
    assertEquals(90, result.value(), 0.0000001);
    
    result = new CircularMean("ff").reduce(
        new ReductionContext(bin(90.0), T, null, null, aux));
    assertEquals(CircularMean.NO_DIRECTION, result.value(), 0.0000001);
  }
  
  @Test
  public void interruptedRead() throws Exception {
    final AuxiliaryChannel channel = mock(AuxiliaryChannel.class);
    when(channel.read(T)).thenThrow(new InterruptedException("Boo!"));
    final Map<String, AuxiliaryChannel> aux = ImmutableMap.of("f", channel);
    try {
      new CircularMean().reduce(
          new ReductionContext(bin(90.0), T, null, null, aux));
      fail("Expected InterruptedException");
    } catch (InterruptedException e) { }
  }
}
