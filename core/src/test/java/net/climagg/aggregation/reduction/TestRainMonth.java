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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import java.time.LocalDateTime;

import org.junit.Test;

import com.google.common.collect.Lists;

import net.climagg.data.Bin;
import net.climagg.data.RawRecord;

public class TestRainMonth {
  private static final LocalDateTime T = LocalDateTime.of(2000, 1, 1, 0, 0);
  
  private static ReductionResult reduce(final Bin bin) {
    return new RainMonth().reduce(new ReductionContext(bin, T, 
        Lists.newArrayList(-1.0), null, null));
  }
  
  @Test
  public void sum() throws Exception {
    final ReductionResult result = reduce(Bin.of(
        RawRecord.of(T.plusDays(1), 10.0),
        RawRecord.of(T.plusDays(2), -1.0),
        RawRecord.of(T.plusDays(3), 20.0)));
    assertEquals(30, result.value(), 0.0000001);
    assertEquals(3, (int) result.info());
  }
  
  @Test
  public void onlyTrace() throws Exception {
    final ReductionResult result = reduce(Bin.of(
        RawRecord.of(T.plusDays(1), -1.0),
        RawRecord.of(T.plusDays(2), null)));
    assertEquals(2, result.value(), 0.0000001);
    assertNull(result.info());
  }
  
  @Test
  public void emptyBin() throws Exception {
    assertSame(ReductionResult.NONE, reduce(Bin.EMPTY));
  }
}
