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

import java.time.LocalDateTime;

import net.climagg.data.Bin;
import net.climagg.data.OutputRecord;
import net.climagg.data.RawRecord;

/**
 * Precipitation from readings with accumulation windows of varying length.
 * The bin is walked from the newest reading back; a reading counts when it
 * ends at or before the start of the window of the last counted reading,
 * so overlapping accumulations aren't summed twice. A reading of
 * {@value #TRACE} marks a trace amount instead.
 * <p>
 * By default the window of a reading is {@code hour % 12 + 6} hours, i.e.
 * 6 hours for readings at 0 and 12, 12 hours at 6 and 18. With
 * {@code use_info} the window is taken from the reading's info when it's
 * set and not {@value #UNKNOWN_WINDOW}.
 * <p>
 * With {@code check_start} the amount of the last reading of the previous
 * interval is subtracted when it doesn't exceed the total and, stepped back
 * by the window of the oldest reading in this bin, it lands exactly where
 * this interval's counted readings start. A trace reading is never
 * subtracted.
 *
 * @since 1.0
 */
public class RainExtendedWindow implements ReductionFunction {
  public static final String NAME = "rain_XT";
  
  public static final String INFO_NAME = "rain_info";
  
  /** A trace of precipitation, both in the readings and the output. */
  public static final double TRACE = -1;
  
  /** Info value meaning the accumulation window is unknown. */
  public static final int UNKNOWN_WINDOW = 99;
  
  private final boolean check_start;
  private final boolean use_info;
  
  /**
   * Default ctor.
   * @param check_start Whether or not to correct for the overlap with the 
   * previous interval.
   * @param use_info Whether or not to read window lengths from the info.
   */
  public RainExtendedWindow(final boolean check_start, final boolean use_info) {
    this.check_start = check_start;
    this.use_info = use_info;
  }
  
  @Override
  public String name() {
    return use_info ? INFO_NAME : NAME;
  }
  
  @Override
  public ReductionResult reduce(final ReductionContext context) {
    final Bin bin = context.bin();
    if (bin.isEmpty()) {
      return ReductionResult.NONE;
    }
    boolean trace = false;
    LocalDateTime start = bin.last().timestamp();
    double total = 0;
    for (int i = bin.size() - 1; i >= 0; i--) {
      final RawRecord record = bin.get(i);
      if (record.value() == null) {
        continue;
      }
      if (record.value() == TRACE) {
        trace = true;
      } else if (!record.timestamp().isAfter(start)) {
        total += record.value();
        start = record.timestamp().minusHours(window(record));
      }
    }
    
    if (check_start) {
      final OutputRecord previous = context.previousOutput();
      if (previous != null && !previous.provenance().isEmpty()) {
        final RawRecord overlap = previous.provenance().last();
        final int oldest_window = window(bin.get(0));
        if (overlap.value() != null 
            && overlap.value() != TRACE
            && overlap.timestamp().minusHours(oldest_window).equals(start)
            && overlap.value() <= total) {
          total -= overlap.value();
        }
      }
    }
    return ReductionResult.emit(total == 0 && trace ? TRACE : total, null);
  }
  
  /**
   * @param record A reading.
   * @return The length of its accumulation window in hours.
   */
  int window(final RawRecord record) {
    if (use_info && record.info() != null && record.info() != 0 
        && record.info() != UNKNOWN_WINDOW) {
      return record.info();
    }
    return record.timestamp().getHour() % 12 + 6;
  }
}
