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
package net.climagg.aggregation.binning;

import java.time.LocalDateTime;
import java.time.LocalTime;

import net.climagg.data.RawRecord;

/**
 * Calendar month intervals labelled with the first of the month at
 * midnight.
 * <p>
 * When the input is a daily aggregate labelled with the end of its window
 * ({@code zero_inclusive} false) the value stamped on the first of a month
 * at or before the zero hour covers the last day of the previous month, so
 * it is counted toward the previous month.
 *
 * @since 1.0
 */
public class MonthlyBinning implements BinningStrategy {
  private final LocalTime zero_time;
  private final boolean zero_inclusive;

  /**
   * Default ctor.
   * @param zero_hour The zero hour of the daily input, 0 to 23.
   * @param zero_inclusive Whether the daily input is labelled with the start
   * of its window.
   */
  public MonthlyBinning(final int zero_hour, final boolean zero_inclusive) {
    if (zero_hour < 0 || zero_hour > 23) {
      throw new IllegalArgumentException("Zero hour must be between 0 and 23: " 
          + zero_hour);
    }
    zero_time = LocalTime.of(zero_hour, 0);
    this.zero_inclusive = zero_inclusive;
  }

  @Override
  public LocalDateTime initial(final RawRecord first) {
    return target(first.timestamp());
  }

  @Override
  public boolean belongs(final LocalDateTime timestamp, final LocalDateTime t) {
    return !target(timestamp).isAfter(t);
  }

  @Override
  public LocalDateTime next(final LocalDateTime t) {
    return t.plusMonths(1);
  }

  /**
   * @param timestamp A record timestamp.
   * @return The month the record is counted toward.
   */
  LocalDateTime target(final LocalDateTime timestamp) {
    final LocalDateTime month = timestamp.toLocalDate().withDayOfMonth(1)
        .atStartOfDay();
    if (!zero_inclusive 
        && timestamp.getDayOfMonth() == 1 
        && !timestamp.toLocalTime().isAfter(zero_time)) {
      return month.minusMonths(1);
    }
    return month;
  }

  @Override
  public String toString() {
    return "MonthlyBinning{zero_time=" + zero_time + ", zero_inclusive=" 
        + zero_inclusive + "}";
  }
}
