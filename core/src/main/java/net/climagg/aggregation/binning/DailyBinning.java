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

import java.time.Duration;
import java.time.LocalDateTime;

import net.climagg.data.RawRecord;

/**
 * Daily intervals starting at {@code zero_hour}.
 * <ul>
 * <li>Inclusive: the window is {@code [t, t + 1 day)}, labelled with its
 * start.</li>
 * <li>Exclusive: the window is {@code (t - 1 day, t]}, labelled with its
 * end.</li>
 * </ul>
 * A postpone shifts both ends of the window later without changing the
 * label, so late accumulation readings count toward the day they close.
 *
 * @since 1.0
 */
public class DailyBinning implements BinningStrategy {
  private final int zero_hour;
  private final boolean zero_inclusive;
  private final Duration postpone;

  /**
   * Default ctor.
   * @param zero_hour The hour of the day at which intervals start, 0 to 23.
   * @param zero_inclusive Whether a record at exactly the zero hour opens
   * an interval or closes one.
   * @param postpone A non-null, non-negative extension of the window end.
   */
  public DailyBinning(final int zero_hour, 
                      final boolean zero_inclusive, 
                      final Duration postpone) {
    if (zero_hour < 0 || zero_hour > 23) {
      throw new IllegalArgumentException("Zero hour must be between 0 and 23: " 
          + zero_hour);
    }
    if (postpone == null || postpone.isNegative()) {
      throw new IllegalArgumentException("Postpone must be non-null and "
          + "non-negative: " + postpone);
    }
    this.zero_hour = zero_hour;
    this.zero_inclusive = zero_inclusive;
    this.postpone = postpone;
  }

  @Override
  public LocalDateTime initial(final RawRecord first) {
    final LocalDateTime timestamp = first.timestamp();
    final LocalDateTime t = timestamp.toLocalDate().atTime(zero_hour, 0);
    // only the hour counts, 06:30 is "at" a zero hour of 6
    final int hour = timestamp.getHour();
    if (hour < zero_hour) {
      return zero_inclusive ? t.minusDays(1) : t;
    }
    if (hour > zero_hour) {
      return zero_inclusive ? t : t.plusDays(1);
    }
    return t;
  }

  @Override
  public boolean belongs(final LocalDateTime timestamp, final LocalDateTime t) {
    if (zero_inclusive) {
      return timestamp.isBefore(t.plusDays(1).plus(postpone));
    }
    if (!postpone.isZero()) {
      return timestamp.isBefore(t.plus(postpone));
    }
    return !timestamp.isAfter(t);
  }

  @Override
  public LocalDateTime next(final LocalDateTime t) {
    return t.plusDays(1);
  }

  @Override
  public String toString() {
    return "DailyBinning{zero_hour=" + zero_hour + ", zero_inclusive=" 
        + zero_inclusive + ", postpone=" + postpone + "}";
  }
}
