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

import net.climagg.data.RawRecord;

/**
 * Base for the half-day precipitation reductions. The reading of the
 * afternoon (hours 12 to 18) and the one of the night (hours 0 to 6) are
 * combined by the subclass; a dry interval with a trace reading emits the
 * trace value {@value #TRACE}.
 *
 * @since 1.0
 */
public abstract class HalfDayPrecipitation implements ReductionFunction {
  /** Emitted for a dry interval with a trace of precipitation. */
  public static final double TRACE = -1;
  
  @Override
  public ReductionResult reduce(final ReductionContext context) {
    if (context.bin().isEmpty()) {
      return ReductionResult.NONE;
    }
    final Double trace_sentinel = context.traceSentinel();
    boolean trace = false;
    double afternoon = 0;
    double night = 0;
    for (final RawRecord record : context.bin()) {
      if (trace_sentinel != null && trace_sentinel.equals(record.value())) {
        trace = true;
      }
      final double amount = record.value() == null ? 0 
          : Math.max(0, record.value());
      final int hour = record.timestamp().getHour();
      if (hour >= 12 && hour <= 18) {
        afternoon = merge(hour, afternoon, amount);
      } else if (hour >= 0 && hour <= 6) {
        night = merge(hour, night, amount);
      }
    }
    final double total = afternoon + night;
    return ReductionResult.emit(total == 0 && trace ? TRACE : total, null);
  }
  
  /**
   * Combines a reading with the amount collected so far for its half day.
   * @param hour The hour of the reading.
   * @param current The amount so far.
   * @param amount The non-negative reading.
   * @return The new amount.
   */
  protected abstract double merge(final int hour, 
                                  final double current, 
                                  final double amount);
}
