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

import net.climagg.data.RawRecord;
import net.climagg.data.SeriesDescriptor;

/**
 * Decides which interval a record falls into. Implementations are
 * stateless; the {@link TemporalBinner} carries the cursor.
 * <p>
 * An interval is identified by a single timestamp {@code t}. Whether the
 * window lies before or after {@code t} is up to the strategy, but
 * {@link #belongs(LocalDateTime, LocalDateTime)} must be monotone: once a
 * record is past the window of {@code t} every later record is too.
 *
 * @since 1.0
 */
public interface BinningStrategy {

  /**
   * @param first The first record of the series.
   * @return The timestamp of the interval the first record falls into.
   */
  public LocalDateTime initial(final RawRecord first);

  /**
   * @param timestamp A record timestamp.
   * @param t The current interval timestamp.
   * @return True if the record falls into the interval of {@code t} or an
   * earlier one.
   */
  public boolean belongs(final LocalDateTime timestamp, final LocalDateTime t);

  /**
   * @param t An interval timestamp.
   * @return The timestamp of the following interval.
   */
  public LocalDateTime next(final LocalDateTime t);

  /**
   * Builds a strategy for a descriptor.
   */
  public interface Factory {
    /**
     * @param descriptor The non-null aggregate descriptor.
     * @return A strategy using the descriptor's binning parameters.
     */
    public BinningStrategy newStrategy(final SeriesDescriptor descriptor);
  }
}
