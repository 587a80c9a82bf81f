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
package net.climagg.aggregation.channel;

import java.time.LocalDateTime;

import net.climagg.data.Bin;

/**
 * A time aligned read view of another series' aggregate, used by
 * reductions that depend on a sibling series (wind direction needs the
 * wind speed of the same interval).
 * <p>
 * Reads must be issued with non-decreasing timestamps; the cursor never
 * rewinds.
 *
 * @since 1.0
 */
public interface AuxiliaryChannel {

  /** @return The variable code of the series read. */
  public String code();
  
  /** @return True if the series is being aggregated concurrently, false if
   * it's replayed from the store. */
  public boolean isLive();
  
  /**
   * Returns the bin the auxiliary series aggregated for interval {@code t}.
   * A live channel blocks until the producer has moved past {@code t} or
   * finished.
   * @param t The interval timestamp of the reader.
   * @return The bin of the auxiliary record at {@code t} or 
   * {@link Bin#EMPTY} if there is none.
   * @throws InterruptedException if interrupted while waiting.
   * @throws IllegalArgumentException if {@code t} is before a previous read.
   */
  public Bin read(final LocalDateTime t) throws InterruptedException;
}
