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
package net.climagg.aggregation;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters of one aggregation. Updated by the worker running the task,
 * safe to read from any thread.
 *
 * @since 1.0
 */
public class TaskStats {
  private final AtomicInteger records_read = new AtomicInteger();
  private final AtomicInteger records_binned = new AtomicInteger();
  private final AtomicInteger intervals = new AtomicInteger();
  private final AtomicInteger emitted = new AtomicInteger();
  private final AtomicInteger validation_failures = new AtomicInteger();
  private final AtomicInteger missing = new AtomicInteger();
  
  void incrementRecordsRead() {
    records_read.incrementAndGet();
  }
  
  void incrementRecordsBinned(final int count) {
    records_binned.addAndGet(count);
  }
  
  void incrementIntervals() {
    intervals.incrementAndGet();
  }
  
  void incrementEmitted() {
    emitted.incrementAndGet();
  }
  
  void incrementValidationFailures() {
    validation_failures.incrementAndGet();
  }
  
  void incrementMissing() {
    missing.incrementAndGet();
  }
  
  /** @return The number of input records seen. */
  public int recordsRead() {
    return records_read.get();
  }
  
  /** @return The number of input records handed to the reduction in a 
   * bin. */
  public int recordsBinned() {
    return records_binned.get();
  }
  
  /** @return The number of intervals traversed, empty ones included. */
  public int intervals() {
    return intervals.get();
  }
  
  /** @return The number of output records. */
  public int emitted() {
    return emitted.get();
  }
  
  /** @return Input records and outputs dropped because they couldn't be
   * represented. */
  public int validationFailures() {
    return validation_failures.get();
  }
  
  /** @return Input records without a value. */
  public int missing() {
    return missing.get();
  }
  
  @Override
  public String toString() {
    return "read=" + records_read + ", binned=" + records_binned 
        + ", intervals=" + intervals + ", emitted=" + emitted 
        + ", invalid=" + validation_failures + ", missing=" + missing;
  }
}
