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
import java.util.List;

import com.google.common.collect.Lists;

import net.climagg.data.Bin;
import net.climagg.data.RawRecord;

/**
 * Groups an ordered stream of records into interval bins and hands each
 * bin to a {@link IntervalSink}. The interval cursor {@code t} starts at the
 * interval of the first record and only moves forward, one interval at a
 * time, so the sink sees every interval between the first and the last
 * record, including those without records.
 * <p>
 * Usage: call {@link #accept(RawRecord)} for each record in ascending
 * timestamp order, then {@link #finish()} once. An empty stream finishes
 * without ever calling the sink.
 * <p>
 * <b>Note:</b> This class is not thread safe.
 *
 * @since 1.0
 */
public class TemporalBinner {

  /** The state of the binner. */
  public static enum State {
    /** Collecting records for the current interval. */
    ACCUMULATING,
    
    /** Handing a bin to the sink. */
    FLUSHING,
    
    /** {@link TemporalBinner#finish()} was called. */
    DONE
  }
  
  /**
   * Receives the bins.
   */
  public interface IntervalSink {
    /**
     * Called once per interval in ascending order.
     * @param t The interval timestamp.
     * @param bin The frozen, possibly empty bin.
     * @throws InterruptedException if the sink was interrupted while 
     * waiting on another aggregation.
     */
    public void step(final LocalDateTime t, final Bin bin) 
        throws InterruptedException;
  }
  
  private final BinningStrategy strategy;
  private final IntervalSink sink;
  
  /** The records of the current interval. */
  private List<RawRecord> pending;
  
  /** The current interval, null until the first record. */
  private LocalDateTime t;
  
  /** The timestamp of the last accepted record. */
  private LocalDateTime last;
  
  private State state;
  
  /** Number of sink calls. */
  private int intervals;
  
  /**
   * Default ctor.
   * @param strategy A non-null binning strategy.
   * @param sink A non-null sink.
   */
  public TemporalBinner(final BinningStrategy strategy, 
                        final IntervalSink sink) {
    if (strategy == null) {
      throw new IllegalArgumentException("Strategy cannot be null.");
    }
    if (sink == null) {
      throw new IllegalArgumentException("Sink cannot be null.");
    }
    this.strategy = strategy;
    this.sink = sink;
    pending = Lists.newArrayList();
    state = State.ACCUMULATING;
  }
  
  /**
   * Adds the next record, flushing every interval the record is past.
   * @param record A non-null record, not older than the previous one.
   * @throws InterruptedException if the sink was interrupted.
   * @throws IllegalArgumentException if the record was null or out of 
   * order.
   * @throws IllegalStateException if the binner was finished.
   */
  public void accept(final RawRecord record) throws InterruptedException {
    if (record == null) {
      throw new IllegalArgumentException("Record cannot be null.");
    }
    if (state != State.ACCUMULATING) {
      throw new IllegalStateException("Binner is " + state);
    }
    if (last != null && record.timestamp().isBefore(last)) {
      throw new IllegalArgumentException("Record at " + record.timestamp() 
          + " is older than the previous record at " + last);
    }
    last = record.timestamp();
    
    if (t == null) {
      t = strategy.initial(record);
    }
    while (!strategy.belongs(record.timestamp(), t)) {
      flush();
      t = strategy.next(t);
    }
    pending.add(record);
  }
  
  /**
   * Flushes the last interval. Must be called exactly once.
   * @throws InterruptedException if the sink was interrupted.
   * @throws IllegalStateException if already finished.
   */
  public void finish() throws InterruptedException {
    if (state != State.ACCUMULATING) {
      throw new IllegalStateException("Binner is " + state);
    }
    if (t != null) {
      flush();
    }
    state = State.DONE;
  }
  
  /** @return The current interval timestamp, null before the first 
   * record. */
  public LocalDateTime currentInterval() {
    return t;
  }
  
  public State state() {
    return state;
  }
  
  /** @return The number of intervals handed to the sink so far. */
  public int intervals() {
    return intervals;
  }
  
  /** @return The number of records waiting in the current interval. */
  public int pending() {
    return pending.size();
  }
  
  private void flush() throws InterruptedException {
    state = State.FLUSHING;
    final Bin bin = pending.isEmpty() ? Bin.EMPTY : Bin.of(pending);
    pending = Lists.newArrayList();
    try {
      sink.step(t, bin);
      intervals++;
    } finally {
      state = State.ACCUMULATING;
    }
  }
}
