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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.climagg.aggregation.channel.AuxiliaryChannel;
import net.climagg.data.Bin;
import net.climagg.data.OutputRecord;
import net.climagg.data.RawRecord;

/**
 * Everything a {@link ReductionFunction} may look at for one interval: the
 * frozen bin, the interval timestamp, the sentinel values of the parent
 * series, the record emitted for the previous interval and the auxiliary
 * channels.
 *
 * @since 1.0
 */
public class ReductionContext {
  private final Bin bin;
  private final LocalDateTime timestamp;
  private final List<Double> sentinels;
  private final OutputRecord previous;
  private final Map<String, AuxiliaryChannel> auxiliaries;
  
  /**
   * Default ctor.
   * @param bin The non-null bin.
   * @param timestamp The non-null interval timestamp.
   * @param sentinels The in-data flag values of the parent, may be null.
   * @param previous The last record emitted by the task, may be null.
   * @param auxiliaries Channels by code, may be null.
   */
  public ReductionContext(final Bin bin,
                          final LocalDateTime timestamp,
                          final List<Double> sentinels,
                          final OutputRecord previous,
                          final Map<String, AuxiliaryChannel> auxiliaries) {
    if (bin == null) {
      throw new IllegalArgumentException("Bin cannot be null.");
    }
    if (timestamp == null) {
      throw new IllegalArgumentException("Timestamp cannot be null.");
    }
    this.bin = bin;
    this.timestamp = timestamp;
    this.sentinels = sentinels == null ? Collections.<Double>emptyList() 
        : ImmutableList.copyOf(sentinels);
    this.previous = previous;
    this.auxiliaries = auxiliaries == null 
        ? Collections.<String, AuxiliaryChannel>emptyMap() 
        : ImmutableMap.copyOf(auxiliaries);
  }
  
  public Bin bin() {
    return bin;
  }
  
  /** @return The interval timestamp. */
  public LocalDateTime timestamp() {
    return timestamp;
  }
  
  /** @return The in-data flag values of the parent series in order. */
  public List<Double> sentinels() {
    return sentinels;
  }
  
  /** @return The first sentinel, marking trace precipitation, or null. */
  public Double traceSentinel() {
    return sentinels.isEmpty() ? null : sentinels.get(0);
  }
  
  /**
   * @param value A value, may be null.
   * @return True if the value is one of the sentinels.
   */
  public boolean isSentinel(final Double value) {
    return value != null && sentinels.contains(value);
  }
  
  /** @return The usable values of the bin, see {@link #values(Iterable)}. */
  public List<Double> values() {
    return values(bin);
  }
  
  /**
   * Filters out missing and sentinel values.
   * @param records The records to filter.
   * @return The remaining values in record order.
   */
  public List<Double> values(final Iterable<RawRecord> records) {
    final List<Double> values = Lists.newArrayList();
    for (final RawRecord record : records) {
      if (record.value() != null && !isSentinel(record.value())) {
        values.add(record.value());
      }
    }
    return values;
  }
  
  /** @return The record this task emitted for an earlier interval, null if
   * none yet. */
  public OutputRecord previousOutput() {
    return previous;
  }
  
  /**
   * @param code An auxiliary series code.
   * @return Whether or not a channel to the series is open.
   */
  public boolean hasAuxiliary(final String code) {
    return auxiliaries.containsKey(code);
  }
  
  /**
   * Reads the auxiliary series for this interval, blocking if it's being
   * aggregated concurrently and hasn't caught up yet.
   * @param code The auxiliary series code.
   * @return The auxiliary bin for this interval, possibly empty.
   * @throws InterruptedException if interrupted while waiting.
   * @throws IllegalStateException if no channel is open for the code.
   */
  public Bin auxiliary(final String code) throws InterruptedException {
    final AuxiliaryChannel channel = auxiliaries.get(code);
    if (channel == null) {
      throw new IllegalStateException("No auxiliary channel for " + code);
    }
    return channel.read(timestamp);
  }
}
