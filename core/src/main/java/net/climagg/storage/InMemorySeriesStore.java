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
package net.climagg.storage;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.stumbleupon.async.Deferred;

import net.climagg.data.IntervalKind;
import net.climagg.data.OutputRecord;
import net.climagg.data.OutputSeries;
import net.climagg.data.RawRecord;
import net.climagg.data.SeriesDescriptor;
import net.climagg.data.SeriesKey;
import net.climagg.exceptions.AmbiguousDependencyException;

/**
 * A simple store keeping raw and aggregated series in memory. It's meant
 * for tests and for applications that load the data themselves and only
 * want the aggregates back.
 * <p>
 * Series are matched by descriptor identity. Writes can be made to fail 
 * with {@link #setWriteStatus(WriteStatus)} or 
 * {@link #setWriteException(Exception)}.
 * 
 * @since 1.0
 */
public class InMemorySeriesStore implements SeriesStore {
  private static final Logger LOG = LoggerFactory.getLogger(
      InMemorySeriesStore.class);
  
  private final Map<SeriesDescriptor, List<RawRecord>> raw;
  
  /** Stored aggregates in insertion order. */
  private final Map<SeriesDescriptor, List<OutputRecord>> aggregates;
  
  /** Status returned by writes, null to accept them. */
  private volatile WriteStatus write_status;
  
  /** Exception returned by writes, null to accept them. */
  private volatile Exception write_exception;
  
  public InMemorySeriesStore() {
    raw = Maps.newHashMap();
    aggregates = Maps.newLinkedHashMap();
  }
  
  /**
   * Adds or replaces a raw series.
   * @param series The non-null descriptor.
   * @param records The non-null records, sorted here by timestamp.
   */
  public synchronized void addSeries(final SeriesDescriptor series, 
                                     final List<RawRecord> records) {
    if (series == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    final List<RawRecord> sorted = Lists.newArrayList(records);
    sorted.sort((a, b) -> a.timestamp().compareTo(b.timestamp()));
    raw.put(series, ImmutableList.copyOf(sorted));
  }
  
  /**
   * Adds or replaces an aggregate, e.g. one computed in an earlier run.
   * @param aggregate The non-null aggregate descriptor.
   * @param records The non-null records in ascending order.
   */
  public synchronized void addAggregate(final SeriesDescriptor aggregate,
                                        final List<OutputRecord> records) {
    if (aggregate == null || !aggregate.isAggregate()) {
      throw new IllegalArgumentException("An aggregate descriptor is "
          + "required.");
    }
    aggregates.put(aggregate, ImmutableList.copyOf(records));
  }
  
  @Override
  public synchronized List<RawRecord> readOrderedRecords(
      final SeriesDescriptor series) {
    final List<RawRecord> records = raw.get(series);
    if (records == null) {
      LOG.debug("No records for {}", series);
      return ImmutableList.of();
    }
    return records;
  }
  
  @Override
  public synchronized Optional<SeriesDescriptor> findExistingAggregate(
      final String code,
      final int station,
      final String source,
      final IntervalKind interval) {
    final SeriesKey key = new SeriesKey(code, station, source);
    final List<SeriesDescriptor> matches = Lists.newArrayList();
    for (final SeriesDescriptor aggregate : aggregates.keySet()) {
      if (aggregate.key().equals(key) 
          && Objects.equals(aggregate.interval(), interval)) {
        matches.add(aggregate);
      }
    }
    if (matches.size() > 1) {
      throw new AmbiguousDependencyException("Multiple " + interval 
          + " aggregates stored for " + key, key, matches.size());
    }
    return matches.isEmpty() ? Optional.<SeriesDescriptor>empty() 
        : Optional.of(matches.get(0));
  }
  
  @Override
  public synchronized List<OutputRecord> loadRecordsWithProvenance(
      final SeriesDescriptor aggregate) {
    final List<OutputRecord> records = aggregates.get(aggregate);
    return records == null ? ImmutableList.<OutputRecord>of() : records;
  }
  
  @Override
  public Deferred<WriteStatus> persist(final OutputSeries series) {
    if (series == null) {
      return Deferred.fromError(
          new IllegalArgumentException("Series cannot be null."));
    }
    final Exception exception = write_exception;
    if (exception != null) {
      return Deferred.fromError(exception);
    }
    final WriteStatus status = write_status;
    if (status != null && status.state() != WriteStatus.WriteState.OK) {
      return Deferred.fromResult(status);
    }
    synchronized (this) {
      aggregates.put(series.descriptor(), 
          ImmutableList.copyOf(series.records()));
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Stored {}", series);
    }
    return Deferred.fromResult(WriteStatus.ok());
  }
  
  /**
   * @param status The status subsequent writes return, null to accept them.
   */
  public void setWriteStatus(final WriteStatus status) {
    write_status = status;
  }
  
  /**
   * @param exception The exception subsequent writes fail with, null to 
   * accept them.
   */
  public void setWriteException(final Exception exception) {
    write_exception = exception;
  }
  
  /** @return The stored aggregate descriptors in insertion order. */
  public synchronized List<SeriesDescriptor> aggregates() {
    return ImmutableList.copyOf(aggregates.keySet());
  }
}
