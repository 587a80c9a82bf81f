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
import java.util.Optional;

import com.stumbleupon.async.Deferred;

import net.climagg.data.IntervalKind;
import net.climagg.data.OutputRecord;
import net.climagg.data.OutputSeries;
import net.climagg.data.RawRecord;
import net.climagg.data.SeriesDescriptor;
import net.climagg.exceptions.AmbiguousDependencyException;

/**
 * The storage collaborator of the aggregation engine. Implementations own
 * the persistent representation; the engine only reads ordered records,
 * looks up existing aggregates for replay and hands finished series back.
 * <p>
 * Reads are called from the thread that sets up a batch, persistence from
 * the worker that ran the aggregation, so implementations must be thread
 * safe.
 * 
 * @since 1.0
 */
public interface SeriesStore {

  /**
   * Reads the records of a series in ascending timestamp order.
   * @param series A non-null series descriptor.
   * @return A non-null, possibly empty list.
   */
  public List<RawRecord> readOrderedRecords(final SeriesDescriptor series);

  /**
   * Looks up a previously stored aggregate.
   * @param code The variable code.
   * @param station The station.
   * @param source The source, may be null.
   * @param interval The non-null interval of the aggregate.
   * @return The descriptor if exactly one aggregate matched, empty if none.
   * @throws AmbiguousDependencyException if more than one matched.
   */
  public Optional<SeriesDescriptor> findExistingAggregate(
      final String code,
      final int station,
      final String source,
      final IntervalKind interval);

  /**
   * Loads the records of a stored aggregate, each carrying the raw records
   * it was computed from.
   * @param aggregate A non-null aggregate descriptor.
   * @return A non-null, possibly empty list in ascending timestamp order.
   */
  public List<OutputRecord> loadRecordsWithProvenance(
      final SeriesDescriptor aggregate);

  /**
   * Stores an aggregated series, all or nothing.
   * @param series The non-null series to store.
   * @return A deferred resolving to the status of the write. Exceptions
   * may also be passed through the deferred.
   */
  public Deferred<WriteStatus> persist(final OutputSeries series);
}
