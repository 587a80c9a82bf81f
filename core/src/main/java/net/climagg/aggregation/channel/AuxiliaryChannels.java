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

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.climagg.aggregation.AggregationTask;
import net.climagg.core.AggregationRegistry;
import net.climagg.data.OutputRecord;
import net.climagg.data.SeriesDescriptor;
import net.climagg.data.SeriesKey;
import net.climagg.exceptions.AmbiguousDependencyException;
import net.climagg.exceptions.MissingDependencyException;
import net.climagg.storage.SeriesStore;

/**
 * Resolves the auxiliary series of an aggregation: a task for the same
 * station and source registered in the current batch is read live,
 * otherwise an aggregate with the same interval is replayed from the store.
 *
 * @since 1.0
 */
public final class AuxiliaryChannels {
  private static final Logger LOG = LoggerFactory.getLogger(
      AuxiliaryChannels.class);

  private AuxiliaryChannels() {
  }
  
  /**
   * Opens a channel to the sibling series with the given code.
   * @param code The code of the auxiliary series.
   * @param dependent The non-null descriptor of the reading aggregate.
   * @param registry The non-null registry of the current batch.
   * @param store The store to fall back to, may be null.
   * @return A non-null channel.
   * @throws MissingDependencyException if the series is neither registered
   * nor stored with at least one record.
   * @throws AmbiguousDependencyException if the store has more than one
   * matching aggregate.
   */
  public static AuxiliaryChannel open(final String code, 
                                      final SeriesDescriptor dependent,
                                      final AggregationRegistry registry,
                                      final SeriesStore store) {
    final SeriesKey key = dependent.key().withCode(code);
    final AggregationTask producer = registry.get(key);
    if (producer != null) {
      if (producer.descriptor().interval() != dependent.interval()) {
        throw new MissingDependencyException("Auxiliary series " + key 
            + " for " + dependent.name() + " is aggregated by " 
            + producer.descriptor().interval() + ", not " 
            + dependent.interval(), key);
      }
      LOG.debug("Auxiliary {} for {} started with running aggregation.", 
          code, dependent.name());
      return new LiveChannel(code, producer.emissionLog());
    }
    
    if (store == null) {
      throw new MissingDependencyException("Auxiliary series " + key 
          + " for " + dependent.name() + " is not available.", key);
    }
    final Optional<SeriesDescriptor> stored = store.findExistingAggregate(
        code, dependent.station(), dependent.source(), dependent.interval());
    if (!stored.isPresent()) {
      throw new MissingDependencyException("Auxiliary series " + key 
          + " for " + dependent.name() + " is not available.", key);
    }
    final List<OutputRecord> records = 
        store.loadRecordsWithProvenance(stored.get());
    if (records == null || records.isEmpty()) {
      throw new MissingDependencyException("No records stored for auxiliary "
          + "series " + key + " of " + dependent.name(), key);
    }
    LOG.debug("Auxiliary {} for {} started from existing aggregation with {} "
        + "records.", code, dependent.name(), records.size());
    return new ReplayChannel(code, records);
  }
}
