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

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import net.climagg.aggregation.binning.BinningStrategies;
import net.climagg.aggregation.binning.TemporalBinner;
import net.climagg.aggregation.channel.AuxiliaryChannel;
import net.climagg.aggregation.channel.EmissionLog;
import net.climagg.aggregation.reduction.ReductionContext;
import net.climagg.aggregation.reduction.ReductionFunction;
import net.climagg.aggregation.reduction.ReductionResult;
import net.climagg.data.Bin;
import net.climagg.data.Coercion;
import net.climagg.data.OutputRecord;
import net.climagg.data.OutputSeries;
import net.climagg.data.RawRecord;
import net.climagg.data.SeriesDescriptor;
import net.climagg.data.SeriesKey;
import net.climagg.exceptions.PersistenceException;
import net.climagg.storage.SeriesStore;
import net.climagg.storage.WriteStatus;
import net.climagg.storage.WriteStatus.WriteState;

/**
 * The aggregation of one series: bins the parent's records, reduces each
 * bin, publishes the results to its {@link EmissionLog} for dependent tasks
 * and finally writes the output series to the store.
 * <p>
 * A task is built on the thread setting up the batch and run exactly once,
 * on a single worker. Once the emission log is finished the task is read 
 * only.
 *
 * @since 1.0
 */
public class AggregationTask implements TemporalBinner.IntervalSink {
  private static final Logger LOG = LoggerFactory.getLogger(
      AggregationTask.class);
  
  private final SeriesDescriptor descriptor;
  private final List<RawRecord> input;
  private final ReductionFunction reduction;
  private final Map<String, AuxiliaryChannel> auxiliaries;
  private final List<Double> sentinels;
  private final SeriesStore store;
  private final boolean commit;
  private final long persist_timeout;
  
  private final EmissionLog log;
  private final OutputSeries output;
  private final TaskStats stats;
  private final AtomicBoolean started;
  
  private volatile AggregationResult result;
  
  protected AggregationTask(final Builder builder) {
    if (builder.descriptor == null) {
      throw new IllegalArgumentException("Descriptor cannot be null.");
    }
    if (!builder.descriptor.isAggregate()) {
      throw new IllegalArgumentException("Series " + builder.descriptor.name() 
          + " is not an aggregate.");
    }
    if (builder.reduction == null) {
      throw new IllegalArgumentException("Reduction cannot be null.");
    }
    if (builder.commit && builder.store == null) {
      throw new IllegalArgumentException("A store is required to commit "
          + builder.descriptor.name());
    }
    descriptor = builder.descriptor;
    input = builder.input == null ? Collections.<RawRecord>emptyList() 
        : builder.input;
    reduction = builder.reduction;
    auxiliaries = Collections.unmodifiableMap(builder.auxiliaries);
    // sentinels are those of the data being binned
    sentinels = descriptor.parent() != null 
        ? descriptor.parent().sentinels() : descriptor.sentinels();
    store = builder.store;
    commit = builder.commit;
    persist_timeout = builder.persist_timeout;
    log = new EmissionLog(descriptor.name());
    output = new OutputSeries(descriptor);
    stats = new TaskStats();
    started = new AtomicBoolean();
  }
  
  /**
   * Runs the aggregation to the end. Errors are reported in the result, 
   * not thrown. Whatever happens, the emission log is finished when this
   * returns.
   * @return The non-null result.
   * @throws IllegalStateException if the task was already run or abandoned.
   */
  public AggregationResult run() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Task for " + descriptor.name() 
          + " was already started.");
    }
    LOG.debug("{}, {} started", descriptor.name(), descriptor.station());
    try {
      final TemporalBinner binner = new TemporalBinner(
          BinningStrategies.forDescriptor(descriptor), this);
      for (final RawRecord record : input) {
        stats.incrementRecordsRead();
        if (record.value() == null) {
          stats.incrementMissing();
        } else if (Double.isNaN(record.value()) 
            || Double.isInfinite(record.value())) {
          stats.incrementValidationFailures();
          LOG.warn("Dropping non-finite value {} of {}", record, 
              descriptor.name());
          continue;
        }
        binner.accept(record);
      }
      binner.finish();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.abandon();
      LOG.warn("Aggregation of {} was interrupted.", descriptor.name());
      result = AggregationResult.cancelled(this);
      return result;
    } catch (RuntimeException e) {
      log.abandon();
      LOG.error("Aggregation of {} failed.", descriptor.name(), e);
      result = AggregationResult.failed(this, e);
      return result;
    }
    log.finish();
    LOG.info("{} done: {}", descriptor.name(), stats);
    
    if (commit) {
      try {
        persist();
      } catch (PersistenceException e) {
        LOG.error("Failed to store {}", descriptor.name(), e);
        result = AggregationResult.failed(this, e);
        return result;
      }
    }
    result = AggregationResult.finished(this);
    return result;
  }
  
  /**
   * Marks a task that will never run as cancelled and releases any task
   * waiting on its emission log.
   * @return True if the task was abandoned, false if it had already started.
   */
  public boolean abandon() {
    if (!started.compareAndSet(false, true)) {
      return false;
    }
    log.abandon();
    result = AggregationResult.cancelled(this);
    LOG.debug("Abandoned aggregation of {}", descriptor.name());
    return true;
  }
  
  @Override
  public void step(final LocalDateTime t, final Bin bin) 
      throws InterruptedException {
    stats.incrementIntervals();
    stats.incrementRecordsBinned(bin.size());
    final ReductionResult reduced = reduction.reduce(new ReductionContext(
        bin, t, sentinels, output.last(), auxiliaries));
    OutputRecord record = null;
    if (reduced.isEmitted()) {
      final Coercion coercion = descriptor.type().coerce(reduced.value());
      if (coercion.isValid()) {
        record = new OutputRecord(t, coercion.value(), reduced.info(), bin);
        output.append(record);
        stats.incrementEmitted();
      } else {
        stats.incrementValidationFailures();
        LOG.warn("Dropping {} output of {} at {}: {}", reduction.name(), 
            descriptor.name(), t, coercion.message());
      }
    }
    log.publish(t, record);
  }
  
  private void persist() {
    final WriteStatus status;
    try {
      status = store.persist(output).join(persist_timeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PersistenceException("Interrupted while storing " 
          + descriptor.name(), e);
    } catch (Exception e) {
      throw new PersistenceException("Failed to store " 
          + descriptor.name(), e);
    }
    if (status == null || status.state() != WriteState.OK) {
      throw new PersistenceException("Store did not accept " 
          + descriptor.name() + ": " + status, status);
    }
    LOG.info("{} committed", descriptor.name());
  }
  
  public SeriesDescriptor descriptor() {
    return descriptor;
  }
  
  /** @return The registry key of the aggregate. */
  public SeriesKey key() {
    return descriptor.key();
  }
  
  public ReductionFunction reduction() {
    return reduction;
  }
  
  /** @return The open auxiliary channels by code. */
  public Map<String, AuxiliaryChannel> auxiliaries() {
    return auxiliaries;
  }
  
  /** @return The log dependents read from. */
  public EmissionLog emissionLog() {
    return log;
  }
  
  /** @return The output series. Only safe to read once the emission log is
   * finished. */
  public OutputSeries output() {
    return output;
  }
  
  public TaskStats stats() {
    return stats;
  }
  
  /** @return The result, null until the task ran or was abandoned. */
  public AggregationResult result() {
    return result;
  }
  
  @Override
  public String toString() {
    return "AggregationTask{" + descriptor.name() + " [" + key() + "], " 
        + reduction.name() + "}";
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private SeriesDescriptor descriptor;
    private List<RawRecord> input;
    private ReductionFunction reduction;
    private final Map<String, AuxiliaryChannel> auxiliaries = 
        Maps.newLinkedHashMap();
    private SeriesStore store;
    private boolean commit;
    private long persist_timeout = 60000;
    
    /**
     * @param descriptor The non-null aggregate descriptor.
     * @return The builder.
     */
    public Builder setDescriptor(final SeriesDescriptor descriptor) {
      this.descriptor = descriptor;
      return this;
    }
    
    /**
     * @param input The parent records in ascending order. Null is treated 
     * as empty.
     * @return The builder.
     */
    public Builder setInput(final List<RawRecord> input) {
      this.input = input == null ? null : ImmutableList.copyOf(input);
      return this;
    }
    
    public Builder setReduction(final ReductionFunction reduction) {
      this.reduction = reduction;
      return this;
    }
    
    /**
     * @param channel A non-null channel, replacing any for the same code.
     * @return The builder.
     */
    public Builder addAuxiliary(final AuxiliaryChannel channel) {
      auxiliaries.put(channel.code(), channel);
      return this;
    }
    
    public Builder setStore(final SeriesStore store) {
      this.store = store;
      return this;
    }
    
    /**
     * @param commit Whether or not to write the output to the store.
     * @return The builder.
     */
    public Builder setCommit(final boolean commit) {
      this.commit = commit;
      return this;
    }
    
    /**
     * @param persist_timeout How long to wait for the store, in 
     * milliseconds.
     * @return The builder.
     */
    public Builder setPersistTimeout(final long persist_timeout) {
      this.persist_timeout = persist_timeout;
      return this;
    }
    
    public AggregationTask build() {
      return new AggregationTask(this);
    }
  }
}
