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

import net.climagg.data.OutputSeries;
import net.climagg.data.SeriesDescriptor;

/**
 * What happened to one aggregation of a batch.
 *
 * @since 1.0
 */
public final class AggregationResult {
  
  public static enum Outcome {
    /** Ran to the end and produced records. */
    COMPLETED,
    
    /** Ran to the end without producing a record. */
    EMPTY,
    
    /** Failed, see {@link AggregationResult#error()}. */
    FAILED,
    
    /** Cancelled or interrupted before it could finish. */
    CANCELLED
  }
  
  private final Outcome outcome;
  private final SeriesDescriptor descriptor;
  private final OutputSeries series;
  private final TaskStats stats;
  private final Throwable error;
  
  private AggregationResult(final Outcome outcome,
                            final SeriesDescriptor descriptor,
                            final OutputSeries series,
                            final TaskStats stats,
                            final Throwable error) {
    this.outcome = outcome;
    this.descriptor = descriptor;
    this.series = series;
    this.stats = stats;
    this.error = error;
  }
  
  /**
   * @param task The finished task.
   * @return A COMPLETED or EMPTY result depending on the output.
   */
  static AggregationResult finished(final AggregationTask task) {
    return new AggregationResult(
        task.output().isEmpty() ? Outcome.EMPTY : Outcome.COMPLETED,
        task.descriptor(), task.output(), task.stats(), null);
  }
  
  /**
   * @param task The failed task.
   * @param error The non-null cause.
   * @return A FAILED result.
   */
  static AggregationResult failed(final AggregationTask task, 
                                  final Throwable error) {
    return new AggregationResult(Outcome.FAILED, task.descriptor(), 
        task.output(), task.stats(), error);
  }
  
  /**
   * Result of a task that couldn't even be constructed, e.g. because an
   * auxiliary series is missing.
   * @param descriptor The descriptor of the aggregate.
   * @param error The non-null cause.
   * @return A FAILED result.
   */
  public static AggregationResult failed(final SeriesDescriptor descriptor, 
                                         final Throwable error) {
    return new AggregationResult(Outcome.FAILED, descriptor, 
        new OutputSeries(descriptor), new TaskStats(), error);
  }
  
  /**
   * @param task The cancelled task.
   * @return A CANCELLED result.
   */
  static AggregationResult cancelled(final AggregationTask task) {
    return new AggregationResult(Outcome.CANCELLED, task.descriptor(), 
        task.output(), task.stats(), null);
  }
  
  public Outcome outcome() {
    return outcome;
  }
  
  public SeriesDescriptor descriptor() {
    return descriptor;
  }
  
  /** @return The output, possibly partial for failed tasks. */
  public OutputSeries series() {
    return series;
  }
  
  public TaskStats stats() {
    return stats;
  }
  
  /** @return The cause of a failure, null otherwise. */
  public Throwable error() {
    return error;
  }
  
  @Override
  public String toString() {
    return "AggregationResult{" + descriptor.name() + ": " + outcome 
        + (error == null ? "" : " (" + error.getMessage() + ")") 
        + ", " + stats + "}";
  }
}
