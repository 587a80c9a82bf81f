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
package net.climagg.core;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import net.climagg.aggregation.AggregationTask;
import net.climagg.configuration.ConfigurationException;
import net.climagg.data.SeriesKey;

/**
 * The tasks of one batch keyed by (code, station, source) in registration
 * order. A dependent task finds the producers of its auxiliary series here.
 * <p>
 * Built by the scheduler before any worker starts and only read afterwards.
 * A new registry is created for every batch.
 *
 * @since 1.0
 */
public class AggregationRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(
      AggregationRegistry.class);
  
  private final Map<SeriesKey, AggregationTask> tasks;
  
  public AggregationRegistry() {
    tasks = Maps.newLinkedHashMap();
  }
  
  /**
   * Adds a task.
   * @param task The non-null task.
   * @throws ConfigurationException if a task with the same key is already
   * registered. The first registration is kept.
   */
  public synchronized void register(final AggregationTask task) {
    if (task == null) {
      throw new IllegalArgumentException("Task cannot be null.");
    }
    final SeriesKey key = task.key();
    final AggregationTask extant = tasks.get(key);
    if (extant != null) {
      throw new ConfigurationException("Code/station/source multiplicity (" 
          + key + ") [" + task.descriptor().name() + "] already registered "
          + "for " + extant.descriptor().name());
    }
    tasks.put(key, task);
    if (LOG.isTraceEnabled()) {
      LOG.trace("Registered {}", task);
    }
  }
  
  /**
   * @param key A non-null key.
   * @return The registered task or null if none.
   */
  public synchronized AggregationTask get(final SeriesKey key) {
    return tasks.get(key);
  }
  
  public synchronized boolean contains(final SeriesKey key) {
    return tasks.containsKey(key);
  }
  
  /** @return The tasks in registration order. */
  public synchronized List<AggregationTask> tasks() {
    return ImmutableList.copyOf(tasks.values());
  }
  
  public synchronized int size() {
    return tasks.size();
  }
}
