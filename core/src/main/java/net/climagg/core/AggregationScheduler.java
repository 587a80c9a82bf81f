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
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import net.climagg.aggregation.AggregationResult;
import net.climagg.aggregation.AggregationTask;
import net.climagg.aggregation.channel.AuxiliaryChannels;
import net.climagg.aggregation.reduction.ReductionFunction;
import net.climagg.aggregation.reduction.ReductionFunctions;
import net.climagg.configuration.AggregationConfig;
import net.climagg.configuration.AggregationProfile;
import net.climagg.configuration.Config;
import net.climagg.configuration.ConfigurationException;
import net.climagg.data.SeriesDescriptor;
import net.climagg.data.SeriesKey;
import net.climagg.exceptions.DependencyException;
import net.climagg.exceptions.MissingDependencyException;
import net.climagg.storage.SeriesStore;

/**
 * Runs batches of aggregations on a bounded pool of workers.
 * <p>
 * A batch is set up entirely on the calling thread: the requested series
 * are ordered so that the producers of auxiliary series come before their
 * readers, then every task is built and registered in that order. Any 
 * {@link ConfigurationException} aborts the batch before a worker starts.
 * A task whose auxiliary series can't be resolved fails on its own.
 * <p>
 * The workers then take tasks from a FIFO queue until it's drained. Since a
 * producer is always dequeued before its readers, a reader only ever waits 
 * on a task that is running or done.
 * <p>
 * One scheduler runs one batch at a time. {@link #cancel()} may be called
 * from any thread.
 *
 * @since 1.0
 */
public class AggregationScheduler {
  private static final Logger LOG = LoggerFactory.getLogger(
      AggregationScheduler.class);
  
  /** Thread name format of the workers. */
  public static final String WORKER_NAME_FORMAT = "aggregator-worker-%d";
  
  private final Config config;
  private final SeriesStore store;
  
  /** Tasks waiting for a worker. */
  private final LinkedBlockingQueue<AggregationTask> queue;
  
  /** Set once every task of the batch is queued. */
  private final AtomicBoolean stop;
  
  private final AtomicBoolean running;
  
  private volatile boolean cancelled;
  
  /** Counted down once per task that ran or was abandoned. */
  private volatile CountDownLatch completion;
  
  /**
   * Default ctor.
   * @param config The non-null config.
   * @param store The non-null store.
   */
  public AggregationScheduler(final Config config, final SeriesStore store) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    this.config = config;
    this.store = store;
    queue = new LinkedBlockingQueue<AggregationTask>();
    stop = new AtomicBoolean();
    running = new AtomicBoolean();
  }
  
  /**
   * Runs a batch with the profile and worker count from the config.
   * @param series The raw series to aggregate.
   * @return One result per series the profile covers.
   * @throws InterruptedException if interrupted while waiting for the batch.
   * @throws ConfigurationException if the batch couldn't be set up.
   */
  public List<AggregationResult> runThreads(final List<SeriesDescriptor> series) 
      throws InterruptedException {
    return runThreads(series, 
        AggregationProfile.load(config.getString(Config.PROFILE_KEY)),
        config.workers());
  }
  
  /**
   * Aggregates the given series concurrently and waits for all of them.
   * @param series The non-null raw series to aggregate. Series whose code
   * the profile doesn't cover are skipped.
   * @param profile The non-null profile.
   * @param workers The maximum number of concurrent aggregations, at 
   * least 1.
   * @return One result per aggregated series in dependency order, including
   * the tasks that failed during setup.
   * @throws InterruptedException if interrupted while waiting for the batch.
   * The batch is cancelled first.
   * @throws ConfigurationException if the batch couldn't be set up. No 
   * aggregation has run in that case.
   */
  public List<AggregationResult> runThreads(final List<SeriesDescriptor> series,
                                            final AggregationProfile profile,
                                            final int workers) 
      throws InterruptedException {
    if (series == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    if (profile == null) {
      throw new IllegalArgumentException("Profile cannot be null.");
    }
    if (workers < 1) {
      throw new IllegalArgumentException("Workers must be at least 1: " 
          + workers);
    }
    if (!running.compareAndSet(false, true)) {
      throw new IllegalStateException("A batch is already running.");
    }
    try {
      cancelled = false;
      stop.set(false);
      queue.clear();
      
      final List<Plan> plans = order(plan(series, profile));
      final AggregationRegistry registry = new AggregationRegistry();
      final Map<Plan, AggregationResult> setup_failures = Maps.newHashMap();
      final Map<Plan, AggregationTask> tasks = Maps.newHashMap();
      try {
        for (final Plan plan : plans) {
          try {
            final AggregationTask task = build(plan, registry);
            registry.register(task);
            tasks.put(plan, task);
          } catch (DependencyException e) {
            LOG.error("Unable to aggregate {}: {}", plan.descriptor.name(), 
                e.getMessage());
            setup_failures.put(plan, 
                AggregationResult.failed(plan.descriptor, e));
          }
        }
      } catch (RuntimeException e) {
        for (final AggregationTask task : registry.tasks()) {
          task.abandon();
        }
        throw e;
      }
      
      execute(registry.tasks(), workers);
      
      final List<AggregationResult> results = 
          Lists.newArrayListWithCapacity(plans.size());
      for (final Plan plan : plans) {
        final AggregationTask task = tasks.get(plan);
        if (task == null) {
          results.add(setup_failures.get(plan));
        } else if (task.result() == null) {
          results.add(AggregationResult.failed(plan.descriptor, 
              new IllegalStateException("Aggregation did not complete.")));
        } else {
          results.add(task.result());
        }
      }
      return results;
    } finally {
      running.set(false);
    }
  }
  
  /**
   * Runs a single aggregation on the calling thread. Auxiliary series are
   * replayed from the store.
   * @param descriptor The non-null aggregate descriptor with a parent.
   * @param reduction The non-null reduction.
   * @param auxiliaries Codes of the auxiliary series, may be null.
   * @return The result.
   * @throws DependencyException if an auxiliary series couldn't be resolved
   * and the config requires it.
   */
  public AggregationResult runAggregation(final SeriesDescriptor descriptor,
                                          final ReductionFunction reduction,
                                          final List<String> auxiliaries) {
    if (descriptor == null || descriptor.parent() == null) {
      throw new IllegalArgumentException("An aggregate descriptor with a "
          + "parent is required.");
    }
    final Plan plan = new Plan(descriptor, reduction, 
        auxiliaries == null ? Lists.<String>newArrayList() : auxiliaries);
    final AggregationRegistry registry = new AggregationRegistry();
    final AggregationTask task = build(plan, registry);
    registry.register(task);
    return task.run();
  }
  
  /**
   * Cancels the running batch: tasks that haven't started are abandoned,
   * running tasks finish. A no-op if no batch is running.
   */
  public void cancel() {
    cancelled = true;
    abandonQueued();
  }
  
  public boolean isCancelled() {
    return cancelled;
  }
  
  /**
   * Drains the queue, abandoning each task and counting it as complete.
   */
  private void abandonQueued() {
    final List<AggregationTask> pending = Lists.newArrayList();
    queue.drainTo(pending);
    if (!pending.isEmpty()) {
      LOG.warn("Cancelling {} pending aggregations.", pending.size());
    }
    for (final AggregationTask task : pending) {
      try {
        task.abandon();
      } finally {
        final CountDownLatch latch = completion;
        if (latch != null) {
          latch.countDown();
        }
      }
    }
  }
  
  /**
   * Resolves profile entries and reductions.
   */
  private List<Plan> plan(final List<SeriesDescriptor> series, 
                          final AggregationProfile profile) {
    final List<Plan> plans = Lists.newArrayListWithCapacity(series.size());
    for (final SeriesDescriptor parent : series) {
      final AggregationConfig entry = profile.forCode(parent.code());
      if (entry == null) {
        LOG.info("No aggregation configured for {} ({}), skipping.", 
            parent.name(), parent.code());
        continue;
      }
      final SeriesDescriptor descriptor;
      try {
        descriptor = entry.describe(parent, profile.getInterval());
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("Invalid aggregation of " 
            + parent.name(), e);
      }
      plans.add(new Plan(descriptor, 
          ReductionFunctions.create(entry.getFunc(), entry), 
          entry.getAuxFields()));
    }
    return plans;
  }
  
  /**
   * Orders the plans so that producers of auxiliary series precede their
   * readers, otherwise keeping the requested order. Dependencies outside the
   * batch are ignored here.
   * @throws ConfigurationException on a dependency cycle.
   */
  static List<Plan> order(final List<Plan> plans) {
    final Map<SeriesKey, Plan> by_key = Maps.newHashMap();
    for (final Plan plan : plans) {
      // on duplicates the first one wins, the registry rejects the second
      if (!by_key.containsKey(plan.descriptor.key())) {
        by_key.put(plan.descriptor.key(), plan);
      }
    }
    final List<Plan> ordered = Lists.newArrayListWithCapacity(plans.size());
    final Set<Plan> visited = Sets.newHashSet();
    final List<Plan> path = Lists.newArrayList();
    for (final Plan plan : plans) {
      visit(plan, by_key, visited, path, ordered);
    }
    return ordered;
  }
  
  private static void visit(final Plan plan, 
                            final Map<SeriesKey, Plan> by_key,
                            final Set<Plan> visited,
                            final List<Plan> path,
                            final List<Plan> ordered) {
    if (visited.contains(plan)) {
      return;
    }
    if (path.contains(plan)) {
      final StringBuilder buf = new StringBuilder();
      for (final Plan step : path.subList(path.indexOf(plan), path.size())) {
        buf.append(step.descriptor.code()).append(" -> ");
      }
      buf.append(plan.descriptor.code());
      throw new ConfigurationException("Auxiliary dependency cycle at station "
          + plan.descriptor.station() + ": " + buf);
    }
    path.add(plan);
    for (final String code : plan.auxiliaries) {
      final Plan dependency = by_key.get(plan.descriptor.key().withCode(code));
      if (dependency != null) {
        visit(dependency, by_key, visited, path, ordered);
      }
    }
    path.remove(path.size() - 1);
    visited.add(plan);
    ordered.add(plan);
  }
  
  /**
   * Opens the channels, reads the input and builds the task.
   */
  private AggregationTask build(final Plan plan, 
                                final AggregationRegistry registry) {
    final AggregationTask.Builder builder = AggregationTask.newBuilder()
        .setDescriptor(plan.descriptor)
        .setReduction(plan.reduction)
        .setStore(store)
        .setCommit(config.commit())
        .setPersistTimeout(config.getLong(Config.PERSIST_TIMEOUT_KEY));
    for (final String code : plan.auxiliaries) {
      try {
        builder.addAuxiliary(AuxiliaryChannels.open(
            code, plan.descriptor, registry, store));
      } catch (MissingDependencyException e) {
        if (config.requireAuxiliary()) {
          throw e;
        }
        LOG.warn("{} Aggregating {} without it.", e.getMessage(), 
            plan.descriptor.name());
      }
    }
    builder.setInput(store.readOrderedRecords(plan.descriptor.parent()));
    return builder.build();
  }
  
  /**
   * Queues the tasks and blocks until each ran or was abandoned.
   */
  private void execute(final List<AggregationTask> tasks, final int workers) 
      throws InterruptedException {
    if (tasks.isEmpty()) {
      LOG.info("Nothing to aggregate.");
      return;
    }
    completion = new CountDownLatch(tasks.size());
    queue.addAll(tasks);
    stop.set(true);
    // cancelled during setup
    if (cancelled) {
      abandonQueued();
    }
    
    final int threads = Math.min(workers, tasks.size());
    final ExecutorService executor = new ThreadPoolExecutor(threads, threads, 
        0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<Runnable>(),
        new ThreadFactoryBuilder()
          .setNameFormat(WORKER_NAME_FORMAT)
          .setDaemon(true)
          .build());
    LOG.info("Aggregating {} series with {} workers.", tasks.size(), threads);
    final long poll = config.getLong(Config.WORKER_POLL_KEY);
    for (int i = 0; i < threads; i++) {
      executor.execute(new Worker(poll));
    }
    executor.shutdown();
    
    try {
      completion.await();
    } catch (InterruptedException e) {
      LOG.warn("Interrupted while waiting for the batch, cancelling.");
      cancel();
      executor.shutdownNow();
      throw e;
    }
    if (!executor.awaitTermination(poll * 10, TimeUnit.MILLISECONDS)) {
      LOG.warn("Workers did not exit in time.");
    }
    if (cancelled) {
      LOG.warn("Batch was cancelled.");
    }
  }
  
  /**
   * Takes tasks off the queue until it's drained and the stop flag is set.
   */
  private class Worker implements Runnable {
    private final long poll;
    
    Worker(final long poll) {
      this.poll = poll;
    }
    
    @Override
    public void run() {
      while (!cancelled) {
        final AggregationTask task;
        try {
          task = queue.poll(poll, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        if (task == null) {
          if (stop.get() && queue.isEmpty()) {
            return;
          }
          continue;
        }
        try {
          task.run();
        } catch (RuntimeException e) {
          LOG.error("Unexpected exception running {}", task, e);
        } finally {
          completion.countDown();
        }
      }
      abandonQueued();
    }
  }
  
  /** A series to aggregate along with its resolved settings. */
  static final class Plan {
    final SeriesDescriptor descriptor;
    final ReductionFunction reduction;
    final List<String> auxiliaries;
    
    Plan(final SeriesDescriptor descriptor, 
         final ReductionFunction reduction,
         final List<String> auxiliaries) {
      if (reduction == null) {
        throw new IllegalArgumentException("Reduction cannot be null.");
      }
      this.descriptor = descriptor;
      this.reduction = reduction;
      this.auxiliaries = auxiliaries;
    }
    
    @Override
    public String toString() {
      return descriptor.name() + " " + auxiliaries;
    }
  }
}
