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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.stumbleupon.async.Deferred;

import net.climagg.aggregation.AggregationResult;
import net.climagg.aggregation.AggregationResult.Outcome;
import net.climagg.aggregation.reduction.CircularMean;
import net.climagg.aggregation.reduction.Mean;
import net.climagg.configuration.AggregationConfig;
import net.climagg.configuration.AggregationProfile;
import net.climagg.configuration.Config;
import net.climagg.configuration.ConfigurationException;
import net.climagg.data.IntervalKind;
import net.climagg.data.OutputSeries;
import net.climagg.data.RawRecord;
import net.climagg.data.SeriesDescriptor;
import net.climagg.exceptions.MissingDependencyException;
import net.climagg.exceptions.PersistenceException;
import net.climagg.storage.InMemorySeriesStore;
import net.climagg.storage.WriteStatus;

public class TestAggregationScheduler {
  private static final LocalDateTime START = LocalDateTime.of(2000, 1, 1, 7, 0);
  private static final LocalDateTime DAY_ONE = LocalDateTime.of(2000, 1, 2, 6, 0);
  private static final int STATION = 6180;
  
  private Config config;
  private InMemorySeriesStore store;
  private AggregationProfile profile;
  private SeriesDescriptor raw_d;
  private SeriesDescriptor raw_f;
  private SeriesDescriptor raw_t;
  
  @Before
  public void before() throws Exception {
    config = new Config();
    config.overrideConfig(Config.WORKER_POLL_KEY, "10");
    store = new InMemorySeriesStore();
    profile = AggregationProfile.load("dmi-daily");
    
    raw_d = raw("d");
    raw_f = raw("f");
    raw_t = raw("t");
    
    // every fourth hour is calm and blows from the south, the rest from 
    // the east
    final List<RawRecord> d = Lists.newArrayList();
    final List<RawRecord> f = Lists.newArrayList();
    final List<RawRecord> t = Lists.newArrayList();
    for (int i = 0; i < 48; i++) {
      final boolean calm = i % 4 == 0;
      d.add(RawRecord.of(START.plusHours(i), calm ? 180.0 : 90.0));
      f.add(RawRecord.of(START.plusHours(i), calm ? 0.0 : 5.0));
      t.add(RawRecord.of(START.plusHours(i), (double) (i / 24)));
    }
    store.addSeries(raw_d, d);
    store.addSeries(raw_f, f);
    store.addSeries(raw_t, t);
  }
  
  private static SeriesDescriptor raw(final String code) {
    return SeriesDescriptor.newBuilder()
        .setCode(code)
        .setStation(STATION)
        .setSource("dmi")
        .build();
  }
  
  private static AggregationConfig ave(final String... aux_fields) {
    return new AggregationConfig(null, Mean.NAME, 
        Lists.newArrayList(aux_fields), null, null, null, null, null, false);
  }
  
  @Test
  public void ctor() throws Exception {
    try {
      new AggregationScheduler(null, store);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new AggregationScheduler(config, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void windWithLiveSpeeds() throws Exception {
    final AggregationScheduler scheduler = 
        new AggregationScheduler(config, store);
    final List<AggregationResult> results = scheduler.runThreads(
        Lists.newArrayList(raw_d, raw_f), profile, 2);
    
    assertEquals(2, results.size());
    // speeds are scheduled before the directions that read them
    final AggregationResult f = results.get(0);
    final AggregationResult d = results.get(1);
    assertEquals("f", f.descriptor().code());
    assertEquals("d", d.descriptor().code());
    assertSame(Outcome.COMPLETED, f.outcome());
    assertSame(Outcome.COMPLETED, d.outcome());
    
    assertEquals(2, f.series().size());
    assertEquals(3.75, f.series().records().get(0).value(), 0.0000001);
    assertEquals(2, d.series().size());
    assertEquals(DAY_ONE, d.series().records().get(0).timestamp());
    assertEquals(90, d.series().records().get(0).value(), 0.0000001);
    assertEquals(18, (int) d.series().records().get(0).info());
    assertEquals(90, d.series().last().value(), 0.0000001);
    
    assertEquals(2, store.aggregates().size());
  }
  
  @Test
  public void windWithStoredSpeeds() throws Exception {
    final AggregationScheduler scheduler = 
        new AggregationScheduler(config, store);
    assertSame(Outcome.COMPLETED, scheduler.runThreads(
        Lists.newArrayList(raw_f), profile, 1).get(0).outcome());
    
    final List<AggregationResult> results = scheduler.runThreads(
        Lists.newArrayList(raw_d), profile, 1);
    assertEquals(1, results.size());
    assertEquals(90, results.get(0).series().last().value(), 0.0000001);
    assertEquals(18, (int) results.get(0).series().last().info());
  }
  
  @Test
  public void windWithoutSpeeds() throws Exception {
    final AggregationScheduler scheduler = 
        new AggregationScheduler(config, store);
    final List<AggregationResult> results = scheduler.runThreads(
        Lists.newArrayList(raw_d), profile, 1);
    
    assertSame(Outcome.COMPLETED, results.get(0).outcome());
    // every sample counts so the calm hours pull the mean south
    assertEquals(108, results.get(0).series().last().value(), 0.0000001);
    assertEquals(24, (int) results.get(0).series().last().info());
  }
  
  @Test
  public void requiredAuxiliaryMissing() throws Exception {
    config.overrideConfig(Config.REQUIRE_AUXILIARY_KEY, "true");
    final AggregationScheduler scheduler = 
        new AggregationScheduler(config, store);
    final List<AggregationResult> results = scheduler.runThreads(
        Lists.newArrayList(raw_d, raw_t), profile, 2);
    
    assertEquals(2, results.size());
    assertSame(Outcome.FAILED, results.get(0).outcome());
    assertTrue(results.get(0).error() instanceof MissingDependencyException);
    assertSame(Outcome.COMPLETED, results.get(1).outcome());
    assertEquals(1, store.aggregates().size());
  }
  
  @Test
  public void unconfiguredCodesAreSkipped() throws Exception {
    final SeriesDescriptor raw_x = raw("x");
    store.addSeries(raw_x, Lists.newArrayList(RawRecord.of(START, 1.0)));
    final List<AggregationResult> results = new AggregationScheduler(
        config, store).runThreads(Lists.newArrayList(raw_x, raw_t), profile, 2);
    assertEquals(1, results.size());
    assertEquals("t", results.get(0).descriptor().code());
    assertEquals(1.0, results.get(0).series().last().value(), 0.0000001);
  }
  
  @Test
  public void defaultsFromConfig() throws Exception {
    config.overrideConfig(Config.COMMIT_KEY, "false");
    final List<AggregationResult> results = new AggregationScheduler(
        config, store).runThreads(Lists.newArrayList(raw_t));
    assertSame(Outcome.COMPLETED, results.get(0).outcome());
    assertSame(IntervalKind.DAY, results.get(0).descriptor().interval());
    assertTrue(store.aggregates().isEmpty());
  }
  
  @Test
  public void nothingToDo() throws Exception {
    assertTrue(new AggregationScheduler(config, store).runThreads(
        Lists.<SeriesDescriptor>newArrayList(), profile, 4).isEmpty());
  }
  
  @Test
  public void dependencyCycle() throws Exception {
    final Map<String, AggregationConfig> aggregations = Maps.newLinkedHashMap();
    aggregations.put("t", ave("f"));
    aggregations.put("f", ave("d"));
    aggregations.put("d", ave("t"));
    final AggregationProfile cyclic = new AggregationProfile(
        IntervalKind.DAY, aggregations);
    final AggregationScheduler scheduler = 
        new AggregationScheduler(config, store);
    try {
      scheduler.runThreads(Lists.newArrayList(raw_t, raw_f, raw_d), cyclic, 2);
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { 
      assertTrue(e.getMessage().contains("cycle"));
    }
    assertTrue(store.aggregates().isEmpty());
    
    // the scheduler is usable again
    assertEquals(1, scheduler.runThreads(Lists.newArrayList(raw_t), 
        profile, 1).size());
  }
  
  @Test
  public void duplicateSeries() throws Exception {
    store.addSeries(raw("t"), Lists.newArrayList(RawRecord.of(START, 1.0)));
    try {
      new AggregationScheduler(config, store).runThreads(
          Lists.newArrayList(raw_t, raw("t")), profile, 2);
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
    assertTrue(store.aggregates().isEmpty());
  }
  
  @Test
  public void unknownReduction() throws Exception {
    final AggregationProfile bad = new AggregationProfile(IntervalKind.DAY, 
        ImmutableMap.of("t", new AggregationConfig(null, "median", null, null, 
            null, null, null, null, false)));
    try {
      new AggregationScheduler(config, store).runThreads(
          Lists.newArrayList(raw_t), bad, 1);
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }
  
  @Test
  public void persistenceFailure() throws Exception {
    store.setWriteStatus(WriteStatus.rejected("Read only"));
    final List<AggregationResult> results = new AggregationScheduler(
        config, store).runThreads(Lists.newArrayList(raw_f, raw_t), profile, 2);
    for (final AggregationResult result : results) {
      assertSame(Outcome.FAILED, result.outcome());
      assertTrue(result.error() instanceof PersistenceException);
    }
  }
  
  @Test
  public void order() throws Exception {
    final AggregationScheduler.Plan d = plan(raw_d, "f");
    final AggregationScheduler.Plan f = plan(raw_f);
    final AggregationScheduler.Plan t = plan(raw_t, "d");
    final List<AggregationScheduler.Plan> ordered = 
        AggregationScheduler.order(Lists.newArrayList(t, d, f));
    assertEquals(Lists.newArrayList(f, d, t), ordered);
    
    // unknown auxiliaries don't constrain anything
    final AggregationScheduler.Plan x = plan(raw("x"), "y");
    assertEquals(Lists.newArrayList(x, f), 
        AggregationScheduler.order(Lists.newArrayList(x, f)));
  }
  
  @Test
  public void runAggregation() throws Exception {
    final AggregationScheduler scheduler = 
        new AggregationScheduler(config, store);
    scheduler.runThreads(Lists.newArrayList(raw_f), profile, 1);
    
    final SeriesDescriptor daily_d = SeriesDescriptor.aggregateOf(raw_d)
        .setInterval(IntervalKind.DAY)
        .setReduction(CircularMean.NAME)
        .build();
    final AggregationResult result = scheduler.runAggregation(daily_d, 
        new CircularMean(), Lists.newArrayList("f"));
    assertSame(Outcome.COMPLETED, result.outcome());
    assertEquals(90, result.series().last().value(), 0.0000001);
    assertEquals(2, store.aggregates().size());
  }
  
  @Test
  public void runAggregationRequiresParent() throws Exception {
    try {
      new AggregationScheduler(config, store).runAggregation(raw_d, 
          new CircularMean(), null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void cancel() throws Exception {
    final BlockingStore blocking = new BlockingStore();
    blocking.addSeries(raw_t, store.readOrderedRecords(raw_t));
    blocking.addSeries(raw_f, store.readOrderedRecords(raw_f));
    blocking.addSeries(raw_d, store.readOrderedRecords(raw_d));
    final AggregationScheduler scheduler = 
        new AggregationScheduler(config, blocking);
    
    final AtomicReference<List<AggregationResult>> results = 
        new AtomicReference<List<AggregationResult>>();
    final Thread batch = new Thread(new Runnable() {
      @Override
      public void run() {
        try {
          results.set(scheduler.runThreads(
              Lists.newArrayList(raw_t, raw_f, raw_d), profile, 1));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
    });
    batch.start();
    assertTrue(blocking.persisting.await(5, TimeUnit.SECONDS));
    
    try {
      scheduler.runThreads(Lists.newArrayList(raw_t), profile, 1);
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
    
    scheduler.cancel();
    assertTrue(scheduler.isCancelled());
    blocking.pending.callback(WriteStatus.ok());
    batch.join(5000);
    
    final List<AggregationResult> list = results.get();
    assertEquals(3, list.size());
    assertEquals("t", list.get(0).descriptor().code());
    assertSame(Outcome.COMPLETED, list.get(0).outcome());
    assertSame(Outcome.CANCELLED, list.get(1).outcome());
    assertSame(Outcome.CANCELLED, list.get(2).outcome());
    assertEquals(1, blocking.aggregates().size());
  }
  
  @Test
  public void cancelDuringSetup() throws Exception {
    final CancellingStore cancelling = new CancellingStore();
    cancelling.addSeries(raw_t, store.readOrderedRecords(raw_t));
    cancelling.addSeries(raw_d, store.readOrderedRecords(raw_d));
    final AggregationScheduler scheduler = 
        new AggregationScheduler(config, cancelling);
    cancelling.scheduler = scheduler;
    
    final AtomicReference<List<AggregationResult>> results = 
        new AtomicReference<List<AggregationResult>>();
    final Thread batch = new Thread(new Runnable() {
      @Override
      public void run() {
        try {
          results.set(scheduler.runThreads(
              Lists.newArrayList(raw_t, raw_d), profile, 2));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
    });
    batch.start();
    batch.join(5000);
    assertFalse(batch.isAlive());
    
    final List<AggregationResult> list = results.get();
    assertEquals(2, list.size());
    for (final AggregationResult result : list) {
      assertSame(Outcome.CANCELLED, result.outcome());
    }
    assertTrue(scheduler.isCancelled());
    assertTrue(cancelling.aggregates().isEmpty());
    
    // the next batch starts afresh
    cancelling.scheduler = null;
    assertSame(Outcome.COMPLETED, scheduler.runThreads(
        Lists.newArrayList(raw_t), profile, 1).get(0).outcome());
  }
  
  private static AggregationScheduler.Plan plan(final SeriesDescriptor raw, 
                                                final String... aux) {
    return new AggregationScheduler.Plan(SeriesDescriptor.aggregateOf(raw)
        .setInterval(IntervalKind.DAY)
        .setReduction(Mean.NAME)
        .build(), new Mean(), Lists.newArrayList(aux));
  }
  
  /** Holds the first write until the test completes it. */
  private static class BlockingStore extends InMemorySeriesStore {
    final CountDownLatch persisting = new CountDownLatch(1);
    volatile Deferred<WriteStatus> pending;
    
    @Override
    public Deferred<WriteStatus> persist(final OutputSeries series) {
      if (pending == null) {
        super.persist(series);
        pending = new Deferred<WriteStatus>();
        persisting.countDown();
        return pending;
      }
      return super.persist(series);
    }
  }
  
  /** Cancels the scheduler while it reads the input of a task. */
  private static class CancellingStore extends InMemorySeriesStore {
    volatile AggregationScheduler scheduler;
    
    @Override
    public synchronized List<RawRecord> readOrderedRecords(
        final SeriesDescriptor descriptor) {
      final AggregationScheduler to_cancel = scheduler;
      if (to_cancel != null) {
        to_cancel.cancel();
      }
      return super.readOrderedRecords(descriptor);
    }
  }
}
