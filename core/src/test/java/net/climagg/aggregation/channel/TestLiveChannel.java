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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Before;
import org.junit.Test;

import net.climagg.data.Bin;
import net.climagg.data.OutputRecord;
import net.climagg.data.RawRecord;

public class TestLiveChannel {
  private static final LocalDateTime T = LocalDateTime.of(2000, 1, 2, 6, 0);
  
  private EmissionLog log;
  private LiveChannel channel;
  
  @Before
  public void before() throws Exception {
    log = new EmissionLog("f day");
    channel = new LiveChannel("f", log);
  }
  
  private static OutputRecord record(final LocalDateTime t, 
                                     final double value) {
    return new OutputRecord(t, value, 1, Bin.of(RawRecord.of(t, value)));
  }
  
  @Test
  public void ctor() throws Exception {
    assertEquals("f", channel.code());
    assertTrue(channel.isLive());
    
    try {
      new LiveChannel("f", null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new LiveChannel("", log);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void readPublished() throws Exception {
    final OutputRecord first = record(T, 4.0);
    final OutputRecord third = record(T.plusDays(2), 6.0);
    log.publish(T, first);
    log.publish(T.plusDays(1), null);
    log.publish(T.plusDays(2), third);
    log.finish();
    
    assertSame(first.provenance(), channel.read(T));
    assertSame(Bin.EMPTY, channel.read(T.plusDays(1)));
    assertSame(third.provenance(), channel.read(T.plusDays(2)));
    assertSame(Bin.EMPTY, channel.read(T.plusDays(3)));
  }
  
  @Test
  public void blockingRead() throws Exception {
    final AtomicReference<Bin> result = new AtomicReference<Bin>();
    final Thread reader = new Thread(new Runnable() {
      @Override
      public void run() {
        try {
          result.set(channel.read(T));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
    });
    reader.start();
    waitForWaiters();
    assertNull(result.get());
    
    final OutputRecord record = record(T, 4.0);
    log.publish(T, record);
    reader.join(5000);
    assertSame(record.provenance(), result.get());
  }
  
  @Test
  public void producerSkippedTheInterval() throws Exception {
    final AtomicReference<Bin> result = new AtomicReference<Bin>();
    final Thread reader = new Thread(new Runnable() {
      @Override
      public void run() {
        try {
          result.set(channel.read(T.plusDays(1)));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
    });
    reader.start();
    waitForWaiters();
    
    log.publish(T, record(T, 1.0));
    log.publish(T.plusDays(2), record(T.plusDays(2), 3.0));
    reader.join(5000);
    assertSame(Bin.EMPTY, result.get());
  }
  
  @Test
  public void abandonedProducer() throws Exception {
    final AtomicReference<Bin> result = new AtomicReference<Bin>();
    final Thread reader = new Thread(new Runnable() {
      @Override
      public void run() {
        try {
          result.set(channel.read(T));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
    });
    reader.start();
    waitForWaiters();
    
    log.abandon();
    reader.join(5000);
    assertFalse(reader.isAlive());
    assertSame(Bin.EMPTY, result.get());
  }
  
  @Test
  public void readsMoveForward() throws Exception {
    log.publish(T.plusDays(1), null);
    channel.read(T.plusDays(1));
    try {
      channel.read(T);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      channel.read(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  private void waitForWaiters() throws Exception {
    for (int i = 0; i < 500 && log.waiters() < 1; i++) {
      Thread.sleep(10);
    }
    assertEquals(1, log.waiters());
  }
}
