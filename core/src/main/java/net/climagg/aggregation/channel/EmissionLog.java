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

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.climagg.data.OutputRecord;

/**
 * The records a running aggregation has emitted so far, readable by other
 * tasks while they are produced. There is a single producer, the task that
 * owns the log, and any number of {@link LiveChannel} readers.
 * <p>
 * Along with the records the log tracks a progress watermark: the last
 * interval the producer completed, whether or not it emitted a record for
 * it. A reader asking for interval {@code t} can proceed as soon as the
 * watermark reached {@code t} because nothing at or before {@code t} will
 * be appended afterwards.
 * <p>
 * Records are appended and the watermark advanced under the same lock the
 * readers wait on, so a reader never sees a record before it is complete.
 *
 * @since 1.0
 */
public class EmissionLog {
  private final String name;
  
  private final ReentrantLock lock;
  
  /** Signalled when the watermark moves or the log finishes. */
  private final Condition progress;
  
  private final List<OutputRecord> records;
  
  private LocalDateTime watermark;
  
  private boolean finished;
  
  private boolean abandoned;
  
  /**
   * Default ctor.
   * @param name A name for log messages, usually the series name.
   */
  public EmissionLog(final String name) {
    this.name = name;
    lock = new ReentrantLock();
    progress = lock.newCondition();
    records = Lists.newArrayList();
  }
  
  /**
   * Records that the interval {@code t} is complete, optionally with the
   * record emitted for it, and wakes up the readers.
   * @param t The non-null interval timestamp, not before the watermark.
   * @param record The record emitted for {@code t}, null if none.
   * @throws IllegalStateException if the log was finished.
   * @throws IllegalArgumentException if {@code t} is before the watermark
   * or the record isn't stamped with {@code t}.
   */
  public void publish(final LocalDateTime t, final OutputRecord record) {
    if (t == null) {
      throw new IllegalArgumentException("Timestamp cannot be null.");
    }
    if (record != null && !record.timestamp().equals(t)) {
      throw new IllegalArgumentException("Record at " + record.timestamp() 
          + " published for interval " + t);
    }
    lock.lock();
    try {
      if (finished) {
        throw new IllegalStateException("Emission log of " + name 
            + " is already finished.");
      }
      if (watermark != null && t.isBefore(watermark)) {
        throw new IllegalArgumentException("Interval " + t 
            + " is before the watermark " + watermark);
      }
      if (record != null) {
        records.add(record);
      }
      watermark = t;
      progress.signalAll();
    } finally {
      lock.unlock();
    }
  }
  
  /**
   * Marks the log as complete. Readers waiting for later intervals are 
   * released. Calling it again has no effect.
   */
  public void finish() {
    lock.lock();
    try {
      finished = true;
      progress.signalAll();
    } finally {
      lock.unlock();
    }
  }
  
  /**
   * Finishes the log of a task that never ran or failed, so that readers
   * don't wait for records that won't come.
   */
  public void abandon() {
    lock.lock();
    try {
      abandoned = true;
      finished = true;
      progress.signalAll();
    } finally {
      lock.unlock();
    }
  }
  
  /**
   * Blocks until the producer completed interval {@code t} or finished.
   * @param t The interval to wait for.
   * @throws InterruptedException if interrupted while waiting.
   */
  public void awaitProgress(final LocalDateTime t) throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (!finished && (watermark == null || watermark.isBefore(t))) {
        progress.await();
      }
    } finally {
      lock.unlock();
    }
  }
  
  /** @return The number of records emitted so far. */
  public int size() {
    lock.lock();
    try {
      return records.size();
    } finally {
      lock.unlock();
    }
  }
  
  /**
   * @param index An index below {@link #size()}.
   * @return The record at the index.
   */
  public OutputRecord get(final int index) {
    lock.lock();
    try {
      return records.get(index);
    } finally {
      lock.unlock();
    }
  }
  
  /** @return A copy of the records emitted so far. */
  public List<OutputRecord> records() {
    lock.lock();
    try {
      return ImmutableList.copyOf(records);
    } finally {
      lock.unlock();
    }
  }
  
  /** @return The last completed interval, null if none. */
  public LocalDateTime watermark() {
    lock.lock();
    try {
      return watermark;
    } finally {
      lock.unlock();
    }
  }
  
  public boolean isFinished() {
    lock.lock();
    try {
      return finished;
    } finally {
      lock.unlock();
    }
  }
  
  /** @return True if the log was finished without the producer running to
   * the end. */
  public boolean isAbandoned() {
    lock.lock();
    try {
      return abandoned;
    } finally {
      lock.unlock();
    }
  }
  
  /** @return The number of threads waiting on the log. For tests and 
   * monitoring, the value is an estimate. */
  public int waiters() {
    lock.lock();
    try {
      return lock.getWaitQueueLength(progress);
    } finally {
      lock.unlock();
    }
  }
  
  @Override
  public String toString() {
    return "EmissionLog{" + name + "}";
  }
}
