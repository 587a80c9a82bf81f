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

import net.climagg.data.Bin;
import net.climagg.data.OutputRecord;

/**
 * Shared cursor logic of the channels: move forward while the record under
 * the cursor is older than the requested interval, then return its bin on
 * an exact match.
 *
 * @since 1.0
 */
abstract class CursorChannel implements AuxiliaryChannel {
  protected final String code;
  
  /** Index of the record under the cursor. */
  private int cursor;
  
  /** The last requested interval. */
  private LocalDateTime last_read;
  
  protected CursorChannel(final String code) {
    if (code == null || code.isEmpty()) {
      throw new IllegalArgumentException("Code cannot be null or empty.");
    }
    this.code = code;
  }
  
  @Override
  public String code() {
    return code;
  }
  
  @Override
  public Bin read(final LocalDateTime t) throws InterruptedException {
    if (t == null) {
      throw new IllegalArgumentException("Timestamp cannot be null.");
    }
    if (last_read != null && t.isBefore(last_read)) {
      throw new IllegalArgumentException("Read at " + t 
          + " is before the previous read at " + last_read);
    }
    last_read = t;
    
    awaitProgress(t);
    final int size = available();
    if (size == 0) {
      return Bin.EMPTY;
    }
    while (cursor + 1 < size && recordAt(cursor).timestamp().isBefore(t)) {
      cursor++;
    }
    final OutputRecord record = recordAt(cursor);
    return record.timestamp().equals(t) ? record.provenance() : Bin.EMPTY;
  }
  
  /** @return The index of the record under the cursor. */
  int cursor() {
    return cursor;
  }
  
  /**
   * Blocks until every record up to {@code t} that will ever exist is
   * available.
   * @param t The requested interval.
   * @throws InterruptedException if interrupted while waiting.
   */
  protected abstract void awaitProgress(final LocalDateTime t) 
      throws InterruptedException;
  
  /** @return The number of records that can be read. */
  protected abstract int available();
  
  /**
   * @param index An index below {@link #available()}.
   * @return The record at the index.
   */
  protected abstract OutputRecord recordAt(final int index);
}
