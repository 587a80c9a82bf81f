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

import com.google.common.collect.ImmutableList;

import net.climagg.data.OutputRecord;

/**
 * Reads a previously stored aggregate. The records are loaded once, with 
 * their provenance, when the channel is opened. Never blocks.
 *
 * @since 1.0
 */
public class ReplayChannel extends CursorChannel {
  private final List<OutputRecord> records;
  
  /**
   * Default ctor.
   * @param code The code of the stored series.
   * @param records The non-null records in ascending timestamp order.
   */
  public ReplayChannel(final String code, final List<OutputRecord> records) {
    super(code);
    if (records == null) {
      throw new IllegalArgumentException("Records cannot be null.");
    }
    this.records = ImmutableList.copyOf(records);
  }
  
  @Override
  public boolean isLive() {
    return false;
  }
  
  @Override
  protected void awaitProgress(final LocalDateTime t) {
    // everything is loaded
  }
  
  @Override
  protected int available() {
    return records.size();
  }
  
  @Override
  protected OutputRecord recordAt(final int index) {
    return records.get(index);
  }
  
  @Override
  public String toString() {
    return "ReplayChannel{" + code + ", records=" + records.size() + "}";
  }
}
