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

import net.climagg.data.OutputRecord;

/**
 * Reads the emission log of an aggregation running in the same batch,
 * blocking until the producer has caught up with the reader.
 *
 * @since 1.0
 */
public class LiveChannel extends CursorChannel {
  private final EmissionLog log;
  
  /**
   * Default ctor.
   * @param code The code of the producing series.
   * @param log The non-null emission log of the producer.
   */
  public LiveChannel(final String code, final EmissionLog log) {
    super(code);
    if (log == null) {
      throw new IllegalArgumentException("Log cannot be null.");
    }
    this.log = log;
  }
  
  @Override
  public boolean isLive() {
    return true;
  }
  
  @Override
  protected void awaitProgress(final LocalDateTime t) 
      throws InterruptedException {
    log.awaitProgress(t);
  }
  
  @Override
  protected int available() {
    return log.size();
  }
  
  @Override
  protected OutputRecord recordAt(final int index) {
    return log.get(index);
  }
  
  @Override
  public String toString() {
    return "LiveChannel{" + code + ", " + log + "}";
  }
}
