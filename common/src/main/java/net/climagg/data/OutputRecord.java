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
package net.climagg.data;

import java.time.LocalDateTime;

/**
 * One value of an aggregated series along with the bin of raw records it
 * was computed from.
 *
 * @since 1.0
 */
public final class OutputRecord {

  /** The interval timestamp. */
  private final LocalDateTime timestamp;

  /** The aggregated value, may be null. */
  private final Double value;

  /** Auxiliary integer, usually a sample count. May be null. */
  private final Integer info;

  /** The records that produced this value. */
  private final Bin provenance;

  /**
   * Default ctor.
   * @param timestamp A non-null interval timestamp.
   * @param value The value, may be null.
   * @param info The info integer, may be null.
   * @param provenance The bin, null is replaced with {@link Bin#EMPTY}.
   * @throws IllegalArgumentException if the timestamp was null.
   */
  public OutputRecord(final LocalDateTime timestamp,
                      final Double value,
                      final Integer info,
                      final Bin provenance) {
    if (timestamp == null) {
      throw new IllegalArgumentException("Timestamp cannot be null.");
    }
    this.timestamp = timestamp;
    this.value = value;
    this.info = info;
    this.provenance = provenance == null ? Bin.EMPTY : provenance;
  }

  public LocalDateTime timestamp() {
    return timestamp;
  }

  public Double value() {
    return value;
  }

  public Integer info() {
    return info;
  }

  /** @return The non-null bin this record was computed from. */
  public Bin provenance() {
    return provenance;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("<OutputRecord t: ")
        .append(timestamp)
        .append(", x: ")
        .append(value)
        .append(", info: ")
        .append(info)
        .append(", binned: ")
        .append(provenance.size())
        .append(">")
        .toString();
  }
}
