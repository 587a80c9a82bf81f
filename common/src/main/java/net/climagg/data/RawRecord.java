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
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * A single immutable observation of a raw series. Timestamps are UTC wall
 * clock times without a zone, the way the stations report them.
 * <p>
 * The value may be null for a missing observation. The info slot carries
 * an optional integer recorded next to the value, e.g. the accumulation
 * length in hours of a precipitation reading.
 *
 * @since 1.0
 */
public final class RawRecord {
  private static final DateTimeFormatter FORMAT =
      DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm");

  /** The observation time. */
  private final LocalDateTime timestamp;

  /** The observed value, may be null. */
  private final Double value;

  /** Optional extra integer. */
  private final Integer info;

  /**
   * Default ctor.
   * @param timestamp A non-null timestamp.
   * @param value A value, may be null.
   * @param info An optional info integer, may be null.
   * @throws IllegalArgumentException if the timestamp was null.
   */
  public RawRecord(final LocalDateTime timestamp,
                   final Double value,
                   final Integer info) {
    if (timestamp == null) {
      throw new IllegalArgumentException("Timestamp cannot be null.");
    }
    this.timestamp = timestamp;
    this.value = value;
    this.info = info;
  }

  /**
   * Shortcut for a record without an info integer.
   * @param timestamp A non-null timestamp.
   * @param value A value, may be null.
   * @return The record.
   */
  public static RawRecord of(final LocalDateTime timestamp, final Double value) {
    return new RawRecord(timestamp, value, null);
  }

  /** @return The non-null observation time. */
  public LocalDateTime timestamp() {
    return timestamp;
  }

  /** @return The value, null if missing. */
  public Double value() {
    return value;
  }

  /** @return The info integer, may be null. */
  public Integer info() {
    return info;
  }

  /** @return Whether or not the value is missing. */
  public boolean isMissing() {
    return value == null;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawRecord)) {
      return false;
    }
    final RawRecord other = (RawRecord) o;
    return timestamp.equals(other.timestamp)
        && Objects.equals(value, other.value)
        && Objects.equals(info, other.info);
  }

  @Override
  public int hashCode() {
    return Objects.hash(timestamp, value, info);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("<RawRecord t: ")
        .append(FORMAT.format(timestamp))
        .append(", x: ")
        .append(value)
        .append(info == null ? "" : ", info: " + info)
        .append(">")
        .toString();
  }
}
