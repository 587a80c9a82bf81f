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

import java.util.Objects;

/**
 * The (code, station, source) triple that identifies the output of an
 * aggregation. Only one task per key may be registered in a batch.
 *
 * @since 1.0
 */
public final class SeriesKey {
  private final String code;
  private final int station;
  private final String source;

  /**
   * Default ctor.
   * @param code A non-null variable code, e.g. "f" for wind speed.
   * @param station The station identifier.
   * @param source The data source, may be null.
   */
  public SeriesKey(final String code, final int station, final String source) {
    if (code == null) {
      throw new IllegalArgumentException("Code cannot be null.");
    }
    this.code = code;
    this.station = station;
    this.source = source;
  }

  public String code() {
    return code;
  }

  public int station() {
    return station;
  }

  public String source() {
    return source;
  }

  /**
   * @param other_code The code of a sibling series.
   * @return A key for the series with the given code at the same station
   * and from the same source.
   */
  public SeriesKey withCode(final String other_code) {
    return new SeriesKey(other_code, station, source);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SeriesKey)) {
      return false;
    }
    final SeriesKey other = (SeriesKey) o;
    return station == other.station
        && code.equals(other.code)
        && Objects.equals(source, other.source);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, station, source);
  }

  @Override
  public String toString() {
    return code + " / " + station + " / " + source;
  }
}
