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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A special value attached to a series. When {@link #inData()} is true the
 * value shows up in place of a measurement (e.g. -1 for a trace amount of
 * precipitation) and reductions must not treat it as a number.
 *
 * @since 1.0
 */
public final class Flag {
  private final int value;
  private final String description;
  private final boolean in_data;

  @JsonCreator
  public Flag(@JsonProperty("value") final int value,
              @JsonProperty("desc") final String description,
              @JsonProperty("in_data") final boolean in_data) {
    this.value = value;
    this.description = description;
    this.in_data = in_data;
  }

  @JsonProperty("value")
  public int value() {
    return value;
  }

  @JsonProperty("desc")
  public String description() {
    return description;
  }

  /** @return True if the value replaces measurements, false if it's
   * recorded in the info slot. */
  @JsonProperty("in_data")
  public boolean inData() {
    return in_data;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Flag)) {
      return false;
    }
    final Flag other = (Flag) o;
    return value == other.value
        && in_data == other.in_data
        && Objects.equals(description, other.description);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, description, in_data);
  }

  @Override
  public String toString() {
    return value + ": " + description + " ("
        + (in_data ? "in-data" : "additional") + ")";
  }
}
