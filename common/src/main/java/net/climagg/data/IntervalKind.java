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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Strings;

/**
 * The granularity of an aggregated series. Months have no fixed length so
 * this is a tag rather than a duration; the binning code maps each kind to
 * its own strategy.
 *
 * @since 1.0
 */
public enum IntervalKind {
  DAY("day"),
  MONTH("month");

  private final String name;

  IntervalKind(final String name) {
    this.name = name;
  }

  /** @return The lower case name stored with aggregate series. */
  @JsonValue
  public String intervalName() {
    return name;
  }

  /**
   * Parses the interval name, case insensitive.
   * @param name A non-null and non-empty name.
   * @return The kind.
   * @throws IllegalArgumentException if the name was null, empty or unknown.
   */
  @JsonCreator
  public static IntervalKind fromName(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Interval name cannot be null or empty.");
    }
    for (final IntervalKind kind : values()) {
      if (kind.name.equalsIgnoreCase(name.trim())) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown interval: " + name);
  }
}
