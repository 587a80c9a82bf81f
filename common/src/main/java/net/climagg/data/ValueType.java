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

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Strings;

/**
 * The numeric storage type of a series. Every value written to an
 * aggregated series goes through {@link #coerce(Object)} first.
 *
 * @since 1.0
 */
public enum ValueType {
  /** Whole numbers, fractions are truncated toward zero. */
  INT("int") {
    @Override
    Coercion convert(final double value) {
      if (value > Long.MAX_VALUE || value < Long.MIN_VALUE) {
        return Coercion.invalid("Value out of range for an integer series: "
            + value);
      }
      return Coercion.value((double) (long) value);
    }
  },

  /** Double precision floating point, stored as is. */
  FLOAT("float") {
    @Override
    Coercion convert(final double value) {
      return Coercion.value(value);
    }
  },

  /** Fixed point decimal with four fraction digits. */
  NUM("num") {
    @Override
    Coercion convert(final double value) {
      return Coercion.value(BigDecimal.valueOf(value)
          .setScale(NUM_SCALE, RoundingMode.HALF_EVEN)
          .doubleValue());
    }
  };

  /** Fraction digits kept for {@link #NUM}. */
  public static final int NUM_SCALE = 4;

  private final String name;

  ValueType(final String name) {
    this.name = name;
  }

  /**
   * Converts a finite double to this type.
   * @param value A finite value.
   * @return The coercion.
   */
  abstract Coercion convert(final double value);

  @JsonValue
  public String typeName() {
    return name;
  }

  /**
   * Converts the given object. Numbers and numeric strings are accepted,
   * null is reported as missing and anything else, including NaN and
   * infinities, as invalid.
   * @param raw The value to convert, may be null.
   * @return A non-null coercion result.
   */
  public Coercion coerce(final Object raw) {
    if (raw == null) {
      return Coercion.missing();
    }
    final double value;
    if (raw instanceof Number) {
      value = ((Number) raw).doubleValue();
    } else if (raw instanceof CharSequence) {
      final String s = raw.toString().trim();
      if (s.isEmpty()) {
        return Coercion.missing();
      }
      try {
        value = Double.parseDouble(s);
      } catch (NumberFormatException e) {
        return Coercion.invalid("Not a number: '" + s + "'");
      }
    } else {
      return Coercion.invalid("Unsupported value type: "
          + raw.getClass().getName());
    }
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return Coercion.invalid("Non-finite value: " + value);
    }
    return convert(value);
  }

  /**
   * Parses the type name, case insensitive. Accepts the legacy record class
   * names as well, e.g. {@code Record_int}.
   * @param name A non-null and non-empty name.
   * @return The type.
   * @throws IllegalArgumentException if the name was null, empty or unknown.
   */
  @JsonCreator
  public static ValueType fromName(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Value type cannot be null or empty.");
    }
    String n = name.trim().toLowerCase();
    if (n.startsWith("record_")) {
      n = n.substring("record_".length());
    }
    for (final ValueType type : values()) {
      if (type.name.equals(n)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown value type: " + name);
  }
}
