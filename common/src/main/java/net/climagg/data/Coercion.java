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

import net.climagg.exceptions.IllegalDataException;

/**
 * The outcome of converting a value to a series' {@link ValueType}. Callers
 * branch on {@link #state()} instead of catching exceptions so that a bad
 * value only drops the one record.
 *
 * @since 1.0
 */
public final class Coercion {

  /** What happened to the input. */
  public static enum State {
    /** Converted, {@link #value()} holds the result. */
    VALUE,

    /** The input was null. */
    MISSING,

    /** The input could not be represented, see {@link #message()}. */
    INVALID
  }

  private static final Coercion MISSING = new Coercion(State.MISSING, null, null);

  private final State state;
  private final Double value;
  private final String message;

  private Coercion(final State state, final Double value, final String message) {
    this.state = state;
    this.value = value;
    this.message = message;
  }

  /**
   * @param value The converted value.
   * @return A successful coercion.
   */
  public static Coercion value(final double value) {
    return new Coercion(State.VALUE, value, null);
  }

  /** @return The shared missing coercion. */
  public static Coercion missing() {
    return MISSING;
  }

  /**
   * @param message A description of why the input was rejected.
   * @return A failed coercion.
   */
  public static Coercion invalid(final String message) {
    return new Coercion(State.INVALID, null, message);
  }

  public State state() {
    return state;
  }

  /** @return The converted value, null unless the state is VALUE. */
  public Double value() {
    return value;
  }

  /** @return The rejection reason, null unless the state is INVALID. */
  public String message() {
    return message;
  }

  public boolean isValid() {
    return state != State.INVALID;
  }

  /**
   * Returns the value or null when missing.
   * @return The value.
   * @throws IllegalDataException if the coercion was invalid.
   */
  public Double get() {
    if (state == State.INVALID) {
      throw new IllegalDataException(message);
    }
    return value;
  }

  @Override
  public String toString() {
    return state == State.INVALID ? "INVALID(" + message + ")"
        : state + "(" + value + ")";
  }
}
