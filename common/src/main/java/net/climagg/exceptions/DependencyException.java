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
package net.climagg.exceptions;

import net.climagg.data.SeriesKey;

/**
 * Thrown when an aggregation needs another series' aggregate as an
 * auxiliary input and it can't be resolved. Fails only the dependent task.
 *
 * @since 1.0
 */
public class DependencyException extends RuntimeException {
  private static final long serialVersionUID = -3121742885316301764L;

  /** The key of the auxiliary series that couldn't be resolved. */
  private final SeriesKey key;

  /**
   * Ctor setting the message.
   * @param message A non-null and non-empty message.
   * @param key The key of the unresolved series, may be null.
   */
  public DependencyException(final String message, final SeriesKey key) {
    super(message);
    this.key = key;
  }

  /** @return The key of the unresolved series, may be null. */
  public SeriesKey getKey() {
    return key;
  }
}
