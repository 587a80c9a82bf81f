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
 * More than one stored aggregate matched an auxiliary lookup.
 *
 * @since 1.0
 */
public class AmbiguousDependencyException extends DependencyException {
  private static final long serialVersionUID = -1580712396601928774L;

  /** How many stored aggregates matched. */
  private final int matches;

  /**
   * Default ctor.
   * @param message A non-null and non-empty message.
   * @param key The key that was looked up.
   * @param matches The number of matching aggregates.
   */
  public AmbiguousDependencyException(final String message,
                                      final SeriesKey key,
                                      final int matches) {
    super(message, key);
    this.matches = matches;
  }

  /** @return How many stored aggregates matched. */
  public int getMatches() {
    return matches;
  }
}
