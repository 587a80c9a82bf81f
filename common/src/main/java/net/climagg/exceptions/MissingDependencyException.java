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
 * The auxiliary series is neither running in the current batch nor stored
 * with at least one record.
 *
 * @since 1.0
 */
public class MissingDependencyException extends DependencyException {
  private static final long serialVersionUID = 6088823641265419105L;

  public MissingDependencyException(final String message, final SeriesKey key) {
    super(message, key);
  }
}
