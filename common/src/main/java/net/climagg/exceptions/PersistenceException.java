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

import net.climagg.storage.WriteStatus;

/**
 * Writing an aggregated series to the store failed. The series is not
 * stored at all.
 *
 * @since 1.0
 */
public class PersistenceException extends RuntimeException {
  private static final long serialVersionUID = 4823309612870153118L;

  /** The status returned by the store, may be null. */
  private final WriteStatus status;

  /**
   * Ctor for a failed write status.
   * @param message A non-null and non-empty message.
   * @param status The non-null status returned by the store.
   */
  public PersistenceException(final String message, final WriteStatus status) {
    super(message, status == null ? null : status.exception());
    this.status = status;
  }

  /**
   * Ctor for an exception thrown by the store.
   * @param message A non-null and non-empty message.
   * @param cause The non-null cause.
   */
  public PersistenceException(final String message, final Throwable cause) {
    super(message, cause);
    status = null;
  }

  /** @return The status returned by the store, may be null. */
  public WriteStatus getStatus() {
    return status;
  }
}
