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
package net.climagg.storage;

/**
 * The response from {@link SeriesStore#persist(net.climagg.data.OutputSeries)}
 * including the state and an optional error message or exception. Writes are
 * all-or-nothing per series so there is no partial state.
 * 
 * @since 1.0
 */
public interface WriteStatus {

  /**
   * An enum used by callers to determine whether or not the series was
   * stored.
   */
  public static enum WriteState {
    /** Every record of the series was stored. */
    OK,
    
    /** Nothing was stored due to a transient issue such as a lock timeout
     * or an unavailable backend. The write can be retried. */
    RETRY,
    
    /** The series was rejected, e.g. it collides with an existing aggregate
     * or a value doesn't fit the column type. Retrying won't help. */
    REJECTED,
    
    /** An error happened during storage, nothing was stored. */
    ERROR
  }
  
  /** @return The non-null state of the write. */
  public WriteState state();
  
  /** @return An optional error message, should be null if 
   * {@link WriteState#OK} is returned. */
  public String message();
  
  /** @return An optional exception. Likely set when 
   * {@link WriteState#ERROR} is returned. */
  public Throwable exception();
  
  /** @return The OK status, no error message or exception. */
  public static WriteStatus ok() {
    return OK;
  }
  
  /**
   * Returns a retry status with the given message.
   * @param message An optional error message.
   * @return The retry write status.
   */
  public static WriteStatus retry(final String message) {
    return new DefaultWriteStatus(WriteState.RETRY, message, null);
  }
  
  /**
   * Returns a rejected status with the given message.
   * @param message An optional error message.
   * @return The rejected write status.
   */
  public static WriteStatus rejected(final String message) {
    return new DefaultWriteStatus(WriteState.REJECTED, message, null);
  }
  
  /**
   * Returns an error status with the given message and optional exception.
   * @param message An optional error message.
   * @param t An optional exception.
   * @return The error write status.
   */
  public static WriteStatus error(final String message, final Throwable t) {
    return new DefaultWriteStatus(WriteState.ERROR, message, t);
  }
  
  /** The OK status, no error message or exception. */
  public static WriteStatus OK = new DefaultWriteStatus(WriteState.OK, null, null);

  /** Immutable holder behind the factory methods. */
  static final class DefaultWriteStatus implements WriteStatus {
    private final WriteState state;
    private final String message;
    private final Throwable exception;

    DefaultWriteStatus(final WriteState state, 
                       final String message, 
                       final Throwable exception) {
      this.state = state;
      this.message = message;
      this.exception = exception;
    }

    @Override
    public WriteState state() {
      return state;
    }

    @Override
    public String message() {
      return message;
    }

    @Override
    public Throwable exception() {
      return exception;
    }

    @Override
    public String toString() {
      return message == null ? state.toString() : state + ": " + message;
    }
  }
}
