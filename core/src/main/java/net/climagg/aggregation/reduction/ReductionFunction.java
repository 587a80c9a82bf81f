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
package net.climagg.aggregation.reduction;

/**
 * Computes the aggregate value of one interval from the records binned for
 * it. Implementations must not modify the bin and should keep no state
 * between calls other than their settings; anything carried over from the
 * previous interval is available through
 * {@link ReductionContext#previousOutput()}.
 *
 * @since 1.0
 */
public interface ReductionFunction {

  /** @return The name the function is configured with, e.g. "ave". */
  public String name();
  
  /**
   * Reduces the bin of the context.
   * @param context The non-null context of the interval.
   * @return {@link ReductionResult#NONE} to skip the interval, otherwise the 
   * value and info to emit.
   * @throws InterruptedException if interrupted while reading an auxiliary
   * series.
   */
  public ReductionResult reduce(final ReductionContext context) 
      throws InterruptedException;
}
