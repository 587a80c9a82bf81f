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
 * The outcome of a reduction: nothing, or a value (possibly null) with an
 * optional info integer.
 *
 * @since 1.0
 */
public final class ReductionResult {
  /** Nothing is emitted for the interval. */
  public static final ReductionResult NONE = 
      new ReductionResult(false, null, null);
  
  private final boolean emitted;
  private final Double value;
  private final Integer info;
  
  private ReductionResult(final boolean emitted, 
                          final Double value, 
                          final Integer info) {
    this.emitted = emitted;
    this.value = value;
    this.info = info;
  }
  
  /**
   * @param value The value, null for an interval with only missing data.
   * @param info The info, may be null.
   * @return A result to emit.
   */
  public static ReductionResult emit(final Double value, final Integer info) {
    return new ReductionResult(true, value, info);
  }
  
  public boolean isEmitted() {
    return emitted;
  }
  
  public Double value() {
    return value;
  }
  
  public Integer info() {
    return info;
  }
  
  @Override
  public String toString() {
    return emitted ? "ReductionResult{value=" + value + ", info=" + info + "}" 
        : "ReductionResult{NONE}";
  }
}
