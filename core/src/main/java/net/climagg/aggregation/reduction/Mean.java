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

import java.util.List;

/**
 * Arithmetic mean of the usable values. An interval with records but no
 * usable value emits a null value with an info of 0.
 *
 * @since 1.0
 */
public class Mean implements ReductionFunction {
  public static final String NAME = "ave";
  
  @Override
  public String name() {
    return NAME;
  }
  
  @Override
  public ReductionResult reduce(final ReductionContext context) {
    if (context.bin().isEmpty()) {
      return ReductionResult.NONE;
    }
    final List<Double> values = context.values();
    if (values.isEmpty()) {
      return ReductionResult.emit(null, 0);
    }
    double sum = 0;
    for (final double value : values) {
      sum += value;
    }
    return ReductionResult.emit(sum / values.size(), values.size());
  }
}
