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
 * Monthly precipitation: the sum of the daily amounts. A month with only
 * trace days emits one unit per day, the trace amount being below the
 * 0.1 mm resolution the daily values are scaled to.
 *
 * @since 1.0
 */
public class RainMonth implements ReductionFunction {
  public static final String NAME = "rain_month";
  
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
      return ReductionResult.emit((double) context.bin().size(), null);
    }
    double sum = 0;
    for (final double value : values) {
      sum += value;
    }
    return ReductionResult.emit(sum, context.bin().size());
  }
}
