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
 * The last reading of each half day wins.
 *
 * @since 1.0
 */
public class RainOrig extends HalfDayPrecipitation {
  public static final String NAME = "rain_orig";
  
  @Override
  public String name() {
    return NAME;
  }
  
  @Override
  protected double merge(final int hour, 
                         final double current, 
                         final double amount) {
    return amount;
  }
}
