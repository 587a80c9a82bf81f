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
 * The DMI six hour cycle: the 12 and 0 o'clock readings open a half day.
 * The 18 and 6 o'clock readings either cover the whole half day, when they
 * are larger, or only the last six hours and are added. Other hours are 
 * ignored.
 *
 * @since 1.0
 */
public class RainDmi extends HalfDayPrecipitation {
  public static final String NAME = "rain_DMI";
  
  @Override
  public String name() {
    return NAME;
  }
  
  @Override
  protected double merge(final int hour, 
                         final double current, 
                         final double amount) {
    switch (hour) {
    case 12:
    case 0:
      return amount;
    case 18:
    case 6:
      return amount > current ? amount : amount + current;
    default:
      return current;
    }
  }
}
