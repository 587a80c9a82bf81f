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
package net.climagg.aggregation.binning;

import java.util.EnumMap;
import java.util.Map;

import net.climagg.configuration.ConfigurationException;
import net.climagg.data.IntervalKind;
import net.climagg.data.SeriesDescriptor;

/**
 * Dispatch table from the interval of an aggregate to its binning.
 *
 * @since 1.0
 */
public final class BinningStrategies {

  private static final Map<IntervalKind, BinningStrategy.Factory> FACTORIES =
      new EnumMap<IntervalKind, BinningStrategy.Factory>(IntervalKind.class);
  static {
    FACTORIES.put(IntervalKind.DAY, new BinningStrategy.Factory() {
      @Override
      public BinningStrategy newStrategy(final SeriesDescriptor descriptor) {
        return new DailyBinning(descriptor.zeroHour(), 
            descriptor.zeroInclusive(), descriptor.postpone());
      }
    });
    FACTORIES.put(IntervalKind.MONTH, new BinningStrategy.Factory() {
      @Override
      public BinningStrategy newStrategy(final SeriesDescriptor descriptor) {
        return new MonthlyBinning(descriptor.zeroHour(), 
            descriptor.zeroInclusive());
      }
    });
  }

  private BinningStrategies() {
  }

  /**
   * @param descriptor A non-null aggregate descriptor.
   * @return The strategy for the descriptor's interval.
   * @throws ConfigurationException if the descriptor has no interval or 
   * the interval isn't supported.
   */
  public static BinningStrategy forDescriptor(
      final SeriesDescriptor descriptor) {
    if (descriptor.interval() == null) {
      throw new ConfigurationException("Series " + descriptor.name() 
          + " is not an aggregate.");
    }
    final BinningStrategy.Factory factory = 
        FACTORIES.get(descriptor.interval());
    if (factory == null) {
      throw new ConfigurationException("Unsupported interval " 
          + descriptor.interval() + " for series " + descriptor.name());
    }
    return factory.newStrategy(descriptor);
  }
}
