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

import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;

import net.climagg.configuration.AggregationConfig;
import net.climagg.configuration.ConfigurationException;

/**
 * Dispatch table from the reduction names used in aggregation profiles to
 * the implementations.
 *
 * @since 1.0
 */
public final class ReductionFunctions {
  
  /** Builds a reduction from its profile entry. */
  private interface Factory {
    /**
     * @param config The profile entry, may be null.
     * @return A new reduction.
     */
    ReductionFunction newFunction(final AggregationConfig config);
  }
  
  private static final Map<String, Factory> FACTORIES = Maps.newHashMap();
  static {
    FACTORIES.put(Mean.NAME, new Factory() {
      @Override
      public ReductionFunction newFunction(final AggregationConfig config) {
        return new Mean();
      }
    });
    FACTORIES.put(CircularMean.NAME, new Factory() {
      @Override
      public ReductionFunction newFunction(final AggregationConfig config) {
        if (config != null && !config.getAuxFields().isEmpty()) {
          return new CircularMean(config.getAuxFields().get(0));
        }
        return new CircularMean();
      }
    });
    FACTORIES.put(RainOrig.NAME, new Factory() {
      @Override
      public ReductionFunction newFunction(final AggregationConfig config) {
        return new RainOrig();
      }
    });
    FACTORIES.put(RainDmi.NAME, new Factory() {
      @Override
      public ReductionFunction newFunction(final AggregationConfig config) {
        return new RainDmi();
      }
    });
    FACTORIES.put(RainExtendedWindow.NAME, new Factory() {
      @Override
      public ReductionFunction newFunction(final AggregationConfig config) {
        return new RainExtendedWindow(
            config != null && config.getCheckStart(), false);
      }
    });
    FACTORIES.put(RainExtendedWindow.INFO_NAME, new Factory() {
      @Override
      public ReductionFunction newFunction(final AggregationConfig config) {
        return new RainExtendedWindow(
            config != null && config.getCheckStart(), true);
      }
    });
    FACTORIES.put(RainMonth.NAME, new Factory() {
      @Override
      public ReductionFunction newFunction(final AggregationConfig config) {
        return new RainMonth();
      }
    });
  }
  
  private ReductionFunctions() {
  }
  
  /**
   * Instantiates a reduction with default settings.
   * @param name The reduction name.
   * @return A new reduction.
   * @throws ConfigurationException if the name is unknown.
   */
  public static ReductionFunction forName(final String name) {
    return create(name, null);
  }
  
  /**
   * Instantiates a reduction.
   * @param name The reduction name.
   * @param config The profile entry with reduction settings, may be null.
   * @return A new reduction.
   * @throws ConfigurationException if the name is unknown.
   */
  public static ReductionFunction create(final String name, 
                                         final AggregationConfig config) {
    final Factory factory = name == null ? null : FACTORIES.get(name);
    if (factory == null) {
      throw new ConfigurationException("Unknown reduction function: " + name 
          + ". Available: " + names());
    }
    return factory.newFunction(config);
  }
  
  /** @return The known reduction names, sorted. */
  public static Set<String> names() {
    return ImmutableSortedSet.copyOf(FACTORIES.keySet());
  }
}
