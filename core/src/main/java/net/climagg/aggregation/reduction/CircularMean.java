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

import com.google.common.collect.Lists;

import net.climagg.data.Bin;
import net.climagg.data.RawRecord;

/**
 * Mean of directions in degrees, computed as the angle of the mean unit
 * vector so that 350 and 10 average to 0 rather than 180.
 * <p>
 * With an auxiliary speed series only samples whose speed at the same
 * timestamp is above zero are used; a calm has no direction. Samples without
 * a speed reading are dropped as well. Without the channel every sample is
 * used.
 * <p>
 * An interval with records but nothing usable emits {@value #NO_DIRECTION}.
 *
 * @since 1.0
 */
public class CircularMean implements ReductionFunction {
  public static final String NAME = "wind_dir";
  
  /** The code of the speed series read by default. */
  public static final String DEFAULT_AUXILIARY = "f";
  
  /** Emitted when there is no usable direction in the interval. */
  public static final double NO_DIRECTION = 999;
  
  private final String auxiliary;
  
  /**
   * Ctor using the default speed series.
   */
  public CircularMean() {
    this(DEFAULT_AUXILIARY);
  }
  
  /**
   * Default ctor.
   * @param auxiliary The code of the speed series.
   */
  public CircularMean(final String auxiliary) {
    this.auxiliary = auxiliary == null ? DEFAULT_AUXILIARY : auxiliary;
  }
  
  @Override
  public String name() {
    return NAME;
  }
  
  @Override
  public ReductionResult reduce(final ReductionContext context) 
      throws InterruptedException {
    final List<RawRecord> kept;
    if (context.hasAuxiliary(auxiliary)) {
      final Bin speeds = context.auxiliary(auxiliary);
      kept = Lists.newArrayList();
      for (final RawRecord direction : context.bin()) {
        final RawRecord speed = find(speeds, direction);
        if (speed != null && speed.value() != null && speed.value() > 0) {
          kept.add(direction);
        }
      }
    } else {
      kept = context.bin().records();
    }
    
    final List<Double> values = context.values(kept);
    if (values.isEmpty()) {
      if (context.bin().isEmpty()) {
        return ReductionResult.NONE;
      }
      return ReductionResult.emit(NO_DIRECTION, kept.size());
    }
    
    double sin = 0;
    double cos = 0;
    for (final double value : values) {
      final double radians = Math.toRadians(value);
      sin += Math.sin(radians);
      cos += Math.cos(radians);
    }
    final double angle = Math.toDegrees(
        Math.atan2(sin / values.size(), cos / values.size()));
    // half away from zero
    long rounded = (long) Math.signum(angle) * Math.round(Math.abs(angle));
    if (rounded < 0) {
      rounded += 360;
    }
    return ReductionResult.emit((double) rounded, values.size());
  }
  
  /** @return The first record of the bin with the same timestamp. */
  private static RawRecord find(final Bin bin, final RawRecord record) {
    for (final RawRecord candidate : bin) {
      if (candidate.timestamp().equals(record.timestamp())) {
        return candidate;
      }
    }
    return null;
  }
}
