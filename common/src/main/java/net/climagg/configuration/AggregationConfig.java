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
package net.climagg.configuration;

import java.time.Duration;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.climagg.data.Flag;
import net.climagg.data.IntervalKind;
import net.climagg.data.SeriesDescriptor;
import net.climagg.data.ValueType;

/**
 * The aggregation settings for one variable code, i.e. one entry of an
 * {@link AggregationProfile}. Only {@code func} is required:
 * <pre>
 * r:
 *   type: int
 *   func: rain_XT
 *   postpone: 6
 * </pre>
 * {@code postpone} is in hours.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
public class AggregationConfig {
  private final ValueType type;
  private final String func;
  private final List<String> aux_fields;
  private final List<Flag> flags;
  private final Integer postpone;
  private final Integer zero_hour;
  private final Boolean zero_inclusive;
  private final String name;
  private final boolean check_start;

  @JsonCreator
  public AggregationConfig(
      @JsonProperty("type") final ValueType type,
      @JsonProperty("func") final String func,
      @JsonProperty("aux_fields") final List<String> aux_fields,
      @JsonProperty("flags") final List<Flag> flags,
      @JsonProperty("postpone") final Integer postpone,
      @JsonProperty("zero_hour") final Integer zero_hour,
      @JsonProperty("zero_incl") final Boolean zero_inclusive,
      @JsonProperty("name") final String name,
      @JsonProperty("check_start") final boolean check_start) {
    if (Strings.isNullOrEmpty(func)) {
      throw new IllegalArgumentException("The func cannot be null or empty.");
    }
    if (postpone != null && postpone < 0) {
      throw new IllegalArgumentException("Postpone cannot be negative: " 
          + postpone);
    }
    if (zero_hour != null && (zero_hour < 0 || zero_hour > 23)) {
      throw new IllegalArgumentException("Zero hour must be between 0 and 23: " 
          + zero_hour);
    }
    this.type = type;
    this.func = func;
    this.aux_fields = aux_fields == null ? ImmutableList.<String>of() 
        : ImmutableList.copyOf(aux_fields);
    this.flags = flags == null ? ImmutableList.<Flag>of() 
        : ImmutableList.copyOf(flags);
    this.postpone = postpone;
    this.zero_hour = zero_hour;
    this.zero_inclusive = zero_inclusive;
    this.name = name;
    this.check_start = check_start;
  }

  /** @return The output value type, null to inherit the parent's. */
  @JsonProperty("type")
  public ValueType getType() {
    return type;
  }

  /** @return The name of the reduction. */
  @JsonProperty("func")
  public String getFunc() {
    return func;
  }

  /** @return Codes of series whose aggregates the reduction reads. */
  @JsonProperty("aux_fields")
  public List<String> getAuxFields() {
    return aux_fields;
  }

  /** @return Flags added to the aggregate on top of the parent's. */
  @JsonProperty("flags")
  public List<Flag> getFlags() {
    return flags;
  }

  @JsonProperty("postpone")
  public Integer getPostpone() {
    return postpone;
  }

  @JsonProperty("zero_hour")
  public Integer getZeroHour() {
    return zero_hour;
  }

  @JsonProperty("zero_incl")
  public Boolean getZeroInclusive() {
    return zero_inclusive;
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  /** @return Whether or not extended window precipitation should subtract
   * an overlap with the previous interval. */
  @JsonProperty("check_start")
  public boolean getCheckStart() {
    return check_start;
  }

  /**
   * Derives the descriptor of the aggregate of {@code parent}.
   * @param parent The non-null series to aggregate.
   * @param interval The non-null interval.
   * @return The aggregate descriptor.
   */
  public SeriesDescriptor describe(final SeriesDescriptor parent,
                                   final IntervalKind interval) {
    if (interval == null) {
      throw new IllegalArgumentException("Interval cannot be null.");
    }
    final SeriesDescriptor.Builder builder = SeriesDescriptor.aggregateOf(parent)
        .setInterval(interval)
        .setReduction(func)
        .setName(name);
    if (type != null) {
      builder.setType(type);
    }
    if (postpone != null) {
      builder.setPostpone(Duration.ofHours(postpone));
    }
    if (zero_hour != null) {
      builder.setZeroHour(zero_hour);
    }
    if (zero_inclusive != null) {
      builder.setZeroInclusive(zero_inclusive);
    }
    for (final Flag flag : flags) {
      builder.addFlag(flag);
    }
    return builder.build();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("type", type)
        .add("func", func)
        .add("aux_fields", aux_fields)
        .add("postpone", postpone)
        .toString();
  }
}
