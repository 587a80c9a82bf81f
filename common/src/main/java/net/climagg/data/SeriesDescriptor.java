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
package net.climagg.data;

import java.time.Duration;
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Metadata about a series: who measured it, what it is and, for aggregated
 * series, how it was binned and reduced.
 * <p>
 * Raw series have no {@link #interval()} and no {@link #reduction()}.
 * Aggregated series point at the series they were computed from via
 * {@link #parent()} and are usually built with {@link #aggregateOf(SeriesDescriptor)}
 * which copies the code, station, source, unit and flags from the parent.
 * <p>
 * The binning parameters:
 * <ul>
 * <li>{@code zero_hour}: the hour of the day at which a daily interval
 * starts, 6 by default (06:00 to 06:00 UTC).</li>
 * <li>{@code zero_inclusive}: whether a value recorded exactly at the zero
 * hour opens the interval (true, the interval is labelled with its start)
 * or closes it (false, labelled with its end).</li>
 * <li>{@code postpone}: extends the end of an interval so that late
 * accumulation readings still count toward it.</li>
 * </ul>
 *
 * @since 1.0
 */
public final class SeriesDescriptor {
  /** The default zero hour. */
  public static final int DEFAULT_ZERO_HOUR = 6;

  private final String id;
  private final String name;
  private final String code;
  private final int station;
  private final String source;
  private final String unit;
  private final ValueType type;
  private final IntervalKind interval;
  private final String reduction;
  private final int zero_hour;
  private final boolean zero_inclusive;
  private final Duration postpone;
  private final ImmutableList<Flag> flags;
  private final SeriesDescriptor parent;

  private SeriesDescriptor(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.code)) {
      throw new IllegalArgumentException("Code cannot be null or empty.");
    }
    if (builder.zero_hour < 0 || builder.zero_hour > 23) {
      throw new IllegalArgumentException("Zero hour must be between 0 and 23: "
          + builder.zero_hour);
    }
    if (builder.postpone.isNegative()) {
      throw new IllegalArgumentException("Postpone cannot be negative: "
          + builder.postpone);
    }
    if (builder.interval != null && Strings.isNullOrEmpty(builder.reduction)) {
      throw new IllegalArgumentException("Aggregate series " + builder.code
          + " requires a reduction.");
    }
    id = builder.id;
    code = builder.code;
    station = builder.station;
    source = builder.source;
    unit = builder.unit;
    type = builder.type;
    interval = builder.interval;
    reduction = builder.reduction;
    zero_hour = builder.zero_hour;
    zero_inclusive = builder.zero_inclusive;
    postpone = builder.postpone;
    flags = ImmutableList.copyOf(builder.flags);
    parent = builder.parent;
    if (!Strings.isNullOrEmpty(builder.name)) {
      name = builder.name;
    } else if (parent != null) {
      final List<SeriesDescriptor> ancestors = ancestors();
      name = ancestors.get(ancestors.size() - 1).name() + " "
          + (interval == null ? "aggr" : interval.intervalName());
    } else {
      name = code;
    }
  }

  /** @return An optional storage ID, may be null for unsaved series. */
  public String id() {
    return id;
  }

  public String name() {
    return name;
  }

  /** @return The variable code, e.g. "t" for temperature. */
  public String code() {
    return code;
  }

  public int station() {
    return station;
  }

  /** @return The origin of the data, may be null. */
  public String source() {
    return source;
  }

  public String unit() {
    return unit;
  }

  public ValueType type() {
    return type;
  }

  /** @return The interval of an aggregate, null for raw series. */
  public IntervalKind interval() {
    return interval;
  }

  /** @return The reduction name of an aggregate, null for raw series. */
  public String reduction() {
    return reduction;
  }

  public int zeroHour() {
    return zero_hour;
  }

  public boolean zeroInclusive() {
    return zero_inclusive;
  }

  /** @return The non-null, non-negative boundary extension. */
  public Duration postpone() {
    return postpone;
  }

  public List<Flag> flags() {
    return flags;
  }

  /** @return The series this one was aggregated from, null for raw series. */
  public SeriesDescriptor parent() {
    return parent;
  }

  /** @return Whether or not this series was computed by an aggregation. */
  public boolean isAggregate() {
    return interval != null;
  }

  /** @return The registry key. */
  public SeriesKey key() {
    return new SeriesKey(code, station, source);
  }

  /**
   * The values of the in-data flags in declaration order. The first one is
   * treated as the trace flag by precipitation reductions.
   * @return A non-null, possibly empty list.
   */
  public List<Double> sentinels() {
    final List<Double> sentinels = Lists.newArrayListWithCapacity(flags.size());
    for (final Flag flag : flags) {
      if (flag.inData() && !sentinels.contains((double) flag.value())) {
        sentinels.add((double) flag.value());
      }
    }
    return ImmutableList.copyOf(sentinels);
  }

  /**
   * Walks up the parent chain.
   * @return The parent, its parent and so on. Empty for raw series.
   */
  public List<SeriesDescriptor> ancestors() {
    final List<SeriesDescriptor> ancestors = Lists.newArrayList();
    SeriesDescriptor current = parent;
    while (current != null) {
      ancestors.add(current);
      current = current.parent;
    }
    return ancestors;
  }

  /** @return A builder pre-populated with this descriptor's fields. */
  public Builder toBuilder() {
    return newBuilder()
        .setId(id)
        .setName(name)
        .setCode(code)
        .setStation(station)
        .setSource(source)
        .setUnit(unit)
        .setType(type)
        .setInterval(interval)
        .setReduction(reduction)
        .setZeroHour(zero_hour)
        .setZeroInclusive(zero_inclusive)
        .setPostpone(postpone)
        .setFlags(flags)
        .setParent(parent);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("id", id)
        .add("name", name)
        .add("code", code)
        .add("station", station)
        .add("source", source)
        .add("interval", interval)
        .add("reduction", reduction)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Starts an aggregate of the given series, inheriting its code, station,
   * source, unit and flags.
   * @param parent A non-null parent series.
   * @return A builder.
   */
  public static Builder aggregateOf(final SeriesDescriptor parent) {
    if (parent == null) {
      throw new IllegalArgumentException("Parent cannot be null.");
    }
    return newBuilder()
        .setCode(parent.code)
        .setStation(parent.station)
        .setSource(parent.source)
        .setUnit(parent.unit)
        .setType(parent.type)
        .setFlags(parent.flags)
        .setParent(parent);
  }

  public static class Builder {
    private String id;
    private String name;
    private String code;
    private int station;
    private String source;
    private String unit;
    private ValueType type = ValueType.FLOAT;
    private IntervalKind interval;
    private String reduction;
    private int zero_hour = DEFAULT_ZERO_HOUR;
    private boolean zero_inclusive;
    private Duration postpone = Duration.ZERO;
    private List<Flag> flags = Lists.newArrayList();
    private SeriesDescriptor parent;

    public Builder setId(final String id) {
      this.id = id;
      return this;
    }

    public Builder setName(final String name) {
      this.name = name;
      return this;
    }

    public Builder setCode(final String code) {
      this.code = code;
      return this;
    }

    public Builder setStation(final int station) {
      this.station = station;
      return this;
    }

    public Builder setSource(final String source) {
      this.source = source;
      return this;
    }

    public Builder setUnit(final String unit) {
      this.unit = unit;
      return this;
    }

    public Builder setType(final ValueType type) {
      this.type = type == null ? ValueType.FLOAT : type;
      return this;
    }

    public Builder setInterval(final IntervalKind interval) {
      this.interval = interval;
      return this;
    }

    public Builder setReduction(final String reduction) {
      this.reduction = reduction;
      return this;
    }

    public Builder setZeroHour(final int zero_hour) {
      this.zero_hour = zero_hour;
      return this;
    }

    public Builder setZeroInclusive(final boolean zero_inclusive) {
      this.zero_inclusive = zero_inclusive;
      return this;
    }

    public Builder setPostpone(final Duration postpone) {
      this.postpone = postpone == null ? Duration.ZERO : postpone;
      return this;
    }

    /**
     * Replaces the flags.
     * @param flags The flags, may be null.
     * @return The builder.
     */
    public Builder setFlags(final List<Flag> flags) {
      this.flags = flags == null ? Lists.<Flag>newArrayList()
          : Lists.newArrayList(flags);
      return this;
    }

    /**
     * Adds a flag unless an equal one is already present.
     * @param flag A non-null flag.
     * @return The builder.
     */
    public Builder addFlag(final Flag flag) {
      if (!flags.contains(flag)) {
        flags.add(flag);
      }
      return this;
    }

    public Builder setParent(final SeriesDescriptor parent) {
      this.parent = parent;
      return this;
    }

    public SeriesDescriptor build() {
      return new SeriesDescriptor(this);
    }
  }
}
