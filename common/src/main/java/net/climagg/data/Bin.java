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

import java.util.Collection;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The frozen set of raw records that fell into one aggregation interval.
 * A bin is built once when the interval is flushed and never changes
 * afterwards, so it's safe to hand to other threads and to keep as the
 * provenance of an {@link OutputRecord}.
 *
 * @since 1.0
 */
public final class Bin implements Iterable<RawRecord> {

  /** The shared empty bin. */
  public static final Bin EMPTY = new Bin(ImmutableList.<RawRecord>of());

  /** The records in time order. */
  private final ImmutableList<RawRecord> records;

  private Bin(final ImmutableList<RawRecord> records) {
    this.records = records;
  }

  /**
   * Freezes a copy of the given records.
   * @param records A non-null collection of records.
   * @return A bin, {@link #EMPTY} when the collection was empty.
   */
  public static Bin of(final Collection<RawRecord> records) {
    if (records.isEmpty()) {
      return EMPTY;
    }
    return new Bin(ImmutableList.copyOf(records));
  }

  /**
   * Freezes the given records.
   * @param records Records in time order.
   * @return A bin, {@link #EMPTY} when no records were given.
   */
  public static Bin of(final RawRecord... records) {
    if (records.length == 0) {
      return EMPTY;
    }
    return new Bin(ImmutableList.copyOf(records));
  }

  /** @return The number of records. */
  public int size() {
    return records.size();
  }

  /** @return True when nothing fell into the interval. */
  public boolean isEmpty() {
    return records.isEmpty();
  }

  /**
   * @param index The index of the record.
   * @return The record at the index.
   * @throws IndexOutOfBoundsException if the index was out of range.
   */
  public RawRecord get(final int index) {
    return records.get(index);
  }

  /** @return The newest record or null if the bin is empty. */
  public RawRecord last() {
    return records.isEmpty() ? null : records.get(records.size() - 1);
  }

  /** @return An immutable view of the records. */
  public List<RawRecord> records() {
    return records;
  }

  @Override
  public Iterator<RawRecord> iterator() {
    return records.iterator();
  }

  @Override
  public String toString() {
    return "Bin" + records;
  }
}
