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

import java.util.Collections;
import java.util.List;

import com.google.common.collect.Lists;

/**
 * An aggregated series: the descriptor and its records in ascending time
 * order. Records can only be appended and each must be newer than the last.
 * <p>
 * <b>Note:</b> This class is not synchronized. While an aggregation is
 * running only the task's worker appends to it; readers on other threads
 * go through the task's emission log.
 *
 * @since 1.0
 */
public class OutputSeries {
  private final SeriesDescriptor descriptor;
  private final List<OutputRecord> records;

  /**
   * Default ctor.
   * @param descriptor A non-null aggregate descriptor.
   */
  public OutputSeries(final SeriesDescriptor descriptor) {
    if (descriptor == null) {
      throw new IllegalArgumentException("Descriptor cannot be null.");
    }
    this.descriptor = descriptor;
    records = Lists.newArrayList();
  }

  public SeriesDescriptor descriptor() {
    return descriptor;
  }

  /**
   * Appends a record.
   * @param record A non-null record.
   * @throws IllegalArgumentException if the record is null or not newer
   * than the last one.
   */
  public void append(final OutputRecord record) {
    if (record == null) {
      throw new IllegalArgumentException("Record cannot be null.");
    }
    final OutputRecord last = last();
    if (last != null && !record.timestamp().isAfter(last.timestamp())) {
      throw new IllegalArgumentException("Record at " + record.timestamp()
          + " is not after the last record at " + last.timestamp()
          + " of " + descriptor.name());
    }
    records.add(record);
  }

  /** @return The newest record or null if the series is empty. */
  public OutputRecord last() {
    return records.isEmpty() ? null : records.get(records.size() - 1);
  }

  public int size() {
    return records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  /** @return An unmodifiable view of the records. */
  public List<OutputRecord> records() {
    return Collections.unmodifiableList(records);
  }

  @Override
  public String toString() {
    return "OutputSeries{" + descriptor.name() + ", records=" + records.size()
        + "}";
  }
}
