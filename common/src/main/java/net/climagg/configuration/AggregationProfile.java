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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Strings;

import net.climagg.data.IntervalKind;
import net.climagg.data.SeriesDescriptor;
import net.climagg.utils.YAML;
import net.climagg.utils.YAMLException;

/**
 * A set of per-code aggregation settings sharing one interval, e.g. the
 * daily aggregation of the DMI station data. Profiles are YAML documents:
 * <pre>
 * interval: day
 * aggregations:
 *   f:
 *     type: float
 *     func: ave
 * </pre>
 * Bundled profiles live under {@code /profiles/} on the class path and are
 * loaded by name with {@link #load(String)}.
 *
 * @since 1.0
 */
public class AggregationProfile {
  private static final Logger LOG = LoggerFactory.getLogger(
      AggregationProfile.class);
  
  /** Class path directory of the bundled profiles. */
  public static final String RESOURCE_PATH = "/profiles/";
  
  private final IntervalKind interval;
  private final Map<String, AggregationConfig> aggregations;

  @JsonCreator
  public AggregationProfile(
      @JsonProperty("interval") final IntervalKind interval,
      @JsonProperty("aggregations") 
        final Map<String, AggregationConfig> aggregations) {
    if (interval == null) {
      throw new IllegalArgumentException("Interval cannot be null.");
    }
    this.interval = interval;
    this.aggregations = aggregations == null 
        ? Collections.<String, AggregationConfig>emptyMap()
        : Collections.unmodifiableMap(
            new LinkedHashMap<String, AggregationConfig>(aggregations));
  }

  @JsonProperty("interval")
  public IntervalKind getInterval() {
    return interval;
  }

  @JsonProperty("aggregations")
  public Map<String, AggregationConfig> getAggregations() {
    return aggregations;
  }

  /**
   * @param code A variable code.
   * @return The settings for the code or null if the profile doesn't
   * aggregate it.
   */
  public AggregationConfig forCode(final String code) {
    return aggregations.get(code);
  }

  /**
   * Derives the aggregate descriptor of the given raw series.
   * @param parent The non-null series to aggregate.
   * @return The descriptor or null if the profile doesn't cover the code.
   */
  public SeriesDescriptor describe(final SeriesDescriptor parent) {
    final AggregationConfig config = aggregations.get(parent.code());
    if (config == null) {
      return null;
    }
    return config.describe(parent, interval);
  }

  /**
   * Loads a bundled profile by name or, if there is no such resource, a
   * YAML file at the given path.
   * @param name_or_path A profile name such as "dmi-daily" or a file path.
   * @return The parsed profile.
   * @throws ConfigurationException if the profile couldn't be found or
   * parsed.
   */
  public static AggregationProfile load(final String name_or_path) {
    if (Strings.isNullOrEmpty(name_or_path)) {
      throw new ConfigurationException("Profile name cannot be null or empty.");
    }
    final String resource = RESOURCE_PATH + name_or_path + ".yaml";
    try (final InputStream stream = 
        AggregationProfile.class.getResourceAsStream(resource)) {
      if (stream != null) {
        LOG.debug("Loading bundled aggregation profile {}", resource);
        return parse(stream, resource);
      }
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read profile " 
          + resource, e);
    }
    
    final File file = new File(name_or_path);
    if (!file.isFile()) {
      throw new ConfigurationException("No such aggregation profile: " 
          + name_or_path);
    }
    try (final InputStream stream = new FileInputStream(file)) {
      LOG.info("Loading aggregation profile from {}", file);
      return parse(stream, name_or_path);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read profile " 
          + name_or_path, e);
    }
  }
  
  private static AggregationProfile parse(final InputStream stream, 
                                          final String source) {
    try {
      return YAML.parseToObject(stream, AggregationProfile.class);
    } catch (IllegalArgumentException | YAMLException e) {
      throw new ConfigurationException("Invalid aggregation profile " 
          + source, e);
    }
  }
}
