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

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

/**
 * ClimAgg Configuration Class
 * 
 * Holds the user configurable settings of an aggregation batch. On
 * initialization default values are set for every key, then callers may load
 * a properties file via {@link #Config(String)} or search the default
 * locations with {@link #Config(boolean)}.
 * <p>
 * The typed getters throw a {@link ConfigurationException} if the property
 * is missing or can't be parsed so a bad value fails the batch before any
 * work starts.
 * @since 1.0
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  /** Number of aggregation workers. */
  public static final String WORKERS_KEY = "climagg.workers";
  
  /** How long, in milliseconds, an idle worker waits on the queue before
   * checking the stop flag. */
  public static final String WORKER_POLL_KEY = "climagg.workers.poll_ms";
  
  /** Whether or not finished series are written to the store. */
  public static final String COMMIT_KEY = "climagg.aggregation.commit";
  
  /** When true a missing auxiliary series fails the dependent task, when 
   * false the task runs without it. */
  public static final String REQUIRE_AUXILIARY_KEY = 
      "climagg.aggregation.require_auxiliary";
  
  /** Name of the bundled aggregation profile or path to a YAML file. */
  public static final String PROFILE_KEY = "climagg.aggregation.profile";
  
  /** How long, in milliseconds, a worker waits for the store to 
   * acknowledge a write. */
  public static final String PERSIST_TIMEOUT_KEY = 
      "climagg.storage.persist_timeout_ms";

  /** The configured properties, defaults merged in. */
  protected final HashMap<String, String> properties = 
      new HashMap<String, String>();

  /** Holds default values for the config. */
  protected final HashMap<String, String> default_map = 
      new HashMap<String, String>();
  
  /** Tracks the location of the file that was actually loaded. */
  protected String config_location;

  /**
   * Ctor that initializes default values and optionally searches for a
   * config file in the default locations.
   * @param auto_load_config Whether or not to search for a file.
   * @throws IOException If a file was found but couldn't be read.
   */
  public Config(final boolean auto_load_config) throws IOException {
    if (auto_load_config) {
      loadConfig();
    }
    setDefaults();
  }

  /**
   * Ctor that loads the given properties file, then fills in defaults.
   * @param file Path to the file to load.
   * @throws IOException If the file couldn't be read.
   */
  public Config(final String file) throws IOException {
    loadConfig(file);
    setDefaults();
  }

  /**
   * Creates a copy of the parent so that overrides don't leak back.
   * @param parent A non-null parent config.
   */
  public Config(final Config parent) {
    properties.putAll(parent.properties);
    config_location = parent.config_location;
    setDefaults();
  }

  /**
   * Creates a config with only the defaults.
   */
  public Config() {
    setDefaults();
  }
  
  /** @return The file that generated this config. May be null */
  public String configLocation() {
    return config_location;
  }

  /** @return The number of workers, always at least 1. */
  public int workers() {
    final int workers = getInt(WORKERS_KEY);
    if (workers < 1) {
      throw new ConfigurationException(WORKERS_KEY 
          + " must be at least 1: " + workers);
    }
    return workers;
  }
  
  /** @return Whether or not finished series are written to the store. */
  public boolean commit() {
    return getBoolean(COMMIT_KEY);
  }
  
  /** @return Whether or not a missing auxiliary series is fatal. */
  public boolean requireAuxiliary() {
    return getBoolean(REQUIRE_AUXILIARY_KEY);
  }
  
  /**
   * Allows for modifying properties after creation or loading, e.g. from
   * the command line.
   * @param property The name of the property to override
   * @param value The value to store
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
  }

  /**
   * Returns the given property as a String
   * @param property The property to load
   * @return The property value, null if it wasn't set.
   */
  public final String getString(final String property) {
    return properties.get(property);
  }

  /**
   * Returns the given property as an integer
   * @param property The property to load
   * @return The parsed integer.
   * @throws ConfigurationException if the property was missing or could 
   * not be parsed.
   */
  public final int getInt(final String property) {
    final String value = required(property);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Property " + property 
          + " is not an integer: " + value, e);
    }
  }

  /**
   * Returns the given property as a long
   * @param property The property to load
   * @return The parsed long.
   * @throws ConfigurationException if the property was missing or could 
   * not be parsed.
   */
  public final long getLong(final String property) {
    final String value = required(property);
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Property " + property 
          + " is not a long: " + value, e);
    }
  }

  /**
   * Returns the given property as a boolean
   * 
   * Property values are case insensitive and the following values will result
   * in a True return value: - 1 - True - Yes
   * 
   * Any other values, including an empty string, will result in a False
   * 
   * @param property The property to load
   * @return A parsed boolean
   * @throws ConfigurationException if the property was not found
   */
  public final boolean getBoolean(final String property) {
    final String val = required(property).toUpperCase();
    if (val.equals("1"))
      return true;
    if (val.equals("TRUE"))
      return true;
    if (val.equals("YES"))
      return true;
    return false;
  }
  
  /**
   * Determines if the given propery is in the map
   * @param property The property to search for
   * @return True if the property exists and has a value, not an empty string
   */
  public final boolean hasProperty(final String property) {
    final String val = properties.get(property);
    if (val == null)
      return false;
    if (val.isEmpty())
      return false;
    return true;
  }

  /**
   * Returns a simple string with the configured properties for debugging
   * @return A string with information about the config
   */
  public final String dumpConfiguration() {
    if (properties.isEmpty())
      return "No configuration settings stored";

    final StringBuilder response = new StringBuilder("ClimAgg Configuration:\n");
    response.append("File [" + config_location + "]\n");
    int line = 0;
    for (final Map.Entry<String, String> entry : properties.entrySet()) {
      if (line > 0) {
        response.append("\n");
      }
      response.append("Key [" + entry.getKey() + "]  Value [")
              .append(entry.getValue())
              .append("]");
      line++;
    }
    return response.toString();
  }

  /**
   * Loads default entries that were not provided by a file or command line
   * 
   * This should be called in the constructor
   */
  protected void setDefaults() {
    default_map.put(WORKERS_KEY, "4");
    default_map.put(WORKER_POLL_KEY, "100");
    default_map.put(COMMIT_KEY, "true");
    default_map.put(REQUIRE_AUXILIARY_KEY, "false");
    default_map.put(PROFILE_KEY, "dmi-daily");
    default_map.put(PERSIST_TIMEOUT_KEY, "60000");

    for (final Map.Entry<String, String> entry : default_map.entrySet()) {
      if (!properties.containsKey(entry.getKey())) {
        properties.put(entry.getKey(), entry.getValue());
      }
    }
  }

  /**
   * Searches a list of locations for a valid configuration file. The first
   * one found is loaded, the rest are ignored.
   * 
   * Defaults are: ./climagg.conf /etc/climagg.conf /etc/climagg/climagg.conf
   * 
   * @throws IOException Thrown if there was an issue reading a file
   */
  protected void loadConfig() throws IOException {
    if (config_location != null && !config_location.isEmpty()) {
      loadConfig(config_location);
      return;
    }

    final List<String> file_locations = Lists.newArrayList(
        "climagg.conf",
        "/etc/climagg.conf",
        "/etc/climagg/climagg.conf");

    for (final String file : file_locations) {
      try {
        loadConfig(file);
        return;
      } catch (FileNotFoundException e) {
        LOG.debug("No configuration at {}", file);
      }
    }

    LOG.info("No configuration found, will use defaults");
  }

  /**
   * Attempts to load the configuration from the given location
   * @param file Path to the file to load
   * @throws IOException Thrown if there was an issue reading the file
   * @throws FileNotFoundException Thrown if the config file was not found
   */
  protected void loadConfig(final String file) throws FileNotFoundException,
      IOException {
    try (final FileInputStream file_stream = new FileInputStream(file)) {
      final Properties props = new Properties();
      props.load(file_stream);
      loadHashMap(props);
      LOG.info("Successfully loaded configuration file: {}", file);
      config_location = file;
    }
  }
  
  private String required(final String property) {
    final String value = properties.get(property);
    if (value == null) {
      throw new ConfigurationException("Missing property: " + property);
    }
    return value.trim();
  }
  
  /**
   * Copies the loaded properties into the hash map.
   * @param props The loaded Properties object to copy
   */
  private void loadHashMap(final Properties props) {
    properties.clear();
    
    @SuppressWarnings("rawtypes")
    Enumeration e = props.propertyNames();
    while (e.hasMoreElements()) {
      String key = (String) e.nextElement();
      properties.put(key, props.getProperty(key));
    }
  }
}
