/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.disruptiondetector.common.config;

import com.linkedin.disruptiondetector.common.DisruptionDetectorConfigurable;
import com.linkedin.disruptiondetector.common.utils.Utils;
import com.linkedin.disruptiondetector.exception.DisruptionDetectorException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A convenient base class for configurations to extend. It holds both the original configuration that was provided
 * and the values parsed against a {@link ConfigDef}.
 */
public class AbstractConfig {
  private final Logger _log = LoggerFactory.getLogger(getClass());
  /* the original values passed in by the user */
  private final Map<String, ?> _originals;
  /* the parsed values, one per defined config */
  private final Map<String, Object> _values;

  /**
   * @param definition The definition of the configs.
   * @param originals The configs given by the user, defined or not.
   * @param doLog {@code true} to log the parsed values at info level.
   */
  @SuppressWarnings("unchecked")
  public AbstractConfig(ConfigDef definition, Map<?, ?> originals, boolean doLog) {
    for (Object key : originals.keySet()) {
      if (!(key instanceof String)) {
        throw new ConfigException(String.valueOf(key), originals.get(key), "Key must be a string.");
      }
    }
    _originals = (Map<String, ?>) originals;
    _values = definition.parse(_originals);
    if (doLog) {
      _log.info("{} values: {}", getClass().getSimpleName(), new TreeMap<>(_values));
    }
  }

  protected Object get(String key) {
    if (!_values.containsKey(key)) {
      throw new ConfigException(String.format("Unknown configuration '%s'", key));
    }
    return _values.get(key);
  }

  public Integer getInt(String key) {
    return (Integer) get(key);
  }

  public Double getDouble(String key) {
    return (Double) get(key);
  }

  @SuppressWarnings("unchecked")
  public List<String> getList(String key) {
    return (List<String>) get(key);
  }

  public Boolean getBoolean(String key) {
    return (Boolean) get(key);
  }

  public String getString(String key) {
    return (String) get(key);
  }

  public Class<?> getClass(String key) {
    return (Class<?>) get(key);
  }

  /**
   * @return A mutable copy of the original configs.
   */
  public Map<String, Object> originals() {
    return new HashMap<>(_originals);
  }

  /**
   * @return Original configs that this config does not define, sorted by name.
   */
  public Set<String> unknownConfigs() {
    Set<String> unknown = new TreeSet<>(_originals.keySet());
    unknown.removeAll(_values.keySet());
    return unknown;
  }

  /**
   * Log a warning for each original config that this config does not define, typically a misspelled key.
   */
  public void logUnknownConfigs() {
    for (String key : unknownConfigs()) {
      _log.warn("The configuration '{}' was supplied but isn't a known config.", key);
    }
  }

  /**
   * Get a configured instance of the class specified by the given configuration key. If the object implements
   * {@link DisruptionDetectorConfigurable}, it is configured with the original configs merged with the given overrides.
   *
   * @param key The configuration key for the class.
   * @param t The interface the class should implement.
   * @param configOverrides Configuration overrides to use.
   * @param <T> The type of the configured instance to be returned.
   * @return A configured instance of the class, or {@code null} if the key has no value.
   */
  public <T> T getConfiguredInstance(String key, Class<T> t, Map<String, ?> configOverrides)
      throws DisruptionDetectorException {
    Class<?> c = getClass(key);
    if (c == null) {
      return null;
    }
    Object o = Utils.newInstance(c);
    if (!t.isInstance(o)) {
      throw new DisruptionDetectorException(c.getName() + " is not an instance of " + t.getName());
    }
    if (o instanceof DisruptionDetectorConfigurable) {
      Map<String, Object> configPairs = originals();
      configPairs.putAll(configOverrides);
      ((DisruptionDetectorConfigurable) o).configure(configPairs);
    }
    return t.cast(o);
  }
}
