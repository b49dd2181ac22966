/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.disruptiondetector.common.config;

import com.linkedin.disruptiondetector.common.utils.Utils;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * The set of expected configurations of a detector component. Each configuration has a name, a type, a default value
 * (possibly {@code null}), an optional {@link Validator}, an importance and a documentation string.
 *
 * <pre>
 * ConfigDef defs = new ConfigDef()
 *     .define(&quot;spot.q&quot;, Type.DOUBLE, 1e-3, Range.between(1e-9, 0.5), Importance.HIGH, &quot;Risk parameter.&quot;)
 *     .define(&quot;extra.metrics&quot;, Type.LIST, &quot;&quot;, Importance.MEDIUM, &quot;Trend metrics.&quot;);
 * Map&lt;String, Object&gt; parsed = defs.parse(props);
 * </pre>
 *
 * Usually consumed through {@link AbstractConfig}, which keeps the parsed values and offers typed getters.
 */
public class ConfigDef {
  private final Map<String, ConfigKey> _configKeys;

  public ConfigDef() {
    _configKeys = new LinkedHashMap<>();
  }

  /**
   * Define a new configuration.
   *
   * @param name          The name of the config parameter.
   * @param type          The type of the config.
   * @param defaultValue  The default value to use if this config isn't present, may be {@code null}.
   * @param validator     The validator to use in checking the correctness of the config, or {@code null}.
   * @param importance    The importance of this config.
   * @param documentation The documentation string for the config.
   * @return This ConfigDef so you can chain calls.
   */
  public ConfigDef define(String name, Type type, Object defaultValue, Validator validator, Importance importance,
                          String documentation) {
    ConfigKey existing = _configKeys.get(name);
    if (existing != null) {
      throw new ConfigException(String.format("Configuration %s is defined twice, first as %s", name, existing));
    }
    _configKeys.put(name, new ConfigKey(name, type, defaultValue, validator, importance, documentation));
    return this;
  }

  /**
   * Define a new configuration with no special validation logic.
   *
   * @param name          The name of the config parameter.
   * @param type          The type of the config.
   * @param defaultValue  The default value to use if this config isn't present, may be {@code null}.
   * @param importance    The importance of this config.
   * @param documentation The documentation string for the config.
   * @return This ConfigDef so you can chain calls.
   */
  public ConfigDef define(String name, Type type, Object defaultValue, Importance importance, String documentation) {
    return define(name, type, defaultValue, null, importance, documentation);
  }

  /**
   * Parse and validate the given configs against this definition. Values may either be strings or already be of
   * the expected type. Configs that are not defined are ignored.
   *
   * @param props The configs to parse and validate.
   * @return Parsed and validated configs by name, one entry per defined config.
   */
  public Map<String, Object> parse(Map<?, ?> props) {
    Map<String, Object> values = new HashMap<>();
    for (ConfigKey key : _configKeys.values()) {
      Object value = props.containsKey(key._name) ? parseType(key._name, props.get(key._name), key._type) : key._defaultValue;
      if (key._validator != null) {
        key._validator.ensureValid(key._name, value);
      }
      values.put(key._name, value);
    }
    return values;
  }

  /**
   * Parse a value according to its expected type.
   *
   * @param name  The config name.
   * @param value The config value.
   * @param type  The expected type.
   * @return The parsed object.
   */
  static Object parseType(String name, Object value, Type type) {
    if (value == null) {
      return null;
    }
    String trimmed = value instanceof String ? ((String) value).trim() : null;
    try {
      switch (type) {
        case BOOLEAN:
          if (value instanceof Boolean) {
            return value;
          } else if ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed)) {
            return Boolean.parseBoolean(trimmed);
          }
          throw new ConfigException(name, value, "Expected value to be either true or false");
        case STRING:
          if (trimmed != null) {
            return trimmed;
          }
          throw new ConfigException(name, value, "Expected value to be a string, but it was a " + value.getClass().getName());
        case INT:
          if (value instanceof Integer) {
            return value;
          } else if (trimmed != null) {
            return Integer.parseInt(trimmed);
          }
          throw new ConfigException(name, value, "Expected value to be a 32-bit integer, but it was a " + value.getClass().getName());
        case DOUBLE:
          if (value instanceof Number) {
            return ((Number) value).doubleValue();
          } else if (trimmed != null) {
            return Double.parseDouble(trimmed);
          }
          throw new ConfigException(name, value, "Expected value to be a double, but it was a " + value.getClass().getName());
        case LIST:
          if (value instanceof List) {
            return value;
          } else if (trimmed != null) {
            return trimmed.isEmpty() ? Collections.emptyList() : Arrays.asList(trimmed.split("\\s*,\\s*", -1));
          }
          throw new ConfigException(name, value, "Expected a comma separated list.");
        case CLASS:
          if (value instanceof Class) {
            return value;
          } else if (trimmed != null) {
            return Class.forName(trimmed, true, Utils.contextOrDetectorClassLoader());
          }
          throw new ConfigException(name, value, "Expected a Class instance or class name.");
        default:
          throw new IllegalStateException("Unknown type " + type);
      }
    } catch (NumberFormatException e) {
      throw new ConfigException(name, value, "Not a number of type " + type);
    } catch (ClassNotFoundException e) {
      throw new ConfigException(name, value, "Class " + value + " could not be found.");
    }
  }

  /**
   * The config types
   */
  public enum Type {
    BOOLEAN, STRING, INT, DOUBLE, LIST, CLASS
  }

  /**
   * The importance level for a configuration
   */
  public enum Importance {
    HIGH, MEDIUM, LOW
  }

  /**
   * Validation logic for a single configuration.
   */
  public interface Validator {
    /**
     * @param name The name of the configuration.
     * @param value The value of the configuration.
     * @throws ConfigException if the value is invalid.
     */
    void ensureValid(String name, Object value);
  }

  /**
   * Validation logic for numeric ranges.
   */
  public static final class Range implements Validator {
    private final Number _min;
    private final Number _max;

    private Range(Number min, Number max) {
      _min = min;
      _max = max;
    }

    /**
     * @param min The minimum acceptable value.
     * @return A numeric range that checks only the lower bound.
     */
    public static Range atLeast(Number min) {
      return new Range(min, null);
    }

    /**
     * @param min Minimum bound.
     * @param max Maximum bound.
     * @return A numeric range that checks both the upper and lower bound.
     */
    public static Range between(Number min, Number max) {
      return new Range(min, max);
    }

    @Override
    public void ensureValid(String name, Object o) {
      if (o == null) {
        throw new ConfigException(name, null, "Value must be non-null");
      }
      double value = ((Number) o).doubleValue();
      if (value < _min.doubleValue() || (_max != null && value > _max.doubleValue())) {
        throw new ConfigException(name, o, "Value must be in " + this);
      }
    }

    @Override
    public String toString() {
      return _max == null ? "[" + _min + ",...]" : "[" + _min + ",...," + _max + "]";
    }
  }

  /**
   * Validation logic for strings that must take one of a fixed set of values (case insensitive).
   */
  public static final class ValidString implements Validator {
    private final List<String> _validStrings;

    private ValidString(List<String> validStrings) {
      _validStrings = validStrings;
    }

    public static ValidString in(String... validStrings) {
      return new ValidString(Arrays.asList(validStrings));
    }

    @Override
    public void ensureValid(String name, Object o) {
      String s = (String) o;
      if (s == null || _validStrings.stream().noneMatch(s::equalsIgnoreCase)) {
        throw new ConfigException(name, o, "String must be one of: " + String.join(", ", _validStrings));
      }
    }
  }

  /**
   * A defined configuration. The importance and documentation describe the config to its users and are not used when
   * parsing.
   */
  private static final class ConfigKey {
    private final String _name;
    private final Type _type;
    private final Object _defaultValue;
    private final Validator _validator;
    private final Importance _importance;
    private final String _documentation;

    private ConfigKey(String name, Type type, Object defaultValue, Validator validator, Importance importance,
                      String documentation) {
      _name = name;
      _type = type;
      _defaultValue = parseType(name, defaultValue, type);
      _validator = validator;
      _importance = importance;
      _documentation = documentation;
      if (_validator != null && _defaultValue != null) {
        _validator.ensureValid(name, _defaultValue);
      }
    }

    @Override
    public String toString() {
      return String.format("%s (%s, %s): %s", _name, _type, _importance, _documentation);
    }
  }
}
