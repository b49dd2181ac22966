/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.disruptiondetector.common.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class ConfigDefTest {
  private static final String RATIO_CONFIG = "test.ratio";
  private static final String COUNT_CONFIG = "test.count";
  private static final String NAMES_CONFIG = "test.names";
  private static final String LANGUAGE_CONFIG = "test.language";
  private static final String OPTIONAL_CLASS_CONFIG = "test.optional.class";
  private static final String ENABLED_CONFIG = "test.enabled";

  private static ConfigDef definition() {
    return new ConfigDef()
        .define(RATIO_CONFIG, ConfigDef.Type.DOUBLE, 0.1, ConfigDef.Range.between(0.0, 1.0),
                ConfigDef.Importance.HIGH, "A ratio.")
        .define(COUNT_CONFIG, ConfigDef.Type.INT, 3, ConfigDef.Range.atLeast(1), ConfigDef.Importance.LOW, "A count.")
        .define(NAMES_CONFIG, ConfigDef.Type.LIST, "", ConfigDef.Importance.MEDIUM, "Some names.")
        .define(LANGUAGE_CONFIG, ConfigDef.Type.STRING, "en", ConfigDef.ValidString.in("en", "zh"),
                ConfigDef.Importance.LOW, "A language.");
  }

  @Test
  public void testDefaults() {
    AbstractConfig config = new AbstractConfig(definition(), Collections.emptyMap(), false);
    assertEquals(0.1, config.getDouble(RATIO_CONFIG), 0.0);
    assertEquals(3, (int) config.getInt(COUNT_CONFIG));
    assertTrue(config.getList(NAMES_CONFIG).isEmpty());
    assertEquals("en", config.getString(LANGUAGE_CONFIG));
  }

  @Test
  public void testParseStringValues() {
    Map<String, Object> props = new HashMap<>();
    props.put(RATIO_CONFIG, " 0.25 ");
    props.put(COUNT_CONFIG, "5");
    props.put(NAMES_CONFIG, "cpu_usage, mem_usage");
    props.put(LANGUAGE_CONFIG, "ZH");
    props.put("unknown.config", "value");
    AbstractConfig config = new AbstractConfig(definition(), props, false);
    assertEquals(0.25, config.getDouble(RATIO_CONFIG), 0.0);
    assertEquals(5, (int) config.getInt(COUNT_CONFIG));
    assertEquals(Arrays.asList("cpu_usage", "mem_usage"), config.getList(NAMES_CONFIG));
    assertEquals("The undefined config should be reported as unknown",
                 Collections.singleton("unknown.config"), config.unknownConfigs());
  }

  @Test
  public void testInvalidValues() {
    assertThrows(ConfigException.class,
                 () -> new AbstractConfig(definition(), Collections.singletonMap(RATIO_CONFIG, "1.5"), false));
    assertThrows(ConfigException.class,
                 () -> new AbstractConfig(definition(), Collections.singletonMap(COUNT_CONFIG, "0"), false));
    assertThrows(ConfigException.class,
                 () -> new AbstractConfig(definition(), Collections.singletonMap(COUNT_CONFIG, "three"), false));
    assertThrows(ConfigException.class,
                 () -> new AbstractConfig(definition(), Collections.singletonMap(LANGUAGE_CONFIG, "fr"), false));
  }

  @Test
  public void testDuplicateDefinition() {
    ConfigException e = assertThrows(ConfigException.class,
                                     () -> definition().define(RATIO_CONFIG, ConfigDef.Type.INT, 1, ConfigDef.Importance.LOW,
                                                               "Another ratio."));
    assertTrue(e.getMessage(), e.getMessage().contains("A ratio."));
  }

  @Test
  public void testNullDefaultAndBoolean() {
    ConfigDef definition = new ConfigDef()
        .define(OPTIONAL_CLASS_CONFIG, ConfigDef.Type.CLASS, null, ConfigDef.Importance.LOW, "An optional class.")
        .define(ENABLED_CONFIG, ConfigDef.Type.BOOLEAN, false, ConfigDef.Importance.LOW, "A flag.");
    AbstractConfig config = new AbstractConfig(definition, Collections.singletonMap(ENABLED_CONFIG, " TRUE "), false);
    assertNull(config.getClass(OPTIONAL_CLASS_CONFIG));
    assertTrue(config.getBoolean(ENABLED_CONFIG));
    assertTrue(config.unknownConfigs().isEmpty());
    assertThrows(ConfigException.class,
                 () -> new AbstractConfig(definition, Collections.singletonMap(ENABLED_CONFIG, "yes"), false));
  }

  @Test
  public void testUnknownKey() {
    AbstractConfig config = new AbstractConfig(definition(), Collections.emptyMap(), false);
    assertThrows(ConfigException.class, () -> config.getString("test.undefined"));
  }
}
