/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.config.constants;

import com.linkedin.disruptiondetector.common.config.ConfigDef;


/**
 * A class to keep the metric loader configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class MetricLoaderConfig {

  /**
   * <code>metric.loader.class</code>
   */
  public static final String METRIC_LOADER_CLASS_CONFIG = "metric.loader.class";
  public static final String DEFAULT_METRIC_LOADER_CLASS = null;
  public static final String METRIC_LOADER_CLASS_DOC = "The class name of the metric loader that serves the container series. "
      + "It must implement com.linkedin.container.disruptiondetector.loader.MetricLoader and is configured with all the "
      + "loader configs.";

  private MetricLoaderConfig() {
  }

  /**
   * Define configs for the metric loader.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the metric loader.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(METRIC_LOADER_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_METRIC_LOADER_CLASS,
                            ConfigDef.Importance.HIGH,
                            METRIC_LOADER_CLASS_DOC);
  }
}
