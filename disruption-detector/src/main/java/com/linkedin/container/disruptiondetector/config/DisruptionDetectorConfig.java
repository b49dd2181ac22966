/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.config;

import com.linkedin.container.disruptiondetector.config.constants.MetricLoaderConfig;
import com.linkedin.container.disruptiondetector.config.constants.ReportConfig;
import com.linkedin.container.disruptiondetector.config.constants.RootCauseConfig;
import com.linkedin.container.disruptiondetector.config.constants.SpotDetectorConfig;
import com.linkedin.container.disruptiondetector.loader.MetricLoader;
import com.linkedin.container.disruptiondetector.report.ReportLanguage;
import com.linkedin.disruptiondetector.common.config.AbstractConfig;
import com.linkedin.disruptiondetector.common.config.ConfigDef;
import com.linkedin.disruptiondetector.common.config.ConfigException;
import com.linkedin.disruptiondetector.exception.DisruptionDetectorException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;


/**
 * The configuration class of the container disruption detector. It is built once per request, or once per process,
 * and passed explicitly to the components that need it.
 *
 * To avoid having a huge monolithic class that mixes unrelated configs, config names, their defaults, and definitions
 * reside in the relevant classes under {@link com.linkedin.container.disruptiondetector.config.constants}.
 */
public class DisruptionDetectorConfig extends AbstractConfig {
  private static final ConfigDef CONFIG;

  static {
    CONFIG = MetricLoaderConfig.define(ReportConfig.define(RootCauseConfig.define(SpotDetectorConfig.define(new ConfigDef()))));
  }

  public DisruptionDetectorConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public DisruptionDetectorConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
  }

  /**
   * @param overrides Configs to override.
   * @return A new config with the original configs of this one overridden by the given ones.
   */
  public DisruptionDetectorConfig withOverrides(Map<String, ?> overrides) {
    if (overrides == null || overrides.isEmpty()) {
      return this;
    }
    Map<String, Object> merged = new HashMap<>(originals());
    merged.putAll(overrides);
    return new DisruptionDetectorConfig(merged);
  }

  /**
   * @return The language of the reports.
   */
  public ReportLanguage reportLanguage() {
    return ReportLanguage.forCode(getString(ReportConfig.REPORT_LANGUAGE_CONFIG));
  }

  /**
   * Instantiate and configure the metric loader given by {@link MetricLoaderConfig#METRIC_LOADER_CLASS_CONFIG}.
   *
   * @return A configured metric loader.
   */
  public MetricLoader metricLoader() throws DisruptionDetectorException {
    MetricLoader loader = getConfiguredInstance(MetricLoaderConfig.METRIC_LOADER_CLASS_CONFIG, MetricLoader.class,
                                                Collections.emptyMap());
    if (loader == null) {
      throw new ConfigException(String.format("Missing %s to load the container metrics.",
                                              MetricLoaderConfig.METRIC_LOADER_CLASS_CONFIG));
    }
    return loader;
  }
}
