/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.config.constants;

import com.linkedin.disruptiondetector.common.config.ConfigDef;

import static com.linkedin.disruptiondetector.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.disruptiondetector.common.config.ConfigDef.Range.between;


/**
 * A class to keep the root cause analysis configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class RootCauseConfig {

  /**
   * <code>root.cause.correlation.threshold</code>
   */
  public static final String ROOT_CAUSE_CORRELATION_THRESHOLD_CONFIG = "root.cause.correlation.threshold";
  public static final double DEFAULT_ROOT_CAUSE_CORRELATION_THRESHOLD = 0.5;
  public static final String ROOT_CAUSE_CORRELATION_THRESHOLD_DOC = "A co-located series is a root cause candidate only if "
      + "the absolute value of its correlation with the victim is strictly above this threshold.";

  /**
   * <code>root.cause.max.count</code>
   */
  public static final String ROOT_CAUSE_MAX_COUNT_CONFIG = "root.cause.max.count";
  public static final int DEFAULT_ROOT_CAUSE_MAX_COUNT = 3;
  public static final String ROOT_CAUSE_MAX_COUNT_DOC = "The maximum number of root causes reported for a victim.";

  /**
   * <code>root.cause.analysis.enabled</code>
   */
  public static final String ROOT_CAUSE_ANALYSIS_ENABLED_CONFIG = "root.cause.analysis.enabled";
  public static final boolean DEFAULT_ROOT_CAUSE_ANALYSIS_ENABLED = false;
  public static final String ROOT_CAUSE_ANALYSIS_ENABLED_DOC = "True to attach root causes, searched among the series of the "
      + "same KPI and window, to every container reported by the detection.";

  private RootCauseConfig() {
  }

  /**
   * Define configs for the root cause analysis.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the root cause analysis.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(ROOT_CAUSE_CORRELATION_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_ROOT_CAUSE_CORRELATION_THRESHOLD,
                            between(0.0, 1.0),
                            ConfigDef.Importance.MEDIUM,
                            ROOT_CAUSE_CORRELATION_THRESHOLD_DOC)
                    .define(ROOT_CAUSE_MAX_COUNT_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_ROOT_CAUSE_MAX_COUNT,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            ROOT_CAUSE_MAX_COUNT_DOC)
                    .define(ROOT_CAUSE_ANALYSIS_ENABLED_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_ROOT_CAUSE_ANALYSIS_ENABLED,
                            ConfigDef.Importance.MEDIUM,
                            ROOT_CAUSE_ANALYSIS_ENABLED_DOC);
  }
}
