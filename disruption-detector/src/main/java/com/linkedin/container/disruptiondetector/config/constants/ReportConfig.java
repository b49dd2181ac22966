/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.config.constants;

import com.linkedin.container.disruptiondetector.report.ReportLanguage;
import com.linkedin.disruptiondetector.common.config.ConfigDef;


/**
 * A class to keep the report configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class ReportConfig {

  /**
   * <code>report.language</code>
   */
  public static final String REPORT_LANGUAGE_CONFIG = "report.language";
  public static final String DEFAULT_REPORT_LANGUAGE = ReportLanguage.EN.code();
  public static final String REPORT_LANGUAGE_DOC = "The language of the markdown reports, either en or zh.";

  private ReportConfig() {
  }

  /**
   * Define configs for the reports.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the reports.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(REPORT_LANGUAGE_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_REPORT_LANGUAGE,
                            ConfigDef.ValidString.in(ReportLanguage.codes()),
                            ConfigDef.Importance.LOW,
                            REPORT_LANGUAGE_DOC);
  }
}
