/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.report;

import com.linkedin.disruptiondetector.common.config.ConfigException;
import java.util.Arrays;


/**
 * Languages the reports can be rendered in.
 */
public enum ReportLanguage {
  EN("en"), ZH("zh");

  private final String _code;

  ReportLanguage(String code) {
    _code = code;
  }

  public String code() {
    return _code;
  }

  /**
   * @return Codes of all the languages.
   */
  public static String[] codes() {
    return Arrays.stream(values()).map(ReportLanguage::code).toArray(String[]::new);
  }

  /**
   * @param code Language code, case insensitive.
   * @return The language with the given code.
   */
  public static ReportLanguage forCode(String code) {
    for (ReportLanguage language : values()) {
      if (language._code.equalsIgnoreCase(code)) {
        return language;
      }
    }
    throw new ConfigException("Unsupported report language: " + code);
  }
}
