/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.disruptiondetector.common.config;

/**
 * Thrown if a configuration or a detection request is invalid. Always raised before any statistical work starts.
 */
public class ConfigException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String name, Object value, String message) {
    super(String.format("Invalid value %s for configuration %s: %s", value, name, message));
  }
}
