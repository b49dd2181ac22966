/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.disruptiondetector.exception;

/**
 * Thrown by a metric loader when the time series backend cannot serve a query. Detection never retries or masks it.
 */
public class MetricLoadingException extends DisruptionDetectorException {

  public MetricLoadingException(String message, Throwable cause) {
    super(message, cause);
  }

  public MetricLoadingException(String message) {
    super(message);
  }
}
