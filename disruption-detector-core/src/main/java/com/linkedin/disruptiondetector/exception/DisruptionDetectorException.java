/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.disruptiondetector.exception;

/**
 * The parent exception for all the checked disruption detector exceptions.
 */
public class DisruptionDetectorException extends Exception {

  public DisruptionDetectorException(String message, Throwable cause) {
    super(message, cause);
  }

  public DisruptionDetectorException(String message) {
    super(message);
  }

  public DisruptionDetectorException(Throwable cause) {
    super(cause);
  }
}
