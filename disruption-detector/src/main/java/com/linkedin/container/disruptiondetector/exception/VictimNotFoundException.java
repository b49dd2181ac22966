/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.exception;

import com.linkedin.disruptiondetector.exception.DisruptionDetectorException;


/**
 * Thrown when the victim container of a root cause analysis has no series in the analyzed window.
 */
public class VictimNotFoundException extends DisruptionDetectorException {
  private final String _containerName;

  public VictimNotFoundException(String containerName, String metric, String machineId) {
    super(String.format("No series of metric %s found for container %s on machine %s.", metric, containerName, machineId));
    _containerName = containerName;
  }

  public String containerName() {
    return _containerName;
  }
}
