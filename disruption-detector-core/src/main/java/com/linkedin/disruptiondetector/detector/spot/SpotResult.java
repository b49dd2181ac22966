/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.disruptiondetector.detector.spot;

import java.util.Collections;
import java.util.List;


/**
 * The outcome of running a {@link SpotThresholdModel} over a test window: the threshold in effect when each point was
 * evaluated and the indices of the points that raised an alarm.
 */
public final class SpotResult {
  private final double[] _thresholds;
  private final List<Integer> _alarms;

  SpotResult(double[] thresholds, List<Integer> alarms) {
    _thresholds = thresholds;
    _alarms = Collections.unmodifiableList(alarms);
  }

  /**
   * @return One threshold per test point, as it was before the point updated the model.
   */
  public double[] thresholds() {
    return _thresholds.clone();
  }

  /**
   * @return Indices of the alarmed test points, ascending.
   */
  public List<Integer> alarms() {
    return _alarms;
  }

  public int numAlarms() {
    return _alarms.size();
  }

  @Override
  public String toString() {
    return String.format("SpotResult{numPoints=%d, alarms=%s}", _thresholds.length, _alarms);
  }
}
