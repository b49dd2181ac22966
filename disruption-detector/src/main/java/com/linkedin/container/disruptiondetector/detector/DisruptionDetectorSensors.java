/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.detector;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;


/**
 * Sensors of the container disruption detection. The sensors are registered by name, so the facades of successive
 * requests sharing a registry report to the same sensors.
 */
public class DisruptionDetectorSensors {
  public static final String DISRUPTION_DETECTOR_SENSOR = "ContainerDisruptionDetector";
  public static final String SPOT_DETECTION_TIMER = "spot-detection-timer";
  public static final String ROOT_CAUSE_ANALYSIS_TIMER = "root-cause-analysis-timer";
  public static final String CONTAINER_ANOMALY_RATE = "container-anomaly-rate";
  public static final String INVALID_SERIES_RATE = "invalid-series-rate";
  public static final String SCANNED_CONTAINERS = "scanned-containers";
  private final Timer _spotDetectionTimer;
  private final Timer _rootCauseAnalysisTimer;
  private final Meter _containerAnomalyRate;
  private final Meter _invalidSeriesRate;
  private final Counter _scannedContainers;

  public DisruptionDetectorSensors(MetricRegistry dropwizardMetricRegistry) {
    _spotDetectionTimer = dropwizardMetricRegistry.timer(MetricRegistry.name(DISRUPTION_DETECTOR_SENSOR, SPOT_DETECTION_TIMER));
    _rootCauseAnalysisTimer = dropwizardMetricRegistry.timer(MetricRegistry.name(DISRUPTION_DETECTOR_SENSOR,
                                                                                 ROOT_CAUSE_ANALYSIS_TIMER));
    _containerAnomalyRate = dropwizardMetricRegistry.meter(MetricRegistry.name(DISRUPTION_DETECTOR_SENSOR, CONTAINER_ANOMALY_RATE));
    _invalidSeriesRate = dropwizardMetricRegistry.meter(MetricRegistry.name(DISRUPTION_DETECTOR_SENSOR, INVALID_SERIES_RATE));
    _scannedContainers = dropwizardMetricRegistry.counter(MetricRegistry.name(DISRUPTION_DETECTOR_SENSOR, SCANNED_CONTAINERS));
  }

  /**
   * @return Timer of the extreme value scoring of one KPI on one machine.
   */
  public Timer spotDetectionTimer() {
    return _spotDetectionTimer;
  }

  public Timer rootCauseAnalysisTimer() {
    return _rootCauseAnalysisTimer;
  }

  public Meter containerAnomalyRate() {
    return _containerAnomalyRate;
  }

  /**
   * @return Rate of series scored 0 because they are too short or degenerate.
   */
  public Meter invalidSeriesRate() {
    return _invalidSeriesRate;
  }

  public Counter scannedContainers() {
    return _scannedContainers;
  }
}
