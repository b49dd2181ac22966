/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.loader;

import com.linkedin.disruptiondetector.common.DisruptionDetectorConfigurable;
import com.linkedin.disruptiondetector.exception.MetricLoadingException;
import com.linkedin.disruptiondetector.model.TimeSeries;
import java.time.Instant;
import java.util.List;


/**
 * The contract of the time series backend that serves per container metrics. Implementations are instantiated by
 * reflection from {@link com.linkedin.container.disruptiondetector.config.constants.MetricLoaderConfig#METRIC_LOADER_CLASS_CONFIG}
 * and configured with the loader configs. Failures of the backend are reported as {@link MetricLoadingException} and
 * are never retried by the detector.
 */
public interface MetricLoader extends DisruptionDetectorConfigurable {

  /**
   * Get the series of the given metric in the window {@code [start, end)}.
   *
   * @param start Start of the window (inclusive).
   * @param end End of the window (exclusive).
   * @param metric Metric name.
   * @param machineId Machine to get the series of, or {@code null} for all machines.
   * @return One series per entity, each with values ordered by time ascending.
   */
  List<TimeSeries> metric(Instant start, Instant end, String metric, String machineId) throws MetricLoadingException;

  /**
   * Get the machines that reported any of the given metrics in the window {@code [start, end)}. Backends that cannot
   * answer this natively keep the default implementation, and the callers derive the machines from the series labels.
   *
   * @param start Start of the window (inclusive).
   * @param end End of the window (exclusive).
   * @param metrics Metric names.
   * @return Distinct machine ids.
   */
  default List<String> uniqueMachines(Instant start, Instant end, List<String> metrics) throws MetricLoadingException {
    throw new UnsupportedOperationException(getClass().getSimpleName() + " cannot list the machines natively.");
  }

  /**
   * @param start Start of the window (inclusive).
   * @param end End of the window (exclusive).
   * @return The number of points a complete series has in the window.
   */
  int expectedPointLength(Instant start, Instant end);
}
