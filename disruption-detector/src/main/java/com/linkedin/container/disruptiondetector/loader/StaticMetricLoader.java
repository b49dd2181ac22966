/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.loader;

import com.linkedin.disruptiondetector.model.TimeSeries;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.linkedin.disruptiondetector.common.utils.Utils.validateNotNull;


/**
 * A metric loader that serves a fixed list of series, e.g. a payload handed over for offline detection. The window is
 * ignored: every series is returned whole and the expected length is the one of the longest series.
 *
 * Series without a {@link TimeSeries#MACHINE_ID_LABEL} label belong to every machine.
 */
public class StaticMetricLoader implements MetricLoader {
  /**
   * The config holding the {@code List<TimeSeries>} to serve.
   */
  public static final String STATIC_METRIC_LOADER_SERIES_OBJECT_CONFIG = "static.metric.loader.series.object";
  public static final String OFFLINE_MACHINE_ID = "offline";
  private List<TimeSeries> _series;

  /**
   * Default constructor for reflection, the series are then given by {@link #configure(Map)}.
   */
  public StaticMetricLoader() {
    _series = Collections.emptyList();
  }

  public StaticMetricLoader(List<TimeSeries> series) {
    _series = List.copyOf(validateNotNull(series, "Series cannot be null."));
  }

  @SuppressWarnings("unchecked")
  @Override
  public void configure(Map<String, ?> configs) {
    Object series = validateNotNull(configs.get(STATIC_METRIC_LOADER_SERIES_OBJECT_CONFIG),
                                    () -> String.format("Missing %s when creating the static metric loader",
                                                        STATIC_METRIC_LOADER_SERIES_OBJECT_CONFIG));
    _series = List.copyOf((List<TimeSeries>) series);
  }

  @Override
  public List<TimeSeries> metric(Instant start, Instant end, String metric, String machineId) {
    List<TimeSeries> result = new ArrayList<>();
    for (TimeSeries series : _series) {
      if (series.metric().equals(metric) && belongsTo(series, machineId)) {
        result.add(series);
      }
    }
    return result;
  }

  @Override
  public List<String> uniqueMachines(Instant start, Instant end, List<String> metrics) {
    Set<String> machineIds = new LinkedHashSet<>();
    for (TimeSeries series : _series) {
      String machineId = series.label(TimeSeries.MACHINE_ID_LABEL);
      if (metrics.contains(series.metric()) && !machineId.isEmpty()) {
        machineIds.add(machineId);
      }
    }
    return new ArrayList<>(machineIds);
  }

  @Override
  public int expectedPointLength(Instant start, Instant end) {
    int expected = 0;
    for (TimeSeries series : _series) {
      expected = Math.max(expected, series.length());
    }
    return expected;
  }

  /**
   * @return Distinct metric names of the served series, in order of appearance.
   */
  public List<String> metrics() {
    Set<String> metrics = new LinkedHashSet<>();
    _series.forEach(series -> metrics.add(series.metric()));
    return new ArrayList<>(metrics);
  }

  private static boolean belongsTo(TimeSeries series, String machineId) {
    String seriesMachineId = series.label(TimeSeries.MACHINE_ID_LABEL);
    return machineId == null || seriesMachineId.isEmpty() || seriesMachineId.equals(machineId);
  }
}
