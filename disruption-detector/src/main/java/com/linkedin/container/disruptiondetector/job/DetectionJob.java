/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.job;

import com.linkedin.container.disruptiondetector.config.constants.SpotDetectorConfig;
import com.linkedin.container.disruptiondetector.model.KpiParam;
import com.linkedin.container.disruptiondetector.model.WindowParam;
import java.util.Collections;
import java.util.List;
import java.util.Map;


/**
 * The enabled KPIs of a detection job, its window and the detector configs it overrides.
 */
public final class DetectionJob {
  private final List<KpiParam> _kpis;
  private final WindowParam _window;
  private final List<String> _extraMetrics;

  public DetectionJob(List<KpiParam> kpis, WindowParam window, List<String> extraMetrics) {
    _kpis = List.copyOf(kpis);
    _window = window;
    _extraMetrics = List.copyOf(extraMetrics);
  }

  public List<KpiParam> kpis() {
    return _kpis;
  }

  public WindowParam window() {
    return _window;
  }

  public List<String> extraMetrics() {
    return _extraMetrics;
  }

  /**
   * @return The detector configs set by the job.
   */
  public Map<String, Object> config() {
    return Collections.singletonMap(SpotDetectorConfig.EXTRA_METRICS_CONFIG, String.join(",", _extraMetrics));
  }

  @Override
  public String toString() {
    return String.format("DetectionJob{kpis=%s, window=%s, extraMetrics=%s}", _kpis, _window, _extraMetrics);
  }
}
