/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.model;

import com.linkedin.disruptiondetector.common.config.ConfigException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static com.linkedin.disruptiondetector.DisruptionDetectorUtils.ensureValidString;


/**
 * A key performance indicator to scan: a metric name and its detection parameters.
 */
public final class KpiParam {
  public static final String OUTLIER_RATIO_THRESHOLD_PARAM = "outlier_ratio_th";
  public static final String LOOK_BACK_PARAM = "look_back";
  public static final String OBS_SIZE_PARAM = "obs_size";
  private final String _metric;
  private final String _entityName;
  private final boolean _enabled;
  private final Map<String, Object> _params;

  public KpiParam(String metric) {
    this(metric, "", true, Collections.emptyMap());
  }

  public KpiParam(String metric, Map<String, ?> params) {
    this(metric, "", true, params);
  }

  /**
   * @param metric Metric name.
   * @param entityName Name of the entity the metric describes, e.g. {@code sli_container}.
   * @param enabled {@code true} if the KPI is scanned.
   * @param params Detection parameters, e.g. {@link #OUTLIER_RATIO_THRESHOLD_PARAM}.
   */
  public KpiParam(String metric, String entityName, boolean enabled, Map<String, ?> params) {
    ensureValidString("metric", metric);
    _metric = metric;
    _entityName = entityName == null ? "" : entityName;
    _enabled = enabled;
    _params = params == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(params));
  }

  public String metric() {
    return _metric;
  }

  public String entityName() {
    return _entityName;
  }

  public boolean enabled() {
    return _enabled;
  }

  public Map<String, Object> params() {
    return _params;
  }

  /**
   * @param defaultThreshold Threshold to use if {@link #OUTLIER_RATIO_THRESHOLD_PARAM} is not set.
   * @return The minimum fraction of the observation window that must breach the extreme threshold.
   */
  public double outlierRatioThreshold(double defaultThreshold) {
    Object value = _params.get(OUTLIER_RATIO_THRESHOLD_PARAM);
    return value == null ? defaultThreshold : doubleParam(OUTLIER_RATIO_THRESHOLD_PARAM, value);
  }

  /**
   * @param name Parameter name.
   * @param defaultValue Value to use if the parameter is not set.
   * @return The parameter as an int.
   */
  public int intParam(String name, int defaultValue) {
    Object value = _params.get(name);
    return value == null ? defaultValue : (int) doubleParam(name, value);
  }

  private double doubleParam(String name, Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new ConfigException(name, value, "Parameter of KPI " + _metric + " is not a number.");
    }
  }

  @Override
  public String toString() {
    return String.format("KpiParam{metric=%s, entityName=%s, enabled=%s, params=%s}", _metric, _entityName, _enabled, _params);
  }
}
