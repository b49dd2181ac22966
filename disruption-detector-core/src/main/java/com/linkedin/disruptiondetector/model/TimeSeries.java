/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.disruptiondetector.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static com.linkedin.disruptiondetector.common.utils.Utils.validateNotNull;


/**
 * The values of one metric for one entity (e.g. a container on a machine) over one query window, ordered by time
 * ascending. Instances are read-only: the arrays are copied on the way in and on the way out.
 */
public final class TimeSeries {
  public static final String MACHINE_ID_LABEL = "machine_id";
  public static final String CONTAINER_NAME_LABEL = "container_name";
  private final String _metric;
  private final Map<String, String> _labels;
  private final long[] _timestamps;
  private final double[] _values;

  public TimeSeries(String metric, Map<String, String> labels, double[] values) {
    this(metric, labels, new long[0], values);
  }

  /**
   * @param metric Metric name.
   * @param labels Labels identifying the entity, e.g. {@link #MACHINE_ID_LABEL} and {@link #CONTAINER_NAME_LABEL}.
   * @param timestamps Sample timestamps in seconds, either empty or as long as {@code values}.
   * @param values Sample values.
   */
  public TimeSeries(String metric, Map<String, String> labels, long[] timestamps, double[] values) {
    _metric = validateNotNull(metric, "Metric name cannot be null.");
    validateNotNull(values, () -> "Values of metric " + metric + " cannot be null.");
    if (timestamps != null && timestamps.length != 0 && timestamps.length != values.length) {
      throw new IllegalArgumentException(String.format("Metric %s has %d timestamps but %d values.", metric,
                                                       timestamps.length, values.length));
    }
    _labels = labels == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(labels));
    _timestamps = timestamps == null ? new long[0] : timestamps.clone();
    _values = values.clone();
  }

  public String metric() {
    return _metric;
  }

  public Map<String, String> labels() {
    return _labels;
  }

  /**
   * @param name Label name.
   * @return The label value, or an empty string if the label is absent.
   */
  public String label(String name) {
    return _labels.getOrDefault(name, "");
  }

  public long[] timestamps() {
    return _timestamps.clone();
  }

  public double[] values() {
    return _values.clone();
  }

  public int length() {
    return _values.length;
  }

  @Override
  public String toString() {
    return String.format("TimeSeries{metric=%s, labels=%s, length=%d, values=%s}", _metric, _labels, _values.length,
                         Arrays.toString(_values));
  }
}
