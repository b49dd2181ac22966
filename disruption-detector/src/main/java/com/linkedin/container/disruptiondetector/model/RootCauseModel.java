/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;


/**
 * A co-located series offered as an explanation of a disruption, scored by the absolute correlation of its values with
 * the values of the victim.
 */
public final class RootCauseModel {
  public static final String METRIC = "metric";
  public static final String LABELS = "labels";
  public static final String SCORE = "score";
  private final String _metric;
  private final Map<String, String> _labels;
  private final double _score;

  public RootCauseModel(String metric, Map<String, String> labels, double score) {
    _metric = metric;
    _labels = labels == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(labels));
    _score = score;
  }

  public String metric() {
    return _metric;
  }

  public Map<String, String> labels() {
    return _labels;
  }

  /**
   * @return Absolute correlation with the victim in [0, 1], rounded to 3 decimals.
   */
  public double score() {
    return _score;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put(METRIC, _metric);
    json.put(LABELS, _labels);
    json.put(SCORE, _score);
    return json;
  }

  @Override
  public String toString() {
    return String.format("%s(%s)", _metric, _score);
  }
}
