/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.linkedin.disruptiondetector.common.utils.Utils.validateNotNull;


/**
 * A container whose observation window breached the extreme threshold often enough to be reported.
 */
public final class AnomalyModel {
  public static final String CONTAINER_ENTITY = "container";
  public static final String EVENT_SOURCE = "event_source";
  public static final String INFO = "info";
  public static final String MACHINE_ID = "machine_id";
  public static final String METRIC = "metric";
  public static final String LABELS = "labels";
  public static final String SCORE = "score";
  public static final String ENTITY_NAME = "entity_name";
  public static final String DETAILS = "details";
  public static final String ROOT_CAUSES = "root_causes";
  private final String _machineId;
  private final String _metric;
  private final Map<String, String> _labels;
  private final double _score;
  private final String _entityName;
  private final Map<String, Object> _details;
  private final List<RootCauseModel> _rootCauses;

  public AnomalyModel(String machineId, String metric, Map<String, String> labels, double score, String eventSource,
                      Map<String, Object> info) {
    this(machineId, metric, labels, score, CONTAINER_ENTITY, details(eventSource, info), Collections.emptyList());
  }

  /**
   * @param machineId Machine of the container.
   * @param metric Metric that breached.
   * @param labels Labels of the series that breached.
   * @param score Fraction of the observation window that breached, in [0, 1].
   * @param entityName Kind of the entity.
   * @param details Details, with the {@link #EVENT_SOURCE} and the extra {@link #INFO}.
   * @param rootCauses Root causes ordered by descending score.
   */
  public AnomalyModel(String machineId,
                      String metric,
                      Map<String, String> labels,
                      double score,
                      String entityName,
                      Map<String, Object> details,
                      List<RootCauseModel> rootCauses) {
    _machineId = validateNotNull(machineId, "Machine id cannot be null.");
    _metric = validateNotNull(metric, "Metric cannot be null.");
    if (score < 0.0 || score > 1.0) {
      throw new IllegalArgumentException("Score must be in [0, 1], but it was " + score);
    }
    _labels = labels == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(labels));
    _score = score;
    _entityName = entityName == null ? "" : entityName;
    _details = details == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    _rootCauses = rootCauses == null ? Collections.emptyList() : List.copyOf(rootCauses);
  }

  private static Map<String, Object> details(String eventSource, Map<String, Object> info) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put(EVENT_SOURCE, eventSource);
    details.put(INFO, info == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(info)));
    return details;
  }

  /**
   * @param rootCauses Root causes ordered by descending score.
   * @return A copy of this anomaly with the given root causes.
   */
  public AnomalyModel withRootCauses(List<RootCauseModel> rootCauses) {
    return new AnomalyModel(_machineId, _metric, _labels, _score, _entityName, _details, rootCauses);
  }

  public String machineId() {
    return _machineId;
  }

  public String metric() {
    return _metric;
  }

  public Map<String, String> labels() {
    return _labels;
  }

  public double score() {
    return _score;
  }

  public String entityName() {
    return _entityName;
  }

  public Map<String, Object> details() {
    return _details;
  }

  /**
   * @return The extra info of the details, or an empty map if there is none.
   */
  @SuppressWarnings("unchecked")
  public Map<String, Object> info() {
    Object info = _details.get(INFO);
    return info instanceof Map ? (Map<String, Object>) info : Collections.emptyMap();
  }

  public List<RootCauseModel> rootCauses() {
    return _rootCauses;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put(MACHINE_ID, _machineId);
    json.put(METRIC, _metric);
    json.put(LABELS, _labels);
    json.put(SCORE, _score);
    json.put(ENTITY_NAME, _entityName);
    json.put(DETAILS, _details);
    List<Map<String, Object>> rootCauses = new ArrayList<>(_rootCauses.size());
    _rootCauses.forEach(rootCause -> rootCauses.add(rootCause.getJsonStructure()));
    json.put(ROOT_CAUSES, rootCauses);
    return json;
  }

  @Override
  public String toString() {
    return String.format("AnomalyModel{machineId=%s, metric=%s, labels=%s, score=%.3f, rootCauses=%s}", _machineId, _metric,
                         _labels, _score, _rootCauses);
  }
}
