/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.model;

import com.google.gson.Gson;
import com.linkedin.disruptiondetector.model.TimeSeries;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class AnomalyModelTest {
  private static final Map<String, String> LABELS = Collections.singletonMap(TimeSeries.CONTAINER_NAME_LABEL, "web");

  @Test
  public void testScoreRange() {
    assertThrows(IllegalArgumentException.class, () -> new AnomalyModel("m1", "cpu", LABELS, 1.2, "spot", null));
    assertThrows(IllegalArgumentException.class, () -> new AnomalyModel("m1", "cpu", LABELS, -0.1, "spot", null));
  }

  @Test
  public void testWithRootCauses() {
    AnomalyModel anomaly = new AnomalyModel("m1", "cpu", LABELS, 0.5, "spot", Collections.singletonMap("container_name", "web"));
    AnomalyModel withRootCauses = anomaly.withRootCauses(Collections.singletonList(new RootCauseModel("cpu", LABELS, 0.8)));

    assertTrue(anomaly.rootCauses().isEmpty());
    assertEquals(1, withRootCauses.rootCauses().size());
    assertEquals(anomaly.details(), withRootCauses.details());
    assertEquals("web", withRootCauses.info().get("container_name"));
  }

  @Test
  @SuppressWarnings("unchecked")
  public void testJsonStructure() {
    AnomalyModel anomaly = new AnomalyModel("m1", "cpu", LABELS, 0.5, "spot", Collections.emptyMap())
        .withRootCauses(Collections.singletonList(new RootCauseModel("mem", LABELS, 0.8)));
    Map<String, Object> json = new Gson().fromJson(new Gson().toJson(anomaly.getJsonStructure()), Map.class);

    assertEquals("m1", json.get(AnomalyModel.MACHINE_ID));
    assertEquals(AnomalyModel.CONTAINER_ENTITY, json.get(AnomalyModel.ENTITY_NAME));
    assertEquals(0.5, (Double) json.get(AnomalyModel.SCORE), 0.0);
    assertEquals("spot", ((Map<String, Object>) json.get(AnomalyModel.DETAILS)).get(AnomalyModel.EVENT_SOURCE));
    List<Map<String, Object>> rootCauses = (List<Map<String, Object>>) json.get(AnomalyModel.ROOT_CAUSES);
    assertEquals("mem", rootCauses.get(0).get(RootCauseModel.METRIC));
    assertEquals("mem(0.8)", anomaly.rootCauses().get(0).toString());
  }
}
