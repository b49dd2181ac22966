/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.model;

import com.linkedin.disruptiondetector.common.config.ConfigException;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class KpiParamTest {

  @Test
  public void testParams() {
    Map<String, Object> params = new HashMap<>();
    params.put(KpiParam.OUTLIER_RATIO_THRESHOLD_PARAM, "0.25");
    params.put(KpiParam.LOOK_BACK_PARAM, 30.0);
    KpiParam kpi = new KpiParam("cpu", params);

    assertTrue(kpi.enabled());
    assertEquals(0.25, kpi.outlierRatioThreshold(0.1), 0.0);
    assertEquals(30, kpi.intParam(KpiParam.LOOK_BACK_PARAM, 20));
    assertEquals(6, kpi.intParam(KpiParam.OBS_SIZE_PARAM, 6));
    assertEquals(0.1, new KpiParam("cpu").outlierRatioThreshold(0.1), 0.0);
  }

  @Test
  public void testInvalidParams() {
    KpiParam kpi = new KpiParam("cpu", Collections.singletonMap(KpiParam.OUTLIER_RATIO_THRESHOLD_PARAM, "high"));
    assertThrows(ConfigException.class, () -> kpi.outlierRatioThreshold(0.1));
    assertThrows(IllegalArgumentException.class, () -> new KpiParam(""));
  }

  @Test
  public void testWindows() {
    assertThrows(IllegalArgumentException.class, () -> new WindowParam(0, 5));
    assertThrows(IllegalArgumentException.class, () -> new WindowParam(20, -1));

    Instant end = Instant.parse("2026-10-19T08:00:00Z");
    WindowContext window = WindowContext.lookingBack(end, 20);
    assertEquals(Instant.parse("2026-10-19T07:40:00Z"), window.start());
    assertEquals(end, window.end());
    assertEquals(window, WindowContext.lookingBack(end, 20));
    assertEquals("[2026-10-19T07:40:00Z, 2026-10-19T08:00:00Z)", window.toString());
  }
}
