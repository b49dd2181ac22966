/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.disruptiondetector.detector.spot;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class SpotThresholdModelTest {

  @Test
  public void testLevelAdjustment() {
    assertEquals(0.899999, SpotThresholdModel.adjustLevel(20, 0.98), 1e-12);
    assertEquals("Long enough samples keep the requested level", 0.98, SpotThresholdModel.adjustLevel(100, 0.98), 0.0);
    for (int n = 2; n < 50; n++) {
      double level = SpotThresholdModel.adjustLevel(n, 0.98);
      assertTrue("At least two calibration peaks for n=" + n, Math.floor(n * (1 - level)) >= 2);
    }
  }

  @Test
  public void testShortSampleUsesAdjustedLevel() {
    SpotThresholdModel model = new SpotThresholdModel();
    model.initialize(ramp(20), SpotThresholdModel.DEFAULT_LEVEL);
    assertEquals(0.899999, model.level(), 1e-12);
    assertEquals(17.0, model.initThreshold(), 0.0);
    assertEquals(2, model.numPeaks());
  }

  @Test
  public void testFlatCalibration() {
    double[] train = new double[59];
    Arrays.fill(train, 10.0);
    SpotThresholdModel model = new SpotThresholdModel();
    model.initialize(train, SpotThresholdModel.DEFAULT_LEVEL);
    assertEquals(10.0, model.initThreshold(), 0.0);
    assertEquals(0, model.numPeaks());
    assertNull(model.tail());
    assertEquals("Without peaks the extreme threshold is the initial threshold", 10.0, model.extremeThreshold(), 0.0);

    SpotResult result = model.run(new double[] {10, 10, 10, 10, 50}, true);
    assertEquals(Collections.singletonList(4), result.alarms());
    assertArrayEquals(new double[] {10, 10, 10, 10, 10}, result.thresholds(), 0.0);
  }

  @Test
  public void testExponentialExtremeThreshold() {
    SpotThresholdModel model = new SpotThresholdModel();
    model.initialize(ramp(100), SpotThresholdModel.DEFAULT_LEVEL);
    assertEquals(98.0, model.initThreshold(), 0.0);
    assertEquals(1, model.numPeaks());
    // A single peak of 1 gives an exponential tail of scale 1, zq = t1 - ln(q * n / Nt).
    assertEquals(98.0 + Math.log(10.0), model.extremeThreshold(), 1e-9);
  }

  @Test
  public void testAlarmDoesNotUpdateModel() {
    SpotThresholdModel model = new SpotThresholdModel();
    model.initialize(ramp(100), SpotThresholdModel.DEFAULT_LEVEL);
    double zq = model.extremeThreshold();

    SpotResult result = model.run(new double[] {1000, 50, 99.5}, true);
    double[] thresholds = result.thresholds();
    assertEquals(Collections.singletonList(0), result.alarms());
    assertEquals(zq, thresholds[0], 0.0);
    assertEquals("An alarmed point must not move the threshold", thresholds[0], thresholds[1], 0.0);
    assertEquals(thresholds[1], thresholds[2], 0.0);
    assertEquals(98.0, model.initThreshold(), 0.0);
    assertEquals("Only the point between t1 and zq is a new peak", 2, model.numPeaks());
    assertEquals(102, model.numObservations());
  }

  @Test
  public void testAlarmsMatchThresholds() {
    SpotThresholdModel model = new SpotThresholdModel(1e-2);
    model.initialize(ramp(200), 0.9);
    double[] test = {50, 185, 199, 250, 190, 120, 500, 195, 205, 199.5};
    SpotResult result = model.run(test, true);
    double[] thresholds = result.thresholds();
    assertEquals(test.length, thresholds.length);
    for (int i = 0; i < test.length; i++) {
      assertEquals("Point " + i, test[i] > thresholds[i], result.alarms().contains(i));
    }
    assertTrue(result.alarms().contains(6));
  }

  @Test
  public void testRunWithoutAlarm() {
    SpotThresholdModel model = new SpotThresholdModel();
    model.initialize(ramp(100), SpotThresholdModel.DEFAULT_LEVEL);
    SpotResult result = model.run(new double[] {1000}, false);
    assertEquals(0, result.numAlarms());
    assertEquals("Extreme points become peaks when alarms are off", 2, model.numPeaks());
  }

  @Test
  public void testInvalidUsage() {
    assertThrows(IllegalArgumentException.class, () -> new SpotThresholdModel(0.0));
    SpotThresholdModel model = new SpotThresholdModel();
    assertThrows(IllegalStateException.class, () -> model.run(new double[] {1.0}, true));
    assertThrows(IllegalArgumentException.class, () -> model.initialize(new double[] {1.0}, 0.98));
    assertThrows(IllegalArgumentException.class, () -> model.initialize(ramp(10), 1.0));
  }

  private static double[] ramp(int length) {
    double[] values = new double[length];
    for (int i = 0; i < length; i++) {
      values[i] = i;
    }
    return values;
  }
}
