/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.disruptiondetector.detector.spot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Streaming Peaks-Over-Threshold detector (SPOT, Siffer et al., KDD 2017).
 *
 * <ol>
 *   <li>{@link #initialize(double[], double)} takes the {@code level}-quantile of a clean calibration sample as the
 *   initial threshold {@code t1}, fits a Generalized Pareto Distribution to the excesses over {@code t1}, and derives
 *   the extreme threshold {@code zq} that a point exceeds with probability {@code q}.</li>
 *   <li>{@link #run(double[], boolean)} evaluates the test points in order. Points above {@code zq} are alarms and do
 *   not touch the model. Points between {@code t1} and {@code zq} are new peaks, so the tail is refitted and
 *   {@code zq} recomputed. Other points only increase the number of observations.</li>
 * </ol>
 *
 * An instance holds the calibration state of a single scoring call and is not thread-safe.
 */
public class SpotThresholdModel {
  private static final Logger LOG = LoggerFactory.getLogger(SpotThresholdModel.class);
  public static final double DEFAULT_Q = 1e-3;
  public static final double DEFAULT_LEVEL = 0.98;
  static final double LEVEL_ADJUSTMENT_EPSILON = 1e-6;
  static final double ZERO_SHAPE_TOLERANCE = 1e-10;
  private final double _q;
  private final GeneralizedParetoEstimator _estimator;
  private final List<Double> _peaks;
  private double _level;
  private double _initThreshold;
  private double _extremeThreshold;
  private int _numObservations;
  private GeneralizedParetoParameters _tail;
  private boolean _initialized;

  public SpotThresholdModel() {
    this(DEFAULT_Q);
  }

  /**
   * @param q Risk parameter, i.e. the probability of a normal point to exceed the extreme threshold.
   */
  public SpotThresholdModel(double q) {
    if (!(q > 0.0 && q < 1.0)) {
      throw new IllegalArgumentException("Risk parameter q must be in (0, 1), but it was " + q);
    }
    _q = q;
    _estimator = new GeneralizedParetoEstimator();
    _peaks = new ArrayList<>();
  }

  /**
   * Calibrate the model. Any previous calibration is discarded.
   *
   * @param trainData Clean calibration sample, at least two points.
   * @param level Quantile of the calibration sample used as the initial threshold, in (0, 1).
   */
  public void initialize(double[] trainData, double level) {
    if (trainData == null || trainData.length < 2) {
      throw new IllegalArgumentException("Calibration requires at least 2 points.");
    }
    if (!(level > 0.0 && level < 1.0)) {
      throw new IllegalArgumentException("Calibration level must be in (0, 1), but it was " + level);
    }
    int n = trainData.length;
    _level = adjustLevel(n, level);
    double[] sorted = trainData.clone();
    Arrays.sort(sorted);
    int index = Math.max(0, Math.min(n - 1, (int) Math.floor(_level * n)));
    _initThreshold = sorted[index];

    _peaks.clear();
    for (double value : trainData) {
      if (value > _initThreshold) {
        _peaks.add(value - _initThreshold);
      }
    }
    _numObservations = n;
    _initialized = true;
    fitTail();
    LOG.debug("Calibrated on {} points at level {}: t1={}, {} peaks, {}, zq={}.", n, _level, _initThreshold,
              _peaks.size(), _tail, _extremeThreshold);
  }

  /**
   * Evaluate the test points in order, updating the model with the non-alarmed ones.
   *
   * @param testData Points to evaluate.
   * @param withAlarm {@code true} to raise alarms on points above the extreme threshold and keep them out of the
   *                  model, {@code false} to treat them as ordinary peaks.
   * @return The thresholds in effect for each point and the alarmed indices.
   */
  public SpotResult run(double[] testData, boolean withAlarm) {
    if (!_initialized) {
      throw new IllegalStateException("The model must be initialized before it runs.");
    }
    double[] thresholds = new double[testData.length];
    List<Integer> alarms = new ArrayList<>();
    for (int i = 0; i < testData.length; i++) {
      double value = testData[i];
      thresholds[i] = _extremeThreshold;
      if (withAlarm && value > _extremeThreshold) {
        alarms.add(i);
      } else if (value > _initThreshold) {
        _peaks.add(value - _initThreshold);
        _numObservations++;
        fitTail();
      } else {
        _numObservations++;
      }
    }
    return new SpotResult(thresholds, alarms);
  }

  /**
   * Lower the calibration level of a short sample so that at least two calibration points exceed the quantile.
   *
   * @param numSamples Size of the calibration sample.
   * @param level Requested level.
   * @return The level to calibrate with.
   */
  public static double adjustLevel(int numSamples, double level) {
    if (Math.floor(numSamples * (1 - level)) == 0) {
      return 1 - 2.0 / numSamples - LEVEL_ADJUSTMENT_EPSILON;
    }
    return level;
  }

  private void fitTail() {
    if (_peaks.isEmpty()) {
      // Flat calibration sample: nothing above t1 has been seen, any point above it is extreme.
      _tail = null;
      _extremeThreshold = _initThreshold;
      return;
    }
    double[] peaks = new double[_peaks.size()];
    for (int i = 0; i < peaks.length; i++) {
      peaks[i] = _peaks.get(i);
    }
    _tail = _estimator.fit(peaks);
    _extremeThreshold = quantile(_tail.shape(), _tail.scale());
  }

  private double quantile(double shape, double scale) {
    double r = _q * _numObservations / _peaks.size();
    if (Math.abs(shape) < ZERO_SHAPE_TOLERANCE) {
      return _initThreshold - scale * Math.log(r);
    }
    return _initThreshold + (scale / shape) * (Math.pow(r, -shape) - 1);
  }

  public double q() {
    return _q;
  }

  /**
   * @return The calibration level actually used, after the adjustment for short samples.
   */
  public double level() {
    return _level;
  }

  /**
   * @return The initial threshold t1.
   */
  public double initThreshold() {
    return _initThreshold;
  }

  /**
   * @return The current extreme threshold zq.
   */
  public double extremeThreshold() {
    return _extremeThreshold;
  }

  public int numPeaks() {
    return _peaks.size();
  }

  public int numObservations() {
    return _numObservations;
  }

  /**
   * @return The fitted tail, or {@code null} if there are no peaks.
   */
  public GeneralizedParetoParameters tail() {
    return _tail;
  }
}
