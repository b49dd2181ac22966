/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.disruptiondetector.detector;

import java.util.Arrays;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;


/**
 * Statistics shared by the disruption detectors: data validity gate, trend, min-max scaling and correlation.
 */
public final class TimeSeriesStatsUtils {
  /**
   * A series shorter than this ratio of the expected number of points is considered as incompletely collected.
   */
  public static final double DEFAULT_MIN_LENGTH_RATIO = 0.6;
  // Same absolute tolerance as numpy.allclose against zero.
  public static final double ZERO_TOLERANCE = 1e-8;

  private TimeSeriesStatsUtils() {

  }

  /**
   * Check whether the given values are usable for scoring. A series is rejected if it is shorter than
   * {@code minLengthRatio * expectedPointLength}, if all its values are (close to) zero or if it is constant.
   *
   * @param values Values of the series.
   * @param expectedPointLength Number of points the metric backend is expected to return for the window.
   * @param minLengthRatio Minimum ratio of the expected length.
   * @return {@code true} if the data is valid for scoring, {@code false} otherwise.
   */
  public static boolean isDataValid(double[] values, int expectedPointLength, double minLengthRatio) {
    if (values.length == 0 || values.length < expectedPointLength * minLengthRatio) {
      return false;
    }
    boolean allZero = true;
    boolean constant = true;
    for (double value : values) {
      allZero &= Math.abs(value) <= ZERO_TOLERANCE;
      constant &= value == values[0];
    }
    return !allZero && !constant;
  }

  /**
   * Relative change of the mean of the last {@code obsSize} values against the mean of the values before them.
   *
   * @param values Values of the series.
   * @param obsSize Size of the observation window at the tail of the series.
   * @return The trend rounded to 3 decimals, or {@code 0.0} if there is no history or its mean is not positive.
   */
  public static double trend(double[] values, int obsSize) {
    if (obsSize <= 0 || values.length <= obsSize) {
      return 0.0;
    }
    int split = values.length - obsSize;
    double preMean = StatUtils.mean(values, 0, split);
    double checkMean = StatUtils.mean(values, split, obsSize);
    return preMean > 0 ? round3((checkMean - preMean) / preMean) : 0.0;
  }

  /**
   * Scale the values to [0, 1]. Constant values are returned unscaled.
   *
   * @param values Values to scale.
   * @return A new array with the scaled values.
   */
  public static double[] minMaxNormalize(double[] values) {
    double[] result = values.clone();
    if (values.length == 0) {
      return result;
    }
    double min = StatUtils.min(values);
    double max = StatUtils.max(values);
    if (max != min) {
      for (int i = 0; i < result.length; i++) {
        result[i] = (result[i] - min) / (max - min);
      }
    }
    return result;
  }

  /**
   * Absolute Pearson correlation of the two series after min-max scaling each of them. Series of different lengths
   * are aligned on their most recent common points.
   *
   * @param x First series.
   * @param y Second series.
   * @return The absolute correlation in [0, 1], or {@link Double#NaN} if it is undefined (fewer than two common
   * points, or a constant series).
   */
  public static double absoluteCorrelation(double[] x, double[] y) {
    int length = Math.min(x.length, y.length);
    if (length < 2) {
      return Double.NaN;
    }
    double[] xs = minMaxNormalize(Arrays.copyOfRange(x, x.length - length, x.length));
    double[] ys = minMaxNormalize(Arrays.copyOfRange(y, y.length - length, y.length));
    return Math.abs(new PearsonsCorrelation().correlation(xs, ys));
  }

  /**
   * @param value Value to round.
   * @return The value rounded to 3 decimals.
   */
  public static double round3(double value) {
    return Math.round(value * 1000.0) / 1000.0;
  }
}
