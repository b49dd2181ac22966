/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.disruptiondetector.detector.normalization;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;


/**
 * Conditions the observation window before it is scored by the extreme value model.
 *
 * The band of a window is {@code [mean - k * std, mean + k * std]}, where {@code k} is the configured clip sigma and
 * {@code std} the population standard deviation of the window. If clipping is requested, out-of-band values are
 * clamped to the band. Values are kept in raw units, because the model is calibrated on raw historical values.
 * A window without spread is returned unchanged.
 */
public class ClipNormalizer {
  public static final double DEFAULT_CLIP_SIGMA = 3.0;
  private final double _clipSigma;

  public ClipNormalizer() {
    this(DEFAULT_CLIP_SIGMA);
  }

  public ClipNormalizer(double clipSigma) {
    if (clipSigma <= 0.0 || Double.isNaN(clipSigma)) {
      throw new IllegalArgumentException("Clip sigma must be positive, but it was " + clipSigma);
    }
    _clipSigma = clipSigma;
  }

  /**
   * @param values Values of the window.
   * @param clip {@code true} to clamp out-of-band values to the band, {@code false} to only compute the band.
   * @return The transformed values and the transform parameters.
   */
  public NormalizationResult transform(double[] values, boolean clip) {
    double[] result = values.clone();
    if (values.length == 0) {
      return new NormalizationResult(result, 0.0, 0.0, 0.0, 0.0);
    }
    DescriptiveStatistics stats = new DescriptiveStatistics(values);
    double mean = stats.getMean();
    double std = Math.sqrt(stats.getPopulationVariance());
    if (std == 0.0) {
      return new NormalizationResult(result, mean, 0.0, mean, mean);
    }
    double lowerBound = mean - _clipSigma * std;
    double upperBound = mean + _clipSigma * std;
    if (clip) {
      for (int i = 0; i < result.length; i++) {
        result[i] = Math.min(upperBound, Math.max(lowerBound, result[i]));
      }
    }
    return new NormalizationResult(result, mean, std, lowerBound, upperBound);
  }

  public double clipSigma() {
    return _clipSigma;
  }
}
