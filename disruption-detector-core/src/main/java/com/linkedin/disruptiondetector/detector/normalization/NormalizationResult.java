/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.disruptiondetector.detector.normalization;

/**
 * The transformed values of a window together with the parameters used to transform them.
 */
public final class NormalizationResult {
  private final double[] _values;
  private final double _mean;
  private final double _std;
  private final double _lowerBound;
  private final double _upperBound;

  NormalizationResult(double[] values, double mean, double std, double lowerBound, double upperBound) {
    _values = values;
    _mean = mean;
    _std = std;
    _lowerBound = lowerBound;
    _upperBound = upperBound;
  }

  public double[] values() {
    return _values.clone();
  }

  public double mean() {
    return _mean;
  }

  /**
   * @return Population standard deviation of the input window.
   */
  public double std() {
    return _std;
  }

  public double lowerBound() {
    return _lowerBound;
  }

  public double upperBound() {
    return _upperBound;
  }

  @Override
  public String toString() {
    return String.format("NormalizationResult{mean=%.3f, std=%.3f, band=[%.3f, %.3f]}", _mean, _std, _lowerBound, _upperBound);
  }
}
