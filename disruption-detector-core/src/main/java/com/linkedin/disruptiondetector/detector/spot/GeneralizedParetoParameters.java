/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.disruptiondetector.detector.spot;

/**
 * Shape and scale of a Generalized Pareto Distribution fitted to tail excesses, with the log-likelihood of the fit.
 */
public final class GeneralizedParetoParameters {
  private final double _shape;
  private final double _scale;
  private final double _logLikelihood;

  public GeneralizedParetoParameters(double shape, double scale, double logLikelihood) {
    _shape = shape;
    _scale = scale;
    _logLikelihood = logLikelihood;
  }

  /**
   * @return Shape parameter (gamma, also known as xi). Zero means an exponential tail.
   */
  public double shape() {
    return _shape;
  }

  /**
   * @return Scale parameter (sigma).
   */
  public double scale() {
    return _scale;
  }

  public double logLikelihood() {
    return _logLikelihood;
  }

  @Override
  public String toString() {
    return String.format("GPD{shape=%.6f, scale=%.6f, logLikelihood=%.6f}", _shape, _scale, _logLikelihood);
  }
}
