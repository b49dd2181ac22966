/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.disruptiondetector.detector.spot;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.analysis.solvers.UnivariateSolver;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Maximum likelihood estimation of the Generalized Pareto Distribution parameters with Grimshaw's reduction.
 *
 * Grimshaw shows that the likelihood equations reduce to a single equation {@code u(t) * v(t) = 1} in
 * {@code t = gamma / sigma}, where {@code u(t) = 1 + mean(log(1 + t * Y))} and {@code v(t) = mean(1 / (1 + t * Y))}.
 * Non-trivial roots lie in {@code (-1 / max(Y), 0)} or in {@code (0, 2 (mean - min) / min^2)}. The negative interval
 * is scanned on a regular grid and the positive one on a geometric grid, as it spans orders of magnitude. Each sign
 * change is refined with a Brent solver and the candidate with the highest log-likelihood wins. The exponential tail
 * ({@code gamma = 0, sigma = mean(Y)}) is always a candidate.
 */
public class GeneralizedParetoEstimator {
  private static final Logger LOG = LoggerFactory.getLogger(GeneralizedParetoEstimator.class);
  static final double DEFAULT_EPSILON = 1e-8;
  static final int NUM_GRID_POINTS = 50;
  static final double MIN_POSITIVE_SHAPE = 1e-4;
  static final int MAX_SOLVER_EVALUATIONS = 200;
  private final UnivariateSolver _solver;

  public GeneralizedParetoEstimator() {
    _solver = new BrentSolver(1e-12);
  }

  /**
   * @param peaks Strictly positive excesses over the tail threshold.
   * @return Fitted parameters.
   */
  public GeneralizedParetoParameters fit(double[] peaks) {
    if (peaks.length == 0) {
      throw new IllegalArgumentException("Cannot fit a tail distribution without peaks.");
    }
    double mean = StatUtils.mean(peaks);
    double min = StatUtils.min(peaks);
    double max = StatUtils.max(peaks);
    GeneralizedParetoParameters best = new GeneralizedParetoParameters(0.0, mean, logLikelihood(peaks, 0.0, mean));
    if (peaks.length < 2 || min == max) {
      return best;
    }

    double epsilon = DEFAULT_EPSILON;
    double a = -1.0 / max;
    if (Math.abs(a) < 2 * epsilon) {
      epsilon = Math.abs(a) / NUM_GRID_POINTS;
    }
    a += epsilon;
    // Smallest positive t scanned, i.e. a shape of about MIN_POSITIVE_SHAPE.
    double b = MIN_POSITIVE_SHAPE / mean;
    double c = 2 * (mean - min) / (min * min);

    UnivariateFunction w = t -> grimshaw(peaks, t);
    List<Double> roots = findRoots(w, linearGrid(a + epsilon, -epsilon));
    roots.addAll(findRoots(w, geometricGrid(b, c)));

    for (double root : roots) {
      double shape = meanLog1p(peaks, root);
      double scale = shape / root;
      double logLikelihood = logLikelihood(peaks, shape, scale);
      if (logLikelihood > best.logLikelihood()) {
        best = new GeneralizedParetoParameters(shape, scale, logLikelihood);
      }
    }
    LOG.trace("Fitted {} over {} peaks from {} candidate roots.", best, peaks.length, roots.size());
    return best;
  }

  private List<Double> findRoots(UnivariateFunction f, double[] grid) {
    List<Double> roots = new ArrayList<>();
    if (grid.length < 2) {
      return roots;
    }
    double fLeft = f.value(grid[0]);
    for (int i = 1; i < grid.length; i++) {
      double left = grid[i - 1];
      double right = grid[i];
      double fRight = f.value(right);
      if (fLeft == 0.0) {
        roots.add(left);
      } else if (fLeft * fRight < 0.0) {
        try {
          roots.add(_solver.solve(MAX_SOLVER_EVALUATIONS, f, left, right));
        } catch (TooManyEvaluationsException e) {
          LOG.debug("No root refined in [{}, {}] within {} evaluations.", left, right, MAX_SOLVER_EVALUATIONS, e);
        }
      }
      fLeft = fRight;
    }
    return roots;
  }

  static double[] linearGrid(double lower, double upper) {
    if (!(upper > lower)) {
      return new double[0];
    }
    double[] grid = new double[NUM_GRID_POINTS + 1];
    double step = (upper - lower) / NUM_GRID_POINTS;
    for (int i = 0; i < NUM_GRID_POINTS; i++) {
      grid[i] = lower + i * step;
    }
    grid[NUM_GRID_POINTS] = upper;
    return grid;
  }

  static double[] geometricGrid(double lower, double upper) {
    if (!(upper > lower) || !(lower > 0.0)) {
      return new double[0];
    }
    double[] grid = new double[NUM_GRID_POINTS + 1];
    double ratio = Math.pow(upper / lower, 1.0 / NUM_GRID_POINTS);
    grid[0] = lower;
    for (int i = 1; i < NUM_GRID_POINTS; i++) {
      grid[i] = grid[i - 1] * ratio;
    }
    grid[NUM_GRID_POINTS] = upper;
    return grid;
  }

  private static double grimshaw(double[] peaks, double t) {
    double sumLog = 0.0;
    double sumInverse = 0.0;
    for (double peak : peaks) {
      double s = 1 + t * peak;
      sumLog += Math.log(s);
      sumInverse += 1 / s;
    }
    double u = 1 + sumLog / peaks.length;
    double v = sumInverse / peaks.length;
    return u * v - 1;
  }

  private static double meanLog1p(double[] peaks, double t) {
    double sum = 0.0;
    for (double peak : peaks) {
      sum += Math.log1p(t * peak);
    }
    return sum / peaks.length;
  }

  /**
   * @param peaks Excesses over the tail threshold.
   * @param shape Shape parameter.
   * @param scale Scale parameter.
   * @return The log-likelihood of the peaks, or negative infinity if the parameters are outside of the support.
   */
  static double logLikelihood(double[] peaks, double shape, double scale) {
    if (!(scale > 0.0)) {
      return Double.NEGATIVE_INFINITY;
    }
    int n = peaks.length;
    if (shape == 0.0) {
      return -n * Math.log(scale) - StatUtils.sum(peaks) / scale;
    }
    double tau = shape / scale;
    double sumLog = 0.0;
    for (double peak : peaks) {
      double s = 1 + tau * peak;
      if (s <= 0.0) {
        return Double.NEGATIVE_INFINITY;
      }
      sumLog += Math.log(s);
    }
    return -n * Math.log(scale) - (1 + 1 / shape) * sumLog;
  }
}
