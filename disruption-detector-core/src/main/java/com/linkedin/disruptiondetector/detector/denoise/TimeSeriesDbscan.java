/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.disruptiondetector.detector.denoise;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Labels the points of a series as either consistent with the bulk of its distribution or as noise, so that the
 * extreme value model is calibrated on clean history only. It does not decide anomalies itself.
 *
 * The values are clustered as one-dimensional points with DBSCAN:
 * <ul>
 *   <li>The neighborhood radius is derived from the robust spread (scaled median absolute deviation) of the history,
 *   i.e. the series without its last {@code obsSize} points, with a floor relative to the median.</li>
 *   <li>The minimum number of neighbors of a core point is larger than {@code obsSize}, so the observation window
 *   cannot form a dense cluster on its own.</li>
 * </ul>
 * Points of any cluster are labeled {@link #NORMAL}, the others {@link #NOISE}. The look back window only describes
 * the series in logs, the labels depend on the values and {@code obsSize} alone.
 */
public class TimeSeriesDbscan {
  private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesDbscan.class);
  public static final int NORMAL = 0;
  public static final int NOISE = -1;
  public static final double DEFAULT_EPS_MULTIPLIER = 1.0;
  static final int MIN_NEIGHBORS = 3;
  // Scale factor from median absolute deviation to standard deviation for normally distributed data.
  static final double MAD_TO_SIGMA = 1.4826;
  static final double RELATIVE_EPS_FLOOR = 1e-3;
  private final int _lookBack;
  private final int _obsSize;
  private final double _epsMultiplier;

  public TimeSeriesDbscan(int lookBack, int obsSize) {
    this(lookBack, obsSize, DEFAULT_EPS_MULTIPLIER);
  }

  /**
   * @param lookBack Look back window of the series in minutes, reported in logs but not used for clustering.
   * @param obsSize Number of most recent points that will be scored.
   * @param epsMultiplier Multiplier of the robust spread used as the neighborhood radius.
   */
  public TimeSeriesDbscan(int lookBack, int obsSize, double epsMultiplier) {
    if (lookBack <= 0 || obsSize <= 0) {
      throw new IllegalArgumentException(String.format("Look back (%d) and observation size (%d) must be positive.",
                                                       lookBack, obsSize));
    }
    if (epsMultiplier <= 0.0 || Double.isNaN(epsMultiplier)) {
      throw new IllegalArgumentException("Eps multiplier must be positive, but it was " + epsMultiplier);
    }
    _lookBack = lookBack;
    _obsSize = obsSize;
    _epsMultiplier = epsMultiplier;
  }

  /**
   * @param values Values of the series.
   * @return Labels of the same length, {@link #NORMAL} for clustered points and {@link #NOISE} for the others.
   */
  public int[] detect(double[] values) {
    int[] labels = new int[values.length];
    int minNeighbors = minNeighbors(values.length);
    if (values.length <= minNeighbors) {
      // Too few points to tell density apart.
      return labels;
    }

    double eps = eps(values);
    List<IndexedValue> points = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      points.add(new IndexedValue(i, values[i]));
    }
    List<Cluster<IndexedValue>> clusters = new DBSCANClusterer<IndexedValue>(eps, minNeighbors).cluster(points);

    Arrays.fill(labels, NOISE);
    for (Cluster<IndexedValue> cluster : clusters) {
      for (IndexedValue point : cluster.getPoints()) {
        labels[point._index] = NORMAL;
      }
    }
    if (LOG.isTraceEnabled()) {
      LOG.trace("Clustered {} points of a {} minute window into {} clusters with eps {} and min neighbors {}, {} noise points.",
                values.length, _lookBack, clusters.size(), eps, minNeighbors, Arrays.stream(labels).filter(l -> l != NORMAL).count());
    }
    return labels;
  }

  int minNeighbors(int numPoints) {
    int minNeighbors = Math.max(MIN_NEIGHBORS, _obsSize + 1);
    return Math.min(minNeighbors, Math.max(2, numPoints / 2));
  }

  double eps(double[] values) {
    double[] history = values.length > _obsSize ? Arrays.copyOfRange(values, 0, values.length - _obsSize) : values;
    Percentile percentile = new Percentile();
    double median = percentile.evaluate(history, 50.0);
    double[] deviations = new double[history.length];
    for (int i = 0; i < history.length; i++) {
      deviations[i] = Math.abs(history[i] - median);
    }
    double robustSigma = MAD_TO_SIGMA * percentile.evaluate(deviations, 50.0);
    return Math.max(_epsMultiplier * robustSigma, RELATIVE_EPS_FLOOR * Math.max(1.0, Math.abs(median)));
  }

  public int lookBack() {
    return _lookBack;
  }

  public int obsSize() {
    return _obsSize;
  }

  /**
   * A one-dimensional point that keeps its position in the series. Equality is identity, so that repeated values
   * remain distinct points for the clusterer.
   */
  private static final class IndexedValue implements Clusterable {
    private final int _index;
    private final double[] _point;

    IndexedValue(int index, double value) {
      _index = index;
      _point = new double[] {value};
    }

    @Override
    public double[] getPoint() {
      return _point;
    }
  }
}
