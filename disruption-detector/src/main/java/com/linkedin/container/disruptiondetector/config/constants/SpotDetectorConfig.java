/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.config.constants;

import com.linkedin.disruptiondetector.common.config.ConfigDef;
import com.linkedin.disruptiondetector.detector.TimeSeriesStatsUtils;
import com.linkedin.disruptiondetector.detector.denoise.TimeSeriesDbscan;
import com.linkedin.disruptiondetector.detector.normalization.ClipNormalizer;
import com.linkedin.disruptiondetector.detector.spot.SpotThresholdModel;

import static com.linkedin.disruptiondetector.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.disruptiondetector.common.config.ConfigDef.Range.between;


/**
 * A class to keep the configs and defaults of the extreme value detection of container disruptions.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class SpotDetectorConfig {

  /**
   * <code>spot.q</code>
   */
  public static final String SPOT_Q_CONFIG = "spot.q";
  public static final double DEFAULT_SPOT_Q = SpotThresholdModel.DEFAULT_Q;
  public static final String SPOT_Q_DOC = "The risk parameter of the extreme value model, i.e. the probability for a "
      + "normal point to exceed the extreme threshold. Smaller values raise fewer alarms.";

  /**
   * <code>spot.level</code>
   */
  public static final String SPOT_LEVEL_CONFIG = "spot.level";
  public static final double DEFAULT_SPOT_LEVEL = SpotThresholdModel.DEFAULT_LEVEL;
  public static final String SPOT_LEVEL_DOC = "The quantile of the calibration sample used as the initial threshold of the "
      + "extreme value model. It is lowered automatically for short calibration samples.";

  /**
   * <code>spot.smooth.window</code>
   */
  public static final String SPOT_SMOOTH_WINDOW_CONFIG = "spot.smooth.window";
  public static final int DEFAULT_SPOT_SMOOTH_WINDOW = 3;
  public static final String SPOT_SMOOTH_WINDOW_DOC = "Reserved smoothing window of the scored series. It is accepted and "
      + "validated, but it does not change the detection.";

  /**
   * <code>outlier.ratio.threshold</code>
   */
  public static final String OUTLIER_RATIO_THRESHOLD_CONFIG = "outlier.ratio.threshold";
  public static final double DEFAULT_OUTLIER_RATIO_THRESHOLD = 0.1;
  public static final String OUTLIER_RATIO_THRESHOLD_DOC = "The minimum fraction of the observation window that must breach "
      + "the extreme threshold for a container to be reported, for KPIs that do not set outlier_ratio_th.";

  /**
   * <code>normalization.clip.sigma</code>
   */
  public static final String NORMALIZATION_CLIP_SIGMA_CONFIG = "normalization.clip.sigma";
  public static final double DEFAULT_NORMALIZATION_CLIP_SIGMA = ClipNormalizer.DEFAULT_CLIP_SIGMA;
  public static final String NORMALIZATION_CLIP_SIGMA_DOC = "The half width, in standard deviations around the mean, of the "
      + "band that the observation window may be clipped to.";

  /**
   * <code>denoise.eps.multiplier</code>
   */
  public static final String DENOISE_EPS_MULTIPLIER_CONFIG = "denoise.eps.multiplier";
  public static final double DEFAULT_DENOISE_EPS_MULTIPLIER = TimeSeriesDbscan.DEFAULT_EPS_MULTIPLIER;
  public static final String DENOISE_EPS_MULTIPLIER_DOC = "The multiplier of the robust standard deviation of the history "
      + "used as the neighborhood radius of the density based denoiser.";

  /**
   * <code>data.min.length.ratio</code>
   */
  public static final String DATA_MIN_LENGTH_RATIO_CONFIG = "data.min.length.ratio";
  public static final double DEFAULT_DATA_MIN_LENGTH_RATIO = TimeSeriesStatsUtils.DEFAULT_MIN_LENGTH_RATIO;
  public static final String DATA_MIN_LENGTH_RATIO_DOC = "The minimum ratio of the expected number of points a series must "
      + "have to be scored. Shorter series score 0.";

  /**
   * <code>extra.metrics</code>
   */
  public static final String EXTRA_METRICS_CONFIG = "extra.metrics";
  public static final String DEFAULT_EXTRA_METRICS = "";
  public static final String EXTRA_METRICS_DOC = "A comma separated list of auxiliary metrics whose trend over the observation "
      + "window is attached to every reported container.";

  private SpotDetectorConfig() {
  }

  /**
   * Define configs for the extreme value detection.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the extreme value detection.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(SPOT_Q_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_SPOT_Q,
                            between(Double.MIN_VALUE, 0.5),
                            ConfigDef.Importance.HIGH,
                            SPOT_Q_DOC)
                    .define(SPOT_LEVEL_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_SPOT_LEVEL,
                            between(0.5, 0.9999),
                            ConfigDef.Importance.HIGH,
                            SPOT_LEVEL_DOC)
                    .define(SPOT_SMOOTH_WINDOW_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_SPOT_SMOOTH_WINDOW,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            SPOT_SMOOTH_WINDOW_DOC)
                    .define(OUTLIER_RATIO_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_OUTLIER_RATIO_THRESHOLD,
                            between(0.0, 1.0),
                            ConfigDef.Importance.HIGH,
                            OUTLIER_RATIO_THRESHOLD_DOC)
                    .define(NORMALIZATION_CLIP_SIGMA_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_NORMALIZATION_CLIP_SIGMA,
                            between(Double.MIN_VALUE, Double.MAX_VALUE),
                            ConfigDef.Importance.LOW,
                            NORMALIZATION_CLIP_SIGMA_DOC)
                    .define(DENOISE_EPS_MULTIPLIER_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_DENOISE_EPS_MULTIPLIER,
                            between(Double.MIN_VALUE, Double.MAX_VALUE),
                            ConfigDef.Importance.LOW,
                            DENOISE_EPS_MULTIPLIER_DOC)
                    .define(DATA_MIN_LENGTH_RATIO_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_DATA_MIN_LENGTH_RATIO,
                            between(0.0, 1.0),
                            ConfigDef.Importance.MEDIUM,
                            DATA_MIN_LENGTH_RATIO_DOC)
                    .define(EXTRA_METRICS_CONFIG,
                            ConfigDef.Type.LIST,
                            DEFAULT_EXTRA_METRICS,
                            ConfigDef.Importance.MEDIUM,
                            EXTRA_METRICS_DOC);
  }
}
