/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.detector;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.linkedin.container.disruptiondetector.config.DisruptionDetectorConfig;
import com.linkedin.container.disruptiondetector.config.constants.RootCauseConfig;
import com.linkedin.container.disruptiondetector.config.constants.SpotDetectorConfig;
import com.linkedin.container.disruptiondetector.loader.MetricLoader;
import com.linkedin.container.disruptiondetector.model.AnomalyModel;
import com.linkedin.container.disruptiondetector.model.KpiParam;
import com.linkedin.container.disruptiondetector.model.KpiTimeSeries;
import com.linkedin.container.disruptiondetector.model.RootCauseModel;
import com.linkedin.container.disruptiondetector.model.WindowContext;
import com.linkedin.disruptiondetector.common.config.ConfigException;
import com.linkedin.disruptiondetector.detector.denoise.TimeSeriesDbscan;
import com.linkedin.disruptiondetector.detector.normalization.ClipNormalizer;
import com.linkedin.disruptiondetector.detector.normalization.NormalizationResult;
import com.linkedin.disruptiondetector.detector.spot.SpotResult;
import com.linkedin.disruptiondetector.detector.spot.SpotThresholdModel;
import com.linkedin.disruptiondetector.exception.MetricLoadingException;
import com.linkedin.disruptiondetector.model.TimeSeries;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.disruptiondetector.common.utils.Utils.validateNotNull;
import static com.linkedin.disruptiondetector.detector.TimeSeriesStatsUtils.absoluteCorrelation;
import static com.linkedin.disruptiondetector.detector.TimeSeriesStatsUtils.isDataValid;
import static com.linkedin.disruptiondetector.detector.TimeSeriesStatsUtils.round3;
import static com.linkedin.disruptiondetector.detector.TimeSeriesStatsUtils.trend;


/**
 * Detects disrupted containers of a machine, one KPI at a time.
 *
 * <p>Each series of the KPI is scored independently:
 * <ol>
 *   <li>The whole series is denoised with {@link TimeSeriesDbscan}, and its points labeled normal form the calibration
 *   sample.</li>
 *   <li>The last {@code obsSize} raw points form the observation window.</li>
 *   <li>Series that are too short or degenerate score 0.</li>
 *   <li>Otherwise a {@link SpotThresholdModel} is calibrated on the sample and run on the unclipped observation
 *   window, whose {@link ClipNormalizer} band is only logged. The score is the fraction of the window that raised an alarm.</li>
 * </ol>
 * Containers whose score reaches the threshold of the KPI are reported, with the trend of the configured extra metrics
 * and, if enabled, their root causes among the other series of the same window.
 *
 * <p>A facade is built per request and is not thread-safe.
 */
public class ContainerDisruptionFacade {
  private static final Logger LOG = LoggerFactory.getLogger(ContainerDisruptionFacade.class);
  public static final String SPOT_EVENT_SOURCE = "spot";
  public static final String CONTAINER_NAME_INFO = "container_name";
  public static final String MACHINE_ID_INFO = "machine_id";
  static final int MIN_CALIBRATION_POINTS = 2;
  private final MetricLoader _metricLoader;
  private final Clock _clock;
  private final DisruptionDetectorSensors _sensors;
  private final ClipNormalizer _normalizer;
  private final double _q;
  private final double _level;
  private final double _epsMultiplier;
  private final double _minLengthRatio;
  private final double _defaultOutlierRatioThreshold;
  private final List<String> _extraMetrics;
  private final double _correlationThreshold;
  private final int _maxRootCauses;
  private final boolean _rootCauseAnalysisEnabled;
  private int _numScannedContainers;

  /**
   * @param config The detector configuration.
   * @param metricLoader The loader of the container series.
   * @param clock The clock that ends the look back windows.
   * @param dropwizardMetricRegistry The metric registry that holds the detection sensors.
   */
  public ContainerDisruptionFacade(DisruptionDetectorConfig config,
                                   MetricLoader metricLoader,
                                   Clock clock,
                                   MetricRegistry dropwizardMetricRegistry) {
    validateNotNull(config, "Configuration cannot be null.");
    _metricLoader = validateNotNull(metricLoader, "Metric loader cannot be null.");
    _clock = validateNotNull(clock, "Clock cannot be null.");
    _sensors = new DisruptionDetectorSensors(validateNotNull(dropwizardMetricRegistry, "Metric registry cannot be null."));
    _normalizer = new ClipNormalizer(config.getDouble(SpotDetectorConfig.NORMALIZATION_CLIP_SIGMA_CONFIG));
    _q = config.getDouble(SpotDetectorConfig.SPOT_Q_CONFIG);
    _level = config.getDouble(SpotDetectorConfig.SPOT_LEVEL_CONFIG);
    _epsMultiplier = config.getDouble(SpotDetectorConfig.DENOISE_EPS_MULTIPLIER_CONFIG);
    _minLengthRatio = config.getDouble(SpotDetectorConfig.DATA_MIN_LENGTH_RATIO_CONFIG);
    _defaultOutlierRatioThreshold = config.getDouble(SpotDetectorConfig.OUTLIER_RATIO_THRESHOLD_CONFIG);
    _extraMetrics = config.getList(SpotDetectorConfig.EXTRA_METRICS_CONFIG).stream()
                          .map(String::trim).filter(m -> !m.isEmpty()).collect(Collectors.toList());
    _correlationThreshold = config.getDouble(RootCauseConfig.ROOT_CAUSE_CORRELATION_THRESHOLD_CONFIG);
    _maxRootCauses = config.getInt(RootCauseConfig.ROOT_CAUSE_MAX_COUNT_CONFIG);
    _rootCauseAnalysisEnabled = config.getBoolean(RootCauseConfig.ROOT_CAUSE_ANALYSIS_ENABLED_CONFIG);
    _numScannedContainers = 0;
  }

  /**
   * Get the machines that reported any of the given KPIs in the look back window. If the loader cannot list machines
   * natively, the machines are the distinct {@link TimeSeries#MACHINE_ID_LABEL} labels of the series of the first KPI.
   *
   * @param lookBack Look back window in minutes.
   * @param kpis KPIs to scan, at least one.
   * @return Distinct machine ids, possibly empty.
   */
  public List<String> getUniqueMachineIds(int lookBack, List<KpiParam> kpis) throws MetricLoadingException {
    if (kpis == null || kpis.isEmpty()) {
      throw new ConfigException("At least one KPI is required to discover the machines to scan.");
    }
    WindowContext window = WindowContext.lookingBack(_clock.instant(), lookBack);
    List<String> metrics = kpis.stream().map(KpiParam::metric).collect(Collectors.toList());
    List<String> machineIds;
    try {
      machineIds = _metricLoader.uniqueMachines(window.start(), window.end(), metrics);
    } catch (UnsupportedOperationException e) {
      LOG.warn("Failed to list machines natively ({}), falling back to the {} labels of metric {}.", e.getMessage(),
               TimeSeries.MACHINE_ID_LABEL, metrics.get(0));
      Set<String> labels = new LinkedHashSet<>();
      for (TimeSeries series : _metricLoader.metric(window.start(), window.end(), metrics.get(0), null)) {
        String machineId = series.label(TimeSeries.MACHINE_ID_LABEL);
        if (!machineId.isEmpty()) {
          labels.add(machineId);
        }
      }
      machineIds = new ArrayList<>(labels);
    }

    if (machineIds.isEmpty()) {
      LOG.warn("No machine found in window {} for metrics {}, check the metric loader configuration and the window.",
               window, metrics);
    } else {
      LOG.info("Discovered {} machines: {}.", machineIds.size(), machineIds);
    }
    return machineIds;
  }

  /**
   * Fetch the series of a KPI on a machine over the look back window ending now.
   *
   * @param metric Metric name.
   * @param machineId Machine id.
   * @param lookBack Look back window in minutes.
   * @return The series, with their window and expected length.
   */
  public KpiTimeSeries getKpiTimeSeries(String metric, String machineId, int lookBack) throws MetricLoadingException {
    WindowContext window = WindowContext.lookingBack(_clock.instant(), lookBack);
    int expectedPointLength = _metricLoader.expectedPointLength(window.start(), window.end());
    List<TimeSeries> series = _metricLoader.metric(window.start(), window.end(), metric, machineId);
    LOG.debug("Fetched {} series of metric {} on machine {} in window {}, expecting {} points each.", series.size(), metric,
              machineId, window, expectedPointLength);
    return new KpiTimeSeries(window, expectedPointLength, series);
  }

  /**
   * Score every container of a machine on a KPI and report those whose score reaches the threshold.
   *
   * @param metric Metric name.
   * @param machineId Machine id.
   * @param outlierRatioThreshold Minimum fraction of the observation window that must raise an alarm.
   * @param lookBack Look back window in minutes.
   * @param obsSize Number of most recent points that are scored.
   * @return Reported containers, in the order of the series returned by the loader.
   */
  public List<AnomalyModel> detectBySpot(String metric, String machineId, double outlierRatioThreshold, int lookBack,
                                         int obsSize) throws MetricLoadingException {
    return detectBySpot(getKpiTimeSeries(metric, machineId, lookBack), machineId, outlierRatioThreshold, lookBack, obsSize);
  }

  /**
   * Same as {@link #detectBySpot(String, String, double, int, int)} on already fetched series.
   *
   * @param kpiTimeSeries The series of the KPI on the machine.
   * @param machineId Machine id.
   * @param outlierRatioThreshold Minimum fraction of the observation window that must raise an alarm.
   * @param lookBack Look back window in minutes.
   * @param obsSize Number of most recent points that are scored.
   * @return Reported containers, in the order of the given series.
   */
  public List<AnomalyModel> detectBySpot(KpiTimeSeries kpiTimeSeries, String machineId, double outlierRatioThreshold,
                                         int lookBack, int obsSize) throws MetricLoadingException {
    TimeSeriesDbscan denoiser = new TimeSeriesDbscan(lookBack, obsSize, _epsMultiplier);
    List<AnomalyModel> anomalies = new ArrayList<>();
    List<TimeSeries> allSeries = kpiTimeSeries.series();
    _numScannedContainers += allSeries.size();
    _sensors.scannedContainers().inc(allSeries.size());

    for (TimeSeries series : allSeries) {
      double score;
      final Timer.Context ctx = _sensors.spotDetectionTimer().time();
      try {
        score = score(series.values(), kpiTimeSeries.expectedPointLength(), denoiser, obsSize);
      } finally {
        ctx.stop();
      }
      LOG.debug("Container {} on machine {} scored {} on metric {}.", series.label(TimeSeries.CONTAINER_NAME_LABEL),
                machineId, score, series.metric());
      if (score < outlierRatioThreshold) {
        continue;
      }
      String containerName = series.label(TimeSeries.CONTAINER_NAME_LABEL);
      Map<String, Object> info = containerExtraInfo(machineId, containerName, kpiTimeSeries.window(), obsSize);
      AnomalyModel anomaly = new AnomalyModel(machineId, series.metric(), series.labels(), score, SPOT_EVENT_SOURCE, info);
      if (_rootCauseAnalysisEnabled) {
        anomaly = anomaly.withRootCauses(findDisruptionSource(series, allSeries));
      }
      _sensors.containerAnomalyRate().mark();
      anomalies.add(anomaly);
    }
    return anomalies;
  }

  /**
   * Score a series: the fraction of its observation window that raises an alarm of the extreme value model calibrated
   * on its denoised values.
   *
   * @param values Values of the series.
   * @param expectedPointLength Number of points a complete series has.
   * @param denoiser Denoiser of the series.
   * @param obsSize Number of most recent points that are scored.
   * @return The score in [0, 1], 0 for unusable series.
   */
  double score(double[] values, int expectedPointLength, TimeSeriesDbscan denoiser, int obsSize) {
    if (!isDataValid(values, expectedPointLength, _minLengthRatio)) {
      _sensors.invalidSeriesRate().mark();
      return 0.0;
    }
    int[] labels = denoiser.detect(values);
    double[] calibration = new double[values.length];
    int numCalibrationPoints = 0;
    for (int i = 0; i < values.length; i++) {
      if (labels[i] == TimeSeriesDbscan.NORMAL) {
        calibration[numCalibrationPoints++] = values[i];
      }
    }
    if (numCalibrationPoints < MIN_CALIBRATION_POINTS) {
      _sensors.invalidSeriesRate().mark();
      return 0.0;
    }
    double[] observation = Arrays.copyOfRange(values, Math.max(0, values.length - obsSize), values.length);

    SpotThresholdModel spot = new SpotThresholdModel(_q);
    spot.initialize(Arrays.copyOf(calibration, numCalibrationPoints), _level);
    // Unclipped, so the observation stays in the raw units the model is calibrated on.
    NormalizationResult normalized = _normalizer.transform(observation, false);
    LOG.debug("Observation window {} scored against {} calibration points.", normalized, numCalibrationPoints);
    SpotResult result = spot.run(normalized.values(), true);
    return (double) result.numAlarms() / obsSize;
  }

  /**
   * Rank the other series of the window by the absolute correlation of their values with the values of the victim.
   *
   * @param victim The disrupted series.
   * @param allSeries Candidate series, the victim itself is skipped.
   * @return Candidates correlated above the threshold, by descending score, at most the configured count.
   */
  public List<RootCauseModel> findDisruptionSource(TimeSeries victim, List<TimeSeries> allSeries) {
    final Timer.Context ctx = _sensors.rootCauseAnalysisTimer().time();
    try {
      double[] victimValues = victim.values();
      List<RootCauseModel> rootCauses = new ArrayList<>();
      for (TimeSeries candidate : allSeries) {
        if (candidate == victim) {
          continue;
        }
        double correlation = absoluteCorrelation(victimValues, candidate.values());
        if (!Double.isNaN(correlation) && correlation > _correlationThreshold) {
          rootCauses.add(new RootCauseModel(candidate.metric(), candidate.labels(), round3(correlation)));
        }
      }
      rootCauses.sort(Comparator.comparingDouble(RootCauseModel::score).reversed());
      return new ArrayList<>(rootCauses.subList(0, Math.min(_maxRootCauses, rootCauses.size())));
    } finally {
      ctx.stop();
    }
  }

  /**
   * Describe a container with the trend of each configured extra metric over the observation window.
   *
   * @param machineId Machine id.
   * @param containerName Container name.
   * @param window Window of the detection.
   * @param obsSize Number of most recent points that are scored.
   * @return The container name, the machine id and one trend per extra metric that has a series for the container.
   */
  public Map<String, Object> containerExtraInfo(String machineId, String containerName, WindowContext window, int obsSize)
      throws MetricLoadingException {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put(CONTAINER_NAME_INFO, containerName);
    info.put(MACHINE_ID_INFO, machineId);
    for (String metric : _extraMetrics) {
      for (TimeSeries series : _metricLoader.metric(window.start(), window.end(), metric, machineId)) {
        if (containerName.equals(series.label(TimeSeries.CONTAINER_NAME_LABEL))) {
          info.put(metric, trend(series.values(), obsSize));
          break;
        }
      }
    }
    return info;
  }

  /**
   * @return The threshold of KPIs that do not set {@link KpiParam#OUTLIER_RATIO_THRESHOLD_PARAM}.
   */
  public double defaultOutlierRatioThreshold() {
    return _defaultOutlierRatioThreshold;
  }

  /**
   * @return The number of container series scanned by this facade.
   */
  public int numScannedContainers() {
    return _numScannedContainers;
  }
}
