/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.tool;

import com.codahale.metrics.MetricRegistry;
import com.linkedin.container.disruptiondetector.config.DisruptionDetectorConfig;
import com.linkedin.container.disruptiondetector.detector.ContainerDisruptionFacade;
import com.linkedin.container.disruptiondetector.exception.VictimNotFoundException;
import com.linkedin.container.disruptiondetector.loader.MetricLoader;
import com.linkedin.container.disruptiondetector.loader.StaticMetricLoader;
import com.linkedin.container.disruptiondetector.model.AnomalyModel;
import com.linkedin.container.disruptiondetector.model.KpiParam;
import com.linkedin.container.disruptiondetector.model.KpiTimeSeries;
import com.linkedin.container.disruptiondetector.model.RootCauseModel;
import com.linkedin.container.disruptiondetector.model.WindowParam;
import com.linkedin.container.disruptiondetector.report.DisruptionReportRenderer;
import com.linkedin.container.disruptiondetector.report.ReportType;
import com.linkedin.disruptiondetector.common.config.ConfigException;
import com.linkedin.disruptiondetector.exception.DisruptionDetectorException;
import com.linkedin.disruptiondetector.exception.MetricLoadingException;
import com.linkedin.disruptiondetector.model.TimeSeries;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.disruptiondetector.common.utils.Utils.validateNotNull;


/**
 * The entry points exposed to the tool layer: detection, root cause analysis and reporting, online against a
 * configured metric loader or offline against a given payload of series.
 *
 * Each call builds its own {@link ContainerDisruptionFacade}. Detection scans machines, then KPIs, then containers
 * sequentially, so identical inputs always produce anomalies in the same order.
 */
public class ContainerDisruptionTools {
  private static final Logger LOG = LoggerFactory.getLogger(ContainerDisruptionTools.class);
  private final DisruptionDetectorConfig _config;
  private final MetricRegistry _dropwizardMetricRegistry;
  private final Clock _clock;

  public ContainerDisruptionTools(DisruptionDetectorConfig config) {
    this(config, new MetricRegistry(), Clock.systemUTC());
  }

  /**
   * @param config Base configuration, which the configs given to each call override.
   * @param dropwizardMetricRegistry The metric registry that holds the detection sensors.
   * @param clock The clock that ends the look back windows and dates the reports.
   */
  public ContainerDisruptionTools(DisruptionDetectorConfig config, MetricRegistry dropwizardMetricRegistry, Clock clock) {
    _config = validateNotNull(config, "Configuration cannot be null.");
    _dropwizardMetricRegistry = validateNotNull(dropwizardMetricRegistry, "Metric registry cannot be null.");
    _clock = validateNotNull(clock, "Clock cannot be null.");
  }

  /**
   * Detect disrupted containers.
   *
   * @param kpis KPIs to scan. Disabled KPIs are skipped.
   * @param window Look back and observation windows.
   * @param config Detector configs overriding the base configuration, may be {@code null}.
   * @param loaderConfig Configs of the metric loader, with at least
   *                     {@link com.linkedin.container.disruptiondetector.config.constants.MetricLoaderConfig#METRIC_LOADER_CLASS_CONFIG}.
   * @param machineId Machine to scan, or {@code null} (or empty) to scan every machine that reported the KPIs.
   * @return Anomalies of all the scanned machines.
   */
  public List<AnomalyModel> detect(List<KpiParam> kpis, WindowParam window, Map<String, ?> config,
                                   Map<String, ?> loaderConfig, String machineId) throws DisruptionDetectorException {
    MetricLoader metricLoader = new DisruptionDetectorConfig(validateNotNull(loaderConfig, "Loader config cannot be null."),
                                                             false).metricLoader();
    return detect(kpis, window, requestConfig(config), metricLoader, machineId);
  }

  /**
   * Detect disrupted containers among the given series.
   *
   * @param machineId Machine the series belong to, {@link StaticMetricLoader#OFFLINE_MACHINE_ID} if {@code null} or empty.
   * @param kpis KPIs to scan. If empty, every metric of the payload is scanned with the default threshold.
   * @param window Look back and observation windows.
   * @param config Detector configs overriding the base configuration, may be {@code null}.
   * @param payload Series to scan.
   * @return Anomalies among the given series.
   */
  public List<AnomalyModel> detectOffline(String machineId, List<KpiParam> kpis, WindowParam window, Map<String, ?> config,
                                          List<TimeSeries> payload) throws DisruptionDetectorException {
    StaticMetricLoader metricLoader = new StaticMetricLoader(payload);
    List<KpiParam> offlineKpis = kpis;
    if (kpis == null || kpis.isEmpty()) {
      offlineKpis = metricLoader.metrics().stream().map(KpiParam::new).collect(Collectors.toList());
      LOG.info("No KPI given for offline detection, scanning all the metrics of the payload: {}.", metricLoader.metrics());
    }
    String offlineMachineId = machineId == null || machineId.isEmpty() ? StaticMetricLoader.OFFLINE_MACHINE_ID : machineId;
    return detect(offlineKpis, window, requestConfig(config), metricLoader, offlineMachineId);
  }

  private DisruptionDetectorConfig requestConfig(Map<String, ?> config) {
    DisruptionDetectorConfig requestConfig = _config.withOverrides(config);
    if (requestConfig != _config) {
      requestConfig.logUnknownConfigs();
    }
    return requestConfig;
  }

  private List<AnomalyModel> detect(List<KpiParam> kpis, WindowParam window, DisruptionDetectorConfig config,
                                    MetricLoader metricLoader, String machineId) throws MetricLoadingException {
    WindowParam detectionWindow = window == null ? new WindowParam() : window;
    List<KpiParam> enabledKpis = kpis == null ? Collections.emptyList()
                                              : kpis.stream().filter(KpiParam::enabled).collect(Collectors.toList());
    ContainerDisruptionFacade facade = new ContainerDisruptionFacade(config, metricLoader, _clock, _dropwizardMetricRegistry);

    List<String> machineIds;
    if (machineId == null || machineId.isEmpty()) {
      if (enabledKpis.isEmpty()) {
        throw new ConfigException("At least one KPI is required to discover the machines to scan.");
      }
      machineIds = facade.getUniqueMachineIds(detectionWindow.lookBack(), enabledKpis);
    } else {
      machineIds = Collections.singletonList(machineId);
    }

    List<AnomalyModel> anomalies = new ArrayList<>();
    for (String id : machineIds) {
      for (KpiParam kpi : enabledKpis) {
        double threshold = kpi.outlierRatioThreshold(facade.defaultOutlierRatioThreshold());
        anomalies.addAll(facade.detectBySpot(kpi.metric(), id, threshold, detectionWindow.lookBack(),
                                             detectionWindow.obsSize()));
      }
    }
    LOG.info("Scanned {} containers on {} machines for {} KPIs, {} anomalies.", facade.numScannedContainers(),
             machineIds.size(), enabledKpis.size(), anomalies.size());
    return anomalies;
  }

  /**
   * Find the series of the window that explain the disruption of a container.
   *
   * @param metric Metric of the victim.
   * @param victimContainerName Container name of the victim.
   * @param window Look back window.
   * @param loaderConfig Configs of the metric loader.
   * @param machineId Machine of the victim, required.
   * @return Root causes by descending score.
   */
  public List<RootCauseModel> analyzeRootCause(String metric, String victimContainerName, WindowParam window,
                                               Map<String, ?> loaderConfig, String machineId)
      throws DisruptionDetectorException {
    if (machineId == null || machineId.isEmpty()) {
      throw new ConfigException("A machine id is required to analyze the root cause of a disruption.");
    }
    validateNotNull(victimContainerName, "Victim container name cannot be null.");
    MetricLoader metricLoader = new DisruptionDetectorConfig(validateNotNull(loaderConfig, "Loader config cannot be null."),
                                                             false).metricLoader();
    ContainerDisruptionFacade facade = new ContainerDisruptionFacade(_config, metricLoader, _clock, _dropwizardMetricRegistry);
    int lookBack = window == null ? WindowParam.DEFAULT_LOOK_BACK_MINUTES : window.lookBack();
    KpiTimeSeries kpiTimeSeries = facade.getKpiTimeSeries(metric, machineId, lookBack);
    for (TimeSeries series : kpiTimeSeries.series()) {
      if (victimContainerName.equals(series.label(TimeSeries.CONTAINER_NAME_LABEL))) {
        return facade.findDisruptionSource(series, kpiTimeSeries.series());
      }
    }
    throw new VictimNotFoundException(victimContainerName, metric, machineId);
  }

  /**
   * Find the series of the given context that explain the disruption of the given victim.
   *
   * @param victim The disrupted series.
   * @param context Candidate series.
   * @return Root causes by descending score.
   */
  public List<RootCauseModel> analyzeRootCauseOffline(TimeSeries victim, List<TimeSeries> context) {
    validateNotNull(victim, "Victim cannot be null.");
    StaticMetricLoader metricLoader = new StaticMetricLoader(context);
    ContainerDisruptionFacade facade = new ContainerDisruptionFacade(_config, metricLoader, _clock, _dropwizardMetricRegistry);
    return facade.findDisruptionSource(victim, context);
  }

  /**
   * @param anomalies Anomalies to report.
   * @param reportType Type of the report.
   * @return The report, keyed by {@link DisruptionReportRenderer#MARKDOWN}.
   */
  public Map<String, String> report(List<AnomalyModel> anomalies, ReportType reportType) {
    DisruptionReportRenderer renderer = new DisruptionReportRenderer(_config.reportLanguage(), _clock);
    return Collections.singletonMap(DisruptionReportRenderer.MARKDOWN,
                                    renderer.render(anomalies, reportType == null ? ReportType.ANOMALY : reportType));
  }
}
