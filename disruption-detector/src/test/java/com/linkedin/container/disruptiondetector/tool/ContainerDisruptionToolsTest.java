/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.tool;

import com.codahale.metrics.MetricRegistry;
import com.linkedin.container.disruptiondetector.config.DisruptionDetectorConfig;
import com.linkedin.container.disruptiondetector.config.constants.MetricLoaderConfig;
import com.linkedin.container.disruptiondetector.config.constants.ReportConfig;
import com.linkedin.container.disruptiondetector.config.constants.RootCauseConfig;
import com.linkedin.container.disruptiondetector.exception.VictimNotFoundException;
import com.linkedin.container.disruptiondetector.loader.StaticMetricLoader;
import com.linkedin.container.disruptiondetector.model.AnomalyModel;
import com.linkedin.container.disruptiondetector.model.KpiParam;
import com.linkedin.container.disruptiondetector.model.RootCauseModel;
import com.linkedin.container.disruptiondetector.model.WindowParam;
import com.linkedin.container.disruptiondetector.report.DisruptionReportRenderer;
import com.linkedin.container.disruptiondetector.report.ReportType;
import com.linkedin.disruptiondetector.common.config.ConfigException;
import com.linkedin.disruptiondetector.exception.DisruptionDetectorException;
import com.linkedin.disruptiondetector.model.TimeSeries;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static com.linkedin.container.disruptiondetector.DisruptionDetectorTestUtils.CLOCK;
import static com.linkedin.container.disruptiondetector.DisruptionDetectorTestUtils.CPU_METRIC;
import static com.linkedin.container.disruptiondetector.DisruptionDetectorTestUtils.LOOK_BACK;
import static com.linkedin.container.disruptiondetector.DisruptionDetectorTestUtils.MACHINE_ID;
import static com.linkedin.container.disruptiondetector.DisruptionDetectorTestUtils.MEMORY_METRIC;
import static com.linkedin.container.disruptiondetector.DisruptionDetectorTestUtils.OBS_SIZE;
import static com.linkedin.container.disruptiondetector.DisruptionDetectorTestUtils.flatWithSpike;
import static com.linkedin.container.disruptiondetector.DisruptionDetectorTestUtils.jittered;
import static com.linkedin.container.disruptiondetector.DisruptionDetectorTestUtils.series;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class ContainerDisruptionToolsTest {
  private static final WindowParam WINDOW = new WindowParam(LOOK_BACK, OBS_SIZE);

  @Test
  public void testDetectDiscoversMachines() throws DisruptionDetectorException {
    List<TimeSeries> payload = Arrays.asList(series(CPU_METRIC, MACHINE_ID, "web", flatWithSpike(10.0, 50.0)),
                                             series(CPU_METRIC, MACHINE_ID, "db", jittered()),
                                             series(CPU_METRIC, "machine-2", "cache", jittered()));
    List<AnomalyModel> anomalies = tools(Collections.emptyMap())
        .detect(Collections.singletonList(new KpiParam(CPU_METRIC)), WINDOW, null, loaderConfig(payload), null);

    assertEquals(1, anomalies.size());
    assertEquals(MACHINE_ID, anomalies.get(0).machineId());
    assertEquals("web", anomalies.get(0).labels().get(TimeSeries.CONTAINER_NAME_LABEL));
    assertEquals(0.2, anomalies.get(0).score(), 1e-12);
  }

  @Test
  public void testDetectSkipsDisabledKpis() throws DisruptionDetectorException {
    List<TimeSeries> payload = Arrays.asList(series(CPU_METRIC, MACHINE_ID, "web", flatWithSpike(10.0, 50.0)),
                                             series(MEMORY_METRIC, MACHINE_ID, "web", flatWithSpike(10.0, 50.0)));
    List<KpiParam> kpis = Arrays.asList(new KpiParam(CPU_METRIC, "sli_container", false, Collections.emptyMap()),
                                        new KpiParam(MEMORY_METRIC));
    List<AnomalyModel> anomalies = tools(Collections.emptyMap()).detect(kpis, WINDOW, null, loaderConfig(payload), MACHINE_ID);

    assertEquals(1, anomalies.size());
    assertEquals(MEMORY_METRIC, anomalies.get(0).metric());
  }

  @Test
  public void testKpiThresholdOverridesDefault() throws DisruptionDetectorException {
    List<TimeSeries> payload = Collections.singletonList(series(CPU_METRIC, MACHINE_ID, "web", flatWithSpike(10.0, 50.0)));
    KpiParam kpi = new KpiParam(CPU_METRIC, Collections.singletonMap(KpiParam.OUTLIER_RATIO_THRESHOLD_PARAM, 0.5));
    assertTrue(tools(Collections.emptyMap())
                   .detect(Collections.singletonList(kpi), WINDOW, null, loaderConfig(payload), MACHINE_ID).isEmpty());
  }

  @Test
  public void testDetectRequiresKpisToDiscoverMachines() {
    ContainerDisruptionTools tools = tools(Collections.emptyMap());
    assertThrows(ConfigException.class,
                 () -> tools.detect(Collections.emptyList(), WINDOW, null, loaderConfig(Collections.emptyList()), null));
  }

  @Test
  public void testDetectRequiresMetricLoader() {
    ContainerDisruptionTools tools = tools(Collections.emptyMap());
    assertThrows(ConfigException.class,
                 () -> tools.detect(Collections.singletonList(new KpiParam(CPU_METRIC)), WINDOW, null,
                                    Collections.emptyMap(), MACHINE_ID));
  }

  @Test
  public void testDetectOfflineScansAllMetrics() throws DisruptionDetectorException {
    List<TimeSeries> payload = Arrays.asList(series(CPU_METRIC, null, "web", flatWithSpike(10.0, 50.0)),
                                             series(MEMORY_METRIC, null, "web", jittered()));
    List<AnomalyModel> anomalies = tools(Collections.emptyMap()).detectOffline(null, null, WINDOW, null, payload);

    assertEquals(1, anomalies.size());
    assertEquals(StaticMetricLoader.OFFLINE_MACHINE_ID, anomalies.get(0).machineId());
    assertEquals(CPU_METRIC, anomalies.get(0).metric());
  }

  @Test
  public void testDetectOfflineWithRootCauses() throws DisruptionDetectorException {
    List<TimeSeries> payload = Arrays.asList(series(CPU_METRIC, MACHINE_ID, "web", flatWithSpike(10.0, 50.0)),
                                             series(CPU_METRIC, MACHINE_ID, "batch", flatWithSpike(5.0, 25.0)),
                                             series(CPU_METRIC, MACHINE_ID, "db", jittered()));
    Map<String, Object> config = Collections.singletonMap(RootCauseConfig.ROOT_CAUSE_ANALYSIS_ENABLED_CONFIG, "true");
    List<AnomalyModel> anomalies = tools(Collections.emptyMap())
        .detectOffline(MACHINE_ID, Collections.singletonList(new KpiParam(CPU_METRIC)), WINDOW, config, payload);

    assertEquals(2, anomalies.size());
    assertEquals("batch", anomalies.get(0).rootCauses().get(0).labels().get(TimeSeries.CONTAINER_NAME_LABEL));
    assertEquals("web", anomalies.get(1).rootCauses().get(0).labels().get(TimeSeries.CONTAINER_NAME_LABEL));
  }

  @Test
  public void testAnalyzeRootCause() throws DisruptionDetectorException {
    List<TimeSeries> payload = Arrays.asList(series(CPU_METRIC, MACHINE_ID, "web", flatWithSpike(10.0, 50.0)),
                                             series(CPU_METRIC, MACHINE_ID, "batch", flatWithSpike(5.0, 25.0)),
                                             series(CPU_METRIC, MACHINE_ID, "db", jittered()));
    List<RootCauseModel> rootCauses = tools(Collections.emptyMap())
        .analyzeRootCause(CPU_METRIC, "web", WINDOW, loaderConfig(payload), MACHINE_ID);

    assertEquals(1, rootCauses.size());
    assertEquals("batch", rootCauses.get(0).labels().get(TimeSeries.CONTAINER_NAME_LABEL));
    assertEquals(1.0, rootCauses.get(0).score(), 0.0);
  }

  @Test
  public void testAnalyzeRootCauseMissingVictim() {
    List<TimeSeries> payload = Collections.singletonList(series(CPU_METRIC, MACHINE_ID, "db", jittered()));
    ContainerDisruptionTools tools = tools(Collections.emptyMap());
    VictimNotFoundException e = assertThrows(VictimNotFoundException.class,
                                             () -> tools.analyzeRootCause(CPU_METRIC, "web", WINDOW, loaderConfig(payload),
                                                                          MACHINE_ID));
    assertEquals("web", e.containerName());
  }

  @Test
  public void testAnalyzeRootCauseRequiresMachine() {
    ContainerDisruptionTools tools = tools(Collections.emptyMap());
    assertThrows(ConfigException.class,
                 () -> tools.analyzeRootCause(CPU_METRIC, "web", WINDOW, loaderConfig(Collections.emptyList()), ""));
  }

  @Test
  public void testAnalyzeRootCauseRequiresVictimName() {
    ContainerDisruptionTools tools = tools(Collections.emptyMap());
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
                     () -> tools.analyzeRootCause(CPU_METRIC, null, WINDOW, loaderConfig(Collections.emptyList()), MACHINE_ID));
    assertEquals("Victim container name cannot be null.", e.getMessage());
  }

  @Test
  public void testDetectIgnoresUnknownConfigs() throws DisruptionDetectorException {
    List<TimeSeries> payload = Collections.singletonList(series(CPU_METRIC, MACHINE_ID, "web", flatWithSpike(10.0, 50.0)));
    List<AnomalyModel> anomalies = tools(Collections.emptyMap())
        .detect(Collections.singletonList(new KpiParam(CPU_METRIC)), WINDOW, Collections.singletonMap("spot.levl", "0.9"),
                loaderConfig(payload), MACHINE_ID);
    assertEquals(1, anomalies.size());
  }

  @Test
  public void testAnalyzeRootCauseOffline() {
    TimeSeries victim = series(CPU_METRIC, MACHINE_ID, "web", flatWithSpike(10.0, 50.0));
    List<TimeSeries> context = Arrays.asList(victim, series(CPU_METRIC, MACHINE_ID, "db", jittered()),
                                             series(MEMORY_METRIC, MACHINE_ID, "batch", flatWithSpike(1.0, 2.0)));
    List<RootCauseModel> rootCauses = tools(Collections.emptyMap()).analyzeRootCauseOffline(victim, context);
    assertEquals(1, rootCauses.size());
    assertEquals(MEMORY_METRIC, rootCauses.get(0).metric());
  }

  @Test
  public void testReport() {
    AnomalyModel anomaly = new AnomalyModel(MACHINE_ID, CPU_METRIC,
                                            Collections.singletonMap(TimeSeries.CONTAINER_NAME_LABEL, "web"), 0.2,
                                            "spot", Collections.emptyMap());
    Map<String, String> report = tools(Collections.singletonMap(ReportConfig.REPORT_LANGUAGE_CONFIG, "zh"))
        .report(Collections.singletonList(anomaly), ReportType.ANOMALY);
    String markdown = report.get(DisruptionReportRenderer.MARKDOWN);
    assertTrue(markdown, markdown.startsWith("# 容器干扰检测诊断报告"));
    assertTrue(markdown, markdown.contains("| machine-1 | " + CPU_METRIC + " | 0.200 | web |"));
  }

  private static Map<String, Object> loaderConfig(List<TimeSeries> payload) {
    Map<String, Object> loaderConfig = new HashMap<>();
    loaderConfig.put(MetricLoaderConfig.METRIC_LOADER_CLASS_CONFIG, StaticMetricLoader.class.getName());
    loaderConfig.put(StaticMetricLoader.STATIC_METRIC_LOADER_SERIES_OBJECT_CONFIG, payload);
    return loaderConfig;
  }

  private static ContainerDisruptionTools tools(Map<String, Object> config) {
    return new ContainerDisruptionTools(new DisruptionDetectorConfig(new HashMap<>(config), false), new MetricRegistry(), CLOCK);
  }
}
