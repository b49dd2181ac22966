/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.report;

import com.linkedin.container.disruptiondetector.model.AnomalyModel;
import com.linkedin.container.disruptiondetector.model.RootCauseModel;
import com.linkedin.disruptiondetector.model.TimeSeries;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;

import static com.linkedin.container.disruptiondetector.DisruptionDetectorTestUtils.CLOCK;
import static com.linkedin.container.disruptiondetector.DisruptionDetectorTestUtils.CPU_METRIC;
import static com.linkedin.container.disruptiondetector.DisruptionDetectorTestUtils.MACHINE_ID;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;


public class DisruptionReportRendererTest {

  @Test
  public void testNormalReport() {
    String markdown = new DisruptionReportRenderer(ReportLanguage.EN, CLOCK).render(Collections.emptyList(), ReportType.ANOMALY);
    assertEquals("# Container Disruption Detection Report\n\n"
                 + "**Time**: 2026-10-19 08:00:00\n\n"
                 + "## Overview\n\n"
                 + "All containers run normally, monitoring continues.", markdown);
  }

  @Test
  public void testNormalTypeIgnoresAnomalies() {
    String markdown = new DisruptionReportRenderer(ReportLanguage.EN, CLOCK)
        .render(Collections.singletonList(anomaly("web", 0.2)), ReportType.NORMAL);
    assertFalse(markdown, markdown.contains("## Details"));
  }

  @Test
  public void testAnomalyReport() {
    AnomalyModel anomaly = anomaly("web", 0.4)
        .withRootCauses(Arrays.asList(new RootCauseModel(CPU_METRIC, Collections.emptyMap(), 0.95),
                                      new RootCauseModel("gala_gopher_container_memory_rss", Collections.emptyMap(), 0.7)));
    String markdown = new DisruptionReportRenderer(ReportLanguage.EN, CLOCK)
        .render(Arrays.asList(anomaly, anomaly("db", 1.0)), ReportType.ANOMALY);

    assertTrue(markdown, markdown.contains("\n\nDisrupted containers detected: **2**\n\n## Details\n\n"));
    assertTrue(markdown, markdown.contains("| Machine | Metric | Score | Container | Info | RCA |\n|---|---:|---:|---|---|---|"));
    assertTrue(markdown, markdown.contains("| machine-1 | " + CPU_METRIC + " | 0.400 | web | "
                                           + "{\"container_name\":\"web\",\"machine_id\":\"machine-1\"} | "
                                           + CPU_METRIC + "(0.95), gala_gopher_container_memory_rss(0.7) |"));
    assertTrue(markdown, markdown.contains("| 1.000 | db |"));
    assertTrue(markdown, markdown.endsWith("## Suggestions\n- " + ReportMessage.SUGGESTION.text(ReportLanguage.EN)));
  }

  @Test
  public void testChineseReport() {
    String markdown = new DisruptionReportRenderer(ReportLanguage.ZH, CLOCK)
        .render(Collections.singletonList(anomaly("web", 0.2)), ReportType.ANOMALY);
    assertTrue(markdown, markdown.startsWith("# 容器干扰检测诊断报告\n\n**时间**: 2026-10-19 08:00:00"));
    assertTrue(markdown, markdown.contains("检测到异常容器数量：**1**"));
    assertTrue(markdown, markdown.contains("| machine-1 | " + CPU_METRIC + " | 0.200 | web |"));
  }

  @Test
  public void testRootCauseSummary() {
    assertEquals(DisruptionReportRenderer.NO_ROOT_CAUSE, DisruptionReportRenderer.rootCauseSummary(Collections.emptyList()));
  }

  @Test
  public void testLanguageCodes() {
    assertEquals(ReportLanguage.ZH, ReportLanguage.forCode("zh"));
    assertArrayEquals(new String[] {"en", "zh"}, ReportLanguage.codes());
    for (ReportLanguage language : ReportLanguage.values()) {
      assertEquals(ReportMessage.values().length, ReportMessage.table(language).size());
    }
  }

  private static AnomalyModel anomaly(String containerName, double score) {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("container_name", containerName);
    info.put("machine_id", MACHINE_ID);
    return new AnomalyModel(MACHINE_ID, CPU_METRIC, Collections.singletonMap(TimeSeries.CONTAINER_NAME_LABEL, containerName),
                            score, "spot", info);
  }
}
