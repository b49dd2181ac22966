/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.linkedin.container.disruptiondetector.model.AnomalyModel;
import com.linkedin.container.disruptiondetector.model.RootCauseModel;
import com.linkedin.disruptiondetector.model.TimeSeries;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

import static com.linkedin.container.disruptiondetector.report.ReportMessage.ALL_NORMAL;
import static com.linkedin.container.disruptiondetector.report.ReportMessage.ANOMALY_COUNT;
import static com.linkedin.container.disruptiondetector.report.ReportMessage.CONTAINER;
import static com.linkedin.container.disruptiondetector.report.ReportMessage.DETAILS;
import static com.linkedin.container.disruptiondetector.report.ReportMessage.INFO;
import static com.linkedin.container.disruptiondetector.report.ReportMessage.MACHINE;
import static com.linkedin.container.disruptiondetector.report.ReportMessage.METRIC;
import static com.linkedin.container.disruptiondetector.report.ReportMessage.OVERVIEW;
import static com.linkedin.container.disruptiondetector.report.ReportMessage.ROOT_CAUSES;
import static com.linkedin.container.disruptiondetector.report.ReportMessage.SCORE;
import static com.linkedin.container.disruptiondetector.report.ReportMessage.SUGGESTION;
import static com.linkedin.container.disruptiondetector.report.ReportMessage.SUGGESTIONS;
import static com.linkedin.container.disruptiondetector.report.ReportMessage.TIME;
import static com.linkedin.container.disruptiondetector.report.ReportMessage.TITLE;
import static com.linkedin.disruptiondetector.common.utils.Utils.validateNotNull;


/**
 * Renders the detected anomalies as a markdown report: a title, the time, an overview and, for disrupted containers,
 * a table with one row per anomaly followed by suggestions.
 */
public class DisruptionReportRenderer {
  public static final String MARKDOWN = "markdown";
  static final String NO_ROOT_CAUSE = "-";
  private static final String BLOCK_SEPARATOR = "\n\n";
  private static final String ROW_SEPARATOR = "\n";
  private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
  private final ReportLanguage _language;
  private final Clock _clock;
  private final Gson _gson;

  public DisruptionReportRenderer(ReportLanguage language, Clock clock) {
    _language = validateNotNull(language, "Report language cannot be null.");
    _clock = validateNotNull(clock, "Clock cannot be null.");
    _gson = new GsonBuilder().disableHtmlEscaping().serializeSpecialFloatingPointValues().create();
  }

  /**
   * @param anomalies Anomalies to report.
   * @param reportType Type of the report. A report of anomalies without any anomaly is a normal report.
   * @return The markdown of the report.
   */
  public String render(List<AnomalyModel> anomalies, ReportType reportType) {
    Map<ReportMessage, String> messages = ReportMessage.table(_language);
    List<String> blocks = new ArrayList<>();
    blocks.add("# " + messages.get(TITLE));
    blocks.add(String.format("**%s**: %s", messages.get(TIME), LocalDateTime.now(_clock).format(TIME_FORMATTER)));
    blocks.add("## " + messages.get(OVERVIEW));
    if (reportType == ReportType.NORMAL || anomalies == null || anomalies.isEmpty()) {
      blocks.add(messages.get(ALL_NORMAL));
      return String.join(BLOCK_SEPARATOR, blocks);
    }

    blocks.add(String.format(messages.get(ANOMALY_COUNT), anomalies.size()));
    blocks.add("## " + messages.get(DETAILS));
    // Rows of a markdown table must not be separated by blank lines.
    StringJoiner table = new StringJoiner(ROW_SEPARATOR);
    table.add(String.format("| %s | %s | %s | %s | %s | %s |", messages.get(MACHINE), messages.get(METRIC),
                            messages.get(SCORE), messages.get(CONTAINER), messages.get(INFO), messages.get(ROOT_CAUSES)));
    table.add("|---|---:|---:|---|---|---|");
    for (AnomalyModel anomaly : anomalies) {
      table.add(row(anomaly));
    }
    blocks.add(table.toString());
    blocks.add("## " + messages.get(SUGGESTIONS) + "\n- " + messages.get(SUGGESTION));
    return String.join(BLOCK_SEPARATOR, blocks);
  }

  String row(AnomalyModel anomaly) {
    return String.format(Locale.ROOT, "| %s | %s | %.3f | %s | %s | %s |", anomaly.machineId(), anomaly.metric(),
                         anomaly.score(), anomaly.labels().getOrDefault(TimeSeries.CONTAINER_NAME_LABEL, ""),
                         _gson.toJson(anomaly.info()), rootCauseSummary(anomaly.rootCauses()));
  }

  static String rootCauseSummary(List<RootCauseModel> rootCauses) {
    if (rootCauses.isEmpty()) {
      return NO_ROOT_CAUSE;
    }
    StringJoiner joiner = new StringJoiner(", ");
    rootCauses.forEach(rootCause -> joiner.add(rootCause.toString()));
    return joiner.toString();
  }

  public ReportLanguage language() {
    return _language;
  }
}
