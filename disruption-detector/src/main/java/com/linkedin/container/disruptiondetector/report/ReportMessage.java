/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.report;

import java.util.EnumMap;
import java.util.Map;


/**
 * The texts of the reports, in every {@link ReportLanguage}.
 */
public enum ReportMessage {
  TITLE("Container Disruption Detection Report", "容器干扰检测诊断报告"),
  TIME("Time", "时间"),
  OVERVIEW("Overview", "总览"),
  ALL_NORMAL("All containers run normally, monitoring continues.", "当前容器运行正常，将持续监测。"),
  ANOMALY_COUNT("Disrupted containers detected: **%d**", "检测到异常容器数量：**%d**"),
  DETAILS("Details", "细节"),
  MACHINE("Machine", "机器"),
  METRIC("Metric", "指标"),
  SCORE("Score", "分数"),
  CONTAINER("Container", "容器"),
  INFO("Info", "细节"),
  ROOT_CAUSES("RCA", "RCA"),
  SUGGESTIONS("Suggestions", "建议"),
  SUGGESTION("Check the compute, network and storage paths of the containers and isolate the slow nodes.",
             "请检查计算、网络、存储链路，隔离慢节点。");

  private final String _english;
  private final String _chinese;

  ReportMessage(String english, String chinese) {
    _english = english;
    _chinese = chinese;
  }

  /**
   * @param language Language of the text.
   * @return The text in the given language.
   */
  public String text(ReportLanguage language) {
    return language == ReportLanguage.ZH ? _chinese : _english;
  }

  /**
   * @param language Language of the texts.
   * @return All the texts in the given language.
   */
  public static Map<ReportMessage, String> table(ReportLanguage language) {
    Map<ReportMessage, String> table = new EnumMap<>(ReportMessage.class);
    for (ReportMessage message : values()) {
      table.put(message, message.text(language));
    }
    return table;
  }
}
