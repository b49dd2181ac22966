/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.job;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.linkedin.container.disruptiondetector.model.KpiParam;
import com.linkedin.container.disruptiondetector.model.WindowParam;
import com.linkedin.disruptiondetector.exception.DisruptionDetectorException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Parses detection jobs from JSON files of the form:
 * <pre>
 * {
 *   "kpis": [
 *     {
 *       "metric": "gala_gopher_sli_container_cpu_rundelay",
 *       "entity_name": "sli_container",
 *       "enable": true,
 *       "params": {"look_back": 20, "obs_size": 6, "outlier_ratio_th": 0.3}
 *     }
 *   ],
 *   "model_config": {
 *     "params": {"extra_metrics": "gala_gopher_container_cpu_usage_seconds_total,gala_gopher_container_memory_rss"}
 *   }
 * }
 * </pre>
 * Disabled KPIs are skipped. The window comes from the parameters of the first enabled KPI.
 */
public final class DetectionJobParser {
  private static final Logger LOG = LoggerFactory.getLogger(DetectionJobParser.class);

  private DetectionJobParser() {
  }

  /**
   * @param jobFile Path of the job file.
   * @return The parsed job.
   */
  public static DetectionJob parse(Path jobFile) throws DisruptionDetectorException {
    try (Reader reader = Files.newBufferedReader(jobFile, StandardCharsets.UTF_8)) {
      DetectionJob job = parse(reader);
      LOG.info("Loaded {} KPIs from job file {}, {}, extra metrics {}.", job.kpis().size(), jobFile, job.window(),
               job.extraMetrics());
      return job;
    } catch (IOException e) {
      throw new DisruptionDetectorException("Failed to read job file " + jobFile, e);
    }
  }

  /**
   * @param reader Reader of the job JSON.
   * @return The parsed job.
   */
  public static DetectionJob parse(Reader reader) throws DisruptionDetectorException {
    JobFile jobFile;
    try {
      jobFile = new Gson().fromJson(reader, JobFile.class);
    } catch (JsonParseException e) {
      throw new DisruptionDetectorException("Malformed detection job.", e);
    }
    if (jobFile == null) {
      throw new DisruptionDetectorException("Empty detection job.");
    }

    List<KpiParam> kpis = new ArrayList<>();
    if (jobFile.kpis != null) {
      for (KpiEntry entry : jobFile.kpis) {
        if (entry.enable != null && !entry.enable) {
          continue;
        }
        if (entry.metric == null || entry.metric.isEmpty()) {
          throw new DisruptionDetectorException("KPI without metric in detection job.");
        }
        kpis.add(new KpiParam(entry.metric, entry.entityName, true, entry.params));
      }
    }

    WindowParam window = new WindowParam();
    if (!kpis.isEmpty()) {
      KpiParam first = kpis.get(0);
      window = new WindowParam(first.intParam(KpiParam.LOOK_BACK_PARAM, WindowParam.DEFAULT_LOOK_BACK_MINUTES),
                               first.intParam(KpiParam.OBS_SIZE_PARAM, WindowParam.DEFAULT_OBS_SIZE));
    }
    return new DetectionJob(kpis, window, extraMetrics(jobFile.modelConfig));
  }

  private static List<String> extraMetrics(ModelConfig modelConfig) {
    if (modelConfig == null || modelConfig.params == null) {
      return Collections.emptyList();
    }
    Object extraMetrics = modelConfig.params.get(ModelConfig.EXTRA_METRICS_PARAM);
    List<String> metrics = new ArrayList<>();
    if (extraMetrics instanceof List) {
      for (Object metric : (List<?>) extraMetrics) {
        addMetric(metrics, String.valueOf(metric));
      }
    } else if (extraMetrics != null) {
      for (String metric : extraMetrics.toString().split(",")) {
        addMetric(metrics, metric);
      }
    }
    return metrics;
  }

  private static void addMetric(List<String> metrics, String metric) {
    String trimmed = metric.trim();
    if (!trimmed.isEmpty()) {
      metrics.add(trimmed);
    }
  }

  private static class JobFile {
    private List<KpiEntry> kpis;
    @SerializedName("model_config")
    private ModelConfig modelConfig;
  }

  private static class KpiEntry {
    private String metric;
    @SerializedName("entity_name")
    private String entityName;
    private Boolean enable;
    private Map<String, Object> params;
  }

  private static class ModelConfig {
    static final String EXTRA_METRICS_PARAM = "extra_metrics";
    private Map<String, Object> params;
  }
}
