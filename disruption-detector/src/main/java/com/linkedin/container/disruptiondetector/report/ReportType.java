/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.report;

/**
 * Flags whether a report describes healthy containers or disrupted ones.
 */
public enum ReportType {
  NORMAL, ANOMALY
}
