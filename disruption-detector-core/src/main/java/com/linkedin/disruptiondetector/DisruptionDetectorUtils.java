/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.disruptiondetector;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoUnit;

import static com.linkedin.disruptiondetector.common.utils.Utils.validateNotNull;

/**
 * Utils class for the disruption detector
 */
public final class DisruptionDetectorUtils {
  private DisruptionDetectorUtils() {

  }

  /**
   * Ensure that the given String value of the given String key is not {@code null} or empty.
   *
   * @param key The key corresponding to the given String value.
   * @param value String value to be checked for being non-empty.
   */
  public static void ensureValidString(String key, String value) {
    validateNotNull(value, () -> key + " cannot be null");
    if (value.isEmpty()) {
      throw new IllegalArgumentException(key + " cannot be empty");
    }
  }

  /**
   * @param timeMs Time in milliseconds.
   * @return The date for the given time in ISO 8601 format with date, hour, minute, and seconds.
   */
  public static String utcDateFor(long timeMs) {
    DateTimeFormatter formatter = new DateTimeFormatterBuilder().appendInstant(0).toFormatter();
    return formatter.format(Instant.ofEpochMilli(timeMs).truncatedTo(ChronoUnit.SECONDS));
  }
}
