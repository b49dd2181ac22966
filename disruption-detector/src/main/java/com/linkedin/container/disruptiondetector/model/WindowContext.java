/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.model;

import java.time.Duration;
import java.time.Instant;

import static com.linkedin.disruptiondetector.DisruptionDetectorUtils.utcDateFor;
import static com.linkedin.disruptiondetector.common.utils.Utils.validateNotNull;


/**
 * The {@code [start, end)} window of a fetch. The same window is reused by the root cause and trend lookups that follow
 * the fetch, so that they see the same data.
 */
public final class WindowContext {
  private final Instant _start;
  private final Instant _end;

  public WindowContext(Instant start, Instant end) {
    _start = validateNotNull(start, "Window start cannot be null.");
    _end = validateNotNull(end, "Window end cannot be null.");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException(String.format("Window end %s is before its start %s.", end, start));
    }
  }

  /**
   * @param end End of the window.
   * @param lookBackMinutes Length of the window in minutes.
   * @return The window of the given length that ends at the given time.
   */
  public static WindowContext lookingBack(Instant end, int lookBackMinutes) {
    return new WindowContext(end.minus(Duration.ofMinutes(lookBackMinutes)), end);
  }

  public Instant start() {
    return _start;
  }

  public Instant end() {
    return _end;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    WindowContext that = (WindowContext) o;
    return _start.equals(that._start) && _end.equals(that._end);
  }

  @Override
  public int hashCode() {
    return 31 * _start.hashCode() + _end.hashCode();
  }

  @Override
  public String toString() {
    return String.format("[%s, %s)", utcDateFor(_start.toEpochMilli()), utcDateFor(_end.toEpochMilli()));
  }
}
