/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.model;

import com.linkedin.disruptiondetector.model.TimeSeries;
import java.util.List;


/**
 * The series of one KPI on one machine, with the window they were fetched for and the number of points a complete
 * series has in that window.
 */
public final class KpiTimeSeries {
  private final WindowContext _window;
  private final int _expectedPointLength;
  private final List<TimeSeries> _series;

  public KpiTimeSeries(WindowContext window, int expectedPointLength, List<TimeSeries> series) {
    _window = window;
    _expectedPointLength = expectedPointLength;
    _series = List.copyOf(series);
  }

  public WindowContext window() {
    return _window;
  }

  public int expectedPointLength() {
    return _expectedPointLength;
  }

  public List<TimeSeries> series() {
    return _series;
  }
}
