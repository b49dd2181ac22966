/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.container.disruptiondetector.model;


/**
 * The look back window of a detection and the size of its trailing observation window.
 */
public final class WindowParam {
  public static final int DEFAULT_LOOK_BACK_MINUTES = 20;
  public static final int DEFAULT_OBS_SIZE = 6;
  private final int _lookBack;
  private final int _obsSize;

  public WindowParam() {
    this(DEFAULT_LOOK_BACK_MINUTES, DEFAULT_OBS_SIZE);
  }

  /**
   * @param lookBack Look back window in minutes.
   * @param obsSize Number of most recent points that are scored.
   */
  public WindowParam(int lookBack, int obsSize) {
    if (lookBack <= 0 || obsSize <= 0) {
      throw new IllegalArgumentException(String.format("Look back (%d) and observation size (%d) must be positive.",
                                                       lookBack, obsSize));
    }
    _lookBack = lookBack;
    _obsSize = obsSize;
  }

  public int lookBack() {
    return _lookBack;
  }

  public int obsSize() {
    return _obsSize;
  }

  @Override
  public String toString() {
    return String.format("WindowParam{lookBack=%d, obsSize=%d}", _lookBack, _obsSize);
  }
}
