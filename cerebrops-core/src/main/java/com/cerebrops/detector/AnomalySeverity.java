/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.detector;

import java.util.Collections;
import java.util.List;


/**
 * Ordered severity of an anomaly or an alert, from least to most severe.
 */
public enum AnomalySeverity {
  LOW, MEDIUM, HIGH, CRITICAL;

  private static final List<AnomalySeverity> CACHED_VALUES = Collections.unmodifiableList(List.of(values()));

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<AnomalySeverity> cachedValues() {
    return CACHED_VALUES;
  }

  /**
   * @param other Severity to compare to.
   * @return True if this severity is strictly more severe than the given one.
   */
  public boolean isMoreSevereThan(AnomalySeverity other) {
    return compareTo(other) > 0;
  }

  @Override
  public String toString() {
    return name().toLowerCase();
  }
}
