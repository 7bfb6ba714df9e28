/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.sampling;

import java.util.Collections;
import java.util.List;


/**
 * The canonical metric fields read from every {@link MetricSample}, in feature order.
 */
public enum MetricField {
  CPU_USAGE("cpu_usage"),
  MEMORY_USAGE("memory_usage"),
  DISK_USAGE("disk_usage"),
  ERROR_RATE("error_rate"),
  REQUEST_COUNT("request_count"),
  RESPONSE_TIME("response_time");

  private static final List<MetricField> CACHED_VALUES = Collections.unmodifiableList(List.of(values()));
  private final String _fieldName;

  MetricField(String fieldName) {
    _fieldName = fieldName;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<MetricField> cachedValues() {
    return CACHED_VALUES;
  }

  /**
   * @return The name of the field in a raw metric sample.
   */
  public String fieldName() {
    return _fieldName;
  }

  @Override
  public String toString() {
    return _fieldName;
  }
}
