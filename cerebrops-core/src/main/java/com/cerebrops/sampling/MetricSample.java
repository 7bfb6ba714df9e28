/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.sampling;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import static com.cerebrops.CerebrOpsUtils.validateNotNull;


/**
 * One observation of the monitored application. A sample keeps its raw fields as reported, including fields
 * unknown to CerebrOps, so that anomalous samples can be reported back verbatim. Values of the
 * {@link MetricField canonical fields} may be missing or non-numeric; feature extraction coerces them.
 */
public class MetricSample {
  public static final String TIMESTAMP = "timestamp";
  private final Map<String, Object> _fields;

  public MetricSample(Map<String, ?> fields) {
    validateNotNull(fields, "Metric sample fields cannot be null.");
    _fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  /**
   * @return True if this sample carries a non-null timestamp field, false otherwise.
   */
  public boolean hasTimestamp() {
    return _fields.get(TIMESTAMP) != null;
  }

  /**
   * @return The raw timestamp of the sample (an ISO-8601 string or epoch milliseconds), or null if absent.
   */
  public Object timestamp() {
    return _fields.get(TIMESTAMP);
  }

  /**
   * @param field Canonical metric field.
   * @return The raw value of the given field, or null if absent.
   */
  public Object rawValue(MetricField field) {
    return _fields.get(field.fieldName());
  }

  /**
   * @return An unmodifiable view of all raw fields of this sample, in their original order.
   */
  public Map<String, Object> fields() {
    return _fields;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return _fields.equals(((MetricSample) o)._fields);
  }

  @Override
  public int hashCode() {
    return _fields.hashCode();
  }

  @Override
  public String toString() {
    return String.format("MetricSample%s", _fields);
  }
}
