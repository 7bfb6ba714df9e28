/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.cerebrops.CerebrOpsUtils.validateNotNull;


/**
 * The outcome of one health check of the monitored application.
 */
public class HealthCheckResult {
  public static final String STATUS = "status";
  public static final String DETAILS = "details";
  public static final String RESPONSE_TIME = "response_time";
  public static final String ERROR = "error";
  public static final String UNKNOWN_HEALTH_ISSUE = "Unknown health issue";
  private final HealthStatus _status;
  private final Map<String, Object> _details;
  private final Double _latencySec;

  /**
   * @param status Health status.
   * @param details Raw details reported by or gathered about the application.
   * @param latencySec Latency of the health check in seconds, or null if the application could not be reached.
   */
  public HealthCheckResult(HealthStatus status, Map<String, ?> details, Double latencySec) {
    _status = validateNotNull(status, "Health status cannot be null.");
    _details = Collections.unmodifiableMap(new LinkedHashMap<>(validateNotNull(details, "Details cannot be null.")));
    _latencySec = latencySec;
  }

  /**
   * @param error Why the application is considered unhealthy.
   * @return An unhealthy result without latency.
   */
  public static HealthCheckResult unhealthy(String error) {
    return new HealthCheckResult(HealthStatus.UNHEALTHY, Collections.singletonMap(ERROR, error), null);
  }

  public HealthStatus status() {
    return _status;
  }

  public boolean isHealthy() {
    return _status == HealthStatus.HEALTHY;
  }

  public Map<String, Object> details() {
    return _details;
  }

  public Double latencySec() {
    return _latencySec;
  }

  /**
   * @return The reported error of an unhealthy application, or {@link #UNKNOWN_HEALTH_ISSUE} if none was reported.
   */
  public String error() {
    Object error = _details.get(ERROR);
    return error == null ? UNKNOWN_HEALTH_ISSUE : error.toString();
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> jsonStructure = new LinkedHashMap<>();
    jsonStructure.put(STATUS, _status.toString());
    jsonStructure.put(DETAILS, _details);
    if (_latencySec != null) {
      jsonStructure.put(RESPONSE_TIME, _latencySec);
    }
    return jsonStructure;
  }

  @Override
  public String toString() {
    return String.format("{status=%s, latency=%s, details=%s}", _status, _latencySec, _details);
  }
}
