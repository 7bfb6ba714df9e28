/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.cycle;

import com.cerebrops.detector.AnomalyReport;
import com.cerebrops.monitor.notifier.AlertKind;
import com.cerebrops.monitor.provider.HealthCheckResult;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.cerebrops.CerebrOpsUtils.utcDateFor;


/**
 * The outcome of one monitoring cycle. Filled in step by step by the {@link CycleOrchestrator} that runs the
 * cycle and not modified after the cycle is persisted.
 */
public class CycleResult {
  public static final String TIMESTAMP = "timestamp";
  public static final String HEALTH_CHECK = "health_check";
  public static final String ANOMALY_DETECTION = "anomaly_detection";
  public static final String ALERTS_SENT = "alerts_sent";
  public static final String ERROR = "error";
  public static final String INITIALIZATION_FAILED_ERROR = "Failed to initialize monitoring system";
  private final long _timeMs;
  private final List<AlertKind> _alertsSent;
  private HealthCheckResult _healthCheck;
  private AnomalyReport _anomalyReport;
  private String _error;

  public CycleResult(long timeMs) {
    _timeMs = timeMs;
    _alertsSent = new ArrayList<>();
  }

  /**
   * @param timeMs Time in milliseconds.
   * @return The result of a single check that could not run because no model could be trained.
   */
  public static CycleResult initializationFailure(long timeMs) {
    CycleResult result = new CycleResult(timeMs);
    result.setError(INITIALIZATION_FAILED_ERROR);
    return result;
  }

  public long timeMs() {
    return _timeMs;
  }

  public HealthCheckResult healthCheck() {
    return _healthCheck;
  }

  void setHealthCheck(HealthCheckResult healthCheck) {
    _healthCheck = healthCheck;
  }

  /**
   * @return The detection report, or null if the cycle ended before detection.
   */
  public AnomalyReport anomalyReport() {
    return _anomalyReport;
  }

  void setAnomalyReport(AnomalyReport anomalyReport) {
    _anomalyReport = anomalyReport;
  }

  /**
   * @return Kinds of the alerts delivered during the cycle, in dispatch order.
   */
  public List<AlertKind> alertsSent() {
    return Collections.unmodifiableList(_alertsSent);
  }

  void addAlertSent(AlertKind alertKind) {
    _alertsSent.add(alertKind);
  }

  /**
   * @return The unexpected failure that ended the cycle, or null if there was none.
   */
  public String error() {
    return _error;
  }

  void setError(String error) {
    _error = error;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> jsonStructure = new LinkedHashMap<>();
    jsonStructure.put(TIMESTAMP, utcDateFor(_timeMs, 3, ChronoUnit.MILLIS));
    jsonStructure.put(HEALTH_CHECK, _healthCheck == null ? null : _healthCheck.getJsonStructure());
    jsonStructure.put(ANOMALY_DETECTION, _anomalyReport == null ? null : _anomalyReport.getJsonStructure());
    List<String> alertsSent = new ArrayList<>(_alertsSent.size());
    _alertsSent.forEach(kind -> alertsSent.add(kind.toString()));
    jsonStructure.put(ALERTS_SENT, alertsSent);
    if (_error != null) {
      jsonStructure.put(ERROR, _error);
    }
    return jsonStructure;
  }

  @Override
  public String toString() {
    return String.format("{time=%s, health=%s, detection=%s, alertsSent=%s%s}", utcDateFor(_timeMs), _healthCheck,
                         _anomalyReport, _alertsSent, _error == null ? "" : ", error=" + _error);
  }
}
