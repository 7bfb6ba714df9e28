/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.detector;

import com.cerebrops.sampling.MetricSample;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.cerebrops.CerebrOpsUtils.round;
import static com.cerebrops.CerebrOpsUtils.utcDateFor;
import static com.cerebrops.CerebrOpsUtils.validateNotNull;


/**
 * The result of scoring one batch of metric samples. The anomaly percentage is always derived from the two
 * counts.
 */
public class AnomalyReport {
  public static final String STATUS = "status";
  public static final String TIMESTAMP = "timestamp";
  public static final String MESSAGE = "message";
  public static final String TOTAL_DATA_POINTS = "total_data_points";
  public static final String ANOMALY_COUNT = "anomaly_count";
  public static final String ANOMALY_PERCENTAGE = "anomaly_percentage";
  public static final String ANOMALOUS_DATA = "anomalous_data";
  public static final String SEVERITY = "severity";
  public static final String RECOMMENDATIONS = "recommendations";
  public static final String NO_DATA_MESSAGE = "No data to analyze";
  private final AnomalyStatus _status;
  private final long _timeMs;
  private final int _totalCount;
  private final List<MetricSample> _anomalousSamples;
  private final AnomalySeverity _severity;
  private final List<String> _recommendations;
  private final String _message;

  /**
   * @param status Outcome of the detection pass.
   * @param timeMs Time of the detection pass in milliseconds.
   * @param totalCount Number of scored samples.
   * @param anomalousSamples Flagged samples in batch order, as received.
   * @param severity Severity of the batch.
   * @param recommendations Operator guidance, must not be empty.
   * @param message Explanation for the no data and error outcomes, null otherwise.
   */
  public AnomalyReport(AnomalyStatus status,
                       long timeMs,
                       int totalCount,
                       List<MetricSample> anomalousSamples,
                       AnomalySeverity severity,
                       List<String> recommendations,
                       String message) {
    _status = validateNotNull(status, "Status cannot be null.");
    _severity = validateNotNull(severity, "Severity cannot be null.");
    validateNotNull(anomalousSamples, "Anomalous samples cannot be null.");
    if (anomalousSamples.size() > totalCount) {
      throw new IllegalArgumentException(String.format("Anomaly count %d exceeds total count %d.",
                                                       anomalousSamples.size(), totalCount));
    }
    if (validateNotNull(recommendations, "Recommendations cannot be null.").isEmpty()) {
      throw new IllegalArgumentException("Recommendations cannot be empty.");
    }
    _timeMs = timeMs;
    _totalCount = totalCount;
    _anomalousSamples = Collections.unmodifiableList(new ArrayList<>(anomalousSamples));
    _recommendations = Collections.unmodifiableList(new ArrayList<>(recommendations));
    _message = message;
  }

  /**
   * @param timeMs Time of the detection pass in milliseconds.
   * @return A report for an empty batch.
   */
  public static AnomalyReport noData(long timeMs) {
    return new AnomalyReport(AnomalyStatus.NO_DATA, timeMs, 0, Collections.emptyList(), AnomalySeverity.LOW,
                             RecommendationEngine.DEFAULT_RECOMMENDATIONS, NO_DATA_MESSAGE);
  }

  /**
   * @param timeMs Time of the detection pass in milliseconds.
   * @param message What went wrong.
   * @return A report for a failed detection pass.
   */
  public static AnomalyReport error(long timeMs, String message) {
    return new AnomalyReport(AnomalyStatus.ERROR, timeMs, 0, Collections.emptyList(), AnomalySeverity.LOW,
                             RecommendationEngine.DEFAULT_RECOMMENDATIONS, message);
  }

  public AnomalyStatus status() {
    return _status;
  }

  public long timeMs() {
    return _timeMs;
  }

  public int totalCount() {
    return _totalCount;
  }

  public int anomalyCount() {
    return _anomalousSamples.size();
  }

  /**
   * @return {@code 100 * anomalyCount / totalCount} rounded to two decimals, or 0 for an empty batch.
   */
  public double anomalyPercentage() {
    return _totalCount == 0 ? 0.0 : round(100.0 * anomalyCount() / _totalCount, 2);
  }

  public List<MetricSample> anomalousSamples() {
    return _anomalousSamples;
  }

  public AnomalySeverity severity() {
    return _severity;
  }

  public List<String> recommendations() {
    return _recommendations;
  }

  /**
   * @return Explanation for the no data and error outcomes, null otherwise.
   */
  public String message() {
    return _message;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> jsonStructure = new LinkedHashMap<>();
    jsonStructure.put(STATUS, _status.toString());
    jsonStructure.put(TIMESTAMP, utcDateFor(_timeMs, 3, ChronoUnit.MILLIS));
    if (_status == AnomalyStatus.NO_DATA || _status == AnomalyStatus.ERROR) {
      jsonStructure.put(MESSAGE, _message);
      return jsonStructure;
    }
    jsonStructure.put(TOTAL_DATA_POINTS, _totalCount);
    jsonStructure.put(ANOMALY_COUNT, anomalyCount());
    jsonStructure.put(ANOMALY_PERCENTAGE, anomalyPercentage());
    List<Map<String, Object>> anomalousData = new ArrayList<>(_anomalousSamples.size());
    _anomalousSamples.forEach(sample -> anomalousData.add(sample.fields()));
    jsonStructure.put(ANOMALOUS_DATA, anomalousData);
    jsonStructure.put(SEVERITY, _severity.toString());
    jsonStructure.put(RECOMMENDATIONS, _recommendations);
    return jsonStructure;
  }

  @Override
  public String toString() {
    return String.format("{status=%s, anomalies=%d/%d (%.2f%%), severity=%s, recommendations=%s%s}", _status,
                         anomalyCount(), _totalCount, anomalyPercentage(), _severity, _recommendations,
                         _message == null ? "" : ", message=" + _message);
  }
}
