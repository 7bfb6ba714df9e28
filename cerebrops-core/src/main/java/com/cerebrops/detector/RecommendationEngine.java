/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.detector;

import com.cerebrops.sampling.MetricField;
import com.cerebrops.sampling.MetricSample;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import static com.cerebrops.detector.feature.FeatureExtractor.toDouble;


/**
 * Derives operator guidance from the mean metric values of the flagged samples only. Recommendations are emitted
 * in a fixed order: CPU, memory, error rate, latency.
 */
public final class RecommendationEngine {
  public static final double CPU_USAGE_THRESHOLD = 80.0;
  public static final double MEMORY_USAGE_THRESHOLD = 80.0;
  public static final double ERROR_RATE_THRESHOLD = 10.0;
  public static final double RESPONSE_TIME_THRESHOLD = 2.0;
  public static final String HIGH_CPU_RECOMMENDATION =
      "High CPU usage detected. Consider scaling up or optimizing processes.";
  public static final String HIGH_MEMORY_RECOMMENDATION =
      "High memory usage detected. Check for memory leaks or increase memory allocation.";
  public static final String HIGH_ERROR_RATE_RECOMMENDATION =
      "High error rate detected. Review application logs and fix critical issues.";
  public static final String SLOW_RESPONSE_RECOMMENDATION =
      "Slow response times detected. Optimize database queries and API calls.";
  public static final String NORMAL_OPERATION_RECOMMENDATION = "System appears to be operating normally.";
  public static final List<String> DEFAULT_RECOMMENDATIONS = Collections.singletonList(NORMAL_OPERATION_RECOMMENDATION);

  private RecommendationEngine() {

  }

  /**
   * @param outliers Flagged samples of a batch.
   * @return The recommendations for the given samples, never empty.
   */
  public static List<String> recommendations(List<MetricSample> outliers) {
    if (outliers.isEmpty()) {
      return DEFAULT_RECOMMENDATIONS;
    }
    List<String> recommendations = new ArrayList<>(4);
    if (mean(outliers, MetricField.CPU_USAGE) > CPU_USAGE_THRESHOLD) {
      recommendations.add(HIGH_CPU_RECOMMENDATION);
    }
    if (mean(outliers, MetricField.MEMORY_USAGE) > MEMORY_USAGE_THRESHOLD) {
      recommendations.add(HIGH_MEMORY_RECOMMENDATION);
    }
    if (mean(outliers, MetricField.ERROR_RATE) > ERROR_RATE_THRESHOLD) {
      recommendations.add(HIGH_ERROR_RATE_RECOMMENDATION);
    }
    if (mean(outliers, MetricField.RESPONSE_TIME) > RESPONSE_TIME_THRESHOLD) {
      recommendations.add(SLOW_RESPONSE_RECOMMENDATION);
    }
    return recommendations.isEmpty() ? DEFAULT_RECOMMENDATIONS : Collections.unmodifiableList(recommendations);
  }

  private static double mean(List<MetricSample> samples, MetricField field) {
    SummaryStatistics stats = new SummaryStatistics();
    samples.forEach(sample -> stats.addValue(toDouble(sample.rawValue(field))));
    return stats.getMean();
  }
}
