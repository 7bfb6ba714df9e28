/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.detector;

/**
 * Maps the share of flagged samples and the lowest decision score of a batch to a severity. Conditions are
 * evaluated from most to least severe and the first match wins.
 */
public final class SeverityClassifier {
  public static final double CRITICAL_PERCENTAGE = 20.0;
  public static final double HIGH_PERCENTAGE = 10.0;
  public static final double MEDIUM_PERCENTAGE = 5.0;
  public static final double CRITICAL_SCORE = -0.5;
  public static final double HIGH_SCORE = -0.3;
  public static final double MEDIUM_SCORE = -0.1;

  private SeverityClassifier() {

  }

  /**
   * @param anomalyPercentage Percentage of flagged samples in the batch, in [0, 100].
   * @param worstScore Lowest decision score in the batch.
   * @return The severity of the batch.
   */
  public static AnomalySeverity classify(double anomalyPercentage, double worstScore) {
    if (anomalyPercentage > CRITICAL_PERCENTAGE || worstScore < CRITICAL_SCORE) {
      return AnomalySeverity.CRITICAL;
    }
    if (anomalyPercentage > HIGH_PERCENTAGE || worstScore < HIGH_SCORE) {
      return AnomalySeverity.HIGH;
    }
    if (anomalyPercentage > MEDIUM_PERCENTAGE || worstScore < MEDIUM_SCORE) {
      return AnomalySeverity.MEDIUM;
    }
    return AnomalySeverity.LOW;
  }
}
