/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.detector;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

@RunWith(Parameterized.class)
public class SeverityClassifierTest {
  private final double _anomalyPercentage;
  private final double _worstScore;
  private final AnomalySeverity _expectedSeverity;

  public SeverityClassifierTest(double anomalyPercentage, double worstScore, AnomalySeverity expectedSeverity) {
    _anomalyPercentage = anomalyPercentage;
    _worstScore = worstScore;
    _expectedSeverity = expectedSeverity;
  }

  /**
   * Populate parameters for the {@link Parameterized} test.
   * @return Parameters for the {@link Parameterized} test.
   */
  @Parameterized.Parameters(name = "{index}: pct={0}, score={1} -> {2}")
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][]{
        {0.0, 0.1, AnomalySeverity.LOW},
        {5.0, -0.1, AnomalySeverity.LOW},
        {5.01, 0.0, AnomalySeverity.MEDIUM},
        {0.0, -0.11, AnomalySeverity.MEDIUM},
        {10.0, -0.3, AnomalySeverity.MEDIUM},
        {10.5, 0.0, AnomalySeverity.HIGH},
        {1.0, -0.31, AnomalySeverity.HIGH},
        {20.0, -0.5, AnomalySeverity.HIGH},
        {20.01, 0.2, AnomalySeverity.CRITICAL},
        {0.0, -0.51, AnomalySeverity.CRITICAL},
        {100.0, -1.0, AnomalySeverity.CRITICAL}
    });
  }

  @Test
  public void testClassify() {
    assertEquals(_expectedSeverity, SeverityClassifier.classify(_anomalyPercentage, _worstScore));
  }

  @Test
  public void testMonotonicity() {
    for (double score = 0.5; score >= -1.0; score -= 0.01) {
      AnomalySeverity previous = AnomalySeverity.LOW;
      for (double pct = 0.0; pct <= 100.0; pct += 0.25) {
        AnomalySeverity current = SeverityClassifier.classify(pct, score);
        assertFalse(previous.isMoreSevereThan(current));
        previous = current;
      }
    }
    for (double pct = 0.0; pct <= 100.0; pct += 0.25) {
      AnomalySeverity previous = AnomalySeverity.LOW;
      for (double score = 0.5; score >= -1.0; score -= 0.01) {
        AnomalySeverity current = SeverityClassifier.classify(pct, score);
        assertFalse(previous.isMoreSevereThan(current));
        previous = current;
      }
    }
  }
}
