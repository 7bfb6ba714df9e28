/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.detector;

import com.cerebrops.sampling.MetricSample;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static com.cerebrops.CerebrOpsUnitTestUtils.sampleWithCpu;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class AnomalyReportTest {

  private static AnomalyReport reportWith(int anomalyCount, int totalCount) {
    List<MetricSample> anomalous = Collections.nCopies(anomalyCount, sampleWithCpu(99.0));
    return new AnomalyReport(anomalyCount == 0 ? AnomalyStatus.NORMAL : AnomalyStatus.ANOMALY, 0L, totalCount,
                             anomalous, AnomalySeverity.LOW, RecommendationEngine.DEFAULT_RECOMMENDATIONS, null);
  }

  @Test
  public void testPercentageIsDerivedFromCounts() {
    assertEquals(33.33, reportWith(1, 3).anomalyPercentage(), 0.0);
    assertEquals(66.67, reportWith(2, 3).anomalyPercentage(), 0.0);
    assertEquals(9.09, reportWith(10, 110).anomalyPercentage(), 0.0);
    assertEquals(100.0, reportWith(7, 7).anomalyPercentage(), 0.0);
    // 0.125 is a tie and rounds to the even digit.
    assertEquals(0.12, reportWith(1, 800).anomalyPercentage(), 0.0);
    assertEquals(0.38, reportWith(3, 800).anomalyPercentage(), 0.0);
    assertEquals(0.0, reportWith(0, 5).anomalyPercentage(), 0.0);
    assertEquals(0.0, AnomalyReport.noData(0L).anomalyPercentage(), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAnomalyCountCannotExceedTotal() {
    reportWith(3, 2);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRecommendationsCannotBeEmpty() {
    new AnomalyReport(AnomalyStatus.NORMAL, 0L, 1, Collections.emptyList(), AnomalySeverity.LOW,
                      Collections.emptyList(), null);
  }

  @Test
  public void testJsonStructure() {
    Map<String, Object> json = reportWith(1, 4).getJsonStructure();
    assertEquals("anomaly", json.get(AnomalyReport.STATUS));
    assertEquals("1970-01-01T00:00:00.000Z", json.get(AnomalyReport.TIMESTAMP));
    assertEquals(4, json.get(AnomalyReport.TOTAL_DATA_POINTS));
    assertEquals(1, json.get(AnomalyReport.ANOMALY_COUNT));
    assertEquals(25.0, json.get(AnomalyReport.ANOMALY_PERCENTAGE));
    assertEquals("low", json.get(AnomalyReport.SEVERITY));
    assertEquals(1, ((List<?>) json.get(AnomalyReport.ANOMALOUS_DATA)).size());

    Map<String, Object> errorJson = AnomalyReport.error(0L, "boom").getJsonStructure();
    assertEquals("error", errorJson.get(AnomalyReport.STATUS));
    assertEquals("boom", errorJson.get(AnomalyReport.MESSAGE));
    assertFalse(errorJson.containsKey(AnomalyReport.ANOMALY_COUNT));
  }
}
