/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.provider;

import com.cerebrops.sampling.MetricField;
import com.cerebrops.sampling.MetricSample;
import java.util.List;
import org.junit.Test;

import static com.cerebrops.monitor.CerebrOpsMonitorUnitTestUtils.START_TIME_MS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class SyntheticMetricsGeneratorTest {

  @Test
  public void testGenerate() {
    List<MetricSample> samples = new SyntheticMetricsGenerator(42L).generate(START_TIME_MS);
    assertEquals(SyntheticMetricsGenerator.NUM_NORMAL_SAMPLES + SyntheticMetricsGenerator.NUM_ANOMALOUS_SAMPLES,
                 samples.size());
    for (MetricSample sample : samples) {
      assertTrue(sample.hasTimestamp());
      for (MetricField field : MetricField.cachedValues()) {
        assertTrue(sample.rawValue(field) instanceof Double);
      }
    }
    assertEquals("2023-11-14T22:13:20", samples.get(0).timestamp());
  }

  @Test
  public void testSameSeedSameSamples() {
    assertEquals(new SyntheticMetricsGenerator(7L).generate(START_TIME_MS),
                 new SyntheticMetricsGenerator(7L).generate(START_TIME_MS));
    assertNotEquals(new SyntheticMetricsGenerator(7L).generate(START_TIME_MS),
                    new SyntheticMetricsGenerator(8L).generate(START_TIME_MS));
  }

  @Test
  public void testAnomalousBlockIsOverloaded() {
    List<MetricSample> samples = new SyntheticMetricsGenerator(42L).generate(START_TIME_MS);
    double normalCpu = meanCpu(samples.subList(0, SyntheticMetricsGenerator.NUM_NORMAL_SAMPLES));
    double anomalousCpu = meanCpu(samples.subList(SyntheticMetricsGenerator.NUM_NORMAL_SAMPLES, samples.size()));
    assertTrue(normalCpu < 60.0);
    assertTrue(anomalousCpu > 80.0);
  }

  private static double meanCpu(List<MetricSample> samples) {
    double sum = 0.0;
    for (MetricSample sample : samples) {
      sum += (Double) sample.rawValue(MetricField.CPU_USAGE);
    }
    return sum / samples.size();
  }
}
