/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops;

import com.cerebrops.sampling.MetricField;
import com.cerebrops.sampling.MetricSample;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;


/**
 * Test utils to create metric samples.
 */
public final class CerebrOpsUnitTestUtils {
  public static final double NORMAL_CPU_USAGE = 50.0;
  public static final double NORMAL_MEMORY_USAGE = 60.0;
  public static final double NORMAL_DISK_USAGE = 70.0;
  public static final double NORMAL_ERROR_RATE = 2.0;
  public static final double NORMAL_REQUEST_COUNT = 100.0;
  public static final double NORMAL_RESPONSE_TIME = 0.5;

  private CerebrOpsUnitTestUtils() {

  }

  /**
   * @param cpuUsage CPU usage of the sample.
   * @return A sample without timestamp whose other fields hold normal values.
   */
  public static MetricSample sampleWithCpu(double cpuUsage) {
    return sample(cpuUsage, NORMAL_MEMORY_USAGE, NORMAL_ERROR_RATE, NORMAL_RESPONSE_TIME);
  }

  /**
   * @return A sample without timestamp, with normal disk usage and request count.
   */
  public static MetricSample sample(double cpuUsage, double memoryUsage, double errorRate, double responseTime) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(MetricField.CPU_USAGE.fieldName(), cpuUsage);
    fields.put(MetricField.MEMORY_USAGE.fieldName(), memoryUsage);
    fields.put(MetricField.DISK_USAGE.fieldName(), NORMAL_DISK_USAGE);
    fields.put(MetricField.ERROR_RATE.fieldName(), errorRate);
    fields.put(MetricField.REQUEST_COUNT.fieldName(), NORMAL_REQUEST_COUNT);
    fields.put(MetricField.RESPONSE_TIME.fieldName(), responseTime);
    return new MetricSample(fields);
  }

  /**
   * @param count Number of samples.
   * @param cpuMean Mean CPU usage.
   * @param cpuStdDev Standard deviation of CPU usage.
   * @param random Random source.
   * @return Samples whose CPU usage is normally distributed and whose other fields hold normal values.
   */
  public static List<MetricSample> samplesWithNormalCpu(int count, double cpuMean, double cpuStdDev, Random random) {
    List<MetricSample> samples = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      samples.add(sampleWithCpu(cpuMean + cpuStdDev * random.nextGaussian()));
    }
    return samples;
  }
}
