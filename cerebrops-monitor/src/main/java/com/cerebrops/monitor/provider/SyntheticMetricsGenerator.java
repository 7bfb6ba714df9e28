/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.provider;

import com.cerebrops.sampling.MetricField;
import com.cerebrops.sampling.MetricSample;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;


/**
 * Generates labelled-by-construction sample data: a block of normally behaving samples one hour apart followed by
 * a smaller block of overloaded samples. Used to bootstrap a model when no history of the monitored application is
 * available and for demos.
 */
public class SyntheticMetricsGenerator {
  public static final int NUM_NORMAL_SAMPLES = 100;
  public static final int NUM_ANOMALOUS_SAMPLES = 10;
  private static final long NORMAL_SAMPLE_SPACING_MS = TimeUnit.HOURS.toMillis(1);
  private static final long ANOMALOUS_SAMPLE_SPACING_MS = TimeUnit.HOURS.toMillis(5);
  // {mean, standard deviation} per canonical field, in MetricField order.
  private static final double[][] NORMAL_PROFILE = {{50, 10}, {60, 8}, {70, 5}, {2, 1}, {100, 20}, {0.5, 0.2}};
  private static final double[][] ANOMALOUS_PROFILE = {{90, 5}, {85, 5}, {95, 2}, {15, 3}, {200, 30}, {2.0, 0.5}};
  private final long _seed;

  public SyntheticMetricsGenerator(long seed) {
    _seed = seed;
  }

  /**
   * Generate {@link #NUM_NORMAL_SAMPLES} normal and {@link #NUM_ANOMALOUS_SAMPLES} anomalous samples. The same seed
   * always yields the same values.
   *
   * @param nowMs Time of the most recent sample in milliseconds.
   * @return Normal samples followed by anomalous samples.
   */
  public List<MetricSample> generate(long nowMs) {
    RandomGenerator random = new Well19937c(_seed);
    List<MetricSample> samples = new ArrayList<>(NUM_NORMAL_SAMPLES + NUM_ANOMALOUS_SAMPLES);
    for (int i = 0; i < NUM_NORMAL_SAMPLES; i++) {
      samples.add(sample(random, NORMAL_PROFILE, nowMs - i * NORMAL_SAMPLE_SPACING_MS));
    }
    for (int i = 0; i < NUM_ANOMALOUS_SAMPLES; i++) {
      samples.add(sample(random, ANOMALOUS_PROFILE, nowMs - i * ANOMALOUS_SAMPLE_SPACING_MS));
    }
    return samples;
  }

  private static MetricSample sample(RandomGenerator random, double[][] profile, long timeMs) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(MetricSample.TIMESTAMP, LocalDateTime.ofInstant(Instant.ofEpochMilli(timeMs), ZoneOffset.UTC).toString());
    List<MetricField> metricFields = MetricField.cachedValues();
    for (int f = 0; f < metricFields.size(); f++) {
      fields.put(metricFields.get(f).fieldName(), profile[f][0] + profile[f][1] * random.nextGaussian());
    }
    return new MetricSample(fields);
  }
}
