/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.provider;

import com.cerebrops.exception.ProviderFailureException;
import com.cerebrops.sampling.MetricSample;
import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.cerebrops.CerebrOpsUtils.validateNotNull;


/**
 * Wraps another provider and substitutes generated samples when fetching metrics from it fails. Health checks are
 * never substituted.
 */
public class SyntheticFallbackMetricsProvider implements MetricsProvider, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(SyntheticFallbackMetricsProvider.class);
  private final MetricsProvider _delegate;
  private final SyntheticMetricsGenerator _generator;
  private final Time _time;

  public SyntheticFallbackMetricsProvider(MetricsProvider delegate, SyntheticMetricsGenerator generator, Time time) {
    _delegate = validateNotNull(delegate, "Delegate provider cannot be null.");
    _generator = validateNotNull(generator, "Generator cannot be null.");
    _time = time;
  }

  /**
   * The delegate is configured when it is instantiated, so this is a no-op.
   */
  @Override
  public void configure(Map<String, ?> configs) {
  }

  @Override
  public List<MetricSample> fetchMetrics() {
    try {
      return _delegate.fetchMetrics();
    } catch (ProviderFailureException e) {
      LOG.warn("Failed to fetch metrics ({}), substituting synthetic samples.", e.getMessage());
      return _generator.generate(_time.milliseconds());
    }
  }

  @Override
  public HealthCheckResult fetchHealth() throws ProviderFailureException {
    return _delegate.fetchHealth();
  }

  @Override
  public void close() throws IOException {
    if (_delegate instanceof Closeable) {
      ((Closeable) _delegate).close();
    }
  }
}
