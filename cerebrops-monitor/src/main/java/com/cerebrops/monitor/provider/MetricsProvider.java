/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.provider;

import com.cerebrops.exception.ProviderFailureException;
import com.cerebrops.monitor.config.CerebrOpsConfigurable;
import com.cerebrops.sampling.MetricSample;
import java.util.List;


/**
 * The source of metric samples and health of the monitored application.
 */
public interface MetricsProvider extends CerebrOpsConfigurable {

  /**
   * @return The current metric samples of the application, possibly empty.
   * @throws ProviderFailureException If the application cannot be reached or its response cannot be read.
   */
  List<MetricSample> fetchMetrics() throws ProviderFailureException;

  /**
   * @return The current health of the application.
   * @throws ProviderFailureException If the application cannot be reached or its response cannot be read.
   */
  HealthCheckResult fetchHealth() throws ProviderFailureException;
}
