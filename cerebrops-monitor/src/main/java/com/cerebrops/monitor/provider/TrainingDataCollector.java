/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.provider;

import com.cerebrops.exception.DataUnavailableException;
import com.cerebrops.exception.ProviderFailureException;
import com.cerebrops.sampling.MetricSample;
import java.util.ArrayList;
import java.util.List;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.cerebrops.CerebrOpsUtils.validateNotNull;


/**
 * Collects training samples by fetching metrics repeatedly with a fixed backoff between fetches. Failed fetches
 * are skipped; the collection fails only if no sample at all could be fetched.
 */
public class TrainingDataCollector {
  private static final Logger LOG = LoggerFactory.getLogger(TrainingDataCollector.class);
  private final MetricsProvider _metricsProvider;
  private final int _numFetches;
  private final long _fetchBackoffMs;
  private final Time _time;

  /**
   * @param metricsProvider Provider to fetch samples from.
   * @param numFetches Number of fetches per collection.
   * @param fetchBackoffMs Time to wait between two fetches.
   * @param time The time object.
   */
  public TrainingDataCollector(MetricsProvider metricsProvider, int numFetches, long fetchBackoffMs, Time time) {
    if (numFetches < 1) {
      throw new IllegalArgumentException("Number of fetches must be positive, got " + numFetches);
    }
    _metricsProvider = validateNotNull(metricsProvider, "Metrics provider cannot be null.");
    _numFetches = numFetches;
    _fetchBackoffMs = fetchBackoffMs;
    _time = time;
  }

  /**
   * @return All samples fetched during the collection, in fetch order.
   * @throws DataUnavailableException If no sample could be fetched.
   */
  public List<MetricSample> collect() throws DataUnavailableException {
    LOG.info("Collecting training samples with {} fetches.", _numFetches);
    List<MetricSample> samples = new ArrayList<>();
    int numFailedFetches = 0;
    for (int i = 0; i < _numFetches; i++) {
      try {
        samples.addAll(_metricsProvider.fetchMetrics());
      } catch (ProviderFailureException e) {
        numFailedFetches++;
        LOG.debug("Skipping failed training fetch {}/{}.", i + 1, _numFetches, e);
      }
      if (i < _numFetches - 1 && _fetchBackoffMs > 0) {
        _time.sleep(_fetchBackoffMs);
      }
    }
    if (samples.isEmpty()) {
      throw new DataUnavailableException(String.format("No training samples could be collected in %d fetches "
                                                       + "(%d failed).", _numFetches, numFailedFetches));
    }
    LOG.info("Collected {} training samples in {} fetches ({} failed).", samples.size(), _numFetches, numFailedFetches);
    return samples;
  }
}
