/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor;

import com.cerebrops.detector.AnomalyDetector;
import com.cerebrops.detector.forest.IsolationForest;
import com.cerebrops.monitor.config.CerebrOpsConfig;
import com.cerebrops.monitor.config.constants.AnomalyDetectorConfig;
import com.cerebrops.monitor.config.constants.MonitorConfig;
import com.cerebrops.monitor.cycle.CycleOrchestrator;
import com.cerebrops.monitor.cycle.CycleResult;
import com.cerebrops.monitor.lifecycle.ModelLifecycle;
import com.cerebrops.monitor.notifier.AlertSink;
import com.cerebrops.monitor.provider.MetricsProvider;
import com.cerebrops.monitor.provider.SyntheticFallbackMetricsProvider;
import com.cerebrops.monitor.provider.SyntheticMetricsGenerator;
import com.cerebrops.monitor.provider.TrainingDataCollector;
import com.cerebrops.monitor.store.ResultStore;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.utils.ThreadUtils;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Wires the monitoring components from a {@link CerebrOpsConfig} and runs them either continuously on a dedicated
 * thread or for a single check.
 */
public class CerebrOpsMonitorApp {
  private static final Logger LOG = LoggerFactory.getLogger(CerebrOpsMonitorApp.class);
  static final String METRIC_DOMAIN = "cerebrops";
  static final String MONITOR_THREAD_PATTERN = "cerebrops-monitor-%d";
  private static final long SHUTDOWN_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(30);

  private final CerebrOpsConfig _config;
  private final MetricRegistry _metricRegistry;
  private final JmxReporter _jmxReporter;
  private final MetricsProvider _metricsProvider;
  private final CycleOrchestrator _cycleOrchestrator;
  private final ExecutorService _monitorExecutor;

  public CerebrOpsMonitorApp(CerebrOpsConfig config) {
    this(config, Time.SYSTEM);
  }

  CerebrOpsMonitorApp(CerebrOpsConfig config, Time time) {
    _config = config;
    _metricRegistry = new MetricRegistry();
    _jmxReporter = JmxReporter.forRegistry(_metricRegistry).inDomain(METRIC_DOMAIN).build();
    _jmxReporter.start();

    long seed = config.getLong(AnomalyDetectorConfig.ANOMALY_DETECTION_RANDOM_SEED_CONFIG);
    MetricsProvider metricsProvider = config.getConfiguredInstance(MonitorConfig.METRICS_PROVIDER_CLASS_CONFIG,
                                                                   MetricsProvider.class);
    if (config.getBoolean(MonitorConfig.METRICS_PROVIDER_SYNTHETIC_FALLBACK_ENABLED_CONFIG)) {
      metricsProvider = new SyntheticFallbackMetricsProvider(metricsProvider, new SyntheticMetricsGenerator(seed), time);
    }
    _metricsProvider = metricsProvider;
    AlertSink alertSink = config.getConfiguredInstance(MonitorConfig.ALERT_SINK_CLASS_CONFIG, AlertSink.class);
    ResultStore resultStore = config.getConfiguredInstance(MonitorConfig.RESULT_STORE_CLASS_CONFIG, ResultStore.class);

    IsolationForest isolationForest =
        new IsolationForest(config.getInt(AnomalyDetectorConfig.ANOMALY_DETECTION_NUM_TREES_CONFIG),
                            config.getInt(AnomalyDetectorConfig.ANOMALY_DETECTION_MAX_SAMPLES_CONFIG),
                            config.getDouble(AnomalyDetectorConfig.ANOMALY_DETECTION_CONTAMINATION_CONFIG),
                            seed,
                            config.getInt(AnomalyDetectorConfig.ANOMALY_DETECTION_MIN_TRAINING_SAMPLES_CONFIG));
    ModelLifecycle modelLifecycle =
        new ModelLifecycle(new AnomalyDetector(isolationForest),
                           config.getLong(AnomalyDetectorConfig.MODEL_RETRAIN_INTERVAL_MS_CONFIG), time);
    TrainingDataCollector trainingDataCollector =
        new TrainingDataCollector(_metricsProvider,
                                  config.getInt(AnomalyDetectorConfig.MODEL_TRAINING_SAMPLE_COUNT_CONFIG),
                                  config.getLong(AnomalyDetectorConfig.MODEL_TRAINING_FETCH_BACKOFF_MS_CONFIG), time);
    SyntheticMetricsGenerator bootstrapGenerator =
        config.getBoolean(AnomalyDetectorConfig.MODEL_TRAINING_SYNTHETIC_BOOTSTRAP_ENABLED_CONFIG)
        ? new SyntheticMetricsGenerator(seed) : null;

    _cycleOrchestrator = new CycleOrchestrator(_metricsProvider, alertSink, resultStore, modelLifecycle,
                                               trainingDataCollector, bootstrapGenerator, time,
                                               config.getLong(MonitorConfig.MONITORING_INTERVAL_MS_CONFIG),
                                               _metricRegistry);
    _monitorExecutor = Executors.newSingleThreadExecutor(ThreadUtils.createThreadFactory(MONITOR_THREAD_PATTERN,
                                                                                         false));
  }

  /**
   * Start continuous monitoring on a dedicated non-daemon thread. The thread exits once monitoring ends, for
   * whatever reason.
   */
  public void start() {
    LOG.info("Starting CerebrOps monitoring of {}.", _config.getString(MonitorConfig.APP_URL_CONFIG));
    _monitorExecutor.execute(() -> {
      try {
        _cycleOrchestrator.startMonitoring();
      } finally {
        _monitorExecutor.shutdown();
      }
    });
  }

  /**
   * @return True once monitoring has stopped and its thread has exited.
   */
  boolean isTerminated() {
    return _monitorExecutor.isTerminated();
  }

  /**
   * Train a model and run one monitoring cycle on the calling thread.
   *
   * @return The result of the cycle.
   */
  public CycleResult runSingleCheck() {
    return _cycleOrchestrator.runSingleCheck();
  }

  void registerShutdownHook() {
    Runtime.getRuntime().addShutdownHook(new Thread(this::stop));
  }

  /**
   * Stops CerebrOps once the running cycle completes.
   */
  public void stop() {
    _cycleOrchestrator.shutdown();
    _monitorExecutor.shutdown();
    try {
      if (!_monitorExecutor.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        LOG.warn("Monitoring did not stop within {} ms.", SHUTDOWN_TIMEOUT_MS);
      }
    } catch (InterruptedException e) {
      LOG.warn("Interrupted while waiting for monitoring to stop.");
      Thread.currentThread().interrupt();
    }
    if (_metricsProvider instanceof Closeable) {
      try {
        ((Closeable) _metricsProvider).close();
      } catch (IOException e) {
        LOG.warn("Failed to close metrics provider.", e);
      }
    }
    _jmxReporter.close();
    LOG.info("CerebrOps stopped.");
  }
}
