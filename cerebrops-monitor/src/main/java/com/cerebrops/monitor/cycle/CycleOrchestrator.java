/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.cycle;

import com.cerebrops.detector.AnomalyReport;
import com.cerebrops.detector.AnomalySeverity;
import com.cerebrops.exception.CerebrOpsException;
import com.cerebrops.exception.DataUnavailableException;
import com.cerebrops.exception.ProviderFailureException;
import com.cerebrops.monitor.lifecycle.ModelLifecycle;
import com.cerebrops.monitor.notifier.AlertKind;
import com.cerebrops.monitor.notifier.AlertSink;
import com.cerebrops.monitor.provider.HealthCheckResult;
import com.cerebrops.monitor.provider.HealthStatus;
import com.cerebrops.monitor.provider.MetricsProvider;
import com.cerebrops.monitor.provider.SyntheticMetricsGenerator;
import com.cerebrops.monitor.provider.TrainingDataCollector;
import com.cerebrops.monitor.store.ResultStore;
import com.cerebrops.sampling.MetricSample;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.cerebrops.CerebrOpsUtils.validateNotNull;


/**
 * Runs monitoring cycles. One cycle executes the following steps strictly in order:
 * <ol>
 *   <li>Health check: an unhealthy application raises a {@link AlertKind#HEALTH_ALERT}.</li>
 *   <li>Fetch metrics: an empty fetch leaves the cycle without a detection report and a failed fetch records an
 *   error report; either way the cycle skips to persisting its result.</li>
 *   <li>Detect: score the samples against the active model.</li>
 *   <li>Alert dispatch: one {@link AlertKind#ANOMALY_ALERT} or {@link AlertKind#ERROR_ALERT} if detection found
 *   anomalies or failed.</li>
 *   <li>Retrain check: retrain the model on freshly collected samples when it is due. Failures are only logged.</li>
 *   <li>Persist: append the cycle result to the {@link ResultStore}. Failures are only logged.</li>
 * </ol>
 * An unexpected failure in any step ends the cycle with a {@link AlertKind#CRITICAL_ERROR_ALERT} and an error on
 * the cycle result, which is still persisted. Cycles never overlap: {@link #startMonitoring()} runs them one after
 * the other on the calling thread, waiting a fixed interval after each, until {@link #shutdown()} is called.
 */
public class CycleOrchestrator {
  private static final Logger LOG = LoggerFactory.getLogger(CycleOrchestrator.class);
  static final String CYCLE_ORCHESTRATOR_SENSOR = "CycleOrchestrator";
  static final String STARTED_MESSAGE = "CerebrOps monitoring system started successfully";
  static final String STOPPED_MESSAGE = "CerebrOps monitoring system stopped";
  static final String CRASHED_MESSAGE_PREFIX = "CerebrOps monitoring system crashed: ";
  static final String CYCLE_FAILED_MESSAGE_PREFIX = "Monitoring cycle failed: ";
  static final String DETECTION_FAILED_MESSAGE_PREFIX = "Anomaly detection failed: ";
  static final String DEGRADED_HEALTH = "degraded";
  static final String WARNING_HEALTH = "warning";
  private final MetricsProvider _metricsProvider;
  private final AlertSink _alertSink;
  private final ResultStore _resultStore;
  private final ModelLifecycle _modelLifecycle;
  private final TrainingDataCollector _trainingDataCollector;
  private final SyntheticMetricsGenerator _bootstrapGenerator;
  private final Time _time;
  private final long _monitoringIntervalMs;
  private final CountDownLatch _shutdownLatch;
  private volatile boolean _shutdown;
  private final Timer _cycleTimer;
  private final Meter _cycleFailureRate;
  private final Meter _anomalyRate;

  /**
   * @param metricsProvider Source of metric samples and health.
   * @param alertSink Destination of alerts.
   * @param resultStore Destination of cycle results.
   * @param modelLifecycle Holder of the active model.
   * @param trainingDataCollector Source of training samples.
   * @param bootstrapGenerator If not null, the generator of the samples the first model is trained on.
   * @param time The time object.
   * @param monitoringIntervalMs Time to wait after a cycle completes before the next one starts.
   * @param dropwizardMetricRegistry Registry of the cycle metrics.
   */
  public CycleOrchestrator(MetricsProvider metricsProvider,
                           AlertSink alertSink,
                           ResultStore resultStore,
                           ModelLifecycle modelLifecycle,
                           TrainingDataCollector trainingDataCollector,
                           SyntheticMetricsGenerator bootstrapGenerator,
                           Time time,
                           long monitoringIntervalMs,
                           MetricRegistry dropwizardMetricRegistry) {
    _metricsProvider = validateNotNull(metricsProvider, "Metrics provider cannot be null.");
    _alertSink = validateNotNull(alertSink, "Alert sink cannot be null.");
    _resultStore = validateNotNull(resultStore, "Result store cannot be null.");
    _modelLifecycle = validateNotNull(modelLifecycle, "Model lifecycle cannot be null.");
    _trainingDataCollector = validateNotNull(trainingDataCollector, "Training data collector cannot be null.");
    _bootstrapGenerator = bootstrapGenerator;
    _time = time;
    _monitoringIntervalMs = monitoringIntervalMs;
    _shutdownLatch = new CountDownLatch(1);
    _shutdown = false;
    _cycleTimer = dropwizardMetricRegistry.timer(MetricRegistry.name(CYCLE_ORCHESTRATOR_SENSOR, "cycle-timer"));
    _cycleFailureRate = dropwizardMetricRegistry.meter(MetricRegistry.name(CYCLE_ORCHESTRATOR_SENSOR, "cycle-failure-rate"));
    _anomalyRate = dropwizardMetricRegistry.meter(MetricRegistry.name(CYCLE_ORCHESTRATOR_SENSOR, "anomaly-rate"));
    dropwizardMetricRegistry.register(MetricRegistry.name(CYCLE_ORCHESTRATOR_SENSOR, "model-age-ms"),
                                      (Gauge<Long>) this::modelAgeMs);
  }

  /**
   * Train the initial model.
   *
   * @return True if a model was trained, false otherwise.
   */
  public boolean initialize() {
    LOG.info("Initializing anomaly detection model.");
    try {
      _modelLifecycle.retrain(trainingSamples());
      LOG.info("Monitoring system initialized successfully.");
      return true;
    } catch (CerebrOpsException | RuntimeException e) {
      LOG.error("Failed to initialize anomaly detection model.", e);
      return false;
    }
  }

  /**
   * Train the initial model and run one cycle.
   *
   * @return The result of the cycle, or an initialization failure if no model could be trained.
   */
  public CycleResult runSingleCheck() {
    if (!initialize()) {
      return CycleResult.initializationFailure(_time.milliseconds());
    }
    return runCycle();
  }

  /**
   * Train the initial model, then run cycles until {@link #shutdown()} is called or the calling thread is
   * interrupted. A started alert is sent before the first cycle and a stopped alert after the last one. If the
   * initial training fails, cycles still run and report detection errors until a retrain succeeds. Any other
   * failure sends a crashed alert followed by the stopped alert.
   */
  public void startMonitoring() {
    try {
      if (!initialize()) {
        LOG.error("Starting without a model, detection is unavailable until a retrain succeeds.");
      }
      LOG.info("Starting continuous monitoring with a {} ms interval.", _monitoringIntervalMs);
      notifyOperators(STARTED_MESSAGE, AnomalySeverity.LOW);
      while (!_shutdown) {
        long cycleStartMs = _time.milliseconds();
        CycleResult result = runCycle();
        LOG.info("Monitoring cycle completed in {} ms, alerts sent: {}.", _time.milliseconds() - cycleStartMs,
                 result.alertsSent());
        awaitNextCycle();
      }
      LOG.info("Monitoring stopped on request.");
    } catch (InterruptedException ie) {
      LOG.info("Monitoring interrupted.");
      Thread.currentThread().interrupt();
    } catch (Throwable t) {
      LOG.error("Monitoring loop failed.", t);
      notifyOperators(CRASHED_MESSAGE_PREFIX + describe(t), AnomalySeverity.CRITICAL);
    } finally {
      _shutdown = true;
      notifyOperators(STOPPED_MESSAGE, AnomalySeverity.MEDIUM);
    }
  }

  /**
   * Stop monitoring once the running cycle, if any, completes.
   */
  public void shutdown() {
    LOG.info("Shutting down monitoring.");
    _shutdown = true;
    _shutdownLatch.countDown();
  }

  public boolean isShutdown() {
    return _shutdown;
  }

  private void awaitNextCycle() throws InterruptedException {
    if (!_shutdown && _monitoringIntervalMs > 0) {
      _shutdownLatch.await(_monitoringIntervalMs, TimeUnit.MILLISECONDS);
    }
  }

  /**
   * Run one monitoring cycle and persist its result.
   *
   * @return The result of the cycle.
   */
  public CycleResult runCycle() {
    CycleResult result = new CycleResult(_time.milliseconds());
    final Timer.Context ctx = _cycleTimer.time();
    try {
      runSteps(result);
    } catch (Exception e) {
      LOG.error("Monitoring cycle failed.", e);
      _cycleFailureRate.mark();
      result.setError(describe(e));
      dispatch(result, AlertKind.CRITICAL_ERROR_ALERT, CYCLE_FAILED_MESSAGE_PREFIX + result.error(),
               AnomalySeverity.CRITICAL, null);
    } finally {
      ctx.stop();
    }
    persist(result);
    return result;
  }

  private void runSteps(CycleResult result) {
    HealthCheckResult health = checkHealth();
    result.setHealthCheck(health);
    if (!health.isHealthy()) {
      dispatch(result, AlertKind.HEALTH_ALERT, healthAlertMessage(health), healthAlertSeverity(health), null);
    }

    List<MetricSample> samples;
    try {
      samples = _metricsProvider.fetchMetrics();
    } catch (ProviderFailureException e) {
      LOG.warn("Failed to fetch metrics.", e);
      result.setAnomalyReport(AnomalyReport.error(_time.milliseconds(), "Failed to fetch metrics: " + e.getMessage()));
      return;
    }
    if (samples == null || samples.isEmpty()) {
      LOG.warn("No metrics data available.");
      return;
    }

    AnomalyReport report = _modelLifecycle.detect(samples, _time.milliseconds());
    result.setAnomalyReport(report);
    _anomalyRate.mark(report.anomalyCount());
    switch (report.status()) {
      case ANOMALY:
        LOG.warn("Anomalies detected: {}", report);
        dispatch(result, AlertKind.ANOMALY_ALERT, anomalyAlertMessage(report), report.severity(),
                 report.getJsonStructure());
        break;
      case ERROR:
        LOG.error("Anomaly detection error: {}", report.message());
        dispatch(result, AlertKind.ERROR_ALERT, DETECTION_FAILED_MESSAGE_PREFIX + report.message(),
                 AnomalySeverity.HIGH, null);
        break;
      default:
        LOG.info("No anomalies detected, system operating normally.");
        break;
    }

    maybeRetrain();
  }

  private HealthCheckResult checkHealth() {
    try {
      HealthCheckResult health = _metricsProvider.fetchHealth();
      LOG.debug("Health check: {}", health);
      return health;
    } catch (ProviderFailureException e) {
      LOG.error("Health check failed.", e);
      return HealthCheckResult.unhealthy(e.getMessage());
    }
  }

  private void maybeRetrain() {
    if (!_modelLifecycle.shouldRetrain(_time.milliseconds())) {
      return;
    }
    LOG.info("Model is due for retraining.");
    try {
      _modelLifecycle.retrain(trainingSamples());
    } catch (CerebrOpsException | RuntimeException e) {
      LOG.warn("Model retraining failed, the previous model keeps serving.", e);
    }
  }

  private List<MetricSample> trainingSamples() throws DataUnavailableException {
    if (_bootstrapGenerator != null && !_modelLifecycle.hasModel()) {
      LOG.info("Bootstrapping the model with synthetic samples.");
      return _bootstrapGenerator.generate(_time.milliseconds());
    }
    return _trainingDataCollector.collect();
  }

  private void persist(CycleResult result) {
    try {
      _resultStore.append(result);
    } catch (IOException | RuntimeException e) {
      LOG.error("Failed to save monitoring cycle result {}.", result, e);
    }
  }

  private void dispatch(CycleResult result, AlertKind alertKind, String message, AnomalySeverity severity,
                        Map<String, Object> payload) {
    if (sendAlert(message, severity, payload)) {
      result.addAlertSent(alertKind);
    } else {
      LOG.warn("Failed to deliver {}.", alertKind);
    }
  }

  private void notifyOperators(String message, AnomalySeverity severity) {
    if (!sendAlert(message, severity, null)) {
      LOG.warn("Failed to deliver notification: {}", message);
    }
  }

  private boolean sendAlert(String message, AnomalySeverity severity, Map<String, Object> payload) {
    try {
      return _alertSink.send(message, severity, payload);
    } catch (RuntimeException e) {
      LOG.warn("Alert sink failed to send alert.", e);
      return false;
    }
  }

  private long modelAgeMs() {
    Long lastTrainedAtMs = _modelLifecycle.state().lastTrainedAtMs();
    return lastTrainedAtMs == null ? -1L : _time.milliseconds() - lastTrainedAtMs;
  }

  static String healthAlertMessage(HealthCheckResult health) {
    String reported = reportedHealthStatus(health);
    String status = reported == null ? health.status().name() : reported.toUpperCase(Locale.ROOT);
    return String.format("Application Health Alert: %s\nDetails: %s", status, health.error());
  }

  /**
   * A degraded application alerts at medium severity and a warning at low severity. Anything else that is not
   * healthy is critical.
   */
  static AnomalySeverity healthAlertSeverity(HealthCheckResult health) {
    String reported = reportedHealthStatus(health);
    if (DEGRADED_HEALTH.equals(reported)) {
      return AnomalySeverity.MEDIUM;
    }
    if (WARNING_HEALTH.equals(reported)) {
      return AnomalySeverity.LOW;
    }
    return AnomalySeverity.CRITICAL;
  }

  // The status string the application reported, lower-cased, or null when it reported none or reported healthy.
  private static String reportedHealthStatus(HealthCheckResult health) {
    Object reported = health.details().get(HealthCheckResult.STATUS);
    if (reported == null) {
      return null;
    }
    String status = reported.toString().trim().toLowerCase(Locale.ROOT);
    return status.isEmpty() || HealthStatus.HEALTHY.name().toLowerCase(Locale.ROOT).equals(status) ? null : status;
  }

  static String anomalyAlertMessage(AnomalyReport report) {
    return String.format("CerebrOps detected %d anomalies (%s%% of data points)", report.anomalyCount(),
                         report.anomalyPercentage());
  }

  private static String describe(Throwable t) {
    return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
  }
}
