/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.cycle;

import com.cerebrops.detector.AnomalyDetector;
import com.cerebrops.detector.AnomalyReport;
import com.cerebrops.detector.AnomalySeverity;
import com.cerebrops.detector.AnomalyStatus;
import com.cerebrops.detector.RecommendationEngine;
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
import com.codahale.metrics.MetricRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.utils.MockTime;
import org.easymock.Capture;
import org.easymock.EasyMock;
import org.junit.Before;
import org.junit.Test;

import static com.cerebrops.monitor.CerebrOpsMonitorUnitTestUtils.START_TIME_MS;
import static com.cerebrops.monitor.CerebrOpsMonitorUnitTestUtils.sampleWithCpu;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class CycleOrchestratorTest {
  private static final HealthCheckResult HEALTHY = new HealthCheckResult(HealthStatus.HEALTHY,
                                                                         Map.of("status", "healthy"), 0.01);
  private MockTime _time;
  private MetricsProvider _metricsProvider;
  private AlertSink _alertSink;
  private ResultStore _resultStore;
  private ModelLifecycle _modelLifecycle;
  private TrainingDataCollector _trainingDataCollector;
  private Capture<CycleResult> _persisted;

  /**
   * Setup the test.
   */
  @Before
  public void setup() {
    _time = new MockTime(0, START_TIME_MS, TimeUnit.NANOSECONDS.convert(START_TIME_MS, TimeUnit.MILLISECONDS));
    _metricsProvider = EasyMock.mock(MetricsProvider.class);
    _alertSink = EasyMock.mock(AlertSink.class);
    _resultStore = EasyMock.mock(ResultStore.class);
    _modelLifecycle = EasyMock.mock(ModelLifecycle.class);
    _trainingDataCollector = EasyMock.mock(TrainingDataCollector.class);
    _persisted = EasyMock.newCapture();
  }

  private CycleOrchestrator orchestrator() {
    return new CycleOrchestrator(_metricsProvider, _alertSink, _resultStore, _modelLifecycle, _trainingDataCollector,
                                 null, _time, 0L, new MetricRegistry());
  }

  private void expectPersist() throws IOException {
    _resultStore.append(EasyMock.capture(_persisted));
    EasyMock.expectLastCall().once();
  }

  private void replayMocks() {
    EasyMock.replay(_metricsProvider, _alertSink, _resultStore, _modelLifecycle, _trainingDataCollector);
  }

  private void verifyMocks() {
    EasyMock.verify(_metricsProvider, _alertSink, _resultStore, _modelLifecycle, _trainingDataCollector);
  }

  private static AnomalyReport anomalyReport(List<MetricSample> samples) {
    return new AnomalyReport(AnomalyStatus.ANOMALY, START_TIME_MS, samples.size(), samples.subList(0, 1),
                             AnomalySeverity.HIGH, List.of(RecommendationEngine.HIGH_CPU_RECOMMENDATION), null);
  }

  @Test
  public void testEmptyFetchSkipsDetectionAndAlerts() throws Exception {
    EasyMock.expect(_metricsProvider.fetchHealth()).andReturn(HEALTHY);
    EasyMock.expect(_metricsProvider.fetchMetrics()).andReturn(Collections.emptyList());
    expectPersist();
    replayMocks();

    CycleResult result = orchestrator().runCycle();
    verifyMocks();
    assertSame(HEALTHY, result.healthCheck());
    assertNull(result.anomalyReport());
    assertNull(result.error());
    assertTrue(result.alertsSent().isEmpty());
    assertSame(result, _persisted.getValue());
    assertNull(result.getJsonStructure().get(CycleResult.ANOMALY_DETECTION));
    assertTrue(result.getJsonStructure().containsKey(CycleResult.ANOMALY_DETECTION));
  }

  @Test
  public void testUnhealthyApplicationRaisesOnlyHealthAlertOnEmptyFetch() throws Exception {
    EasyMock.expect(_metricsProvider.fetchHealth()).andThrow(new ProviderFailureException("connection refused"));
    EasyMock.expect(_alertSink.send(EasyMock.eq("Application Health Alert: UNHEALTHY\nDetails: connection refused"),
                                    EasyMock.eq(AnomalySeverity.CRITICAL), EasyMock.isNull())).andReturn(true);
    EasyMock.expect(_metricsProvider.fetchMetrics()).andReturn(Collections.emptyList());
    expectPersist();
    replayMocks();

    CycleResult result = orchestrator().runCycle();
    verifyMocks();
    assertEquals(HealthStatus.UNHEALTHY, result.healthCheck().status());
    assertEquals(List.of(AlertKind.HEALTH_ALERT), result.alertsSent());
    assertNull(result.anomalyReport());
  }

  @Test
  public void testAnomalyRaisesAnomalyAlert() throws Exception {
    List<MetricSample> samples = List.of(sampleWithCpu(99.0), sampleWithCpu(50.0));
    AnomalyReport report = anomalyReport(samples);
    EasyMock.expect(_metricsProvider.fetchHealth()).andReturn(HEALTHY);
    EasyMock.expect(_metricsProvider.fetchMetrics()).andReturn(samples);
    EasyMock.expect(_modelLifecycle.detect(EasyMock.eq(samples), EasyMock.anyLong())).andReturn(report);
    EasyMock.expect(_alertSink.send(EasyMock.eq("CerebrOps detected 1 anomalies (50.0% of data points)"),
                                    EasyMock.eq(AnomalySeverity.HIGH), EasyMock.notNull())).andReturn(true);
    EasyMock.expect(_modelLifecycle.shouldRetrain(EasyMock.anyLong())).andReturn(false);
    expectPersist();
    replayMocks();

    CycleResult result = orchestrator().runCycle();
    verifyMocks();
    assertSame(report, result.anomalyReport());
    assertEquals(List.of(AlertKind.ANOMALY_ALERT), result.alertsSent());
  }

  @Test
  public void testDetectionErrorRaisesErrorAlert() throws Exception {
    List<MetricSample> samples = List.of(sampleWithCpu(50.0));
    EasyMock.expect(_metricsProvider.fetchHealth()).andReturn(HEALTHY);
    EasyMock.expect(_metricsProvider.fetchMetrics()).andReturn(samples);
    EasyMock.expect(_modelLifecycle.detect(EasyMock.eq(samples), EasyMock.anyLong()))
            .andReturn(AnomalyReport.error(START_TIME_MS, "Model not trained."));
    EasyMock.expect(_alertSink.send(EasyMock.eq("Anomaly detection failed: Model not trained."),
                                    EasyMock.eq(AnomalySeverity.HIGH), EasyMock.isNull())).andReturn(true);
    EasyMock.expect(_modelLifecycle.shouldRetrain(EasyMock.anyLong())).andReturn(false);
    expectPersist();
    replayMocks();

    CycleResult result = orchestrator().runCycle();
    verifyMocks();
    assertEquals(AnomalyStatus.ERROR, result.anomalyReport().status());
    assertEquals(List.of(AlertKind.ERROR_ALERT), result.alertsSent());
  }

  @Test
  public void testNormalBatchRaisesNoAlert() throws Exception {
    List<MetricSample> samples = List.of(sampleWithCpu(50.0));
    AnomalyReport normal = new AnomalyReport(AnomalyStatus.NORMAL, START_TIME_MS, 1, Collections.emptyList(),
                                             AnomalySeverity.LOW, RecommendationEngine.DEFAULT_RECOMMENDATIONS, null);
    EasyMock.expect(_metricsProvider.fetchHealth()).andReturn(HEALTHY);
    EasyMock.expect(_metricsProvider.fetchMetrics()).andReturn(samples);
    EasyMock.expect(_modelLifecycle.detect(EasyMock.eq(samples), EasyMock.anyLong())).andReturn(normal);
    EasyMock.expect(_modelLifecycle.shouldRetrain(EasyMock.anyLong())).andReturn(false);
    expectPersist();
    replayMocks();

    CycleResult result = orchestrator().runCycle();
    verifyMocks();
    assertTrue(result.alertsSent().isEmpty());
  }

  @Test
  public void testFetchFailureRecordsErrorAndSkipsDetection() throws Exception {
    EasyMock.expect(_metricsProvider.fetchHealth()).andReturn(HEALTHY);
    EasyMock.expect(_metricsProvider.fetchMetrics()).andThrow(new ProviderFailureException("HTTP 500"));
    expectPersist();
    replayMocks();

    CycleResult result = orchestrator().runCycle();
    verifyMocks();
    assertEquals(AnomalyStatus.ERROR, result.anomalyReport().status());
    assertTrue(result.anomalyReport().message().contains("HTTP 500"));
    assertTrue(result.alertsSent().isEmpty());
  }

  @Test
  public void testUnexpectedFailureRaisesCriticalAlertAndIsPersisted() throws Exception {
    EasyMock.expect(_metricsProvider.fetchHealth()).andReturn(HEALTHY);
    EasyMock.expect(_metricsProvider.fetchMetrics()).andThrow(new IllegalStateException("boom"));
    EasyMock.expect(_alertSink.send(EasyMock.eq("Monitoring cycle failed: boom"), EasyMock.eq(AnomalySeverity.CRITICAL),
                                    EasyMock.isNull())).andReturn(true);
    expectPersist();
    replayMocks();

    CycleResult result = orchestrator().runCycle();
    verifyMocks();
    assertEquals("boom", result.error());
    assertEquals(List.of(AlertKind.CRITICAL_ERROR_ALERT), result.alertsSent());
    assertEquals("boom", _persisted.getValue().getJsonStructure().get(CycleResult.ERROR));
  }

  @Test
  public void testFailedAlertIsNotRecorded() throws Exception {
    EasyMock.expect(_metricsProvider.fetchHealth()).andReturn(HealthCheckResult.unhealthy("down"));
    EasyMock.expect(_alertSink.send(EasyMock.anyString(), EasyMock.eq(AnomalySeverity.CRITICAL), EasyMock.isNull()))
            .andThrow(new IllegalStateException("sink is down"));
    EasyMock.expect(_metricsProvider.fetchMetrics()).andReturn(Collections.emptyList());
    expectPersist();
    replayMocks();

    CycleResult result = orchestrator().runCycle();
    verifyMocks();
    assertTrue(result.alertsSent().isEmpty());
    assertNull(result.error());
  }

  @Test
  public void testPersistFailureIsNotACycleFailure() throws Exception {
    EasyMock.expect(_metricsProvider.fetchHealth()).andReturn(HEALTHY);
    EasyMock.expect(_metricsProvider.fetchMetrics()).andReturn(Collections.emptyList());
    _resultStore.append(EasyMock.anyObject());
    EasyMock.expectLastCall().andThrow(new IOException("disk full"));
    replayMocks();

    CycleResult result = orchestrator().runCycle();
    verifyMocks();
    assertNull(result.error());
  }

  @Test
  public void testRetrainFailureIsOnlyLogged() throws Exception {
    List<MetricSample> samples = List.of(sampleWithCpu(50.0));
    EasyMock.expect(_metricsProvider.fetchHealth()).andReturn(HEALTHY);
    EasyMock.expect(_metricsProvider.fetchMetrics()).andReturn(samples);
    EasyMock.expect(_modelLifecycle.detect(EasyMock.eq(samples), EasyMock.anyLong()))
            .andReturn(AnomalyReport.error(START_TIME_MS, "Model not trained."));
    EasyMock.expect(_alertSink.send(EasyMock.anyString(), EasyMock.eq(AnomalySeverity.HIGH), EasyMock.isNull()))
            .andReturn(true);
    EasyMock.expect(_modelLifecycle.shouldRetrain(EasyMock.anyLong())).andReturn(true);
    EasyMock.expect(_trainingDataCollector.collect()).andThrow(new DataUnavailableException("nothing"));
    expectPersist();
    replayMocks();

    CycleResult result = orchestrator().runCycle();
    verifyMocks();
    assertNull(result.error());
    assertEquals(List.of(AlertKind.ERROR_ALERT), result.alertsSent());
  }

  @Test
  public void testSingleCheckInitializationFailure() throws Exception {
    EasyMock.expect(_trainingDataCollector.collect()).andThrow(new DataUnavailableException("nothing"));
    replayMocks();

    CycleResult result = orchestrator().runSingleCheck();
    verifyMocks();
    assertEquals(CycleResult.INITIALIZATION_FAILED_ERROR, result.error());
    assertNull(result.healthCheck());
  }

  @Test
  public void testSingleCheckUncheckedInitializationFailure() throws Exception {
    EasyMock.expect(_trainingDataCollector.collect())
            .andThrow(new IllegalStateException("metrics endpoint misconfigured"));
    replayMocks();

    CycleResult result = orchestrator().runSingleCheck();
    verifyMocks();
    assertEquals(CycleResult.INITIALIZATION_FAILED_ERROR, result.error());
    assertNull(result.healthCheck());
  }

  @Test
  public void testUncheckedInitialTrainingFailureStillMonitors() {
    RecordingAlertSink alertSink = new RecordingAlertSink();
    ShutdownAfterCyclesStore store = new ShutdownAfterCyclesStore(2);
    FlakyStartMetricsProvider provider =
        new FlakyStartMetricsProvider(new IllegalStateException("metrics endpoint misconfigured"));
    CycleOrchestrator orchestrator = continuousOrchestrator(alertSink, store, provider, null);
    store._orchestrator = orchestrator;

    orchestrator.startMonitoring();
    assertTrue(orchestrator.isShutdown());
    assertEquals(2, store._results.size());
    assertEquals(List.of(CycleOrchestrator.STARTED_MESSAGE, CycleOrchestrator.STOPPED_MESSAGE), alertSink._messages);
    for (CycleResult result : store._results) {
      assertNull(result.error());
    }
  }

  @Test
  public void testInitializationErrorRaisesCrashAlertBeforeStopping() {
    RecordingAlertSink alertSink = new RecordingAlertSink();
    ShutdownAfterCyclesStore store = new ShutdownAfterCyclesStore(1);
    FlakyStartMetricsProvider provider = new FlakyStartMetricsProvider(new AssertionError("training blew up"));
    CycleOrchestrator orchestrator = continuousOrchestrator(alertSink, store, provider, null);
    store._orchestrator = orchestrator;

    orchestrator.startMonitoring();
    assertTrue(orchestrator.isShutdown());
    assertTrue(store._results.isEmpty());
    assertEquals(List.of(CycleOrchestrator.CRASHED_MESSAGE_PREFIX + "training blew up",
                         CycleOrchestrator.STOPPED_MESSAGE), alertSink._messages);
    assertEquals(List.of(AnomalySeverity.CRITICAL, AnomalySeverity.MEDIUM), alertSink._severities);
  }

  @Test
  public void testDegradedApplicationRaisesMediumHealthAlert() throws Exception {
    HealthCheckResult degraded = new HealthCheckResult(HealthStatus.UNHEALTHY,
                                                       Map.of("status", "degraded", "error", "slow db"), 0.2);
    EasyMock.expect(_metricsProvider.fetchHealth()).andReturn(degraded);
    EasyMock.expect(_alertSink.send(EasyMock.eq("Application Health Alert: DEGRADED\nDetails: slow db"),
                                    EasyMock.eq(AnomalySeverity.MEDIUM), EasyMock.isNull())).andReturn(true);
    EasyMock.expect(_metricsProvider.fetchMetrics()).andReturn(Collections.emptyList());
    expectPersist();
    replayMocks();

    CycleResult result = orchestrator().runCycle();
    verifyMocks();
    assertEquals(List.of(AlertKind.HEALTH_ALERT), result.alertsSent());
  }

  @Test
  public void testHealthAlertSeverityFollowsReportedStatus() {
    assertEquals(AnomalySeverity.LOW, CycleOrchestrator.healthAlertSeverity(
        new HealthCheckResult(HealthStatus.UNHEALTHY, Map.of("status", "Warning"), 0.1)));
    assertEquals(AnomalySeverity.CRITICAL, CycleOrchestrator.healthAlertSeverity(
        new HealthCheckResult(HealthStatus.UNHEALTHY, Map.of("status", "unhealthy"), 0.1)));
    assertEquals(AnomalySeverity.CRITICAL, CycleOrchestrator.healthAlertSeverity(HealthCheckResult.unhealthy("down")));
    assertEquals("Application Health Alert: WARNING\nDetails: " + HealthCheckResult.UNKNOWN_HEALTH_ISSUE,
                 CycleOrchestrator.healthAlertMessage(
                     new HealthCheckResult(HealthStatus.UNHEALTHY, Map.of("status", "Warning"), 0.1)));
  }

  @Test
  public void testContinuousMonitoringStartsAndStops() {
    RecordingAlertSink alertSink = new RecordingAlertSink();
    ShutdownAfterCyclesStore store = new ShutdownAfterCyclesStore(3);
    CycleOrchestrator orchestrator = continuousOrchestrator(alertSink, store);
    store._orchestrator = orchestrator;

    orchestrator.startMonitoring();
    assertTrue(orchestrator.isShutdown());
    assertEquals(3, store._results.size());
    assertEquals(List.of(CycleOrchestrator.STARTED_MESSAGE, CycleOrchestrator.STOPPED_MESSAGE), alertSink._messages);
    assertEquals(List.of(AnomalySeverity.LOW, AnomalySeverity.MEDIUM), alertSink._severities);
    for (CycleResult result : store._results) {
      assertSame(HEALTHY, result.healthCheck());
      assertNull(result.anomalyReport());
    }
  }

  @Test
  public void testLoopFailureRaisesCrashAlertBeforeStopping() {
    RecordingAlertSink alertSink = new RecordingAlertSink();
    ResultStore failingStore = new ResultStore() {
      @Override
      public void configure(Map<String, ?> configs) {
      }

      @Override
      public void append(CycleResult cycleResult) {
        throw new AssertionError("disk on fire");
      }
    };
    CycleOrchestrator orchestrator = continuousOrchestrator(alertSink, failingStore);

    orchestrator.startMonitoring();
    assertEquals(List.of(CycleOrchestrator.STARTED_MESSAGE, CycleOrchestrator.CRASHED_MESSAGE_PREFIX + "disk on fire",
                         CycleOrchestrator.STOPPED_MESSAGE), alertSink._messages);
    assertEquals(AnomalySeverity.CRITICAL, alertSink._severities.get(1));
  }

  private CycleOrchestrator continuousOrchestrator(AlertSink alertSink, ResultStore store) {
    return continuousOrchestrator(alertSink, store, new FlakyStartMetricsProvider(null),
                                  new SyntheticMetricsGenerator(42L));
  }

  private CycleOrchestrator continuousOrchestrator(AlertSink alertSink, ResultStore store, MetricsProvider provider,
                                                   SyntheticMetricsGenerator bootstrapGenerator) {
    ModelLifecycle modelLifecycle = new ModelLifecycle(new AnomalyDetector(), TimeUnit.DAYS.toMillis(1), _time);
    TrainingDataCollector collector = new TrainingDataCollector(provider, 20, 0L, _time);
    return new CycleOrchestrator(provider, alertSink, store, modelLifecycle, collector,
                                 bootstrapGenerator, _time, 1L, new MetricRegistry());
  }

  /**
   * Healthy provider whose first fetch throws the given failure, if any. Later fetches return nothing.
   */
  private static class FlakyStartMetricsProvider implements MetricsProvider {
    private final Throwable _firstFetchFailure;
    private int _numFetches = 0;

    FlakyStartMetricsProvider(Throwable firstFetchFailure) {
      _firstFetchFailure = firstFetchFailure;
    }

    @Override
    public void configure(Map<String, ?> configs) {
    }

    @Override
    public List<MetricSample> fetchMetrics() {
      _numFetches++;
      if (_numFetches == 1 && _firstFetchFailure instanceof RuntimeException) {
        throw (RuntimeException) _firstFetchFailure;
      }
      if (_numFetches == 1 && _firstFetchFailure instanceof Error) {
        throw (Error) _firstFetchFailure;
      }
      return Collections.emptyList();
    }

    @Override
    public HealthCheckResult fetchHealth() {
      return HEALTHY;
    }
  }

  private static class RecordingAlertSink implements AlertSink {
    private final List<String> _messages = new ArrayList<>();
    private final List<AnomalySeverity> _severities = new ArrayList<>();

    @Override
    public void configure(Map<String, ?> configs) {
    }

    @Override
    public boolean send(String message, AnomalySeverity severity, Map<String, Object> payload) {
      _messages.add(message);
      _severities.add(severity);
      return true;
    }
  }

  private static class ShutdownAfterCyclesStore implements ResultStore {
    private final int _numCycles;
    private final List<CycleResult> _results = new ArrayList<>();
    private CycleOrchestrator _orchestrator;

    ShutdownAfterCyclesStore(int numCycles) {
      _numCycles = numCycles;
    }

    @Override
    public void configure(Map<String, ?> configs) {
    }

    @Override
    public void append(CycleResult cycleResult) {
      _results.add(cycleResult);
      if (_results.size() == _numCycles) {
        _orchestrator.shutdown();
      }
    }
  }
}
