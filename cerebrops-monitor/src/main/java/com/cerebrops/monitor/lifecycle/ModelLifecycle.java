/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.lifecycle;

import com.cerebrops.detector.AnomalyDetector;
import com.cerebrops.detector.AnomalyReport;
import com.cerebrops.detector.TrainedModel;
import com.cerebrops.exception.InsufficientDataException;
import com.cerebrops.exception.ModelTrainingException;
import com.cerebrops.exception.ValidationException;
import com.cerebrops.sampling.MetricSample;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.cerebrops.CerebrOpsUtils.utcDateFor;
import static com.cerebrops.CerebrOpsUtils.validateNotNull;


/**
 * Owns the active {@link TrainedModel} and decides when it is due for retraining.
 *
 * <p>A retrain builds a complete new model before swapping it in, so a failed retrain leaves the previous model
 * serving. Each detection reads the active model exactly once.</p>
 */
public class ModelLifecycle {
  private static final Logger LOG = LoggerFactory.getLogger(ModelLifecycle.class);
  private final AnomalyDetector _anomalyDetector;
  private final long _retrainIntervalMs;
  private final Time _time;
  private final AtomicReference<TrainedModel> _activeModel;

  /**
   * @param anomalyDetector Detector used to train models and score samples.
   * @param retrainIntervalMs Minimum time between two trainings.
   * @param time The time object.
   */
  public ModelLifecycle(AnomalyDetector anomalyDetector, long retrainIntervalMs, Time time) {
    if (retrainIntervalMs < 0) {
      throw new IllegalArgumentException("Retrain interval cannot be negative, got " + retrainIntervalMs);
    }
    _anomalyDetector = validateNotNull(anomalyDetector, "Anomaly detector cannot be null.");
    _retrainIntervalMs = retrainIntervalMs;
    _time = time;
    _activeModel = new AtomicReference<>();
  }

  /**
   * @param nowMs Current time in milliseconds.
   * @return True if no model was trained yet or the active model is older than the retrain interval.
   */
  public boolean shouldRetrain(long nowMs) {
    TrainedModel model = _activeModel.get();
    return model == null || nowMs - model.trainedAtMs() > _retrainIntervalMs;
  }

  /**
   * Train a new model and make it the active one. The active model is unchanged if training fails.
   *
   * @param trainingSamples Samples to train on.
   * @return The new active model.
   */
  public TrainedModel retrain(List<MetricSample> trainingSamples)
      throws InsufficientDataException, ModelTrainingException, ValidationException {
    LOG.info("Training anomaly detection model on {} samples.", trainingSamples.size());
    TrainedModel candidate = _anomalyDetector.train(trainingSamples, _time.milliseconds());
    TrainedModel previous = _activeModel.getAndSet(candidate);
    if (previous == null) {
      LOG.info("Initial model trained at {}.", utcDateFor(candidate.trainedAtMs()));
    } else {
      LOG.info("Replaced model trained at {} with model trained at {}.", utcDateFor(previous.trainedAtMs()),
               utcDateFor(candidate.trainedAtMs()));
    }
    return candidate;
  }

  /**
   * Score the given samples against the active model. Never throws; failures, including the absence of a model,
   * are reported as an error report.
   *
   * @param samples Samples to score.
   * @param nowMs Current time in milliseconds.
   * @return The report for the batch.
   */
  public AnomalyReport detect(List<MetricSample> samples, long nowMs) {
    return _anomalyDetector.detectAnomalies(_activeModel.get(), samples, nowMs);
  }

  /**
   * @return The active model, or null if no model was trained yet.
   */
  public TrainedModel activeModel() {
    return _activeModel.get();
  }

  public boolean hasModel() {
    return _activeModel.get() != null;
  }

  public ModelLifecycleState state() {
    TrainedModel model = _activeModel.get();
    return new ModelLifecycleState(model == null ? null : model.trainedAtMs(), _retrainIntervalMs);
  }
}
