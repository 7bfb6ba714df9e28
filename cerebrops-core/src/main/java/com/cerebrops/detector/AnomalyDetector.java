/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.detector;

import com.cerebrops.detector.feature.FeatureExtractor;
import com.cerebrops.detector.feature.FeatureMatrix;
import com.cerebrops.detector.forest.IsolationForest;
import com.cerebrops.detector.forest.IsolationForestModel;
import com.cerebrops.detector.scaler.ScalerParams;
import com.cerebrops.detector.scaler.StandardScaler;
import com.cerebrops.exception.CerebrOpsException;
import com.cerebrops.exception.InsufficientDataException;
import com.cerebrops.exception.ModelTrainingException;
import com.cerebrops.exception.NotTrainedException;
import com.cerebrops.exception.ValidationException;
import com.cerebrops.sampling.MetricSample;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.cerebrops.CerebrOpsUtils.validateNotNull;


/**
 * Trains models on metric samples and scores batches against them:
 * features, then standardization, then the isolation forest, then severity and recommendations.
 */
public class AnomalyDetector {
  private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);
  private final FeatureExtractor _featureExtractor;
  private final StandardScaler _scaler;
  private final IsolationForest _isolationForest;

  public AnomalyDetector() {
    this(new IsolationForest());
  }

  public AnomalyDetector(IsolationForest isolationForest) {
    _featureExtractor = new FeatureExtractor();
    _scaler = new StandardScaler();
    _isolationForest = validateNotNull(isolationForest, "Isolation forest cannot be null.");
  }

  /**
   * Build a new model from the given samples. Calendar features are used if any training sample has a timestamp.
   *
   * @param trainingSamples Samples describing normal behavior.
   * @param nowMs Current time in milliseconds, recorded as the training time.
   * @return The trained model.
   */
  public TrainedModel train(List<MetricSample> trainingSamples, long nowMs)
      throws InsufficientDataException, ModelTrainingException, ValidationException {
    FeatureMatrix features = _featureExtractor.extract(trainingSamples);
    if (features.numRows() < _isolationForest.minTrainingSamples()) {
      throw new InsufficientDataException(String.format("Need at least %d training samples, got %d.",
                                                        _isolationForest.minTrainingSamples(), features.numRows()));
    }
    ScalerParams scalerParams = _scaler.fit(features);
    FeatureMatrix scaled;
    try {
      scaled = _scaler.transform(features, scalerParams);
    } catch (NotTrainedException nte) {
      throw new ModelTrainingException("Scaler was not fitted.", nte);
    }
    IsolationForestModel forest = _isolationForest.fit(scaled);
    TrainedModel model = new TrainedModel(scalerParams, forest, features.hasCalendarFeatures(), features.numRows(), nowMs);
    LOG.info("Trained {}.", model);
    return model;
  }

  /**
   * Score the given samples against the given model.
   *
   * @param model Model to score against.
   * @param samples Samples to score.
   * @param nowMs Current time in milliseconds.
   * @return The report for the batch; {@link AnomalyStatus#NO_DATA} for an empty batch.
   */
  public AnomalyReport detect(TrainedModel model, List<MetricSample> samples, long nowMs)
      throws NotTrainedException, ValidationException {
    if (samples == null || samples.isEmpty()) {
      return AnomalyReport.noData(nowMs);
    }
    if (model == null) {
      throw new NotTrainedException("Model not trained. Call train() first.");
    }
    // Calendar features follow the model, so a batch without timestamps still matches a model trained with them.
    FeatureMatrix features = _featureExtractor.extract(samples, model.hasCalendarFeatures());
    FeatureMatrix scaled = _scaler.transform(features, model.scalerParams());
    double[] scores = model.forest().scores(scaled);

    List<MetricSample> anomalousSamples = new ArrayList<>();
    double worstScore = Double.POSITIVE_INFINITY;
    for (int i = 0; i < scores.length; i++) {
      worstScore = Math.min(worstScore, scores[i]);
      if (IsolationForestModel.flag(scores[i]) == IsolationForestModel.OUTLIER) {
        anomalousSamples.add(samples.get(i));
      }
    }
    AnomalyStatus status = anomalousSamples.isEmpty() ? AnomalyStatus.NORMAL : AnomalyStatus.ANOMALY;
    double anomalyPercentage = 100.0 * anomalousSamples.size() / samples.size();
    AnomalySeverity severity = SeverityClassifier.classify(anomalyPercentage, worstScore);
    AnomalyReport report = new AnomalyReport(status, nowMs, samples.size(), anomalousSamples, severity,
                                             RecommendationEngine.recommendations(anomalousSamples), null);
    LOG.debug("Detection finished with {} (worst score {}).", report, worstScore);
    return report;
  }

  /**
   * Same as {@link #detect(TrainedModel, List, long)}, but failures are reported as an
   * {@link AnomalyStatus#ERROR} report instead of being thrown.
   *
   * @param model Model to score against, may be null if no model was trained yet.
   * @param samples Samples to score.
   * @param nowMs Current time in milliseconds.
   * @return The report for the batch.
   */
  public AnomalyReport detectAnomalies(TrainedModel model, List<MetricSample> samples, long nowMs) {
    try {
      return detect(model, samples, nowMs);
    } catch (CerebrOpsException e) {
      LOG.warn("Anomaly detection failed: {}", e.getMessage());
      return AnomalyReport.error(nowMs, e.getMessage());
    } catch (RuntimeException e) {
      LOG.error("Unexpected failure during anomaly detection.", e);
      return AnomalyReport.error(nowMs, String.valueOf(e));
    }
  }
}
