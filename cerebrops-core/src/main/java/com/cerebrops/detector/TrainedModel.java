/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.detector;

import com.cerebrops.detector.forest.IsolationForestModel;
import com.cerebrops.detector.scaler.ScalerParams;

import static com.cerebrops.CerebrOpsUtils.validateNotNull;


/**
 * An immutable snapshot of everything needed to score samples: scaler parameters, the fitted forest and the
 * feature layout both were fitted on. A retrain produces a new snapshot rather than modifying this one.
 */
public final class TrainedModel {
  private final ScalerParams _scalerParams;
  private final IsolationForestModel _forest;
  private final boolean _hasCalendarFeatures;
  private final int _numTrainingSamples;
  private final long _trainedAtMs;

  public TrainedModel(ScalerParams scalerParams,
                      IsolationForestModel forest,
                      boolean hasCalendarFeatures,
                      int numTrainingSamples,
                      long trainedAtMs) {
    _scalerParams = validateNotNull(scalerParams, "Scaler parameters cannot be null.");
    _forest = validateNotNull(forest, "Forest cannot be null.");
    if (scalerParams.numFeatures() != forest.numFeatures()) {
      throw new IllegalArgumentException(String.format("Scaler has %d features but forest has %d.",
                                                       scalerParams.numFeatures(), forest.numFeatures()));
    }
    _hasCalendarFeatures = hasCalendarFeatures;
    _numTrainingSamples = numTrainingSamples;
    _trainedAtMs = trainedAtMs;
  }

  public ScalerParams scalerParams() {
    return _scalerParams;
  }

  public IsolationForestModel forest() {
    return _forest;
  }

  public boolean hasCalendarFeatures() {
    return _hasCalendarFeatures;
  }

  public int numFeatures() {
    return _forest.numFeatures();
  }

  public double contamination() {
    return _forest.contamination();
  }

  public int numTrainingSamples() {
    return _numTrainingSamples;
  }

  public long trainedAtMs() {
    return _trainedAtMs;
  }

  @Override
  public String toString() {
    return String.format("TrainedModel{features=%d, calendar=%s, trainingSamples=%d, trainedAt=%d, forest=%s}",
                         numFeatures(), _hasCalendarFeatures, _numTrainingSamples, _trainedAtMs, _forest);
  }
}
