/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.detector.scaler;

import com.cerebrops.detector.feature.FeatureMatrix;
import com.cerebrops.exception.InsufficientDataException;
import com.cerebrops.exception.NotTrainedException;
import com.cerebrops.exception.ValidationException;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;


/**
 * Standardizes features to zero mean and unit variance: {@code (x - mean) / std}, where {@code std} is the
 * population standard deviation seen during fitting, or 1 for a feature that was constant.
 */
public class StandardScaler {

  /**
   * @param matrix Training features.
   * @return The learned per-feature parameters.
   */
  public ScalerParams fit(FeatureMatrix matrix) throws InsufficientDataException {
    if (matrix.isEmpty()) {
      throw new InsufficientDataException("Cannot fit a scaler on an empty feature matrix.");
    }
    int numFeatures = matrix.numFeatures();
    double[] means = new double[numFeatures];
    double[] variances = new double[numFeatures];
    for (int f = 0; f < numFeatures; f++) {
      SummaryStatistics stats = new SummaryStatistics();
      for (int r = 0; r < matrix.numRows(); r++) {
        stats.addValue(matrix.value(r, f));
      }
      means[f] = stats.getMean();
      variances[f] = stats.getPopulationVariance();
    }
    return new ScalerParams(means, variances);
  }

  /**
   * @param matrix Features to standardize.
   * @param params Parameters learned by {@link #fit(FeatureMatrix)}.
   * @return The standardized features.
   */
  public FeatureMatrix transform(FeatureMatrix matrix, ScalerParams params)
      throws NotTrainedException, ValidationException {
    if (params == null) {
      throw new NotTrainedException("Scaler has not been fitted.");
    }
    if (matrix.numFeatures() != params.numFeatures()) {
      throw new ValidationException(String.format("Feature dimensionality mismatch: scaler was fitted on %d features "
                                                  + "but got %d.", params.numFeatures(), matrix.numFeatures()));
    }
    double[][] scaled = new double[matrix.numRows()][matrix.numFeatures()];
    for (int r = 0; r < matrix.numRows(); r++) {
      for (int f = 0; f < matrix.numFeatures(); f++) {
        scaled[r][f] = (matrix.value(r, f) - params.mean(f)) / params.scale(f);
      }
    }
    return new FeatureMatrix(scaled, matrix.numFeatures(), matrix.hasCalendarFeatures());
  }
}
