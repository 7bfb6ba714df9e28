/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.detector.scaler;

import java.util.Arrays;


/**
 * Per-feature mean and population variance learned by {@link StandardScaler#fit}.
 */
public final class ScalerParams {
  private final double[] _means;
  private final double[] _variances;

  public ScalerParams(double[] means, double[] variances) {
    if (means.length != variances.length) {
      throw new IllegalArgumentException(String.format("Got %d means but %d variances.", means.length, variances.length));
    }
    _means = means.clone();
    _variances = variances.clone();
  }

  public int numFeatures() {
    return _means.length;
  }

  public double mean(int feature) {
    return _means[feature];
  }

  public double variance(int feature) {
    return _variances[feature];
  }

  /**
   * @param feature Feature index.
   * @return The standard deviation of the feature, or {@code 1.0} if the feature was constant during fitting.
   */
  public double scale(int feature) {
    return _variances[feature] == 0.0 ? 1.0 : Math.sqrt(_variances[feature]);
  }

  @Override
  public String toString() {
    return String.format("ScalerParams{means=%s, variances=%s}", Arrays.toString(_means), Arrays.toString(_variances));
  }
}
