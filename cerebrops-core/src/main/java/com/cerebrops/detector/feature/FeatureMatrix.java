/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.detector.feature;

import java.util.Arrays;


/**
 * A dense, row-major matrix of feature vectors, one row per metric sample. Instances are immutable: rows handed
 * in are copied and rows handed out are copies.
 */
public final class FeatureMatrix {
  private final double[][] _rows;
  private final int _numFeatures;
  private final boolean _hasCalendarFeatures;

  /**
   * @param rows Feature vectors, all of width {@code numFeatures}.
   * @param numFeatures Width of each feature vector.
   * @param hasCalendarFeatures True if the trailing two features are hour of day and day of week.
   */
  public FeatureMatrix(double[][] rows, int numFeatures, boolean hasCalendarFeatures) {
    _rows = new double[rows.length][];
    for (int i = 0; i < rows.length; i++) {
      if (rows[i].length != numFeatures) {
        throw new IllegalArgumentException(String.format("Row %d has %d features, expected %d.", i, rows[i].length,
                                                         numFeatures));
      }
      _rows[i] = rows[i].clone();
    }
    _numFeatures = numFeatures;
    _hasCalendarFeatures = hasCalendarFeatures;
  }

  public int numRows() {
    return _rows.length;
  }

  public int numFeatures() {
    return _numFeatures;
  }

  public boolean isEmpty() {
    return _rows.length == 0;
  }

  public boolean hasCalendarFeatures() {
    return _hasCalendarFeatures;
  }

  /**
   * @param row Row index.
   * @return A copy of the feature vector at the given row.
   */
  public double[] row(int row) {
    return _rows[row].clone();
  }

  public double value(int row, int feature) {
    return _rows[row][feature];
  }

  /**
   * @param feature Feature index.
   * @return The values of the given feature across all rows.
   */
  public double[] column(int feature) {
    double[] column = new double[_rows.length];
    for (int i = 0; i < _rows.length; i++) {
      column[i] = _rows[i][feature];
    }
    return column;
  }

  @Override
  public String toString() {
    return String.format("FeatureMatrix{rows=%d, features=%d, calendar=%s, data=%s}", _rows.length, _numFeatures,
                         _hasCalendarFeatures, Arrays.deepToString(_rows));
  }
}
