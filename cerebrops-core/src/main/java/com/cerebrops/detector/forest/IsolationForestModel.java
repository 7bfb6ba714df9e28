/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.detector.forest;

import com.cerebrops.detector.feature.FeatureMatrix;
import com.cerebrops.exception.ValidationException;
import java.util.Collections;
import java.util.List;


/**
 * A fitted isolation forest. Scores follow the convention that lower means more anomalous: the decision score of
 * a vector is its raw score {@code -2^(-E[h(x)] / c(psi))} minus the offset learned from the contamination
 * fraction, so a negative decision score marks an outlier.
 */
public final class IsolationForestModel {
  public static final int INLIER = 1;
  public static final int OUTLIER = -1;
  private final List<IsolationTree> _trees;
  private final int _numFeatures;
  private final int _subsampleSize;
  private final double _contamination;
  private final double _offset;

  IsolationForestModel(List<IsolationTree> trees, int numFeatures, int subsampleSize, double contamination,
                       double offset) {
    _trees = Collections.unmodifiableList(trees);
    _numFeatures = numFeatures;
    _subsampleSize = subsampleSize;
    _contamination = contamination;
    _offset = offset;
  }

  /**
   * @param x Feature vector.
   * @return The raw score in [-1, 0), before the contamination offset is applied.
   */
  double rawScore(double[] x) {
    double totalPathLength = 0.0;
    for (IsolationTree tree : _trees) {
      totalPathLength += tree.pathLength(x);
    }
    double meanPathLength = totalPathLength / _trees.size();
    double normalizer = IsolationTree.averagePathLength(_subsampleSize);
    // A single-row subsample cannot isolate anything, every vector is equally normal.
    if (normalizer == 0.0) {
      return -0.5;
    }
    return -Math.pow(2.0, -meanPathLength / normalizer);
  }

  /**
   * @param x Feature vector.
   * @return The decision score of the vector; negative means outlier.
   */
  public double score(double[] x) throws ValidationException {
    ensureWidth(x.length);
    return rawScore(x) - _offset;
  }

  /**
   * @param matrix Feature vectors.
   * @return The decision score of every row.
   */
  public double[] scores(FeatureMatrix matrix) throws ValidationException {
    ensureWidth(matrix.numFeatures());
    double[] scores = new double[matrix.numRows()];
    for (int r = 0; r < matrix.numRows(); r++) {
      scores[r] = rawScore(matrix.row(r)) - _offset;
    }
    return scores;
  }

  /**
   * @param score Decision score.
   * @return {@link #OUTLIER} if the score is negative, {@link #INLIER} otherwise.
   */
  public static int flag(double score) {
    return score < 0.0 ? OUTLIER : INLIER;
  }

  private void ensureWidth(int width) throws ValidationException {
    if (width != _numFeatures) {
      throw new ValidationException(String.format("Feature dimensionality mismatch: forest was fitted on %d features "
                                                  + "but got %d.", _numFeatures, width));
    }
  }

  public int numTrees() {
    return _trees.size();
  }

  public int numFeatures() {
    return _numFeatures;
  }

  public int subsampleSize() {
    return _subsampleSize;
  }

  public double contamination() {
    return _contamination;
  }

  public double offset() {
    return _offset;
  }

  @Override
  public String toString() {
    return String.format("IsolationForestModel{trees=%d, features=%d, subsampleSize=%d, contamination=%.3f, offset=%.6f}",
                         _trees.size(), _numFeatures, _subsampleSize, _contamination, _offset);
  }
}
