/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.detector.forest;

import com.cerebrops.detector.feature.FeatureMatrix;
import com.cerebrops.exception.InsufficientDataException;
import com.cerebrops.exception.ModelTrainingException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Fits {@link IsolationForestModel isolation forests}. Fitting is deterministic for a given random seed and
 * training matrix.
 *
 * <ul>
 *   <li>Each tree is grown on {@code min(maxSamples, n)} rows drawn without replacement.</li>
 *   <li>Trees stop growing at depth {@code ceil(log2(subsampleSize))}.</li>
 *   <li>The offset is the {@code contamination} quantile of the raw training scores, so roughly that fraction of
 *   the training rows is flagged.</li>
 * </ul>
 */
public class IsolationForest {
  private static final Logger LOG = LoggerFactory.getLogger(IsolationForest.class);
  public static final int DEFAULT_NUM_TREES = 100;
  public static final int DEFAULT_MAX_SAMPLES = 256;
  public static final double DEFAULT_CONTAMINATION = 0.1;
  public static final long DEFAULT_RANDOM_SEED = 42L;
  public static final int DEFAULT_MIN_TRAINING_SAMPLES = 10;
  private final int _numTrees;
  private final int _maxSamples;
  private final double _contamination;
  private final long _randomSeed;
  private final int _minTrainingSamples;

  public IsolationForest() {
    this(DEFAULT_NUM_TREES, DEFAULT_MAX_SAMPLES, DEFAULT_CONTAMINATION, DEFAULT_RANDOM_SEED,
         DEFAULT_MIN_TRAINING_SAMPLES);
  }

  /**
   * @param numTrees Number of trees in the ensemble.
   * @param maxSamples Maximum number of rows each tree is grown on.
   * @param contamination Expected fraction of outliers in training data, in (0, 0.5].
   * @param randomSeed Seed of the random source used for subsampling and splitting.
   * @param minTrainingSamples Minimum number of training rows, at least 2.
   */
  public IsolationForest(int numTrees, int maxSamples, double contamination, long randomSeed, int minTrainingSamples) {
    if (numTrees < 1) {
      throw new IllegalArgumentException("Number of trees must be positive, got " + numTrees);
    }
    if (maxSamples < 2) {
      throw new IllegalArgumentException("Max samples must be at least 2, got " + maxSamples);
    }
    if (!(contamination > 0.0 && contamination <= 0.5)) {
      throw new IllegalArgumentException("Contamination must be in (0, 0.5], got " + contamination);
    }
    if (minTrainingSamples < 2) {
      throw new IllegalArgumentException("Min training samples must be at least 2, got " + minTrainingSamples);
    }
    _numTrees = numTrees;
    _maxSamples = maxSamples;
    _contamination = contamination;
    _randomSeed = randomSeed;
    _minTrainingSamples = minTrainingSamples;
  }

  /**
   * @param trainingData Standardized training features.
   * @return The fitted forest.
   */
  public IsolationForestModel fit(FeatureMatrix trainingData) throws InsufficientDataException, ModelTrainingException {
    int numRows = trainingData.numRows();
    if (numRows < _minTrainingSamples) {
      throw new InsufficientDataException(String.format("Need at least %d training samples to fit an isolation forest, "
                                                        + "got %d.", _minTrainingSamples, numRows));
    }
    int subsampleSize = Math.min(_maxSamples, numRows);
    int maxDepth = (int) Math.ceil(Math.log(subsampleSize) / Math.log(2));
    Random random = new Random(_randomSeed);
    try {
      List<IsolationTree> trees = new ArrayList<>(_numTrees);
      for (int t = 0; t < _numTrees; t++) {
        int[] indices = sampleWithoutReplacement(numRows, subsampleSize, random);
        double[][] subsample = new double[subsampleSize][];
        for (int i = 0; i < subsampleSize; i++) {
          subsample[i] = trainingData.row(indices[i]);
        }
        trees.add(IsolationTree.grow(subsample, maxDepth, random));
      }
      IsolationForestModel unshifted = new IsolationForestModel(trees, trainingData.numFeatures(), subsampleSize,
                                                                _contamination, 0.0);
      double[] rawScores = new double[numRows];
      for (int r = 0; r < numRows; r++) {
        rawScores[r] = unshifted.rawScore(trainingData.row(r));
      }
      double offset = new Percentile().withEstimationType(Percentile.EstimationType.R_7)
                                      .evaluate(rawScores, 100.0 * _contamination);
      IsolationForestModel model = new IsolationForestModel(trees, trainingData.numFeatures(), subsampleSize,
                                                            _contamination, offset);
      LOG.debug("Fitted {} on {} rows.", model, numRows);
      return model;
    } catch (RuntimeException e) {
      throw new ModelTrainingException("Failed to fit isolation forest on " + numRows + " rows.", e);
    }
  }

  /**
   * Partial Fisher-Yates shuffle of {@code [0, n)}.
   */
  static int[] sampleWithoutReplacement(int n, int k, Random random) {
    int[] pool = new int[n];
    for (int i = 0; i < n; i++) {
      pool[i] = i;
    }
    for (int i = 0; i < k; i++) {
      int j = i + random.nextInt(n - i);
      int tmp = pool[i];
      pool[i] = pool[j];
      pool[j] = tmp;
    }
    int[] sample = new int[k];
    System.arraycopy(pool, 0, sample, 0, k);
    return sample;
  }

  public int numTrees() {
    return _numTrees;
  }

  public int maxSamples() {
    return _maxSamples;
  }

  public double contamination() {
    return _contamination;
  }

  public long randomSeed() {
    return _randomSeed;
  }

  public int minTrainingSamples() {
    return _minTrainingSamples;
  }
}
