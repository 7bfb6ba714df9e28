/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.config.constants;

import com.cerebrops.detector.forest.IsolationForest;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.config.ConfigDef;

import static org.apache.kafka.common.config.ConfigDef.Range.atLeast;
import static org.apache.kafka.common.config.ConfigDef.Range.between;


/**
 * A class to keep CerebrOps anomaly detection and model lifecycle configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class AnomalyDetectorConfig {

  /**
   * <code>anomaly.detection.contamination</code>
   */
  public static final String ANOMALY_DETECTION_CONTAMINATION_CONFIG = "anomaly.detection.contamination";
  public static final double DEFAULT_ANOMALY_DETECTION_CONTAMINATION = IsolationForest.DEFAULT_CONTAMINATION;
  public static final String ANOMALY_DETECTION_CONTAMINATION_DOC = "The expected fraction of outliers in training data. "
      + "It sets the decision threshold of the model. Must be in (0, 0.5].";

  /**
   * <code>anomaly.detection.num.trees</code>
   */
  public static final String ANOMALY_DETECTION_NUM_TREES_CONFIG = "anomaly.detection.num.trees";
  public static final int DEFAULT_ANOMALY_DETECTION_NUM_TREES = IsolationForest.DEFAULT_NUM_TREES;
  public static final String ANOMALY_DETECTION_NUM_TREES_DOC = "The number of isolation trees in the model.";

  /**
   * <code>anomaly.detection.max.samples</code>
   */
  public static final String ANOMALY_DETECTION_MAX_SAMPLES_CONFIG = "anomaly.detection.max.samples";
  public static final int DEFAULT_ANOMALY_DETECTION_MAX_SAMPLES = IsolationForest.DEFAULT_MAX_SAMPLES;
  public static final String ANOMALY_DETECTION_MAX_SAMPLES_DOC = "The maximum number of training samples each "
      + "isolation tree is grown on.";

  /**
   * <code>anomaly.detection.random.seed</code>
   */
  public static final String ANOMALY_DETECTION_RANDOM_SEED_CONFIG = "anomaly.detection.random.seed";
  public static final long DEFAULT_ANOMALY_DETECTION_RANDOM_SEED = IsolationForest.DEFAULT_RANDOM_SEED;
  public static final String ANOMALY_DETECTION_RANDOM_SEED_DOC = "The seed of the model's random source. Training twice "
      + "on the same samples with the same seed yields the same model.";

  /**
   * <code>anomaly.detection.min.training.samples</code>
   */
  public static final String ANOMALY_DETECTION_MIN_TRAINING_SAMPLES_CONFIG = "anomaly.detection.min.training.samples";
  public static final int DEFAULT_ANOMALY_DETECTION_MIN_TRAINING_SAMPLES = IsolationForest.DEFAULT_MIN_TRAINING_SAMPLES;
  public static final String ANOMALY_DETECTION_MIN_TRAINING_SAMPLES_DOC = "The minimum number of samples a model can "
      + "be trained on.";

  /**
   * <code>model.retrain.interval.ms</code>
   */
  public static final String MODEL_RETRAIN_INTERVAL_MS_CONFIG = "model.retrain.interval.ms";
  public static final long DEFAULT_MODEL_RETRAIN_INTERVAL_MS = TimeUnit.HOURS.toMillis(24);
  public static final String MODEL_RETRAIN_INTERVAL_MS_DOC = "The minimum time between two model trainings.";

  /**
   * <code>model.training.sample.count</code>
   */
  public static final String MODEL_TRAINING_SAMPLE_COUNT_CONFIG = "model.training.sample.count";
  public static final int DEFAULT_MODEL_TRAINING_SAMPLE_COUNT = 100;
  public static final String MODEL_TRAINING_SAMPLE_COUNT_DOC = "The number of metric fetches used to collect training "
      + "samples for a model.";

  /**
   * <code>model.training.fetch.backoff.ms</code>
   */
  public static final String MODEL_TRAINING_FETCH_BACKOFF_MS_CONFIG = "model.training.fetch.backoff.ms";
  public static final long DEFAULT_MODEL_TRAINING_FETCH_BACKOFF_MS = TimeUnit.SECONDS.toMillis(1);
  public static final String MODEL_TRAINING_FETCH_BACKOFF_MS_DOC = "The time to wait between two metric fetches while "
      + "collecting training samples.";

  /**
   * <code>model.training.synthetic.bootstrap.enabled</code>
   */
  public static final String MODEL_TRAINING_SYNTHETIC_BOOTSTRAP_ENABLED_CONFIG =
      "model.training.synthetic.bootstrap.enabled";
  public static final boolean DEFAULT_MODEL_TRAINING_SYNTHETIC_BOOTSTRAP_ENABLED = false;
  public static final String MODEL_TRAINING_SYNTHETIC_BOOTSTRAP_ENABLED_DOC = "True to train the first model on "
      + "generated sample data instead of samples collected from the monitored application.";

  private AnomalyDetectorConfig() {
  }

  /**
   * Define configs for anomaly detection and the model lifecycle.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for anomaly detection and the model lifecycle.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(ANOMALY_DETECTION_CONTAMINATION_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_ANOMALY_DETECTION_CONTAMINATION,
                            between(0.0, 0.5),
                            ConfigDef.Importance.HIGH,
                            ANOMALY_DETECTION_CONTAMINATION_DOC)
                    .define(ANOMALY_DETECTION_NUM_TREES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_ANOMALY_DETECTION_NUM_TREES,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            ANOMALY_DETECTION_NUM_TREES_DOC)
                    .define(ANOMALY_DETECTION_MAX_SAMPLES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_ANOMALY_DETECTION_MAX_SAMPLES,
                            atLeast(2),
                            ConfigDef.Importance.LOW,
                            ANOMALY_DETECTION_MAX_SAMPLES_DOC)
                    .define(ANOMALY_DETECTION_RANDOM_SEED_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_ANOMALY_DETECTION_RANDOM_SEED,
                            ConfigDef.Importance.LOW,
                            ANOMALY_DETECTION_RANDOM_SEED_DOC)
                    .define(ANOMALY_DETECTION_MIN_TRAINING_SAMPLES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_ANOMALY_DETECTION_MIN_TRAINING_SAMPLES,
                            atLeast(2),
                            ConfigDef.Importance.LOW,
                            ANOMALY_DETECTION_MIN_TRAINING_SAMPLES_DOC)
                    .define(MODEL_RETRAIN_INTERVAL_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_MODEL_RETRAIN_INTERVAL_MS,
                            atLeast(0),
                            ConfigDef.Importance.MEDIUM,
                            MODEL_RETRAIN_INTERVAL_MS_DOC)
                    .define(MODEL_TRAINING_SAMPLE_COUNT_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MODEL_TRAINING_SAMPLE_COUNT,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            MODEL_TRAINING_SAMPLE_COUNT_DOC)
                    .define(MODEL_TRAINING_FETCH_BACKOFF_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_MODEL_TRAINING_FETCH_BACKOFF_MS,
                            atLeast(0),
                            ConfigDef.Importance.LOW,
                            MODEL_TRAINING_FETCH_BACKOFF_MS_DOC)
                    .define(MODEL_TRAINING_SYNTHETIC_BOOTSTRAP_ENABLED_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_MODEL_TRAINING_SYNTHETIC_BOOTSTRAP_ENABLED,
                            ConfigDef.Importance.LOW,
                            MODEL_TRAINING_SYNTHETIC_BOOTSTRAP_ENABLED_DOC);
  }
}
