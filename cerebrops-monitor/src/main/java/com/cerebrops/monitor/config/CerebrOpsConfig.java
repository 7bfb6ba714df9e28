/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.config;

import com.cerebrops.monitor.config.constants.AnomalyDetectorConfig;
import com.cerebrops.monitor.config.constants.MonitorConfig;
import java.util.Map;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigException;


/**
 * The configuration class of CerebrOps.
 *
 * Config names, their defaults, and definitions reside in the relevant classes under
 * {@link com.cerebrops.monitor.config.constants}.
 */
public class CerebrOpsConfig extends AbstractConfig {
  private static final ConfigDef CONFIG;

  static {
    CONFIG = AnomalyDetectorConfig.define(MonitorConfig.define(new ConfigDef()));
  }

  public CerebrOpsConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public CerebrOpsConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
    sanityCheckContamination();
    sanityCheckTrainingSamples();
  }

  /**
   * @return Merged config values.
   */
  public Map<String, Object> mergedConfigValues() {
    Map<String, Object> conf = originals();

    // Use parsed non-null value to overwrite originals.
    // This will keep default values and also keep values that are not defined under ConfigDef.
    values().forEach((k, v) -> {
      if (v != null) {
        conf.put(k, v);
      }
    });
    return conf;
  }

  @Override
  public <T> T getConfiguredInstance(String key, Class<T> t) {
    T o = super.getConfiguredInstance(key, t);
    if (o instanceof CerebrOpsConfigurable) {
      ((CerebrOpsConfigurable) o).configure(mergedConfigValues());
    }
    return o;
  }

  /**
   * Sanity check that {@link AnomalyDetectorConfig#ANOMALY_DETECTION_CONTAMINATION_CONFIG} is strictly positive.
   */
  private void sanityCheckContamination() {
    double contamination = getDouble(AnomalyDetectorConfig.ANOMALY_DETECTION_CONTAMINATION_CONFIG);
    if (contamination <= 0.0) {
      throw new ConfigException(AnomalyDetectorConfig.ANOMALY_DETECTION_CONTAMINATION_CONFIG, contamination,
                                "Contamination must be strictly positive.");
    }
  }

  /**
   * Sanity check that a model can be trained on the samples of one training collection, i.e.
   * {@link AnomalyDetectorConfig#MODEL_TRAINING_SAMPLE_COUNT_CONFIG} fetches of at least one sample each reach
   * {@link AnomalyDetectorConfig#ANOMALY_DETECTION_MIN_TRAINING_SAMPLES_CONFIG}.
   */
  private void sanityCheckTrainingSamples() {
    int sampleCount = getInt(AnomalyDetectorConfig.MODEL_TRAINING_SAMPLE_COUNT_CONFIG);
    int minTrainingSamples = getInt(AnomalyDetectorConfig.ANOMALY_DETECTION_MIN_TRAINING_SAMPLES_CONFIG);
    if (sampleCount < minTrainingSamples) {
      throw new ConfigException(String.format("Attempt to collect %d training samples while at least %d samples are "
                                              + "required to train a model (see %s).", sampleCount, minTrainingSamples,
                                              AnomalyDetectorConfig.ANOMALY_DETECTION_MIN_TRAINING_SAMPLES_CONFIG));
    }
  }
}
