/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.lifecycle;

/**
 * A point-in-time view of the model lifecycle.
 */
public final class ModelLifecycleState {
  private final Long _lastTrainedAtMs;
  private final long _retrainIntervalMs;

  ModelLifecycleState(Long lastTrainedAtMs, long retrainIntervalMs) {
    _lastTrainedAtMs = lastTrainedAtMs;
    _retrainIntervalMs = retrainIntervalMs;
  }

  /**
   * @return Time the active model was trained in milliseconds, or null if no model was trained yet.
   */
  public Long lastTrainedAtMs() {
    return _lastTrainedAtMs;
  }

  public long retrainIntervalMs() {
    return _retrainIntervalMs;
  }

  @Override
  public String toString() {
    return String.format("{lastTrainedAtMs=%s, retrainIntervalMs=%d}", _lastTrainedAtMs, _retrainIntervalMs);
  }
}
