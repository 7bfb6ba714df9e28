/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.detector;

/**
 * Outcome of one detection pass.
 */
public enum AnomalyStatus {
  NO_DATA, NORMAL, ANOMALY, ERROR;

  @Override
  public String toString() {
    return name().toLowerCase();
  }
}
