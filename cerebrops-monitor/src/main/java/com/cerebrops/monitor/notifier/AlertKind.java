/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.notifier;

/**
 * Kinds of alerts a monitoring cycle can dispatch.
 */
public enum AlertKind {
  HEALTH_ALERT, ANOMALY_ALERT, ERROR_ALERT, CRITICAL_ERROR_ALERT;

  @Override
  public String toString() {
    return name().toLowerCase();
  }
}
