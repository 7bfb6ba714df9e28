/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.provider;

public enum HealthStatus {
  HEALTHY, UNHEALTHY;

  @Override
  public String toString() {
    return name().toLowerCase();
  }
}
