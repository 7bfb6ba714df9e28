/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.notifier;

import com.cerebrops.detector.AnomalySeverity;
import com.cerebrops.monitor.config.CerebrOpsConfigurable;
import java.util.Map;


/**
 * Delivers alerts to operators.
 */
public interface AlertSink extends CerebrOpsConfigurable {

  /**
   * Deliver an alert. Implementations should report delivery failures through the return value rather than throw.
   *
   * @param message Human readable alert text.
   * @param severity Severity of the alert.
   * @param payload Optional structured details, may be null.
   * @return True if the alert was delivered, false otherwise.
   */
  boolean send(String message, AnomalySeverity severity, Map<String, Object> payload);
}
