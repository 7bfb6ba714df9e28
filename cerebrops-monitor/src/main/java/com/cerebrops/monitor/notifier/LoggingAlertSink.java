/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.notifier;

import com.cerebrops.detector.AnomalySeverity;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Writes alerts to the log only.
 */
public class LoggingAlertSink implements AlertSink {
  private static final Logger LOG = LoggerFactory.getLogger(LoggingAlertSink.class);

  @Override
  public void configure(Map<String, ?> configs) {
  }

  @Override
  public boolean send(String message, AnomalySeverity severity, Map<String, Object> payload) {
    if (severity.isMoreSevereThan(AnomalySeverity.MEDIUM)) {
      LOG.warn("ALERT [{}]: {}", severity.name(), message);
    } else {
      LOG.info("ALERT [{}]: {}", severity.name(), message);
    }
    if (payload != null) {
      LOG.debug("Alert payload: {}", payload);
    }
    return true;
  }
}
