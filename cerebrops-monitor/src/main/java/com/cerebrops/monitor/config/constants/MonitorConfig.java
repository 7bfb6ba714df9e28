/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.config.constants;

import com.cerebrops.monitor.notifier.LoggingAlertSink;
import com.cerebrops.monitor.provider.HttpMetricsProvider;
import com.cerebrops.monitor.store.JsonLinesResultStore;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.config.ConfigDef;

import static org.apache.kafka.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep CerebrOps monitoring cycle configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class MonitorConfig {

  /**
   * <code>app.url</code>
   */
  public static final String APP_URL_CONFIG = "app.url";
  public static final String DEFAULT_APP_URL = "http://localhost:5000";
  public static final String APP_URL_DOC = "The base URL of the monitored application. Metrics are read from its "
      + "/metrics endpoint and health from its /health endpoint.";

  /**
   * <code>monitoring.interval.ms</code>
   */
  public static final String MONITORING_INTERVAL_MS_CONFIG = "monitoring.interval.ms";
  public static final long DEFAULT_MONITORING_INTERVAL_MS = TimeUnit.MINUTES.toMillis(5);
  public static final String MONITORING_INTERVAL_MS_DOC = "The time to wait after a monitoring cycle completes before "
      + "the next one starts.";

  /**
   * <code>provider.request.timeout.ms</code>
   */
  public static final String PROVIDER_REQUEST_TIMEOUT_MS_CONFIG = "provider.request.timeout.ms";
  public static final int DEFAULT_PROVIDER_REQUEST_TIMEOUT_MS = (int) TimeUnit.SECONDS.toMillis(10);
  public static final String PROVIDER_REQUEST_TIMEOUT_MS_DOC = "The connect, read and connection request timeout of a "
      + "single request to the monitored application.";

  /**
   * <code>metrics.provider.class</code>
   */
  public static final String METRICS_PROVIDER_CLASS_CONFIG = "metrics.provider.class";
  public static final String DEFAULT_METRICS_PROVIDER_CLASS = HttpMetricsProvider.class.getName();
  public static final String METRICS_PROVIDER_CLASS_DOC = "The class implementing MetricsProvider used to fetch metric "
      + "samples and health of the monitored application.";

  /**
   * <code>metrics.provider.synthetic.fallback.enabled</code>
   */
  public static final String METRICS_PROVIDER_SYNTHETIC_FALLBACK_ENABLED_CONFIG =
      "metrics.provider.synthetic.fallback.enabled";
  public static final boolean DEFAULT_METRICS_PROVIDER_SYNTHETIC_FALLBACK_ENABLED = false;
  public static final String METRICS_PROVIDER_SYNTHETIC_FALLBACK_ENABLED_DOC = "True to substitute generated sample "
      + "data when fetching metrics from the monitored application fails. Intended for demos only.";

  /**
   * <code>alert.sink.class</code>
   */
  public static final String ALERT_SINK_CLASS_CONFIG = "alert.sink.class";
  public static final String DEFAULT_ALERT_SINK_CLASS = LoggingAlertSink.class.getName();
  public static final String ALERT_SINK_CLASS_DOC = "The class implementing AlertSink used to deliver alerts.";

  /**
   * <code>result.store.class</code>
   */
  public static final String RESULT_STORE_CLASS_CONFIG = "result.store.class";
  public static final String DEFAULT_RESULT_STORE_CLASS = JsonLinesResultStore.class.getName();
  public static final String RESULT_STORE_CLASS_DOC = "The class implementing ResultStore used to persist the result "
      + "of every monitoring cycle.";

  private MonitorConfig() {
  }

  /**
   * Define configs for the monitoring cycle.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the monitoring cycle.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(APP_URL_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_APP_URL,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.HIGH,
                            APP_URL_DOC)
                    .define(MONITORING_INTERVAL_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_MONITORING_INTERVAL_MS,
                            atLeast(0),
                            ConfigDef.Importance.HIGH,
                            MONITORING_INTERVAL_MS_DOC)
                    .define(PROVIDER_REQUEST_TIMEOUT_MS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_PROVIDER_REQUEST_TIMEOUT_MS,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            PROVIDER_REQUEST_TIMEOUT_MS_DOC)
                    .define(METRICS_PROVIDER_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_METRICS_PROVIDER_CLASS,
                            ConfigDef.Importance.MEDIUM,
                            METRICS_PROVIDER_CLASS_DOC)
                    .define(METRICS_PROVIDER_SYNTHETIC_FALLBACK_ENABLED_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_METRICS_PROVIDER_SYNTHETIC_FALLBACK_ENABLED,
                            ConfigDef.Importance.LOW,
                            METRICS_PROVIDER_SYNTHETIC_FALLBACK_ENABLED_DOC)
                    .define(ALERT_SINK_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_ALERT_SINK_CLASS,
                            ConfigDef.Importance.MEDIUM,
                            ALERT_SINK_CLASS_DOC)
                    .define(RESULT_STORE_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_RESULT_STORE_CLASS,
                            ConfigDef.Importance.MEDIUM,
                            RESULT_STORE_CLASS_DOC);
  }
}
