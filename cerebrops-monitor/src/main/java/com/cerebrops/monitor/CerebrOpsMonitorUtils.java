/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor;

import com.cerebrops.monitor.config.CerebrOpsConfig;
import com.cerebrops.monitor.config.EnvConfigProvider;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.apache.kafka.common.config.AbstractConfig;


/**
 * Util class for convenience.
 */
public final class CerebrOpsMonitorUtils {
  public static final String ENV_CONFIG_PROVIDER_NAME = "env";
  public static final String ENV_CONFIG_PROVIDER_CLASS_CONFIG = ".env.class";

  private CerebrOpsMonitorUtils() {

  }

  /**
   * Read the CerebrOps properties file. Values may reference environment variables as {@code ${env:NAME}}.
   *
   * @param propertiesFile Path of the properties file.
   * @return The configuration read from the file.
   */
  public static CerebrOpsConfig readConfig(String propertiesFile) throws IOException {
    Properties props = new Properties();
    try (InputStream propStream = new FileInputStream(propertiesFile)) {
      props.put(AbstractConfig.CONFIG_PROVIDERS_CONFIG, ENV_CONFIG_PROVIDER_NAME);
      props.put(AbstractConfig.CONFIG_PROVIDERS_CONFIG + ENV_CONFIG_PROVIDER_CLASS_CONFIG, EnvConfigProvider.class.getName());
      props.load(propStream);
    }
    return new CerebrOpsConfig(props);
  }
}
