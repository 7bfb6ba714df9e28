/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.config;

import org.apache.kafka.common.config.ConfigData;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.config.provider.ConfigProvider;
import java.util.HashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves {@code ${env:NAME}} placeholders in CerebrOps properties, e.g.
 * {@code slack.alert.sink.webhook=${env:SLACK_WEBHOOK_URL}}. Values passed to {@link #configure(Map)} act as
 * fallbacks for variables absent from the process environment.
 */
public class EnvConfigProvider implements ConfigProvider {

  private Map<String, String> _fallbackVariables;

  @Override
  public ConfigData get(String path) {
    assertNoPath(path);
    return new ConfigData(variables());
  }

  @Override
  public ConfigData get(String path, Set<String> keys) {
    assertNoPath(path);
    Map<String, String> filtered = new HashMap<>(variables());
    filtered.keySet().retainAll(keys);
    return new ConfigData(filtered);
  }

  @Override
  public void close() {
    if (_fallbackVariables != null) {
      _fallbackVariables.clear();
    }
  }

  @Override
  public void configure(Map<String, ?> configs) {
    _fallbackVariables = configs.entrySet()
        .stream()
        .collect(Collectors.toMap(Entry::getKey, kv -> String.valueOf(kv.getValue())));
  }

  private static void assertNoPath(String path) {
    if (path != null && !path.isEmpty()) {
      throw new ConfigException("EnvConfigProvider does not support paths. Found: " + path);
    }
  }

  private Map<String, String> variables() {
    if (_fallbackVariables == null) {
      return System.getenv();
    }
    Map<String, String> result = new HashMap<>(_fallbackVariables);
    result.putAll(System.getenv());
    return result;
  }
}
