/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.provider;

import com.cerebrops.exception.ProviderFailureException;
import com.cerebrops.monitor.config.constants.MonitorConfig;
import com.cerebrops.sampling.MetricSample;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.reflect.TypeToken;
import java.io.Closeable;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Reads metric samples from {@code GET <app.url>/metrics} and health from {@code GET <app.url>/health}.
 *
 * <p>The metrics endpoint may return a single JSON object (one sample) or a JSON array of objects. The health
 * endpoint must return a JSON object whose {@code status} field is {@code healthy} for a healthy application; any
 * other status, a non-2xx response or an unreachable application is reported as unhealthy by the caller.</p>
 */
public class HttpMetricsProvider implements MetricsProvider, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(HttpMetricsProvider.class);
  static final String METRICS_PATH = "/metrics";
  static final String HEALTH_PATH = "/health";
  private static final Gson GSON = new Gson();
  private static final Type FIELDS_TYPE = new TypeToken<Map<String, Object>>() { }.getType();
  private final Time _time;
  private String _appUrl;
  private CloseableHttpClient _httpClient;

  public HttpMetricsProvider() {
    this(Time.SYSTEM);
  }

  public HttpMetricsProvider(Time time) {
    _time = time;
  }

  @Override
  public void configure(Map<String, ?> configs) {
    String appUrl = (String) configs.get(MonitorConfig.APP_URL_CONFIG);
    _appUrl = appUrl == null ? MonitorConfig.DEFAULT_APP_URL : appUrl.replaceAll("/+$", "");
    Object timeout = configs.get(MonitorConfig.PROVIDER_REQUEST_TIMEOUT_MS_CONFIG);
    int timeoutMs = timeout == null ? MonitorConfig.DEFAULT_PROVIDER_REQUEST_TIMEOUT_MS
                                    : Integer.parseInt(timeout.toString());
    RequestConfig requestConfig = RequestConfig.custom()
                                               .setConnectTimeout(timeoutMs)
                                               .setSocketTimeout(timeoutMs)
                                               .setConnectionRequestTimeout(timeoutMs)
                                               .build();
    _httpClient = HttpClients.custom().setDefaultRequestConfig(requestConfig).build();
    LOG.info("Fetching metrics and health from {} with a {} ms timeout.", _appUrl, timeoutMs);
  }

  @Override
  public List<MetricSample> fetchMetrics() throws ProviderFailureException {
    return toMetricSamples(get(METRICS_PATH));
  }

  @Override
  public HealthCheckResult fetchHealth() throws ProviderFailureException {
    long startNs = _time.nanoseconds();
    String body = get(HEALTH_PATH);
    double latencySec = (_time.nanoseconds() - startNs) / 1e9;
    return toHealthCheckResult(body, latencySec);
  }

  private String get(String path) throws ProviderFailureException {
    if (_httpClient == null) {
      throw new IllegalStateException("HttpMetricsProvider has not been configured.");
    }
    HttpGet httpGet = new HttpGet(_appUrl + path);
    httpGet.setHeader("Accept", "application/json");
    try (CloseableHttpResponse response = _httpClient.execute(httpGet)) {
      int statusCode = response.getStatusLine().getStatusCode();
      String body = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
      if (statusCode < 200 || statusCode >= 300) {
        throw new ProviderFailureException(String.format("GET %s returned HTTP %d.", httpGet.getURI(), statusCode));
      }
      LOG.debug("GET {} returned {}", httpGet.getURI(), body);
      return body;
    } catch (IOException e) {
      throw new ProviderFailureException(String.format("GET %s failed: %s", httpGet.getURI(), e.getMessage()), e);
    }
  }

  /**
   * @param body Body of a metrics response.
   * @return The metric samples in the body.
   */
  static List<MetricSample> toMetricSamples(String body) throws ProviderFailureException {
    try {
      JsonElement json = JsonParser.parseString(body);
      if (json.isJsonNull()) {
        return Collections.emptyList();
      }
      if (json.isJsonObject()) {
        return Collections.singletonList(new MetricSample(GSON.fromJson(json, FIELDS_TYPE)));
      }
      if (json.isJsonArray()) {
        List<MetricSample> samples = new ArrayList<>(json.getAsJsonArray().size());
        for (JsonElement element : json.getAsJsonArray()) {
          if (!element.isJsonObject()) {
            throw new ProviderFailureException("Expected metric samples to be JSON objects, got: " + element);
          }
          samples.add(new MetricSample(GSON.fromJson(element, FIELDS_TYPE)));
        }
        return samples;
      }
      throw new ProviderFailureException("Unexpected metrics response: " + body);
    } catch (JsonParseException e) {
      throw new ProviderFailureException("Malformed metrics response: " + e.getMessage(), e);
    }
  }

  /**
   * @param body Body of a health response.
   * @param latencySec Time the health request took in seconds.
   * @return The health check result described by the body.
   */
  static HealthCheckResult toHealthCheckResult(String body, double latencySec) throws ProviderFailureException {
    try {
      JsonElement json = JsonParser.parseString(body);
      if (!json.isJsonObject()) {
        throw new ProviderFailureException("Unexpected health response: " + body);
      }
      Map<String, Object> details = GSON.fromJson(json, FIELDS_TYPE);
      HealthStatus status = HealthStatus.HEALTHY.toString().equals(details.get(HealthCheckResult.STATUS))
                            ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY;
      return new HealthCheckResult(status, details, latencySec);
    } catch (JsonParseException e) {
      throw new ProviderFailureException("Malformed health response: " + e.getMessage(), e);
    }
  }

  @Override
  public void close() throws IOException {
    if (_httpClient != null) {
      _httpClient.close();
    }
  }
}
