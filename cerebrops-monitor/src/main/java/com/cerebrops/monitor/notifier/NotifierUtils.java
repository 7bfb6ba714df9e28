/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.notifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class NotifierUtils {

  private static final Logger LOG = LoggerFactory.getLogger(NotifierUtils.class);
  static final int SEND_TIMEOUT_MS = (int) TimeUnit.SECONDS.toMillis(10);

  private NotifierUtils() { }

  /**
   * Send POST message to a specific URL (application/json)
   *
   * @param message The message that will be posted
   * @param postUrl The post URL
   * @throws IOException In case of issue with the API, including a non-2xx response.
   */
  public static void sendMessage(String message, String postUrl) throws IOException {
    RequestConfig requestConfig = RequestConfig.custom()
                                               .setConnectTimeout(SEND_TIMEOUT_MS)
                                               .setSocketTimeout(SEND_TIMEOUT_MS)
                                               .setConnectionRequestTimeout(SEND_TIMEOUT_MS)
                                               .build();
    try (CloseableHttpClient client = HttpClients.custom().setDefaultRequestConfig(requestConfig).build()) {
      HttpPost httpPost = new HttpPost(postUrl);
      httpPost.setEntity(new StringEntity(message, ContentType.APPLICATION_JSON.withCharset(StandardCharsets.UTF_8)));
      httpPost.setHeader("Accept", "application/json");
      LOG.debug("Sending alert to: {}\nBody:\n{}", httpPost, message);
      try (CloseableHttpResponse httpResponse = client.execute(httpPost)) {
        int statusCode = httpResponse.getStatusLine().getStatusCode();
        LOG.debug("Response status: {}", statusCode);
        if (statusCode < 200 || statusCode >= 300) {
          throw new IOException(String.format("POST %s returned HTTP %d.", postUrl, statusCode));
        }
      }
    }
  }
}
