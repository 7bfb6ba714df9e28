/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.notifier;

import com.cerebrops.detector.AnomalyReport;
import com.cerebrops.detector.AnomalySeverity;
import com.cerebrops.sampling.MetricSample;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Posts alerts to a Slack incoming webhook. Without a webhook, alerts are only logged and still count as delivered.
 * The following configurations are read:
 * <ul>
 *   <li>{@value #SLACK_ALERT_SINK_WEBHOOK_CONFIG}: webhook URL, alerts are only logged if unset.</li>
 *   <li>{@value #SLACK_ALERT_SINK_CHANNEL_CONFIG}: channel override, the webhook's channel is used if unset.</li>
 *   <li>{@value #SLACK_ALERT_SINK_USER_CONFIG}: user name, default {@value #DEFAULT_SLACK_ALERT_SINK_USER}.</li>
 *   <li>{@value #SLACK_ALERT_SINK_ICON_CONFIG}: icon emoji, default {@value #DEFAULT_SLACK_ALERT_SINK_ICON}.</li>
 * </ul>
 */
public class SlackAlertSink implements AlertSink {
    private static final Logger LOG = LoggerFactory.getLogger(SlackAlertSink.class);
    public static final String SLACK_ALERT_SINK_WEBHOOK_CONFIG = "slack.alert.sink.webhook";
    public static final String SLACK_ALERT_SINK_ICON_CONFIG = "slack.alert.sink.icon";
    public static final String SLACK_ALERT_SINK_USER_CONFIG = "slack.alert.sink.user";
    public static final String SLACK_ALERT_SINK_CHANNEL_CONFIG = "slack.alert.sink.channel";
    public static final String DEFAULT_SLACK_ALERT_SINK_ICON = ":brain:";
    public static final String DEFAULT_SLACK_ALERT_SINK_USER = "CerebrOps AI Monitor";
    static final String FOOTER = "CerebrOps AI-Powered Monitoring";
    static final String ANOMALIES_DETECTED_FIELD = "Anomalies Detected";
    static final String ANOMALY_RATE_FIELD = "Anomaly Rate";
    static final String RECOMMENDATIONS_FIELD = "Recommendations";
    static final String ANOMALOUS_METRICS_FIELD = "Anomalous Metrics";

    protected final Time _time;
    protected String _slackWebhook;
    protected String _slackIcon;
    protected String _slackUser;
    protected String _slackChannel;

    public SlackAlertSink() {
        this(Time.SYSTEM);
    }

    public SlackAlertSink(Time time) {
        _time = time;
        _slackIcon = DEFAULT_SLACK_ALERT_SINK_ICON;
        _slackUser = DEFAULT_SLACK_ALERT_SINK_USER;
    }

    @Override
    public void configure(Map<String, ?> config) {
        _slackWebhook = (String) config.get(SLACK_ALERT_SINK_WEBHOOK_CONFIG);
        _slackIcon = (String) config.get(SLACK_ALERT_SINK_ICON_CONFIG);
        _slackUser = (String) config.get(SLACK_ALERT_SINK_USER_CONFIG);
        _slackChannel = (String) config.get(SLACK_ALERT_SINK_CHANNEL_CONFIG);
        _slackIcon = _slackIcon == null ? DEFAULT_SLACK_ALERT_SINK_ICON : _slackIcon;
        _slackUser = _slackUser == null ? DEFAULT_SLACK_ALERT_SINK_USER : _slackUser;
        if (_slackWebhook == null || _slackWebhook.isEmpty()) {
            _slackWebhook = null;
            LOG.warn("No Slack webhook configured, alerts will be logged only.");
        }
    }

    @Override
    public boolean send(String message, AnomalySeverity severity, Map<String, Object> payload) {
        LOG.info("ALERT [{}]: {}", severity.name(), message);
        if (_slackWebhook == null) {
            return true;
        }
        SlackMessage slackMessage = new SlackMessage(_slackUser, _slackIcon, _slackChannel,
                                                     attachment(message, severity, payload));
        try {
            sendSlackMessage(slackMessage, _slackWebhook);
            LOG.debug("Alert sent to Slack.");
            return true;
        } catch (IOException e) {
            LOG.warn("Failed to send alert to Slack.", e);
            return false;
        }
    }

    protected void sendSlackMessage(SlackMessage slackMessage, String slackWebhookUrl) throws IOException {
        NotifierUtils.sendMessage(slackMessage.toJson(), slackWebhookUrl);
    }

    SlackMessage.Attachment attachment(String message, AnomalySeverity severity, Map<String, Object> payload) {
        String title = String.format("%s CerebrOps Alert - %s", emoji(severity), severity.name());
        long ts = TimeUnit.MILLISECONDS.toSeconds(_time.milliseconds());
        List<SlackMessage.Field> fields = payload == null ? null : fields(payload);
        return new SlackMessage.Attachment(color(severity), title, message, FOOTER, ts, fields);
    }

    private static List<SlackMessage.Field> fields(Map<String, Object> payload) {
        List<SlackMessage.Field> fields = new ArrayList<>();
        if (payload.containsKey(AnomalyReport.ANOMALY_COUNT)) {
            Object total = payload.getOrDefault(AnomalyReport.TOTAL_DATA_POINTS, "N/A");
            fields.add(new SlackMessage.Field(ANOMALIES_DETECTED_FIELD,
                                              String.format("%s out of %s data points",
                                                            payload.get(AnomalyReport.ANOMALY_COUNT), total), true));
        }
        if (payload.containsKey(AnomalyReport.ANOMALY_PERCENTAGE)) {
            fields.add(new SlackMessage.Field(ANOMALY_RATE_FIELD, payload.get(AnomalyReport.ANOMALY_PERCENTAGE) + "%", true));
        }
        Object recommendations = payload.get(AnomalyReport.RECOMMENDATIONS);
        if (recommendations instanceof Collection && !((Collection<?>) recommendations).isEmpty()) {
            StringBuilder sb = new StringBuilder();
            for (Object recommendation : (Collection<?>) recommendations) {
                sb.append(sb.length() == 0 ? "" : "\n").append("• ").append(recommendation);
            }
            fields.add(new SlackMessage.Field(RECOMMENDATIONS_FIELD, sb.toString(), false));
        }
        Object anomalousData = payload.get(AnomalyReport.ANOMALOUS_DATA);
        if (anomalousData instanceof List && !((List<?>) anomalousData).isEmpty()
            && ((List<?>) anomalousData).get(0) instanceof Map) {
            // Only the first anomalous sample is shown.
            String metrics = metricsText((Map<?, ?>) ((List<?>) anomalousData).get(0));
            if (!metrics.isEmpty()) {
                fields.add(new SlackMessage.Field(ANOMALOUS_METRICS_FIELD, metrics, true));
            }
        }
        return fields;
    }

    private static String metricsText(Map<?, ?> sample) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<?, ?> entry : sample.entrySet()) {
            if (entry.getValue() instanceof Number && !MetricSample.TIMESTAMP.equals(entry.getKey())) {
                sb.append("• ").append(titleCase(String.valueOf(entry.getKey())))
                  .append(String.format(Locale.ROOT, ": %.2f\n", ((Number) entry.getValue()).doubleValue()));
            }
        }
        return sb.toString();
    }

    private static String titleCase(String key) {
        StringBuilder sb = new StringBuilder();
        for (String word : key.split("_")) {
            if (!word.isEmpty()) {
                sb.append(sb.length() == 0 ? "" : " ").append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
        }
        return sb.toString();
    }

    static String color(AnomalySeverity severity) {
        switch (severity) {
            case CRITICAL:
                return "#ff0000";
            case HIGH:
                return "#ff6b35";
            case MEDIUM:
                return "#ff9500";
            default:
                return "#36a64f";
        }
    }

    private static String emoji(AnomalySeverity severity) {
        switch (severity) {
            case CRITICAL:
                return ":rotating_light:";
            case HIGH:
                return ":red_circle:";
            case MEDIUM:
                return ":large_orange_circle:";
            default:
                return ":large_yellow_circle:";
        }
    }
}
