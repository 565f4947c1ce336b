package com.ops.incident.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ops.incident.config.MetricsConfig;
import com.ops.incident.config.WebhookNotificationConfig;
import com.ops.incident.model.Incident;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Posts a Slack block-kit message to an incoming webhook for every new incident.
 */
@Service
public class WebhookNotificationService {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationService.class);

    private static final String CHANNEL = "webhook";

    private static final Map<String, String> SEVERITY_COLORS = Map.of(
            "high", "#FF0000",
            "critical", "#8B0000",
            "medium", "#FFA500",
            "low", "#FFFF00");
    private static final String DEFAULT_COLOR = "#808080";

    private final WebhookNotificationConfig config;
    private final MetricsConfig metricsConfig;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Autowired
    public WebhookNotificationService(WebhookNotificationConfig config, MetricsConfig metricsConfig) {
        this(config, metricsConfig, HttpClient.newBuilder()
                .connectTimeout(config.getTimeout())
                .build());
    }

    WebhookNotificationService(WebhookNotificationConfig config, MetricsConfig metricsConfig,
                               HttpClient httpClient) {
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    @Async
    @Observed(name = "notification.webhook", contextualName = "send-webhook-alert")
    public void notifyIncident(Incident incident) {
        if (!config.isEnabled() || config.getUrl() == null || config.getUrl().isBlank()) {
            return;
        }

        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(config.getUrl()))
                    .timeout(config.getTimeout())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(
                            objectMapper.writeValueAsString(buildPayload(incident))))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 300) {
                throw new IOException("Webhook returned HTTP " + response.statusCode());
            }

            metricsConfig.recordNotification(CHANNEL, "success");
            log.info("Webhook alert sent for incident={}", incident.getId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metricsConfig.recordNotification(CHANNEL, "error");
            log.error("Interrupted while sending webhook alert for incident={}", incident.getId());
        } catch (Exception e) {
            metricsConfig.recordNotification(CHANNEL, "error");
            log.error("Failed to send webhook alert for incident={}: {}", incident.getId(), e.getMessage(), e);
        }
    }

    Map<String, Object> buildPayload(Incident incident) {
        String severity = incident.getSeverity().wireName();
        long id = incident.getId();

        Map<String, Object> header = Map.of(
                "type", "header",
                "text", Map.of("type", "plain_text", "text", "🚨 Incident #" + id + " Detected", "emoji", true));

        Map<String, Object> fields = Map.of(
                "type", "section",
                "fields", List.of(
                        Map.of("type", "mrkdwn", "text", "*Severity:*\n" + severity.toUpperCase(Locale.ROOT)),
                        Map.of("type", "mrkdwn", "text", "*Status:*\nOpen")));

        Map<String, Object> description = Map.of(
                "type", "section",
                "text", Map.of("type", "mrkdwn", "text", "*Description:*\n" + incident.getDescription()));

        Map<String, Object> links = Map.of(
                "type", "context",
                "elements", List.of(Map.of("type", "mrkdwn", "text",
                        "<" + config.getDashboardUrl() + "|View in Dashboard> | <"
                                + config.getApiBaseUrl() + "/api/v1/incidents/" + id + "/summary|Get AI Analysis>")));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", "🚨 New Incident Detected: #" + id);
        payload.put("blocks", List.of(header, fields, description, links));
        payload.put("attachments", List.of(Map.of(
                "color", colorFor(severity),
                "footer", "Incident Monitoring Platform",
                "ts", System.currentTimeMillis() / 1000)));
        return payload;
    }

    static String colorFor(String severity) {
        return SEVERITY_COLORS.getOrDefault(severity.toLowerCase(Locale.ROOT), DEFAULT_COLOR);
    }
}
