package com.ops.incident.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "notification.webhook")
public class WebhookNotificationConfig {

    // Slack-compatible incoming webhook URL
    private String url;
    private boolean enabled = false;
    private Duration timeout = Duration.ofSeconds(5);
    private String dashboardUrl = "http://localhost:5173";
    private String apiBaseUrl = "http://localhost:8080";
}
