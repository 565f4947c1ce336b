package com.ops.incident.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "llm")
public class LlmConfig {

    // Empty key disables LLM analysis; summaries fall back to a fixed message pair.
    private String apiKey = "";
    private String baseUrl = "https://api.openai.com/v1";
    private String model = "gpt-4o-mini";
    private double temperature = 0.3;
    private int maxTokens = 500;
    private Duration timeout = Duration.ofSeconds(30);

    // Recent logs handed to the summarizer: fetched window, then at most this many in the prompt.
    private Duration contextWindow = Duration.ofHours(1);
    private int contextFetchLimit = 100;
    private int promptLogLimit = 20;

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
