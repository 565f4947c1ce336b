package com.ops.incident.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ops.incident.config.LlmConfig;
import com.ops.incident.config.MetricsConfig;
import com.ops.incident.model.IncidentSummary;
import com.ops.incident.model.LogEntry;
import com.ops.incident.model.SeverityClass;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Asks a chat-completion model for a short summary and likely root cause of an incident.
 *
 * Never throws: a missing API key yields a fixed "unavailable" pair, and any transport
 * or parsing failure yields an "error" pair carrying the failure message.
 */
@Service
public class LlmSummaryService {

    private static final Logger log = LoggerFactory.getLogger(LlmSummaryService.class);

    static final String UNAVAILABLE_SUMMARY = "LLM analysis unavailable: API key not configured";
    static final String UNAVAILABLE_ROOT_CAUSE = "Please configure OPENAI_API_KEY environment variable";
    static final String ERROR_ROOT_CAUSE = "Please check API key and network connectivity";

    private static final String SYSTEM_PROMPT =
            "You are a helpful DevOps engineer analyzing system incidents. Always respond with valid JSON.";

    private final LlmConfig config;
    private final MetricsConfig metricsConfig;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Autowired
    public LlmSummaryService(LlmConfig config, MetricsConfig metricsConfig) {
        this(config, metricsConfig, HttpClient.newBuilder()
                .connectTimeout(config.getTimeout())
                .build());
    }

    LlmSummaryService(LlmConfig config, MetricsConfig metricsConfig, HttpClient httpClient) {
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    @Observed(name = "incident.summarize", contextualName = "summarize-incident")
    public IncidentSummary summarize(String incidentDescription, List<LogEntry> recentLogs) {
        if (!config.isConfigured()) {
            metricsConfig.recordSummary("unconfigured");
            return IncidentSummary.fallback(UNAVAILABLE_SUMMARY, UNAVAILABLE_ROOT_CAUSE);
        }

        List<LogEntry> relevant = selectRelevantLogs(recentLogs, config.getPromptLogLimit());
        String prompt = buildPrompt(incidentDescription, relevant);

        try {
            String content = complete(prompt);
            IncidentSummary summary = parseAnalysis(content);
            metricsConfig.recordSummary("success");
            return summary;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metricsConfig.recordSummary("error");
            return IncidentSummary.fallback("Error during LLM analysis: interrupted", ERROR_ROOT_CAUSE);
        } catch (Exception e) {
            log.error("LLM analysis failed: {}", e.getMessage(), e);
            metricsConfig.recordSummary("error");
            return IncidentSummary.fallback("Error during LLM analysis: " + e.getMessage(), ERROR_ROOT_CAUSE);
        }
    }

    /**
     * Error-level logs if there are any, otherwise the logs as given; at most {@code limit}.
     */
    static List<LogEntry> selectRelevantLogs(List<LogEntry> logs, int limit) {
        List<LogEntry> errors = logs.stream()
                .filter(entry -> SeverityClass.fromLevel(entry.getLevel()) == SeverityClass.ERROR)
                .limit(limit)
                .toList();
        if (!errors.isEmpty()) {
            return errors;
        }
        return logs.stream().limit(limit).toList();
    }

    static String buildPrompt(String incidentDescription, List<LogEntry> logs) {
        String logContext = logs.stream()
                .map(entry -> String.format("[%s] %s [%s]: %s",
                        entry.getTimestamp() != null ? entry.getTimestamp().toString() : "N/A",
                        entry.getService() != null ? entry.getService() : "unknown",
                        entry.getLevel() != null ? entry.getLevel() : "info",
                        entry.getMessage() != null ? entry.getMessage() : ""))
                .collect(Collectors.joining("\n"));

        return "You are a DevOps engineer analyzing an incident. Based on the incident description "
                + "and recent logs, provide:\n\n"
                + "1. A concise summary of what happened (2-3 sentences)\n"
                + "2. The most likely root cause (1-2 sentences)\n\n"
                + "Incident Description:\n" + incidentDescription + "\n\n"
                + "Recent Logs:\n" + logContext + "\n\n"
                + "Respond in JSON format with \"summary\" and \"root_cause\" fields.\n";
    }

    IncidentSummary parseAnalysis(String content) throws IOException {
        String json = stripCodeFence(content);
        JsonNode result = objectMapper.readTree(json);
        String summary = result.path("summary").asText("Unable to generate summary");
        String rootCause = result.path("root_cause").asText("Unable to determine root cause");
        return IncidentSummary.generated(summary, rootCause);
    }

    static String stripCodeFence(String content) {
        String text = content.strip();
        if (text.startsWith("```json")) {
            text = text.substring(7);
        }
        if (text.startsWith("```")) {
            text = text.substring(3);
        }
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3);
        }
        return text.strip();
    }

    private String complete(String prompt) throws IOException, InterruptedException {
        Map<String, Object> body = Map.of(
                "model", config.getModel(),
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", prompt)),
                "temperature", config.getTemperature(),
                "max_tokens", config.getMaxTokens());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.getBaseUrl() + "/chat/completions"))
                .timeout(config.getTimeout())
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.getApiKey())
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() >= 300) {
            throw new IOException("LLM API returned HTTP " + response.statusCode());
        }

        JsonNode content = objectMapper.readTree(response.body())
                .path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new IOException("LLM API response has no message content");
        }
        return content.asText();
    }
}
