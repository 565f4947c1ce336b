package com.ops.incident.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI incidentDetectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Log Incident Detection API")
                        .version("1.0.0")
                        .description(
                                "Unsupervised anomaly detection over structured logs.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Ingest logs via `POST /api/v1/logs`\n" +
                                "2. Trigger a run via `POST /api/v1/detections/run` (last hour, up to 1000 logs)\n" +
                                "3. Logs are bucketed per minute and per service\n" +
                                "4. Baselines (mean, std) are computed from the batch itself\n" +
                                "5. Each anomaly opens an incident and sends an alert\n\n" +
                                "**Anomaly Types:**\n" +
                                "- `SPIKE_ERROR_RATE`: a minute whose error rate AND volume are both above mean + 2 std\n" +
                                "- `SERVICE_ERROR_RATE`: a service (5+ logs) with more than 30% errors\n" +
                                "- `VOLUME_OUTLIER`: a minute the Isolation Forest isolates on volume (10+ minutes needed)\n\n" +
                                "Incident summaries are generated on demand via `GET /api/v1/incidents/{id}/summary`.")
                        .contact(new Contact().name("Incident Monitoring Team")));
    }
}
