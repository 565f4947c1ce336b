package com.ops.incident.config;

import com.ops.incident.model.AnomalySeverity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String toNumber;
    private boolean enabled = false;
    private String channel = "sms";  // "sms" or "whatsapp"

    // Text messages go out only for incidents at least this severe.
    private AnomalySeverity minSeverity = AnomalySeverity.HIGH;

    public boolean shouldNotify(AnomalySeverity severity) {
        return severity != null && severity.ordinal() <= minSeverity.ordinal();
    }
}
