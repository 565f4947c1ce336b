package com.ops.incident.service;

import com.ops.incident.config.MetricsConfig;
import com.ops.incident.config.TwilioNotificationConfig;
import com.ops.incident.model.Incident;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

@Service
public class TwilioNotificationService {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification service initialized. Channel: {}, min severity: {}",
                    config.getChannel(), config.getMinSeverity());
        } else {
            log.info("Twilio notification service is DISABLED.");
        }
    }

    @Async
    @Observed(name = "notification.twilio", contextualName = "send-twilio-alert")
    public void notifyIncident(Incident incident) {
        if (!config.isEnabled() || !config.shouldNotify(incident.getSeverity())) {
            return;
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getToNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    buildMessageBody(incident)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Twilio alert sent for incident={}, sid={}", incident.getId(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send Twilio alert for incident={}: {}", incident.getId(), e.getMessage(), e);
        }
    }

    static String buildMessageBody(Incident incident) {
        return String.format(
                "[INCIDENT ALERT] #%d opened\n" +
                "Severity: %s\n" +
                "Status: %s\n" +
                "%s",
                incident.getId(),
                incident.getSeverity().name(),
                incident.getStatus().name(),
                incident.getDescription()
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
