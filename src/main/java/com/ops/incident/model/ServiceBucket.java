package com.ops.incident.model;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class ServiceBucket {

    private final String service;
    private long total;
    private long errorCount;

    public ServiceBucket(String service) {
        this.service = service;
    }

    public void record(SeverityClass severity) {
        total++;
        if (severity == SeverityClass.ERROR) {
            errorCount++;
        }
    }

    public double getErrorRate() {
        return total == 0 ? 0.0 : (double) errorCount / total;
    }
}
