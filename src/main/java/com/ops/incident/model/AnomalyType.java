package com.ops.incident.model;

/**
 * Kinds of anomaly the engine reports. Declaration order is the order in which
 * detector output is assembled.
 */
public enum AnomalyType {
    SPIKE_ERROR_RATE,
    SERVICE_ERROR_RATE,
    VOLUME_OUTLIER
}
