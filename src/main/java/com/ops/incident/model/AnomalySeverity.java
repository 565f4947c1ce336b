package com.ops.incident.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnomalySeverity {
    HIGH,
    MEDIUM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AnomalySeverity fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
