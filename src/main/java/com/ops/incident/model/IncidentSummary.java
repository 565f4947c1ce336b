package com.ops.incident.model;

/**
 * Natural-language analysis of an incident.
 *
 * @param generated false for the fixed fallback pairs returned when the model is
 *                  unconfigured or failed; those are shown but never stored
 */
public record IncidentSummary(String summary, String rootCause, boolean generated) {

    public static IncidentSummary generated(String summary, String rootCause) {
        return new IncidentSummary(summary, rootCause, true);
    }

    public static IncidentSummary fallback(String summary, String rootCause) {
        return new IncidentSummary(summary, rootCause, false);
    }
}
