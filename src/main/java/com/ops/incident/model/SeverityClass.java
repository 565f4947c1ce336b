package com.ops.incident.model;

import java.util.Locale;
import java.util.Set;

/**
 * Coarse categorization of a log level. Membership is fixed and case-insensitive.
 */
public enum SeverityClass {
    ERROR,
    WARNING,
    OTHER;

    public static final Set<String> ERROR_LEVELS = Set.of("error", "critical", "fatal", "panic");
    public static final Set<String> WARNING_LEVELS = Set.of("warn", "warning");

    public static SeverityClass fromLevel(String level) {
        if (level == null) return OTHER;
        String normalized = level.toLowerCase(Locale.ROOT);
        if (ERROR_LEVELS.contains(normalized)) return ERROR;
        if (WARNING_LEVELS.contains(normalized)) return WARNING;
        return OTHER;
    }
}
