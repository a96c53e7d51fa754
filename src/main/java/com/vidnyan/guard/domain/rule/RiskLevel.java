package com.vidnyan.guard.domain.rule;

import java.util.Locale;

/**
 * Risk levels, ordered from least to most severe.
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL;

    /**
     * Lenient parse; unknown or missing values default to {@link #WARNING}.
     */
    public static RiskLevel fromWire(String value) {
        if (value == null) return WARNING;
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "INFO" -> INFO;
            case "WARN", "WARNING" -> WARNING;
            case "CRITICAL", "HIGH" -> CRITICAL;
            default -> WARNING;
        };
    }
}
