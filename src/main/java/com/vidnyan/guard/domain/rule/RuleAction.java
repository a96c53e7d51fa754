package com.vidnyan.guard.domain.rule;

import java.util.Locale;

/**
 * What happens when a rule matches. Declaration order is severity order;
 * it has nothing to do with evaluation order.
 */
public enum RuleAction {
    LOG_ONLY,
    ALERT,
    PAUSE_AND_ASK,
    BLOCK,
    CRITICAL_ALERT;

    /**
     * Whether a match with this action stops the tool call.
     */
    public boolean isBlocking() {
        return this == PAUSE_AND_ASK || this == BLOCK || this == CRITICAL_ALERT;
    }

    /**
     * Lenient parse: only letters are significant, so {@code critical_alert},
     * {@code CriticalAlert} and {@code critical-alert} are the same action.
     * Unknown or missing values default to {@link #ALERT}.
     */
    public static RuleAction fromWire(String value) {
        if (value == null) return ALERT;
        String letters = value.replaceAll("[^A-Za-z]", "").toLowerCase(Locale.ROOT);
        return switch (letters) {
            case "logonly", "log" -> LOG_ONLY;
            case "alert" -> ALERT;
            case "pauseandask" -> PAUSE_AND_ASK;
            case "block" -> BLOCK;
            case "criticalalert" -> CRITICAL_ALERT;
            default -> ALERT;
        };
    }
}
