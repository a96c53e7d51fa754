package com.vidnyan.guard.domain.verdict;

import com.vidnyan.guard.domain.rule.RiskLevel;
import com.vidnyan.guard.domain.rule.RuleSetTier;
import com.vidnyan.guard.domain.rule.ToolKind;

import java.util.List;

/**
 * Payload handed to alert sinks for every verdict that is not a plain allow.
 */
public record AlertNotification(
    ToolKind toolKind,
    String candidate,           // already truncated for display
    List<String> ruleNames,
    RiskLevel riskLevel,        // highest among matched rules
    boolean blocked,
    boolean selfProtection,
    RuleSetTier tier
) {

    public AlertNotification {
        ruleNames = List.copyOf(ruleNames);
    }

    public boolean degraded() {
        return tier != null && tier.isDegraded();
    }
}
