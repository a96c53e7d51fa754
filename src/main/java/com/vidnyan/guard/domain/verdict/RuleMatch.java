package com.vidnyan.guard.domain.verdict;

import com.vidnyan.guard.domain.rule.RiskLevel;
import com.vidnyan.guard.domain.rule.Rule;
import com.vidnyan.guard.domain.rule.RuleAction;

/**
 * A rule that matched a tool call.
 */
public record RuleMatch(
    String ruleName,
    String description,
    RiskLevel riskLevel,
    RuleAction action,
    boolean selfProtection
) {

    public static RuleMatch of(Rule rule) {
        return new RuleMatch(rule.name(), rule.description(), rule.riskLevel(), rule.action(), rule.protectedRule());
    }

    /**
     * Self-protection matches always block at the most severe action,
     * whatever the rule was declared with.
     */
    public static RuleMatch selfProtection(Rule rule) {
        return new RuleMatch(rule.name(), rule.description(), RiskLevel.CRITICAL, RuleAction.CRITICAL_ALERT, true);
    }

    public boolean isBlocking() {
        return selfProtection || action.isBlocking();
    }
}
