package com.vidnyan.guard.domain.verdict;

import com.vidnyan.guard.domain.event.ToolCallEvent;
import com.vidnyan.guard.domain.rule.RiskLevel;
import com.vidnyan.guard.domain.rule.RuleSetTier;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The engine's decision for one tool call, with everything needed to explain
 * it to the agent and to notify alert sinks.
 */
public record Verdict(
    Decision decision,
    ToolCallEvent event,
    RuleMatch blockingMatch,    // null unless decision == BLOCK
    List<RuleMatch> matches,    // every matched rule, in evaluation order
    RuleSetTier tier,
    AlertNotification notification  // null for ALLOW
) {

    public Verdict {
        matches = List.copyOf(matches);
    }

    public static Verdict allow(ToolCallEvent event, RuleSetTier tier) {
        return new Verdict(Decision.ALLOW, event, null, List.of(), tier, null);
    }

    /**
     * Self-protection block. Remote rules were never consulted.
     */
    public static Verdict selfProtectionBlock(ToolCallEvent event, RuleMatch match, int maxCandidateLength) {
        List<RuleMatch> matches = List.of(match);
        return new Verdict(Decision.BLOCK, event, match, matches, RuleSetTier.NONE,
                notify(event, matches, true, RuleSetTier.NONE, maxCandidateLength));
    }

    /**
     * Resolve a verdict from the matches of the effective rule set. The first
     * blocking match in evaluation order is reported as the reason; the rest are
     * carried along for alerting.
     */
    public static Verdict resolve(ToolCallEvent event, List<RuleMatch> matches, RuleSetTier tier,
                                  int maxCandidateLength) {
        return resolve(event, matches, tier, maxCandidateLength, true);
    }

    /**
     * As {@link #resolve(ToolCallEvent, List, RuleSetTier, int)}, but when
     * {@code enforceBlocking} is false a blocking match only alerts.
     */
    public static Verdict resolve(ToolCallEvent event, List<RuleMatch> matches, RuleSetTier tier,
                                  int maxCandidateLength, boolean enforceBlocking) {
        if (matches.isEmpty()) {
            return allow(event, tier);
        }
        Optional<RuleMatch> blocking = enforceBlocking
                ? matches.stream().filter(RuleMatch::isBlocking).findFirst()
                : Optional.empty();
        Decision decision = blocking.isPresent() ? Decision.BLOCK : Decision.ALLOW_WITH_ALERT;
        return new Verdict(decision, event, blocking.orElse(null), matches, tier,
                notify(event, matches, blocking.isPresent(), tier, maxCandidateLength));
    }

    private static AlertNotification notify(ToolCallEvent event, List<RuleMatch> matches, boolean blocked,
                                            RuleSetTier tier, int maxCandidateLength) {
        RiskLevel highest = matches.stream()
                .map(RuleMatch::riskLevel)
                .max(Comparator.naturalOrder())
                .orElse(RiskLevel.INFO);
        boolean selfProtection = matches.stream().anyMatch(RuleMatch::selfProtection);
        return new AlertNotification(
                event.kind(),
                TextTruncation.truncate(event.candidate(), maxCandidateLength),
                matches.stream().map(RuleMatch::ruleName).toList(),
                highest,
                blocked,
                selfProtection,
                tier);
    }

    public boolean isBlocked() {
        return decision == Decision.BLOCK;
    }

    public boolean isDegraded() {
        return tier != null && tier.isDegraded();
    }

    public boolean isSelfProtection() {
        return blockingMatch != null && blockingMatch.selfProtection();
    }

    public Optional<AlertNotification> alert() {
        return Optional.ofNullable(notification);
    }

    public List<String> matchedRuleNames() {
        return matches.stream().map(RuleMatch::ruleName).toList();
    }

    /**
     * Human-readable reason surfaced to the agent when the call is blocked.
     */
    public String blockReason() {
        if (!isBlocked()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        if (isSelfProtection()) {
            sb.append("🔒 Blocked by Harness Guard (Self-Protection)\n");
        } else {
            sb.append("🛡️ Blocked by Harness Guard\n");
        }
        sb.append("Tool: ").append(event.kind().wireName()).append('\n');
        sb.append("Rule: ").append(blockingMatch.ruleName()).append('\n');
        sb.append("Description: ").append(blockingMatch.description()).append('\n');
        sb.append("Risk Level: ").append(blockingMatch.riskLevel());
        if (isSelfProtection()) {
            sb.append("\nThis action is permanently blocked.");
        } else if (tier == RuleSetTier.FALLBACK) {
            sb.append("\n⚠️ (Fallback mode: control plane unreachable)");
        } else if (tier == RuleSetTier.STALE) {
            sb.append("\n⚠️ (Stale rules: control plane unreachable)");
        }
        return sb.toString();
    }
}
