package com.vidnyan.guard.application.service;

import com.vidnyan.guard.domain.event.ToolCallEvent;
import com.vidnyan.guard.domain.protection.SelfProtectionSet;
import com.vidnyan.guard.domain.rule.CompiledRule;
import com.vidnyan.guard.domain.rule.RuleMatcher;
import com.vidnyan.guard.domain.rule.RuleSetTier;
import com.vidnyan.guard.domain.verdict.RuleMatch;
import com.vidnyan.guard.domain.verdict.Verdict;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns one tool-call event into one verdict.
 *
 * <p>Self-protection runs first and unconditionally. Only when it does not
 * match is the effective rule set consulted, and then every rule is evaluated
 * so that the alert can name all of them. The engine does no delivery itself;
 * the verdict carries the alert payload.
 */
@Slf4j
public class DecisionEngine {

    private final SelfProtectionSet selfProtection;
    private final RuleProvider ruleProvider;
    private final boolean rulesEnabled;
    private final int maxCandidateLength;
    private final boolean enforceBlocking;

    public DecisionEngine(SelfProtectionSet selfProtection, RuleProvider ruleProvider,
                          boolean rulesEnabled, int maxCandidateLength) {
        this(selfProtection, ruleProvider, rulesEnabled, maxCandidateLength, true);
    }

    /**
     * @param enforceBlocking when false, blocking actions of remote and fallback
     *                        rules are reported as alerts; self-protection still blocks
     */
    public DecisionEngine(SelfProtectionSet selfProtection, RuleProvider ruleProvider,
                          boolean rulesEnabled, int maxCandidateLength, boolean enforceBlocking) {
        this.selfProtection = selfProtection;
        this.ruleProvider = ruleProvider;
        this.rulesEnabled = rulesEnabled;
        this.maxCandidateLength = maxCandidateLength;
        this.enforceBlocking = enforceBlocking;
    }

    public Verdict decide(ToolCallEvent event) {
        if (event == null || event.candidate() == null || event.candidate().isBlank()) {
            return Verdict.allow(event, RuleSetTier.NONE);
        }

        Optional<RuleMatch> protectedMatch = selfProtection.check(event);
        if (protectedMatch.isPresent()) {
            RuleMatch match = protectedMatch.get();
            log.warn("Self-protection block: rule={} tool={}", match.ruleName(), event.kind());
            return Verdict.selfProtectionBlock(event, match, maxCandidateLength);
        }

        if (!rulesEnabled) {
            return Verdict.allow(event, RuleSetTier.NONE);
        }

        RuleProvider.EffectiveRules effective = ruleProvider.getEffectiveRules();
        List<RuleMatch> matches = new ArrayList<>();
        for (CompiledRule rule : effective.ruleSet().rules()) {
            if (RuleMatcher.evaluate(rule, event)) {
                matches.add(RuleMatch.of(rule.rule()));
            }
        }

        Verdict verdict = Verdict.resolve(event, matches, effective.tier(), maxCandidateLength, enforceBlocking);
        switch (verdict.decision()) {
            case BLOCK -> log.warn("Blocked: rule={} tool={} tier={} matched={}",
                    verdict.blockingMatch().ruleName(), event.kind(), effective.tier(), verdict.matchedRuleNames());
            case ALLOW_WITH_ALERT -> log.info("Alert: tool={} tier={} matched={}",
                    event.kind(), effective.tier(), verdict.matchedRuleNames());
            case ALLOW -> log.trace("Allowed: tool={} tier={}", event.kind(), effective.tier());
        }
        return verdict;
    }

    public boolean isRulesEnabled() {
        return rulesEnabled;
    }

    public boolean isEnforceBlocking() {
        return enforceBlocking;
    }
}
