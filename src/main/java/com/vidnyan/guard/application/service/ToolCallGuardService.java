package com.vidnyan.guard.application.service;

import com.vidnyan.guard.application.port.in.GuardToolCallUseCase;
import com.vidnyan.guard.domain.event.EventExtractionException;
import com.vidnyan.guard.domain.event.ToolCallEvent;
import com.vidnyan.guard.domain.event.ToolCallEvents;
import com.vidnyan.guard.domain.protection.SelfProtectionSet;
import com.vidnyan.guard.domain.rule.RuleSet;
import com.vidnyan.guard.domain.rule.RuleSetTier;
import com.vidnyan.guard.domain.verdict.Verdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Application service behind the host hook.
 * Extracts the event, asks the engine, hands the alert to the dispatcher.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolCallGuardService implements GuardToolCallUseCase {

    private final DecisionEngine decisionEngine;
    private final RuleProvider ruleProvider;
    private final SelfProtectionSet selfProtection;
    private final AlertDispatcher alertDispatcher;

    @Override
    public HookResponse beforeToolCall(HookRequest request) {
        ToolCallEvent event;
        try {
            event = ToolCallEvents.extract(request.toolName(), request.params());
        } catch (EventExtractionException e) {
            log.debug("No opinion on tool call {}: {}", e.getToolName(), e.getMessage());
            return HookResponse.noOpinion();
        }

        Verdict verdict = decisionEngine.decide(event);
        alertDispatcher.dispatch(verdict);

        return verdict.isBlocked()
                ? HookResponse.block(verdict.blockReason())
                : HookResponse.noOpinion();
    }

    @Override
    public GuardStatus status() {
        RuleSet current = ruleProvider.currentRuleSet();
        RuleSetTier tier = decisionEngine.isRulesEnabled() ? ruleProvider.currentTier() : RuleSetTier.NONE;
        return new GuardStatus(
                decisionEngine.isRulesEnabled(),
                ruleProvider.isControlPlaneReachable(),
                tier,
                selfProtection.ruleNames().size(),
                current.size(),
                current.errors().stream().map(e -> e.ruleName() + ": " + e.reason()).toList());
    }
}
