package com.vidnyan.guard.application.port.in;

import com.vidnyan.guard.domain.rule.RuleSetTier;

import java.util.List;
import java.util.Map;

/**
 * Primary use case: decide whether an intercepted tool call may run.
 * This is the single entry point the host's call-site hook talks to.
 */
public interface GuardToolCallUseCase {

    /**
     * Decide on one tool call. Never throws; anything that cannot be decided
     * on is answered with "no opinion".
     */
    HookResponse beforeToolCall(HookRequest request);

    /**
     * Current rule-provider state, for operators.
     */
    GuardStatus status();

    /**
     * A tool call as the host reports it.
     */
    record HookRequest(
        String toolName,
        Map<String, Object> params
    ) {
        public HookRequest {
            params = params == null ? Map.of() : params;
        }

        public static HookRequest exec(String command) {
            return new HookRequest("exec", Map.of("command", command));
        }
    }

    /**
     * The host's instruction. {@code block == false} means "no opinion".
     */
    record HookResponse(
        boolean block,
        String blockReason
    ) {
        public static HookResponse noOpinion() {
            return new HookResponse(false, null);
        }

        public static HookResponse block(String reason) {
            return new HookResponse(true, reason);
        }
    }

    record GuardStatus(
        boolean enabled,
        boolean controlPlaneReachable,
        RuleSetTier tier,
        int selfProtectionRules,
        int activeRules,
        List<String> ruleErrors
    ) {}
}
