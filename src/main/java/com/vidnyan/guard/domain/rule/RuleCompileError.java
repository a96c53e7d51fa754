package com.vidnyan.guard.domain.rule;

/**
 * Record of a rule that was excluded from a rule set because it failed to compile.
 */
public record RuleCompileError(String ruleName, String reason) {

    public static RuleCompileError of(RuleCompileException e) {
        return new RuleCompileError(e.getRuleName(), e.getMessage());
    }
}
