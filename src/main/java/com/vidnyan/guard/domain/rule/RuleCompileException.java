package com.vidnyan.guard.domain.rule;

/**
 * A single rule could not be compiled. Non-fatal: the rule is excluded from
 * its rule set and the failure is recorded.
 */
public class RuleCompileException extends Exception {

    private final String ruleName;

    public RuleCompileException(String ruleName, String message) {
        super(message);
        this.ruleName = ruleName;
    }

    public RuleCompileException(String ruleName, String message, Throwable cause) {
        super(message, cause);
        this.ruleName = ruleName;
    }

    public String getRuleName() {
        return ruleName;
    }
}
