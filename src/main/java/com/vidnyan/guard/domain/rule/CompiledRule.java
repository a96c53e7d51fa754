package com.vidnyan.guard.domain.rule;

/**
 * A rule together with its compiled matcher. Only {@link RuleCompiler}
 * creates these, so every instance is known to be usable.
 */
public final class CompiledRule {

    private final Rule rule;
    private final RuleCondition condition;

    CompiledRule(Rule rule, RuleCondition condition) {
        this.rule = rule;
        this.condition = condition;
    }

    public Rule rule() {
        return rule;
    }

    public String name() {
        return rule.name();
    }

    boolean test(String subject, boolean ignoreCase) {
        return condition.test(subject, ignoreCase);
    }

    @Override
    public String toString() {
        return "CompiledRule[" + rule.name() + ", " + rule.matchSpec().type() + "]";
    }
}
