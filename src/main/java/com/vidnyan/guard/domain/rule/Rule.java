package com.vidnyan.guard.domain.rule;

import java.util.EnumSet;
import java.util.Set;

/**
 * A single policy statement. Immutable value object.
 *
 * <p>{@code protectedRule} is true only for members of the self-protection
 * set. Nothing that parses remote rule records ever sets it.
 */
public record Rule(
    String name,
    String description,
    MatchSpec matchSpec,
    RiskLevel riskLevel,
    RuleAction action,
    Set<ToolKind> appliesTo,    // empty = all kinds
    boolean enabled,
    boolean protectedRule
) {

    public Rule {
        description = description == null ? "" : description;
        riskLevel = riskLevel == null ? RiskLevel.WARNING : riskLevel;
        action = action == null ? RuleAction.ALERT : action;
        appliesTo = appliesTo == null || appliesTo.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(appliesTo));
    }

    /**
     * Whether this rule is evaluated for the given tool kind.
     */
    public boolean appliesTo(ToolKind kind) {
        return appliesTo.isEmpty() || appliesTo.contains(kind);
    }

    /**
     * Copy with a different match spec, used when a template is expanded.
     */
    public Rule withMatchSpec(MatchSpec spec, Set<ToolKind> kinds, String desc) {
        return new Rule(name, desc, spec, riskLevel, action, kinds, enabled, protectedRule);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String description = "";
        private MatchSpec matchSpec;
        private RiskLevel riskLevel = RiskLevel.WARNING;
        private RuleAction action = RuleAction.ALERT;
        private Set<ToolKind> appliesTo = Set.of();
        private boolean enabled = true;

        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String desc) { this.description = desc; return this; }
        public Builder matchSpec(MatchSpec spec) { this.matchSpec = spec; return this; }
        public Builder regex(String pattern) { this.matchSpec = new RegexMatch(pattern); return this; }
        public Builder keyword(KeywordMatch keyword) { this.matchSpec = keyword; return this; }
        public Builder riskLevel(RiskLevel risk) { this.riskLevel = risk; return this; }
        public Builder action(RuleAction action) { this.action = action; return this; }
        public Builder appliesTo(Set<ToolKind> kinds) { this.appliesTo = kinds; return this; }
        public Builder appliesTo(ToolKind... kinds) { this.appliesTo = Set.of(kinds); return this; }
        public Builder enabled(boolean enabled) { this.enabled = enabled; return this; }

        public Rule build() {
            return new Rule(name, description, matchSpec, riskLevel, action, appliesTo, enabled, false);
        }

        /**
         * Build a self-protection rule. These are always enabled and always
         * block at critical risk, whatever was configured on the builder.
         */
        public Rule buildProtected() {
            return new Rule(name, description, matchSpec, RiskLevel.CRITICAL, RuleAction.CRITICAL_ALERT,
                    appliesTo, true, true);
        }
    }
}
