package com.vidnyan.guard.domain.rule;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Immutable, ordered set of compiled rules. Replaced wholesale, never patched.
 */
@Slf4j
public record RuleSet(
    List<CompiledRule> rules,
    List<RuleCompileError> errors,
    List<String> shadowed
) {

    public RuleSet {
        rules = List.copyOf(rules);
        errors = List.copyOf(errors);
        shadowed = List.copyOf(shadowed);
    }

    public static RuleSet empty() {
        return new RuleSet(List.of(), List.of(), List.of());
    }

    /**
     * Compile a batch of rules. Disabled rules are skipped, rules that fail to
     * compile are recorded and excluded, and rules whose name is reserved by the
     * self-protection set are shadowed (dropped) rather than allowed to replace it.
     */
    public static RuleSet load(Collection<Rule> source, RuleCompiler compiler, Set<String> reservedNames) {
        List<CompiledRule> compiled = new ArrayList<>();
        List<RuleCompileError> errors = new ArrayList<>();
        List<String> shadowed = new ArrayList<>();

        for (Rule rule : source) {
            if (rule == null || !rule.enabled()) {
                continue;
            }
            if (reservedNames.contains(rule.name())) {
                log.warn("Rule {} is shadowed by the self-protection rule of the same name", rule.name());
                shadowed.add(rule.name());
                continue;
            }
            try {
                compiled.add(compiler.compile(rule));
            } catch (RuleCompileException e) {
                log.warn("Excluding rule {}: {}", e.getRuleName(), e.getMessage());
                errors.add(RuleCompileError.of(e));
            }
        }
        return new RuleSet(compiled, errors, shadowed);
    }

    /**
     * Copy that also reports records rejected before compilation, such as
     * remote records that could not be mapped to a rule at all.
     */
    public RuleSet withRejected(List<RuleCompileError> rejected) {
        if (rejected.isEmpty()) {
            return this;
        }
        List<RuleCompileError> all = new ArrayList<>(rejected);
        all.addAll(errors);
        return new RuleSet(rules, all, shadowed);
    }

    public int size() {
        return rules.size();
    }

    public List<String> names() {
        return rules.stream().map(CompiledRule::name).toList();
    }
}
