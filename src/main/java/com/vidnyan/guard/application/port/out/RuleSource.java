package com.vidnyan.guard.application.port.out;

import com.vidnyan.guard.domain.rule.Rule;
import com.vidnyan.guard.domain.rule.RuleCompileError;

import java.util.List;

/**
 * Output port: where remote rules come from.
 * Implementations perform blocking I/O; callers bound the wait.
 */
public interface RuleSource {

    /**
     * Fetch the complete current rule list, in control-plane order. Records
     * that cannot be mapped are returned as rejections; only a response that
     * is not a list at all fails.
     */
    FetchedRules fetchRules() throws ControlPlaneUnreachableException;

    /**
     * Where rules are fetched from, for logs and status output.
     */
    String describe();

    record FetchedRules(List<Rule> rules, List<RuleCompileError> rejected) {

        public FetchedRules {
            rules = List.copyOf(rules);
            rejected = List.copyOf(rejected);
        }

        public static FetchedRules of(List<Rule> rules) {
            return new FetchedRules(rules, List.of());
        }
    }
}
