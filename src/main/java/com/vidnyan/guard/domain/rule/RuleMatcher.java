package com.vidnyan.guard.domain.rule;

import com.vidnyan.guard.domain.event.ToolCallEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether one compiled rule matches one tool-call event.
 * No state, no I/O, never throws: anything unexpected is a non-match.
 */
@Slf4j
public final class RuleMatcher {

    public static boolean evaluate(CompiledRule compiled, ToolCallEvent event) {
        if (compiled == null || event == null) {
            return false;
        }
        Rule rule = compiled.rule();
        if (!rule.enabled() || !rule.appliesTo(event.kind())) {
            return false;
        }
        return evaluate(compiled, event.kind(), event.candidate());
    }

    /**
     * Match against an explicit candidate, ignoring enablement and scope.
     *
     * <p>File paths are tested in forward-slash form and in canonical form.
     * Other candidates are tested as written and, when they contain
     * backslashes, in forward-slash form as well.
     */
    public static boolean evaluate(CompiledRule compiled, ToolKind kind, String candidate) {
        if (candidate == null || candidate.isEmpty()) {
            return false;
        }
        boolean ignoreCase = CandidateNormalizer.ignoreCase(kind);
        try {
            if (kind != null && kind.isPathBearing()) {
                String path = CandidateNormalizer.separators(candidate);
                String canonical = CandidateNormalizer.canonicalPath(candidate);
                return compiled.test(path, ignoreCase)
                        || (!canonical.equals(path) && compiled.test(canonical, ignoreCase));
            }
            String forwardSlashes = CandidateNormalizer.separators(candidate);
            return compiled.test(candidate, ignoreCase)
                    || (!forwardSlashes.equals(candidate) && compiled.test(forwardSlashes, ignoreCase));
        } catch (RuntimeException e) {
            log.warn("Rule {} failed while matching, treating as no match: {}", compiled.name(), e.toString());
            return false;
        }
    }

    private RuleMatcher() {}
}
