package com.vidnyan.guard.domain.rule.template;

import com.vidnyan.guard.domain.rule.ToolKind;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Output of expanding a template: concrete patterns, default scope and a description.
 */
public record TemplateExpansion(
    List<String> patterns,
    Set<ToolKind> appliesTo,
    String description
) {

    public TemplateExpansion {
        patterns = List.copyOf(patterns);
        appliesTo = Set.copyOf(appliesTo);
    }

    /**
     * All patterns folded into one alternation. Each alternative keeps its own
     * group so inline flags such as {@code (?i)} stay local to it.
     */
    public String combinedPattern() {
        return patterns.stream()
                .map(p -> "(?:" + p + ")")
                .collect(Collectors.joining("|"));
    }
}
