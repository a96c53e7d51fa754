package com.vidnyan.guard.domain.rule.template;

import java.util.List;
import java.util.function.Function;

/**
 * A named, parameterized rule generator.
 */
public record RuleTemplate(
    String id,
    String description,
    String category,
    List<String> requiredParams,
    Function<TemplateParams, TemplateExpansion> expander
) {

    /**
     * @throws IllegalArgumentException when a required parameter is missing
     *                                  or the expansion yields no patterns
     */
    public TemplateExpansion expand(TemplateParams params) {
        TemplateParams p = params == null ? TemplateParams.empty() : params;
        for (String required : requiredParams) {
            boolean present = switch (required) {
                case "path" -> !p.allPaths().isEmpty();
                case "commands" -> !p.commandsOrPatterns().isEmpty();
                default -> p.extra().containsKey(required);
            };
            if (!present) {
                throw new IllegalArgumentException("missing required parameter '" + required + "'");
            }
        }
        TemplateExpansion expansion = expander.apply(p);
        if (expansion.patterns().isEmpty()) {
            throw new IllegalArgumentException("expansion produced no patterns");
        }
        return expansion;
    }
}
