package com.vidnyan.guard.domain.rule;

import com.vidnyan.guard.domain.rule.template.TemplateParams;

/**
 * Reference to a named rule template. Expanded into a concrete
 * {@link RegexMatch} when the rule is compiled; never evaluated directly.
 */
public record TemplateMatch(String templateId, TemplateParams params) implements MatchSpec {

    public TemplateMatch {
        params = params == null ? TemplateParams.empty() : params;
    }

    @Override
    public String type() {
        return "template";
    }
}
