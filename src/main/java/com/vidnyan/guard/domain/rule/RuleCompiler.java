package com.vidnyan.guard.domain.rule;

import com.google.re2j.PatternSyntaxException;
import com.vidnyan.guard.domain.rule.template.RuleTemplate;
import com.vidnyan.guard.domain.rule.template.RuleTemplates;
import com.vidnyan.guard.domain.rule.template.TemplateExpansion;

import java.util.Optional;

/**
 * Validates rules and compiles their match specs. Templates are expanded here,
 * so a compiled rule is always regex or keyword.
 */
public class RuleCompiler {

    private final RuleTemplates templates;

    public RuleCompiler(RuleTemplates templates) {
        this.templates = templates;
    }

    public CompiledRule compile(Rule rule) throws RuleCompileException {
        String name = rule.name();
        if (name == null || name.isBlank()) {
            throw new RuleCompileException("<unnamed>", "Rule has no name");
        }
        MatchSpec spec = rule.matchSpec();
        if (spec == null) {
            throw new RuleCompileException(name, "Rule has no match spec");
        }

        if (spec instanceof RegexMatch regex) {
            return new CompiledRule(rule, compileRegex(name, regex.pattern()));
        }
        if (spec instanceof KeywordMatch keyword) {
            return new CompiledRule(rule, compileKeyword(name, keyword));
        }
        if (spec instanceof TemplateMatch template) {
            return compile(expand(rule, template));
        }
        throw new RuleCompileException(name, "Unsupported match type: " + spec.type());
    }

    /**
     * Replace a template reference with the concrete regex rule it generates.
     * The template's scope and description apply only when the rule sets none.
     */
    Rule expand(Rule rule, TemplateMatch template) throws RuleCompileException {
        Optional<RuleTemplate> definition = templates.find(template.templateId());
        if (definition.isEmpty()) {
            throw new RuleCompileException(rule.name(), "Unknown template: " + template.templateId());
        }
        TemplateExpansion expansion;
        try {
            expansion = definition.get().expand(template.params());
        } catch (IllegalArgumentException e) {
            throw new RuleCompileException(rule.name(),
                    "Template " + template.templateId() + ": " + e.getMessage(), e);
        }
        String description = rule.description().isBlank() || rule.description().startsWith("Template:")
                ? expansion.description()
                : rule.description();
        return rule.withMatchSpec(
                new RegexMatch(expansion.combinedPattern()),
                rule.appliesTo().isEmpty() ? expansion.appliesTo() : rule.appliesTo(),
                description);
    }

    private RuleCondition compileRegex(String name, String pattern) throws RuleCompileException {
        if (pattern == null || pattern.isEmpty()) {
            throw new RuleCompileException(name, "Empty regex pattern");
        }
        try {
            return new RegexCondition(pattern);
        } catch (PatternSyntaxException e) {
            throw new RuleCompileException(name, "Invalid pattern: " + e.getMessage(), e);
        }
    }

    private RuleCondition compileKeyword(String name, KeywordMatch keyword) throws RuleCompileException {
        if (keyword.isEmpty()) {
            throw new RuleCompileException(name, "Keyword rule has no operators");
        }
        try {
            return new KeywordCondition(keyword);
        } catch (PatternSyntaxException e) {
            throw new RuleCompileException(name, "Invalid glob: " + e.getMessage(), e);
        }
    }
}
