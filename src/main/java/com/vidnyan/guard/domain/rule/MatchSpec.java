package com.vidnyan.guard.domain.rule;

/**
 * How a rule decides whether it matches. Exactly one variant per rule:
 * {@link RegexMatch}, {@link KeywordMatch} or {@link TemplateMatch}.
 */
public interface MatchSpec {

    /**
     * Wire name of the variant ("regex", "keyword", "template").
     */
    String type();
}
