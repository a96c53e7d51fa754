package com.vidnyan.guard.domain.rule;

/**
 * Regular expression match against the candidate string. Patterns are
 * compiled with RE2 semantics, so lookaround assertions are rejected.
 */
public record RegexMatch(String pattern) implements MatchSpec {

    @Override
    public String type() {
        return "regex";
    }
}
