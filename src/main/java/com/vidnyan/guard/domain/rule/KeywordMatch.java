package com.vidnyan.guard.domain.rule;

import java.util.List;

/**
 * Plain string operators over the candidate. Every non-empty operator must
 * pass for the rule to match.
 */
public record KeywordMatch(
    List<String> contains,      // all must appear
    List<String> anyOf,         // at least one must appear
    List<String> startsWith,    // candidate starts with one of these
    List<String> endsWith,      // candidate ends with one of these
    List<String> glob           // candidate matches one of these globs
) implements MatchSpec {

    public KeywordMatch {
        contains = contains == null ? List.of() : List.copyOf(contains);
        anyOf = anyOf == null ? List.of() : List.copyOf(anyOf);
        startsWith = startsWith == null ? List.of() : List.copyOf(startsWith);
        endsWith = endsWith == null ? List.of() : List.copyOf(endsWith);
        glob = glob == null ? List.of() : List.copyOf(glob);
    }

    @Override
    public String type() {
        return "keyword";
    }

    /**
     * A keyword match with no operators never matches anything.
     */
    public boolean isEmpty() {
        return contains.isEmpty() && anyOf.isEmpty() && startsWith.isEmpty()
                && endsWith.isEmpty() && glob.isEmpty();
    }

    public static KeywordMatch anyOf(String... values) {
        return new KeywordMatch(List.of(), List.of(values), List.of(), List.of(), List.of());
    }

    public static KeywordMatch contains(String... values) {
        return new KeywordMatch(List.of(values), List.of(), List.of(), List.of(), List.of());
    }
}
