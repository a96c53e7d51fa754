package com.vidnyan.guard.domain.rule;

import com.google.re2j.Pattern;

import java.util.List;
import java.util.Locale;
import java.util.function.BiPredicate;

/**
 * Conjunction of keyword operators. Needles are compared in the same
 * normalized form as the subject (forward slashes, lower case when case is
 * insignificant).
 */
final class KeywordCondition implements RuleCondition {

    private final KeywordMatch keyword;
    private final List<Pattern> globsCaseSensitive;
    private final List<Pattern> globsCaseInsensitive;

    KeywordCondition(KeywordMatch keyword) {
        this.keyword = keyword;
        this.globsCaseSensitive = keyword.glob().stream()
                .map(g -> GlobPattern.globToRegexPattern(CandidateNormalizer.separators(g), false))
                .toList();
        this.globsCaseInsensitive = keyword.glob().stream()
                .map(g -> GlobPattern.globToRegexPattern(CandidateNormalizer.separators(g), true))
                .toList();
    }

    @Override
    public boolean test(String subject, boolean ignoreCase) {
        if (keyword.isEmpty()) {
            return false;
        }
        String text = ignoreCase ? subject.toLowerCase(Locale.ROOT) : subject;

        if (!keyword.contains().isEmpty() && !all(keyword.contains(), text, ignoreCase, String::contains)) {
            return false;
        }
        if (!keyword.anyOf().isEmpty() && !any(keyword.anyOf(), text, ignoreCase, String::contains)) {
            return false;
        }
        if (!keyword.startsWith().isEmpty() && !any(keyword.startsWith(), text, ignoreCase, String::startsWith)) {
            return false;
        }
        if (!keyword.endsWith().isEmpty() && !any(keyword.endsWith(), text, ignoreCase, String::endsWith)) {
            return false;
        }
        if (!keyword.glob().isEmpty()) {
            List<Pattern> globs = ignoreCase ? globsCaseInsensitive : globsCaseSensitive;
            return globs.stream().anyMatch(g -> g.matcher(subject).matches());
        }
        return true;
    }

    private static boolean all(List<String> needles, String text, boolean ignoreCase,
                               BiPredicate<String, String> op) {
        return needles.stream().allMatch(n -> op.test(text, normalize(n, ignoreCase)));
    }

    private static boolean any(List<String> needles, String text, boolean ignoreCase,
                               BiPredicate<String, String> op) {
        return needles.stream().anyMatch(n -> op.test(text, normalize(n, ignoreCase)));
    }

    private static String normalize(String needle, boolean ignoreCase) {
        String n = CandidateNormalizer.separators(needle);
        return ignoreCase ? n.toLowerCase(Locale.ROOT) : n;
    }
}
