package com.vidnyan.guard.domain.rule;

import com.google.re2j.Pattern;

/**
 * RE2 pattern compiled in both case modes at load time.
 */
final class RegexCondition implements RuleCondition {

    private final Pattern caseSensitive;
    private final Pattern caseInsensitive;

    RegexCondition(String pattern) {
        this.caseSensitive = Pattern.compile(pattern);
        this.caseInsensitive = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
    }

    @Override
    public boolean test(String subject, boolean ignoreCase) {
        Pattern pattern = ignoreCase ? caseInsensitive : caseSensitive;
        return pattern.matcher(subject).find();
    }
}
