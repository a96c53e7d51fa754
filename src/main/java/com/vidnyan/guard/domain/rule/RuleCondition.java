package com.vidnyan.guard.domain.rule;

/**
 * Compiled form of a {@link MatchSpec}.
 */
interface RuleCondition {

    /**
     * @param subject    candidate string, already normalized for its tool kind
     * @param ignoreCase whether letter case is insignificant for this candidate
     */
    boolean test(String subject, boolean ignoreCase);
}
