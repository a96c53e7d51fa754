package com.vidnyan.guard.domain.verdict;

/**
 * Final outcome for one tool call.
 */
public enum Decision {
    ALLOW,
    ALLOW_WITH_ALERT,
    BLOCK
}
