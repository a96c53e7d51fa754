package com.vidnyan.guard.domain.rule;

/**
 * Which tier produced the remote-or-fallback rules for an evaluation.
 */
public enum RuleSetTier {
    /** Fetched from the control plane within the cache TTL. */
    FRESH,
    /** Control plane unreachable; last good fetch reused past its TTL. */
    STALE,
    /** Control plane unreachable and nothing cached; built-in rules. */
    FALLBACK,
    /** Remote rules were not consulted (self-protection verdict or engine disabled). */
    NONE;

    public boolean isDegraded() {
        return this == STALE || this == FALLBACK;
    }
}
