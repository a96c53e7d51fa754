package com.vidnyan.guard.application.service;

import com.vidnyan.guard.application.port.out.ControlPlaneUnreachableException;
import com.vidnyan.guard.application.port.out.RuleSource;
import com.vidnyan.guard.domain.rule.Rule;
import com.vidnyan.guard.domain.rule.RuleCompiler;
import com.vidnyan.guard.domain.rule.RuleSet;
import com.vidnyan.guard.domain.rule.RuleSetTier;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the remote rule cache and decides which rule set tier is in effect.
 *
 * <p>Readers never lock: the cache is an immutable snapshot swapped atomically.
 * A refresh runs on {@code fetchExecutor} and is single-flight, so concurrent
 * callers that find the cache expired all wait on the same fetch. Each caller
 * waits at most {@code fetchTimeout} and then falls back to the stale cache or
 * the built-in fallback set. A fetch that completes after its callers gave up
 * still updates the cache.
 */
@Slf4j
public class RuleProvider {

    private final RuleSource source;
    private final RuleCompiler compiler;
    private final Set<String> reservedNames;
    private final RuleSet fallback;
    private final Clock clock;
    private final Duration ttl;
    private final Duration fetchTimeout;
    private final Executor fetchExecutor;

    private final AtomicReference<CachedRuleSet> cache = new AtomicReference<>();
    private final AtomicReference<CompletableFuture<CachedRuleSet>> inFlight = new AtomicReference<>();
    private final AtomicBoolean reachable = new AtomicBoolean(false);

    public RuleProvider(RuleSource source,
                        RuleCompiler compiler,
                        Set<String> reservedNames,
                        List<Rule> fallbackRules,
                        Clock clock,
                        Duration ttl,
                        Duration fetchTimeout,
                        Executor fetchExecutor) {
        this.source = source;
        this.compiler = compiler;
        this.reservedNames = Set.copyOf(reservedNames);
        this.fallback = RuleSet.load(fallbackRules, compiler, this.reservedNames);
        this.clock = clock;
        this.ttl = ttl;
        this.fetchTimeout = fetchTimeout;
        this.fetchExecutor = fetchExecutor;
        if (!fallback.errors().isEmpty()) {
            throw new IllegalStateException("Built-in fallback rules do not compile: " + fallback.errors());
        }
    }

    /**
     * The rule set to evaluate right now, and the tier it came from.
     */
    public EffectiveRules getEffectiveRules() {
        CachedRuleSet current = cache.get();
        if (current != null && isFresh(current, clock.instant())) {
            return new EffectiveRules(current.ruleSet(), RuleSetTier.FRESH);
        }

        CompletableFuture<CachedRuleSet> refresh = refresh();
        try {
            CachedRuleSet fetched = refresh.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return new EffectiveRules(fetched.ruleSet(), RuleSetTier.FRESH);
        } catch (TimeoutException e) {
            reachable.set(false);
            log.warn("Control plane did not answer within {}ms", fetchTimeout.toMillis());
        } catch (ExecutionException e) {
            log.warn("Rule refresh from {} failed: {}", source.describe(), e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for rule refresh");
        }
        return degraded();
    }

    private EffectiveRules degraded() {
        CachedRuleSet stale = cache.get();
        if (stale != null) {
            log.warn("Degraded mode: using stale rules fetched at {} ({} rules)",
                    stale.fetchedAt(), stale.ruleSet().size());
            return new EffectiveRules(stale.ruleSet(), RuleSetTier.STALE);
        }
        log.warn("Degraded mode: no cached rules, using {} built-in fallback rules", fallback.size());
        return new EffectiveRules(fallback, RuleSetTier.FALLBACK);
    }

    private CompletableFuture<CachedRuleSet> refresh() {
        while (true) {
            CompletableFuture<CachedRuleSet> existing = inFlight.get();
            if (existing != null) {
                return existing;
            }
            CompletableFuture<CachedRuleSet> started = new CompletableFuture<>();
            if (inFlight.compareAndSet(null, started)) {
                // another caller's fetch may have landed since our cache check
                CachedRuleSet current = cache.get();
                if (current != null && isFresh(current, clock.instant())) {
                    inFlight.compareAndSet(started, null);
                    started.complete(current);
                    return started;
                }
                try {
                    fetchExecutor.execute(() -> fetch(started));
                } catch (RejectedExecutionException e) {
                    inFlight.compareAndSet(started, null);
                    started.completeExceptionally(new ControlPlaneUnreachableException("Rule fetch rejected", e));
                }
                return started;
            }
        }
    }

    private void fetch(CompletableFuture<CachedRuleSet> result) {
        try {
            RuleSource.FetchedRules fetched = source.fetchRules();
            RuleSet loaded = RuleSet.load(fetched.rules(), compiler, reservedNames)
                    .withRejected(fetched.rejected());
            CachedRuleSet fresh = new CachedRuleSet(loaded, clock.instant());
            cache.set(fresh);
            reachable.set(true);
            log.debug("Fetched {} rules from {} ({} excluded, {} shadowed)",
                    loaded.size(), source.describe(), loaded.errors().size(), loaded.shadowed().size());
            inFlight.compareAndSet(result, null);
            result.complete(fresh);
        } catch (ControlPlaneUnreachableException | RuntimeException e) {
            reachable.set(false);
            inFlight.compareAndSet(result, null);
            result.completeExceptionally(e);
        }
    }

    private boolean isFresh(CachedRuleSet cached, Instant now) {
        return Duration.between(cached.fetchedAt(), now).compareTo(ttl) < 0;
    }

    public boolean isControlPlaneReachable() {
        return reachable.get();
    }

    /**
     * The tier a call would get right now, without fetching.
     */
    public RuleSetTier currentTier() {
        CachedRuleSet current = cache.get();
        if (current == null) {
            return RuleSetTier.FALLBACK;
        }
        return isFresh(current, clock.instant()) ? RuleSetTier.FRESH : RuleSetTier.STALE;
    }

    /**
     * The cached remote set if one was ever fetched, else the fallback set.
     */
    public RuleSet currentRuleSet() {
        CachedRuleSet current = cache.get();
        return current != null ? current.ruleSet() : fallback;
    }

    public RuleSet fallbackRuleSet() {
        return fallback;
    }

    /**
     * Rule set together with the tier that supplied it.
     */
    public record EffectiveRules(RuleSet ruleSet, RuleSetTier tier) {

        public boolean isDegraded() {
            return tier.isDegraded();
        }
    }

    private record CachedRuleSet(RuleSet ruleSet, Instant fetchedAt) {}
}
