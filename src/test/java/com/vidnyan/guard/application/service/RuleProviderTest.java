package com.vidnyan.guard.application.service;

import com.vidnyan.guard.application.port.out.MalformedRemoteSetException;
import com.vidnyan.guard.domain.rule.Rule;
import com.vidnyan.guard.domain.rule.RuleSetTier;
import com.vidnyan.guard.support.CountingRuleSource;
import com.vidnyan.guard.support.GuardFixtures;
import com.vidnyan.guard.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RuleProviderTest {

    private final MutableClock clock = new MutableClock();
    private final CountingRuleSource source = new CountingRuleSource(
            Rule.builder().name("remote_rule").regex("terraform destroy").build());

    @Test
    void getEffectiveRules_ShouldFetchOnceWithinTtl() {
        // Arrange
        RuleProvider provider = GuardFixtures.provider(source, clock);

        // Act
        for (int i = 0; i < 10; i++) {
            RuleProvider.EffectiveRules rules = provider.getEffectiveRules();
            assertEquals(RuleSetTier.FRESH, rules.tier());
            clock.advance(Duration.ofSeconds(2));
        }

        // Assert
        assertEquals(1, source.fetchCount());
        assertTrue(provider.isControlPlaneReachable());
    }

    @Test
    void getEffectiveRules_ShouldRefetchAfterTtl() {
        RuleProvider provider = GuardFixtures.provider(source, clock);

        provider.getEffectiveRules();
        clock.advance(GuardFixtures.TTL);
        provider.getEffectiveRules();

        assertEquals(2, source.fetchCount());
    }

    @Test
    void getEffectiveRules_ShouldReplaceSetWholesaleOnRefresh() {
        RuleProvider provider = GuardFixtures.provider(source, clock);
        provider.getEffectiveRules();

        source.setRules(Rule.builder().name("replacement").regex("x").build());
        clock.advance(GuardFixtures.TTL);

        assertEquals(List.of("replacement"), provider.getEffectiveRules().ruleSet().names());
    }

    @Test
    void getEffectiveRules_ShouldUseFallbackWhenNothingCached() {
        source.goDown();
        RuleProvider provider = GuardFixtures.provider(source, clock);

        RuleProvider.EffectiveRules rules = provider.getEffectiveRules();

        assertEquals(RuleSetTier.FALLBACK, rules.tier());
        assertTrue(rules.isDegraded());
        assertTrue(rules.ruleSet().names().contains("dangerous_rm"));
        assertFalse(provider.isControlPlaneReachable());
    }

    @Test
    void getEffectiveRules_ShouldServeStaleCacheOnFailure() {
        // Arrange
        RuleProvider provider = GuardFixtures.provider(source, clock);
        provider.getEffectiveRules();
        source.goDown();
        clock.advance(GuardFixtures.TTL.plusSeconds(1));

        // Act
        RuleProvider.EffectiveRules rules = provider.getEffectiveRules();

        // Assert
        assertEquals(RuleSetTier.STALE, rules.tier());
        assertEquals(List.of("remote_rule"), rules.ruleSet().names());
        assertEquals(RuleSetTier.STALE, provider.currentTier());
    }

    @Test
    void getEffectiveRules_ShouldRetryOnEveryCallWhileDegraded() {
        RuleProvider provider = GuardFixtures.provider(source, clock);
        source.goDown();

        provider.getEffectiveRules();
        provider.getEffectiveRules();
        source.recover();
        RuleProvider.EffectiveRules rules = provider.getEffectiveRules();

        assertEquals(3, source.fetchCount());
        assertEquals(RuleSetTier.FRESH, rules.tier());
        assertTrue(provider.isControlPlaneReachable());
    }

    @Test
    void getEffectiveRules_ShouldTreatMalformedSetAsUnreachable() {
        source.failWith(new MalformedRemoteSetException("Rules response is not a JSON array"));
        RuleProvider provider = GuardFixtures.provider(source, clock);

        assertEquals(RuleSetTier.FALLBACK, provider.getEffectiveRules().tier());
    }

    @Test
    void getEffectiveRules_ShouldShadowSelfProtectionNames() {
        source.setRules(
                Rule.builder().name("self_protect_process").regex("ls").build(),
                Rule.builder().name("remote_rule").regex("ls").build());
        RuleProvider provider = GuardFixtures.provider(source, clock);

        RuleProvider.EffectiveRules rules = provider.getEffectiveRules();

        assertEquals(List.of("remote_rule"), rules.ruleSet().names());
        assertEquals(List.of("self_protect_process"), rules.ruleSet().shadowed());
    }

    @Test
    void getEffectiveRules_ShouldShareOneFetchBetweenConcurrentCallers() throws Exception {
        // Arrange
        ExecutorService fetchExecutor = Executors.newSingleThreadExecutor();
        ExecutorService callers = Executors.newFixedThreadPool(8);
        RuleProvider provider = GuardFixtures.provider(source, clock, Duration.ofSeconds(5), fetchExecutor);
        CountDownLatch gate = source.stall();
        try {
            // Act
            List<Future<RuleProvider.EffectiveRules>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(callers.submit(provider::getEffectiveRules));
            }
            Thread.sleep(200);
            gate.countDown();

            // Assert
            for (Future<RuleProvider.EffectiveRules> result : results) {
                assertEquals(RuleSetTier.FRESH, result.get(5, TimeUnit.SECONDS).tier());
            }
            assertEquals(1, source.fetchCount());
        } finally {
            gate.countDown();
            callers.shutdownNow();
            fetchExecutor.shutdownNow();
        }
    }

    @Test
    void getEffectiveRules_ShouldNotWaitPastFetchTimeout() throws Exception {
        // Arrange
        ExecutorService fetchExecutor = Executors.newSingleThreadExecutor();
        RuleProvider provider = GuardFixtures.provider(source, clock, Duration.ofMillis(100), fetchExecutor);
        CountDownLatch gate = source.stall();
        try {
            // Act
            long start = System.nanoTime();
            RuleProvider.EffectiveRules rules = provider.getEffectiveRules();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            // Assert
            assertEquals(RuleSetTier.FALLBACK, rules.tier());
            assertTrue(elapsedMs < 2000, "waited " + elapsedMs + "ms");

            // the abandoned fetch still lands in the cache
            gate.countDown();
            long deadline = System.currentTimeMillis() + 5000;
            while (provider.currentTier() != RuleSetTier.FRESH && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(RuleSetTier.FRESH, provider.getEffectiveRules().tier());
            assertEquals(1, source.fetchCount());
        } finally {
            gate.countDown();
            fetchExecutor.shutdownNow();
        }
    }
}
