package com.vidnyan.guard.adapter.in.cli;

import com.vidnyan.guard.support.CountingRuleSource;
import com.vidnyan.guard.support.GuardFixtures;
import com.vidnyan.guard.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;

class RuleTestCliRunnerTest {

    private RuleTestCliRunner runner(CountingRuleSource source, String rule, String input, String tool) {
        RuleTestCliRunner runner = new RuleTestCliRunner(
                GuardFixtures.selfProtection(),
                GuardFixtures.provider(source, new MutableClock()),
                null);
        ReflectionTestUtils.setField(runner, "ruleName", rule);
        ReflectionTestUtils.setField(runner, "input", input);
        ReflectionTestUtils.setField(runner, "tool", tool);
        return runner;
    }

    @Test
    void runTest_ShouldFindRemoteRule() {
        CountingRuleSource source = new CountingRuleSource(GuardFixtures.dangerousRm());

        assertEquals(0, runner(source, "dangerous_rm", "rm -rf ~/", "exec").runTest());
        assertEquals(1, source.fetchCount());
    }

    @Test
    void runTest_ShouldFindSelfProtectionRule() {
        CountingRuleSource source = new CountingRuleSource();

        assertEquals(0, runner(source, "self_protect_process", "pkill -f openclaw", "exec").runTest());
    }

    @Test
    void runTest_ShouldOfferFallbackRulesWhenControlPlaneIsDown() {
        CountingRuleSource source = new CountingRuleSource();
        source.goDown();

        assertEquals(0, runner(source, "wallet_access", "cat ~/.wallet", "read").runTest());
    }

    @Test
    void runTest_ShouldFailForUnknownRule() {
        CountingRuleSource source = new CountingRuleSource();

        assertEquals(1, runner(source, "no_such_rule", "anything", "exec").runTest());
    }

    @Test
    void run_ShouldDoNothingWithoutTestProperties() {
        CountingRuleSource source = new CountingRuleSource();

        runner(source, "", "", "exec").run();

        assertEquals(0, source.fetchCount());
    }
}
