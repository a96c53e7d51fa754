package com.vidnyan.guard.adapter.in.cli;

import com.vidnyan.guard.application.service.RuleProvider;
import com.vidnyan.guard.domain.protection.SelfProtectionSet;
import com.vidnyan.guard.domain.rule.CompiledRule;
import com.vidnyan.guard.domain.rule.RuleMatcher;
import com.vidnyan.guard.domain.rule.ToolKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CLI runner that tests a single rule against an input string.
 * Runs when guard.test.rule and guard.test.input are set, then exits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleTestCliRunner implements CommandLineRunner {

    private final SelfProtectionSet selfProtection;
    private final RuleProvider ruleProvider;
    private final ConfigurableApplicationContext context;

    @Value("${guard.test.rule:}")
    private String ruleName;

    @Value("${guard.test.input:}")
    private String input;

    @Value("${guard.test.tool:exec}")
    private String tool;

    @Override
    public void run(String... args) {
        if (ruleName == null || ruleName.isBlank() || input == null || input.isBlank()) {
            log.debug("No rule test requested. Set guard.test.rule and guard.test.input.");
            return;
        }

        int exitCode = 1;
        try {
            exitCode = runTest();
        } finally {
            // Ensure application shuts down after the test
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    int runTest() {
        ToolKind kind = ToolKind.fromWire(tool).orElse(ToolKind.EXEC);
        List<CompiledRule> available = availableRules();

        Optional<CompiledRule> found = available.stream()
                .filter(r -> r.name().equals(ruleName))
                .findFirst();
        if (found.isEmpty()) {
            log.info("Rule not found: {}", ruleName);
            log.info("Available rules:");
            available.forEach(r -> log.info("  - {}", r.name()));
            return 1;
        }

        CompiledRule rule = found.get();
        boolean matched = RuleMatcher.evaluate(rule, kind, input);

        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" RULE TEST");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Rule:   {}{}", rule.name(), rule.rule().protectedRule() ? " (self-protection)" : "");
        log.info(" Tool:   {}", kind);
        log.info(" Input:  {}", input);
        log.info("───────────────────────────────────────────────────────────────");
        if (matched) {
            log.info(" ✅ MATCH");
            log.info("   Risk Level: {}", rule.rule().riskLevel());
            log.info("   Action:     {}", rule.rule().action());
        } else {
            log.info(" ❌ NO MATCH");
        }
        if (!rule.rule().appliesTo(kind)) {
            log.info(" Note: rule is not scoped to {}; the engine would skip it for this tool", kind);
        }
        return 0;
    }

    /**
     * Self-protection first, then whatever the provider can get: the remote
     * set when reachable, otherwise stale or fallback rules.
     */
    private List<CompiledRule> availableRules() {
        List<CompiledRule> rules = new ArrayList<>(selfProtection.rules());
        rules.addAll(ruleProvider.getEffectiveRules().ruleSet().rules());
        ruleProvider.fallbackRuleSet().rules().stream()
                .filter(f -> rules.stream().noneMatch(r -> r.name().equals(f.name())))
                .forEach(rules::add);
        return rules;
    }
}
