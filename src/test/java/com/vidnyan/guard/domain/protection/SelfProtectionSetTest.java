package com.vidnyan.guard.domain.protection;

import com.vidnyan.guard.domain.event.ExecEvent;
import com.vidnyan.guard.domain.event.FileEditEvent;
import com.vidnyan.guard.domain.event.FileReadEvent;
import com.vidnyan.guard.domain.event.FileWriteEvent;
import com.vidnyan.guard.domain.event.ToolCallEvent;
import com.vidnyan.guard.domain.event.ToolCallEvents;
import com.vidnyan.guard.domain.rule.RiskLevel;
import com.vidnyan.guard.domain.rule.RuleAction;
import com.vidnyan.guard.domain.rule.RuleCompiler;
import com.vidnyan.guard.domain.rule.template.RuleTemplates;
import com.vidnyan.guard.domain.verdict.RuleMatch;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SelfProtectionSetTest {

    private final SelfProtectionSet set = SelfProtectionSet.builtIn(new RuleCompiler(new RuleTemplates()));

    private String matchedRule(ToolCallEvent event) {
        return set.check(event).map(RuleMatch::ruleName).orElse(null);
    }

    @Test
    void builtIn_ShouldCompileEveryRuleAsProtected() {
        assertEquals(SelfProtectionSet.builtInRules().size(), set.rules().size());
        assertTrue(set.rules().stream().allMatch(r -> r.rule().protectedRule()));
        assertTrue(set.ruleNames().containsAll(
                List.of("self_protect_process", "self_protect_path", "self_protect_host_config")));
    }

    @Test
    void check_ShouldBlockKillingTheGuard() {
        // Act
        Optional<RuleMatch> match = set.check(new ExecEvent("pkill -f harness"));

        // Assert
        assertTrue(match.isPresent());
        assertEquals("self_protect_process", match.get().ruleName());
        assertEquals(RiskLevel.CRITICAL, match.get().riskLevel());
        assertEquals(RuleAction.CRITICAL_ALERT, match.get().action());
        assertTrue(match.get().isBlocking());
    }

    @Test
    void check_ShouldMatchCommandsWithoutRegardToCase() {
        assertEquals("self_protect_process", matchedRule(new ExecEvent("PKILL -f Harness")));
        assertEquals("self_protect_stop", matchedRule(new ExecEvent("OpenClaw-Harness   stop")));
    }

    @Test
    void check_ShouldBlockControlPlaneTampering() {
        assertEquals("self_protect_api",
                matchedRule(new ExecEvent("curl -X DELETE http://localhost:8380/api/rules/dangerous_rm")));
        assertEquals("self_protect_patch_revert", matchedRule(new ExecEvent("patch openclaw --revert")));
        assertEquals("self_protect_mv_rm", matchedRule(new ExecEvent("rm -rf /opt/safebot/config")));
        assertEquals("self_protect_chmod", matchedRule(new ExecEvent("chmod 777 /opt/openclaw-harness/")));
    }

    @Test
    void check_ShouldBlockWritesInsideProtectedDirectoryWithEitherSeparator() {
        // Arrange
        ToolCallEvent forward = new FileWriteEvent("/home/dev/safebot/config/extra.yaml", "x: 1");
        ToolCallEvent backward = new FileWriteEvent("C:\\Users\\dev\\safebot\\config\\extra.yaml", "x: 1");
        ToolCallEvent mixedCase = new FileEditEvent("/home/dev/SafeBot/Config/extra.yaml", "a", "b");

        // Act & Assert
        assertEquals("self_protect_path", matchedRule(forward));
        assertEquals("self_protect_path", matchedRule(backward));
        assertEquals("self_protect_path", matchedRule(mixedCase));
    }

    @Test
    void isProtectedPath_ShouldBeSeparatorAgnosticBothWays() {
        assertTrue(SelfProtectionSet.isProtectedPath("D:\\tools\\openclaw-harness\\src\\main.rs"));
        assertTrue(SelfProtectionSet.isProtectedPath("/srv/openclaw-harness/src/main.rs"));
        assertFalse(SelfProtectionSet.isProtectedPath("/srv/other/src/main.rs"));
    }

    @Test
    void check_ShouldBlockEditsThatMentionTheGuardInHostConfig() {
        ToolCallEvent removeEntry = new FileEditEvent("/home/dev/.openclaw/openclaw.json",
                "\"harness-guard\": { \"enabled\": true },", "");
        ToolCallEvent rewrite = new FileWriteEvent("/tmp/moved/clawdbot.json",
                "{\"plugins\": {\"Harness-Guard\": {\"enabled\": false}}}");

        assertEquals("self_protect_host_config", matchedRule(removeEntry));
        assertEquals("self_protect_host_config", matchedRule(rewrite));
    }

    @Test
    void check_ShouldLeaveUnrelatedCallsAlone() {
        assertTrue(set.check(new ExecEvent("rm -rf ~/Documents")).isEmpty());
        assertTrue(set.check(new ExecEvent("ls -la")).isEmpty());
        assertTrue(set.check(new FileWriteEvent("/home/dev/.openclaw/openclaw.json", "{\"theme\": \"dark\"}")).isEmpty());
        assertTrue(set.check(new FileReadEvent("/home/dev/safebot/config/extra.yaml")).isEmpty());
        assertTrue(set.check(new FileWriteEvent("/home/dev/project/README.md", "hello")).isEmpty());
    }

    @Test
    void check_ShouldBlockWritesThatReachProtectedDirectoryIndirectly() {
        ToolCallEvent doubled = new FileWriteEvent("/home/u/openclaw-harness//src/main.rs", "fn main() {}");
        ToolCallEvent dotDot = new FileWriteEvent("/home/u/openclaw-harness/docs/../src/main.rs", "fn main() {}");
        ToolCallEvent dot = new FileEditEvent("C:\\tools\\safebot\\.\\config\\extra.yaml", "a", "b");

        assertNotNull(matchedRule(doubled));
        assertNotNull(matchedRule(dotDot));
        assertEquals("self_protect_path", matchedRule(dot));
    }

    @Test
    void isProtectedPath_ShouldResolveDotSegments() {
        assertTrue(SelfProtectionSet.isProtectedPath("/srv/openclaw-harness/docs/../src/main.rs"));
        assertTrue(SelfProtectionSet.isProtectedPath("/srv/openclaw-harness///src/main.rs"));
        assertFalse(SelfProtectionSet.isProtectedPath("/srv/openclaw-harness/src/../docs/readme.md"));
    }

    @Test
    void check_ShouldBlockMultiEditThatRemovesGuardFromHostConfig() throws Exception {
        ToolCallEvent multiEdit = ToolCallEvents.extract("MultiEdit", Map.of(
                "file_path", "/home/u/.openclaw/openclaw.json",
                "edits", List.of(Map.of("old_string", "\"harness-guard\": { \"enabled\": true },", "new_string", ""))));

        assertEquals("self_protect_host_config", matchedRule(multiEdit));
    }
}
