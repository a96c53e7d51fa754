package com.vidnyan.guard.domain.protection;

import com.google.re2j.Pattern;
import com.vidnyan.guard.domain.event.ExecEvent;
import com.vidnyan.guard.domain.event.FileEditEvent;
import com.vidnyan.guard.domain.event.FileWriteEvent;
import com.vidnyan.guard.domain.event.PathEvent;
import com.vidnyan.guard.domain.event.ToolCallEvent;
import com.vidnyan.guard.domain.rule.CandidateNormalizer;
import com.vidnyan.guard.domain.rule.CompiledRule;
import com.vidnyan.guard.domain.rule.KeywordMatch;
import com.vidnyan.guard.domain.rule.Rule;
import com.vidnyan.guard.domain.rule.RuleCompileException;
import com.vidnyan.guard.domain.rule.RuleCompiler;
import com.vidnyan.guard.domain.rule.RuleMatcher;
import com.vidnyan.guard.domain.rule.ToolKind;
import com.vidnyan.guard.domain.verdict.RuleMatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.vidnyan.guard.domain.rule.ToolKind.EXEC;
import static com.vidnyan.guard.domain.rule.ToolKind.FILE_EDIT;
import static com.vidnyan.guard.domain.rule.ToolKind.FILE_WRITE;

/**
 * Compiled-in rules that protect the guard's own configuration, process and
 * control channel. Built once at startup, immutable afterwards, never sourced
 * from the control plane and not affected by any configuration switch.
 */
public final class SelfProtectionSet {

    private static final String GUARD_DIRS = "(safebot|openclaw-harness|moltbot-harness)";

    /**
     * Directories and files a write or edit may never target. Matched by
     * containment against the canonical path, ignoring case.
     */
    static final List<String> PROTECTED_PATHS = List.of(
            "safebot/config/",
            "openclaw-harness/config/",
            "moltbot-harness/config/",
            "safebot/src/",
            "openclaw-harness/src/",
            "safebot/target/",
            "openclaw-harness/target/",
            "safebot/openclaw-plugin/",
            "safebot/clawdbot-plugin/",
            "openclaw-harness/openclaw-plugin/",
            "openclaw-harness/clawdbot-plugin/",
            "rules.yaml",
            "safebot.yaml",
            "openclaw-harness.yaml");

    /** Host config files that may carry the guard plugin's own entry. */
    private static final Pattern HOST_CONFIG_FILE = Pattern.compile("(openclaw|clawdbot)\\.json", Pattern.CASE_INSENSITIVE);

    /** The guard's identifier as it appears inside host config content. */
    private static final Pattern GUARD_IDENTIFIER = Pattern.compile("harness-guard|safebot-guard", Pattern.CASE_INSENSITIVE);

    private final List<CompiledRule> rules;
    private final Rule protectedPathRule;
    private final Rule hostConfigRule;
    private final Set<String> names;

    private SelfProtectionSet(List<CompiledRule> rules, Rule protectedPathRule, Rule hostConfigRule) {
        this.rules = List.copyOf(rules);
        this.protectedPathRule = protectedPathRule;
        this.hostConfigRule = hostConfigRule;
        Set<String> all = new LinkedHashSet<>();
        rules.forEach(r -> all.add(r.name()));
        all.add(protectedPathRule.name());
        all.add(hostConfigRule.name());
        this.names = Collections.unmodifiableSet(all);
    }

    /**
     * Compile the built-in set.
     *
     * @throws IllegalStateException if a built-in rule does not compile; the
     *                               guard must not start without its own protection
     */
    public static SelfProtectionSet builtIn(RuleCompiler compiler) {
        List<CompiledRule> compiled = new ArrayList<>();
        for (Rule rule : builtInRules()) {
            try {
                compiled.add(compiler.compile(rule));
            } catch (RuleCompileException e) {
                throw new IllegalStateException("Self-protection rule " + e.getRuleName()
                        + " does not compile: " + e.getMessage(), e);
            }
        }
        Rule pathRule = Rule.builder()
                .name("self_protect_path")
                .description("SELF-PROTECTION: Block writes to guard config, source, binaries and plugin")
                .keyword(KeywordMatch.anyOf(PROTECTED_PATHS.toArray(String[]::new)))
                .appliesTo(FILE_WRITE, FILE_EDIT)
                .buildProtected();
        Rule hostConfigRule = Rule.builder()
                .name("self_protect_host_config")
                .description("SELF-PROTECTION: Block edits to the guard entry in openclaw.json/clawdbot.json")
                .keyword(KeywordMatch.anyOf("harness-guard", "safebot-guard"))
                .appliesTo(FILE_WRITE, FILE_EDIT)
                .buildProtected();
        return new SelfProtectionSet(compiled, pathRule, hostConfigRule);
    }

    /**
     * First self-protection match for the event, if any. Every rule is
     * considered; there is no switch that skips this check.
     */
    public Optional<RuleMatch> check(ToolCallEvent event) {
        if (event == null || event.candidate() == null) {
            return Optional.empty();
        }
        for (CompiledRule rule : rules) {
            if (matches(rule, event)) {
                return Optional.of(RuleMatch.selfProtection(rule.rule()));
            }
        }
        if (event instanceof PathEvent pathEvent && isWrite(event.kind())) {
            if (isProtectedPath(pathEvent.path())) {
                return Optional.of(RuleMatch.selfProtection(protectedPathRule));
            }
            if (touchesGuardEntry(event)) {
                return Optional.of(RuleMatch.selfProtection(hostConfigRule));
            }
        }
        return Optional.empty();
    }

    /**
     * Commands are tried verbatim and with whitespace runs collapsed, so
     * padding a command with extra spaces does not slip past a rule.
     */
    private static boolean matches(CompiledRule rule, ToolCallEvent event) {
        if (RuleMatcher.evaluate(rule, event)) {
            return true;
        }
        if (event instanceof ExecEvent exec) {
            String collapsed = CandidateNormalizer.collapseWhitespace(exec.command());
            return !collapsed.equals(exec.command()) && RuleMatcher.evaluate(rule, new ExecEvent(collapsed));
        }
        return false;
    }

    static boolean isProtectedPath(String path) {
        return PROTECTED_PATHS.stream().anyMatch(p -> CandidateNormalizer.pathContains(path, p));
    }

    /**
     * Host config files are protected by content rather than by location, so
     * moving the file does not help: any write or edit whose old or new text
     * names the guard is refused.
     */
    static boolean touchesGuardEntry(ToolCallEvent event) {
        String path = CandidateNormalizer.canonicalPath(event.candidate());
        if (!HOST_CONFIG_FILE.matcher(path).find()) {
            return false;
        }
        if (event instanceof FileWriteEvent write) {
            return mentionsGuard(write.content());
        }
        if (event instanceof FileEditEvent edit) {
            return mentionsGuard(edit.oldText()) || mentionsGuard(edit.newText());
        }
        return false;
    }

    private static boolean mentionsGuard(String text) {
        return text != null && GUARD_IDENTIFIER.matcher(text).find();
    }

    private static boolean isWrite(ToolKind kind) {
        return kind == FILE_WRITE || kind == FILE_EDIT;
    }

    public List<CompiledRule> rules() {
        return rules;
    }

    /**
     * Names reserved by this set; remote rules with these names are shadowed.
     */
    public Set<String> ruleNames() {
        return names;
    }

    static List<Rule> builtInRules() {
        return List.of(
                Rule.builder()
                        .name("self_protect_config")
                        .description("SELF-PROTECTION: Block modification of guard config files")
                        .keyword(KeywordMatch.anyOf(
                                "config/rules.yaml",
                                "config/safebot.yaml",
                                "config/openclaw-harness.yaml",
                                "config/moltbot-harness.yaml",
                                "openclaw-harness/config",
                                "moltbot-harness/config",
                                ".openclaw-harness/config",
                                "alerts.json"))
                        .appliesTo(FILE_WRITE, FILE_EDIT, EXEC)
                        .buildProtected(),
                Rule.builder()
                        .name("self_protect_source")
                        .description("SELF-PROTECTION: Block modification of guard source code")
                        .regex(GUARD_DIRS + "/src/.*\\.(rs|toml|java|js|ts)")
                        .appliesTo(FILE_WRITE, FILE_EDIT, EXEC)
                        .buildProtected(),
                Rule.builder()
                        .name("self_protect_process")
                        .description("SELF-PROTECTION: Block killing the guard process")
                        .regex("(kill|pkill|killall)\\s+.*(openclaw|moltbot|safebot|harness)")
                        .appliesTo(EXEC)
                        .buildProtected(),
                Rule.builder()
                        .name("self_protect_stop")
                        .description("SELF-PROTECTION: Block stopping the guard via its CLI")
                        .regex("(openclaw-harness|moltbot-harness|safebot)\\s+stop")
                        .appliesTo(EXEC)
                        .buildProtected(),
                Rule.builder()
                        .name("self_protect_plugin")
                        .description("SELF-PROTECTION: Block modification of the harness-guard plugin")
                        .keyword(KeywordMatch.anyOf(
                                "harness-guard",
                                "clawdbot-plugin",
                                "clawdbot.plugin.json",
                                "openclaw.plugin.json"))
                        .appliesTo(FILE_WRITE, FILE_EDIT, EXEC)
                        .buildProtected(),
                Rule.builder()
                        .name("self_protect_binary")
                        .description("SELF-PROTECTION: Block modification of the guard binary")
                        .regex(GUARD_DIRS + "/target/(release|debug)/")
                        .appliesTo(FILE_WRITE, FILE_EDIT, EXEC)
                        .buildProtected(),
                Rule.builder()
                        .name("self_protect_api")
                        .description("SELF-PROTECTION: Block disabling rules via the control plane API")
                        .regex("(curl|http|fetch|wget)\\s+.*(localhost|127\\.0\\.0\\.1):8380.*(rules|disable|delete)")
                        .appliesTo(EXEC)
                        .buildProtected(),
                Rule.builder()
                        .name("self_protect_patch_revert")
                        .description("SELF-PROTECTION: Block reverting the host call-site patch")
                        .regex("patch\\s+(openclaw|clawdbot).*(--revert|\\s-r(\\s|$))|bash-tools\\.exec\\.js\\.orig")
                        .appliesTo(EXEC)
                        .buildProtected(),
                Rule.builder()
                        .name("self_protect_config_exec")
                        .description("SELF-PROTECTION: Block shell writes to guard rule files")
                        .regex("(cat\\s*>|\\btee|sed\\s+-i|\\bvim?|\\bnano|echo\\s+.*>)\\s+.*(rules\\.yaml|safebot\\.yaml|openclaw-harness\\.yaml)")
                        .appliesTo(EXEC)
                        .buildProtected(),
                Rule.builder()
                        .name("self_protect_chmod")
                        .description("SELF-PROTECTION: Block permission changes on guard files")
                        .regex("(chmod|chown)\\s+.*/" + GUARD_DIRS + "/")
                        .appliesTo(EXEC)
                        .buildProtected(),
                Rule.builder()
                        .name("self_protect_mv_rm")
                        .description("SELF-PROTECTION: Block moving or deleting guard files")
                        .regex("(mv|rm|cp)\\s+.*/" + GUARD_DIRS + "/(config|src|target|openclaw-plugin|clawdbot-plugin)")
                        .appliesTo(EXEC)
                        .buildProtected());
    }
}
