package com.vidnyan.guard.domain.protection;

import com.vidnyan.guard.domain.rule.RiskLevel;
import com.vidnyan.guard.domain.rule.Rule;
import com.vidnyan.guard.domain.rule.RuleAction;
import com.vidnyan.guard.domain.rule.ToolKind;

import java.util.List;

/**
 * Highest-value critical rules, used when the control plane is unreachable and
 * no rule set has ever been fetched.
 */
public final class FallbackRules {

    public static List<Rule> builtIn() {
        return List.of(
                Rule.builder()
                        .name("dangerous_rm")
                        .description("Dangerous recursive delete")
                        .regex("rm\\s+(-rf?|-fr|--force|--recursive)\\s+[~/]")
                        .riskLevel(RiskLevel.CRITICAL)
                        .action(RuleAction.CRITICAL_ALERT)
                        .appliesTo(ToolKind.EXEC)
                        .build(),
                Rule.builder()
                        .name("ssh_key_access")
                        .description("SSH private key access")
                        .regex("\\.ssh/(id_rsa|id_ed25519|id_ecdsa)($|[^.])")
                        .riskLevel(RiskLevel.CRITICAL)
                        .action(RuleAction.CRITICAL_ALERT)
                        .build(),
                Rule.builder()
                        .name("wallet_access")
                        .description("Cryptocurrency wallet or seed phrase access")
                        .regex("(\\.wallet|seed\\s*phrase|mnemonic|private\\s*key)")
                        .riskLevel(RiskLevel.CRITICAL)
                        .action(RuleAction.CRITICAL_ALERT)
                        .build(),
                Rule.builder()
                        .name("api_key_exposure")
                        .description("API key or secret exposure")
                        .regex("(api[_-]?key|secret|token|password)\\s*[=:]\\s*['\"][a-zA-Z0-9]{20,}")
                        .riskLevel(RiskLevel.CRITICAL)
                        .action(RuleAction.CRITICAL_ALERT)
                        .build());
    }

    private FallbackRules() {}
}
