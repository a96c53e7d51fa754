package com.vidnyan.guard.adapter.out.alert;

import com.vidnyan.guard.domain.rule.RuleSetTier;
import com.vidnyan.guard.domain.verdict.AlertNotification;

/**
 * Renders alert notifications as chat messages.
 */
public final class AlertMessageFormatter {

    static String header(AlertNotification n) {
        if (n.selfProtection()) {
            return "🔒 Harness Guard: self-protection block";
        }
        return n.blocked() ? "🛡️ Harness Guard: blocked" : "⚠️ Harness Guard: alert";
    }

    static String degradedLine(AlertNotification n) {
        if (n.tier() == RuleSetTier.FALLBACK) {
            return "Degraded mode: control plane unreachable, built-in fallback rules in effect";
        }
        if (n.tier() == RuleSetTier.STALE) {
            return "Degraded mode: control plane unreachable, stale rules in effect";
        }
        return null;
    }

    /**
     * Plain text, used by Slack and Discord webhooks.
     */
    public static String plain(AlertNotification n) {
        StringBuilder sb = new StringBuilder();
        sb.append(header(n)).append("\n\n");
        sb.append("Risk Level: ").append(n.riskLevel()).append('\n');
        sb.append("Tool: ").append(n.toolKind().wireName()).append('\n');
        sb.append("Content: ").append(n.candidate()).append('\n');
        sb.append("Matched Rules: ").append(String.join(", ", n.ruleNames()));
        String degraded = degradedLine(n);
        if (degraded != null) {
            sb.append("\n").append(degraded);
        }
        return sb.toString();
    }

    /**
     * Telegram HTML parse mode. Only the candidate and rule names come from
     * outside, and both are escaped.
     */
    public static String html(AlertNotification n) {
        StringBuilder sb = new StringBuilder();
        sb.append("<b>").append(escapeHtml(header(n))).append("</b>\n\n");
        sb.append("<b>Risk Level:</b> ").append(n.riskLevel()).append('\n');
        sb.append("<b>Tool:</b> ").append(n.toolKind().wireName()).append('\n');
        sb.append("<b>Content:</b> <code>").append(escapeHtml(n.candidate())).append("</code>\n");
        sb.append("<b>Matched Rules:</b> ").append(escapeHtml(String.join(", ", n.ruleNames())));
        String degraded = degradedLine(n);
        if (degraded != null) {
            sb.append("\n<i>").append(escapeHtml(degraded)).append("</i>");
        }
        return sb.toString();
    }

    static String escapeHtml(String text) {
        if (text == null) return "";
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    private AlertMessageFormatter() {}
}
