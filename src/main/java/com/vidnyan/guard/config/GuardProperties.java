package com.vidnyan.guard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the guard.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "guard")
public class GuardProperties {

    /**
     * When false, remote and fallback rules are not evaluated.
     * Self-protection is unaffected.
     */
    private boolean enabled = true;

    /**
     * When false, rules with a blocking action only alert. Self-protection
     * always blocks.
     */
    private boolean blockDangerous = true;

    /**
     * Report every rule match as an alert and never block on one.
     * Self-protection always blocks.
     */
    private boolean alertOnly = false;

    private ControlPlane controlPlane = new ControlPlane();

    private Alerts alerts = new Alerts();

    public boolean isEnforceBlocking() {
        return blockDangerous && !alertOnly;
    }

    @Data
    public static class ControlPlane {
        private String baseUrl = "http://localhost:8380";
        private String rulesPath = "/api/rules";
        /** Bound on one fetch and on how long a caller waits for it. */
        private Duration fetchTimeout = Duration.ofSeconds(2);
        private Duration cacheTtl = Duration.ofSeconds(30);
    }

    @Data
    public static class Alerts {
        private int maxCandidateLength = 200;
        private Duration timeout = Duration.ofSeconds(5);
        private int dispatchThreads = 2;
        private int queueCapacity = 100;
        private Telegram telegram = new Telegram();
        private Webhook slack = new Webhook();
        private Webhook discord = new Webhook();
    }

    @Data
    public static class Telegram {
        private String apiBaseUrl = "https://api.telegram.org";
        private String botToken = "";
        private String chatId = "";

        public boolean isConfigured() {
            return botToken != null && !botToken.isBlank() && chatId != null && !chatId.isBlank();
        }
    }

    @Data
    public static class Webhook {
        private String webhookUrl = "";

        public boolean isConfigured() {
            return webhookUrl != null && !webhookUrl.isBlank();
        }
    }
}
