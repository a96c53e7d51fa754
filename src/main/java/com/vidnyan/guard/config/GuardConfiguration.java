package com.vidnyan.guard.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.guard.adapter.out.alert.DiscordAlertSink;
import com.vidnyan.guard.adapter.out.alert.SlackAlertSink;
import com.vidnyan.guard.adapter.out.alert.TelegramAlertSink;
import com.vidnyan.guard.adapter.out.controlplane.HttpControlPlaneRuleSource;
import com.vidnyan.guard.application.port.out.AlertSink;
import com.vidnyan.guard.application.port.out.RuleSource;
import com.vidnyan.guard.application.service.AlertDispatcher;
import com.vidnyan.guard.application.service.DecisionEngine;
import com.vidnyan.guard.application.service.RuleProvider;
import com.vidnyan.guard.domain.protection.FallbackRules;
import com.vidnyan.guard.domain.protection.SelfProtectionSet;
import com.vidnyan.guard.domain.rule.RuleCompiler;
import com.vidnyan.guard.domain.rule.template.RuleTemplates;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Spring configuration for the guard.
 * The engine classes are plain objects; this is where they are wired.
 */
@Slf4j
@Configuration
public class GuardConfiguration {

    /**
     * ObjectMapper for JSON parsing.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public HttpClient httpClient(GuardProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getControlPlane().getFetchTimeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RuleTemplates ruleTemplates() {
        return new RuleTemplates();
    }

    @Bean
    public RuleCompiler ruleCompiler(RuleTemplates ruleTemplates) {
        return new RuleCompiler(ruleTemplates);
    }

    @Bean
    public SelfProtectionSet selfProtectionSet(RuleCompiler ruleCompiler) {
        SelfProtectionSet set = SelfProtectionSet.builtIn(ruleCompiler);
        log.info("Loaded {} self-protection rules", set.ruleNames().size());
        return set;
    }

    @Bean
    public RuleSource ruleSource(HttpClient httpClient, ObjectMapper objectMapper, GuardProperties properties) {
        GuardProperties.ControlPlane controlPlane = properties.getControlPlane();
        String base = controlPlane.getBaseUrl().replaceAll("/+$", "");
        URI rulesUri = URI.create(base + controlPlane.getRulesPath());
        return new HttpControlPlaneRuleSource(httpClient, objectMapper, rulesUri, controlPlane.getFetchTimeout());
    }

    /**
     * One thread is enough: refreshes are single-flight.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService ruleFetchExecutor() {
        return Executors.newSingleThreadExecutor(daemonThreads("guard-rule-fetch-"));
    }

    @Bean
    public RuleProvider ruleProvider(RuleSource ruleSource, RuleCompiler ruleCompiler,
                                     SelfProtectionSet selfProtectionSet, Clock clock,
                                     @Qualifier("ruleFetchExecutor") ExecutorService ruleFetchExecutor,
                                     GuardProperties properties) {
        GuardProperties.ControlPlane controlPlane = properties.getControlPlane();
        log.info("Rules from {} (ttl={}, fetch timeout={})",
                ruleSource.describe(), controlPlane.getCacheTtl(), controlPlane.getFetchTimeout());
        return new RuleProvider(
                ruleSource,
                ruleCompiler,
                selfProtectionSet.ruleNames(),
                FallbackRules.builtIn(),
                clock,
                controlPlane.getCacheTtl(),
                controlPlane.getFetchTimeout(),
                ruleFetchExecutor);
    }

    @Bean
    public DecisionEngine decisionEngine(SelfProtectionSet selfProtectionSet, RuleProvider ruleProvider,
                                         GuardProperties properties) {
        if (!properties.isEnabled()) {
            log.warn("Rule evaluation disabled (guard.enabled=false); only self-protection is active");
        }
        if (!properties.isEnforceBlocking()) {
            log.warn("Rule matches will alert but not block (block-dangerous={}, alert-only={})",
                    properties.isBlockDangerous(), properties.isAlertOnly());
        }
        return new DecisionEngine(selfProtectionSet, ruleProvider,
                properties.isEnabled(), properties.getAlerts().getMaxCandidateLength(),
                properties.isEnforceBlocking());
    }

    /**
     * A sink is registered only when its credentials are configured.
     */
    static List<AlertSink> alertSinks(HttpClient httpClient, ObjectMapper objectMapper, GuardProperties properties) {
        GuardProperties.Alerts alerts = properties.getAlerts();
        List<AlertSink> sinks = new ArrayList<>();
        if (alerts.getTelegram().isConfigured()) {
            sinks.add(new TelegramAlertSink(httpClient, objectMapper, alerts.getTimeout(),
                    alerts.getTelegram().getApiBaseUrl(),
                    alerts.getTelegram().getBotToken(),
                    alerts.getTelegram().getChatId()));
        }
        if (alerts.getSlack().isConfigured()) {
            sinks.add(new SlackAlertSink(httpClient, objectMapper, alerts.getTimeout(),
                    alerts.getSlack().getWebhookUrl()));
        }
        if (alerts.getDiscord().isConfigured()) {
            sinks.add(new DiscordAlertSink(httpClient, objectMapper, alerts.getTimeout(),
                    alerts.getDiscord().getWebhookUrl()));
        }
        return sinks;
    }

    /**
     * Bounded: when sinks fall behind, new alerts are dropped, not queued forever.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService alertExecutor(GuardProperties properties) {
        GuardProperties.Alerts alerts = properties.getAlerts();
        return new ThreadPoolExecutor(
                alerts.getDispatchThreads(), alerts.getDispatchThreads(),
                60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(alerts.getQueueCapacity()),
                daemonThreads("guard-alert-"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public AlertDispatcher alertDispatcher(HttpClient httpClient, ObjectMapper objectMapper, GuardProperties properties,
                                           @Qualifier("alertExecutor") ExecutorService alertExecutor) {
        AlertDispatcher dispatcher = new AlertDispatcher(alertSinks(httpClient, objectMapper, properties), alertExecutor);
        log.info("Registered {} alert sinks: {}", dispatcher.sinkNames().size(), dispatcher.sinkNames());
        return dispatcher;
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
