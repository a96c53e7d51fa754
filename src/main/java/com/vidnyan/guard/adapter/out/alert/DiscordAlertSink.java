package com.vidnyan.guard.adapter.out.alert;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guard.domain.verdict.AlertNotification;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

public class DiscordAlertSink extends HttpAlertSink {

    private final URI webhook;

    public DiscordAlertSink(HttpClient httpClient, ObjectMapper objectMapper, Duration timeout, String webhookUrl) {
        super(httpClient, objectMapper, timeout);
        this.webhook = URI.create(webhookUrl);
    }

    @Override
    public String name() {
        return "discord";
    }

    @Override
    protected URI endpoint() {
        return webhook;
    }

    @Override
    protected Map<String, Object> payload(AlertNotification notification) {
        return Map.of("content", AlertMessageFormatter.plain(notification));
    }
}
