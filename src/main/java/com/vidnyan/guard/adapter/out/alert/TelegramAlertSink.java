package com.vidnyan.guard.adapter.out.alert;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guard.domain.verdict.AlertNotification;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

/**
 * Telegram Bot API {@code sendMessage}, HTML parse mode.
 */
public class TelegramAlertSink extends HttpAlertSink {

    private final URI endpoint;
    private final String chatId;

    public TelegramAlertSink(HttpClient httpClient, ObjectMapper objectMapper, Duration timeout,
                             String apiBaseUrl, String botToken, String chatId) {
        super(httpClient, objectMapper, timeout);
        String base = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.endpoint = URI.create(base + "/bot" + botToken + "/sendMessage");
        this.chatId = chatId;
    }

    @Override
    public String name() {
        return "telegram";
    }

    @Override
    protected URI endpoint() {
        return endpoint;
    }

    @Override
    protected Map<String, Object> payload(AlertNotification notification) {
        return Map.of(
                "chat_id", chatId,
                "text", AlertMessageFormatter.html(notification),
                "parse_mode", "HTML");
    }
}
