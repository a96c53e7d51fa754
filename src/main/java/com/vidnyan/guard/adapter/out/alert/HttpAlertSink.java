package com.vidnyan.guard.adapter.out.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guard.application.port.out.AlertDeliveryException;
import com.vidnyan.guard.application.port.out.AlertSink;
import com.vidnyan.guard.domain.verdict.AlertNotification;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Base for sinks that deliver by POSTing a JSON body to a webhook-style URL.
 */
@Slf4j
public abstract class HttpAlertSink implements AlertSink {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    protected HttpAlertSink(HttpClient httpClient, ObjectMapper objectMapper, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    protected abstract URI endpoint();

    protected abstract Map<String, Object> payload(AlertNotification notification);

    @Override
    public void send(AlertNotification notification) throws AlertDeliveryException {
        String body;
        try {
            body = objectMapper.writeValueAsString(payload(notification));
        } catch (JsonProcessingException e) {
            throw new AlertDeliveryException(name(), "Could not serialize alert: " + e.getOriginalMessage(), e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint())
                .header("Content-Type", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new AlertDeliveryException(name(), e.toString(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlertDeliveryException(name(), "Interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new AlertDeliveryException(name(), "HTTP " + response.statusCode() + ": " + response.body());
        }
        log.info("Sent {} alert", name());
    }
}
