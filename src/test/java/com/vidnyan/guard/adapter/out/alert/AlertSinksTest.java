package com.vidnyan.guard.adapter.out.alert;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guard.application.port.out.AlertDeliveryException;
import com.vidnyan.guard.domain.rule.RiskLevel;
import com.vidnyan.guard.domain.rule.RuleSetTier;
import com.vidnyan.guard.domain.rule.ToolKind;
import com.vidnyan.guard.domain.verdict.AlertNotification;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AlertSinksTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newHttpClient();
    private MockWebServer server;

    private static final AlertNotification BLOCKED = new AlertNotification(
            ToolKind.EXEC, "cat <secrets> & rm", List.of("dangerous_rm", "wallet_access"),
            RiskLevel.CRITICAL, true, false, RuleSetTier.FALLBACK);

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private JsonNode takeJson(String expectedPath) throws Exception {
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("POST", request.getMethod());
        assertEquals(expectedPath, request.getPath());
        return objectMapper.readTree(request.getBody().readUtf8());
    }

    @Test
    void telegram_ShouldSendEscapedHtml() throws Exception {
        // Arrange
        server.enqueue(new MockResponse().setBody("{\"ok\":true}"));
        String base = server.url("/").toString();
        TelegramAlertSink sink = new TelegramAlertSink(httpClient, objectMapper, Duration.ofSeconds(2),
                base, "123:abc", "-10042");

        // Act
        sink.send(BLOCKED);

        // Assert
        JsonNode body = takeJson("/bot123:abc/sendMessage");
        assertEquals("-10042", body.get("chat_id").asText());
        assertEquals("HTML", body.get("parse_mode").asText());
        String text = body.get("text").asText();
        assertTrue(text.contains("cat &lt;secrets&gt; &amp; rm"));
        assertTrue(text.contains("dangerous_rm, wallet_access"));
        assertTrue(text.contains("built-in fallback rules"));
    }

    @Test
    void slack_ShouldSendPlainText() throws Exception {
        server.enqueue(new MockResponse().setBody("ok"));
        SlackAlertSink sink = new SlackAlertSink(httpClient, objectMapper, Duration.ofSeconds(2),
                server.url("/services/T/B/X").toString());

        sink.send(BLOCKED);

        String text = takeJson("/services/T/B/X").get("text").asText();
        assertTrue(text.startsWith("🛡️ Harness Guard: blocked"));
        assertTrue(text.contains("Content: cat <secrets> & rm"));
        assertTrue(text.contains("Risk Level: CRITICAL"));
    }

    @Test
    void discord_ShouldSendContentField() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        DiscordAlertSink sink = new DiscordAlertSink(httpClient, objectMapper, Duration.ofSeconds(2),
                server.url("/api/webhooks/1/abc").toString());
        AlertNotification alert = new AlertNotification(ToolKind.FILE_WRITE, "/etc/hosts", List.of("hosts"),
                RiskLevel.WARNING, false, false, RuleSetTier.FRESH);

        sink.send(alert);

        String content = takeJson("/api/webhooks/1/abc").get("content").asText();
        assertTrue(content.startsWith("⚠️ Harness Guard: alert"));
        assertFalse(content.contains("Degraded mode"));
    }

    @Test
    void send_ShouldFailOnErrorStatus() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        SlackAlertSink sink = new SlackAlertSink(httpClient, objectMapper, Duration.ofSeconds(2),
                server.url("/hook").toString());

        AlertDeliveryException e = assertThrows(AlertDeliveryException.class, () -> sink.send(BLOCKED));
        assertEquals("slack", e.getSinkName());
        assertTrue(e.getMessage().contains("500"));
    }

    @Test
    void formatter_ShouldMarkSelfProtection() {
        AlertNotification selfProtect = new AlertNotification(ToolKind.EXEC, "pkill -f harness",
                List.of("self_protect_process"), RiskLevel.CRITICAL, true, true, RuleSetTier.NONE);

        assertTrue(AlertMessageFormatter.plain(selfProtect).startsWith("🔒"));
        assertNull(AlertMessageFormatter.degradedLine(selfProtect));
    }
}
