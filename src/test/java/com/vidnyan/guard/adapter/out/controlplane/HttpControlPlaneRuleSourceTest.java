package com.vidnyan.guard.adapter.out.controlplane;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guard.application.port.out.ControlPlaneUnreachableException;
import com.vidnyan.guard.application.port.out.MalformedRemoteSetException;
import com.vidnyan.guard.application.port.out.RuleSource.FetchedRules;
import com.vidnyan.guard.domain.rule.KeywordMatch;
import com.vidnyan.guard.domain.rule.RegexMatch;
import com.vidnyan.guard.domain.rule.RiskLevel;
import com.vidnyan.guard.domain.rule.Rule;
import com.vidnyan.guard.domain.rule.RuleAction;
import com.vidnyan.guard.domain.rule.TemplateMatch;
import com.vidnyan.guard.domain.rule.ToolKind;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HttpControlPlaneRuleSourceTest {

    private MockWebServer server;
    private HttpControlPlaneRuleSource source;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        ObjectMapper objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        source = new HttpControlPlaneRuleSource(HttpClient.newHttpClient(), objectMapper,
                server.url("/api/rules").uri(), Duration.ofMillis(500));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    @Test
    void fetchRules_ShouldMapEveryMatchType() throws Exception {
        // Arrange
        server.enqueue(json("""
                [
                  {"name": "dangerous_rm", "description": "Dangerous rm", "pattern": "rm\\\\s+-rf",
                   "risk_level": "Critical", "action": "CriticalAlert", "applies_to": ["exec"],
                   "is_preset": true},
                  {"name": "curl_post", "match_type": "keyword",
                   "keyword": {"contains": ["curl", "--data"]}, "action": "block"},
                  {"name": "keys", "match_type": "template", "template": "protect_path",
                   "params": {"path": "~/.ssh", "operations": ["read"]}, "risk_level": "warning"}
                ]
                """));

        // Act
        FetchedRules fetched = source.fetchRules();

        // Assert
        assertTrue(fetched.rejected().isEmpty());
        List<Rule> rules = fetched.rules();
        assertEquals(3, rules.size());

        Rule rm = rules.get(0);
        assertEquals(new RegexMatch("rm\\s+-rf"), rm.matchSpec());
        assertEquals(RiskLevel.CRITICAL, rm.riskLevel());
        assertEquals(RuleAction.CRITICAL_ALERT, rm.action());
        assertEquals(Set.of(ToolKind.EXEC), rm.appliesTo());

        assertEquals(KeywordMatch.contains("curl", "--data"), rules.get(1).matchSpec());
        assertEquals(RuleAction.BLOCK, rules.get(1).action());

        TemplateMatch template = assertInstanceOf(TemplateMatch.class, rules.get(2).matchSpec());
        assertEquals("protect_path", template.templateId());
        assertEquals("~/.ssh", template.params().path());
        assertEquals(List.of("read"), template.params().operations());

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("GET", request.getMethod());
        assertEquals("/api/rules", request.getPath());
    }

    @Test
    void fetchRules_ShouldNeverHonourRemoteProtectedFlag() throws Exception {
        server.enqueue(json("[{\"name\": \"sneaky\", \"pattern\": \"x\", \"protected\": true}]"));

        Rule rule = source.fetchRules().rules().get(0);

        assertFalse(rule.protectedRule());
        assertEquals(RuleAction.ALERT, rule.action());
        assertEquals(RiskLevel.WARNING, rule.riskLevel());
    }

    @Test
    void fetchRules_ShouldDropDisabledRecords() throws Exception {
        server.enqueue(json("[{\"name\": \"off\", \"pattern\": \"x\", \"enabled\": false}]"));

        FetchedRules fetched = source.fetchRules();

        assertTrue(fetched.rules().isEmpty());
        assertTrue(fetched.rejected().isEmpty());
    }

    @Test
    void fetchRules_ShouldRejectBadRecordsIndividually() throws Exception {
        server.enqueue(json("""
                [
                  {"name": "fuzzy", "match_type": "fuzzy", "pattern": "x"},
                  {"pattern": "no name"},
                  {"name": "nowhere", "pattern": "x", "applies_to": ["browser"]},
                  {"name": "garbled", "keyword": "not-an-object", "match_type": "keyword"},
                  {"name": "good", "pattern": "x", "applies_to": ["exec", "browser"]}
                ]
                """));

        FetchedRules fetched = source.fetchRules();

        assertEquals(List.of("good"), fetched.rules().stream().map(Rule::name).toList());
        assertEquals(Set.of(ToolKind.EXEC), fetched.rules().get(0).appliesTo());
        assertEquals(List.of("fuzzy", "<record 1>", "nowhere", "garbled"),
                fetched.rejected().stream().map(e -> e.ruleName()).toList());
    }

    @Test
    void fetchRules_ShouldFailOnNonArrayBody() {
        server.enqueue(json("{\"rules\": []}"));

        assertThrows(MalformedRemoteSetException.class, () -> source.fetchRules());
    }

    @Test
    void fetchRules_ShouldFailOnInvalidJson() {
        server.enqueue(json("<html>gateway</html>"));

        assertThrows(MalformedRemoteSetException.class, () -> source.fetchRules());
    }

    @Test
    void fetchRules_ShouldFailOnErrorStatus() {
        server.enqueue(new MockResponse().setResponseCode(503));

        ControlPlaneUnreachableException e =
                assertThrows(ControlPlaneUnreachableException.class, () -> source.fetchRules());
        assertFalse(e instanceof MalformedRemoteSetException);
        assertTrue(e.getMessage().contains("503"));
    }

    @Test
    void fetchRules_ShouldFailWhenServerIsTooSlow() {
        server.enqueue(json("[]").setHeadersDelay(2, TimeUnit.SECONDS));

        assertThrows(ControlPlaneUnreachableException.class, () -> source.fetchRules());
    }

    @Test
    void fetchRules_ShouldFailWhenServerIsDown() throws IOException {
        MockWebServer gone = new MockWebServer();
        gone.start();
        URI rulesUri = gone.url("/api/rules").uri();
        gone.shutdown();
        HttpControlPlaneRuleSource down = new HttpControlPlaneRuleSource(HttpClient.newHttpClient(),
                new ObjectMapper(), rulesUri, Duration.ofMillis(500));

        assertThrows(ControlPlaneUnreachableException.class, down::fetchRules);
    }
}
