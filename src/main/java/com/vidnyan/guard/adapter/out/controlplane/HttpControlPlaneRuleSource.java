package com.vidnyan.guard.adapter.out.controlplane;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guard.application.port.out.ControlPlaneUnreachableException;
import com.vidnyan.guard.application.port.out.MalformedRemoteSetException;
import com.vidnyan.guard.application.port.out.RuleSource;
import com.vidnyan.guard.domain.rule.KeywordMatch;
import com.vidnyan.guard.domain.rule.MatchSpec;
import com.vidnyan.guard.domain.rule.RegexMatch;
import com.vidnyan.guard.domain.rule.RiskLevel;
import com.vidnyan.guard.domain.rule.Rule;
import com.vidnyan.guard.domain.rule.RuleAction;
import com.vidnyan.guard.domain.rule.RuleCompileError;
import com.vidnyan.guard.domain.rule.TemplateMatch;
import com.vidnyan.guard.domain.rule.ToolKind;
import com.vidnyan.guard.domain.rule.template.TemplateParams;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Control plane rule source over HTTP. {@code GET <base-url><rules-path>}
 * must answer with a JSON array of rule records.
 */
@Slf4j
public class HttpControlPlaneRuleSource implements RuleSource {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI rulesUri;
    private final Duration timeout;

    public HttpControlPlaneRuleSource(HttpClient httpClient, ObjectMapper objectMapper,
                                      URI rulesUri, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.rulesUri = rulesUri;
        this.timeout = timeout;
    }

    @Override
    public FetchedRules fetchRules() throws ControlPlaneUnreachableException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(rulesUri)
                .header("Accept", "application/json")
                .timeout(timeout)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ControlPlaneUnreachableException("GET " + rulesUri + " failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ControlPlaneUnreachableException("Interrupted during GET " + rulesUri, e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new ControlPlaneUnreachableException("GET " + rulesUri + " returned " + response.statusCode());
        }
        return parse(response.body());
    }

    @Override
    public String describe() {
        return rulesUri.toString();
    }

    /**
     * Map a rules response body. Disabled records are dropped here; records
     * that cannot be mapped are rejected one by one.
     */
    FetchedRules parse(String body) throws MalformedRemoteSetException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new MalformedRemoteSetException("Rules response is not JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new MalformedRemoteSetException("Rules response is not a JSON array");
        }

        List<Rule> rules = new ArrayList<>();
        List<RuleCompileError> rejected = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            String label = node.path("name").asText("").isBlank()
                    ? "<record " + index + ">"
                    : node.path("name").asText();
            index++;
            RuleDto dto;
            try {
                dto = objectMapper.treeToValue(node, RuleDto.class);
            } catch (JsonProcessingException e) {
                log.warn("Rejecting remote rule {}: {}", label, e.getOriginalMessage());
                rejected.add(new RuleCompileError(label, "Unreadable record: " + e.getOriginalMessage()));
                continue;
            }
            if (dto == null || Boolean.FALSE.equals(dto.enabled)) {
                continue;
            }
            try {
                rules.add(mapToRule(dto));
            } catch (IllegalArgumentException e) {
                log.warn("Rejecting remote rule {}: {}", label, e.getMessage());
                rejected.add(new RuleCompileError(label, e.getMessage()));
            }
        }
        return new FetchedRules(rules, rejected);
    }

    private Rule mapToRule(RuleDto dto) {
        if (dto.name == null || dto.name.isBlank()) {
            throw new IllegalArgumentException("Rule has no name");
        }
        // the remote "protected" flag is never honoured
        return Rule.builder()
                .name(dto.name)
                .description(dto.description)
                .matchSpec(mapMatchSpec(dto))
                .riskLevel(RiskLevel.fromWire(dto.riskLevel))
                .action(RuleAction.fromWire(dto.action))
                .appliesTo(mapAppliesTo(dto.appliesTo))
                .build();
    }

    private MatchSpec mapMatchSpec(RuleDto dto) {
        String type = dto.matchType == null || dto.matchType.isBlank()
                ? "regex"
                : dto.matchType.trim().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "regex" -> new RegexMatch(dto.pattern);
            case "keyword" -> mapKeyword(dto.keyword);
            case "template" -> new TemplateMatch(dto.template, mapParams(dto.params));
            default -> throw new IllegalArgumentException("Unknown match type: " + dto.matchType);
        };
    }

    private KeywordMatch mapKeyword(KeywordDto dto) {
        if (dto == null) {
            throw new IllegalArgumentException("Keyword rule has no keyword operators");
        }
        return new KeywordMatch(dto.contains, dto.anyOf, dto.startsWith, dto.endsWith, dto.glob);
    }

    private TemplateParams mapParams(ParamsDto dto) {
        if (dto == null) return TemplateParams.empty();
        return new TemplateParams(dto.path, dto.paths, dto.operations, dto.commands, dto.patterns, dto.extra);
    }

    /**
     * Unknown kinds are skipped. A list naming only unknown kinds is an error
     * rather than an empty scope, which would widen the rule to every kind.
     */
    private Set<ToolKind> mapAppliesTo(List<String> kinds) {
        if (kinds == null || kinds.isEmpty()) {
            return Set.of();
        }
        Set<ToolKind> mapped = EnumSet.noneOf(ToolKind.class);
        for (String kind : kinds) {
            Optional<ToolKind> parsed = ToolKind.fromWire(kind);
            if (parsed.isPresent()) {
                mapped.add(parsed.get());
            } else {
                log.debug("Ignoring unknown tool kind {}", kind);
            }
        }
        if (mapped.isEmpty()) {
            throw new IllegalArgumentException("applies_to names no known tool kind: " + kinds);
        }
        return mapped;
    }

    // DTO classes for JSON deserialization
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RuleDto {
        public String name;
        public String description;
        @JsonProperty("match_type")
        public String matchType;
        public String pattern;
        public KeywordDto keyword;
        public String template;
        public ParamsDto params;
        @JsonProperty("applies_to")
        public List<String> appliesTo;
        @JsonProperty("risk_level")
        public String riskLevel;
        public String action;
        public Boolean enabled;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class KeywordDto {
        public List<String> contains;
        @JsonProperty("any_of")
        public List<String> anyOf;
        @JsonProperty("starts_with")
        public List<String> startsWith;
        @JsonProperty("ends_with")
        public List<String> endsWith;
        public List<String> glob;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ParamsDto {
        public String path;
        public List<String> paths;
        public List<String> operations;
        public List<String> commands;
        public List<String> patterns;
        public Map<String, String> extra;
    }
}
