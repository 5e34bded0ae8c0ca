package com.governorHq.llmGateway.gateway.service;

import com.governorHq.llmGateway.config.PolicyProperties;
import com.governorHq.llmGateway.gateway.dto.HealthResponse;
import com.governorHq.llmGateway.guard.prompt.SafetySystemPrompt;
import com.governorHq.llmGateway.guard.rules.PatternRuleSet;
import com.governorHq.llmGateway.guard.service.PolicyCounters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the public status payloads ({@code /health}, {@code /info}, {@code /v1/constitution}).
 * None of them ever contains the upstream or gateway key.
 */
@Slf4j
@Service
public class GatewayStatusService {

    static final List<String> ENDPOINTS = List.of(
            "POST /v1/chat/completions",
            "POST /v1/completions",
            "GET  /v1/models",
            "GET  /v1/constitution",
            "GET  /health",
            "GET  /info");

    private final PolicyProperties policy;
    private final PolicyCounters counters;
    private final PatternRuleSet ruleSet;
    private final Clock clock;
    private final Instant startedAt;
    private final String name;
    private final String version;
    private final String apiUrl;
    private final String model;

    public GatewayStatusService(PolicyProperties policy,
                                PolicyCounters counters,
                                PatternRuleSet ruleSet,
                                Clock clock,
                                @Value("${gateway.name:llm-api}") String name,
                                @Value("${gateway.version:1.0.0}") String version,
                                @Value("${llm.api.url:https://api.openai.com/v1}") String apiUrl,
                                @Value("${llm.model:gpt-4o-mini}") String model) {
        this.policy = policy;
        this.counters = counters;
        this.ruleSet = ruleSet;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.name = name;
        this.version = version;
        this.apiUrl = apiUrl;
        this.model = model;
    }

    public HealthResponse health() {
        Instant now = clock.instant();
        long uptimeMs = Duration.between(startedAt, now).toMillis();
        return HealthResponse.builder()
                .status("ok")
                .uptimeMs(uptimeMs)
                .uptimeHuman(formatUptime(uptimeMs))
                .timestamp(now.toString())
                .build();
    }

    public Map<String, Object> info() {
        Map<String, Object> layers = new LinkedHashMap<>();
        layers.put("systemPrompt", policy.systemPrompt());
        layers.put("inputValidation", policy.validateInput());
        layers.put("outputValidation", policy.validateOutput());
        layers.put("rateLimiting", policy.rateLimit() > 0);

        Map<String, Object> constitution = new LinkedHashMap<>();
        constitution.put("enabled", policy.enabled());
        constitution.put("domain", policy.resolvedDomain().getId());
        constitution.put("mode", policy.mode().getId());
        constitution.put("layers", layers);

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", name);
        info.put("version", version);
        info.put("description", "OpenAI-compatible LLM proxy gateway with a constitutional safety layer");
        info.put("model", model);
        info.put("provider_url", apiUrl);
        info.put("uptime", Duration.between(startedAt, clock.instant()).toMillis());
        info.put("constitution", constitution);
        info.put("endpoints", ENDPOINTS);
        return info;
    }

    /**
     * Configuration, hard rules, layer list and live counters of the safety layer.
     */
    public Map<String, Object> constitution() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("domain", policy.resolvedDomain().getId());
        config.put("mode", policy.mode().getId());
        config.put("systemPrompt", policy.systemPrompt());
        config.put("validateInput", policy.validateInput());
        config.put("validateOutput", policy.validateOutput());
        config.put("logViolations", policy.logViolations());
        config.put("rateLimit", policy.rateLimit() > 0 ? policy.rateLimit() + "/min" : "disabled");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", "Governor HQ Constitutional Safety Layer");
        payload.put("version", version);
        payload.put("rulesVersion", ruleSet.getVersion());
        payload.put("enabled", policy.enabled());
        payload.put("config", config);
        payload.put("hardRules", SafetySystemPrompt.HARD_RULES);
        payload.put("layers", layers());
        payload.put("stats", counters.snapshot());
        return payload;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void logStartup() {
        log.info("{} {} ready - upstream: {}, model: {}", name, version, apiUrl, model);
        if (policy.enabled()) {
            List<String> active = new ArrayList<>();
            if (policy.systemPrompt()) active.add("system-prompt");
            if (policy.validateInput()) active.add("input-validation");
            if (policy.validateOutput()) active.add("output-validation");
            if (policy.rateLimit() > 0) active.add("rate-limit(" + policy.rateLimit() + "/min)");
            log.info("Constitution enabled - domain: {}, mode: {}, layers: {}, rules: {}",
                    policy.resolvedDomain().getId(), policy.mode().getId(), String.join(", ", active),
                    ruleSet.ruleCount());
        } else {
            log.info("Constitution disabled - requests are proxied without safety layers");
        }
    }

    private List<Map<String, Object>> layers() {
        return List.of(
                layer(1, "System Prompt Injection", "pre-generation", policy.systemPrompt()),
                layer(2, "Input Pattern Validation", "pre-generation", policy.validateInput()),
                layer(3, "Output Pattern Validation", "post-generation", policy.validateOutput()),
                layer(4, "Request Rate Limiting", "abuse-prevention", policy.rateLimit() > 0));
    }

    private static Map<String, Object> layer(int id, String name, String phase, boolean enabled) {
        Map<String, Object> layer = new LinkedHashMap<>();
        layer.put("id", id);
        layer.put("name", name);
        layer.put("phase", phase);
        layer.put("enabled", enabled);
        return layer;
    }

    /**
     * Largest two units only, e.g. {@code 2d 3h}, {@code 4m 10s}, {@code 9s}.
     */
    static String formatUptime(long uptimeMs) {
        long seconds = uptimeMs / 1000;
        long minutes = seconds / 60;
        long hours = minutes / 60;
        long days = hours / 24;
        if (days > 0) {
            return days + "d " + (hours % 24) + "h";
        }
        if (hours > 0) {
            return hours + "h " + (minutes % 60) + "m";
        }
        if (minutes > 0) {
            return minutes + "m " + (seconds % 60) + "s";
        }
        return seconds + "s";
    }
}
