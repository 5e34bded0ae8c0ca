package com.governorHq.llmGateway.config;

import com.governorHq.llmGateway.guard.model.PolicyDomain;
import com.governorHq.llmGateway.guard.model.PolicyMode;
import lombok.Builder;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Constitution (safety layer) configuration. Bound once at startup from the
 * {@code constitution.*} properties and never mutated afterwards.
 *
 * @param enabled        master toggle for every layer
 * @param domain         policy vertical; unknown values resolve to {@code general}
 * @param mode           how negative verdicts are acted upon
 * @param systemPrompt   inject the domain safety prompt into outbound requests
 * @param validateInput  score user-authored input before the upstream call
 * @param validateOutput score non-streamed assistant output
 * @param logViolations  log violation details
 * @param rateLimit      requests per minute per client identity, 0 disables
 */
@Builder(toBuilder = true)
@ConfigurationProperties(prefix = "constitution")
public record PolicyProperties(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("general") String domain,
        @DefaultValue("warn") PolicyMode mode,
        @DefaultValue("true") boolean systemPrompt,
        @DefaultValue("true") boolean validateInput,
        @DefaultValue("true") boolean validateOutput,
        @DefaultValue("true") boolean logViolations,
        @DefaultValue("60") int rateLimit) {

    public PolicyProperties {
        if (mode == null) {
            mode = PolicyMode.WARN;
        }
        if (rateLimit < 0) {
            throw new IllegalArgumentException("constitution.rate-limit must not be negative: " + rateLimit);
        }
    }

    public PolicyDomain resolvedDomain() {
        return PolicyDomain.fromId(domain);
    }

    public boolean rateLimitingActive() {
        return enabled && rateLimit > 0;
    }
}
