package com.governorHq.llmGateway.config;

import com.governorHq.llmGateway.guard.rules.PatternRuleSet;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Infrastructure beans: clock, compiled rule set and the upstream executor.
 */
@Configuration
@EnableConfigurationProperties(PolicyProperties.class)
public class GatewayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Compiled once at startup; a malformed rule table fails the boot.
     */
    @Bean
    public PatternRuleSet patternRuleSet(
            @Value("${constitution.rules-resource:" + PatternRuleSet.DEFAULT_RESOURCE + "}") String rulesResource) {
        return PatternRuleSet.load(rulesResource);
    }

    @Bean(name = "upstreamExecutor")
    public ThreadPoolTaskExecutor upstreamExecutor(
            @Value("${llm.executor.core-threads:8}") int coreThreads,
            @Value("${llm.executor.max-threads:64}") int maxThreads,
            @Value("${llm.executor.queue-capacity:256}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreThreads);
        executor.setMaxPoolSize(maxThreads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("upstream-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
