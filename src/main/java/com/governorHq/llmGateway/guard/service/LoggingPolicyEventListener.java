package com.governorHq.llmGateway.guard.service;

import com.governorHq.llmGateway.config.PolicyProperties;
import com.governorHq.llmGateway.gateway.util.ClientIdMasker;
import com.governorHq.llmGateway.guard.model.EnforcementAction;
import com.governorHq.llmGateway.guard.model.PolicyMode;
import com.governorHq.llmGateway.guard.model.ScoringStage;
import com.governorHq.llmGateway.guard.model.TerminalState;
import com.governorHq.llmGateway.guard.model.Verdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes enforcement events to the application log.
 * <p>
 * Violation details are logged only when {@code constitution.log-violations} is on.
 * In log mode input violations stay silent and output violations are logged at INFO.
 */
@Slf4j
@Component
public class LoggingPolicyEventListener implements PolicyEventListener {

    @Override
    public void onViolations(ScoringStage stage, Verdict verdict, EnforcementAction action,
                             PolicyProperties policy, String correlationId) {
        if (!policy.logViolations()) {
            return;
        }
        if (policy.mode() == PolicyMode.LOG) {
            if (stage == ScoringStage.OUTPUT) {
                log.info("constitution: {} violations detected - correlationId: {}, mode: {}, violations: {}, confidence: {}, details: {}",
                        stage.getId(), correlationId, policy.mode().getId(), verdict.violationCount(),
                        verdict.getConfidence(), ResponseSynthesizer.summarize(verdict.getViolations()));
            }
            return;
        }
        log.warn("constitution: {} violations detected - correlationId: {}, mode: {}, action: {}, violations: {}, confidence: {}, details: {}",
                stage.getId(), correlationId, policy.mode().getId(), action, verdict.violationCount(),
                verdict.getConfidence(), ResponseSynthesizer.summarize(verdict.getViolations()));
    }

    @Override
    public void onCrisisSignal(ScoringStage stage, PolicyProperties policy, String correlationId) {
        if (policy.logViolations()) {
            log.warn("constitution: crisis signal detected in {} - correlationId: {}, domain: {}",
                    stage.getId(), correlationId, policy.resolvedDomain().getId());
        }
    }

    @Override
    public void onRateLimited(String identity, PolicyProperties policy, String correlationId) {
        log.warn("constitution: rate limit exceeded - correlationId: {}, ip: {}, limit: {}",
                correlationId, ClientIdMasker.mask(identity), policy.rateLimit());
    }

    @Override
    public void onOutcome(TerminalState state, String correlationId) {
        log.debug("constitution: request finished - correlationId: {}, state: {}", correlationId, state);
    }
}
