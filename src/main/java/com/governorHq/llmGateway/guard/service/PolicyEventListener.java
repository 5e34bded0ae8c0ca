package com.governorHq.llmGateway.guard.service;

import com.governorHq.llmGateway.config.PolicyProperties;
import com.governorHq.llmGateway.guard.model.EnforcementAction;
import com.governorHq.llmGateway.guard.model.ScoringStage;
import com.governorHq.llmGateway.guard.model.TerminalState;
import com.governorHq.llmGateway.guard.model.Verdict;

/**
 * Observer of enforcement events. Implementations must be fast; the pipeline
 * calls them on the request thread and ignores their failures.
 */
public interface PolicyEventListener {

    void onViolations(ScoringStage stage, Verdict verdict, EnforcementAction action,
                      PolicyProperties policy, String correlationId);

    void onCrisisSignal(ScoringStage stage, PolicyProperties policy, String correlationId);

    void onRateLimited(String identity, PolicyProperties policy, String correlationId);

    void onOutcome(TerminalState state, String correlationId);
}
