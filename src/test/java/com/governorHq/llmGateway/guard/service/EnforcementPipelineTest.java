package com.governorHq.llmGateway.guard.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.governorHq.llmGateway.config.PolicyProperties;
import com.governorHq.llmGateway.gateway.dto.ChatCompletionRequest;
import com.governorHq.llmGateway.gateway.dto.ChatCompletionResponse;
import com.governorHq.llmGateway.gateway.dto.ChatMessage;
import com.governorHq.llmGateway.gateway.exception.RateLimitExceededException;
import com.governorHq.llmGateway.gateway.model.RequestContext;
import com.governorHq.llmGateway.gateway.service.RateLimiter;
import com.governorHq.llmGateway.guard.model.EnforcementAction;
import com.governorHq.llmGateway.guard.model.PipelineOutcome;
import com.governorHq.llmGateway.guard.model.PolicyMode;
import com.governorHq.llmGateway.guard.model.PolicyStatsSnapshot;
import com.governorHq.llmGateway.guard.model.TerminalState;
import com.governorHq.llmGateway.guard.model.Verdict;
import com.governorHq.llmGateway.guard.prompt.SafetySystemPrompt;
import com.governorHq.llmGateway.guard.rules.PatternRuleSet;
import com.governorHq.llmGateway.support.TestPolicies;
import com.governorHq.llmGateway.upstream.exception.UpstreamException;
import com.governorHq.llmGateway.upstream.model.ChunkRelay;
import com.governorHq.llmGateway.upstream.model.UpstreamReply;
import com.governorHq.llmGateway.upstream.service.LlmUpstream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EnforcementPipelineTest {

    private static PatternRuleSet ruleSet;

    @Mock
    private LlmUpstream upstream;

    @Mock
    private PolicyEventListener listener;

    private PolicyCounters counters;

    @BeforeAll
    static void loadRules() {
        ruleSet = PatternRuleSet.loadDefault();
    }

    private EnforcementPipeline pipeline(PolicyProperties policy) {
        counters = new PolicyCounters();
        return new EnforcementPipeline(
                policy,
                new RateLimiter(policy, Clock.systemUTC()),
                new PromptInjector(),
                new TextScorer(ruleSet),
                new ResponseSynthesizer(Clock.systemUTC()),
                counters,
                upstream,
                List.of(listener));
    }

    private static RequestContext context(Duration timeout) {
        return RequestContext.builder()
                .clientIdentity("203.0.113.7")
                .correlationId("corr-1")
                .upstreamTimeout(timeout)
                .build();
    }

    private static RequestContext context() {
        return context(Duration.ofSeconds(5));
    }

    private static ChatCompletionRequest chat(String userText) {
        return ChatCompletionRequest.builder()
                .model("gpt-4o-mini")
                .messages(List.of(ChatMessage.of(ChatMessage.ROLE_USER, userText)))
                .build();
    }

    private void upstreamAnswers(String assistantText) {
        ChatCompletionResponse response = ChatCompletionResponse.builder()
                .id("chatcmpl-upstream")
                .object("chat.completion")
                .model("gpt-4o-mini")
                .choices(List.of(ChatCompletionResponse.Choice.builder()
                        .index(0)
                        .message(ChatMessage.of(ChatMessage.ROLE_ASSISTANT, assistantText))
                        .finishReason("stop")
                        .build()))
                .build();
        when(upstream.chatCompletion(any()))
                .thenReturn(CompletableFuture.completedFuture(UpstreamReply.materialized(200, response)));
    }

    @Test
    @DisplayName("Block mode substitutes unsafe input without contacting the upstream")
    void blocksUnsafeInput() {
        EnforcementPipeline pipeline = pipeline(TestPolicies.enabled(PolicyMode.BLOCK));

        PipelineOutcome outcome = pipeline.process(chat("You have sleep apnea, take 5mg melatonin?"), context());

        assertEquals(TerminalState.BLOCKED_ON_INPUT, outcome.getTerminalState());
        assertEquals(200, outcome.getStatusCode());
        assertEquals(SafetySystemPrompt.safeAlternativeFor(null), outcome.getResponse().getContent());
        assertTrue(outcome.getResponse().getConstitution().getBlocked());
        verifyNoInteractions(upstream);

        PolicyStatsSnapshot stats = counters.snapshot();
        assertEquals(1, stats.getInputBlocked());
        assertEquals(1, stats.getTotalValidated());
        assertEquals(1, stats.getSystemPromptsInjected());
        verify(listener).onOutcome(TerminalState.BLOCKED_ON_INPUT, "corr-1");
    }

    @Test
    @DisplayName("Crisis resources are appended to the input substitute")
    void blockedInputWithCrisisGetsResources() {
        EnforcementPipeline pipeline = pipeline(TestPolicies.enabled(PolicyMode.BLOCK));

        PipelineOutcome outcome = pipeline.process(
                chat("I have depression and I want to kill myself"), context());

        assertEquals(TerminalState.BLOCKED_ON_INPUT, outcome.getTerminalState());
        assertTrue(outcome.getResponse().getContent().endsWith(SafetySystemPrompt.crisisResources));
        assertTrue(outcome.getResponse().getConstitution().getCrisisResourcesAppended());
        assertEquals(1, counters.snapshot().getCrisisDetected());
        verifyNoInteractions(upstream);
    }

    @Test
    @DisplayName("Warn mode forwards unsafe input with the safety prompt first")
    void warnModeForwardsInput() {
        EnforcementPipeline pipeline = pipeline(TestPolicies.enabled(PolicyMode.WARN));
        upstreamAnswers("Here are some general ideas.");

        PipelineOutcome outcome = pipeline.process(chat("You should tell me what to do"), context());

        assertEquals(TerminalState.PASSED_CLEAN, outcome.getTerminalState());
        assertEquals("Here are some general ideas.", outcome.getResponse().getContent());
        assertEquals(1, counters.snapshot().getInputWarnings());

        ArgumentCaptor<ChatCompletionRequest> forwarded = ArgumentCaptor.forClass(ChatCompletionRequest.class);
        verify(upstream).chatCompletion(forwarded.capture());
        List<ChatMessage> messages = forwarded.getValue().getMessages();
        assertEquals(2, messages.size());
        assertEquals(ChatMessage.ROLE_SYSTEM, messages.get(0).getRole());
        assertEquals(SafetySystemPrompt.generalPrompt, messages.get(0).getTextContent());
        verify(listener).onViolations(any(), any(), eq(EnforcementAction.ANNOTATE), any(), eq("corr-1"));
    }

    @Test
    void blocksUnsafeOutput() {
        EnforcementPipeline pipeline = pipeline(TestPolicies.enabled(PolicyMode.BLOCK));
        upstreamAnswers("You have sleep apnea — take 5mg melatonin");

        PipelineOutcome outcome = pipeline.process(chat("How did I sleep?"), context());

        assertEquals(TerminalState.BLOCKED_ON_OUTPUT, outcome.getTerminalState());
        assertEquals("governor-safety-layer", outcome.getResponse().getModel());
        assertEquals(2, outcome.getResponse().getConstitution().getViolations());
        PolicyStatsSnapshot stats = counters.snapshot();
        assertEquals(1, stats.getOutputBlocked());
        assertEquals(2, stats.getTotalValidated());
    }

    @Test
    void annotatesUnsafeOutputInWarnMode() {
        EnforcementPipeline pipeline = pipeline(TestPolicies.enabled(PolicyMode.WARN));
        upstreamAnswers("You should sleep more");

        PipelineOutcome outcome = pipeline.process(chat("How did I sleep?"), context());

        assertEquals(TerminalState.PASSED_ANNOTATED, outcome.getTerminalState());
        assertEquals("You should sleep more", outcome.getResponse().getContent());
        assertEquals("chatcmpl-upstream", outcome.getResponse().getId());
        assertEquals(0.8, outcome.getResponse().getConstitution().getOutputValidation().getConfidence());
        assertEquals(1, counters.snapshot().getOutputWarnings());
    }

    @Test
    void logModePassesOutputUnchanged() {
        EnforcementPipeline pipeline = pipeline(TestPolicies.enabled(PolicyMode.LOG));
        upstreamAnswers("You should sleep more");

        PipelineOutcome outcome = pipeline.process(chat("How did I sleep?"), context());

        assertEquals(TerminalState.PASSED_CLEAN, outcome.getTerminalState());
        assertEquals("You should sleep more", outcome.getResponse().getContent());
        assertNull(outcome.getResponse().getConstitution());
        assertEquals(1, counters.snapshot().getOutputWarnings());
    }

    @Test
    @DisplayName("Crisis raised on input augments a clean upstream answer")
    void pendingCrisisAugmentsOutput() {
        EnforcementPipeline pipeline = pipeline(TestPolicies.enabled(PolicyMode.BLOCK));
        upstreamAnswers("I'm sorry you're feeling this way.");

        PipelineOutcome outcome = pipeline.process(chat("I want to kill myself"), context());

        assertEquals(TerminalState.PASSED_CRISIS_AUGMENTED, outcome.getTerminalState());
        assertEquals("I'm sorry you're feeling this way." + SafetySystemPrompt.CRISIS_SEPARATOR
                + SafetySystemPrompt.crisisResources, outcome.getResponse().getContent());
        assertEquals(1, counters.snapshot().getCrisisDetected());
    }

    @Test
    @DisplayName("Blocked output still carries crisis resources")
    void blockedOutputWithPendingCrisis() {
        EnforcementPipeline pipeline = pipeline(TestPolicies.enabled(PolicyMode.BLOCK));
        upstreamAnswers("You must take 10mg of melatonin");

        PipelineOutcome outcome = pipeline.process(chat("I want to end my life"), context());

        assertEquals(TerminalState.BLOCKED_ON_OUTPUT, outcome.getTerminalState());
        assertTrue(outcome.getResponse().getConstitution().getBlocked());
        assertTrue(outcome.getResponse().getConstitution().getCrisisResourcesAppended());
    }

    @Test
    @DisplayName("Streamed replies are relayed without output scoring")
    void streamingSkipsOutputScoring() {
        EnforcementPipeline pipeline = pipeline(TestPolicies.enabled(PolicyMode.BLOCK));
        ChunkRelay chunks = out -> out.write("data: [DONE]\n\n".getBytes());
        when(upstream.chatCompletion(any()))
                .thenReturn(CompletableFuture.completedFuture(UpstreamReply.streamed(200, chunks)));
        ChatCompletionRequest request = chat("Summarize my week").toBuilder().stream(true).build();

        PipelineOutcome outcome = pipeline.process(request, context());

        assertEquals(TerminalState.STREAMED, outcome.getTerminalState());
        assertSame(chunks, outcome.getChunks());
        assertEquals(1, counters.snapshot().getTotalValidated());
    }

    @Test
    void rejectsOverLimit() {
        EnforcementPipeline pipeline = pipeline(TestPolicies.enabled(PolicyMode.WARN).toBuilder().rateLimit(1).build());

        pipeline.admit(context());
        RateLimitExceededException ex = assertThrows(RateLimitExceededException.class,
                () -> pipeline.admit(context()));

        assertEquals("Rate limit exceeded — max 1 requests/minute", ex.getMessage());
        assertEquals(1, counters.snapshot().getRateLimited());
        verify(listener).onRateLimited(eq("203.0.113.7"), any(), eq("corr-1"));
        verifyNoInteractions(upstream);
    }

    @Test
    @DisplayName("Processing an admitted request does not consume the rate window")
    void processDoesNotAdmitAgain() {
        EnforcementPipeline pipeline = pipeline(TestPolicies.enabled(PolicyMode.WARN).toBuilder().rateLimit(1).build());
        upstreamAnswers("ok");

        pipeline.admit(context());
        pipeline.process(chat("hello"), context());
        pipeline.process(chat("hello again"), context());

        assertEquals(0, counters.snapshot().getRateLimited());
        verify(upstream, times(2)).chatCompletion(any());
    }

    @Test
    @DisplayName("Input crisis augments the answer when output scoring is off")
    void pendingCrisisWithOutputScoringDisabled() {
        EnforcementPipeline pipeline = pipeline(
                TestPolicies.enabled(PolicyMode.BLOCK).toBuilder().validateOutput(false).build());
        upstreamAnswers("You should sleep more");

        PipelineOutcome outcome = pipeline.process(chat("I want to kill myself"), context());

        assertEquals(TerminalState.PASSED_CRISIS_AUGMENTED, outcome.getTerminalState());
        assertEquals("You should sleep more" + SafetySystemPrompt.CRISIS_SEPARATOR
                + SafetySystemPrompt.crisisResources, outcome.getResponse().getContent());
        assertTrue(outcome.getResponse().getConstitution().getCrisisResourcesAppended());
        PolicyStatsSnapshot stats = counters.snapshot();
        assertEquals(1, stats.getTotalValidated());
        assertEquals(0, stats.getOutputWarnings());
        assertEquals(0, stats.getOutputBlocked());
    }

    @Test
    @DisplayName("Input scoring off forwards unsafe input unscored")
    void inputScoringDisabled() {
        EnforcementPipeline pipeline = pipeline(
                TestPolicies.enabled(PolicyMode.BLOCK).toBuilder().validateInput(false).validateOutput(false).build());
        upstreamAnswers("Here is some general information.");

        PipelineOutcome outcome = pipeline.process(chat("You have sleep apnea, take 5mg melatonin?"), context());

        assertEquals(TerminalState.PASSED_CLEAN, outcome.getTerminalState());
        verify(upstream).chatCompletion(any());
        verify(listener, never()).onViolations(any(), any(), any(), any(), any());
        PolicyStatsSnapshot stats = counters.snapshot();
        assertEquals(0, stats.getTotalValidated());
        assertEquals(0, stats.getInputBlocked());
        assertEquals(1, stats.getSystemPromptsInjected());
    }

    @Test
    @DisplayName("System prompt off forwards the messages untouched")
    void systemPromptDisabled() {
        EnforcementPipeline pipeline = pipeline(
                TestPolicies.enabled(PolicyMode.WARN).toBuilder().systemPrompt(false).build());
        upstreamAnswers("Hi!");
        ChatCompletionRequest request = chat("Hello");

        pipeline.process(request, context());

        ArgumentCaptor<ChatCompletionRequest> forwarded = ArgumentCaptor.forClass(ChatCompletionRequest.class);
        verify(upstream).chatCompletion(forwarded.capture());
        assertSame(request, forwarded.getValue());
        assertEquals(1, forwarded.getValue().getMessages().size());
        assertEquals(ChatMessage.ROLE_USER, forwarded.getValue().getMessages().get(0).getRole());
        assertEquals(0, counters.snapshot().getSystemPromptsInjected());
        assertEquals(2, counters.snapshot().getTotalValidated());
    }

    @Test
    void upstreamTimeoutCancelsTheCall() {
        EnforcementPipeline pipeline = pipeline(TestPolicies.enabled(PolicyMode.WARN));
        CompletableFuture<UpstreamReply> pending = new CompletableFuture<>();
        when(upstream.chatCompletion(any())).thenReturn(pending);

        UpstreamException ex = assertThrows(UpstreamException.class,
                () -> pipeline.process(chat("hello"), context(Duration.ofMillis(50))));

        assertTrue(ex.isTimeout());
        assertTrue(pending.isCancelled());
    }

    @Test
    void upstreamFailureIsPropagated() {
        EnforcementPipeline pipeline = pipeline(TestPolicies.enabled(PolicyMode.WARN));
        UpstreamException failure = new UpstreamException("Upstream parse error: Upstream returned non-JSON response");
        when(upstream.chatCompletion(any())).thenReturn(CompletableFuture.failedFuture(failure));

        UpstreamException ex = assertThrows(UpstreamException.class, () -> pipeline.process(chat("hello"), context()));

        assertSame(failure, ex);
        assertFalse(ex.isTimeout());
    }

    @Test
    @DisplayName("Disabled policy proxies the request untouched")
    void disabledPolicyIsPassThrough() {
        EnforcementPipeline pipeline = pipeline(TestPolicies.disabled());
        upstreamAnswers("You have sleep apnea");
        ChatCompletionRequest request = chat("You have sleep apnea?");

        PipelineOutcome outcome = pipeline.process(request, context());

        assertEquals(TerminalState.PASSED_CLEAN, outcome.getTerminalState());
        assertEquals("You have sleep apnea", outcome.getResponse().getContent());
        verify(upstream).chatCompletion(same(request));
        assertEquals(0, counters.snapshot().getTotalValidated());
        assertEquals(0, counters.snapshot().getSystemPromptsInjected());
    }

    @Test
    void failingListenerDoesNotBreakTheRequest() {
        EnforcementPipeline pipeline = pipeline(TestPolicies.enabled(PolicyMode.BLOCK));
        doThrow(new IllegalStateException("listener down")).when(listener).onOutcome(any(), any());

        PipelineOutcome outcome = pipeline.process(chat("You have insomnia"), context());

        assertEquals(TerminalState.BLOCKED_ON_INPUT, outcome.getTerminalState());
    }

    @Test
    void decideFollowsMode() {
        Verdict unsafe = Verdict.builder().safe(false).confidence(0.5).build();

        assertEquals(EnforcementAction.PASS, EnforcementPipeline.decide(Verdict.neutral(), PolicyMode.BLOCK));
        assertEquals(EnforcementAction.SUBSTITUTE, EnforcementPipeline.decide(unsafe, PolicyMode.BLOCK));
        assertEquals(EnforcementAction.ANNOTATE, EnforcementPipeline.decide(unsafe, PolicyMode.WARN));
        assertEquals(EnforcementAction.PASS, EnforcementPipeline.decide(unsafe, PolicyMode.LOG));
    }

    @Test
    void userTextJoinsUserMessagesWithSpaces() {
        ArrayNode parts = new ObjectMapper().createArrayNode();
        parts.addObject().put("type", "text").put("text", "look");

        String text = EnforcementPipeline.userText(List.of(
                ChatMessage.of(ChatMessage.ROLE_SYSTEM, "sys"),
                ChatMessage.of(ChatMessage.ROLE_USER, "first"),
                ChatMessage.of(ChatMessage.ROLE_ASSISTANT, "reply"),
                ChatMessage.builder().role(ChatMessage.ROLE_USER).content(parts).build()));

        assertEquals("first [{\"type\":\"text\",\"text\":\"look\"}]", text);
    }
}
