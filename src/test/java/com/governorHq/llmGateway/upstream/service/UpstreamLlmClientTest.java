package com.governorHq.llmGateway.upstream.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.governorHq.llmGateway.gateway.dto.ChatCompletionRequest;
import com.governorHq.llmGateway.gateway.dto.ChatMessage;
import com.governorHq.llmGateway.upstream.exception.UpstreamException;
import com.governorHq.llmGateway.upstream.model.UpstreamReply;
import com.governorHq.llmGateway.upstream.util.UpstreamFutures;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.web.client.RestClient;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for UpstreamLlmClient against a local mock provider.
 */
class UpstreamLlmClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private MockWebServer mockServer;
    private ObjectMapper objectMapper;
    private UpstreamLlmClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();
        objectMapper = new ObjectMapper();
        client = new UpstreamLlmClient(RestClient.builder(), Runnable::run,
                mockServer.url("/v1/").toString(), "sk-test", "gpt-4o-mini", 5000);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    private static ChatCompletionRequest request() {
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .messages(List.of(ChatMessage.of(ChatMessage.ROLE_USER, "Hello")))
                .build();
        request.setAdditionalProperty("temperature", 0.2);
        return request;
    }

    @Test
    @DisplayName("Should forward chat completion with default model, key and extra fields")
    void forwardsChatCompletion() throws Exception {
        mockServer.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"id\":\"chatcmpl-1\",\"object\":\"chat.completion\",\"model\":\"gpt-4o-mini\","
                        + "\"system_fingerprint\":\"fp_1\","
                        + "\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"Hi!\"},"
                        + "\"finish_reason\":\"stop\",\"logprobs\":null}]}"));

        UpstreamReply reply = UpstreamFutures.await(client.chatCompletion(request()), TIMEOUT, "corr-1");

        assertFalse(reply.isStreamed());
        assertEquals(200, reply.getStatusCode());
        assertEquals("Hi!", reply.getResponse().getContent());
        assertEquals("fp_1", reply.getResponse().getAdditionalProperties().get("system_fingerprint"));

        RecordedRequest recorded = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(recorded);
        assertEquals("/v1/chat/completions", recorded.getPath());
        assertEquals("Bearer sk-test", recorded.getHeader("Authorization"));
        JsonNode sent = objectMapper.readTree(recorded.getBody().readUtf8());
        assertEquals("gpt-4o-mini", sent.get("model").asText());
        assertEquals(0.2, sent.get("temperature").asDouble());
        assertEquals("Hello", sent.get("messages").get(0).get("content").asText());
        assertFalse(sent.has("stream"));
    }

    @Test
    @DisplayName("Should keep upstream error status and body")
    void keepsUpstreamErrorStatus() {
        mockServer.enqueue(new MockResponse()
                .setResponseCode(401)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"error\":{\"message\":\"Incorrect API key\",\"type\":\"invalid_request_error\"}}"));

        UpstreamReply reply = UpstreamFutures.await(client.chatCompletion(request()), TIMEOUT, "corr-1");

        assertEquals(401, reply.getStatusCode());
        assertFalse(reply.getResponse().hasContent());
        assertTrue(reply.getResponse().getAdditionalProperties().containsKey("error"));
    }

    @Test
    @DisplayName("Should fail with parse error on non-JSON body")
    void nonJsonBodyIsParseError() {
        mockServer.enqueue(new MockResponse()
                .setHeader("Content-Type", "text/html")
                .setBody("<html>Bad Gateway</html>"));

        UpstreamException ex = assertThrows(UpstreamException.class,
                () -> UpstreamFutures.await(client.chatCompletion(request()), TIMEOUT, "corr-1"));

        assertTrue(ex.getMessage().startsWith("Upstream parse error"));
        assertFalse(ex.isTimeout());
    }

    @Test
    @DisplayName("Should relay streamed chunks verbatim")
    void relaysStream() throws IOException {
        String events = "data: {\"choices\":[{\"delta\":{\"content\":\"Hi\"}}]}\n\ndata: [DONE]\n\n";
        mockServer.enqueue(new MockResponse()
                .setHeader("Content-Type", "text/event-stream")
                .setBody(events));
        ChatCompletionRequest streaming = request().toBuilder().stream(true).build();

        UpstreamReply reply = UpstreamFutures.await(client.chatCompletion(streaming), TIMEOUT, "corr-1");

        assertTrue(reply.isStreamed());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        reply.getChunks().relayTo(out);
        assertEquals(events, out.toString(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should pass text completions through")
    void forwardsTextCompletion() throws Exception {
        mockServer.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"object\":\"text_completion\",\"choices\":[{\"text\":\" there was\"}]}"));
        JsonNode body = objectMapper.readTree("{\"model\":\"gpt-4o-mini\",\"prompt\":\"Once upon a time\"}");

        LlmUpstream.RawReply reply = UpstreamFutures.await(client.completion(body, false), TIMEOUT, "corr-1");

        assertEquals(200, reply.statusCode());
        assertEquals(" there was", reply.body().get("choices").get(0).get("text").asText());
        assertNull(reply.chunks());
        assertEquals("/v1/completions", mockServer.takeRequest(1, TimeUnit.SECONDS).getPath());
    }

    @Test
    @DisplayName("Should fail with upstream error when the provider is unreachable")
    void unreachableUpstream() throws IOException {
        mockServer.shutdown();

        UpstreamException ex = assertThrows(UpstreamException.class,
                () -> UpstreamFutures.await(client.chatCompletion(request()), TIMEOUT, "corr-1"));

        assertTrue(ex.getMessage().startsWith("Upstream error"));
    }

    @Test
    @DisplayName("Should pass an upstream auth failure through on text completions")
    void keepsUpstreamAuthErrorOnTextCompletion() throws Exception {
        mockServer.enqueue(new MockResponse()
                .setResponseCode(401)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"error\":{\"message\":\"Incorrect API key\",\"code\":\"invalid_api_key\"}}"));
        JsonNode body = objectMapper.readTree("{\"prompt\":\"Once upon a time\"}");

        LlmUpstream.RawReply reply = UpstreamFutures.await(client.completion(body, false), TIMEOUT, "corr-1");

        assertEquals(401, reply.statusCode());
        assertEquals("invalid_api_key", reply.body().get("error").get("code").asText());
    }

    @Test
    @DisplayName("Should fail with upstream error when the worker pool is saturated")
    void saturatedExecutorIsUpstreamError() {
        Executor saturated = command -> {
            throw new TaskRejectedException("upstream pool is full");
        };
        UpstreamLlmClient busyClient = new UpstreamLlmClient(RestClient.builder(), saturated,
                mockServer.url("/v1/").toString(), "sk-test", "gpt-4o-mini", 5000);

        UpstreamException chatFailure = assertThrows(UpstreamException.class,
                () -> UpstreamFutures.await(busyClient.chatCompletion(request()), TIMEOUT, "corr-1"));
        UpstreamException textFailure = assertThrows(UpstreamException.class,
                () -> UpstreamFutures.await(busyClient.completion(objectMapper.createObjectNode(), false),
                        TIMEOUT, "corr-1"));

        assertTrue(chatFailure.getMessage().startsWith("Upstream error"));
        assertTrue(textFailure.getMessage().startsWith("Upstream error"));
        assertFalse(chatFailure.isTimeout());
        assertEquals(0, mockServer.getRequestCount());
    }
}
