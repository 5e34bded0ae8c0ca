package com.governorHq.llmGateway.upstream.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.governorHq.llmGateway.gateway.dto.ChatCompletionRequest;
import com.governorHq.llmGateway.gateway.dto.ChatCompletionResponse;
import com.governorHq.llmGateway.upstream.exception.UpstreamException;
import com.governorHq.llmGateway.upstream.model.ChunkRelay;
import com.governorHq.llmGateway.upstream.model.UpstreamReply;
import com.governorHq.llmGateway.upstream.util.UpstreamFutures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Client for the upstream OpenAI-compatible provider.
 * Handles HTTP communication with the {@code /chat/completions} and
 * {@code /completions} endpoints; the provider URL and key never leave the server.
 */
@Slf4j
@Service
public class UpstreamLlmClient implements LlmUpstream {

    private static final int RELAY_BUFFER_SIZE = 8192;

    private final RestClient restClient;
    private final Executor executor;
    private final String defaultModel;

    public UpstreamLlmClient(RestClient.Builder restClientBuilder,
                             @Qualifier("upstreamExecutor") Executor executor,
                             @Value("${llm.api.url:https://api.openai.com/v1}") String apiUrl,
                             @Value("${llm.api.key:}") String apiKey,
                             @Value("${llm.model:gpt-4o-mini}") String defaultModel,
                             @Value("${llm.request-timeout-ms:120000}") int requestTimeoutMs) {
        Duration timeout = Duration.ofMillis(requestTimeoutMs);
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);

        RestClient.Builder builder = restClientBuilder
                .baseUrl(stripTrailingSlash(apiUrl))
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        this.restClient = builder.build();
        this.executor = executor;
        this.defaultModel = defaultModel;
    }

    /**
     * Sends a chat-completion request. The server-side model is used when the caller did not name one.
     *
     * @param request Chat-completion request, possibly rewritten by the safety layer
     * @return future resolving to the materialized response or the live chunk sequence
     */
    @Override
    public CompletableFuture<UpstreamReply> chatCompletion(ChatCompletionRequest request) {
        ChatCompletionRequest outbound = withModel(request);
        return UpstreamFutures.supply(() -> exchangeChat(outbound), executor, UpstreamReply::release);
    }

    /**
     * Sends a raw text-completion request.
     *
     * @param body      request body as received from the caller
     * @param streaming whether the caller asked for a streamed reply
     * @return future resolving to the untyped reply
     */
    @Override
    public CompletableFuture<RawReply> completion(JsonNode body, boolean streaming) {
        return UpstreamFutures.supply(() -> exchangeRaw(body, streaming), executor, RawReply::release);
    }

    private UpstreamReply exchangeChat(ChatCompletionRequest request) {
        log.debug("Calling upstream chat/completions - model: {}, messages: {}, stream: {}",
                request.getModel(), request.getMessages() != null ? request.getMessages().size() : 0,
                request.isStreaming());
        try {
            if (request.isStreaming()) {
                return restClient.post()
                        .uri("/chat/completions")
                        .body(request)
                        .exchange((req, resp) -> UpstreamReply.streamed(resp.getStatusCode().value(), relayOf(resp)),
                                false);
            }
            return restClient.post()
                    .uri("/chat/completions")
                    .body(request)
                    .exchange((req, resp) -> {
                        int status = resp.getStatusCode().value();
                        ChatCompletionResponse response = readBody(() -> resp.bodyTo(ChatCompletionResponse.class));
                        log.debug("Upstream response received - status: {}, model: {}", status,
                                response != null ? response.getModel() : "unknown");
                        return UpstreamReply.materialized(status, response);
                    });
        } catch (UpstreamException e) {
            throw e;
        } catch (RestClientException e) {
            log.error("Error calling upstream chat/completions: {}", e.getMessage());
            throw new UpstreamException("Upstream error: " + e.getMessage(), e);
        }
    }

    private RawReply exchangeRaw(JsonNode body, boolean streaming) {
        log.debug("Calling upstream completions - stream: {}", streaming);
        try {
            if (streaming) {
                return restClient.post()
                        .uri("/completions")
                        .body(body)
                        .exchange((req, resp) -> new RawReply(resp.getStatusCode().value(), null, relayOf(resp)),
                                false);
            }
            return restClient.post()
                    .uri("/completions")
                    .body(body)
                    .exchange((req, resp) -> new RawReply(resp.getStatusCode().value(),
                            readBody(() -> resp.bodyTo(JsonNode.class)), null));
        } catch (UpstreamException e) {
            throw e;
        } catch (RestClientException e) {
            log.error("Error calling upstream completions: {}", e.getMessage());
            throw new UpstreamException("Upstream error: " + e.getMessage(), e);
        }
    }

    private ChatCompletionRequest withModel(ChatCompletionRequest request) {
        if (request.getModel() != null && !request.getModel().isBlank()) {
            return request;
        }
        return request.toBuilder().model(defaultModel).build();
    }

    private static <T> T readBody(BodyReader<T> reader) {
        try {
            T body = reader.read();
            if (body == null) {
                throw new UpstreamException("Upstream parse error: empty response body");
            }
            return body;
        } catch (IOException | RestClientException e) {
            throw new UpstreamException("Upstream parse error: Upstream returned non-JSON response", e);
        }
    }

    private static ChunkRelay relayOf(ClientHttpResponse resp) {
        return new ChunkRelay() {
            @Override
            public void relayTo(OutputStream out) throws IOException {
                try (resp; InputStream in = resp.getBody()) {
                    copyFlushing(in, out);
                }
            }

            @Override
            public void release() {
                resp.close();
            }
        };
    }

    private static void copyFlushing(InputStream in, OutputStream out) throws IOException {
        byte[] buffer = new byte[RELAY_BUFFER_SIZE];
        int read;
        while ((read = in.read(buffer)) != -1) {
            out.write(buffer, 0, read);
            out.flush();
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @FunctionalInterface
    private interface BodyReader<T> {
        T read() throws IOException;
    }
}
