package com.governorHq.llmGateway.gateway.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.governorHq.llmGateway.gateway.dto.ApiError;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Set;

/**
 * Requires the gateway key on every non-public route when {@code gateway.api-key} is set.
 * Accepted as {@code Authorization: Bearer <key>} or {@code x-api-key: <key>}.
 * Status routes and CORS preflight are always public; with no key configured the gateway is open.
 */
@Slf4j
@Component
public class GatewayApiKeyFilter extends OncePerRequestFilter {

    static final String API_KEY_HEADER = "x-api-key";
    static final String UNAUTHORIZED_MESSAGE =
            "Unauthorized — provide a valid key via Authorization: Bearer <key> or x-api-key header";

    private static final String BEARER_PREFIX = "bearer ";
    private static final Set<String> PUBLIC_PATHS = Set.of("/health", "/info", "/v1/constitution");

    private final byte[] gatewayApiKey;
    private final ObjectMapper objectMapper;

    public GatewayApiKeyFilter(@Value("${gateway.api-key:}") String gatewayApiKey, ObjectMapper objectMapper) {
        this.gatewayApiKey = gatewayApiKey == null ? new byte[0] : gatewayApiKey.getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (gatewayApiKey.length == 0 || HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }
        return HttpMethod.GET.matches(request.getMethod()) && PUBLIC_PATHS.contains(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        if (isAuthorized(request)) {
            chain.doFilter(request, response);
            return;
        }

        log.warn("Unauthorized request - method: {}, path: {}", request.getMethod(), request.getRequestURI());
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        objectMapper.writeValue(response.getOutputStream(),
                ApiError.of(HttpServletResponse.SC_UNAUTHORIZED, ApiError.AUTHENTICATION, UNAUTHORIZED_MESSAGE));
    }

    private boolean isAuthorized(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.toLowerCase().startsWith(BEARER_PREFIX)
                && matches(authorization.substring(BEARER_PREFIX.length()).trim())) {
            return true;
        }
        String apiKey = request.getHeader(API_KEY_HEADER);
        return apiKey != null && matches(apiKey.trim());
    }

    private boolean matches(String presented) {
        return MessageDigest.isEqual(gatewayApiKey, presented.getBytes(StandardCharsets.UTF_8));
    }
}
