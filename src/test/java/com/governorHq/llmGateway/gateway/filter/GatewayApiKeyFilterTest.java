package com.governorHq.llmGateway.gateway.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;

class GatewayApiKeyFilterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockHttpServletResponse run(GatewayApiKeyFilter filter, MockHttpServletRequest request, MockFilterChain chain)
            throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, chain);
        return response;
    }

    @Test
    @DisplayName("Open mode lets everything through")
    void openWithoutKey() throws Exception {
        GatewayApiKeyFilter filter = new GatewayApiKeyFilter("", objectMapper);
        MockFilterChain chain = new MockFilterChain();

        run(filter, new MockHttpServletRequest("POST", "/v1/chat/completions"), chain);

        assertNotNull(chain.getRequest());
    }

    @Test
    void acceptsBearerToken() throws Exception {
        GatewayApiKeyFilter filter = new GatewayApiKeyFilter("gw-secret", objectMapper);
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/chat/completions");
        request.addHeader("Authorization", "Bearer gw-secret");
        MockFilterChain chain = new MockFilterChain();

        run(filter, request, chain);

        assertNotNull(chain.getRequest());
    }

    @Test
    void acceptsApiKeyHeader() throws Exception {
        GatewayApiKeyFilter filter = new GatewayApiKeyFilter("gw-secret", objectMapper);
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/models");
        request.addHeader("x-api-key", " gw-secret ");
        MockFilterChain chain = new MockFilterChain();

        run(filter, request, chain);

        assertNotNull(chain.getRequest());
    }

    @Test
    void rejectsWrongKey() throws Exception {
        GatewayApiKeyFilter filter = new GatewayApiKeyFilter("gw-secret", objectMapper);
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/completions");
        request.addHeader("Authorization", "Bearer nope");
        MockFilterChain chain = new MockFilterChain();

        MockHttpServletResponse response = run(filter, request, chain);

        assertNull(chain.getRequest());
        assertEquals(401, response.getStatus());
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertEquals("authentication_error", body.get("error").get("type").asText());
        assertEquals(401, body.get("error").get("code").asInt());
    }

    @Test
    @DisplayName("Status routes and preflight stay public")
    void publicRoutes() throws Exception {
        GatewayApiKeyFilter filter = new GatewayApiKeyFilter("gw-secret", objectMapper);

        for (String path : new String[]{"/health", "/info", "/v1/constitution"}) {
            MockFilterChain chain = new MockFilterChain();
            run(filter, new MockHttpServletRequest("GET", path), chain);
            assertNotNull(chain.getRequest(), path);
        }

        MockFilterChain preflight = new MockFilterChain();
        run(filter, new MockHttpServletRequest("OPTIONS", "/v1/chat/completions"), preflight);
        assertNotNull(preflight.getRequest());
    }
}
