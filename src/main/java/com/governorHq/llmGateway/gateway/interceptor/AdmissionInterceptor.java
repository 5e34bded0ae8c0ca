package com.governorHq.llmGateway.gateway.interceptor;

import com.governorHq.llmGateway.gateway.model.RequestContext;
import com.governorHq.llmGateway.gateway.service.GatewayService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Opens the request context and runs admission before the body is read,
 * so malformed requests count against the rate window too.
 * The context is handed to the controller as the {@link RequestContext#ATTRIBUTE} request attribute.
 */
@Component
@RequiredArgsConstructor
public class AdmissionInterceptor implements HandlerInterceptor {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    static final String REQUEST_ID_HEADER = "X-Request-ID";

    private final GatewayService gatewayService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // async re-dispatch of a streamed reply was admitted already
        if (CorsUtils.isPreFlightRequest(request) || request.getAttribute(RequestContext.ATTRIBUTE) != null) {
            return true;
        }
        RequestContext context = gatewayService.admit(
                request.getHeader(FORWARDED_FOR_HEADER),
                request.getRemoteAddr(),
                request.getHeader(REQUEST_ID_HEADER));
        request.setAttribute(RequestContext.ATTRIBUTE, context);
        return true;
    }
}
