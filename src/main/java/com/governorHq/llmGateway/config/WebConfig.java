package com.governorHq.llmGateway.config;

import com.governorHq.llmGateway.gateway.interceptor.AdmissionInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Rate-limited routes pass through admission first.
 */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final AdmissionInterceptor admissionInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(admissionInterceptor)
                .addPathPatterns("/v1/chat/completions", "/v1/completions", "/v1/models");
    }
}
