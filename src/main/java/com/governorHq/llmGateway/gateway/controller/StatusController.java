package com.governorHq.llmGateway.gateway.controller;

import com.governorHq.llmGateway.gateway.dto.HealthResponse;
import com.governorHq.llmGateway.gateway.service.GatewayStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Public status routes. Never require the gateway key.
 */
@RestController
@CrossOrigin(origins = "*", methods = {RequestMethod.GET, RequestMethod.OPTIONS})
@RequiredArgsConstructor
public class StatusController {

    private final GatewayStatusService statusService;

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(statusService.health());
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        return ResponseEntity.ok(statusService.info());
    }

    /**
     * Safety layer configuration (no secrets), hard rules, layers and live counters.
     */
    @GetMapping("/v1/constitution")
    public ResponseEntity<Map<String, Object>> constitution() {
        return ResponseEntity.ok(statusService.constitution());
    }
}
