package com.infergate.controller;

import com.infergate.concurrency.AdmissionLimiter;
import com.infergate.handler.ModelRegistry;
import com.infergate.model.HealthResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Liveness for load balancers. Reports 503 once draining has started so traffic moves
 * away before the process exits.
 */
@RestController
public class HealthController {

    private final ModelRegistry registry;
    private final AdmissionLimiter limiter;

    public HealthController(ModelRegistry registry, AdmissionLimiter limiter) {
        this.registry = registry;
        this.limiter = limiter;
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        if (limiter.isShuttingDown()) {
            return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(HealthResponse.builder().status("draining").build()));
        }
        return Mono.just(ResponseEntity.ok(HealthResponse.builder()
                .status("ok")
                .models(registry.listModels())
                .build()));
    }
}
