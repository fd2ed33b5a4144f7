package com.infergate.controller;

import com.infergate.batching.BatchScheduler;
import com.infergate.batching.BatchSettings;
import com.infergate.concurrency.AdmissionLimiter;
import com.infergate.concurrency.ExecutionPool;
import com.infergate.concurrency.LimiterSnapshot;
import com.infergate.model.ConcurrencyStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Admin API for inspecting admission and batching state.
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin")
public class AdminController {

    private final AdmissionLimiter limiter;
    private final ExecutionPool executionPool;
    private final BatchScheduler<String, float[]> batchScheduler;

    public AdminController(AdmissionLimiter limiter,
                           ExecutionPool executionPool,
                           BatchScheduler<String, float[]> batchScheduler) {
        this.limiter = limiter;
        this.executionPool = executionPool;
        this.batchScheduler = batchScheduler;
    }

    /**
     * Current limiter counters, worker activity and batching configuration.
     *
     * @return concurrency status snapshot
     */
    @GetMapping("/concurrency")
    public Mono<ConcurrencyStatus> getConcurrency() {
        log.debug("Admin: Getting concurrency status");

        LimiterSnapshot snapshot = limiter.snapshot();
        BatchSettings settings = batchScheduler.getSettings();

        return Mono.just(ConcurrencyStatus.builder()
                .running(snapshot.getRunning())
                .admitted(snapshot.getAdmitted())
                .waiting(snapshot.getWaiting())
                .maxConcurrent(snapshot.getMaxConcurrent())
                .maxAdmitted(snapshot.getMaxAdmitted())
                .queueTimeoutMs(limiter.getQueueTimeout().toMillis())
                .shuttingDown(snapshot.isShuttingDown())
                .workersActive(executionPool.getActiveCount())
                .batching(ConcurrencyStatus.BatchingStatus.builder()
                        .enabled(settings.isEnabled())
                        .maxBatchSize(settings.getMaxBatchSize())
                        .maxWaitMs(settings.getMaxWait().toMillis())
                        .modelOverrides(settings.getModelOverrides())
                        .batchesDispatched(batchScheduler.getBatchesDispatched())
                        .itemsDispatched(batchScheduler.getItemsDispatched())
                        .batchesFailed(batchScheduler.getBatchesFailed())
                        .build())
                .build());
    }
}
