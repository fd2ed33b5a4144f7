package com.infergate.config;

import com.infergate.batching.BatchScheduler;
import com.infergate.concurrency.AdmissionLimiter;
import com.infergate.concurrency.ExecutionPool;
import com.infergate.handler.ModelRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerGracefulShutdownLifecycle;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Graceful shutdown: stop admitting, let admitted requests finish, flush leftover
 * batches, stop the workers, then close the models.
 *
 * Stops in a phase above the web server's graceful shutdown, so the server still
 * answers while draining: new requests get 503 and /health reports "draining".
 */
@Slf4j
@Component
public class InferenceLifecycle implements SmartLifecycle {

    static final int PHASE = WebServerGracefulShutdownLifecycle.SMART_LIFECYCLE_PHASE + 1;

    private final AdmissionLimiter limiter;
    private final BatchScheduler<String, float[]> batchScheduler;
    private final ExecutionPool executionPool;
    private final ModelRegistry modelRegistry;
    private final InfergateProperties properties;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();

    public InferenceLifecycle(AdmissionLimiter limiter,
                              BatchScheduler<String, float[]> batchScheduler,
                              ExecutionPool executionPool,
                              ModelRegistry modelRegistry,
                              InfergateProperties properties) {
        this.limiter = limiter;
        this.batchScheduler = batchScheduler;
        this.executionPool = executionPool;
        this.modelRegistry = modelRegistry;
        this.properties = properties;
    }

    @Override
    public void start() {
        running.set(true);
        log.info("Inference gateway ready: max-concurrent={}, max-admitted={}, models={}",
                limiter.getMaxConcurrent(), limiter.getMaxAdmitted(), modelRegistry.listModels());
    }

    @Override
    public void stop() {
        try {
            shutdown();
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    /**
     * Runs the shutdown sequence once. Also bound to bean destruction for contexts that
     * close without stopping lifecycle beans.
     */
    @PreDestroy
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        Duration grace = properties.getConcurrency().getDrainGrace();
        log.info("Shutting down inference gateway (grace {}ms)", grace.toMillis());

        Boolean drained = limiter.drain(grace).block(grace.plusSeconds(1));
        if (!Boolean.TRUE.equals(drained)) {
            log.warn("Shutdown continuing with requests still admitted: {}", limiter.snapshot());
        }

        batchScheduler.flushAll();
        executionPool.shutdown(grace);
        modelRegistry.close();
        log.info("Inference gateway stopped");
    }
}
