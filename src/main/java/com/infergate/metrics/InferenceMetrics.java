package com.infergate.metrics;

import com.infergate.concurrency.AdmissionLimiter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Request metrics. Every recording method is fire-and-forget: a metrics failure is
 * logged and never reaches the request path.
 */
@Slf4j
@Component
public class InferenceMetrics {

    static final String REQUESTS = "embedding.requests";
    static final String LATENCY = "embedding.request.latency";
    static final String QUEUE_REJECTIONS = "embedding.queue.rejections";

    private final MeterRegistry registry;

    public InferenceMetrics(MeterRegistry registry, AdmissionLimiter limiter) {
        this.registry = registry;

        Tags tags = Tags.of("component", "admission_limiter");
        Gauge.builder("admission.running", limiter, l -> l.snapshot().getRunning())
                .tags(tags)
                .description("Requests holding an execution slot")
                .register(registry);
        Gauge.builder("admission.admitted", limiter, l -> l.snapshot().getAdmitted())
                .tags(tags)
                .description("Requests admitted, running or waiting")
                .register(registry);
        Gauge.builder("admission.waiting", limiter, l -> l.snapshot().getWaiting())
                .tags(tags)
                .description("Requests waiting for an execution slot")
                .register(registry);
    }

    public void recordRequest(String model, String status) {
        try {
            Counter.builder(REQUESTS)
                    .description("Total number of embedding requests")
                    .tag("model", String.valueOf(model))
                    .tag("status", status)
                    .register(registry)
                    .increment();
        } catch (RuntimeException e) {
            log.debug("Failed to record request metric", e);
        }
    }

    public void observeLatency(String model, Duration latency) {
        try {
            Timer.builder(LATENCY)
                    .description("Embedding request latency")
                    .tag("model", String.valueOf(model))
                    .publishPercentileHistogram()
                    .register(registry)
                    .record(latency);
        } catch (RuntimeException e) {
            log.debug("Failed to record latency metric", e);
        }
    }

    public void recordQueueRejection(String reason) {
        try {
            Counter.builder(QUEUE_REJECTIONS)
                    .description("Requests rejected due to queue limits")
                    .tag("reason", reason)
                    .register(registry)
                    .increment();
        } catch (RuntimeException e) {
            log.debug("Failed to record queue rejection metric", e);
        }
    }
}
