package com.infergate.config;

import com.infergate.batching.BatchScheduler;
import com.infergate.batching.BatchSettings;
import com.infergate.concurrency.AdmissionLimiter;
import com.infergate.concurrency.ExecutionPool;
import com.infergate.handler.ModelRegistry;
import com.infergate.handler.RegistryBatchHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Composition root for the admission and batching layer. Every component is an
 * explicitly constructed bean; shutdown order is owned by {@link InferenceLifecycle}.
 */
@Slf4j
@Configuration
public class ConcurrencyConfiguration {

    private final InfergateProperties properties;

    public ConcurrencyConfiguration(InfergateProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "")
    public ModelRegistry modelRegistry() {
        return ModelRegistry.load(properties.getModels(), properties.getAllowedModels(), properties.getDevice());
    }

    @Bean
    public AdmissionLimiter admissionLimiter(ModelRegistry modelRegistry, Clock clock) {
        InfergateProperties.ConcurrencyConfig config = properties.getConcurrency();
        int maxConcurrent = resolveMaxConcurrent(config, modelRegistry);

        log.info("Admission limits: max-concurrent={}, max-admitted={}, queue-timeout={}ms",
                maxConcurrent, config.getMaxAdmitted(), config.getQueueTimeout().toMillis());
        return new AdmissionLimiter(maxConcurrent, config.getMaxAdmitted(), config.getQueueTimeout(), clock);
    }

    /**
     * Sized to the limiter's execution ceiling so the two never double-bound each other.
     */
    @Bean(destroyMethod = "")
    public ExecutionPool executionPool(AdmissionLimiter admissionLimiter) {
        return new ExecutionPool(admissionLimiter.getMaxConcurrent(), "embed-worker");
    }

    @Bean
    public BatchScheduler<String, float[]> batchScheduler(ModelRegistry modelRegistry, ExecutionPool executionPool) {
        InfergateProperties.BatchingConfig config = properties.getBatching();
        BatchSettings settings = BatchSettings.builder()
                .enabled(config.isEnabled())
                .maxBatchSize(config.getMaxBatchSize())
                .maxWait(config.getMaxWait())
                .modelOverrides(config.getModels())
                .build();

        log.info("Batching: enabled={}, max-batch-size={}, max-wait={}ms, overrides={}",
                settings.isEnabled(), settings.getMaxBatchSize(), settings.getMaxWait().toMillis(),
                settings.getModelOverrides());
        return new BatchScheduler<>(new RegistryBatchHandler(modelRegistry), executionPool, settings);
    }

    static int resolveMaxConcurrent(InfergateProperties.ConcurrencyConfig config, ModelRegistry registry) {
        if (config.getMaxConcurrent() > 0) {
            boolean exclusiveOnly = registry.handlers().stream().allMatch(h -> h.requiresExclusiveAccess());
            if (exclusiveOnly && config.getMaxConcurrent() > registry.handlers().size()) {
                log.warn("max-concurrent={} exceeds the {} exclusive-access model(s); extra slots will wait on model locks",
                        config.getMaxConcurrent(), registry.handlers().size());
            }
            return config.getMaxConcurrent();
        }

        int derived = registry.deriveMaxConcurrent(Runtime.getRuntime().availableProcessors());
        if (derived > config.getMaxAdmitted()) {
            log.warn("Derived max-concurrent={} capped to max-admitted={}", derived, config.getMaxAdmitted());
            derived = config.getMaxAdmitted();
        }
        log.info("Derived max-concurrent={} from {} loaded model(s)", derived, registry.handlers().size());
        return derived;
    }
}
