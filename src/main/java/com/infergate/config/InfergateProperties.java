package com.infergate.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for Infergate. Read once at startup.
 */
@Data
@Component
@ConfigurationProperties(prefix = "infergate")
public class InfergateProperties {

    /**
     * Device identifier reported by handlers. Informational only.
     */
    private String device = "cpu";

    /**
     * When non-empty, only these configured models are loaded.
     */
    private List<String> allowedModels = new ArrayList<>();

    private List<ModelConfig> models = new ArrayList<>();
    private ConcurrencyConfig concurrency = new ConcurrencyConfig();
    private BatchingConfig batching = new BatchingConfig();
    private LimitsConfig limits = new LimitsConfig();

    @Data
    public static class ModelConfig {
        private String name;
        /**
         * Handler kind tag, see HandlerKind.
         */
        private String kind;
        /**
         * Model file path or repository id, depending on the kind.
         */
        private String source;
        private int dimensions = 384;
        /**
         * Whether invocations must be serialized because the model is not thread-safe.
         */
        private Boolean exclusive;
        private Map<String, String> options = new HashMap<>();
    }

    @Data
    public static class ConcurrencyConfig {
        /**
         * Execution slots. 0 derives the value from the loaded models.
         */
        private int maxConcurrent = 0;
        /**
         * Total admitted requests, running plus waiting.
         */
        private int maxAdmitted = 64;
        private Duration queueTimeout = Duration.ofSeconds(2);
        private Duration drainGrace = Duration.ofSeconds(30);
        private Duration requestTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class BatchingConfig {
        private boolean enabled = true;
        private int maxBatchSize = 32;
        private Duration maxWait = Duration.ofMillis(5);
        /**
         * Per-model enable overrides keyed by model name.
         */
        private Map<String, Boolean> models = new HashMap<>();
    }

    @Data
    public static class LimitsConfig {
        private int maxInputItems = 32;
        private int maxTextChars = 20000;
    }
}
