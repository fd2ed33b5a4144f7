package com.infergate.batching;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Batching limits shared by all models, plus per-model enable overrides.
 */
@Value
@Builder
public class BatchSettings {

    @Builder.Default
    boolean enabled = true;

    @Builder.Default
    int maxBatchSize = 32;

    @Builder.Default
    Duration maxWait = Duration.ofMillis(5);

    @Singular("modelEnabled")
    Map<String, Boolean> modelOverrides;

    public boolean isEnabled(String model) {
        Boolean override = modelOverrides.get(model);
        return override != null ? override : enabled;
    }

    public void validate() {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be > 0");
        }
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must not be negative");
        }
    }
}
