package com.infergate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Admission and batching state for the admin API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConcurrencyStatus {

    @JsonProperty("running")
    private int running;

    @JsonProperty("admitted")
    private int admitted;

    @JsonProperty("waiting")
    private int waiting;

    @JsonProperty("max_concurrent")
    private int maxConcurrent;

    @JsonProperty("max_admitted")
    private int maxAdmitted;

    @JsonProperty("queue_timeout_ms")
    private long queueTimeoutMs;

    @JsonProperty("shutting_down")
    private boolean shuttingDown;

    @JsonProperty("workers_active")
    private int workersActive;

    @JsonProperty("batching")
    private BatchingStatus batching;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BatchingStatus {

        @JsonProperty("enabled")
        private boolean enabled;

        @JsonProperty("max_batch_size")
        private int maxBatchSize;

        @JsonProperty("max_wait_ms")
        private long maxWaitMs;

        @JsonProperty("model_overrides")
        private Map<String, Boolean> modelOverrides;

        @JsonProperty("batches_dispatched")
        private long batchesDispatched;

        @JsonProperty("items_dispatched")
        private long itemsDispatched;

        @JsonProperty("batches_failed")
        private long batchesFailed;
    }
}
