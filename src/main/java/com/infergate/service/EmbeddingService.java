package com.infergate.service;

import com.infergate.batching.BatchScheduler;
import com.infergate.concurrency.AdmissionLimiter;
import com.infergate.config.InfergateProperties;
import com.infergate.exception.AdmissionException;
import com.infergate.exception.BatchFailureException;
import com.infergate.exception.CancelledException;
import com.infergate.exception.InvalidRequestException;
import com.infergate.exception.ModelNotFoundException;
import com.infergate.exception.QueueFullException;
import com.infergate.exception.QueueTimeoutException;
import com.infergate.exception.ShuttingDownException;
import com.infergate.handler.EmbeddingHandler;
import com.infergate.handler.ModelRegistry;
import com.infergate.metrics.InferenceMetrics;
import com.infergate.model.EmbeddingData;
import com.infergate.model.EmbeddingRequest;
import com.infergate.model.EmbeddingResponse;
import com.infergate.model.Usage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Runs one embedding request through the gateway.
 *
 * Flow:
 * 1. Validate the request (encoding, item count, text length)
 * 2. Acquire admission
 * 3. Submit to the batch scheduler, which falls back to a direct pool call when
 *    batching is disabled for the model
 * 4. Release admission on every exit path and record the outcome
 */
@Slf4j
@Service
public class EmbeddingService {

    private final ModelRegistry registry;
    private final AdmissionLimiter limiter;
    private final BatchScheduler<String, float[]> batchScheduler;
    private final InferenceMetrics metrics;
    private final InfergateProperties properties;

    public EmbeddingService(ModelRegistry registry,
                            AdmissionLimiter limiter,
                            BatchScheduler<String, float[]> batchScheduler,
                            InferenceMetrics metrics,
                            InfergateProperties properties) {
        this.registry = registry;
        this.limiter = limiter;
        this.batchScheduler = batchScheduler;
        this.metrics = metrics;
        this.properties = properties;
    }

    public Mono<EmbeddingResponse> createEmbeddings(EmbeddingRequest request) {
        return Mono.defer(() -> {
            List<String> texts = validate(request);
            String model = request.getModel();
            Duration deadline = properties.getConcurrency().getRequestTimeout();
            long startTime = System.nanoTime();

            return limiter.withAdmission(() -> Mono.defer(() -> execute(model, texts)))
                    .timeout(deadline)
                    .onErrorMap(TimeoutException.class,
                            e -> new CancelledException("Request deadline of " + deadline.toMillis() + "ms exceeded"))
                    .map(vectors -> toResponse(model, texts, vectors))
                    .doOnSuccess(response -> {
                        Duration latency = Duration.ofNanos(System.nanoTime() - startTime);
                        metrics.observeLatency(model, latency);
                        metrics.recordRequest(model, "200");
                        log.info("Embedding request: model={}, batch_size={}, latency_ms={}, status=200",
                                model, texts.size(), latency.toMillis());
                    })
                    .doOnError(error -> recordFailure(model, texts.size(), error))
                    .doOnCancel(() -> log.debug("Embedding request for model {} cancelled by client", model));
        });
    }

    private Mono<List<float[]>> execute(String model, List<String> texts) {
        // Lookup happens under admission so unknown models are counted like any other request
        registry.get(model);
        return batchScheduler.submit(model, texts);
    }

    private EmbeddingResponse toResponse(String model, List<String> texts, List<float[]> vectors) {
        List<EmbeddingData> data = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            data.add(EmbeddingData.builder().index(i).embedding(vectors.get(i)).build());
        }

        int promptTokens = countTokens(registry.get(model), texts);
        return EmbeddingResponse.builder()
                .data(data)
                .model(model)
                .usage(Usage.builder().promptTokens(promptTokens).totalTokens(promptTokens).build())
                .build();
    }

    private int countTokens(EmbeddingHandler handler, List<String> texts) {
        try {
            return handler.countTokens(texts);
        } catch (RuntimeException e) {
            log.debug("Token counting failed for model {}; reporting 0", handler.name(), e);
            return 0;
        }
    }

    private void recordFailure(String model, int batchSize, Throwable error) {
        if (error instanceof QueueFullException) {
            metrics.recordQueueRejection("queue_full");
        } else if (error instanceof QueueTimeoutException) {
            metrics.recordQueueRejection("queue_timeout");
        }

        String status = statusOf(error);
        metrics.recordRequest(model, status);

        if (error instanceof AdmissionException || error instanceof ModelNotFoundException
                || error instanceof CancelledException) {
            log.info("Embedding request not served: model={}, batch_size={}, status={}, reason={}",
                    model, batchSize, status, error.getMessage());
        } else if (error instanceof BatchFailureException) {
            // The scheduler already logged the batch failure with its stack trace
            log.warn("Embedding request failed in batch: model={}, batch_size={}, status={}, reason={}",
                    model, batchSize, status, error.getMessage());
        } else {
            String device = registry.find(model).map(EmbeddingHandler::device).orElse("unknown");
            log.error("Embedding failed: model={}, batch_size={}, device={}", model, batchSize, device, error);
        }
    }

    static String statusOf(Throwable error) {
        if (error instanceof QueueFullException || error instanceof QueueTimeoutException) {
            return "429";
        }
        if (error instanceof ShuttingDownException) {
            return "503";
        }
        if (error instanceof ModelNotFoundException) {
            return "404";
        }
        if (error instanceof InvalidRequestException) {
            return "400";
        }
        if (error instanceof CancelledException) {
            return "504";
        }
        return "500";
    }

    /**
     * Normalizes the input to a list of strings and enforces request limits.
     */
    List<String> validate(EmbeddingRequest request) {
        if (request.getModel() == null || request.getModel().isBlank()) {
            throw new InvalidRequestException("Model must be specified");
        }
        String encodingFormat = request.getEncodingFormat();
        if (encodingFormat != null && !"float".equals(encodingFormat)) {
            throw new InvalidRequestException("Only 'float' encoding_format is supported");
        }

        List<String> texts = new ArrayList<>();
        Object input = request.getInput();
        if (input instanceof String text) {
            texts.add(text);
        } else if (input instanceof List<?> items) {
            for (Object item : items) {
                if (!(item instanceof String text)) {
                    throw new InvalidRequestException("Input must be a string or a list of strings");
                }
                texts.add(text);
            }
        } else {
            throw new InvalidRequestException("Input must be a string or a list of strings");
        }

        if (texts.isEmpty()) {
            throw new InvalidRequestException("Input cannot be empty");
        }

        int maxItems = properties.getLimits().getMaxInputItems();
        if (texts.size() > maxItems) {
            throw new InvalidRequestException("Batch too large; max " + maxItems + " items");
        }

        int maxChars = properties.getLimits().getMaxTextChars();
        for (int i = 0; i < texts.size(); i++) {
            if (texts.get(i).length() > maxChars) {
                throw new InvalidRequestException("Input at index " + i + " exceeds max length " + maxChars + " chars");
            }
        }
        return texts;
    }
}
