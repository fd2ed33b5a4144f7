package com.infergate.controller;

import com.infergate.batching.BatchScheduler;
import com.infergate.batching.BatchSettings;
import com.infergate.concurrency.AdmissionLimiter;
import com.infergate.concurrency.AdmissionTicket;
import com.infergate.concurrency.CancellationToken;
import com.infergate.concurrency.ExecutionPool;
import com.infergate.config.InfergateProperties;
import com.infergate.handler.EmbeddingHandler;
import com.infergate.handler.HashingEmbeddingHandler;
import com.infergate.handler.ModelRegistry;
import com.infergate.handler.RegistryBatchHandler;
import com.infergate.metrics.InferenceMetrics;
import com.infergate.service.EmbeddingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HTTP-level tests for the embeddings, models, health and admin endpoints.
 */
class EmbeddingApiTest {

    private static final String MODEL = "api-model";

    private ExecutionPool pool;
    private AdmissionLimiter limiter;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        InfergateProperties properties = new InfergateProperties();
        properties.getLimits().setMaxInputItems(3);

        InfergateProperties.ModelConfig config = new InfergateProperties.ModelConfig();
        config.setName(MODEL);
        config.setKind("hashing");
        config.setDimensions(8);
        ModelRegistry registry = ModelRegistry.of(new HashingEmbeddingHandler(config, "cpu"), new BrokenHandler());

        limiter = new AdmissionLimiter(1, 1, Duration.ofMillis(1500), Clock.systemUTC());
        pool = new ExecutionPool(1, "api-test");
        BatchScheduler<String, float[]> scheduler = new BatchScheduler<>(new RegistryBatchHandler(registry), pool,
                BatchSettings.builder().maxBatchSize(4).maxWait(Duration.ofMillis(5)).modelEnabled("broken", false).build());
        EmbeddingService service = new EmbeddingService(registry, limiter, scheduler,
                new InferenceMetrics(new SimpleMeterRegistry(), limiter), properties);

        client = WebTestClient.bindToController(
                        new EmbeddingController(service),
                        new ModelController(registry),
                        new HealthController(registry, limiter),
                        new AdminController(limiter, pool, scheduler))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        pool.shutdown(Duration.ofSeconds(1));
    }

    private WebTestClient.ResponseSpec postEmbeddings(String body) {
        return client.post().uri("/v1/embeddings")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    @Test
    void testCreateEmbeddings() {
        postEmbeddings("{\"model\":\"api-model\",\"input\":[\"first text\",\"second\"],\"user\":\"u1\",\"dimensions\":8}")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.object").isEqualTo("list")
                .jsonPath("$.model").isEqualTo(MODEL)
                .jsonPath("$.data.length()").isEqualTo(2)
                .jsonPath("$.data[0].object").isEqualTo("embedding")
                .jsonPath("$.data[1].index").isEqualTo(1)
                .jsonPath("$.data[0].embedding.length()").isEqualTo(8)
                .jsonPath("$.usage.prompt_tokens").isEqualTo(3)
                .jsonPath("$.usage.total_tokens").isEqualTo(3);
    }

    @Test
    void testUnknownModelReturns404() {
        postEmbeddings("{\"model\":\"ghost\",\"input\":\"text\"}")
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error.message").isEqualTo("Model ghost not found")
                .jsonPath("$.error.code").isEqualTo("model_not_found");
    }

    @Test
    void testInvalidInputReturns400() {
        postEmbeddings("{\"model\":\"api-model\",\"input\":[\"a\",\"b\",\"c\",\"d\"]}")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.message").isEqualTo("Batch too large; max 3 items")
                .jsonPath("$.error.type").isEqualTo("invalid_request_error");
    }

    @Test
    void testMalformedJsonReturns400() {
        postEmbeddings("{\"model\":")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("invalid_json");
    }

    @Test
    void testQueueFullReturns429WithRetryAfter() {
        AdmissionTicket held = limiter.acquire().block(Duration.ofSeconds(1));
        assertNotNull(held);
        try {
            postEmbeddings("{\"model\":\"api-model\",\"input\":\"text\"}")
                    .expectStatus().isEqualTo(429)
                    .expectHeader().valueEquals(HttpHeaders.RETRY_AFTER, "2")
                    .expectBody()
                    .jsonPath("$.error.code").isEqualTo("queue_full");
        } finally {
            limiter.release(held);
        }
    }

    @Test
    void testModelFailureReturnsGeneric500() {
        postEmbeddings("{\"model\":\"broken\",\"input\":\"text\"}")
                .expectStatus().isEqualTo(500)
                .expectBody()
                .jsonPath("$.error.message").isEqualTo("Embedding generation failed");
    }

    @Test
    void testListModels() {
        client.get().uri("/v1/models")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.object").isEqualTo("list")
                .jsonPath("$.data[0].id").isEqualTo(MODEL)
                .jsonPath("$.data[0].object").isEqualTo("model")
                .jsonPath("$.data[0].owned_by").isEqualTo("local")
                .jsonPath("$.data[0].embedding_dimensions").isEqualTo(8);
    }

    @Test
    void testHealthAndDraining() {
        client.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ok")
                .jsonPath("$.models[0]").isEqualTo(MODEL);

        limiter.drain(Duration.ofMillis(10)).block(Duration.ofSeconds(1));

        client.get().uri("/health")
                .exchange()
                .expectStatus().isEqualTo(503);
        postEmbeddings("{\"model\":\"api-model\",\"input\":\"text\"}")
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("shutting_down");
    }

    @Test
    void testConcurrencyStatus() {
        client.get().uri("/v1/admin/concurrency")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.max_concurrent").isEqualTo(1)
                .jsonPath("$.max_admitted").isEqualTo(1)
                .jsonPath("$.queue_timeout_ms").isEqualTo(1500)
                .jsonPath("$.running").isEqualTo(0)
                .jsonPath("$.shutting_down").isEqualTo(false)
                .jsonPath("$.batching.enabled").isEqualTo(true)
                .jsonPath("$.batching.max_batch_size").isEqualTo(4)
                .jsonPath("$.batching.model_overrides.broken").isEqualTo(false);
    }

    @Test
    void testRetryAfterRoundsUp() {
        assertEquals(1, ApiExceptionHandler.retryAfterSeconds(null));
        assertEquals(1, ApiExceptionHandler.retryAfterSeconds(Duration.ofMillis(5)));
        assertEquals(2, ApiExceptionHandler.retryAfterSeconds(Duration.ofMillis(1500)));
    }

    /**
     * Always fails, to exercise the 500 path.
     */
    private static final class BrokenHandler implements EmbeddingHandler {

        @Override
        public String name() {
            return "broken";
        }

        @Override
        public int dimensions() {
            return 4;
        }

        @Override
        public String device() {
            return "cpu";
        }

        @Override
        public Set<String> capabilities() {
            return Set.of("text-embedding");
        }

        @Override
        public boolean requiresExclusiveAccess() {
            return false;
        }

        @Override
        public List<float[]> embed(List<String> texts, CancellationToken token) {
            throw new IllegalStateException("weights corrupted");
        }

        @Override
        public int countTokens(List<String> texts) {
            return 0;
        }
    }
}
