package com.infergate.handler;

import com.infergate.concurrency.CancellationToken;
import com.infergate.config.InfergateProperties;
import com.infergate.exception.CancelledException;
import com.infergate.exception.ModelLoadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HashingEmbeddingHandler.
 */
class HashingEmbeddingHandlerTest {

    private HashingEmbeddingHandler handler;

    static InfergateProperties.ModelConfig config(String name, int dimensions) {
        InfergateProperties.ModelConfig config = new InfergateProperties.ModelConfig();
        config.setName(name);
        config.setKind("hashing");
        config.setDimensions(dimensions);
        return config;
    }

    @BeforeEach
    void setUp() {
        handler = new HashingEmbeddingHandler(config("hash-64", 64), "cpu");
    }

    @Test
    void testProducesOneNormalizedVectorPerText() {
        List<float[]> vectors = handler.embed(List.of("hello world", "the quick brown fox"), CancellationToken.none());

        assertEquals(2, vectors.size());
        for (float[] vector : vectors) {
            assertEquals(64, vector.length);
            double norm = 0;
            for (float v : vector) {
                norm += v * v;
            }
            assertEquals(1.0, Math.sqrt(norm), 1e-5);
        }
    }

    @Test
    void testDeterministic() {
        float[] first = handler.embed(List.of("Admission control"), CancellationToken.none()).get(0);
        float[] second = handler.embed(List.of("admission   CONTROL"), CancellationToken.none()).get(0);

        assertArrayEquals(first, second);
    }

    @Test
    void testSimilarTextsScoreHigherThanUnrelated() {
        List<float[]> vectors = handler.embed(List.of(
                "dynamic batching of inference requests",
                "dynamic batching for inference requests",
                "purple elephants dancing"), CancellationToken.none());

        assertTrue(dot(vectors.get(0), vectors.get(1)) > dot(vectors.get(0), vectors.get(2)));
    }

    @Test
    void testEmptyTextYieldsZeroVector() {
        float[] vector = handler.embed(List.of("   "), CancellationToken.none()).get(0);

        for (float v : vector) {
            assertEquals(0.0f, v);
        }
    }

    @Test
    void testCountTokens() {
        assertEquals(5, handler.countTokens(List.of("one two three", "four  five")));
    }

    @Test
    void testCancelledTokenStopsBeforeWork() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(CancelledException.class, () -> handler.embed(List.of("text"), token));
    }

    @Test
    void testExclusiveOverride() {
        InfergateProperties.ModelConfig config = config("hash-exclusive", 8);
        config.setExclusive(true);

        HashingEmbeddingHandler exclusive = new HashingEmbeddingHandler(config, "cpu");

        assertTrue(exclusive.requiresExclusiveAccess());
        assertFalse(handler.requiresExclusiveAccess());
        assertEquals(1, exclusive.embed(List.of("serialized"), CancellationToken.none()).size());
    }

    @Test
    void testChunkingKeepsOrder() {
        InfergateProperties.ModelConfig config = config("hash-chunked", 32);
        config.getOptions().put("chunk-size", "2");
        HashingEmbeddingHandler chunked = new HashingEmbeddingHandler(config, "cpu");
        List<String> texts = List.of("a b", "c d", "e f", "g h", "i j");

        List<float[]> fromChunks = chunked.embed(texts, CancellationToken.none());
        List<float[]> whole = new HashingEmbeddingHandler(config("hash-whole", 32), "cpu")
                .embed(texts, CancellationToken.none());

        assertEquals(5, fromChunks.size());
        for (int i = 0; i < texts.size(); i++) {
            assertArrayEquals(whole.get(i), fromChunks.get(i));
        }
    }

    @Test
    void testRejectsNonPositiveDimensions() {
        assertThrows(ModelLoadException.class, () -> new HashingEmbeddingHandler(config("bad", 0), "cpu"));
    }

    private static double dot(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
