package com.infergate.handler;

import com.infergate.concurrency.CancellationToken;
import com.infergate.config.InfergateProperties;
import com.infergate.exception.ModelLoadException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Abstract base class for embedding handlers with common functionality.
 *
 * Handlers that declare exclusive access are serialized through a dedicated lock. The
 * cancellation token is checked before and after taking the lock and between chunks.
 */
@Slf4j
public abstract class AbstractEmbeddingHandler implements EmbeddingHandler {

    private static final int DEFAULT_CHUNK_SIZE = 16;

    protected final InfergateProperties.ModelConfig config;
    protected final String device;
    private final boolean exclusive;
    private final ReentrantLock lock;
    private final int chunkSize;

    protected AbstractEmbeddingHandler(InfergateProperties.ModelConfig config, String device, boolean exclusiveByDefault) {
        if (config.getName() == null || config.getName().isBlank()) {
            throw new ModelLoadException("Model name must be specified");
        }
        this.config = config;
        this.device = device;
        this.exclusive = config.getExclusive() != null ? config.getExclusive() : exclusiveByDefault;
        this.lock = exclusive ? new ReentrantLock(true) : null;
        this.chunkSize = Integer.parseInt(config.getOptions().getOrDefault("chunk-size", String.valueOf(DEFAULT_CHUNK_SIZE)));
        if (chunkSize <= 0) {
            throw new ModelLoadException("chunk-size must be > 0 for model " + config.getName());
        }
    }

    @Override
    public String name() {
        return config.getName();
    }

    @Override
    public String device() {
        return device;
    }

    @Override
    public Set<String> capabilities() {
        return Set.of("text-embedding");
    }

    @Override
    public boolean requiresExclusiveAccess() {
        return exclusive;
    }

    @Override
    public final List<float[]> embed(List<String> texts, CancellationToken token) {
        token.throwIfCancellationRequested();
        if (!exclusive) {
            return embedInChunks(texts, token);
        }
        lock.lock();
        try {
            token.throwIfCancellationRequested();
            return embedInChunks(texts, token);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int countTokens(List<String> texts) {
        int total = 0;
        for (String text : texts) {
            total += countTokens(text);
        }
        return total;
    }

    /**
     * Embed one chunk of at most chunk-size texts. Uninterruptible.
     */
    protected abstract List<float[]> embedChunk(List<String> texts) throws Exception;

    protected abstract int countTokens(String text);

    /**
     * L2 normalization.
     */
    protected static float[] normalize(float[] vector) {
        double norm = 0.0;
        for (float v : vector) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);

        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= norm;
            }
        }

        return vector;
    }

    private List<float[]> embedInChunks(List<String> texts, CancellationToken token) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += chunkSize) {
            token.throwIfCancellationRequested();
            List<String> chunk = texts.subList(start, Math.min(start + chunkSize, texts.size()));
            List<float[]> out;
            try {
                out = embedChunk(chunk);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException("Embedding failed for model " + name(), e);
            }
            if (out.size() != chunk.size()) {
                throw new IllegalStateException("Model " + name() + " returned " + out.size()
                        + " vector(s) for " + chunk.size() + " text(s)");
            }
            vectors.addAll(out);
        }
        return vectors;
    }
}
