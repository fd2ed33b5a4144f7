package com.infergate.handler;

import com.infergate.concurrency.CancellationToken;

import java.util.List;
import java.util.Set;

/**
 * A loaded embedding model. Does the actual tensor math; the gateway only decides when
 * and with which inputs it is called.
 */
public interface EmbeddingHandler extends AutoCloseable {

    /**
     * Get model name as exposed through the API.
     *
     * @return model name
     */
    String name();

    /**
     * Get embedding dimensions.
     *
     * @return number of dimensions in each output vector
     */
    int dimensions();

    /**
     * Device identifier, used only for logging and metrics.
     */
    String device();

    /**
     * Capability tags, e.g. "text-embedding".
     */
    Set<String> capabilities();

    /**
     * Whether the underlying model is not thread-safe and every invocation must hold
     * exclusive access. Concurrency sizing is derived from this.
     */
    boolean requiresExclusiveAccess();

    /**
     * Generate embeddings for a batch of texts.
     *
     * @param texts input texts
     * @param token checked between internal steps
     * @return one vector per text, in input order
     */
    List<float[]> embed(List<String> texts, CancellationToken token);

    /**
     * Count prompt tokens for usage reporting.
     */
    int countTokens(List<String> texts);

    /**
     * Best-effort release of cached resources after a failed invocation.
     */
    default void releaseResources() {
    }

    @Override
    default void close() {
    }
}
