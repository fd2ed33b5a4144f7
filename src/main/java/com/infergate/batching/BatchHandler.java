package com.infergate.batching;

import com.infergate.concurrency.CancellationToken;

import java.util.List;

/**
 * The model invocation behind a {@link BatchScheduler}.
 *
 * @param <T> input sub-item type
 * @param <R> output type, one per input
 */
public interface BatchHandler<T, R> {

    /**
     * Process the concatenated inputs of one batch. Must return exactly one output per
     * input, in input order.
     *
     * @param model logical model name
     * @param inputs sub-items of every caller in the batch, in arrival order
     * @param token cooperative cancellation signal
     * @return outputs positionally aligned with {@code inputs}
     */
    List<R> process(String model, List<T> inputs, CancellationToken token) throws Exception;

    /**
     * Device identifier used in logs.
     */
    default String device(String model) {
        return "unknown";
    }

    /**
     * Best-effort cleanup after a failed invocation (for example releasing cached
     * accelerator memory). Runs before callers see the failure.
     */
    default void onFailure(String model, Throwable error) {
    }
}
