package com.infergate.concurrency;

/**
 * A blocking model invocation run on the {@link ExecutionPool}.
 */
@FunctionalInterface
public interface ModelCall<T> {

    T call(CancellationToken token) throws Exception;
}
