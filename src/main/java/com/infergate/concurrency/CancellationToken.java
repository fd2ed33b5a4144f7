package com.infergate.concurrency;

import com.infergate.exception.CancelledException;

/**
 * Cooperative cancellation signal handed to long-running model calls.
 *
 * The model checks it at natural step boundaries (between chunks, between decoding
 * iterations). Once a model commits to an uninterruptible step the call runs to the
 * end of that step before observing the signal.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    public void throwIfCancellationRequested() {
        if (cancelled) {
            throw new CancelledException("Model call cancelled");
        }
    }
}
