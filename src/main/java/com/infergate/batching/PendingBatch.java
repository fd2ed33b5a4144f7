package com.infergate.batching;

import reactor.core.Disposable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Items accumulated for one model and not yet dispatched.
 *
 * Thread-safety:
 * - Every method except {@link #getLock()} MUST be called while holding the lock
 * - The generation counter increments on each detach so a stale flush timer can tell
 *   that the batch it was armed for is already gone
 */
final class PendingBatch<T, R> {

    private final ReentrantLock lock = new ReentrantLock();
    private List<BatchItem<T, R>> items = new ArrayList<>();
    private int subItemCount;
    private long generation;
    private Disposable flushTimer;

    ReentrantLock getLock() {
        return lock;
    }

    boolean isEmpty() {
        return items.isEmpty();
    }

    int subItemCount() {
        return subItemCount;
    }

    long generation() {
        return generation;
    }

    void add(BatchItem<T, R> item) {
        items.add(item);
        subItemCount += item.size();
    }

    void arm(Disposable timer) {
        this.flushTimer = timer;
    }

    /**
     * Takes the accumulated items and leaves an empty batch behind.
     */
    List<BatchItem<T, R>> detach() {
        List<BatchItem<T, R>> detached = items;
        items = new ArrayList<>();
        subItemCount = 0;
        generation++;
        if (flushTimer != null) {
            flushTimer.dispose();
            flushTimer = null;
        }
        return detached;
    }
}
