package com.infergate.batching;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One caller's contribution to a batch and its single-assignment result slot.
 */
final class BatchItem<T, R> {

    private final List<T> items;
    private final CompletableFuture<List<R>> result = new CompletableFuture<>();
    private int offset = -1;

    BatchItem(List<T> items) {
        this.items = items;
    }

    List<T> getItems() {
        return items;
    }

    int size() {
        return items.size();
    }

    CompletableFuture<List<R>> getResult() {
        return result;
    }

    /**
     * Position of this caller's first sub-item in the dispatched input. Set at flush.
     */
    int getOffset() {
        return offset;
    }

    void setOffset(int offset) {
        this.offset = offset;
    }
}
