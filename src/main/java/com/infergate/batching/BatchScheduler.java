package com.infergate.batching;

import com.infergate.concurrency.ExecutionPool;
import com.infergate.exception.BatchFailureException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Coalesces concurrent submissions for the same model into single model invocations.
 *
 * Flow per model:
 * 1. Append the caller's items to the model's pending batch
 * 2. Flush at once when the batch reaches maxBatchSize sub-items
 * 3. Otherwise the first item of an empty batch arms a flush timer of maxWait
 * 4. A flush concatenates all sub-items in arrival order, runs one call on the
 *    {@link ExecutionPool}, and hands each caller the slice matching its own items
 *
 * A failed invocation fails every caller of that batch with the same
 * {@link BatchFailureException}. A caller that cancels after joining a batch is not
 * withdrawn from it; its slice is simply discarded.
 *
 * @param <T> input sub-item type
 * @param <R> output type, one per input
 */
@Slf4j
public class BatchScheduler<T, R> {

    private final BatchHandler<T, R> handler;
    private final ExecutionPool pool;
    private final BatchSettings settings;
    private final Scheduler timer;
    private final ConcurrentMap<String, PendingBatch<T, R>> pending = new ConcurrentHashMap<>();

    private final AtomicLong batchesDispatched = new AtomicLong();
    private final AtomicLong itemsDispatched = new AtomicLong();
    private final AtomicLong batchesFailed = new AtomicLong();

    public BatchScheduler(BatchHandler<T, R> handler, ExecutionPool pool, BatchSettings settings) {
        this(handler, pool, settings, Schedulers.parallel());
    }

    public BatchScheduler(BatchHandler<T, R> handler, ExecutionPool pool, BatchSettings settings, Scheduler timer) {
        if (handler == null || pool == null || settings == null || timer == null) {
            throw new IllegalArgumentException("handler, pool, settings and timer are required");
        }
        settings.validate();
        this.handler = handler;
        this.pool = pool;
        this.settings = settings;
        this.timer = timer;
    }

    /**
     * Submits one caller's items.
     *
     * When batching is disabled for the model the items go straight to the pool as a
     * single call.
     *
     * @return outputs for exactly these items, in the same order
     */
    public Mono<List<R>> submit(String model, List<T> items) {
        return Mono.defer(() -> {
            if (items.isEmpty()) {
                return Mono.just(List.of());
            }
            List<T> copy = List.copyOf(items);
            if (!settings.isEnabled(model)) {
                return pool.run(token -> handler.process(model, copy, token));
            }
            BatchItem<T, R> item = new BatchItem<>(copy);
            enqueue(model, item);
            return Mono.fromFuture(item.getResult(), true);
        });
    }

    public boolean isEnabled(String model) {
        return settings.isEnabled(model);
    }

    public BatchSettings getSettings() {
        return settings;
    }

    /**
     * Sub-items waiting for the given model's next flush.
     */
    public int pendingItems(String model) {
        PendingBatch<T, R> batch = pending.get(model);
        if (batch == null) {
            return 0;
        }
        batch.getLock().lock();
        try {
            return batch.subItemCount();
        } finally {
            batch.getLock().unlock();
        }
    }

    public long getBatchesDispatched() {
        return batchesDispatched.get();
    }

    public long getItemsDispatched() {
        return itemsDispatched.get();
    }

    public long getBatchesFailed() {
        return batchesFailed.get();
    }

    /**
     * Flushes every pending batch so no caller is left waiting on a timer.
     */
    public void flushAll() {
        for (Map.Entry<String, PendingBatch<T, R>> entry : pending.entrySet()) {
            List<BatchItem<T, R>> members;
            PendingBatch<T, R> batch = entry.getValue();
            batch.getLock().lock();
            try {
                members = batch.isEmpty() ? List.of() : batch.detach();
            } finally {
                batch.getLock().unlock();
            }
            if (!members.isEmpty()) {
                log.info("Flushing {} pending caller(s) for model {} on shutdown", members.size(), entry.getKey());
                dispatch(entry.getKey(), members);
            }
        }
    }

    private void enqueue(String model, BatchItem<T, R> item) {
        PendingBatch<T, R> batch = pending.computeIfAbsent(model, k -> new PendingBatch<>());
        int maxBatchSize = settings.getMaxBatchSize();
        List<List<BatchItem<T, R>>> ready = new ArrayList<>(2);

        batch.getLock().lock();
        try {
            if (!batch.isEmpty() && batch.subItemCount() + item.size() > maxBatchSize) {
                ready.add(batch.detach());
            }
            boolean first = batch.isEmpty();
            batch.add(item);
            if (batch.subItemCount() >= maxBatchSize) {
                ready.add(batch.detach());
            } else if (first) {
                long generation = batch.generation();
                batch.arm(timer.schedule(() -> flushExpired(model, generation),
                        settings.getMaxWait().toNanos(), TimeUnit.NANOSECONDS));
            }
        } finally {
            batch.getLock().unlock();
        }

        for (List<BatchItem<T, R>> members : ready) {
            dispatch(model, members);
        }
    }

    private void flushExpired(String model, long generation) {
        PendingBatch<T, R> batch = pending.get(model);
        List<BatchItem<T, R>> members;
        batch.getLock().lock();
        try {
            if (batch.generation() != generation || batch.isEmpty()) {
                return;
            }
            members = batch.detach();
        } finally {
            batch.getLock().unlock();
        }
        dispatch(model, members);
    }

    private void dispatch(String model, List<BatchItem<T, R>> members) {
        List<T> inputs = new ArrayList<>();
        for (BatchItem<T, R> member : members) {
            member.setOffset(inputs.size());
            inputs.addAll(member.getItems());
        }
        int size = inputs.size();
        String device = deviceOf(model);

        batchesDispatched.incrementAndGet();
        itemsDispatched.addAndGet(size);
        log.debug("Dispatching batch for model {}: {} item(s) from {} caller(s)", model, size, members.size());

        pool.run(token -> handler.process(model, inputs, token))
                .defaultIfEmpty(List.of())
                .subscribe(
                        outputs -> fanOut(model, device, members, size, outputs),
                        error -> fail(model, device, members, size, error));
    }

    /**
     * Every slice is built before any caller is completed, so a bad output fails the
     * whole batch instead of a subset of its callers.
     */
    private void fanOut(String model, String device, List<BatchItem<T, R>> members, int size, List<R> outputs) {
        if (outputs.size() != size) {
            fail(model, device, members, size, new BatchFailureException(model, size, device,
                    "model returned " + outputs.size() + " output(s) for " + size + " input(s)"));
            return;
        }
        for (int i = 0; i < size; i++) {
            if (outputs.get(i) == null) {
                fail(model, device, members, size, new BatchFailureException(model, size, device,
                        "model returned no output for input " + i));
                return;
            }
        }

        List<List<R>> slices = new ArrayList<>(members.size());
        try {
            for (BatchItem<T, R> member : members) {
                int from = member.getOffset();
                slices.add(List.copyOf(outputs.subList(from, from + member.size())));
            }
        } catch (RuntimeException e) {
            fail(model, device, members, size, e);
            return;
        }

        for (int i = 0; i < members.size(); i++) {
            if (!members.get(i).getResult().complete(slices.get(i))) {
                log.debug("Discarding batch result for a caller that is no longer waiting");
            }
        }
    }

    private void fail(String model, String device, List<BatchItem<T, R>> members, int size, Throwable error) {
        batchesFailed.incrementAndGet();
        BatchFailureException failure = error instanceof BatchFailureException bfe
                ? bfe
                : new BatchFailureException(model, size, device, error);

        log.error("Batch failed: model={}, batch_size={}, callers={}, device={}",
                model, size, members.size(), device, error);

        try {
            handler.onFailure(model, error);
        } catch (Exception cleanupError) {
            failure.addSuppressed(cleanupError);
        }

        for (BatchItem<T, R> member : members) {
            member.getResult().completeExceptionally(failure);
        }
    }

    private String deviceOf(String model) {
        try {
            return handler.device(model);
        } catch (RuntimeException e) {
            log.debug("Could not resolve device for model {}", model, e);
            return "unknown";
        }
    }
}
