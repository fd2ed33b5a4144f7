package com.infergate.concurrency;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads for blocking model invocations.
 *
 * Request handling and batch bookkeeping stay on the event loop; only the model call
 * itself runs here. Failures propagate unchanged and are never retried: retrying an
 * expensive call that already failed tends to deepen the overload that caused it.
 */
@Slf4j
public class ExecutionPool {

    private final int workers;
    private final ThreadPoolExecutor executor;
    private final Scheduler scheduler;

    /**
     * @param workers number of worker threads, normally the limiter's maxConcurrent
     * @param threadNamePrefix prefix for worker thread names
     */
    public ExecutionPool(int workers, String threadNamePrefix) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be > 0");
        }
        this.workers = workers;
        this.executor = new ThreadPoolExecutor(
                workers, workers,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new WorkerThreadFactory(threadNamePrefix));
        // No interrupts on cancel: models observe the CancellationToken instead
        this.scheduler = Schedulers.fromExecutor(executor);
        log.info("Started execution pool with {} worker(s) named {}-N", workers, threadNamePrefix);
    }

    /**
     * Runs a blocking call on a worker thread.
     *
     * Cancelling the returned Mono trips the call's {@link CancellationToken}; a call
     * that has not started yet is skipped.
     */
    public <T> Mono<T> run(ModelCall<T> call) {
        return Mono.defer(() -> {
            CancellationToken token = new CancellationToken();
            return Mono.fromCallable(() -> call.call(token))
                    .subscribeOn(scheduler)
                    .doOnCancel(token::cancel);
        });
    }

    public int getWorkers() {
        return workers;
    }

    /**
     * Approximate number of workers currently running a call.
     */
    public int getActiveCount() {
        return executor.getActiveCount();
    }

    /**
     * Stops accepting work and waits for in-flight calls.
     *
     * @return true if all calls finished within the timeout
     */
    public boolean shutdown(Duration timeout) {
        executor.shutdown();
        try {
            boolean terminated = executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!terminated) {
                log.warn("Execution pool still busy after {}ms; {} call(s) in flight",
                        timeout.toMillis(), executor.getActiveCount());
            }
            return terminated;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            scheduler.dispose();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
