package com.infergate.concurrency;

import com.infergate.exception.QueueFullException;
import com.infergate.exception.QueueTimeoutException;
import com.infergate.exception.ShuttingDownException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Two-level admission gate in front of model execution.
 *
 * Counters:
 * - admitted: requests holding a ticket, running or waiting (at most maxAdmitted)
 * - running: tickets holding an execution slot (at most maxConcurrent)
 *
 * Admission itself never waits: when maxAdmitted tickets are out, {@link #acquire()}
 * fails at once with {@link QueueFullException}. An admitted ticket without a free slot
 * joins a FIFO wait list for at most the queue timeout. The timeout is tracked per
 * waiter under the same lock as slot grants, so a waiter either times out or runs,
 * never both.
 *
 * Thread-safety:
 * - All counters and the wait list are guarded by a single ReentrantLock
 * - Subscribers are signalled only after the lock is released
 *
 * Usage example:
 * <pre>
 * limiter.withAdmission(() -> pool.run(token -> model.embed(texts, token)))
 *        .subscribe(...);
 * </pre>
 */
@Slf4j
public final class AdmissionLimiter {

    private final int maxConcurrent;
    private final int maxAdmitted;
    private final Duration queueTimeout;
    private final Clock clock;
    private final Scheduler timer;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private final AtomicLong ticketIds = new AtomicLong();
    private final CompletableFuture<Void> drained = new CompletableFuture<>();

    // Guarded by lock
    private int running;
    private int admitted;
    private boolean shuttingDown;

    /**
     * Creates a limiter using the parallel scheduler for queue timeouts.
     *
     * @param maxConcurrent execution slots
     * @param maxAdmitted total tickets, running plus waiting
     * @param queueTimeout longest wait for an execution slot
     * @param clock time source for ticket timestamps
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public AdmissionLimiter(int maxConcurrent, int maxAdmitted, Duration queueTimeout, Clock clock) {
        this(maxConcurrent, maxAdmitted, queueTimeout, clock, Schedulers.parallel());
    }

    public AdmissionLimiter(int maxConcurrent, int maxAdmitted, Duration queueTimeout,
                            Clock clock, Scheduler timer) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be > 0");
        }
        if (maxAdmitted < maxConcurrent) {
            throw new IllegalArgumentException("maxAdmitted must be >= maxConcurrent");
        }
        if (queueTimeout == null || queueTimeout.isNegative() || queueTimeout.isZero()) {
            throw new IllegalArgumentException("queueTimeout must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (timer == null) {
            throw new IllegalArgumentException("timer cannot be null");
        }
        this.maxConcurrent = maxConcurrent;
        this.maxAdmitted = maxAdmitted;
        this.queueTimeout = queueTimeout;
        this.clock = clock;
        this.timer = timer;
    }

    /**
     * Requests a ticket.
     *
     * The returned Mono emits a RUNNING ticket, or fails with
     * {@link ShuttingDownException} / {@link QueueFullException} immediately, or with
     * {@link QueueTimeoutException} after waiting for the queue timeout. Cancelling the
     * subscription while waiting gives the admission back.
     *
     * @return ticket that must be passed to {@link #release(AdmissionTicket)}
     */
    public Mono<AdmissionTicket> acquire() {
        return Mono.<AdmissionTicket>create(sink -> {
                    AdmissionTicket ticket = new AdmissionTicket(ticketIds.incrementAndGet(), clock.instant());
                    Waiter waiter = new Waiter(ticket, sink);
                    sink.onCancel(() -> abandon(waiter));
                    admit(waiter);
                })
                .doOnDiscard(AdmissionTicket.class, this::discard);
    }

    /**
     * Runs {@code body} only while holding a ticket. The ticket is released on
     * completion, error and cancellation.
     */
    public <T> Mono<T> withAdmission(Supplier<Mono<T>> body) {
        return Mono.usingWhen(
                acquire(),
                ticket -> body.get(),
                this::releaseAsync,
                (ticket, error) -> releaseAsync(ticket),
                this::releaseAsync);
    }

    /**
     * Gives the ticket's capacity back and hands the freed slot to the longest waiter.
     * Releasing an already released ticket is a no-op.
     */
    public void release(AdmissionTicket ticket) {
        List<Waiter> granted;
        lock.lock();
        try {
            if (ticket.getState() == TicketState.RELEASED) {
                log.warn("Ignoring release of already released ticket {}", ticket.getId());
                return;
            }
            granted = releaseLocked(ticket);
        } finally {
            lock.unlock();
        }
        signal(granted);
    }

    /**
     * Stops admitting new work and waits for every admitted ticket to be released.
     *
     * @param grace upper bound on the wait
     * @return true if the limiter drained within the grace period
     */
    public Mono<Boolean> drain(Duration grace) {
        return Mono.defer(() -> {
            lock.lock();
            try {
                if (!shuttingDown) {
                    shuttingDown = true;
                    log.info("Draining admission limiter: {} admitted, {} running", admitted, running);
                }
                if (admitted == 0) {
                    drained.complete(null);
                }
            } finally {
                lock.unlock();
            }
            return Mono.fromFuture(drained, true)
                    .thenReturn(true)
                    .timeout(grace, Mono.fromSupplier(() -> {
                        log.warn("Drain grace period of {}ms elapsed with {} ticket(s) still admitted",
                                grace.toMillis(), snapshot().getAdmitted());
                        return false;
                    }), timer);
        });
    }

    public LimiterSnapshot snapshot() {
        lock.lock();
        try {
            return LimiterSnapshot.builder()
                    .running(running)
                    .admitted(admitted)
                    .waiting(waiters.size())
                    .maxConcurrent(maxConcurrent)
                    .maxAdmitted(maxAdmitted)
                    .shuttingDown(shuttingDown)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public boolean isShuttingDown() {
        lock.lock();
        try {
            return shuttingDown;
        } finally {
            lock.unlock();
        }
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public int getMaxAdmitted() {
        return maxAdmitted;
    }

    public Duration getQueueTimeout() {
        return queueTimeout;
    }

    private void admit(Waiter waiter) {
        AdmissionTicket ticket = waiter.ticket;
        RuntimeException rejection = null;
        boolean runNow = false;

        lock.lock();
        try {
            if (ticket.getState() == TicketState.RELEASED) {
                // subscriber cancelled before we got here
                return;
            }
            if (shuttingDown) {
                ticket.markReleased();
                rejection = new ShuttingDownException();
            } else if (admitted >= maxAdmitted) {
                ticket.markReleased();
                rejection = new QueueFullException(maxAdmitted, queueTimeout);
            } else {
                admitted++;
                if (running < maxConcurrent && waiters.isEmpty()) {
                    running++;
                    ticket.markRunning(clock.instant());
                    runNow = true;
                } else {
                    waiters.addLast(waiter);
                    waiter.expiry = timer.schedule(() -> expire(waiter),
                            queueTimeout.toNanos(), TimeUnit.NANOSECONDS);
                }
            }
        } finally {
            lock.unlock();
        }

        if (rejection != null) {
            log.debug("Rejected ticket {}: {}", ticket.getId(), rejection.getMessage());
            waiter.sink.error(rejection);
        } else if (runNow) {
            waiter.sink.success(ticket);
        } else {
            log.debug("Ticket {} queued for an execution slot", ticket.getId());
        }
    }

    /**
     * Queue timeout for a waiter. A waiter that was granted a slot in the meantime is
     * left alone; the grant and the expiry are decided under the same lock.
     */
    private void expire(Waiter waiter) {
        AdmissionTicket ticket = waiter.ticket;
        List<Waiter> granted;
        lock.lock();
        try {
            if (ticket.getState() != TicketState.QUEUED || !waiters.remove(waiter)) {
                return;
            }
            admitted--;
            ticket.markReleased();
            granted = promoteWaiters();
        } finally {
            lock.unlock();
        }
        log.debug("Ticket {} timed out after {}ms waiting for a slot", ticket.getId(), queueTimeout.toMillis());
        waiter.sink.error(new QueueTimeoutException(queueTimeout));
        signal(granted);
    }

    /**
     * Cancellation and discard path. Quietly ignores tickets that are already released,
     * since a cancel can race with a normal release.
     */
    private void abandon(Waiter waiter) {
        AdmissionTicket ticket = waiter.ticket;
        List<Waiter> granted;
        lock.lock();
        try {
            if (ticket.getState() == TicketState.RELEASED) {
                return;
            }
            if (ticket.getState() == TicketState.QUEUED && !waiters.contains(waiter)) {
                // never admitted
                ticket.markReleased();
                return;
            }
            log.debug("Ticket {} abandoned in state {}", ticket.getId(), ticket.getState());
            granted = releaseLocked(ticket);
        } finally {
            lock.unlock();
        }
        signal(granted);
    }

    private void discard(AdmissionTicket ticket) {
        List<Waiter> granted;
        lock.lock();
        try {
            if (ticket.getState() == TicketState.RELEASED) {
                return;
            }
            log.debug("Ticket {} discarded after the subscriber went away", ticket.getId());
            granted = releaseLocked(ticket);
        } finally {
            lock.unlock();
        }
        signal(granted);
    }

    // Must hold lock
    private List<Waiter> releaseLocked(AdmissionTicket ticket) {
        if (ticket.getState() == TicketState.RUNNING) {
            running--;
        } else {
            removeWaiter(ticket);
        }
        admitted--;
        ticket.markReleased();
        return promoteWaiters();
    }

    // Must hold lock
    private void removeWaiter(AdmissionTicket ticket) {
        waiters.removeIf(w -> {
            if (w.ticket != ticket) {
                return false;
            }
            w.cancelExpiry();
            return true;
        });
    }

    // Must hold lock
    private List<Waiter> promoteWaiters() {
        List<Waiter> granted = new ArrayList<>(1);
        while (running < maxConcurrent && !waiters.isEmpty()) {
            Waiter next = waiters.pollFirst();
            next.cancelExpiry();
            running++;
            next.ticket.markRunning(clock.instant());
            granted.add(next);
        }
        if (shuttingDown && admitted == 0) {
            drained.complete(null);
        }
        return granted;
    }

    private void signal(List<Waiter> granted) {
        for (Waiter waiter : granted) {
            log.debug("Ticket {} granted a slot after {}ms",
                    waiter.ticket.getId(), waiter.ticket.queueWait().toMillis());
            waiter.sink.success(waiter.ticket);
        }
    }

    private Mono<Void> releaseAsync(AdmissionTicket ticket) {
        return Mono.fromRunnable(() -> release(ticket));
    }

    private static final class Waiter {
        private final AdmissionTicket ticket;
        private final MonoSink<AdmissionTicket> sink;
        // Guarded by lock
        private Disposable expiry;

        private Waiter(AdmissionTicket ticket, MonoSink<AdmissionTicket> sink) {
            this.ticket = ticket;
            this.sink = sink;
        }

        private void cancelExpiry() {
            if (expiry != null) {
                expiry.dispose();
                expiry = null;
            }
        }
    }
}
