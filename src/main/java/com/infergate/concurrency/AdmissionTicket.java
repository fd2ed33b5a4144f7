package com.infergate.concurrency;

import java.time.Duration;
import java.time.Instant;

/**
 * One in-flight request's claim on capacity.
 *
 * State transitions happen only inside {@link AdmissionLimiter} while holding its lock;
 * the fields are volatile so other threads can read them for logging.
 */
public final class AdmissionTicket {

    private final long id;
    private final Instant createdAt;
    private volatile TicketState state = TicketState.QUEUED;
    private volatile Instant startedAt;

    AdmissionTicket(long id, Instant createdAt) {
        this.id = id;
        this.createdAt = createdAt;
    }

    public long getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public TicketState getState() {
        return state;
    }

    /**
     * When the ticket obtained its execution slot, or {@code null} if it never did.
     */
    public Instant getStartedAt() {
        return startedAt;
    }

    /**
     * Time spent queued before running. Zero if the slot was free on arrival.
     */
    public Duration queueWait() {
        Instant started = startedAt;
        return started == null ? Duration.ZERO : Duration.between(createdAt, started);
    }

    void markRunning(Instant now) {
        this.startedAt = now;
        this.state = TicketState.RUNNING;
    }

    void markReleased() {
        this.state = TicketState.RELEASED;
    }

    @Override
    public String toString() {
        return "AdmissionTicket{id=" + id + ", state=" + state + ", createdAt=" + createdAt + '}';
    }
}
