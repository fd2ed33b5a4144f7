package com.infergate.concurrency;

/**
 * Lifecycle of an {@link AdmissionTicket}.
 *
 * Valid transitions:
 * - QUEUED -> RUNNING -> RELEASED
 * - QUEUED -> RELEASED (rejected, timed out or cancelled while waiting)
 */
public enum TicketState {
    QUEUED,
    RUNNING,
    RELEASED
}
