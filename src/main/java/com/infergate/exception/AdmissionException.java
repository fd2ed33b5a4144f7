package com.infergate.exception;

import java.time.Duration;

/**
 * Admission was refused. These are recoverable signals meant to be translated into
 * client-facing retry guidance; they are never retried internally.
 */
public abstract class AdmissionException extends InfergateException {

    private final Duration retryAfter;

    protected AdmissionException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    /**
     * Suggested client back-off, or {@code null} when no hint applies.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
