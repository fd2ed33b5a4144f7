package com.infergate.exception;

/**
 * The limiter is draining and accepts no new work.
 */
public class ShuttingDownException extends AdmissionException {

    public ShuttingDownException() {
        super("Service is shutting down", null);
    }
}
