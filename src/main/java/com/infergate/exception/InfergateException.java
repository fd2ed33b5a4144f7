package com.infergate.exception;

/**
 * Base class for all failures raised by the gateway.
 */
public class InfergateException extends RuntimeException {

    public InfergateException(String message) {
        super(message);
    }

    public InfergateException(String message, Throwable cause) {
        super(message, cause);
    }
}
