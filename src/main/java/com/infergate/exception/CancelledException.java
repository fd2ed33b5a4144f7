package com.infergate.exception;

/**
 * The caller's own context ended before the work completed. Not a system failure.
 */
public class CancelledException extends InfergateException {

    public CancelledException(String message) {
        super(message);
    }
}
