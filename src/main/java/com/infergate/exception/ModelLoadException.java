package com.infergate.exception;

/**
 * Configuration or model files could not be turned into a working handler.
 * Raised during startup and treated as fatal.
 */
public class ModelLoadException extends InfergateException {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
