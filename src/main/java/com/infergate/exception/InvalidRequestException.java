package com.infergate.exception;

public class InvalidRequestException extends InfergateException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
