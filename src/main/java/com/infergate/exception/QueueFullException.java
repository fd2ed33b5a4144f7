package com.infergate.exception;

import java.time.Duration;

/**
 * The admission ceiling was reached. Raised without any waiting.
 */
public class QueueFullException extends AdmissionException {

    public QueueFullException(int maxAdmitted, Duration retryAfter) {
        super("Request queue full (" + maxAdmitted + " admitted)", retryAfter);
    }
}
