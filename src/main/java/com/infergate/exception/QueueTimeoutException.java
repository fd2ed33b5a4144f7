package com.infergate.exception;

import java.time.Duration;

/**
 * Admitted, but no execution slot freed up within the queue timeout.
 */
public class QueueTimeoutException extends AdmissionException {

    public QueueTimeoutException(Duration waited) {
        super("Timed out after " + waited.toMillis() + "ms waiting for a worker", waited);
    }
}
