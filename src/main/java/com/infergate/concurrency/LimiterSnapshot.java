package com.infergate.concurrency;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time copy of the limiter counters, read under the limiter lock.
 */
@Value
@Builder
public class LimiterSnapshot {
    int running;
    int admitted;
    int waiting;
    int maxConcurrent;
    int maxAdmitted;
    boolean shuttingDown;
}
