package com.infergate.concurrency;

import com.infergate.exception.QueueFullException;
import com.infergate.exception.QueueTimeoutException;
import com.infergate.exception.ShuttingDownException;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AdmissionLimiter.
 */
class AdmissionLimiterTest {

    private static AdmissionLimiter limiter(int maxConcurrent, int maxAdmitted, Duration queueTimeout) {
        return new AdmissionLimiter(maxConcurrent, maxAdmitted, queueTimeout, Clock.systemUTC());
    }

    @Test
    void testRejectsInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> limiter(0, 4, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> limiter(4, 2, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> limiter(1, 1, Duration.ZERO));
    }

    @Test
    void testAcquireRunsImmediatelyWhenSlotFree() {
        AdmissionLimiter limiter = limiter(2, 4, Duration.ofSeconds(1));

        AdmissionTicket ticket = limiter.acquire().block(Duration.ofSeconds(1));

        assertNotNull(ticket);
        assertEquals(TicketState.RUNNING, ticket.getState());
        assertNotNull(ticket.getStartedAt());
        assertEquals(1, limiter.snapshot().getRunning());
        assertEquals(1, limiter.snapshot().getAdmitted());

        limiter.release(ticket);
        assertEquals(TicketState.RELEASED, ticket.getState());
        assertEquals(0, limiter.snapshot().getAdmitted());
    }

    @Test
    void testExactlyExcessAttemptsFailWithQueueFullWithoutWaiting() {
        int maxAdmitted = 3;
        AdmissionLimiter limiter = limiter(1, maxAdmitted, Duration.ofSeconds(5));
        List<Disposable> holders = new ArrayList<>();
        AtomicInteger rejected = new AtomicInteger();

        long start = System.nanoTime();
        for (int i = 0; i < 8; i++) {
            holders.add(limiter.acquire().subscribe(
                    ticket -> { },
                    error -> {
                        if (error instanceof QueueFullException) {
                            rejected.incrementAndGet();
                        }
                    }));
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(8 - maxAdmitted, rejected.get());
        assertTrue(elapsedMs < 1000, "rejections must not wait for the queue timeout");
        assertEquals(maxAdmitted, limiter.snapshot().getAdmitted());

        holders.forEach(Disposable::dispose);
    }

    @Test
    void testSecondCallerWaitsForSingleSlot() throws Exception {
        AdmissionLimiter limiter = limiter(1, 2, Duration.ofSeconds(2));
        AdmissionTicket first = limiter.acquire().block(Duration.ofSeconds(1));
        assertNotNull(first);

        AtomicReference<AdmissionTicket> second = new AtomicReference<>();
        CountDownLatch granted = new CountDownLatch(1);
        limiter.acquire().subscribe(ticket -> {
            second.set(ticket);
            granted.countDown();
        });

        assertFalse(granted.await(100, TimeUnit.MILLISECONDS), "second caller must wait while the slot is held");
        assertEquals(1, limiter.snapshot().getWaiting());

        limiter.release(first);

        assertTrue(granted.await(1, TimeUnit.SECONDS));
        assertEquals(TicketState.RUNNING, second.get().getState());
        assertEquals(1, limiter.snapshot().getRunning());
        limiter.release(second.get());
    }

    @Test
    void testNeverMoreThanMaxConcurrentRunning() throws Exception {
        AdmissionLimiter limiter = limiter(1, 16, Duration.ofSeconds(5));
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxSeen = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(8);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> limiter.withAdmission(() -> Mono.fromCallable(() -> {
                    int now = inside.incrementAndGet();
                    maxSeen.accumulateAndGet(now, Math::max);
                    Thread.sleep(10);
                    inside.decrementAndGet();
                    return now;
                })).block(Duration.ofSeconds(5))));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxSeen.get());
        assertEquals(0, limiter.snapshot().getAdmitted());
    }

    @Test
    void testConcreteOverloadScenario() throws Exception {
        AdmissionLimiter limiter = limiter(1, 2, Duration.ofMillis(200));

        // Caller 1 runs for 100ms
        Mono<String> caller1 = limiter.withAdmission(() -> Mono.delay(Duration.ofMillis(100)).thenReturn("one"));
        // Caller 2 is admitted but waits for the slot
        Mono<String> caller2 = limiter.withAdmission(() -> Mono.just("two"));

        CountDownLatch done = new CountDownLatch(2);
        List<String> results = new CopyOnWriteArrayList<>();
        caller1.doFinally(s -> done.countDown()).subscribe(results::add);
        caller2.doFinally(s -> done.countDown()).subscribe(results::add);

        long start = System.nanoTime();
        StepVerifier.create(limiter.withAdmission(() -> Mono.just("three")))
                .expectError(QueueFullException.class)
                .verify(Duration.ofSeconds(1));
        assertTrue((System.nanoTime() - start) / 1_000_000 < 100, "caller 3 must fail without waiting");

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertEquals(List.of("one", "two"), results);
        assertEquals(0, limiter.snapshot().getAdmitted());
    }

    @Test
    void testQueueTimeoutReleasesAdmission() {
        AdmissionLimiter limiter = limiter(1, 2, Duration.ofMillis(100));
        AdmissionTicket holder = limiter.acquire().block(Duration.ofSeconds(1));
        assertNotNull(holder);

        StepVerifier.create(limiter.acquire())
                .expectError(QueueTimeoutException.class)
                .verify(Duration.ofSeconds(2));

        LimiterSnapshot snapshot = limiter.snapshot();
        assertEquals(1, snapshot.getAdmitted());
        assertEquals(0, snapshot.getWaiting());

        limiter.release(holder);
        StepVerifier.create(limiter.acquire())
                .assertNext(ticket -> assertEquals(TicketState.RUNNING, ticket.getState()))
                .verifyComplete();
    }

    @Test
    void testCountersReturnToZeroUnderTimeoutPressure() {
        // Short queue timeout so expiries constantly race with slot grants
        AdmissionLimiter limiter = limiter(2, 40, Duration.ofMillis(5));
        AtomicInteger timedOut = new AtomicInteger();

        for (int round = 0; round < 20; round++) {
            Flux.range(0, 300)
                    .flatMap(i -> limiter.withAdmission(() -> Mono.delay(Duration.ofMillis(1)).thenReturn(i))
                            .onErrorResume(QueueTimeoutException.class, e -> {
                                timedOut.incrementAndGet();
                                return Mono.empty();
                            })
                            .onErrorResume(QueueFullException.class, e -> Mono.empty()), 64)
                    .then()
                    .block(Duration.ofSeconds(30));

            LimiterSnapshot snapshot = limiter.snapshot();
            assertEquals(0, snapshot.getRunning(), "running after round " + round);
            assertEquals(0, snapshot.getAdmitted(), "admitted after round " + round);
            assertEquals(0, snapshot.getWaiting(), "waiting after round " + round);
        }
        assertTrue(timedOut.get() > 0, "expected some waiters to time out");
    }

    @Test
    void testTimedOutWaiterIsNeverGrantedLater() {
        AdmissionLimiter limiter = limiter(1, 2, Duration.ofMillis(50));
        AdmissionTicket holder = limiter.acquire().block(Duration.ofSeconds(1));
        assertNotNull(holder);

        List<AdmissionTicket> granted = new CopyOnWriteArrayList<>();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        limiter.acquire().subscribe(granted::add, failure::set);

        StepVerifier.create(Mono.delay(Duration.ofMillis(150))).expectNextCount(1).verifyComplete();
        limiter.release(holder);

        assertInstanceOf(QueueTimeoutException.class, failure.get());
        assertTrue(granted.isEmpty());
        assertEquals(0, limiter.snapshot().getRunning());
        assertEquals(0, limiter.snapshot().getAdmitted());
    }

    @Test
    void testQueueTimeoutCarriesRetryHint() {
        AdmissionLimiter limiter = limiter(1, 2, Duration.ofMillis(50));
        limiter.acquire().block(Duration.ofSeconds(1));

        StepVerifier.create(limiter.acquire())
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(QueueTimeoutException.class, error);
                    assertEquals(Duration.ofMillis(50), ((QueueTimeoutException) error).getRetryAfter());
                })
                .verify(Duration.ofSeconds(2));
    }

    @Test
    void testCancelWhileWaitingReleasesAdmission() {
        AdmissionLimiter limiter = limiter(1, 2, Duration.ofSeconds(5));
        AdmissionTicket holder = limiter.acquire().block(Duration.ofSeconds(1));
        assertNotNull(holder);

        Disposable waiting = limiter.acquire().subscribe();
        assertEquals(2, limiter.snapshot().getAdmitted());

        waiting.dispose();

        assertEquals(1, limiter.snapshot().getAdmitted());
        assertEquals(0, limiter.snapshot().getWaiting());
        limiter.release(holder);
        assertEquals(0, limiter.snapshot().getAdmitted());
    }

    @Test
    void testWithAdmissionReleasesOnError() {
        AdmissionLimiter limiter = limiter(1, 1, Duration.ofSeconds(1));

        StepVerifier.create(limiter.withAdmission(() -> Mono.error(new IllegalStateException("boom"))))
                .expectError(IllegalStateException.class)
                .verify(Duration.ofSeconds(1));

        assertEquals(0, limiter.snapshot().getAdmitted());
        assertEquals(0, limiter.snapshot().getRunning());
    }

    @Test
    void testWithAdmissionReleasesOnCancel() {
        AdmissionLimiter limiter = limiter(1, 1, Duration.ofSeconds(1));

        Disposable running = limiter.withAdmission(Mono::never).subscribe();
        assertEquals(1, limiter.snapshot().getRunning());

        running.dispose();

        assertEquals(0, limiter.snapshot().getAdmitted());
    }

    @Test
    void testDoubleReleaseIsIgnored() {
        AdmissionLimiter limiter = limiter(1, 2, Duration.ofSeconds(1));
        AdmissionTicket ticket = limiter.acquire().block(Duration.ofSeconds(1));
        assertNotNull(ticket);

        limiter.release(ticket);
        limiter.release(ticket);

        LimiterSnapshot snapshot = limiter.snapshot();
        assertEquals(0, snapshot.getAdmitted());
        assertEquals(0, snapshot.getRunning());
    }

    @Test
    void testWaitersAreGrantedInArrivalOrder() throws Exception {
        AdmissionLimiter limiter = limiter(1, 4, Duration.ofSeconds(2));
        AdmissionTicket holder = limiter.acquire().block(Duration.ofSeconds(1));
        assertNotNull(holder);

        List<Integer> order = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(3);
        for (int i = 1; i <= 3; i++) {
            int caller = i;
            limiter.withAdmission(() -> Mono.fromRunnable(() -> order.add(caller)))
                    .doFinally(s -> done.countDown())
                    .subscribe();
        }
        assertEquals(3, limiter.snapshot().getWaiting());

        limiter.release(holder);

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertEquals(List.of(1, 2, 3), order);
    }

    @Test
    void testDrainRejectsNewWorkAndLetsRunningFinish() {
        AdmissionLimiter limiter = limiter(2, 4, Duration.ofSeconds(1));
        AdmissionTicket running = limiter.acquire().block(Duration.ofSeconds(1));
        assertNotNull(running);

        AtomicReference<Boolean> drained = new AtomicReference<>();
        limiter.drain(Duration.ofSeconds(2)).subscribe(drained::set);

        assertTrue(limiter.isShuttingDown());
        StepVerifier.create(limiter.acquire())
                .expectError(ShuttingDownException.class)
                .verify(Duration.ofSeconds(1));
        assertNull(drained.get());
        assertEquals(TicketState.RUNNING, running.getState());

        limiter.release(running);

        StepVerifier.create(limiter.drain(Duration.ofSeconds(1)))
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    void testDrainReportsFalseWhenGraceElapses() {
        AdmissionLimiter limiter = new AdmissionLimiter(1, 1, Duration.ofSeconds(1), Clock.systemUTC(),
                Schedulers.parallel());
        AdmissionTicket stuck = limiter.acquire().block(Duration.ofSeconds(1));
        assertNotNull(stuck);

        StepVerifier.create(limiter.drain(Duration.ofMillis(50)))
                .expectNext(false)
                .verifyComplete();

        limiter.release(stuck);
    }
}
