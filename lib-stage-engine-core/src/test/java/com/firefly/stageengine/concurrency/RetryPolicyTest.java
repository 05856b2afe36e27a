package com.firefly.stageengine.concurrency;

import com.firefly.stageengine.errors.StageCancelledException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void delaysGrowExponentiallyUpToTheCap() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), Duration.ofSeconds(1), 2.0);

        assertEquals(Duration.ofMillis(100), policy.delayFor(1));
        assertEquals(Duration.ofMillis(200), policy.delayFor(2));
        assertEquals(Duration.ofMillis(400), policy.delayFor(3));
        assertEquals(Duration.ofMillis(800), policy.delayFor(4));
        assertEquals(Duration.ofSeconds(1), policy.delayFor(5));
        assertThrows(IllegalArgumentException.class, () -> policy.delayFor(0));
    }

    @Test
    void defaultsMatchDocumentedValues() {
        RetryPolicy policy = RetryPolicy.defaults();
        assertEquals(3, policy.maxRetries());
        assertEquals(Duration.ofSeconds(1), policy.baseDelay());
        assertEquals(Duration.ofSeconds(30), policy.maxDelay());
        assertEquals(2.0, policy.backoffFactor());
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, Duration.ZERO, Duration.ZERO, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.5));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaults().withBaseDelay(Duration.ofMillis(-1)));
    }

    @Test
    void succeedsAfterTransientFailures() {
        AtomicInteger attempts = new AtomicInteger();
        List<Integer> retries = new CopyOnWriteArrayList<>();
        RetryPolicy policy = RetryPolicy.of(3, Duration.ZERO);

        Mono<String> run = policy.execute(() -> attempts.incrementAndGet() <= 2
                        ? Mono.<String>error(new IllegalStateException("flaky"))
                        : Mono.just("ok"),
                (attempt, delay, error) -> retries.add(attempt));

        StepVerifier.create(run).expectNext("ok").verifyComplete();
        assertEquals(3, attempts.get());
        assertEquals(List.of(1, 2), retries);
    }

    @Test
    void surfacesLastErrorWhenRetriesAreExhausted() {
        AtomicInteger attempts = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.of(2, Duration.ZERO);

        Mono<String> run = policy.execute(
                () -> Mono.<String>error(new IllegalStateException("attempt " + attempts.incrementAndGet())),
                RetryPolicy.RetryListener.NOOP);

        StepVerifier.create(run).expectErrorMessage("attempt 3").verify();
        assertEquals(3, attempts.get());
    }

    @Test
    void cancellationIsNeverRetried() {
        AtomicInteger attempts = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.of(5, Duration.ZERO);

        Mono<String> run = policy.execute(() -> {
            attempts.incrementAndGet();
            return Mono.<String>error(new StageCancelledException("test", null));
        }, null);

        StepVerifier.create(run).expectError(StageCancelledException.class).verify();
        assertEquals(1, attempts.get());
    }

    @Test
    void waitsTheComputedDelayBetweenAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(2, Duration.ofSeconds(1), Duration.ofSeconds(10), 3.0);

        StepVerifier.withVirtualTime(() -> policy.execute(
                        () -> attempts.incrementAndGet() < 3 ? Mono.<Integer>error(new RuntimeException("x")) : Mono.just(attempts.get()),
                        null))
                .expectSubscription()
                .expectNoEvent(Duration.ofSeconds(1))
                .thenAwait(Duration.ofSeconds(3))
                .expectNext(3)
                .verifyComplete();
    }
}
