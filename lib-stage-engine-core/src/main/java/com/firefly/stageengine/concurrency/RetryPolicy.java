/*
 * Copyright 2025 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.firefly.stageengine.concurrency;

import com.firefly.stageengine.errors.StageCancelledException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Exponential backoff retry. The delay before retry {@code n} (1-based) is
 * {@code min(baseDelay * backoffFactor^(n-1), maxDelay)}. Every error except
 * {@link StageCancelledException} is retryable; once the retries are exhausted the last error
 * propagates unchanged.
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
    public static final double DEFAULT_BACKOFF_FACTOR = 2.0;

    /** Notified before each retry is scheduled. */
    @FunctionalInterface
    public interface RetryListener {
        RetryListener NOOP = (attempt, delay, error) -> {};

        void onRetry(int attempt, Duration delay, Throwable error);
    }

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double backoffFactor;

    public RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, double backoffFactor) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0 but was " + maxRetries);
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1 but was " + backoffFactor);
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.backoffFactor = backoffFactor;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, DEFAULT_BACKOFF_FACTOR);
    }

    public static RetryPolicy of(int maxRetries, Duration baseDelay) {
        return new RetryPolicy(maxRetries, baseDelay, DEFAULT_MAX_DELAY, DEFAULT_BACKOFF_FACTOR);
    }

    public int maxRetries() { return maxRetries; }
    public Duration baseDelay() { return baseDelay; }
    public Duration maxDelay() { return maxDelay; }
    public double backoffFactor() { return backoffFactor; }

    public RetryPolicy withMaxRetries(int retries) {
        return new RetryPolicy(retries, baseDelay, maxDelay, backoffFactor);
    }

    public RetryPolicy withBaseDelay(Duration delay) {
        return new RetryPolicy(maxRetries, delay, maxDelay, backoffFactor);
    }

    public RetryPolicy withMaxDelay(Duration delay) {
        return new RetryPolicy(maxRetries, baseDelay, delay, backoffFactor);
    }

    public RetryPolicy withBackoffFactor(double factor) {
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, factor);
    }

    /** Delay before retry {@code retry} (1-based). */
    public Duration delayFor(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("retry is 1-based but was " + retry);
        }
        double millis = baseDelay.toMillis() * Math.pow(backoffFactor, retry - 1);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    /** Reactor retry spec implementing this policy. */
    public Retry toRetry(RetryListener listener) {
        RetryListener l = listener != null ? listener : RetryListener.NOOP;
        return Retry.from(signals -> signals.concatMap(signal -> {
            int next = (int) signal.totalRetries() + 1;
            Throwable failure = signal.failure();
            if (next > maxRetries || failure instanceof StageCancelledException) {
                return Mono.<Integer>error(failure);
            }
            Duration delay = delayFor(next);
            l.onRetry(next, delay, failure);
            return delay.isZero() ? Mono.just(next) : Mono.delay(delay).thenReturn(next);
        }));
    }

    /** Subscribes to a fresh {@code attempt} for the first try and for each retry. */
    public <T> Mono<T> execute(Supplier<? extends Mono<T>> attempt, RetryListener listener) {
        return Mono.defer(attempt).retryWhen(toRetry(listener));
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + maxRetries + ", baseDelay=" + baseDelay
                + ", maxDelay=" + maxDelay + ", backoffFactor=" + backoffFactor + '}';
    }
}
