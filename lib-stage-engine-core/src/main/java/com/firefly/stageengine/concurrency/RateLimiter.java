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

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Spaces the starts of rate-limited work at least {@code 1000 / requestsPerSecond} ms apart.
 * One instance is shared by every invocation it decorates. Work that is already running is
 * not affected; combine with a {@link ConcurrencyLimiter} to bound the in-flight count.
 */
public final class RateLimiter {

    private final double requestsPerSecond;
    private final long intervalNanos;
    private final AtomicLong nextSlot;

    public RateLimiter(double requestsPerSecond) {
        if (!(requestsPerSecond > 0)) {
            throw new IllegalArgumentException("requestsPerSecond must be > 0 but was " + requestsPerSecond);
        }
        this.requestsPerSecond = requestsPerSecond;
        this.intervalNanos = (long) (1_000_000_000L / requestsPerSecond);
        this.nextSlot = new AtomicLong(System.nanoTime());
    }

    public double requestsPerSecond() {
        return requestsPerSecond;
    }

    public Duration interval() {
        return Duration.ofNanos(intervalNanos);
    }

    /** Reserves the next start slot and completes when it is reached. */
    public Mono<Void> acquire() {
        return Mono.defer(() -> {
            long now = System.nanoTime();
            long slot;
            while (true) {
                long prev = nextSlot.get();
                slot = Math.max(now, prev);
                if (nextSlot.compareAndSet(prev, slot + intervalNanos)) {
                    break;
                }
            }
            long wait = slot - now;
            return wait <= 0 ? Mono.<Void>empty() : Mono.delay(Duration.ofNanos(wait)).then();
        });
    }

    public <T> Mono<T> limit(Supplier<? extends Mono<T>> work) {
        return acquire().then(Mono.defer(work));
    }
}
