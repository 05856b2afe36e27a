package com.firefly.stageengine.testing;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks how many units are in flight at once. Each tracked unit holds its slot for {@code hold}.
 */
public class ConcurrencyProbe {

    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger max = new AtomicInteger();
    private final AtomicInteger started = new AtomicInteger();
    private final Duration hold;

    public ConcurrencyProbe(Duration hold) {
        this.hold = hold;
    }

    public <T> Mono<T> track(T value) {
        return Mono.defer(() -> {
            started.incrementAndGet();
            int now = active.incrementAndGet();
            max.accumulateAndGet(now, Math::max);
            return Mono.delay(hold).thenReturn(value).doFinally(s -> active.decrementAndGet());
        });
    }

    public int maxActive() {
        return max.get();
    }

    public int started() {
        return started.get();
    }
}
