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

package com.firefly.stageengine.stage;

import com.firefly.stageengine.core.Stage;
import com.firefly.stageengine.core.StageConfig;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Memoizes successful results of the delegate per key for a fixed time-to-live.
 * <p>
 * When the cache is full the oldest entry is evicted. Failures are not cached. Concurrent misses
 * for the same key each invoke the delegate; the last result stored wins.
 */
public final class CachingStage<I, O> implements Stage<I, O> {

    private record Entry(Optional<Object> value, long storedAt) {}

    private final Stage<I, O> delegate;
    private final long ttlNanos;
    private final int maxSize;
    private final Function<? super I, ?> keyFunction;
    private final LongSupplier clock;
    private final LinkedHashMap<Object, Entry> cache = new LinkedHashMap<>();

    public CachingStage(Stage<I, O> delegate, Duration ttl, int maxSize, Function<? super I, ?> keyFunction) {
        this(delegate, ttl, maxSize, keyFunction, System::nanoTime);
    }

    CachingStage(Stage<I, O> delegate, Duration ttl, int maxSize, Function<? super I, ?> keyFunction, LongSupplier clock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive but was " + ttl);
        }
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1 but was " + maxSize);
        }
        this.ttlNanos = ttl.toNanos();
        this.maxSize = maxSize;
        this.keyFunction = keyFunction != null ? keyFunction : Function.identity();
        this.clock = clock;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    public int size() {
        synchronized (cache) {
            return cache.size();
        }
    }

    public void clear() {
        synchronized (cache) {
            cache.clear();
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public Mono<O> invoke(I input, StageConfig config) {
        return Mono.defer(() -> {
            Object key = keyFunction.apply(input);
            Entry hit = lookup(key);
            if (hit != null) {
                return Mono.justOrEmpty((Optional<O>) (Optional<?>) hit.value());
            }
            return delegate.invoke(input, config)
                    .map(v -> {
                        store(key, Optional.<Object>of(v));
                        return v;
                    })
                    .switchIfEmpty(Mono.fromRunnable(() -> store(key, Optional.empty())));
        });
    }

    private Entry lookup(Object key) {
        long now = clock.getAsLong();
        synchronized (cache) {
            Entry e = cache.get(key);
            if (e == null) return null;
            if (now - e.storedAt() >= ttlNanos) {
                cache.remove(key);
                return null;
            }
            return e;
        }
    }

    private void store(Object key, Optional<Object> value) {
        long now = clock.getAsLong();
        synchronized (cache) {
            cache.remove(key);
            cache.put(key, new Entry(value, now));
            Iterator<Map.Entry<Object, Entry>> it = cache.entrySet().iterator();
            while (cache.size() > maxSize && it.hasNext()) {
                it.next();
                it.remove();
            }
        }
    }
}
