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
import reactor.core.publisher.MonoSink;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Counting semaphore for reactive work with FIFO waiters.
 * <p>
 * A released permit is handed directly to the oldest live waiter, so a newcomer can never
 * overtake a queued acquirer. A waiter cancelled before it is granted leaves the queue and
 * never consumes a permit; a waiter cancelled while a grant is in transit gives the permit back.
 * <p>
 * Grants are delivered from a drain loop: a release made while another thread (or an outer
 * frame of the same thread) is delivering only enqueues the grant, so chains of synchronous
 * holders never grow the stack.
 */
public final class ConcurrencyLimiter {

    private static final int WAITING = 0;
    private static final int GRANTED = 1;
    private static final int CANCELLED = 2;

    private final int maxPermits;
    private final Object lock = new Object();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private final Queue<Waiter> granted = new ConcurrentLinkedQueue<>();
    private final AtomicInteger wip = new AtomicInteger();
    private int available;

    public ConcurrencyLimiter(int permits) {
        if (permits < 1) {
            throw new IllegalArgumentException("permits must be >= 1 but was " + permits);
        }
        this.maxPermits = permits;
        this.available = permits;
    }

    public int maxPermits() {
        return maxPermits;
    }

    public int availablePermits() {
        synchronized (lock) {
            return available;
        }
    }

    /** Number of acquirers currently queued. */
    public int queueLength() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    /**
     * Acquires one permit. Completes immediately when one is free, otherwise once a holder
     * releases and every earlier waiter has been served.
     */
    public Mono<Permit> acquire() {
        return Mono.create(sink -> {
            Waiter waiter = new Waiter(sink);
            sink.onCancel(waiter::cancel);
            boolean immediate;
            synchronized (lock) {
                if (waiter.state.get() == CANCELLED) {
                    return;
                }
                immediate = available > 0 && waiters.isEmpty();
                if (immediate) {
                    available--;
                    waiter.state.set(GRANTED);
                } else {
                    waiters.addLast(waiter);
                }
            }
            if (immediate) {
                sink.success(waiter.permit);
            }
        });
    }

    /** Runs {@code work} under a permit, released on success, error or cancellation. */
    public <T> Mono<T> withPermit(Supplier<? extends Mono<T>> work) {
        return Mono.usingWhen(
                acquire(),
                permit -> Mono.defer(work),
                Permit::releaseAsync,
                (permit, error) -> permit.releaseAsync(),
                Permit::releaseAsync);
    }

    private void releaseOne() {
        Waiter next = null;
        synchronized (lock) {
            while (!waiters.isEmpty()) {
                Waiter candidate = waiters.pollFirst();
                if (candidate.state.compareAndSet(WAITING, GRANTED)) {
                    next = candidate;
                    break;
                }
            }
            if (next == null) {
                available++;
            }
        }
        if (next != null) {
            granted.offer(next);
            drain();
        }
    }

    private void drain() {
        if (wip.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        do {
            Waiter w;
            while ((w = granted.poll()) != null) {
                w.sink.success(w.permit);
            }
            missed = wip.addAndGet(-missed);
        } while (missed != 0);
    }

    private final class Waiter {
        private final MonoSink<Permit> sink;
        private final AtomicInteger state = new AtomicInteger(WAITING);
        private final Permit permit = new Permit();

        private Waiter(MonoSink<Permit> sink) {
            this.sink = sink;
        }

        private void cancel() {
            if (state.compareAndSet(WAITING, CANCELLED)) {
                synchronized (lock) {
                    waiters.remove(this);
                }
            } else if (state.get() == GRANTED) {
                permit.release();
            }
        }
    }

    /** A held permit. Releasing more than once has no effect. */
    public final class Permit {
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {}

        public void release() {
            if (released.compareAndSet(false, true)) {
                releaseOne();
            }
        }

        public boolean isReleased() {
            return released.get();
        }

        Mono<Void> releaseAsync() {
            return Mono.fromRunnable(this::release);
        }
    }
}
