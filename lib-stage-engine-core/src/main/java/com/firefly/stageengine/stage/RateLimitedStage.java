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

import com.firefly.stageengine.concurrency.RateLimiter;
import com.firefly.stageengine.core.Stage;
import com.firefly.stageengine.core.StageConfig;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Delays invocations of the delegate so their starts respect a shared {@link RateLimiter}.
 */
public final class RateLimitedStage<I, O> implements Stage<I, O> {

    private final Stage<I, O> delegate;
    private final RateLimiter limiter;

    public RateLimitedStage(Stage<I, O> delegate, RateLimiter limiter) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
    }

    public RateLimiter limiter() {
        return limiter;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public Mono<O> invoke(I input, StageConfig config) {
        return limiter.limit(() -> delegate.invoke(input, config));
    }
}
