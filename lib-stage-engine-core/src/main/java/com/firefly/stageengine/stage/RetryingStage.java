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

import com.firefly.stageengine.concurrency.RetryPolicy;
import com.firefly.stageengine.core.Stage;
import com.firefly.stageengine.core.StageConfig;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Re-invokes the delegate on failure according to a {@link RetryPolicy}. Each retry is reported
 * through {@code StageEvents.onRetry}. Cancellation is never retried.
 */
public final class RetryingStage<I, O> implements Stage<I, O> {

    private final Stage<I, O> delegate;
    private final RetryPolicy policy;

    public RetryingStage(Stage<I, O> delegate, RetryPolicy policy) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public RetryPolicy policy() {
        return policy;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public Mono<O> invoke(I input, StageConfig config) {
        StageConfig cfg = config != null ? config : StageConfig.defaults();
        return policy.execute(() -> delegate.invoke(input, cfg),
                (attempt, delay, error) -> cfg.events().onRetry(name(), cfg.runId(), attempt, delay.toMillis(), error));
    }

    @Override
    public String toString() {
        return "RetryingStage[" + delegate.name() + ", " + policy + "]";
    }
}
