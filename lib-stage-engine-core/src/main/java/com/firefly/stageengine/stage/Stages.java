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
import com.firefly.stageengine.concurrency.RetryPolicy;
import com.firefly.stageengine.condition.Condition;
import com.firefly.stageengine.core.ConcurrencyOptions;
import com.firefly.stageengine.core.Stage;
import com.firefly.stageengine.core.StageConfig;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Static entry points for building and decorating stages.
 */
public final class Stages {

    private Stages() {}

    public static <I, O> Stage<I, O> lambda(Function<? super I, ? extends O> fn) {
        return LambdaStage.of(fn);
    }

    public static <I, O> Stage<I, O> lambda(String name, Function<? super I, ? extends O> fn) {
        return LambdaStage.of(name, fn);
    }

    public static <I, O> Stage<I, O> async(Function<? super I, ? extends Mono<O>> fn) {
        return LambdaStage.async(fn);
    }

    public static <I, O> Pipeline<I, O> pipe(List<? extends Stage<?, ?>> steps) {
        return Pipeline.from(steps);
    }

    public static <I> FanOut<I> parallel(Map<String, ? extends Stage<? super I, ?>> steps) {
        return FanOut.of(steps);
    }

    public static <I, O> Router<I, O> branch(List<BranchDefinition<I, O>> branches, Stage<? super I, ? extends O> defaultTarget) {
        return Router.create(branches, defaultTarget);
    }

    public static <I, O> BranchDefinition<I, O> when(Condition<? super I> condition, Stage<? super I, ? extends O> target) {
        return new BranchDefinition<>(null, condition, target);
    }

    public static Enricher enrich(Map<String, Assignment> assignments) {
        return Enricher.of(assignments);
    }

    public static <I, O> Mapper<I, O> map(Stage<? super I, ? extends O> element) {
        return Mapper.of(element);
    }

    public static <I, O> Mapper<I, O> map(Stage<? super I, ? extends O> element, ConcurrencyOptions options) {
        return Mapper.of(element, options);
    }

    public static <I, O> Stage<I, O> withRetry(Stage<I, O> stage, RetryPolicy policy) {
        return new RetryingStage<>(stage, policy);
    }

    public static <I, O> Stage<I, O> withRetry(Stage<I, O> stage, int maxRetries, Duration baseDelay) {
        return new RetryingStage<>(stage, RetryPolicy.of(maxRetries, baseDelay));
    }

    /** Fails with a {@link java.util.concurrent.TimeoutException} when no result arrives in time. */
    public static <I, O> Stage<I, O> withTimeout(Stage<I, O> stage, Duration timeout) {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(timeout, "timeout");
        return new Stage<>() {
            @Override
            public Mono<O> invoke(I input, StageConfig config) {
                return stage.invoke(input, config).timeout(timeout);
            }

            @Override
            public String name() {
                return stage.name();
            }
        };
    }

    public static <I, O> Stage<I, O> withFallback(Stage<I, O> stage, Stage<I, O> fallback) {
        return new FallbackStage<>(stage, fallback);
    }

    public static <I, O> CachingStage<I, O> withCache(Stage<I, O> stage, Duration ttl, int maxSize) {
        return new CachingStage<>(stage, ttl, maxSize, null);
    }

    public static <I, O> CachingStage<I, O> withCache(Stage<I, O> stage, Duration ttl, int maxSize,
                                                      Function<? super I, ?> keyFunction) {
        return new CachingStage<>(stage, ttl, maxSize, keyFunction);
    }

    public static <I, O> Stage<I, O> withRateLimit(Stage<I, O> stage, double requestsPerSecond) {
        return new RateLimitedStage<>(stage, new RateLimiter(requestsPerSecond));
    }
}
