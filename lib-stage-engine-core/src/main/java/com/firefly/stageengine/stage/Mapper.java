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

import com.firefly.stageengine.concurrency.BatchExecutor;
import com.firefly.stageengine.concurrency.RateLimiter;
import com.firefly.stageengine.concurrency.RetryPolicy;
import com.firefly.stageengine.core.ConcurrencyOptions;
import com.firefly.stageengine.core.Stage;
import com.firefly.stageengine.core.StageConfig;
import com.firefly.stageengine.errors.AggregateFailureException;
import com.firefly.stageengine.errors.StageCancelledException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Applies one element stage to every element of a list through the {@link BatchExecutor}.
 * <p>
 * A mapper built with explicit {@link ConcurrencyOptions} always runs with them; one built
 * without takes them from the call's config. Derived mappers ({@code with*}) never modify the
 * original.
 */
public final class Mapper<I, O> implements Stage<List<I>, List<O>> {

    static final int MAX_DEFAULT_STREAM_CHUNK = 20;

    private final String name;
    private final Stage<I, O> element;
    private final ConcurrencyOptions options;

    private Mapper(String name, Stage<I, O> element, ConcurrencyOptions options) {
        this.element = Objects.requireNonNull(element, "element");
        this.name = name != null && !name.isBlank() ? name : "map(" + element.name() + ")";
        this.options = options;
    }

    @SuppressWarnings("unchecked")
    public static <I, O> Mapper<I, O> of(Stage<? super I, ? extends O> element) {
        return new Mapper<>(null, (Stage<I, O>) element, null);
    }

    @SuppressWarnings("unchecked")
    public static <I, O> Mapper<I, O> of(Stage<? super I, ? extends O> element, ConcurrencyOptions options) {
        return new Mapper<>(null, (Stage<I, O>) element, Objects.requireNonNull(options, "options"));
    }

    public static <I, O> Mapper<I, O> from(Function<? super I, ? extends O> fn) {
        return new Mapper<>(null, LambdaStage.of("mapFn", fn), null);
    }

    public static <I, O> Mapper<I, O> from(Function<? super I, ? extends O> fn, ConcurrencyOptions options) {
        return new Mapper<>(null, LambdaStage.of("mapFn", fn), options);
    }

    /** Unordered, high concurrency. */
    public static <I, O> Mapper<I, O> parallel(Stage<? super I, ? extends O> element, int concurrency) {
        return of(element, new ConcurrencyOptions(concurrency, ConcurrencyOptions.DEFAULT_BATCH_SIZE, false));
    }

    public static <I, O> Mapper<I, O> parallel(Stage<? super I, ? extends O> element) {
        return parallel(element, 20);
    }

    /** One element at a time, in order. */
    public static <I, O> Mapper<I, O> sequential(Stage<? super I, ? extends O> element) {
        return of(element, new ConcurrencyOptions(1, ConcurrencyOptions.DEFAULT_BATCH_SIZE, true));
    }

    public static <I, O> Mapper<I, O> batched(Stage<? super I, ? extends O> element, int batchSize, int concurrency) {
        return of(element, new ConcurrencyOptions(concurrency, batchSize, true));
    }

    public static <I, O> Mapper<I, O> batched(Stage<? super I, ? extends O> element) {
        return batched(element, 50, 5);
    }

    public Stage<I, O> element() {
        return element;
    }

    /** Options this mapper runs with, or the defaults when it takes them from the call. */
    public ConcurrencyOptions options() {
        return options != null ? options : ConcurrencyOptions.defaults();
    }

    public Mapper<I, O> named(String newName) {
        return new Mapper<>(newName, element, options);
    }

    public Mapper<I, O> withConcurrency(int limit) {
        return new Mapper<>(name, element, options().withConcurrencyLimit(limit));
    }

    public Mapper<I, O> withBatchSize(int size) {
        return new Mapper<>(name, element, options().withBatchSize(size));
    }

    public Mapper<I, O> withOrderPreservation(boolean preserve) {
        return new Mapper<>(name, element, options().withPreserveOrder(preserve));
    }

    public Mapper<I, O> withOptions(ConcurrencyOptions newOptions) {
        return new Mapper<>(name, element, Objects.requireNonNull(newOptions, "options"));
    }

    /** Retries each element independently. */
    public Mapper<I, O> withRetry(RetryPolicy policy) {
        return new Mapper<>(name, new RetryingStage<>(element, policy), options);
    }

    public Mapper<I, O> withRetry(int maxRetries, Duration baseDelay) {
        return withRetry(RetryPolicy.of(maxRetries, baseDelay));
    }

    /**
     * Spaces element starts by {@code 1000 / requestsPerSecond} ms and caps concurrency at
     * {@code min(limit, requestsPerSecond)}.
     */
    public Mapper<I, O> withRateLimit(double requestsPerSecond) {
        RateLimiter limiter = new RateLimiter(requestsPerSecond);
        ConcurrencyOptions base = options();
        int capped = (int) Math.max(1, Math.min(base.concurrencyLimit(), Math.floor(requestsPerSecond)));
        return new Mapper<>(name, new RateLimitedStage<>(element, limiter), base.withConcurrencyLimit(capped));
    }

    /** Drops elements failing {@code predicate} before mapping. */
    public Pipeline<List<I>, List<O>> withFilter(Predicate<? super I> predicate) {
        return Pipeline.<List<I>, List<I>, List<O>>of(LambdaStage.filter(predicate), this).named(name + ".filter");
    }

    /** Maps, then folds the results starting from {@code initial}. */
    public <R> Pipeline<List<I>, R> withReduce(R initial, BiFunction<R, ? super O, R> reducer) {
        return Pipeline.<List<I>, List<O>, R>of(this, LambdaStage.reduce(initial, reducer)).named(name + ".reduce");
    }

    @Override
    public String name() {
        return name;
    }

    private ConcurrencyOptions effective(StageConfig cfg) {
        return options != null ? options : cfg.concurrencyOptions();
    }

    @Override
    public Mono<List<O>> invoke(List<I> input, StageConfig config) {
        StageConfig cfg = config != null ? config : StageConfig.defaults();
        if (input == null || input.isEmpty()) {
            return Mono.just(List.of());
        }
        long start = System.currentTimeMillis();
        return BatchExecutor.execute(name, input,
                        (item, index) -> element.invoke(item, cfg.withTag("item:" + index)),
                        effective(cfg), cfg.cancellationToken())
                .doOnSuccess(r -> cfg.events().onBatchCompleted(name, cfg.runId(), r.size(), 0,
                        System.currentTimeMillis() - start))
                .doOnError(AggregateFailureException.class, e -> cfg.events().onBatchCompleted(name, cfg.runId(),
                        e.getTotal(), e.getFailedCount(), System.currentTimeMillis() - start))
                .doOnError(StageCancelledException.class, e -> cfg.events().onCancelled(name, cfg.runId(), e.getBoundary()));
    }

    /**
     * Emits one list per chunk. The chunk size is the config's {@code streamBatchSize}, or
     * {@code min(batchSize, 20)} when unset.
     */
    @Override
    public Flux<List<O>> stream(List<I> input, StageConfig config) {
        StageConfig cfg = config != null ? config : StageConfig.defaults();
        ConcurrencyOptions opts = effective(cfg);
        int chunk = cfg.streamBatchSize() > 0
                ? cfg.streamBatchSize()
                : Math.min(opts.batchSize(), MAX_DEFAULT_STREAM_CHUNK);
        return BatchExecutor.stream(name, input,
                (item, index) -> element.invoke(item, cfg.withTag("item:" + index)),
                opts, chunk, cfg.cancellationToken());
    }

    @Override
    public String toString() {
        return "Mapper[" + name + ", options=" + options() + "]";
    }
}
