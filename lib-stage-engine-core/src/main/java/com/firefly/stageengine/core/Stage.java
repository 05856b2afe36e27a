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

package com.firefly.stageengine.core;

import com.firefly.stageengine.concurrency.BatchExecutor;
import com.firefly.stageengine.errors.AggregateFailureException;
import com.firefly.stageengine.stage.Pipeline;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Unit of asynchronous work transforming an input into an output.
 * <p>
 * An empty {@code Mono} means the stage produced no value; composites pass that on as
 * {@code null}. Implementations only need {@link #invoke(Object, StageConfig)}; batch and
 * stream variants default to the batch executor and a single-element stream.
 *
 * @param <I> input type
 * @param <O> output type
 */
@FunctionalInterface
public interface Stage<I, O> {

    Mono<O> invoke(I input, StageConfig config);

    default Mono<O> invoke(I input) {
        return invoke(input, StageConfig.defaults());
    }

    /** Name used in events, logs and error messages. */
    default String name() {
        String simple = getClass().getSimpleName();
        int lambda = simple.indexOf("$$");
        if (lambda > 0) {
            simple = simple.substring(0, lambda);
        }
        return simple.isEmpty() ? "stage" : simple;
    }

    /**
     * Invokes every input independently, bounded by the config's concurrency options.
     * The result is aligned with the input; any item failure fails the call after all items ran.
     */
    default Mono<List<O>> batch(List<I> inputs, StageConfig config) {
        StageConfig cfg = config != null ? config : StageConfig.defaults();
        long start = System.currentTimeMillis();
        return BatchExecutor.execute(name(), inputs,
                        (item, index) -> invoke(item, cfg.withTag("batch:" + index)),
                        cfg.concurrencyOptions(), cfg.cancellationToken())
                .doOnSuccess(r -> cfg.events().onBatchCompleted(name(), cfg.runId(),
                        r.size(), 0, System.currentTimeMillis() - start))
                .doOnError(AggregateFailureException.class, e -> cfg.events().onBatchCompleted(name(), cfg.runId(),
                        e.getTotal(), e.getFailedCount(), System.currentTimeMillis() - start));
    }

    default Mono<List<O>> batch(List<I> inputs) {
        return batch(inputs, StageConfig.defaults());
    }

    /** Like {@link #batch}, but reports each item's value or error instead of failing. */
    default Mono<List<ItemOutcome<O>>> batchSettled(List<I> inputs, StageConfig config) {
        StageConfig cfg = config != null ? config : StageConfig.defaults();
        long start = System.currentTimeMillis();
        return BatchExecutor.executeSettled(inputs,
                        (item, index) -> invoke(item, cfg.withTag("batch:" + index)),
                        cfg.concurrencyOptions(), cfg.cancellationToken())
                .doOnSuccess(r -> cfg.events().onBatchCompleted(name(), cfg.runId(), r.size(),
                        (int) r.stream().filter(o -> !o.isSuccess()).count(),
                        System.currentTimeMillis() - start));
    }

    /** Finite cold stream of results; by default the single invoke result. */
    default Flux<O> stream(I input, StageConfig config) {
        return Flux.defer(() -> invoke(input, config != null ? config : StageConfig.defaults()).flux());
    }

    default Flux<O> stream(I input) {
        return stream(input, StageConfig.defaults());
    }

    /** Sequential composition: this stage followed by {@code next}. */
    default <R> Pipeline<I, R> pipe(Stage<? super O, R> next) {
        return Pipeline.of(this, next);
    }
}
