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
import com.firefly.stageengine.core.ConcurrencyOptions;
import com.firefly.stageengine.core.Stage;
import com.firefly.stageengine.core.StageConfig;
import com.firefly.stageengine.errors.AggregateFailureException;
import com.firefly.stageengine.errors.StageCancelledException;
import com.firefly.stageengine.errors.StageExecutionException;
import com.firefly.stageengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered sequence of stages where each output feeds the next input.
 * <p>
 * Step {@code i+1} starts only after step {@code i} completed. The first failure aborts the run
 * with a {@link StageExecutionException} carrying the failing step index; the cancellation token
 * is checked after each step.
 */
public final class Pipeline<I, O> implements Stage<I, O> {

    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    static final int DEFAULT_BATCH_CONCURRENCY = 10;

    private final String name;
    private final List<Stage<?, ?>> steps;

    private Pipeline(String name, List<? extends Stage<?, ?>> steps) {
        Objects.requireNonNull(steps, "steps");
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("Pipeline requires at least one step");
        }
        for (Stage<?, ?> s : steps) {
            Objects.requireNonNull(s, "pipeline step");
        }
        this.name = name != null && !name.isBlank() ? name : "pipeline";
        this.steps = List.copyOf(steps);
    }

    public static <I, M, O> Pipeline<I, O> of(Stage<I, ? extends M> first, Stage<? super M, O> second) {
        return new Pipeline<>(null, List.of(first, second));
    }

    /** Untyped construction from an ordered list; the caller guarantees type compatibility. */
    public static <I, O> Pipeline<I, O> from(List<? extends Stage<?, ?>> steps) {
        return new Pipeline<>(null, steps);
    }

    public static <I, O> Pipeline<I, O> from(String name, List<? extends Stage<?, ?>> steps) {
        return new Pipeline<>(name, steps);
    }

    public static <I, O> Pipeline<I, O> single(Stage<I, O> step) {
        return new Pipeline<>(null, List.of(step));
    }

    /** Returns a copy of this pipeline with a new name. */
    public Pipeline<I, O> named(String newName) {
        return new Pipeline<>(newName, steps);
    }

    /** Appends {@code next}, returning a new pipeline. */
    @Override
    public <R> Pipeline<I, R> pipe(Stage<? super O, R> next) {
        List<Stage<?, ?>> extended = new ArrayList<>(steps);
        extended.add(Objects.requireNonNull(next, "next"));
        return new Pipeline<>(name, extended);
    }

    public List<Stage<?, ?>> steps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Mono<O> invoke(I input, StageConfig config) {
        StageConfig cfg = config != null ? config : StageConfig.defaults();
        return runSteps(input, cfg, steps.size())
                .filter(Optional::isPresent)
                .map(out -> cast(out.get()));
    }

    private Mono<Optional<Object>> runSteps(Object input, StageConfig cfg, int count) {
        Mono<Optional<Object>> acc = Mono.just(Optional.ofNullable(input));
        for (int i = 0; i < count; i++) {
            final int index = i;
            final Stage<?, ?> step = steps.get(i);
            acc = acc.flatMap(current -> StepRunner
                    .run(name, "step:" + index, step, current.orElse(null), cfg.withTag("step:" + index))
                    .onErrorMap(e -> !(e instanceof StageCancelledException),
                            e -> StageExecutionException.atStep(name, index, step.name(), e))
                    .doOnSuccess(out -> {
                        if (cfg.cancellationToken().isCancelled()) {
                            cfg.events().onCancelled(name, cfg.runId(), "after step " + index);
                            throw new StageCancelledException("pipeline '" + name + "' after step " + index,
                                    cfg.cancellationToken().reason());
                        }
                    }));
        }
        return acc.doOnError(StageExecutionException.class, e -> log.warn(JsonUtils.json(
                "stage_event", "pipeline_failed",
                "stage", name,
                "runId", cfg.runId(),
                "stepIndex", String.valueOf(e.getStepIndex().orElse(-1)),
                "error_class", e.getCause() != null ? e.getCause().getClass().getName() : "",
                "error_msg", JsonUtils.safeString(e.getMessage(), 500)
        )));
    }

    /**
     * Runs the whole pipeline once per input. Outer concurrency is {@code batchConcurrency}, or
     * {@code min(n, 10)} when unset.
     */
    @Override
    public Mono<List<O>> batch(List<I> inputs, StageConfig config) {
        if (inputs == null || inputs.isEmpty()) {
            return Mono.just(List.of());
        }
        StageConfig cfg = config != null ? config : StageConfig.defaults();
        int concurrency = StepRunner.outerConcurrency(cfg, inputs.size(), DEFAULT_BATCH_CONCURRENCY);
        ConcurrencyOptions options = cfg.concurrencyOptions().withConcurrencyLimit(concurrency);
        long start = System.currentTimeMillis();
        return BatchExecutor.execute(name, inputs,
                        (item, index) -> invoke(item, cfg.withTag("batch:" + index)),
                        options, cfg.cancellationToken())
                .doOnSuccess(r -> cfg.events().onBatchCompleted(name, cfg.runId(), r.size(), 0,
                        System.currentTimeMillis() - start))
                .doOnError(AggregateFailureException.class, e -> cfg.events().onBatchCompleted(name, cfg.runId(),
                        e.getTotal(), e.getFailedCount(), System.currentTimeMillis() - start));
    }

    /** Runs every step but the last with invoke, then streams the last step's output. */
    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public Flux<O> stream(I input, StageConfig config) {
        StageConfig cfg = config != null ? config : StageConfig.defaults();
        int last = steps.size() - 1;
        Stage lastStep = steps.get(last);
        return runSteps(input, cfg, last)
                .flatMapMany(current -> {
                    Flux<Object> out = lastStep.stream(current.orElse(null), cfg.withTag("step:" + last));
                    return out.onErrorMap(e -> !(e instanceof StageCancelledException),
                            e -> StageExecutionException.atStep(name, last, lastStep.name(), e));
                })
                .map(this::cast);
    }

    @SuppressWarnings("unchecked")
    private O cast(Object value) {
        return (O) value;
    }

    @Override
    public String toString() {
        return "Pipeline[" + name + ", steps=" + steps.size() + "]";
    }
}
