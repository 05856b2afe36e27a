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
import com.firefly.stageengine.concurrency.ConcurrencyLimiter;
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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs every named step on the same input concurrently and gathers the results into a record
 * keyed by step name, in declaration order.
 * <p>
 * With {@code throwOnError} set (the default) any step failure fails the invocation with an
 * {@link AggregateFailureException} listing every failing key. Otherwise failures are logged and
 * the failing keys are left out of the record.
 */
public final class FanOut<I> implements Stage<I, Map<String, Object>> {

    private static final Logger log = LoggerFactory.getLogger(FanOut.class);

    static final int DEFAULT_BATCH_CONCURRENCY = 5;

    private final String name;
    private final Map<String, Stage<? super I, ?>> steps;

    private FanOut(String name, Map<String, ? extends Stage<? super I, ?>> steps) {
        Objects.requireNonNull(steps, "steps");
        Map<String, Stage<? super I, ?>> copy = new LinkedHashMap<>();
        steps.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "step key"), Objects.requireNonNull(v, "step " + k)));
        this.name = name != null && !name.isBlank() ? name : "fanOut";
        this.steps = Collections.unmodifiableMap(copy);
    }

    public static <I> FanOut<I> of(Map<String, ? extends Stage<? super I, ?>> steps) {
        return new FanOut<>(null, steps);
    }

    public static <I> FanOut<I> of(String name, Map<String, ? extends Stage<? super I, ?>> steps) {
        return new FanOut<>(name, steps);
    }

    /** Copy of this fan-out with {@code key} added or replaced. */
    public FanOut<I> addStep(String key, Stage<? super I, ?> step) {
        Map<String, Stage<? super I, ?>> copy = new LinkedHashMap<>(steps);
        copy.put(key, step);
        return new FanOut<>(name, copy);
    }

    public FanOut<I> removeStep(String key) {
        Map<String, Stage<? super I, ?>> copy = new LinkedHashMap<>(steps);
        copy.remove(key);
        return new FanOut<>(name, copy);
    }

    /** Copy of the step map; changes do not affect this fan-out. */
    public Map<String, Stage<? super I, ?>> steps() {
        return new LinkedHashMap<>(steps);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Mono<Map<String, Object>> invoke(I input, StageConfig config) {
        StageConfig cfg = config != null ? config : StageConfig.defaults();
        if (steps.isEmpty()) {
            return Mono.just(new LinkedHashMap<>());
        }
        return Mono.defer(() -> {
            cfg.cancellationToken().throwIfCancelled("fan-out '" + name + "' start");
            ConcurrencyLimiter limiter = new ConcurrencyLimiter(cfg.concurrencyLimit());
            Map<String, Optional<Object>> results = new ConcurrentHashMap<>();
            Map<String, Throwable> errors = new ConcurrentHashMap<>();
            List<Mono<Void>> executions = steps.entrySet().stream()
                    .map(e -> limiter.withPermit(() -> StepRunner.run(name, e.getKey(), e.getValue(), input,
                                    cfg.withTag("stepKey_" + e.getKey())))
                            .doOnNext(v -> results.put(e.getKey(), v))
                            .onErrorResume(err -> !(err instanceof StageCancelledException), err -> {
                                errors.put(e.getKey(), err);
                                return Mono.empty();
                            })
                            .then())
                    .toList();
            return Mono.when(executions).then(Mono.fromCallable(() -> collect(results, errors, cfg)));
        });
    }

    private Map<String, Object> collect(Map<String, Optional<Object>> results, Map<String, Throwable> errors, StageConfig cfg) {
        if (!errors.isEmpty()) {
            Map<String, Throwable> ordered = new LinkedHashMap<>();
            for (String key : steps.keySet()) {
                if (errors.containsKey(key)) ordered.put(key, errors.get(key));
            }
            if (cfg.throwOnError()) {
                throw new AggregateFailureException(name, ordered, steps.size());
            }
            ordered.forEach((key, err) -> log.warn(JsonUtils.json(
                    "stage_event", "fan_out_step_dropped",
                    "stage", name,
                    "runId", cfg.runId(),
                    "stepKey", key,
                    "error_class", err.getClass().getName(),
                    "error_msg", JsonUtils.safeString(err.getMessage(), 500)
            )));
        }
        Map<String, Object> record = new LinkedHashMap<>();
        for (String key : steps.keySet()) {
            Optional<Object> v = results.get(key);
            if (v != null) {
                record.put(key, v.orElse(null));
            }
        }
        return record;
    }

    /**
     * Runs the fan-out once per input. Outer concurrency is {@code batchConcurrency}, or
     * {@code min(n, 5)} when unset; each invocation keeps its own inner bound.
     */
    @Override
    public Mono<List<Map<String, Object>>> batch(List<I> inputs, StageConfig config) {
        if (inputs == null || inputs.isEmpty()) {
            return Mono.just(List.of());
        }
        StageConfig cfg = config != null ? config : StageConfig.defaults();
        int outer = StepRunner.outerConcurrency(cfg, inputs.size(), DEFAULT_BATCH_CONCURRENCY);
        ConcurrencyOptions options = cfg.concurrencyOptions().withConcurrencyLimit(outer);
        return BatchExecutor.execute(name, inputs,
                (item, index) -> invoke(item, cfg.withTag("batchIndex_" + index)),
                options, cfg.cancellationToken());
    }

    /**
     * Emits the record accumulated so far each time a step completes. Fails at the first step
     * failure, identifying the failing key.
     */
    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public Flux<Map<String, Object>> stream(I input, StageConfig config) {
        StageConfig cfg = config != null ? config : StageConfig.defaults();
        if (steps.isEmpty()) {
            return Flux.just(new LinkedHashMap<>());
        }
        return Flux.defer(() -> {
            cfg.cancellationToken().throwIfCancelled("fan-out '" + name + "' start");
            ConcurrencyLimiter limiter = new ConcurrencyLimiter(cfg.concurrencyLimit());
            Map<String, Object> partial = Collections.synchronizedMap(new LinkedHashMap<>());
            return Flux.fromIterable(steps.entrySet())
                    .flatMap(e -> {
                        Stage step = e.getValue();
                        StageConfig stepCfg = cfg.withTag("stepKey_" + e.getKey());
                        Mono<Optional<Object>> last = limiter.withPermit(() -> ((Flux<Object>) step.stream(input, stepCfg))
                                .takeLast(1)
                                .singleOrEmpty()
                                .map(Optional::of)
                                .defaultIfEmpty(Optional.empty()));
                        return last
                                .onErrorMap(err -> !(err instanceof StageCancelledException),
                                        err -> StageExecutionException.forKey(name, e.getKey(), err))
                                .map(v -> {
                                    synchronized (partial) {
                                        partial.put(e.getKey(), v.orElse(null));
                                        return ordered(partial);
                                    }
                                });
                    });
        });
    }

    private Map<String, Object> ordered(Map<String, Object> partial) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        for (String key : steps.keySet()) {
            if (partial.containsKey(key)) snapshot.put(key, partial.get(key));
        }
        return snapshot;
    }

    @Override
    public String toString() {
        return "FanOut[" + name + ", keys=" + steps.keySet() + "]";
    }
}
