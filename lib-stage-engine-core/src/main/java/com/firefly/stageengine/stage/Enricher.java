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

import com.firefly.stageengine.concurrency.ConcurrencyLimiter;
import com.firefly.stageengine.core.Stage;
import com.firefly.stageengine.core.StageConfig;
import com.firefly.stageengine.errors.AggregateFailureException;
import com.firefly.stageengine.errors.StageCancelledException;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Adds computed keys to a map input.
 * <p>
 * All assignments run concurrently against the original input. Their results are written over
 * a shallow copy of the input in declaration order, so an assignment overrides an existing key
 * of the same name. Any failure fails the invocation with an {@link AggregateFailureException}
 * naming every failing key.
 */
public final class Enricher implements Stage<Map<String, Object>, Map<String, Object>> {

    private final String name;
    private final Map<String, Assignment> assignments;

    private Enricher(String name, Map<String, Assignment> assignments) {
        Map<String, Assignment> copy = new LinkedHashMap<>();
        Objects.requireNonNull(assignments, "assignments")
                .forEach((k, v) -> copy.put(Objects.requireNonNull(k, "key"), Objects.requireNonNull(v, "assignment " + k)));
        this.name = name != null && !name.isBlank() ? name : "enricher";
        this.assignments = Collections.unmodifiableMap(copy);
    }

    public static Enricher of(Map<String, Assignment> assignments) {
        return new Enricher(null, assignments);
    }

    public static Enricher of(String name, Map<String, Assignment> assignments) {
        return new Enricher(name, assignments);
    }

    /** Enricher whose keys are computed by plain functions of the input. */
    public static Enricher compute(Map<String, Function<? super Map<String, Object>, ?>> computations) {
        Map<String, Assignment> a = new LinkedHashMap<>();
        computations.forEach((k, fn) -> a.put(k, Assignment.function(fn)));
        return new Enricher("compute", a);
    }

    /** Enricher adding fixed values. */
    public static Enricher addMetadata(Map<String, ?> metadata) {
        Map<String, Assignment> a = new LinkedHashMap<>();
        metadata.forEach((k, v) -> a.put(k, Assignment.constant(v)));
        return new Enricher("metadata", a);
    }

    /** Copy with {@code more} added; later keys replace earlier ones. */
    public Enricher addAssignments(Map<String, Assignment> more) {
        Map<String, Assignment> copy = new LinkedHashMap<>(assignments);
        copy.putAll(more);
        return new Enricher(name, copy);
    }

    public Enricher withAssignment(String key, Assignment assignment) {
        return addAssignments(Map.of(key, assignment));
    }

    public Enricher withStage(String key, Stage<? super Map<String, Object>, ?> stage) {
        return withAssignment(key, Assignment.stage(stage));
    }

    /** Copy holding both sets of assignments; {@code other} wins on shared keys. */
    public Enricher merge(Enricher other) {
        return addAssignments(other.assignments);
    }

    public Map<String, Assignment> assignments() {
        return new LinkedHashMap<>(assignments);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Mono<Map<String, Object>> invoke(Map<String, Object> input, StageConfig config) {
        StageConfig cfg = config != null ? config : StageConfig.defaults();
        Map<String, Object> original = input != null ? input : Map.of();
        if (assignments.isEmpty()) {
            return Mono.fromCallable(() -> new LinkedHashMap<>(original));
        }
        return Mono.defer(() -> {
            ConcurrencyLimiter limiter = new ConcurrencyLimiter(cfg.concurrencyLimit());
            Map<String, Optional<Object>> values = new ConcurrentHashMap<>();
            Map<String, Throwable> errors = new ConcurrentHashMap<>();
            List<Mono<Void>> executions = assignments.entrySet().stream()
                    .map(e -> {
                        Assignment assignment = e.getValue();
                        Stage<Map<String, Object>, Object> step = assignment::apply;
                        return limiter.withPermit(() -> StepRunner.run(name, e.getKey(), step, original,
                                        cfg.withTag("assign_" + e.getKey())))
                                .doOnNext(v -> values.put(e.getKey(), v))
                                .onErrorResume(err -> !(err instanceof StageCancelledException), err -> {
                                    errors.put(e.getKey(), err);
                                    return Mono.empty();
                                })
                                .then();
                    })
                    .toList();
            return Mono.when(executions).then(Mono.fromCallable(() -> {
                if (!errors.isEmpty()) {
                    Map<String, Throwable> ordered = new LinkedHashMap<>();
                    for (String key : assignments.keySet()) {
                        if (errors.containsKey(key)) ordered.put(key, errors.get(key));
                    }
                    throw new AggregateFailureException(name, ordered, assignments.size());
                }
                Map<String, Object> out = new LinkedHashMap<>(original);
                for (String key : assignments.keySet()) {
                    out.put(key, values.get(key).orElse(null));
                }
                return out;
            }));
        });
    }

    @Override
    public String toString() {
        return "Enricher[" + name + ", keys=" + assignments.keySet() + "]";
    }
}
