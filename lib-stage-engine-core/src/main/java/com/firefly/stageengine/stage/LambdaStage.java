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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Stage backed by a function. Synchronous functions run on subscription; a {@code null} return
 * is an absent value. Exceptions thrown by the function surface as errors of the returned
 * {@code Mono}.
 */
public final class LambdaStage<I, O> implements Stage<I, O> {

    private final String name;
    private final BiFunction<? super I, StageConfig, ? extends Mono<O>> body;

    private LambdaStage(String name, BiFunction<? super I, StageConfig, ? extends Mono<O>> body) {
        this.name = name != null && !name.isBlank() ? name : "lambda";
        this.body = Objects.requireNonNull(body, "body");
    }

    public static <I, O> LambdaStage<I, O> of(Function<? super I, ? extends O> fn) {
        return of("lambda", fn);
    }

    public static <I, O> LambdaStage<I, O> of(String name, Function<? super I, ? extends O> fn) {
        Objects.requireNonNull(fn, "fn");
        return new LambdaStage<>(name, (in, cfg) -> Mono.fromCallable(() -> fn.apply(in)));
    }

    /** Function that also receives the call's config. */
    public static <I, O> LambdaStage<I, O> withConfig(String name, BiFunction<? super I, StageConfig, ? extends O> fn) {
        Objects.requireNonNull(fn, "fn");
        return new LambdaStage<>(name, (in, cfg) -> Mono.fromCallable(() -> fn.apply(in, cfg)));
    }

    public static <I, O> LambdaStage<I, O> async(Function<? super I, ? extends Mono<O>> fn) {
        return async("lambda", fn);
    }

    public static <I, O> LambdaStage<I, O> async(String name, Function<? super I, ? extends Mono<O>> fn) {
        Objects.requireNonNull(fn, "fn");
        return new LambdaStage<>(name, (in, cfg) -> fn.apply(in));
    }

    public static <I> LambdaStage<I, I> identity() {
        return new LambdaStage<>("identity", (in, cfg) -> Mono.justOrEmpty(in));
    }

    /** Applies {@code fn} to every element of a list input. */
    public static <T, R> LambdaStage<List<T>, List<R>> map(Function<? super T, ? extends R> fn) {
        Objects.requireNonNull(fn, "fn");
        return of("map", list -> {
            List<R> out = new ArrayList<>(list.size());
            for (T item : list) {
                out.add(fn.apply(item));
            }
            return out;
        });
    }

    public static <T> LambdaStage<List<T>, List<T>> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return of("filter", list -> {
            List<T> out = new ArrayList<>();
            for (T item : list) {
                if (predicate.test(item)) out.add(item);
            }
            return out;
        });
    }

    /** Folds a list input starting from {@code initial}. */
    public static <T, R> LambdaStage<List<T>, R> reduce(R initial, BiFunction<R, ? super T, R> accumulator) {
        Objects.requireNonNull(accumulator, "accumulator");
        return of("reduce", list -> {
            R acc = initial;
            for (T item : list) {
                acc = accumulator.apply(acc, item);
            }
            return acc;
        });
    }

    public static <T> LambdaStage<List<T>, T> reduce(BinaryOperator<T> accumulator) {
        Objects.requireNonNull(accumulator, "accumulator");
        return of("reduce", list -> list.stream().reduce(accumulator).orElse(null));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Mono<O> invoke(I input, StageConfig config) {
        return Mono.defer(() -> body.apply(input, config));
    }

    @Override
    public String toString() {
        return "LambdaStage[" + name + "]";
    }
}
