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

package com.firefly.stageengine.condition;

import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Boolean test over a stage input, possibly asynchronous.
 * <p>
 * Conditions are evaluated through {@link ConditionEvaluator#evaluate}, which turns any error
 * into {@code false}. Implementations may therefore throw or emit errors freely.
 */
@FunctionalInterface
public interface Condition<I> {

    Mono<Boolean> test(I input);

    static <I> Condition<I> predicate(Predicate<? super I> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return input -> Mono.fromCallable(() -> predicate.test(input));
    }

    static <I> Condition<I> asyncPredicate(Function<? super I, ? extends Mono<Boolean>> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return input -> Mono.defer(() -> predicate.apply(input));
    }

    /**
     * Path expression. {@code a.b=value} compares the resolved value's string form with
     * {@code value}; a plain {@code a.b} tests the truthiness of the resolved value.
     */
    static <I> Condition<I> path(String expression) {
        return new PathCondition<>(expression);
    }

    /** Regex searched anywhere in {@code String.valueOf(input)}. */
    static <I> Condition<I> pattern(Pattern pattern) {
        return new PatternCondition<>(pattern);
    }

    static <I> Condition<I> pattern(String regex) {
        return new PatternCondition<>(Pattern.compile(regex));
    }

    static <I> Condition<I> always() {
        return input -> Mono.just(true);
    }
}
