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

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * How an {@link Enricher} computes one key: a stage, a function or a constant.
 * Every variant receives the original, unmodified input.
 */
@FunctionalInterface
public interface Assignment {

    Mono<Object> apply(Map<String, Object> input, StageConfig config);

    @SuppressWarnings("unchecked")
    static Assignment stage(Stage<? super Map<String, Object>, ?> stage) {
        Objects.requireNonNull(stage, "stage");
        Stage<Map<String, Object>, Object> s = (Stage<Map<String, Object>, Object>) stage;
        return s::invoke;
    }

    static Assignment function(Function<? super Map<String, Object>, ?> fn) {
        Objects.requireNonNull(fn, "fn");
        return (input, config) -> Mono.fromCallable(() -> fn.apply(input));
    }

    static Assignment async(Function<? super Map<String, Object>, ? extends Mono<?>> fn) {
        Objects.requireNonNull(fn, "fn");
        return (input, config) -> Mono.defer(() -> fn.apply(input)).cast(Object.class);
    }

    static Assignment constant(Object value) {
        return (input, config) -> Mono.justOrEmpty(value);
    }
}
