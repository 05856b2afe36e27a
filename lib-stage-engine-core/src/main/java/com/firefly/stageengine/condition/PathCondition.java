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

/**
 * Condition over a dotted path, parsed once at construction.
 */
public final class PathCondition<I> implements Condition<I> {

    private final String expression;
    private final String path;
    private final String expected;

    public PathCondition(String expression) {
        Objects.requireNonNull(expression, "expression");
        this.expression = expression;
        int eq = expression.indexOf('=');
        if (eq >= 0) {
            this.path = expression.substring(0, eq).trim();
            this.expected = expression.substring(eq + 1).trim();
        } else {
            this.path = expression.trim();
            this.expected = null;
        }
    }

    public String path() {
        return path;
    }

    /** Literal to compare against, or {@code null} for a truthiness test. */
    public String expected() {
        return expected;
    }

    @Override
    public Mono<Boolean> test(I input) {
        return Mono.fromCallable(() -> {
            Object value = PathResolver.resolve(input, path);
            if (expected == null) {
                return PathResolver.isTruthy(value);
            }
            return value != null && String.valueOf(value).equals(expected);
        });
    }

    @Override
    public String toString() {
        return "path(" + expression + ")";
    }
}
