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

import com.firefly.stageengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates {@link Condition}s and builds composite ones.
 * <p>
 * {@link #evaluate} never fails: an error while evaluating is logged at debug level and the
 * condition counts as not matched. An empty result also counts as {@code false}.
 */
public final class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private ConditionEvaluator() {}

    public static <I> Mono<Boolean> evaluate(I input, Condition<? super I> condition) {
        if (condition == null) {
            return Mono.just(false);
        }
        return Mono.defer(() -> condition.test(input))
                .map(Boolean.TRUE::equals)
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.debug(JsonUtils.json(
                            "stage_event", "condition_error",
                            "condition", JsonUtils.summarize(condition, 200),
                            "error_class", e.getClass().getName(),
                            "error_msg", JsonUtils.safeString(e.getMessage(), 300)
                    ));
                    return Mono.just(false);
                });
    }

    /** True when every condition holds; stops at the first false. Evaluated in order. */
    @SafeVarargs
    public static <I> Condition<I> and(Condition<? super I>... conditions) {
        List<Condition<? super I>> all = List.of(conditions);
        return input -> Flux.fromIterable(all)
                .concatMap(c -> evaluate(input, c))
                .all(Boolean::booleanValue);
    }

    /** True when any condition holds; stops at the first true. Evaluated in order. */
    @SafeVarargs
    public static <I> Condition<I> or(Condition<? super I>... conditions) {
        List<Condition<? super I>> all = List.of(conditions);
        return input -> Flux.fromIterable(all)
                .concatMap(c -> evaluate(input, c))
                .any(Boolean::booleanValue);
    }

    public static <I> Condition<I> not(Condition<? super I> condition) {
        Objects.requireNonNull(condition, "condition");
        return input -> evaluate(input, condition).map(b -> !b);
    }

    /** Resolved value equals {@code expected}; numbers compare by value. */
    public static <I> Condition<I> equals(String path, Object expected) {
        return input -> Mono.fromCallable(() -> sameValue(PathResolver.resolve(input, path), expected));
    }

    /**
     * Resolved collection, array or map key set contains {@code expected}, or the resolved
     * string contains {@code String.valueOf(expected)}.
     */
    public static <I> Condition<I> contains(String path, Object expected) {
        return input -> Mono.fromCallable(() -> containsValue(PathResolver.resolve(input, path), expected));
    }

    /** Resolved value is numeric and within {@code [min, max]}. */
    public static <I> Condition<I> inRange(String path, Number min, Number max) {
        BigDecimal lo = toDecimal(Objects.requireNonNull(min, "min"));
        BigDecimal hi = toDecimal(Objects.requireNonNull(max, "max"));
        return input -> Mono.fromCallable(() -> {
            BigDecimal v = toDecimal(PathResolver.resolve(input, path));
            return v != null && lo != null && hi != null && v.compareTo(lo) >= 0 && v.compareTo(hi) <= 0;
        });
    }

    static boolean sameValue(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            BigDecimal a = toDecimal(actual);
            BigDecimal b = toDecimal(expected);
            return a != null && b != null && a.compareTo(b) == 0;
        }
        return Objects.equals(actual, expected);
    }

    private static boolean containsValue(Object container, Object expected) {
        if (container == null) return false;
        if (container instanceof CharSequence s) {
            return s.toString().contains(String.valueOf(expected));
        }
        if (container instanceof Collection<?> c) {
            for (Object o : c) {
                if (sameValue(o, expected)) return true;
            }
            return false;
        }
        if (container instanceof Map<?, ?> m) {
            return m.containsKey(expected);
        }
        if (container.getClass().isArray()) {
            int n = Array.getLength(container);
            for (int i = 0; i < n; i++) {
                if (sameValue(Array.get(container, i), expected)) return true;
            }
        }
        return false;
    }

    private static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal d) return d;
        if (value instanceof Number n) {
            double dv = n.doubleValue();
            if (Double.isNaN(dv) || Double.isInfinite(dv)) return null;
            if (value instanceof Double || value instanceof Float) return BigDecimal.valueOf(dv);
            return new BigDecimal(n.toString());
        }
        return null;
    }
}
