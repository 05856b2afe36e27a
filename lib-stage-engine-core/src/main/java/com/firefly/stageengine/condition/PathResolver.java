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

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves dotted paths such as {@code customer.address.city} or {@code items.0.sku} against
 * maps, lists, arrays, records and JavaBeans. A missing segment resolves to {@code null}.
 * Accessors are looked up once per class and member name and cached.
 */
public final class PathResolver {

    @FunctionalInterface
    private interface Accessor {
        Object read(Object target) throws ReflectiveOperationException;
    }

    private static final Accessor MISSING = t -> null;
    private static final Map<Class<?>, Map<String, Accessor>> accessorCache = new ConcurrentHashMap<>();

    private PathResolver() {}

    /** Value at {@code path}; a blank path resolves to the root itself. */
    public static Object resolve(Object root, String path) {
        if (path == null || path.isBlank()) {
            return root;
        }
        Object current = root;
        for (String segment : path.trim().split("\\.")) {
            if (current == null) {
                return null;
            }
            current = step(current, segment);
        }
        return current;
    }

    private static Object step(Object target, String segment) {
        if (target instanceof Optional<?> opt) {
            target = opt.orElse(null);
            if (target == null) return null;
        }
        if (target instanceof Map<?, ?> m) {
            return m.get(segment);
        }
        if (target instanceof List<?> list) {
            Integer idx = parseIndex(segment);
            return idx != null && idx < list.size() ? list.get(idx) : null;
        }
        if (target.getClass().isArray()) {
            Integer idx = parseIndex(segment);
            return idx != null && idx < Array.getLength(target) ? Array.get(target, idx) : null;
        }
        Class<?> type = target.getClass();
        Accessor accessor = accessorCache
                .computeIfAbsent(type, c -> new ConcurrentHashMap<>())
                .computeIfAbsent(segment, s -> compile(type, s));
        try {
            return accessor.read(target);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Accessor for '" + segment + "' on " + type.getName() + " failed", cause);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot read '" + segment + "' on " + type.getName(), e);
        }
    }

    private static Accessor compile(Class<?> type, String name) {
        if (type.isRecord()) {
            for (RecordComponent rc : type.getRecordComponents()) {
                if (rc.getName().equals(name)) {
                    Method m = rc.getAccessor();
                    m.trySetAccessible();
                    return m::invoke;
                }
            }
        }
        String cap = name.isEmpty() ? name : Character.toUpperCase(name.charAt(0)) + name.substring(1);
        for (String candidate : new String[]{"get" + cap, "is" + cap}) {
            Method m = publicNoArg(type, candidate);
            if (m != null) {
                return m::invoke;
            }
        }
        for (Field f : type.getFields()) {
            if (f.getName().equals(name) && !Modifier.isStatic(f.getModifiers())) {
                return f::get;
            }
        }
        return MISSING;
    }

    private static Method publicNoArg(Class<?> type, String name) {
        try {
            Method m = type.getMethod(name);
            if (Modifier.isStatic(m.getModifiers()) || m.getReturnType() == void.class) {
                return null;
            }
            // public method on a non-public class
            m.trySetAccessible();
            return m;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static Integer parseIndex(String segment) {
        try {
            int i = Integer.parseInt(segment);
            return i >= 0 ? i : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Falsy values: {@code null}, {@code false}, numeric zero, empty string, empty collection,
     * empty map, empty array and empty {@code Optional}. Everything else is truthy.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0.0;
        if (value instanceof CharSequence s) return s.length() > 0;
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        if (value instanceof Optional<?> o) return o.isPresent();
        if (value.getClass().isArray()) return Array.getLength(value) > 0;
        return true;
    }
}
