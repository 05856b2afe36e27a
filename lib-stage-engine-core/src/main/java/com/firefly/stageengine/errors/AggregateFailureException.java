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

package com.firefly.stageengine.errors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Several independent branches failed in the same invocation. Lists every failing branch
 * (fan-out key, assignment name or item index) with its cause. The first failure is kept
 * as the cause; the others are attached as suppressed exceptions.
 */
public class AggregateFailureException extends StageEngineException {

    private final Map<String, Throwable> failures;
    private final int total;

    public AggregateFailureException(String stageName, Map<String, Throwable> failures, int total) {
        super(buildMessage(stageName, failures, total), first(failures));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.total = total;
        boolean skip = true;
        for (Throwable t : failures.values()) {
            if (skip) { skip = false; continue; }
            if (t != null) addSuppressed(t);
        }
    }

    /** Failing branch identifiers mapped to their causes, in discovery order. */
    public Map<String, Throwable> getFailures() {
        return failures;
    }

    public int getFailedCount() {
        return failures.size();
    }

    public int getTotal() {
        return total;
    }

    private static Throwable first(Map<String, Throwable> failures) {
        return failures.isEmpty() ? null : failures.values().iterator().next();
    }

    private static String buildMessage(String stageName, Map<String, Throwable> failures, int total) {
        String details = failures.entrySet().stream()
                .map(e -> e.getKey() + ": " + StageExecutionException.describe(e.getValue()))
                .collect(Collectors.joining("; "));
        return "Stage '" + stageName + "' failed: " + failures.size() + "/" + total + " items failed [" + details + "]";
    }
}
