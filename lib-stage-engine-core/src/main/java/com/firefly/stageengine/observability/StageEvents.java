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

package com.firefly.stageengine.observability;

/**
 * Observability hooks for stage execution. Implement to integrate with logging, metrics or tracing.
 * Every method has a no-op default so sinks only override what they care about.
 */
public interface StageEvents {

    /** Shared no-op sink. */
    StageEvents NOOP = new StageEvents() {};

    default void onInvokeStarted(String stageName, String runId) {}
    default void onInvokeCompleted(String stageName, String runId, boolean success, long latencyMs) {}

    /** Invoked when a child step of a composite starts. */
    default void onStepStarted(String stageName, String runId, String stepId) {}
    default void onStepSuccess(String stageName, String runId, String stepId, long latencyMs) {}
    default void onStepFailed(String stageName, String runId, String stepId, Throwable error, long latencyMs) {}

    default void onBranchSelected(String routerName, String runId, String branchName) {}

    /** Invoked before retry {@code attempt} (1-based) is scheduled. */
    default void onRetry(String stageName, String runId, int attempt, long delayMs, Throwable error) {}

    default void onBatchCompleted(String stageName, String runId, int total, int failed, long latencyMs) {}

    default void onCancelled(String stageName, String runId, String boundary) {}
}
