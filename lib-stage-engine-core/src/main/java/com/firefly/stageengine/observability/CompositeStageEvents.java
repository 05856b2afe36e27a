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

import com.firefly.stageengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Fans every event out to a list of delegates. A delegate that throws is logged and skipped;
 * it never affects the other delegates or the execution being observed.
 */
public class CompositeStageEvents implements StageEvents {
    private static final Logger log = LoggerFactory.getLogger(CompositeStageEvents.class);

    private final List<StageEvents> delegates;

    public CompositeStageEvents(List<StageEvents> delegates) {
        this.delegates = List.copyOf(Objects.requireNonNull(delegates, "delegates"));
    }

    public List<StageEvents> getDelegates() {
        return delegates;
    }

    private void each(String event, Consumer<StageEvents> call) {
        for (StageEvents d : delegates) {
            try {
                call.accept(d);
            } catch (RuntimeException e) {
                log.warn(JsonUtils.json(
                        "stage_event", "sink_error",
                        "event", event,
                        "sink", d.getClass().getName(),
                        "error_class", e.getClass().getName(),
                        "error_msg", JsonUtils.safeString(e.getMessage(), 300)
                ));
            }
        }
    }

    @Override
    public void onInvokeStarted(String stageName, String runId) {
        each("invoke_started", d -> d.onInvokeStarted(stageName, runId));
    }

    @Override
    public void onInvokeCompleted(String stageName, String runId, boolean success, long latencyMs) {
        each("invoke_completed", d -> d.onInvokeCompleted(stageName, runId, success, latencyMs));
    }

    @Override
    public void onStepStarted(String stageName, String runId, String stepId) {
        each("step_started", d -> d.onStepStarted(stageName, runId, stepId));
    }

    @Override
    public void onStepSuccess(String stageName, String runId, String stepId, long latencyMs) {
        each("step_success", d -> d.onStepSuccess(stageName, runId, stepId, latencyMs));
    }

    @Override
    public void onStepFailed(String stageName, String runId, String stepId, Throwable error, long latencyMs) {
        each("step_failed", d -> d.onStepFailed(stageName, runId, stepId, error, latencyMs));
    }

    @Override
    public void onBranchSelected(String routerName, String runId, String branchName) {
        each("branch_selected", d -> d.onBranchSelected(routerName, runId, branchName));
    }

    @Override
    public void onRetry(String stageName, String runId, int attempt, long delayMs, Throwable error) {
        each("retry", d -> d.onRetry(stageName, runId, attempt, delayMs, error));
    }

    @Override
    public void onBatchCompleted(String stageName, String runId, int total, int failed, long latencyMs) {
        each("batch_completed", d -> d.onBatchCompleted(stageName, runId, total, failed, latencyMs));
    }

    @Override
    public void onCancelled(String stageName, String runId, String boundary) {
        each("cancelled", d -> d.onCancelled(stageName, runId, boundary));
    }
}
