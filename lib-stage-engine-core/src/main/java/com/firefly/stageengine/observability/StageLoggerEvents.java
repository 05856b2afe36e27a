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

/**
 * Default {@link StageEvents} implementation that emits JSON-friendly logs via SLF4J.
 */
public class StageLoggerEvents implements StageEvents {
    private static final Logger log = LoggerFactory.getLogger(StageLoggerEvents.class);

    @Override
    public void onInvokeStarted(String stageName, String runId) {
        log.info(JsonUtils.json(
                "stage_event", "invoke_started",
                "stage", stageName,
                "runId", runId
        ));
    }

    @Override
    public void onInvokeCompleted(String stageName, String runId, boolean success, long latencyMs) {
        log.info(JsonUtils.json(
                "stage_event", "invoke_completed",
                "stage", stageName,
                "runId", runId,
                "success", Boolean.toString(success),
                "latencyMs", Long.toString(latencyMs)
        ));
    }

    @Override
    public void onStepStarted(String stageName, String runId, String stepId) {
        log.debug(JsonUtils.json(
                "stage_event", "step_started",
                "stage", stageName,
                "runId", runId,
                "stepId", stepId
        ));
    }

    @Override
    public void onStepSuccess(String stageName, String runId, String stepId, long latencyMs) {
        log.debug(JsonUtils.json(
                "stage_event", "step_success",
                "stage", stageName,
                "runId", runId,
                "stepId", stepId,
                "latencyMs", Long.toString(latencyMs)
        ));
    }

    @Override
    public void onStepFailed(String stageName, String runId, String stepId, Throwable error, long latencyMs) {
        log.warn(JsonUtils.json(
                "stage_event", "step_failed",
                "stage", stageName,
                "runId", runId,
                "stepId", stepId,
                "latencyMs", Long.toString(latencyMs),
                "error_class", error != null ? error.getClass().getName() : "",
                "error_msg", JsonUtils.safeString(error != null ? error.getMessage() : "", 500)
        ));
    }

    @Override
    public void onBranchSelected(String routerName, String runId, String branchName) {
        log.info(JsonUtils.json(
                "stage_event", "branch_selected",
                "stage", routerName,
                "runId", runId,
                "branch", branchName
        ));
    }

    @Override
    public void onRetry(String stageName, String runId, int attempt, long delayMs, Throwable error) {
        log.info(JsonUtils.json(
                "stage_event", "retry",
                "stage", stageName,
                "runId", runId,
                "attempt", Integer.toString(attempt),
                "delayMs", Long.toString(delayMs),
                "error_class", error != null ? error.getClass().getName() : "",
                "error_msg", JsonUtils.safeString(error != null ? error.getMessage() : "", 500)
        ));
    }

    @Override
    public void onBatchCompleted(String stageName, String runId, int total, int failed, long latencyMs) {
        log.info(JsonUtils.json(
                "stage_event", "batch_completed",
                "stage", stageName,
                "runId", runId,
                "total", Integer.toString(total),
                "failed", Integer.toString(failed),
                "latencyMs", Long.toString(latencyMs)
        ));
    }

    @Override
    public void onCancelled(String stageName, String runId, String boundary) {
        log.warn(JsonUtils.json(
                "stage_event", "cancelled",
                "stage", stageName,
                "runId", runId,
                "boundary", boundary
        ));
    }
}
