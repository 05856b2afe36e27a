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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps a bounded history of stage events in memory.
 * <p>
 * Oldest entries are dropped once {@code maxEvents} is exceeded.
 */
public class InMemoryStageEvents implements StageEvents {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStageEvents.class);

    private final int maxEvents;
    private final Queue<StageEventRecord> history = new ConcurrentLinkedQueue<>();
    private final AtomicInteger size = new AtomicInteger();
    private final AtomicInteger totalEvents = new AtomicInteger();

    public InMemoryStageEvents(int maxEvents) {
        if (maxEvents < 1) {
            throw new IllegalArgumentException("maxEvents must be >= 1, was " + maxEvents);
        }
        this.maxEvents = maxEvents;
    }

    @Override
    public void onInvokeStarted(String stageName, String runId) {
        record("invoke_started", stageName, runId, null, null);
    }

    @Override
    public void onInvokeCompleted(String stageName, String runId, boolean success, long latencyMs) {
        record("invoke_completed", stageName, runId, null, "success=" + success + ", latencyMs=" + latencyMs);
    }

    @Override
    public void onStepStarted(String stageName, String runId, String stepId) {
        record("step_started", stageName, runId, stepId, null);
    }

    @Override
    public void onStepSuccess(String stageName, String runId, String stepId, long latencyMs) {
        record("step_success", stageName, runId, stepId, "latencyMs=" + latencyMs);
    }

    @Override
    public void onStepFailed(String stageName, String runId, String stepId, Throwable error, long latencyMs) {
        record("step_failed", stageName, runId, stepId, error == null ? null : error.getClass().getSimpleName() + ": " + error.getMessage());
    }

    @Override
    public void onBranchSelected(String routerName, String runId, String branchName) {
        record("branch_selected", routerName, runId, branchName, null);
    }

    @Override
    public void onRetry(String stageName, String runId, int attempt, long delayMs, Throwable error) {
        record("retry", stageName, runId, null, "attempt=" + attempt + ", delayMs=" + delayMs);
    }

    @Override
    public void onBatchCompleted(String stageName, String runId, int total, int failed, long latencyMs) {
        record("batch_completed", stageName, runId, null, "total=" + total + ", failed=" + failed);
    }

    @Override
    public void onCancelled(String stageName, String runId, String boundary) {
        record("cancelled", stageName, runId, boundary, null);
    }

    /** Snapshot of the retained events, oldest first. */
    public List<StageEventRecord> getRecentEvents() {
        return new ArrayList<>(history);
    }

    /** Retained events of the given type, oldest first. */
    public List<StageEventRecord> getEvents(String type) {
        List<StageEventRecord> out = new ArrayList<>();
        for (StageEventRecord e : history) {
            if (e.type().equals(type)) {
                out.add(e);
            }
        }
        return out;
    }

    /** Number of events received since creation or the last {@link #clearHistory()}, including dropped ones. */
    public int getTotalEventCount() {
        return totalEvents.get();
    }

    public int getMaxEvents() {
        return maxEvents;
    }

    public void clearHistory() {
        history.clear();
        size.set(0);
        totalEvents.set(0);
        log.debug("Cleared in-memory stage event history");
    }

    private void record(String type, String stage, String runId, String subject, String detail) {
        history.add(new StageEventRecord(type, stage, runId, subject, detail, Instant.now()));
        totalEvents.incrementAndGet();
        if (size.incrementAndGet() > maxEvents) {
            if (history.poll() != null) {
                size.decrementAndGet();
            }
        }
    }

    /**
     * A single retained event. {@code subject} is the step id, branch name or cancellation
     * boundary depending on the type.
     */
    public record StageEventRecord(String type, String stageName, String runId, String subject,
                                   String detail, Instant timestamp) {
    }
}
