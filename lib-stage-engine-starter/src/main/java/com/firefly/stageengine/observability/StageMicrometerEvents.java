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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer-based implementation of {@link StageEvents}.
 * <p>
 * Meter names:
 * <ul>
 *   <li>stage.invoke.started / stage.invoke.completed (tags: stage, success)</li>
 *   <li>stage.invoke.latency timer (tags: stage, success)</li>
 *   <li>stage.step.started / stage.step.succeeded / stage.step.failed (tags: stage, step)</li>
 *   <li>stage.step.latency timer (tags: stage, step, success)</li>
 *   <li>stage.branch.selected (tags: router, branch)</li>
 *   <li>stage.retry (tags: stage) and stage.retry.delay summary</li>
 *   <li>stage.batch.items / stage.batch.failed.items summaries and stage.batch.latency timer</li>
 *   <li>stage.cancelled (tags: stage, boundary)</li>
 * </ul>
 */
public class StageMicrometerEvents implements StageEvents {

    private final MeterRegistry registry;

    public StageMicrometerEvents(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onInvokeStarted(String stageName, String runId) {
        counter("stage.invoke.started", Tags.of(Tag.of("stage", stageName))).increment();
    }

    @Override
    public void onInvokeCompleted(String stageName, String runId, boolean success, long latencyMs) {
        Tags tags = Tags.of(Tag.of("stage", stageName), Tag.of("success", Boolean.toString(success)));
        counter("stage.invoke.completed", tags).increment();
        Timer.builder("stage.invoke.latency").tags(tags).register(registry).record(Duration.ofMillis(latencyMs));
    }

    @Override
    public void onStepStarted(String stageName, String runId, String stepId) {
        counter("stage.step.started", stepTags(stageName, stepId)).increment();
    }

    @Override
    public void onStepSuccess(String stageName, String runId, String stepId, long latencyMs) {
        Tags tags = stepTags(stageName, stepId);
        counter("stage.step.succeeded", tags).increment();
        Timer.builder("stage.step.latency").tags(tags.and("success", "true")).register(registry)
                .record(Duration.ofMillis(latencyMs));
    }

    @Override
    public void onStepFailed(String stageName, String runId, String stepId, Throwable error, long latencyMs) {
        Tags tags = stepTags(stageName, stepId);
        counter("stage.step.failed", tags).increment();
        Timer.builder("stage.step.latency").tags(tags.and("success", "false")).register(registry)
                .record(Duration.ofMillis(latencyMs));
    }

    @Override
    public void onBranchSelected(String routerName, String runId, String branchName) {
        counter("stage.branch.selected", Tags.of(Tag.of("router", routerName), Tag.of("branch", branchName))).increment();
    }

    @Override
    public void onRetry(String stageName, String runId, int attempt, long delayMs, Throwable error) {
        Tags tags = Tags.of(Tag.of("stage", stageName));
        counter("stage.retry", tags).increment();
        DistributionSummary.builder("stage.retry.delay").baseUnit("milliseconds").tags(tags)
                .register(registry).record(delayMs);
    }

    @Override
    public void onBatchCompleted(String stageName, String runId, int total, int failed, long latencyMs) {
        Tags tags = Tags.of(Tag.of("stage", stageName));
        DistributionSummary.builder("stage.batch.items").tags(tags).register(registry).record(total);
        DistributionSummary.builder("stage.batch.failed.items").tags(tags).register(registry).record(failed);
        Timer.builder("stage.batch.latency").tags(tags).register(registry).record(Duration.ofMillis(latencyMs));
    }

    @Override
    public void onCancelled(String stageName, String runId, String boundary) {
        counter("stage.cancelled", Tags.of(Tag.of("stage", stageName), Tag.of("boundary", boundary))).increment();
    }

    private Counter counter(String name, Tags tags) {
        return registry.counter(name, tags);
    }

    private static Tags stepTags(String stageName, String stepId) {
        return Tags.of(Tag.of("stage", stageName), Tag.of("step", stepId));
    }
}
