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

package com.firefly.stageengine.engine;

import com.firefly.stageengine.core.CancellationToken;
import com.firefly.stageengine.core.ItemOutcome;
import com.firefly.stageengine.core.Stage;
import com.firefly.stageengine.core.StageConfig;
import com.firefly.stageengine.errors.StageCancelledException;
import com.firefly.stageengine.observability.StageEvents;
import com.firefly.stageengine.observability.StageLoggerEvents;
import com.firefly.stageengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for running stage graphs.
 * <p>
 * Holds the default {@link StageConfig} and the {@link StageEvents} sink. Every run gets a fresh
 * run id and its own cancellation token unless one is supplied, and is bracketed by
 * {@code onInvokeStarted}/{@code onInvokeCompleted} events.
 */
public class StageEngine {

    private static final Logger log = LoggerFactory.getLogger(StageEngine.class);

    private final StageConfig defaults;
    private final StageEvents events;

    public StageEngine() {
        this(StageConfig.defaults(), new StageLoggerEvents());
    }

    public StageEngine(StageConfig defaults, StageEvents events) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        this.events = events != null ? events : StageEvents.NOOP;
    }

    public StageConfig defaults() {
        return defaults;
    }

    public StageEvents events() {
        return events;
    }

    /** Config for a new run: the defaults with a fresh run id, a fresh token and this engine's events. */
    public StageConfig newRunConfig() {
        return newRunConfig(new CancellationToken());
    }

    public StageConfig newRunConfig(CancellationToken token) {
        return defaults.toBuilder()
                .runId(UUID.randomUUID().toString())
                .cancellationToken(token != null ? token : new CancellationToken())
                .events(events)
                .build();
    }

    public <I, O> Mono<O> invoke(Stage<I, O> stage, I input) {
        return invoke(stage, input, newRunConfig());
    }

    public <I, O> Mono<O> invoke(Stage<I, O> stage, I input, StageConfig config) {
        Objects.requireNonNull(stage, "stage");
        return Mono.defer(() -> {
            StageConfig cfg = config != null ? config : newRunConfig();
            return bracket(stage.name(), cfg, "invoke", stage.invoke(input, cfg));
        });
    }

    public <I, O> Mono<List<O>> batch(Stage<I, O> stage, List<I> inputs) {
        return batch(stage, inputs, newRunConfig());
    }

    public <I, O> Mono<List<O>> batch(Stage<I, O> stage, List<I> inputs, StageConfig config) {
        Objects.requireNonNull(stage, "stage");
        return Mono.defer(() -> {
            StageConfig cfg = config != null ? config : newRunConfig();
            return bracket(stage.name(), cfg, "batch", stage.batch(inputs, cfg));
        });
    }

    public <I, O> Mono<List<ItemOutcome<O>>> batchSettled(Stage<I, O> stage, List<I> inputs) {
        return batchSettled(stage, inputs, newRunConfig());
    }

    public <I, O> Mono<List<ItemOutcome<O>>> batchSettled(Stage<I, O> stage, List<I> inputs, StageConfig config) {
        Objects.requireNonNull(stage, "stage");
        return Mono.defer(() -> {
            StageConfig cfg = config != null ? config : newRunConfig();
            return bracket(stage.name(), cfg, "batch_settled", stage.batchSettled(inputs, cfg));
        });
    }

    public <I, O> Flux<O> stream(Stage<I, O> stage, I input) {
        return stream(stage, input, newRunConfig());
    }

    public <I, O> Flux<O> stream(Stage<I, O> stage, I input, StageConfig config) {
        Objects.requireNonNull(stage, "stage");
        return Flux.defer(() -> {
            StageConfig cfg = config != null ? config : newRunConfig();
            String name = stage.name();
            long start = System.currentTimeMillis();
            AtomicBoolean failed = new AtomicBoolean(false);
            started(name, cfg, "stream");
            return stage.stream(input, cfg)
                    .doOnError(err -> {
                        failed.set(true);
                        failed(name, cfg, err);
                    })
                    .doFinally(signal -> completed(name, cfg, signal == SignalType.ON_COMPLETE && !failed.get(), start));
        });
    }

    private <T> Mono<T> bracket(String name, StageConfig cfg, String mode, Mono<T> execution) {
        long start = System.currentTimeMillis();
        started(name, cfg, mode);
        return execution
                .doOnError(err -> failed(name, cfg, err))
                .doFinally(signal -> completed(name, cfg, signal == SignalType.ON_COMPLETE, start));
    }

    private void started(String name, StageConfig cfg, String mode) {
        events.onInvokeStarted(name, cfg.runId());
        if (log.isDebugEnabled()) {
            log.debug(JsonUtils.json(
                    "stage_event", "run_config",
                    "stage", name,
                    "runId", cfg.runId(),
                    "mode", mode,
                    "concurrencyLimit", Integer.toString(cfg.concurrencyLimit()),
                    "batchSize", Integer.toString(cfg.batchSize()),
                    "preserveOrder", Boolean.toString(cfg.preserveOrder()),
                    "tags", String.join(",", cfg.tags())
            ));
        }
    }

    private void failed(String name, StageConfig cfg, Throwable err) {
        if (err instanceof StageCancelledException cancelled) {
            log.info(JsonUtils.json(
                    "stage_event", "run_cancelled",
                    "stage", name,
                    "runId", cfg.runId(),
                    "boundary", cancelled.getBoundary(),
                    "reason", cancelled.getReason()
            ));
            return;
        }
        log.warn(JsonUtils.json(
                "stage_event", "run_failed",
                "stage", name,
                "runId", cfg.runId(),
                "error_class", err.getClass().getName(),
                "error_msg", JsonUtils.safeString(err.getMessage(), 500)
        ));
    }

    private void completed(String name, StageConfig cfg, boolean success, long start) {
        events.onInvokeCompleted(name, cfg.runId(), success, System.currentTimeMillis() - start);
    }
}
