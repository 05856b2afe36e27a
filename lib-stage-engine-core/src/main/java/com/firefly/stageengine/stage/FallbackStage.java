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

package com.firefly.stageengine.stage;

import com.firefly.stageengine.core.Stage;
import com.firefly.stageengine.core.StageConfig;
import com.firefly.stageengine.errors.StageCancelledException;
import com.firefly.stageengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.Function;

/**
 * Replaces a failure of the primary stage with the fallback stage's result. The fallback receives
 * the original input. Cancellation is passed through unchanged.
 */
public final class FallbackStage<I, O> implements Stage<I, O> {

    private static final Logger log = LoggerFactory.getLogger(FallbackStage.class);

    private final Stage<I, O> primary;
    private final Function<Throwable, ? extends Stage<I, O>> fallback;

    public FallbackStage(Stage<I, O> primary, Stage<I, O> fallback) {
        this(primary, err -> fallback);
        Objects.requireNonNull(fallback, "fallback");
    }

    /** Fallback chosen from the primary's error. */
    public FallbackStage(Stage<I, O> primary, Function<Throwable, ? extends Stage<I, O>> fallback) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    @Override
    public String name() {
        return primary.name();
    }

    @Override
    public Mono<O> invoke(I input, StageConfig config) {
        StageConfig cfg = config != null ? config : StageConfig.defaults();
        return primary.invoke(input, cfg)
                .onErrorResume(err -> !(err instanceof StageCancelledException), err -> {
                    log.info(JsonUtils.json(
                            "stage_event", "fallback",
                            "stage", name(),
                            "runId", cfg.runId(),
                            "error_class", err.getClass().getName(),
                            "error_msg", JsonUtils.safeString(err.getMessage(), 500)
                    ));
                    return fallback.apply(err).invoke(input, cfg);
                });
    }
}
