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
import com.firefly.stageengine.observability.StageEvents;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Runs one child step of a composite, reporting start, success and failure with latency.
 * Results are wrapped in {@code Optional} so absent values survive operator chains.
 */
final class StepRunner {

    private StepRunner() {}

    @SuppressWarnings({"unchecked", "rawtypes"})
    static Mono<Optional<Object>> run(String owner, String stepId, Stage step, Object input, StageConfig cfg) {
        return Mono.defer(() -> {
            StageEvents events = cfg.events();
            events.onStepStarted(owner, cfg.runId(), stepId);
            final long start = System.currentTimeMillis();
            Mono<Object> execution = step.invoke(input, cfg);
            return execution
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .doOnSuccess(v -> events.onStepSuccess(owner, cfg.runId(), stepId, System.currentTimeMillis() - start))
                    .doOnError(err -> events.onStepFailed(owner, cfg.runId(), stepId, err, System.currentTimeMillis() - start));
        });
    }

    static int outerConcurrency(StageConfig cfg, int items, int cap) {
        if (cfg.batchConcurrency() > 0) {
            return cfg.batchConcurrency();
        }
        return Math.max(1, Math.min(items, cap));
    }
}
