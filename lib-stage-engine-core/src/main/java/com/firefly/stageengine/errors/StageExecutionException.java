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

import java.util.Optional;

/**
 * A stage failed. Wraps the original cause and identifies where it happened:
 * the pipeline step index, or the fan-out key.
 */
public class StageExecutionException extends StageEngineException {

    private final String stageName;
    private final Integer stepIndex;
    private final String stepKey;

    public StageExecutionException(String message, String stageName, Integer stepIndex, String stepKey, Throwable cause) {
        super(message, cause);
        this.stageName = stageName;
        this.stepIndex = stepIndex;
        this.stepKey = stepKey;
    }

    /** Failure of step {@code stepIndex} (0-based) of a sequential composition. */
    public static StageExecutionException atStep(String pipelineName, int stepIndex, String stepName, Throwable cause) {
        String msg = "Pipeline '" + pipelineName + "' failed at step " + stepIndex
                + " (" + stepName + "): " + describe(cause);
        return new StageExecutionException(msg, stepName, stepIndex, null, cause);
    }

    /** Failure of the named step of a keyed composition. */
    public static StageExecutionException forKey(String stageName, String key, Throwable cause) {
        String msg = "Stage '" + stageName + "' failed for key '" + key + "': " + describe(cause);
        return new StageExecutionException(msg, stageName, null, key, cause);
    }

    public String getStageName() {
        return stageName;
    }

    public Optional<Integer> getStepIndex() {
        return Optional.ofNullable(stepIndex);
    }

    public Optional<String> getStepKey() {
        return Optional.ofNullable(stepKey);
    }

    static String describe(Throwable cause) {
        if (cause == null) return "unknown error";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }
}
