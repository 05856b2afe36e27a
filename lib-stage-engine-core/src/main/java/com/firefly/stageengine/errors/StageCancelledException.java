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

/**
 * Invocation stopped at a boundary because the cancellation token was set.
 * Not a failure of any stage; callers should not retry on it.
 */
public class StageCancelledException extends StageEngineException {

    private final String boundary;
    private final String reason;

    public StageCancelledException(String boundary, String reason) {
        super("Execution was cancelled at " + boundary + (reason != null ? ": " + reason : ""));
        this.boundary = boundary;
        this.reason = reason;
    }

    public String getBoundary() {
        return boundary;
    }

    public String getReason() {
        return reason;
    }
}
