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

package com.firefly.stageengine.core;

import com.firefly.stageengine.errors.StageCancelledException;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag shared by reference through a call tree.
 * Composites poll it at boundaries (between steps, before chunks); work already started is
 * never interrupted.
 */
public final class CancellationToken {

    private static final String NO_REASON = "";

    private final AtomicReference<String> reason = new AtomicReference<>();

    public void cancel() {
        cancel(NO_REASON);
    }

    /** Sets the flag. Only the first reason is kept. */
    public void cancel(String reason) {
        this.reason.compareAndSet(null, reason != null ? reason : NO_REASON);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /** Reason given to the first {@link #cancel(String)}, or {@code null} when not cancelled or none was given. */
    public String reason() {
        String r = reason.get();
        return r == null || r.isEmpty() ? null : r;
    }

    public void throwIfCancelled(String boundary) {
        if (isCancelled()) {
            throw new StageCancelledException(boundary, reason());
        }
    }
}
