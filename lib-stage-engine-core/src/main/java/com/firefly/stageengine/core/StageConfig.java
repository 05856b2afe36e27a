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

import com.firefly.stageengine.observability.StageEvents;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable per-call configuration threaded through every stage invocation.
 * <p>
 * Composites derive child configs with the {@code with*} methods (typically adding a tag such as
 * {@code step:1}); the parent is never mutated. The cancellation token and the events sink are
 * shared by reference across the whole call tree.
 */
public final class StageConfig {

    private final int concurrencyLimit;
    private final int batchSize;
    private final boolean preserveOrder;
    private final int batchConcurrency;
    private final int streamBatchSize;
    private final boolean throwOnError;
    private final List<String> tags;
    private final CancellationToken cancellationToken;
    private final StageEvents events;
    private final String runId;

    private StageConfig(Builder b) {
        if (b.concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1 but was " + b.concurrencyLimit);
        }
        if (b.batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1 but was " + b.batchSize);
        }
        if (b.batchConcurrency < 0) {
            throw new IllegalArgumentException("batchConcurrency must be >= 0 but was " + b.batchConcurrency);
        }
        if (b.streamBatchSize < 0) {
            throw new IllegalArgumentException("streamBatchSize must be >= 0 but was " + b.streamBatchSize);
        }
        this.concurrencyLimit = b.concurrencyLimit;
        this.batchSize = b.batchSize;
        this.preserveOrder = b.preserveOrder;
        this.batchConcurrency = b.batchConcurrency;
        this.streamBatchSize = b.streamBatchSize;
        this.throwOnError = b.throwOnError;
        this.tags = Collections.unmodifiableList(new ArrayList<>(b.tags));
        this.cancellationToken = b.cancellationToken != null ? b.cancellationToken : new CancellationToken();
        this.events = b.events != null ? b.events : StageEvents.NOOP;
        this.runId = b.runId != null ? b.runId : UUID.randomUUID().toString();
    }

    /** A fresh default config with its own run id and token. */
    public static StageConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.concurrencyLimit = concurrencyLimit;
        b.batchSize = batchSize;
        b.preserveOrder = preserveOrder;
        b.batchConcurrency = batchConcurrency;
        b.streamBatchSize = streamBatchSize;
        b.throwOnError = throwOnError;
        b.tags = new ArrayList<>(tags);
        b.cancellationToken = cancellationToken;
        b.events = events;
        b.runId = runId;
        return b;
    }

    public int concurrencyLimit() { return concurrencyLimit; }
    public int batchSize() { return batchSize; }
    public boolean preserveOrder() { return preserveOrder; }
    /** Outer concurrency for batch runs of composites; 0 means the component default. */
    public int batchConcurrency() { return batchConcurrency; }
    /** Chunk size for streaming runs; 0 means the component default. */
    public int streamBatchSize() { return streamBatchSize; }
    public boolean throwOnError() { return throwOnError; }
    public List<String> tags() { return tags; }
    public CancellationToken cancellationToken() { return cancellationToken; }
    public StageEvents events() { return events; }
    public String runId() { return runId; }

    public ConcurrencyOptions concurrencyOptions() {
        return new ConcurrencyOptions(concurrencyLimit, batchSize, preserveOrder);
    }

    public StageConfig withConcurrencyOptions(ConcurrencyOptions options) {
        return toBuilder()
                .concurrencyLimit(options.concurrencyLimit())
                .batchSize(options.batchSize())
                .preserveOrder(options.preserveOrder())
                .build();
    }

    public StageConfig withTag(String tag) {
        return toBuilder().tag(tag).build();
    }

    public StageConfig withConcurrencyLimit(int limit) {
        return toBuilder().concurrencyLimit(limit).build();
    }

    public StageConfig withBatchSize(int size) {
        return toBuilder().batchSize(size).build();
    }

    public StageConfig withPreserveOrder(boolean preserve) {
        return toBuilder().preserveOrder(preserve).build();
    }

    public StageConfig withBatchConcurrency(int concurrency) {
        return toBuilder().batchConcurrency(concurrency).build();
    }

    public StageConfig withStreamBatchSize(int size) {
        return toBuilder().streamBatchSize(size).build();
    }

    public StageConfig withThrowOnError(boolean throwOnError) {
        return toBuilder().throwOnError(throwOnError).build();
    }

    public StageConfig withEvents(StageEvents events) {
        return toBuilder().events(events).build();
    }

    public StageConfig withCancellationToken(CancellationToken token) {
        return toBuilder().cancellationToken(token).build();
    }

    public StageConfig withRunId(String runId) {
        return toBuilder().runId(runId).build();
    }

    @Override
    public String toString() {
        return "StageConfig{concurrencyLimit=" + concurrencyLimit
                + ", batchSize=" + batchSize
                + ", preserveOrder=" + preserveOrder
                + ", batchConcurrency=" + batchConcurrency
                + ", streamBatchSize=" + streamBatchSize
                + ", throwOnError=" + throwOnError
                + ", tags=" + tags
                + ", runId=" + runId + '}';
    }

    public static final class Builder {
        private int concurrencyLimit = ConcurrencyOptions.DEFAULT_CONCURRENCY_LIMIT;
        private int batchSize = ConcurrencyOptions.DEFAULT_BATCH_SIZE;
        private boolean preserveOrder = true;
        private int batchConcurrency = 0;
        private int streamBatchSize = 0;
        private boolean throwOnError = true;
        private List<String> tags = new ArrayList<>();
        private CancellationToken cancellationToken;
        private StageEvents events;
        private String runId;

        private Builder() {}

        public Builder concurrencyLimit(int v) { this.concurrencyLimit = v; return this; }
        public Builder batchSize(int v) { this.batchSize = v; return this; }
        public Builder preserveOrder(boolean v) { this.preserveOrder = v; return this; }
        public Builder batchConcurrency(int v) { this.batchConcurrency = v; return this; }
        public Builder streamBatchSize(int v) { this.streamBatchSize = v; return this; }
        public Builder throwOnError(boolean v) { this.throwOnError = v; return this; }
        public Builder tag(String tag) { this.tags.add(Objects.requireNonNull(tag, "tag")); return this; }
        public Builder tags(List<String> tags) { this.tags = new ArrayList<>(tags); return this; }
        public Builder cancellationToken(CancellationToken token) { this.cancellationToken = token; return this; }
        public Builder events(StageEvents events) { this.events = events; return this; }
        public Builder runId(String runId) { this.runId = runId; return this; }

        public StageConfig build() {
            return new StageConfig(this);
        }
    }
}
