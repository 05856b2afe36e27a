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

/**
 * Concurrency knobs consumed by the batch executor.
 *
 * @param concurrencyLimit maximum units in flight, at least 1
 * @param batchSize        chunk size above which the input is split, at least 1
 * @param preserveOrder    whether results must be aligned with input order
 */
public record ConcurrencyOptions(int concurrencyLimit, int batchSize, boolean preserveOrder) {

    public static final int DEFAULT_CONCURRENCY_LIMIT = 10;
    public static final int DEFAULT_BATCH_SIZE = 100;

    public ConcurrencyOptions {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1 but was " + concurrencyLimit);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1 but was " + batchSize);
        }
    }

    public static ConcurrencyOptions defaults() {
        return new ConcurrencyOptions(DEFAULT_CONCURRENCY_LIMIT, DEFAULT_BATCH_SIZE, true);
    }

    public ConcurrencyOptions withConcurrencyLimit(int limit) {
        return new ConcurrencyOptions(limit, batchSize, preserveOrder);
    }

    public ConcurrencyOptions withBatchSize(int size) {
        return new ConcurrencyOptions(concurrencyLimit, size, preserveOrder);
    }

    public ConcurrencyOptions withPreserveOrder(boolean preserve) {
        return new ConcurrencyOptions(concurrencyLimit, batchSize, preserve);
    }
}
