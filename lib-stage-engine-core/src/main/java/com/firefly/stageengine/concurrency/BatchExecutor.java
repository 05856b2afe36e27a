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

package com.firefly.stageengine.concurrency;

import com.firefly.stageengine.core.CancellationToken;
import com.firefly.stageengine.core.ConcurrencyOptions;
import com.firefly.stageengine.core.ItemOutcome;
import com.firefly.stageengine.errors.AggregateFailureException;
import com.firefly.stageengine.errors.StageCancelledException;
import com.firefly.stageengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one asynchronous unit per input item under a {@link ConcurrencyLimiter}.
 * <p>
 * Results are always stored at the index of their input. Inputs larger than the batch size are
 * split into contiguous chunks that run one after another, each under its own limiter, so at no
 * time are more than {@code concurrencyLimit} units in flight. Unordered runs skip chunking.
 * The cancellation token is checked before each chunk.
 */
public final class BatchExecutor {

    private static final Logger log = LoggerFactory.getLogger(BatchExecutor.class);

    public static final int DEFAULT_STREAM_CHUNK_SIZE = 50;

    /** Asynchronous unit of work applied to one item. */
    @FunctionalInterface
    public interface Unit<T, R> {
        Mono<R> apply(T item, int index);
    }

    private BatchExecutor() {}

    public static <T, R> Mono<List<R>> execute(List<T> items, Unit<T, R> unit, ConcurrencyOptions options) {
        return execute("batch", items, unit, options, null);
    }

    /**
     * Runs every item and fails with {@link AggregateFailureException} when at least one failed.
     * Every item runs to completion before the failure is raised. An absent result is a
     * {@code null} slot.
     */
    public static <T, R> Mono<List<R>> execute(String name,
                                               List<T> items,
                                               Unit<T, R> unit,
                                               ConcurrencyOptions options,
                                               CancellationToken token) {
        return executeSettled(items, unit, options, token).map(outcomes -> unwrap(name, outcomes));
    }

    /** Same execution as {@link #execute}, but item failures are reported per index instead of failing the call. */
    public static <T, R> Mono<List<ItemOutcome<R>>> executeSettled(List<T> items,
                                                                   Unit<T, R> unit,
                                                                   ConcurrencyOptions options,
                                                                   CancellationToken token) {
        if (items == null || items.isEmpty()) {
            return Mono.just(List.of());
        }
        ConcurrencyOptions opts = options != null ? options : ConcurrencyOptions.defaults();
        if (!opts.preserveOrder() || items.size() <= opts.batchSize()) {
            return Mono.defer(() -> {
                checkCancelled(token, "batch start");
                return runChunk(items, 0, unit, new ConcurrencyLimiter(opts.concurrencyLimit()));
            });
        }
        int chunks = (items.size() + opts.batchSize() - 1) / opts.batchSize();
        log.debug(JsonUtils.json(
                "stage_event", "batch_chunked",
                "items", Integer.toString(items.size()),
                "chunks", Integer.toString(chunks),
                "batchSize", Integer.toString(opts.batchSize()),
                "concurrencyLimit", Integer.toString(opts.concurrencyLimit())
        ));
        return Flux.range(0, chunks)
                .concatMap(c -> Mono.defer(() -> {
                    checkCancelled(token, "chunk " + c);
                    int from = c * opts.batchSize();
                    int to = Math.min(items.size(), from + opts.batchSize());
                    return runChunk(items.subList(from, to), from, unit, new ConcurrencyLimiter(opts.concurrencyLimit()));
                }))
                .collectList()
                .map(BatchExecutor::flatten);
    }

    /**
     * Emits the results one chunk at a time. The next chunk starts only after the previous
     * one was emitted and more was requested. Fails at the first chunk containing a failure.
     */
    public static <T, R> Flux<List<R>> stream(String name,
                                              List<T> items,
                                              Unit<T, R> unit,
                                              ConcurrencyOptions options,
                                              int chunkSize,
                                              CancellationToken token) {
        if (items == null || items.isEmpty()) {
            return Flux.empty();
        }
        ConcurrencyOptions opts = options != null ? options : ConcurrencyOptions.defaults();
        int size = chunkSize > 0 ? chunkSize : DEFAULT_STREAM_CHUNK_SIZE;
        int chunks = (items.size() + size - 1) / size;
        return Flux.range(0, chunks)
                .concatMap(c -> Mono.defer(() -> {
                    checkCancelled(token, "chunk " + c);
                    int from = c * size;
                    int to = Math.min(items.size(), from + size);
                    return runChunk(items.subList(from, to), from, unit, new ConcurrencyLimiter(opts.concurrencyLimit()))
                            .map(outcomes -> unwrap(name, outcomes));
                }), 0);
    }

    private static <T, R> Mono<List<ItemOutcome<R>>> runChunk(List<T> chunk,
                                                              int offset,
                                                              Unit<T, R> unit,
                                                              ConcurrencyLimiter limiter) {
        return Flux.range(0, chunk.size())
                .flatMap(i -> {
                    int index = offset + i;
                    return limiter.withPermit(() -> unit.apply(chunk.get(i), index))
                            .map(value -> ItemOutcome.success(index, value))
                            .defaultIfEmpty(ItemOutcome.success(index, null))
                            .onErrorResume(e -> !(e instanceof StageCancelledException),
                                    e -> Mono.just(ItemOutcome.<R>failure(index, e)));
                }, Math.max(1, chunk.size()))
                .collectList()
                .map(list -> {
                    @SuppressWarnings("unchecked")
                    ItemOutcome<R>[] slots = new ItemOutcome[chunk.size()];
                    for (ItemOutcome<R> o : list) {
                        slots[o.index() - offset] = o;
                    }
                    return Arrays.asList(slots);
                });
    }

    private static <R> List<ItemOutcome<R>> flatten(List<List<ItemOutcome<R>>> parts) {
        List<ItemOutcome<R>> all = new ArrayList<>();
        for (List<ItemOutcome<R>> part : parts) {
            all.addAll(part);
        }
        return all;
    }

    private static <R> List<R> unwrap(String name, List<ItemOutcome<R>> outcomes) {
        Map<String, Throwable> failures = new LinkedHashMap<>();
        List<R> values = new ArrayList<>(outcomes.size());
        for (ItemOutcome<R> o : outcomes) {
            if (o.isSuccess()) {
                values.add(o.value());
            } else {
                failures.put(Integer.toString(o.index()), o.error());
                values.add(null);
            }
        }
        if (!failures.isEmpty()) {
            throw new AggregateFailureException(name, failures, outcomes.size());
        }
        return values;
    }

    private static void checkCancelled(CancellationToken token, String boundary) {
        if (token != null) {
            token.throwIfCancelled(boundary);
        }
    }
}
