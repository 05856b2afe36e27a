package com.firefly.stageengine.concurrency;

import com.firefly.stageengine.core.CancellationToken;
import com.firefly.stageengine.core.ConcurrencyOptions;
import com.firefly.stageengine.core.ItemOutcome;
import com.firefly.stageengine.errors.AggregateFailureException;
import com.firefly.stageengine.errors.StageCancelledException;
import com.firefly.stageengine.testing.ConcurrencyProbe;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class BatchExecutorTest {

    private static List<Integer> range(int n) {
        return IntStream.range(0, n).boxed().collect(Collectors.toList());
    }

    @Test
    void emptyInputYieldsEmptyResult() {
        AtomicInteger calls = new AtomicInteger();
        List<Integer> out = BatchExecutor.<Integer, Integer>execute(List.of(),
                (item, index) -> Mono.fromCallable(calls::incrementAndGet),
                ConcurrencyOptions.defaults()).block();

        assertEquals(List.of(), out);
        assertEquals(0, calls.get());
    }

    @Test
    void resultsAreAlignedWithInputEvenWhenCompletingOutOfOrder() {
        List<Integer> items = range(8);
        List<Integer> out = BatchExecutor.execute(items,
                (item, index) -> Mono.delay(Duration.ofMillis(40 - item * 5L)).thenReturn(item * 10),
                new ConcurrencyOptions(8, 100, true)).block(Duration.ofSeconds(5));

        assertEquals(List.of(0, 10, 20, 30, 40, 50, 60, 70), out);
    }

    @Test
    void unorderedRunsStillStoreResultsByIndex() {
        List<Integer> items = range(6);
        List<Integer> out = BatchExecutor.execute(items,
                (item, index) -> Mono.delay(Duration.ofMillis(30 - item * 5L)).thenReturn(index),
                new ConcurrencyOptions(6, 2, false)).block(Duration.ofSeconds(5));

        assertEquals(items, out);
    }

    @Test
    void concurrencyLimitHoldsAcrossChunks() {
        ConcurrencyProbe probe = new ConcurrencyProbe(Duration.ofMillis(10));
        List<Integer> out = BatchExecutor.execute(range(25),
                (item, index) -> probe.track(item),
                new ConcurrencyOptions(4, 10, true)).block(Duration.ofSeconds(10));

        assertEquals(range(25), out);
        assertTrue(probe.maxActive() <= 4, "max in flight was " + probe.maxActive());
        assertEquals(25, probe.started());
    }

    @Test
    void absentResultBecomesNullSlot() {
        List<Integer> out = BatchExecutor.execute(range(3),
                (item, index) -> item == 1 ? Mono.<Integer>empty() : Mono.just(item),
                ConcurrencyOptions.defaults()).block();

        assertEquals(Arrays.asList(0, null, 2), out);
    }

    @Test
    void failuresAreAggregatedAfterEveryItemRan() {
        AtomicInteger calls = new AtomicInteger();
        Mono<List<Integer>> run = BatchExecutor.execute("squares", range(5), (item, index) -> {
            calls.incrementAndGet();
            if (item % 2 == 1) {
                return Mono.error(new IllegalArgumentException("odd " + item));
            }
            return Mono.just(item * item);
        }, ConcurrencyOptions.defaults(), null);

        StepVerifier.create(run)
                .expectErrorSatisfies(err -> {
                    AggregateFailureException agg = assertInstanceOf(AggregateFailureException.class, err);
                    assertThat(agg.getFailures()).containsOnlyKeys("1", "3");
                    assertEquals(2, agg.getFailedCount());
                    assertEquals(5, agg.getTotal());
                    assertThat(agg.getMessage()).contains("squares").contains("2/5");
                })
                .verify();
        assertEquals(5, calls.get());
    }

    @Test
    void settledRunReportsEachOutcome() {
        List<ItemOutcome<String>> outcomes = BatchExecutor.executeSettled(List.of("a", "", "c"),
                (item, index) -> item.isEmpty()
                        ? Mono.<String>error(new IllegalStateException("blank at " + index))
                        : Mono.just(item.toUpperCase()),
                ConcurrencyOptions.defaults(), null).block();

        assertNotNull(outcomes);
        assertEquals(3, outcomes.size());
        assertTrue(outcomes.get(0).isSuccess());
        assertEquals("A", outcomes.get(0).value());
        assertFalse(outcomes.get(1).isSuccess());
        assertEquals("blank at 1", outcomes.get(1).error().getMessage());
        assertEquals(2, outcomes.get(2).index());
    }

    @Test
    void cancellationStopsBeforeTheNextChunk() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        Mono<List<Integer>> run = BatchExecutor.execute("cancelling", range(30), (item, index) -> {
            calls.incrementAndGet();
            if (index == 0) {
                token.cancel("enough");
            }
            return Mono.just(item);
        }, new ConcurrencyOptions(10, 10, true), token);

        StepVerifier.create(run)
                .expectErrorSatisfies(err -> {
                    StageCancelledException cancelled = assertInstanceOf(StageCancelledException.class, err);
                    assertEquals("chunk 1", cancelled.getBoundary());
                    assertEquals("enough", cancelled.getReason());
                })
                .verify();
        assertEquals(10, calls.get());
    }

    @Test
    void alreadyCancelledTokenFailsBeforeAnyWork() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        StepVerifier.create(BatchExecutor.execute("x", range(3),
                        (item, index) -> Mono.fromCallable(calls::incrementAndGet),
                        ConcurrencyOptions.defaults(), token))
                .expectError(StageCancelledException.class)
                .verify();
        assertEquals(0, calls.get());
    }

    @Test
    void streamEmitsOneListPerChunk() {
        List<List<Integer>> chunks = new ArrayList<>();
        StepVerifier.create(BatchExecutor.stream("doubler", range(7),
                        (item, index) -> Mono.just(item * 2),
                        ConcurrencyOptions.defaults(), 3, null))
                .recordWith(() -> chunks)
                .expectNextCount(3)
                .verifyComplete();

        assertEquals(List.of(0, 2, 4), chunks.get(0));
        assertEquals(List.of(6, 8, 10), chunks.get(1));
        assertEquals(List.of(12), chunks.get(2));
    }

    @Test
    void streamFailsAtFirstChunkWithFailure() {
        StepVerifier.create(BatchExecutor.stream("s", range(6),
                        (item, index) -> item == 4 ? Mono.<Integer>error(new IllegalStateException("four")) : Mono.just(item),
                        ConcurrencyOptions.defaults(), 2, null))
                .expectNext(List.of(0, 1))
                .expectNext(List.of(2, 3))
                .expectError(AggregateFailureException.class)
                .verify();
    }

    @Test
    void streamOfEmptyInputCompletesImmediately() {
        StepVerifier.create(BatchExecutor.<Integer, Integer>stream("s", List.of(),
                        (item, index) -> Mono.just(item), ConcurrencyOptions.defaults(), 0, null))
                .verifyComplete();
    }

    @Test
    void largeBatchWithSynchronousTailCompletes() {
        List<Integer> items = range(20_000);
        List<Integer> out = BatchExecutor.execute(items,
                (item, index) -> index == 0
                        ? Mono.delay(Duration.ofMillis(100)).thenReturn(item)
                        : Mono.just(item),
                new ConcurrencyOptions(1, 100, false)).block(Duration.ofSeconds(30));

        assertNotNull(out);
        assertEquals(20_000, out.size());
        assertEquals(19_999, out.get(19_999));
    }
}
