package com.firefly.stageengine.stage;

import com.firefly.stageengine.core.CancellationToken;
import com.firefly.stageengine.core.ConcurrencyOptions;
import com.firefly.stageengine.core.Stage;
import com.firefly.stageengine.core.StageConfig;
import com.firefly.stageengine.errors.AggregateFailureException;
import com.firefly.stageengine.errors.StageCancelledException;
import com.firefly.stageengine.testing.ConcurrencyProbe;
import com.firefly.stageengine.testing.RecordingEvents;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class MapperTest {

    private static List<Integer> range(int n) {
        return IntStream.range(0, n).boxed().collect(Collectors.toList());
    }

    @Test
    void mapsEveryElementInOrder() {
        Mapper<Integer, String> mapper = Mapper.from(i -> "#" + i);

        StepVerifier.create(mapper.invoke(List.of(3, 1, 2)))
                .expectNext(List.of("#3", "#1", "#2"))
                .verifyComplete();
    }

    @Test
    void emptyInputYieldsEmptyList() {
        StepVerifier.create(Mapper.<Integer, Integer>from(i -> i).invoke(List.of()))
                .expectNext(List.of())
                .verifyComplete();
    }

    @Test
    void sequentialMapperRunsOneAtATime() {
        ConcurrencyProbe probe = new ConcurrencyProbe(Duration.ofMillis(5));
        Mapper<Integer, Integer> mapper = Mapper.sequential(LambdaStage.<Integer, Integer>async(probe::track));

        assertEquals(range(6), mapper.invoke(range(6)).block(Duration.ofSeconds(5)));
        assertEquals(1, probe.maxActive());
    }

    @Test
    void explicitOptionsWinOverCallConfig() {
        ConcurrencyProbe probe = new ConcurrencyProbe(Duration.ofMillis(15));
        Mapper<Integer, Integer> mapper = Mapper.of(LambdaStage.<Integer, Integer>async(probe::track),
                new ConcurrencyOptions(2, 100, true));

        mapper.invoke(range(8), StageConfig.defaults().withConcurrencyLimit(8)).block(Duration.ofSeconds(5));

        assertTrue(probe.maxActive() <= 2, "max in flight was " + probe.maxActive());
    }

    @Test
    void callConfigAppliesWhenMapperHasNoOptions() {
        ConcurrencyProbe probe = new ConcurrencyProbe(Duration.ofMillis(15));
        Mapper<Integer, Integer> mapper = Mapper.of(LambdaStage.<Integer, Integer>async(probe::track));

        mapper.invoke(range(9), StageConfig.defaults().withConcurrencyLimit(3)).block(Duration.ofSeconds(5));

        assertTrue(probe.maxActive() <= 3, "max in flight was " + probe.maxActive());
        assertEquals(9, probe.started());
    }

    @Test
    void parallelMapperKeepsResultsAlignedWithInput() {
        Stage<Integer, Integer> slowForSmall = LambdaStage.async(i -> Mono.delay(Duration.ofMillis(50 - i * 10L)).thenReturn(i * i));

        StepVerifier.create(Mapper.parallel(slowForSmall).invoke(List.of(0, 1, 2, 3, 4)))
                .expectNext(List.of(0, 1, 4, 9, 16))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        assertFalse(Mapper.parallel(slowForSmall).options().preserveOrder());
    }

    @Test
    void derivedMappersLeaveTheOriginalUntouched() {
        Mapper<Integer, Integer> base = Mapper.batched(LambdaStage.<Integer, Integer>of(i -> i));
        Mapper<Integer, Integer> wider = base.withConcurrency(30).withBatchSize(500).withOrderPreservation(false);

        assertEquals(new ConcurrencyOptions(5, 50, true), base.options());
        assertEquals(new ConcurrencyOptions(30, 500, false), wider.options());
    }

    @Test
    void elementFailuresAreAggregated() {
        Mapper<Integer, Integer> mapper = Mapper.from(i -> {
            if (i < 0) throw new IllegalArgumentException("negative " + i);
            return i;
        });
        RecordingEvents events = new RecordingEvents();

        StepVerifier.create(mapper.named("checker").invoke(List.of(1, -2, 3, -4), StageConfig.defaults().withEvents(events)))
                .expectErrorSatisfies(err -> {
                    AggregateFailureException e = assertInstanceOf(AggregateFailureException.class, err);
                    assertEquals(Map.of("1", "negative -2", "3", "negative -4"),
                            e.getFailures().entrySet().stream().collect(Collectors.toMap(Map.Entry::getKey, x -> x.getValue().getMessage())));
                })
                .verify();
        assertEquals(List.of("batch:checker:4:2"), events.calls);
    }

    @Test
    void retriesEachElementIndependently() {
        Map<Integer, AtomicInteger> attempts = new ConcurrentHashMap<>();
        Mapper<Integer, Integer> flaky = Mapper.from((Integer i) -> {
            if (attempts.computeIfAbsent(i, k -> new AtomicInteger()).incrementAndGet() < 2) {
                throw new IllegalStateException("first try fails");
            }
            return i * 10;
        }).withRetry(2, Duration.ZERO);

        StepVerifier.create(flaky.invoke(List.of(1, 2, 3)))
                .expectNext(List.of(10, 20, 30))
                .verifyComplete();
        attempts.values().forEach(a -> assertEquals(2, a.get()));
    }

    @Test
    void rateLimitCapsConcurrency() {
        Mapper<Integer, Integer> limited = Mapper.<Integer, Integer>from(i -> i).withRateLimit(3.5);
        assertEquals(3, limited.options().concurrencyLimit());

        Mapper<Integer, Integer> slow = Mapper.<Integer, Integer>from(i -> i).withRateLimit(0.5);
        assertEquals(1, slow.options().concurrencyLimit());
    }

    @Test
    void filterAndReduceBuildPipelines() {
        Mapper<Integer, Integer> square = Mapper.from(i -> i * i);

        StepVerifier.create(square.withFilter(i -> i % 2 == 0).invoke(List.of(1, 2, 3, 4)))
                .expectNext(List.of(4, 16))
                .verifyComplete();
        StepVerifier.create(square.withReduce(0, Integer::sum).invoke(List.of(1, 2, 3)))
                .expectNext(14)
                .verifyComplete();
    }

    @Test
    void streamEmitsChunksOfStreamBatchSize() {
        Mapper<Integer, Integer> mapper = Mapper.from(i -> i + 100);

        StepVerifier.create(mapper.stream(range(5), StageConfig.defaults().withStreamBatchSize(2)))
                .expectNext(List.of(100, 101))
                .expectNext(List.of(102, 103))
                .expectNext(List.of(104))
                .verifyComplete();
    }

    @Test
    void streamChunkDefaultsToAtMostTwenty() {
        Mapper<Integer, Integer> mapper = Mapper.from(i -> i);

        StepVerifier.create(mapper.stream(range(45)))
                .expectNextMatches(chunk -> chunk.size() == 20)
                .expectNextMatches(chunk -> chunk.size() == 20)
                .expectNextMatches(chunk -> chunk.size() == 5)
                .verifyComplete();
    }

    @Test
    void cancellationIsReported() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        RecordingEvents events = new RecordingEvents();
        StageConfig cfg = StageConfig.defaults().withCancellationToken(token).withEvents(events);

        StepVerifier.create(Mapper.<Integer, Integer>from(i -> i).named("m").invoke(List.of(1), cfg))
                .expectError(StageCancelledException.class)
                .verify();
        assertEquals(List.of("cancelled:m:batch start"), events.calls);
    }
}
