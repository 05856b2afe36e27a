package com.firefly.stageengine.stage;

import com.firefly.stageengine.errors.AggregateFailureException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class EnricherTest {

    private static int intAt(Map<String, Object> m, String key) {
        return (Integer) m.get(key);
    }

    @Test
    void assignmentsSeeTheOriginalInputAndOverrideExistingKeys() {
        Map<String, Assignment> assignments = new LinkedHashMap<>();
        assignments.put("a", Assignment.function(m -> intAt(m, "a") + 1));
        assignments.put("b", Assignment.function(m -> intAt(m, "a") + 2));
        Map<String, Object> input = new HashMap<>(Map.of("a", 0));

        Map<String, Object> out = Enricher.of(assignments).invoke(input).block();

        assertEquals(Map.of("a", 1, "b", 2), out);
        assertEquals(Map.of("a", 0), input);
    }

    @Test
    void keepsInputKeysFirstThenNewKeysInDeclarationOrder() {
        Map<String, Function<? super Map<String, Object>, ?>> computations = new LinkedHashMap<>();
        computations.put("z", m -> "last");
        computations.put("y", m -> "first");
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("id", 7);

        Map<String, Object> out = Enricher.compute(computations).invoke(input).block();

        assertNotNull(out);
        assertEquals(List.of("id", "z", "y"), new ArrayList<>(out.keySet()));
    }

    @Test
    void supportsStagesAsyncAndConstants() {
        Enricher enricher = Enricher.addMetadata(Map.of("source", "api"))
                .withStage("size", LambdaStage.<Map<String, Object>, Integer>of(Map::size))
                .withAssignment("remote", Assignment.async(m -> Mono.just("fetched")));

        StepVerifier.create(enricher.invoke(Map.of("k", "v")))
                .expectNext(Map.of("k", "v", "source", "api", "size", 1, "remote", "fetched"))
                .verifyComplete();
    }

    @Test
    void absentAssignmentStoresNull() {
        Map<String, Object> out = Enricher.of(Map.of("missing", Assignment.constant(null)))
                .invoke(Map.of("k", 1)).block();

        assertNotNull(out);
        assertTrue(out.containsKey("missing"));
        assertNull(out.get("missing"));
    }

    @Test
    void failuresNameEveryFailingKey() {
        Map<String, Assignment> assignments = new LinkedHashMap<>();
        assignments.put("ok", Assignment.constant(1));
        assignments.put("credit", Assignment.async(m -> Mono.error(new IllegalStateException("bureau down"))));
        assignments.put("fraud", Assignment.function(m -> { throw new IllegalArgumentException("no score"); }));

        StepVerifier.create(Enricher.of("scoring", assignments).invoke(Map.of()))
                .expectErrorSatisfies(err -> {
                    AggregateFailureException e = assertInstanceOf(AggregateFailureException.class, err);
                    assertEquals(List.of("credit", "fraud"), new ArrayList<>(e.getFailures().keySet()));
                    assertTrue(e.getMessage().contains("bureau down"), e.getMessage());
                })
                .verify();
    }

    @Test
    void emptyEnricherCopiesInput() {
        Map<String, Object> input = Map.of("a", 1);
        Map<String, Object> out = Enricher.of(Map.of()).invoke(input).block();

        assertEquals(input, out);
        assertNotSame(input, out);
    }

    @Test
    void mergeLetsTheOtherEnricherWin() {
        Enricher first = Enricher.addMetadata(Map.of("v", 1, "only", "first"));
        Enricher second = Enricher.addMetadata(Map.of("v", 2));

        StepVerifier.create(first.merge(second).invoke(Map.of()))
                .expectNext(Map.of("v", 2, "only", "first"))
                .verifyComplete();
    }
}
