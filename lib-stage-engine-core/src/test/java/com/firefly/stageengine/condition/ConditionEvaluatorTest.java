package com.firefly.stageengine.condition;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConditionEvaluatorTest {

    private static final Map<String, Object> ORDER = Map.of(
            "status", "active",
            "amount", 150,
            "tags", List.of("vip", "eu"),
            "customer", Map.of("country", "ES"));

    private static boolean eval(Condition<Map<String, Object>> condition) {
        Boolean result = ConditionEvaluator.evaluate(ORDER, condition).block();
        assertNotNull(result);
        return result;
    }

    @Test
    void errorsAndEmptyResultsCountAsFalse() {
        Condition<Map<String, Object>> failing = input -> Mono.error(new IllegalStateException("broken"));
        Condition<Map<String, Object>> throwing = input -> { throw new IllegalStateException("thrown"); };
        Condition<Map<String, Object>> empty = input -> Mono.empty();

        assertFalse(eval(failing));
        assertFalse(eval(throwing));
        assertFalse(eval(empty));
        StepVerifier.create(ConditionEvaluator.evaluate(ORDER, null)).expectNext(false).verifyComplete();
    }

    @Test
    void pathExpressionsCompareStringForms() {
        assertTrue(eval(Condition.path("status=active")));
        assertTrue(eval(Condition.path(" status = active ")));
        assertTrue(eval(Condition.path("amount=150")));
        assertFalse(eval(Condition.path("status=closed")));
        assertFalse(eval(Condition.path("missing=null")));
        assertTrue(eval(Condition.path("customer.country")));
        assertFalse(eval(Condition.path("customer.region")));
    }

    @Test
    void patternMatchesAnywhereInStringForm() {
        Condition<String> urgent = Condition.pattern("(?i)urgent");
        StepVerifier.create(ConditionEvaluator.evaluate("this is URGENT!", urgent)).expectNext(true).verifyComplete();
        StepVerifier.create(ConditionEvaluator.evaluate("later", urgent)).expectNext(false).verifyComplete();
    }

    @Test
    void combinators() {
        Condition<Map<String, Object>> active = Condition.path("status=active");
        Condition<Map<String, Object>> spanish = ConditionEvaluator.equals("customer.country", "ES");
        Condition<Map<String, Object>> large = ConditionEvaluator.inRange("amount", 1000, 5000);

        assertTrue(eval(ConditionEvaluator.and(active, spanish)));
        assertFalse(eval(ConditionEvaluator.and(active, large)));
        assertTrue(eval(ConditionEvaluator.or(large, spanish)));
        assertFalse(eval(ConditionEvaluator.or(large, ConditionEvaluator.not(active))));
        assertTrue(eval(ConditionEvaluator.not(large)));
    }

    @Test
    void andStopsAtFirstFalse() {
        AtomicInteger evaluated = new AtomicInteger();
        Condition<Map<String, Object>> counting = Condition.predicate(m -> {
            evaluated.incrementAndGet();
            return true;
        });

        assertFalse(eval(ConditionEvaluator.and(Condition.path("status=closed"), counting)));
        assertEquals(0, evaluated.get());
        assertTrue(eval(ConditionEvaluator.or(Condition.path("status=active"), counting)));
        assertEquals(0, evaluated.get());
    }

    @Test
    void numericEqualityIgnoresRepresentation() {
        assertTrue(eval(ConditionEvaluator.equals("amount", 150L)));
        assertTrue(eval(ConditionEvaluator.equals("amount", 150.0)));
        assertFalse(eval(ConditionEvaluator.equals("amount", "150")));
    }

    @Test
    void containsChecksCollectionsStringsAndMaps() {
        assertTrue(eval(ConditionEvaluator.contains("tags", "vip")));
        assertFalse(eval(ConditionEvaluator.contains("tags", "us")));
        assertTrue(eval(ConditionEvaluator.contains("status", "act")));
        assertTrue(eval(ConditionEvaluator.contains("customer", "country")));
        assertFalse(eval(ConditionEvaluator.contains("missing", "x")));
    }

    @Test
    void inRangeIsInclusive() {
        assertTrue(eval(ConditionEvaluator.inRange("amount", 150, 200)));
        assertTrue(eval(ConditionEvaluator.inRange("amount", 100, 150.0)));
        assertFalse(eval(ConditionEvaluator.inRange("amount", 151, 200)));
        assertFalse(eval(ConditionEvaluator.inRange("status", 0, 10)));
    }

    @Test
    void asyncPredicateIsAwaited() {
        Condition<Integer> positive = Condition.asyncPredicate(i -> Mono.just(i > 0));
        StepVerifier.create(ConditionEvaluator.evaluate(5, positive)).expectNext(true).verifyComplete();
        StepVerifier.create(ConditionEvaluator.evaluate(-5, positive)).expectNext(false).verifyComplete();
    }
}
