package com.firefly.stageengine.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StageMicrometerEventsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final StageMicrometerEvents events = new StageMicrometerEvents(registry);

    @Test
    void countsInvocationsBySuccess() {
        events.onInvokeCompleted("checkout", "r1", true, 20);
        events.onInvokeCompleted("checkout", "r2", false, 40);
        events.onInvokeCompleted("checkout", "r3", true, 30);

        assertEquals(2.0, registry.get("stage.invoke.completed").tags("stage", "checkout", "success", "true").counter().count());
        assertEquals(1.0, registry.get("stage.invoke.completed").tags("stage", "checkout", "success", "false").counter().count());
        assertEquals(50.0, registry.get("stage.invoke.latency").tags("stage", "checkout", "success", "true").timer()
                .totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    void recordsStepOutcomes() {
        events.onStepStarted("p", "r", "step:0");
        events.onStepSuccess("p", "r", "step:0", 5);
        events.onStepFailed("p", "r", "step:1", new IllegalStateException("x"), 7);

        assertEquals(1.0, registry.get("stage.step.started").tags("stage", "p", "step", "step:0").counter().count());
        assertEquals(1.0, registry.get("stage.step.succeeded").tags("stage", "p", "step", "step:0").counter().count());
        assertEquals(1.0, registry.get("stage.step.failed").tags("stage", "p", "step", "step:1").counter().count());
        assertEquals(1, registry.get("stage.step.latency").tags("step", "step:1", "success", "false").timer().count());
    }

    @Test
    void recordsRoutingRetriesBatchesAndCancellations() {
        events.onBranchSelected("router", "r", "vip");
        events.onRetry("fetch", "r", 1, 100, new RuntimeException("x"));
        events.onRetry("fetch", "r", 2, 200, new RuntimeException("x"));
        events.onBatchCompleted("map", "r", 10, 2, 55);
        events.onCancelled("pipeline", "r", "after step 0");

        assertEquals(1.0, registry.get("stage.branch.selected").tags("router", "router", "branch", "vip").counter().count());
        assertEquals(2.0, registry.get("stage.retry").tag("stage", "fetch").counter().count());
        assertEquals(300.0, registry.get("stage.retry.delay").tag("stage", "fetch").summary().totalAmount());
        assertEquals(10.0, registry.get("stage.batch.items").tag("stage", "map").summary().totalAmount());
        assertEquals(2.0, registry.get("stage.batch.failed.items").tag("stage", "map").summary().totalAmount());
        assertEquals(1.0, registry.get("stage.cancelled").tags("stage", "pipeline", "boundary", "after step 0").counter().count());
    }
}
