package com.firefly.stageengine.observability;

import com.firefly.stageengine.testing.RecordingEvents;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class CompositeStageEventsTest {

    @Test
    void compositeFansOutCalls() {
        RecordingEvents a = new RecordingEvents();
        RecordingEvents b = new RecordingEvents();
        CompositeStageEvents composite = new CompositeStageEvents(List.of(a, b));

        composite.onInvokeStarted("S", "run-1");
        composite.onStepStarted("S", "run-1", "step:0");
        composite.onBranchSelected("R", "run-1", "fast");
        composite.onInvokeCompleted("S", "run-1", true, 3);

        List<String> expected = List.of("invoke_started:S", "step_started:S:step:0", "branch:R:fast", "invoke_completed:S:true");
        assertEquals(expected, a.calls);
        assertEquals(expected, b.calls);
        assertEquals(2, composite.getDelegates().size());
    }

    @Test
    void failingSinkDoesNotStopOthers() {
        StageEvents broken = new StageEvents() {
            @Override
            public void onRetry(String stageName, String runId, int attempt, long delayMs, Throwable error) {
                throw new IllegalStateException("sink exploded");
            }
        };
        RecordingEvents after = new RecordingEvents();
        CompositeStageEvents composite = new CompositeStageEvents(List.of(broken, after));

        assertDoesNotThrow(() -> composite.onRetry("S", "run-1", 1, 10, new RuntimeException("x")));
        assertEquals(List.of("retry:S:1"), after.calls);
    }

    @Test
    void forwardsArgumentsUnchanged() {
        StageEvents sink = mock(StageEvents.class);
        CompositeStageEvents composite = new CompositeStageEvents(List.of(sink));
        IllegalStateException error = new IllegalStateException("boom");

        composite.onStepFailed("P", "run-9", "step:2", error, 12);
        composite.onBatchCompleted("M", "run-9", 10, 3, 40);

        verify(sink).onStepFailed(eq("P"), eq("run-9"), eq("step:2"), eq(error), anyLong());
        verify(sink).onBatchCompleted("M", "run-9", 10, 3, 40);
    }

    @Test
    void noopIgnoresEverything() {
        assertDoesNotThrow(() -> {
            StageEvents.NOOP.onInvokeStarted("S", "r");
            StageEvents.NOOP.onCancelled("S", "r", "after step 0");
        });
    }
}
