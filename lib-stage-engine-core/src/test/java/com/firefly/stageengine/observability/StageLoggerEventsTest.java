package com.firefly.stageengine.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StageLoggerEventsTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(StageLoggerEvents.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private Level oldLevel;

    @BeforeEach
    void attach() {
        oldLevel = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
        logger.setLevel(oldLevel);
    }

    @Test
    void logsInvokeLifecycleAsJsonAtInfo() {
        StageLoggerEvents events = new StageLoggerEvents();

        events.onInvokeStarted("checkout", "run-42");
        events.onInvokeCompleted("checkout", "run-42", true, 17);

        List<ILoggingEvent> logs = appender.list;
        assertEquals(2, logs.size());
        assertEquals(Level.INFO, logs.get(0).getLevel());
        String completed = logs.get(1).getFormattedMessage();
        assertTrue(completed.contains("\"stage_event\":\"invoke_completed\""), completed);
        assertTrue(completed.contains("\"stage\":\"checkout\""), completed);
        assertTrue(completed.contains("\"runId\":\"run-42\""), completed);
        assertTrue(completed.contains("\"latencyMs\":\"17\""), completed);
    }

    @Test
    void stepFailuresAreWarnings() {
        StageLoggerEvents events = new StageLoggerEvents();

        events.onStepStarted("p", "r", "step:1");
        events.onStepFailed("p", "r", "step:1", new IllegalStateException("db \"down\""), 5);

        assertEquals(Level.DEBUG, appender.list.get(0).getLevel());
        ILoggingEvent failed = appender.list.get(1);
        assertEquals(Level.WARN, failed.getLevel());
        assertTrue(failed.getFormattedMessage().contains("\"stage_event\":\"step_failed\""));
        assertTrue(failed.getFormattedMessage().contains("db \\\"down\\\""), failed.getFormattedMessage());
    }

    @Test
    void cancellationIsAWarning() {
        new StageLoggerEvents().onCancelled("p", "r", "after step 2");

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("\"boundary\":\"after step 2\""), event.getFormattedMessage());
    }
}
