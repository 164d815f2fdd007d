package com.nodeflow.dfg.util;

import com.nodeflow.dfg.api.CalculationResult;
import com.nodeflow.dfg.api.NodeResult;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.Property;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.Assert.*;

public class RunStatsListenerTest {

    @Test
    public void testCountsRunsAndFailures() {
        RunStatsListener stats = new RunStatsListener();

        stats.onRunStart(1);
        stats.onRunEnd(1, CalculationResult.empty());
        stats.onRunStart(2);
        stats.onRunError(2, new IllegalStateException("failing on purpose"));

        assertEquals(1, stats.totalRuns());
        assertEquals(1, stats.failedRuns());
        assertEquals(0, stats.lastNodesReported());
        assertTrue(stats.minLatencyNanos() <= stats.maxLatencyNanos());
        assertNotNull(stats.summary());

        stats.reset();
        assertEquals(0, stats.totalRuns());
        assertEquals(0.0, stats.avgLatencyNanos(), 0.0);
    }

    @Test
    public void testResetClearsLastRun() {
        RunStatsListener stats = new RunStatsListener();
        stats.onRunStart(1);
        stats.onRunEnd(1, new CalculationResult(Map.of("n1", new NodeResult(Map.of(), Map.of()))));
        assertEquals(1, stats.lastNodesReported());

        stats.reset();

        assertEquals(0, stats.lastNodesReported());
        assertEquals(0, stats.lastLatencyNanos());
        assertEquals(0, stats.failedRuns());
        assertTrue(stats.summary().endsWith("lastNodes=0"));
    }

    @Test
    public void testFailedRunIsCountedWithoutLogging() {
        List<LogEvent> events = new CopyOnWriteArrayList<>();
        AbstractAppender appender = new AbstractAppender("run-stats-capture", null, null, true,
                Property.EMPTY_ARRAY) {
            @Override
            public void append(LogEvent event) {
                events.add(event.toImmutable());
            }
        };
        appender.start();
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        Configuration cfg = ctx.getConfiguration();
        cfg.getRootLogger().addAppender(appender, Level.ALL, null);
        ctx.updateLoggers();
        try {
            RunStatsListener stats = new RunStatsListener();
            stats.onRunStart(1);
            stats.onRunError(1, new IllegalStateException("failing on purpose"));

            assertEquals(1, stats.failedRuns());
            assertTrue(events.isEmpty());
        } finally {
            cfg.getRootLogger().removeAppender(appender.getName());
            ctx.updateLoggers();
            appender.stop();
        }
    }
}
