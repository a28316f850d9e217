package com.lob.common;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LatencyStatsTest {

    @Test
    void testRecordsAndResets() {
        LatencyStats stats = new LatencyStats("test");
        for (int i = 1; i <= 100; i++) {
            stats.record(i * 1_000L);
        }

        assertEquals(100, stats.count());
        long p50 = stats.valueAtPercentile(50);
        assertTrue(p50 >= 49_000 && p50 <= 51_000, "p50 should be ~50us, was " + p50);

        assertEquals(100, stats.logAndReset());
        assertEquals(0, stats.count());
        assertEquals(0, stats.logAndReset(), "Nothing to report after reset");
    }

    @Test
    void testReportIsParameterized() {
        LatencyStats stats = new LatencyStats("engine.command");
        for (int i = 1; i <= 100; i++) stats.record(i * 1_000L);

        try (LogCapture log = new LogCapture(LatencyStats.class, Level.INFO)) {
            assertEquals(100, stats.logAndReset());

            assertEquals(1, log.events().size());
            ILoggingEvent event = log.events().get(0);
            assertTrue(event.getMessage().contains("count={}"), event.getMessage());
            Object[] args = event.getArgumentArray();
            assertEquals("engine.command", args[0]);
            assertEquals(100L, args[1]);
            double p50 = (Double) args[2];
            assertTrue(p50 >= 49.0 && p50 <= 51.0, "p50 in micros, was " + p50);
        }
    }

    @Test
    void testNoReportBuiltWhenInfoIsOff() {
        LatencyStats stats = new LatencyStats("quiet");
        stats.record(5_000);

        try (LogCapture log = new LogCapture(LatencyStats.class, Level.WARN)) {
            assertEquals(1, stats.logAndReset(), "Still counts and resets");
            assertTrue(log.events().isEmpty());
        }
        assertEquals(0, stats.count());
    }

    @Test
    void testClampsValuesAboveTrackableRange() {
        LatencyStats stats = new LatencyStats("test");
        stats.record(Long.MAX_VALUE);
        assertEquals(1, stats.count());
    }
}
