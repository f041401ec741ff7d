package org.openphc.exposure.keyserver.publish;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for IntervalClock.
 */
class IntervalClockTest {

    @Test
    void shouldCountTenMinuteIntervalsSinceEpoch() {
        assertEquals(0, IntervalClock.intervalNumber(Instant.EPOCH));
        assertEquals(0, IntervalClock.intervalNumber(Instant.ofEpochSecond(599)));
        assertEquals(1, IntervalClock.intervalNumber(Instant.ofEpochSecond(600)));
        assertEquals(2704176, IntervalClock.intervalNumber(Instant.parse("2021-06-01T00:00:00Z")));
    }

    @Test
    void shouldFloorTimesBeforeEpoch() {
        assertEquals(-1, IntervalClock.intervalNumber(Instant.ofEpochSecond(-1)));
        assertEquals(-1, IntervalClock.intervalNumber(Instant.ofEpochSecond(-600)));
        assertEquals(-2, IntervalClock.intervalNumber(Instant.ofEpochSecond(-601)));
    }

    @Test
    void shouldTruncateToPrecedingWindow() {
        Instant t = Instant.parse("2021-06-01T10:37:12.500Z");
        assertEquals(Instant.parse("2021-06-01T10:00:00Z"), IntervalClock.truncateWindow(t, Duration.ofHours(1)));
        assertEquals(Instant.parse("2021-06-01T10:30:00Z"), IntervalClock.truncateWindow(t, Duration.ofMinutes(15)));
        assertEquals(Instant.parse("2021-06-01T00:00:00Z"), IntervalClock.truncateWindow(t, Duration.ofDays(1)));
    }

    @Test
    void shouldTruncateToSubSecondWindow() {
        Instant t = Instant.parse("2021-06-01T10:37:12.780Z");
        assertEquals(Instant.parse("2021-06-01T10:37:12.750Z"),
                IntervalClock.truncateWindow(t, Duration.ofMillis(250)));
    }

    @Test
    void shouldCountWindowsFromYearOne() {
        // 62135596800 s from 0001-01-01 to the epoch leaves 60 s over a 7 minute window
        assertEquals(Instant.parse("1969-12-31T23:59:00Z"),
                IntervalClock.truncateWindow(Instant.EPOCH, Duration.ofMinutes(7)));
        assertEquals(Instant.parse("1969-12-31T23:59:00Z"),
                IntervalClock.truncateWindow(Instant.parse("1970-01-01T00:05:59.900Z"), Duration.ofMinutes(7)));
        assertEquals(Instant.parse("1970-01-01T00:06:00Z"),
                IntervalClock.truncateWindow(Instant.parse("1970-01-01T00:06:00Z"), Duration.ofMinutes(7)));
    }

    @Test
    void shouldKeepAlignedTimes() {
        Instant t = Instant.parse("2021-06-01T10:00:00Z");
        assertEquals(t, IntervalClock.truncateWindow(t, Duration.ofHours(1)));
    }

    @Test
    void shouldLeaveTimeUnchangedForNonPositiveWindow() {
        Instant t = Instant.parse("2021-06-01T10:37:12.500Z");
        assertEquals(t, IntervalClock.truncateWindow(t, Duration.ZERO));
        assertEquals(t, IntervalClock.truncateWindow(t, Duration.ofMinutes(-5)));
    }
}
