package org.openphc.exposure.keyserver.publish;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

/**
 * Conversions between wall-clock time and exposure notification interval numbers.
 * An interval is a 10 minute period; interval 0 starts at the Unix epoch.
 */
public final class IntervalClock {

    public static final Duration INTERVAL_LENGTH = Duration.ofMinutes(10);

    private static final long INTERVAL_SECONDS = INTERVAL_LENGTH.getSeconds();

    /** Seconds between 0001-01-01T00:00:00Z, Go's zero time, and the Unix epoch. */
    static final long SECONDS_FROM_YEAR_ONE_TO_EPOCH = 62_135_596_800L;

    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

    private IntervalClock() {
    }

    /**
     * Interval number containing {@code t}.
     */
    public static int intervalNumber(Instant t) {
        return (int) Math.floorDiv(t.getEpochSecond(), INTERVAL_SECONDS);
    }

    /**
     * Truncates {@code t} down to the closest preceding multiple of {@code window}, counted from
     * 0001-01-01T00:00:00Z like Go's {@code time.Time.Truncate}. Windows that divide a day give the same
     * result as counting from the Unix epoch. A zero or negative window leaves {@code t} unchanged.
     */
    public static Instant truncateWindow(Instant t, Duration window) {
        if (window == null || window.isZero() || window.isNegative()) {
            return t;
        }
        long seconds = t.getEpochSecond() + SECONDS_FROM_YEAR_ONE_TO_EPOCH;
        if (window.getNano() == 0 && t.getNano() == 0) {
            return t.minusSeconds(Math.floorMod(seconds, window.getSeconds()));
        }
        BigInteger sinceYearOne = BigInteger.valueOf(seconds).multiply(NANOS_PER_SECOND)
                .add(BigInteger.valueOf(t.getNano()));
        BigInteger remainder = sinceYearOne.mod(BigInteger.valueOf(window.getSeconds()).multiply(NANOS_PER_SECOND)
                .add(BigInteger.valueOf(window.getNano())));
        return t.minusNanos(remainder.longValueExact());
    }
}
