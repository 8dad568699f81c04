package com.phillippitts.streambridge.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Durations are measured with {@link System#nanoTime()} and reported in milliseconds,
 * or in seconds with millisecond precision on the client wire.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds (truncated)
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Converts milliseconds to seconds rounded half-up to three decimals.
     *
     * @param millis duration in milliseconds
     * @return seconds, e.g. {@code 1.5} for 1500
     */
    public static double millisToSeconds(long millis) {
        return BigDecimal.valueOf(millis).movePointLeft(3).setScale(3, RoundingMode.HALF_UP).doubleValue();
    }
}
