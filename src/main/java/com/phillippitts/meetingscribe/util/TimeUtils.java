package com.phillippitts.meetingscribe.util;

import java.util.Locale;

/**
 * Timing helpers for logs: elapsed milliseconds from {@link System#nanoTime()} and audio durations.
 */
public final class TimeUtils {

    static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    /**
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos, truncated
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Formats an audio duration or timeline position in seconds with two decimals, e.g. {@code "2.05"}.
     */
    public static String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.2f", seconds);
    }
}
