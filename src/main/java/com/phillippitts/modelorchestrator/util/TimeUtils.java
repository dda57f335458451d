package com.phillippitts.modelorchestrator.util;

/**
 * Conversions for timings taken with {@link System#nanoTime()}.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    /**
     * Converts nanoseconds to milliseconds, truncating.
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Milliseconds elapsed since {@code startNanos}.
     *
     * <pre>
     * long start = System.nanoTime();
     * backend.process(model, step, input);
     * LOG.info("step took {}ms", TimeUtils.elapsedMillis(start));
     * </pre>
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds
     */
    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }
}
