package com.edgeviewer.edgeviewer.service.display;

import java.util.OptionalDouble;

/**
 * Instantaneous frame rate from consecutive frame timestamps.
 * Not thread-safe: fed only from the capture thread.
 */
public class StatsCalculator {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private boolean hasBaseline;
    private long previousTimestampNs;

    /**
     * @return empty on the first call after construction or {@link #reset()}; otherwise
     *         frames per second for the last interval, or 0 when the timestamp did not advance
     */
    public OptionalDouble update(long timestampNs) {
        if (!hasBaseline) {
            hasBaseline = true;
            previousTimestampNs = timestampNs;
            return OptionalDouble.empty();
        }

        long delta = timestampNs - previousTimestampNs;
        previousTimestampNs = timestampNs;
        return OptionalDouble.of(delta > 0 ? NANOS_PER_SECOND / delta : 0d);
    }

    public void reset() {
        hasBaseline = false;
        previousTimestampNs = 0L;
    }
}
