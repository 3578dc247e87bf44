package com.edgeviewer.edgeviewer.util;

import java.time.Duration;

public final class DurationFormatter {

    private DurationFormatter() {}

    /**
     * "1h 5m", "3m 12s" or "42s".
     */
    public static String humanize(Duration duration) {
        long seconds = Math.max(0, duration.getSeconds());
        long minutes = seconds / 60;
        long hours = minutes / 60;

        if (hours > 0) {
            return String.format("%dh %dm", hours, minutes % 60);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds % 60);
        } else {
            return String.format("%ds", seconds);
        }
    }
}
