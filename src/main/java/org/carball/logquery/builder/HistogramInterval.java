package org.carball.logquery.builder;

import java.time.Duration;

/**
 * Bucket sizes for histogram queries, each backed by a ClickHouse rounding function.
 */
public enum HistogramInterval {
    MINUTE("toStartOfMinute", Duration.ofMinutes(1)),
    FIVE_MINUTES("toStartOfFiveMinutes", Duration.ofMinutes(5)),
    FIFTEEN_MINUTES("toStartOfFifteenMinutes", Duration.ofMinutes(15)),
    HOUR("toStartOfHour", Duration.ofHours(1)),
    DAY("toStartOfDay", Duration.ofDays(1));

    private static final long TARGET_BUCKETS = 120;

    private final String function;
    private final Duration width;

    HistogramInterval(String function, Duration width) {
        this.function = function;
        this.width = width;
    }

    public String getFunction() {
        return function;
    }

    public Duration getWidth() {
        return width;
    }

    /**
     * Picks the finest bucket that keeps a range under roughly 120 buckets.
     */
    public static HistogramInterval forRange(Duration range) {
        for (HistogramInterval interval : values()) {
            if (range.dividedBy(interval.width) <= TARGET_BUCKETS) {
                return interval;
            }
        }
        return DAY;
    }

    public static HistogramInterval fromName(String name) {
        for (HistogramInterval interval : values()) {
            if (interval.name().equalsIgnoreCase(name.replace('-', '_'))) {
                return interval;
            }
        }
        throw new IllegalArgumentException("Unknown histogram interval: " + name);
    }
}
