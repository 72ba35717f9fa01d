package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Requested data window. Each range knows its wire code, its span in days (used for the
 * live cutoff filter) and the shape of a simulated series (point count and spacing).
 */
public enum TimeRange {

    INTRADAY("INTRADAY", 1, 100, Duration.ofMinutes(5)),
    ONE_DAY("1D", 1, 1, Duration.ofDays(1)),
    THREE_DAYS("3D", 3, 3, Duration.ofDays(1)),
    ONE_WEEK("1W", 7, 7, Duration.ofDays(1)),
    ONE_MONTH("1M", 30, 30, Duration.ofDays(1)),
    THREE_MONTHS("3M", 90, 90, Duration.ofDays(1)),
    ONE_YEAR("1Y", 365, 365, Duration.ofDays(1));

    private final String code;
    private final int days;
    private final int syntheticPoints;
    private final Duration spacing;

    TimeRange(String code, int days, int syntheticPoints, Duration spacing) {
        this.code = code;
        this.days = days;
        this.syntheticPoints = syntheticPoints;
        this.spacing = spacing;
    }

    @JsonValue
    public String code() { return code; }

    public int days() { return days; }

    public int syntheticPoints() { return syntheticPoints; }

    public Duration spacing() { return spacing; }

    public boolean isIntraday() { return this == INTRADAY; }

    /** Lenient lookup by wire code or enum name; empty for unknown input. */
    public static Optional<TimeRange> fromCode(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (TimeRange range : values()) {
            if (range.code.equals(normalized) || range.name().equals(normalized)) {
                return Optional.of(range);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static TimeRange fromJson(String raw) {
        return fromCode(raw).orElse(INTRADAY);
    }
}
