package com.researchplatform.marketdata.client;

import com.researchplatform.common.model.TimeRange;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Trims a full daily history down to the requested window: keeps entries dated on or after
 * {@code now - range.days()}. Keys that do not parse as {@code yyyy-MM-dd} are kept.
 */
public final class DailyRangeFilter {

    private DailyRangeFilter() {}

    public static <V> Map<String, V> apply(Map<String, V> data, TimeRange range, LocalDateTime now) {
        LocalDateTime cutoff = now.minusDays(range.days());
        Map<String, V> filtered = new LinkedHashMap<>();
        data.forEach((key, value) -> {
            try {
                LocalDateTime timestamp = LocalDate.parse(key).atStartOfDay();
                if (!timestamp.isBefore(cutoff)) {
                    filtered.put(key, value);
                }
            } catch (DateTimeParseException e) {
                filtered.put(key, value);
            }
        });
        return filtered;
    }
}
