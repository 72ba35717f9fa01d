package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Filtered, change-descending scan results plus a human-readable status line.
 * A missing or empty watchlist is an empty outcome with an explanatory status, never an error.
 */
public record ScanOutcome(
    @JsonProperty("scanIntent") ScanIntent scanIntent,
    @JsonProperty("timeRange")  TimeRange timeRange,
    @JsonProperty("results")    List<ScanResult> results,
    @JsonProperty("status")     String status
) {
    public ScanOutcome {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static ScanOutcome empty(ScanIntent scanIntent, TimeRange timeRange, String status) {
        return new ScanOutcome(scanIntent, timeRange, List.of(), status);
    }

    @JsonIgnore
    public boolean isEmpty() { return results.isEmpty(); }
}
