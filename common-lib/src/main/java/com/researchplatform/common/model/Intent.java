package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured interpretation of a free-text research request.
 *
 * <p>At most one of {@code symbol} and {@code scanIntent} is expected to be set. Both may be
 * absent, which means the request could not be resolved; that case is legal and ends in the
 * refusal report.
 */
public record Intent(
    @JsonProperty("symbol")     String symbol,
    @JsonProperty("scanIntent") ScanIntent scanIntent,
    @JsonProperty("timeRange")  TimeRange timeRange
) {
    public Intent {
        if (timeRange == null) timeRange = TimeRange.INTRADAY;
    }

    public static Intent forSymbol(String symbol, TimeRange timeRange) {
        return new Intent(symbol, null, timeRange);
    }

    public static Intent forScan(ScanIntent scanIntent, TimeRange timeRange) {
        return new Intent(null, scanIntent, timeRange);
    }

    /** The "insufficient input" intent: neither a symbol nor a scan. */
    public static Intent none() {
        return new Intent(null, null, TimeRange.INTRADAY);
    }

    public boolean isScan() { return scanIntent != null; }

    public boolean hasSymbol() { return symbol != null && !symbol.isBlank(); }
}
