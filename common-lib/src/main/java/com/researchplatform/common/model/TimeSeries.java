package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Ordered OHLCV series for one symbol, oldest bar first.
 *
 * <p>Timestamps are strictly increasing; construction fails otherwise. {@code provenance}
 * and {@code sourceNote} record whether the data is live or simulated and why.
 */
public record TimeSeries(
    @JsonProperty("symbol")     String symbol,
    @JsonProperty("timeRange")  TimeRange timeRange,
    @JsonProperty("bars")       List<PriceBar> bars,
    @JsonProperty("provenance") Provenance provenance,
    @JsonProperty("sourceNote") String sourceNote
) {
    public TimeSeries {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(provenance, "provenance");
        if (timeRange == null) timeRange = TimeRange.INTRADAY;
        bars = bars == null ? List.of() : List.copyOf(bars);
        for (int i = 1; i < bars.size(); i++) {
            if (!bars.get(i).timestamp().isAfter(bars.get(i - 1).timestamp())) {
                throw new IllegalArgumentException("Bar timestamps must be strictly increasing. symbol="
                    + symbol + " index=" + i + " timestamp=" + bars.get(i).timestamp());
            }
        }
    }

    @JsonIgnore
    public boolean isEmpty() { return bars.isEmpty(); }

    @JsonIgnore
    public int size() { return bars.size(); }

    @JsonIgnore
    public PriceBar first() { return bars.get(0); }

    @JsonIgnore
    public PriceBar last() { return bars.get(bars.size() - 1); }

    @JsonIgnore
    public boolean isSimulated() { return provenance == Provenance.SIMULATED; }
}
