package com.researchplatform.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Alpha Vantage time-series body. Throttled or rejected calls come back with HTTP 200 and
 * only one of {@code note}, {@code information} or {@code errorMessage} populated.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlphaVantageTimeSeriesResponse(
    @JsonProperty("Meta Data") MetaData metaData,
    @JsonProperty("Time Series (5min)") Map<String, OhlcvData> timeSeries5min,
    @JsonProperty("Time Series (Daily)") Map<String, OhlcvData> timeSeriesDaily,
    @JsonProperty("Note") String note,
    @JsonProperty("Information") String information,
    @JsonProperty("Error Message") String errorMessage
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MetaData(
        @JsonProperty("1. Information") String information,
        @JsonProperty("2. Symbol") String symbol,
        @JsonProperty("3. Last Refreshed") String lastRefreshed
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OhlcvData(
        @JsonProperty("1. open") String open,
        @JsonProperty("2. high") String high,
        @JsonProperty("3. low") String low,
        @JsonProperty("4. close") String close,
        @JsonProperty("5. volume") String volume
    ) {
        public double openAsDouble() {
            return Double.parseDouble(open);
        }
        public double highAsDouble() {
            return Double.parseDouble(high);
        }
        public double lowAsDouble() {
            return Double.parseDouble(low);
        }
        public double closeAsDouble() {
            return Double.parseDouble(close);
        }
        public long volumeAsLong() {
            return (long) Double.parseDouble(volume);
        }
    }

    /** Whichever explanatory field the API filled in, for logging a rejected call. */
    public String diagnostic() {
        if (errorMessage != null) return errorMessage;
        if (note != null) return note;
        if (information != null) return information;
        return "no time series object in response";
    }
}
