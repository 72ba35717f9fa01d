package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record Alert(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("type")      AlertType type,
    @JsonProperty("symbol")    String symbol,
    @JsonProperty("message")   String message,
    @JsonProperty("details")   Map<String, Object> details
) {
    public Alert {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
