package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record PriceBar(
    @JsonProperty("timestamp") LocalDateTime timestamp,
    @JsonProperty("open")      double open,
    @JsonProperty("high")      double high,
    @JsonProperty("low")       double low,
    @JsonProperty("close")     double close,
    @JsonProperty("volume")    long volume
) {}
