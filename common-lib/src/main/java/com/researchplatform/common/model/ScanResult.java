package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ScanResult(
    @JsonProperty("symbol")     String symbol,
    @JsonProperty("price")      double price,
    @JsonProperty("changePct")  double changePct,
    @JsonProperty("provenance") Provenance provenance
) {}
