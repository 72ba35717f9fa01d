package com.researchplatform.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Raw scan parameters; unknown values fall back to ALL and INTRADAY. */
public record ScanRequest(
    @JsonProperty("scanIntent") String scanIntent,
    @JsonProperty("timeRange")  String timeRange
) {}
