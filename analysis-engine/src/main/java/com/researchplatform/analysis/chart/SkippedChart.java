package com.researchplatform.analysis.chart;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SkippedChart(
    @JsonProperty("title")  String title,
    @JsonProperty("reason") String reason
) {}
