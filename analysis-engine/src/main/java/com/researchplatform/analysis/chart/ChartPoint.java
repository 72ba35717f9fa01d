package com.researchplatform.analysis.chart;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChartPoint(
    @JsonProperty("x") Object x,
    @JsonProperty("y") double y
) {}
