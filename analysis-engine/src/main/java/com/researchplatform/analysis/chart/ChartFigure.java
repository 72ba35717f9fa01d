package com.researchplatform.analysis.chart;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.researchplatform.analysis.plan.ChartType;

import java.util.List;

/**
 * Renderer-neutral chart handle: the data a presentation layer needs to draw one chart.
 * Histogram points are bins ({@code x} = lower edge, {@code y} = count).
 */
public record ChartFigure(
    @JsonProperty("type")    ChartType type,
    @JsonProperty("title")   String title,
    @JsonProperty("xColumn") String xColumn,
    @JsonProperty("yColumn") String yColumn,
    @JsonProperty("points")  List<ChartPoint> points
) {
    public ChartFigure {
        points = points == null ? List.of() : List.copyOf(points);
    }
}
