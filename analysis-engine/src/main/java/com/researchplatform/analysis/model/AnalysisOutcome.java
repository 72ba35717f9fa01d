package com.researchplatform.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.researchplatform.analysis.chart.ChartFigure;
import com.researchplatform.analysis.chart.SkippedChart;
import com.researchplatform.analysis.plan.VisualizationSpec;

import java.util.List;

public record AnalysisOutcome(
    @JsonProperty("insights")       String insights,
    @JsonProperty("visualizations") List<VisualizationSpec> visualizations,
    @JsonProperty("charts")         List<ChartFigure> charts,
    @JsonProperty("skipped")        List<SkippedChart> skipped
) {
    public static final String NO_DATA = "No data available for analysis.";

    public AnalysisOutcome {
        if (insights == null) insights = "";
        visualizations = visualizations == null ? List.of() : List.copyOf(visualizations);
        charts = charts == null ? List.of() : List.copyOf(charts);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    /** Outcome with only an insights line and no charts; used for empty data and scan runs. */
    public static AnalysisOutcome empty(String insights) {
        return new AnalysisOutcome(insights, List.of(), List.of(), List.of());
    }

    @JsonIgnore
    public boolean hasCharts() { return !charts.isEmpty(); }
}
