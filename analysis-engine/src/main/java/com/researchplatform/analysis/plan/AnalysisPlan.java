package com.researchplatform.analysis.plan;

import java.util.List;

/**
 * Planner output: insight bullets plus the charts to draw. {@code fallback} marks the fixed
 * default plan used when the planner's reply could not be decoded.
 */
public record AnalysisPlan(List<String> insights, List<VisualizationSpec> visualizations, boolean fallback) {

    public AnalysisPlan {
        insights = insights == null ? List.of() : List.copyOf(insights);
        visualizations = visualizations == null ? List.of() : List.copyOf(visualizations);
    }

    /** Insights as newline-joined {@code "* item"} bullets; the fallback note is returned as-is. */
    public String insightsText() {
        if (fallback) {
            return insights.isEmpty() ? "" : insights.get(0);
        }
        return String.join("\n", insights.stream().map(item -> "* " + item).toList());
    }
}
