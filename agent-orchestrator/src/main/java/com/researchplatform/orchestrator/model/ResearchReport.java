package com.researchplatform.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.researchplatform.analysis.chart.ChartFigure;
import com.researchplatform.analysis.chart.SkippedChart;
import com.researchplatform.analysis.plan.VisualizationSpec;
import com.researchplatform.common.model.Provenance;
import com.researchplatform.common.model.ScanResult;
import com.researchplatform.common.model.TimeRange;
import com.researchplatform.orchestrator.report.ReportKind;

import java.time.Instant;
import java.util.List;

/**
 * Final output of one research run, handed to the presentation layer.
 * {@code provenance} and {@code sourceNote} are set for single-symbol reports backed by a series.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResearchReport(
    @JsonProperty("traceId")        String traceId,
    @JsonProperty("task")           String task,
    @JsonProperty("kind")           ReportKind kind,
    @JsonProperty("symbol")         String symbol,
    @JsonProperty("timeRange")      TimeRange timeRange,
    @JsonProperty("reportText")     String reportText,
    @JsonProperty("fallback")       boolean fallback,
    @JsonProperty("provenance")     Provenance provenance,
    @JsonProperty("sourceNote")     String sourceNote,
    @JsonProperty("scanStatus")     String scanStatus,
    @JsonProperty("scanResults")    List<ScanResult> scanResults,
    @JsonProperty("insights")       String insights,
    @JsonProperty("visualizations") List<VisualizationSpec> visualizations,
    @JsonProperty("charts")         List<ChartFigure> charts,
    @JsonProperty("skippedCharts")  List<SkippedChart> skippedCharts,
    @JsonProperty("generatedAt")    Instant generatedAt
) {
    public ResearchReport {
        scanResults = scanResults == null ? List.of() : List.copyOf(scanResults);
        visualizations = visualizations == null ? List.of() : List.copyOf(visualizations);
        charts = charts == null ? List.of() : List.copyOf(charts);
        skippedCharts = skippedCharts == null ? List.of() : List.copyOf(skippedCharts);
    }
}
