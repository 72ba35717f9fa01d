package com.researchplatform.analysis.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * One planned chart as the planner wrote it. {@code type} stays a raw string so that an
 * unsupported type can be reported at render time instead of failing the whole plan.
 */
public record VisualizationSpec(
    @JsonProperty("type")    String type,
    @JsonProperty("columns") List<String> columns,
    @JsonProperty("title")   String title
) {
    public VisualizationSpec {
        columns = columns == null ? List.of() : List.copyOf(columns);
        if (title == null) title = "";
    }

    @JsonIgnore
    public Optional<ChartType> chartType() {
        return ChartType.fromWire(type);
    }
}
