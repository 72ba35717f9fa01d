package com.researchplatform.analysis.profile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only summary of a {@link com.researchplatform.analysis.frame.SeriesFrame}, handed to the
 * visualization planner.
 */
public record DatasetProfile(
    @JsonProperty("row_count")        int rowCount,
    @JsonProperty("column_count")     int columnCount,
    @JsonProperty("columns")          List<String> columns,
    @JsonProperty("column_types")     Map<String, String> columnTypes,
    @JsonProperty("numeric_columns")  List<String> numericColumns,
    @JsonProperty("datetime_columns") List<String> datetimeColumns
) {
    public DatasetProfile {
        columns = columns == null ? List.of() : List.copyOf(columns);
        columnTypes = columnTypes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(columnTypes));
        numericColumns = numericColumns == null ? List.of() : List.copyOf(numericColumns);
        datetimeColumns = datetimeColumns == null ? List.of() : List.copyOf(datetimeColumns);
    }

    /** First datetime column, else the first column, else {@code "index"}. */
    @JsonIgnore
    public String primaryDatetimeColumn() {
        if (!datetimeColumns.isEmpty()) return datetimeColumns.get(0);
        if (!columns.isEmpty()) return columns.get(0);
        return "index";
    }
}
