package com.researchplatform.analysis.frame;

/** Column kinds a {@link SeriesFrame} can hold, with the dtype label shown to the planner. */
public enum ColumnType {
    DATETIME("datetime64[ns]"),
    FLOAT("float64"),
    INTEGER("int64");

    private final String dtype;

    ColumnType(String dtype) {
        this.dtype = dtype;
    }

    public String dtype() { return dtype; }

    public boolean isNumeric() { return this != DATETIME; }
}
