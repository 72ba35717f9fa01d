package com.researchplatform.analysis.chart;

/** A plan entry that cannot be drawn against the frame it was given. */
public class ChartSpecException extends IllegalArgumentException {
    public ChartSpecException(String message) {
        super(message);
    }
}
