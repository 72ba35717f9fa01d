package com.researchplatform.common.model;

/**
 * Where a {@link TimeSeries} came from. Carried through to the final report.
 */
public enum Provenance {
    LIVE("Real API (Alpha Vantage)"),
    SIMULATED("Simulated (Fallback)");

    private final String label;

    Provenance(String label) {
        this.label = label;
    }

    public String label() { return label; }
}
