package com.researchplatform.analysis.plan;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum ChartType {
    LINE("line"),
    HISTOGRAM("histogram"),
    SCATTER("scatter"),
    BAR("bar");

    private final String wire;

    ChartType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() { return wire; }

    public static Optional<ChartType> fromWire(String raw) {
        if (raw == null) return Optional.empty();
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ChartType type : values()) {
            if (type.wire.equals(normalized)) return Optional.of(type);
        }
        return Optional.empty();
    }
}
