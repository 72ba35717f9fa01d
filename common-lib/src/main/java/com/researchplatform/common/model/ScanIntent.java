package com.researchplatform.common.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Directional filter applied to a watchlist scan.
 */
public enum ScanIntent {
    UPWARD,
    DOWNWARD,
    ALL;

    /** Keeps a percent change according to this intent: strictly positive, strictly negative, or any. */
    public boolean accepts(double changePct) {
        return switch (this) {
            case UPWARD   -> changePct > 0;
            case DOWNWARD -> changePct < 0;
            case ALL      -> true;
        };
    }

    public static Optional<ScanIntent> fromCode(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(ScanIntent.valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
