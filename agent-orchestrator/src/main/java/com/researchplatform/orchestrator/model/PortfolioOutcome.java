package com.researchplatform.orchestrator.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/** Portfolio lookup result; {@code rows} is empty when the lookup was skipped or failed. */
public record PortfolioOutcome(String question, String generatedQuery, List<Map<String, Object>> rows, String note) {

    public static final String SCAN_SKIPPED = "Market Scan initiated. Portfolio context skipped.";
    public static final String NO_SYMBOL = "Skipped: No symbol provided.";

    public PortfolioOutcome {
        rows = rows == null ? List.of() : rows.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    }

    public static PortfolioOutcome skipped(String note) {
        return new PortfolioOutcome(null, null, List.of(), note);
    }

    public static PortfolioOutcome failed(String question, String reason) {
        return new PortfolioOutcome(question, null, List.of(), "Portfolio data unavailable: " + reason);
    }

    public String describe() {
        if (note != null) return note;
        if (question == null) return "Not available.";
        StringBuilder text = new StringBuilder("Question: ").append(question);
        if (generatedQuery != null) text.append("\nQuery: ").append(generatedQuery);
        if (rows.isEmpty()) {
            text.append("\nRows: none (no current exposure recorded)");
        } else {
            text.append("\nRows:");
            rows.forEach(row -> text.append("\n- ").append(row));
        }
        return text.toString();
    }
}
