package com.researchplatform.orchestrator.report;

/** Caps externally sourced text before it goes into a report prompt. */
public final class TextBudget {

    static final String MARKER = "... (truncated)";

    private TextBudget() {}

    public static String truncate(String text, int maxChars) {
        if (text == null) return "Not available.";
        if (text.length() <= maxChars) return text;
        return text.substring(0, maxChars) + MARKER;
    }
}
