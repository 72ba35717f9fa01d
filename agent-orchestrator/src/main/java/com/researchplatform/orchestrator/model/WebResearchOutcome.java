package com.researchplatform.orchestrator.model;

import com.researchplatform.orchestrator.client.dto.SearchResponse;

import java.util.List;

/**
 * Result of the web research stage, already rendered to prompt text.
 * {@code hasContent} is false when the stage was skipped, failed, or found nothing.
 */
public record WebResearchOutcome(List<String> queries, String text, int resultCount, boolean hasContent) {

    public static final String SCAN_SKIPPED = "Market Scan initiated. Web research skipped for individual stock.";

    public WebResearchOutcome {
        queries = queries == null ? List.of() : List.copyOf(queries);
        if (text == null) text = "";
    }

    public static WebResearchOutcome skipped(String reason) {
        return new WebResearchOutcome(List.of(), reason, 0, false);
    }

    public static WebResearchOutcome failed(List<String> queries, String reason) {
        return new WebResearchOutcome(queries, "Web research unavailable: " + reason, 0, false);
    }

    /** Renders each query's hits as {@code - title (url): content} lines. */
    public static WebResearchOutcome from(List<String> queries, SearchResponse response) {
        StringBuilder text = new StringBuilder();
        int count = 0;
        for (SearchResponse.QueryResults block : response.data()) {
            text.append("Query: ").append(block.query()).append('\n');
            for (SearchResponse.SearchHit hit : block.results()) {
                text.append("- ").append(nullToEmpty(hit.title()))
                    .append(" (").append(nullToEmpty(hit.url())).append("): ")
                    .append(nullToEmpty(hit.content()).replace('\n', ' '))
                    .append('\n');
                count++;
            }
        }
        if (count == 0) {
            return new WebResearchOutcome(queries, "No web results found.", 0, false);
        }
        return new WebResearchOutcome(queries, text.toString().trim(), count, true);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
