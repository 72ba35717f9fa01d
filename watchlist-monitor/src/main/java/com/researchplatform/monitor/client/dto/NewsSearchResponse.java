package com.researchplatform.monitor.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/** Subset of the search service's {@code POST /research} body read by the news check. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NewsSearchResponse(
    @JsonProperty("status")  String status,
    @JsonProperty("message") String message,
    @JsonProperty("data")    List<QueryResults> data
) {
    public NewsSearchResponse {
        data = data == null ? List.of() : List.copyOf(data);
    }

    /** First hit of the first query, if any. */
    public Optional<Headline> topHeadline() {
        if (data.isEmpty() || data.get(0).results().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(data.get(0).results().get(0));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record QueryResults(
        @JsonProperty("query")   String query,
        @JsonProperty("results") List<Headline> results
    ) {
        public QueryResults {
            results = results == null ? List.of() : List.copyOf(results);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Headline(
        @JsonProperty("title")   String title,
        @JsonProperty("url")     String url,
        @JsonProperty("content") String content
    ) {}
}
