package com.researchplatform.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Body returned by the search service's {@code POST /research}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchResponse(
    @JsonProperty("status")  String status,
    @JsonProperty("message") String message,
    @JsonProperty("data")    List<QueryResults> data
) {
    public SearchResponse {
        data = data == null ? List.of() : List.copyOf(data);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record QueryResults(
        @JsonProperty("query")   String query,
        @JsonProperty("results") List<SearchHit> results
    ) {
        public QueryResults {
            results = results == null ? List.of() : List.copyOf(results);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SearchHit(
        @JsonProperty("title")   String title,
        @JsonProperty("url")     String url,
        @JsonProperty("content") String content
    ) {}
}
