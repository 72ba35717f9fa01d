package com.researchplatform.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/** Body returned by the portfolio service's {@code POST /portfolio_data}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PortfolioResponse(
    @JsonProperty("status")   String status,
    @JsonProperty("question") String question,
    @JsonProperty("generated_query") @JsonAlias("generated_sql") String generatedQuery,
    @JsonProperty("data")     List<Map<String, Object>> data,
    @JsonProperty("message")  String message
) {
    public PortfolioResponse {
        data = data == null ? List.of() : data;
    }

    public boolean isSuccess() {
        return "success".equalsIgnoreCase(status);
    }
}
