package com.researchplatform.analysis.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchplatform.analysis.profile.DatasetProfile;
import com.researchplatform.common.llm.LlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Asks the language model for insights and a chart plan in one call. Never errors: a failed
 * call or an undecodable reply yields {@link PlanDecoder#fallbackPlan}.
 */
@Component
public class VisualizationPlanner {

    private static final Logger log = LoggerFactory.getLogger(VisualizationPlanner.class);

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;

    public VisualizationPlanner(LlmClient llmClient, ObjectMapper objectMapper) {
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
    }

    public Mono<AnalysisPlan> plan(DatasetProfile profile) {
        return Mono.fromCallable(() -> buildPrompt(profile))
            .flatMap(llmClient::complete)
            .map(reply -> PlanDecoder.decodeStructured(reply, objectMapper).orElseGet(() -> {
                log.warn("[Analysis] Planner reply not decodable, using default plan. replyLength={}", reply.length());
                return PlanDecoder.fallbackPlan(profile);
            }))
            .doOnNext(plan -> log.info("[Analysis] Plan ready. insights={} visualizations={} fallback={}",
                plan.insights().size(), plan.visualizations().size(), plan.fallback()))
            .switchIfEmpty(Mono.fromSupplier(() -> PlanDecoder.fallbackPlan(profile)))
            .onErrorResume(e -> {
                log.error("[Analysis] Planner call failed, using default plan. reason={}", e.getMessage());
                return Mono.just(PlanDecoder.fallbackPlan(profile));
            });
    }

    String buildPrompt(DatasetProfile profile) throws JsonProcessingException {
        String x = profile.primaryDatetimeColumn();
        String profileJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(profile);
        return """
            You are a financial data scientist. Using the profile of a stock price time series below,
            write key insights and plan charts for it.

            Data profile:
            %s

            Reply with a single JSON object and nothing else. It must have two keys:
            - "insights": 3 to 5 short bullet-style strings about trends, correlations and anomalies.
            - "visualizations": 3 chart objects, each {"type": ..., "columns": [...], "title": ...}:
                1. a "line" chart of "close" over "%s",
                2. a "histogram" of "volume",
                3. one more chart of your choice ("scatter" or "bar").

            Example:
            {
              "insights": ["Closing price trends upward over the window.", "Volume spikes cluster near the lows."],
              "visualizations": [
                {"type": "line", "columns": ["%s", "close"], "title": "Closing Price Over Time"},
                {"type": "histogram", "columns": ["volume"], "title": "Trading Volume Distribution"},
                {"type": "scatter", "columns": ["open", "close"], "title": "Open vs. Close"}
              ]
            }
            """.formatted(profileJson, x, x);
    }
}
