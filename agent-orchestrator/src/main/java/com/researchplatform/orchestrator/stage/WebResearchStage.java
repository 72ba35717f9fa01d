package com.researchplatform.orchestrator.stage;

import com.researchplatform.orchestrator.client.WebResearchClient;
import com.researchplatform.orchestrator.model.WebResearchOutcome;
import com.researchplatform.orchestrator.pipeline.PipelineKeys;
import com.researchplatform.orchestrator.pipeline.PipelineStage;
import com.researchplatform.orchestrator.pipeline.PipelineState;
import com.researchplatform.orchestrator.pipeline.StateUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/** Searches the web for the raw task text. Skipped in scan mode. */
@Component
@Order(2)
public class WebResearchStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(WebResearchStage.class);
    static final String DEPTH = "advanced";

    private final WebResearchClient webResearchClient;

    public WebResearchStage(WebResearchClient webResearchClient) {
        this.webResearchClient = webResearchClient;
    }

    @Override
    public String name() {
        return PipelineKeys.WEB_RESEARCH;
    }

    @Override
    public Mono<StateUpdate> apply(PipelineState state) {
        if (PipelineKeys.isScan(state)) {
            return Mono.just(StateUpdate.of(PipelineKeys.WEB_RESEARCH_RESULT,
                WebResearchOutcome.skipped(WebResearchOutcome.SCAN_SKIPPED)));
        }
        List<String> queries = List.of(state.task());
        return webResearchClient.research(queries, DEPTH)
            .map(response -> WebResearchOutcome.from(queries, response))
            .onErrorResume(e -> {
                log.warn("[WebResearch] Search failed, continuing without web data. reason={}", e.getMessage());
                return Mono.just(WebResearchOutcome.failed(queries, e.getMessage()));
            })
            .defaultIfEmpty(WebResearchOutcome.failed(queries, "empty response"))
            .map(outcome -> StateUpdate.of(PipelineKeys.WEB_RESEARCH_RESULT, outcome));
    }
}
