package com.researchplatform.orchestrator.stage;

import com.researchplatform.common.model.Intent;
import com.researchplatform.orchestrator.client.PortfolioClient;
import com.researchplatform.orchestrator.model.PortfolioOutcome;
import com.researchplatform.orchestrator.pipeline.PipelineKeys;
import com.researchplatform.orchestrator.pipeline.PipelineStage;
import com.researchplatform.orchestrator.pipeline.PipelineState;
import com.researchplatform.orchestrator.pipeline.StateUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@Order(4)
public class PortfolioLookupStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(PortfolioLookupStage.class);

    private final PortfolioClient portfolioClient;

    public PortfolioLookupStage(PortfolioClient portfolioClient) {
        this.portfolioClient = portfolioClient;
    }

    @Override
    public String name() {
        return PipelineKeys.PORTFOLIO_LOOKUP;
    }

    @Override
    public Mono<StateUpdate> apply(PipelineState state) {
        Intent intent = state.get(PipelineKeys.INTENT).orElse(Intent.none());
        if (intent.isScan()) {
            return Mono.just(update(PortfolioOutcome.skipped(PortfolioOutcome.SCAN_SKIPPED)));
        }
        if (!intent.hasSymbol()) {
            return Mono.just(update(PortfolioOutcome.skipped(PortfolioOutcome.NO_SYMBOL)));
        }
        String question = exposureQuestion(intent.symbol());
        return portfolioClient.query(question)
            .map(response -> new PortfolioOutcome(question, response.generatedQuery(), response.data(), null))
            .onErrorResume(e -> {
                log.warn("[Portfolio] Lookup failed, continuing without portfolio data. symbol={} reason={}",
                    intent.symbol(), e.getMessage());
                return Mono.just(PortfolioOutcome.failed(question, e.getMessage()));
            })
            .defaultIfEmpty(PortfolioOutcome.failed(question, "empty response"))
            .map(PortfolioLookupStage::update);
    }

    static String exposureQuestion(String symbol) {
        return "What is the current exposure to " + symbol + "?";
    }

    private static StateUpdate update(PortfolioOutcome outcome) {
        return StateUpdate.of(PipelineKeys.PORTFOLIO, outcome);
    }
}
