package com.researchplatform.orchestrator.stage;

import com.researchplatform.analysis.frame.SeriesFrame;
import com.researchplatform.common.model.Intent;
import com.researchplatform.orchestrator.model.MarketDataOutcome;
import com.researchplatform.orchestrator.pipeline.PipelineKeys;
import com.researchplatform.orchestrator.pipeline.PipelineStage;
import com.researchplatform.orchestrator.pipeline.PipelineState;
import com.researchplatform.orchestrator.pipeline.StateUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Builds the analysis frame from the single-symbol series; an empty frame otherwise. */
@Component
@Order(5)
public class TransformStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(TransformStage.class);

    @Override
    public String name() {
        return PipelineKeys.TRANSFORM;
    }

    @Override
    public Mono<StateUpdate> apply(PipelineState state) {
        Intent intent = state.get(PipelineKeys.INTENT).orElse(Intent.none());
        String symbol = intent.symbol() == null ? "" : intent.symbol();
        if (intent.isScan()) {
            return Mono.just(StateUpdate.of(PipelineKeys.FRAME, SeriesFrame.empty(symbol)));
        }
        SeriesFrame frame = state.get(PipelineKeys.MARKET_DATA_RESULT)
            .filter(MarketDataOutcome::hasContent)
            .filter(MarketDataOutcome.SeriesData.class::isInstance)
            .map(outcome -> SeriesFrame.from(((MarketDataOutcome.SeriesData) outcome).series()))
            .orElseGet(() -> {
                log.info("[Transform] No usable market data, empty frame. symbol={}", symbol);
                return SeriesFrame.empty(symbol);
            });
        return Mono.just(StateUpdate.of(PipelineKeys.FRAME, frame));
    }
}
