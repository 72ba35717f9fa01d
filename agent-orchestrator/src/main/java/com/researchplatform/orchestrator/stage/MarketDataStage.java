package com.researchplatform.orchestrator.stage;

import com.researchplatform.common.model.Intent;
import com.researchplatform.common.model.ScanOutcome;
import com.researchplatform.marketdata.scan.ScanEngine;
import com.researchplatform.marketdata.service.MarketDataService;
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

/**
 * Fetches the series for the extracted symbol, or runs the watchlist scan in scan mode.
 */
@Component
@Order(3)
public class MarketDataStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(MarketDataStage.class);
    static final String SCAN_FAILED = "Error executing scan.";

    private final MarketDataService marketDataService;
    private final ScanEngine scanEngine;

    public MarketDataStage(MarketDataService marketDataService, ScanEngine scanEngine) {
        this.marketDataService = marketDataService;
        this.scanEngine = scanEngine;
    }

    @Override
    public String name() {
        return PipelineKeys.MARKET_DATA;
    }

    @Override
    public Mono<StateUpdate> apply(PipelineState state) {
        Intent intent = state.get(PipelineKeys.INTENT).orElse(Intent.none());
        Mono<MarketDataOutcome> outcome;
        if (intent.isScan()) {
            outcome = scanEngine.scanWatchlist(intent.scanIntent(), intent.timeRange())
                .onErrorResume(e -> {
                    log.error("[MarketData] Scan failed. intent={} reason={}", intent.scanIntent(), e.getMessage());
                    return Mono.just(ScanOutcome.empty(intent.scanIntent(), intent.timeRange(), SCAN_FAILED));
                })
                .map(MarketDataOutcome.ScanData::new);
        } else if (!intent.hasSymbol()) {
            outcome = Mono.just(new MarketDataOutcome.Skipped("Skipped."));
        } else {
            outcome = marketDataService.fetch(intent.symbol(), intent.timeRange())
                .map(MarketDataOutcome.SeriesData::new);
        }
        return outcome
            .defaultIfEmpty(new MarketDataOutcome.Skipped("No market data returned."))
            .map(result -> StateUpdate.of(PipelineKeys.MARKET_DATA_RESULT, result));
    }
}
