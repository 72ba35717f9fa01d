package com.researchplatform.orchestrator.report;

import com.researchplatform.analysis.model.AnalysisOutcome;
import com.researchplatform.common.model.Intent;
import com.researchplatform.common.model.ScanOutcome;
import com.researchplatform.common.model.TimeRange;
import com.researchplatform.orchestrator.model.MarketDataOutcome;
import com.researchplatform.orchestrator.model.PortfolioOutcome;
import com.researchplatform.orchestrator.model.WebResearchOutcome;
import com.researchplatform.orchestrator.pipeline.PipelineKeys;
import com.researchplatform.orchestrator.pipeline.PipelineState;

/**
 * What the report is written from, decided once from the market data outcome.
 */
public sealed interface ReportInput permits ReportInput.SingleSymbol, ReportInput.MarketScan {

    String task();

    record SingleSymbol(
        String task,
        String symbol,
        TimeRange timeRange,
        WebResearchOutcome web,
        MarketDataOutcome market,
        PortfolioOutcome portfolio,
        AnalysisOutcome analysis
    ) implements ReportInput {

        /** Unresolved symbol, or neither web nor market data has anything to say. */
        public boolean isInsufficient() {
            boolean noSymbol = symbol == null || symbol.isBlank();
            boolean noWeb = web == null || !web.hasContent();
            boolean noMarket = market == null || !market.hasContent();
            return noSymbol || noWeb && noMarket;
        }
    }

    record MarketScan(String task, ScanOutcome scan) implements ReportInput {}

    static ReportInput from(PipelineState state) {
        MarketDataOutcome market = state.get(PipelineKeys.MARKET_DATA_RESULT)
            .orElse(new MarketDataOutcome.Skipped("Not available."));
        if (market instanceof MarketDataOutcome.ScanData scanData) {
            return new MarketScan(state.task(), scanData.scan());
        }
        Intent intent = state.get(PipelineKeys.INTENT).orElse(Intent.none());
        return new SingleSymbol(
            state.task(),
            intent.symbol(),
            intent.timeRange(),
            state.get(PipelineKeys.WEB_RESEARCH_RESULT).orElse(WebResearchOutcome.skipped("Not available.")),
            market,
            state.get(PipelineKeys.PORTFOLIO).orElse(PortfolioOutcome.skipped("Not available.")),
            state.get(PipelineKeys.ANALYSIS).orElse(AnalysisOutcome.empty("Not available.")));
    }
}
