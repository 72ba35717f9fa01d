package com.researchplatform.orchestrator.pipeline;

import com.researchplatform.analysis.frame.SeriesFrame;
import com.researchplatform.analysis.model.AnalysisOutcome;
import com.researchplatform.common.model.Intent;
import com.researchplatform.orchestrator.model.MarketDataOutcome;
import com.researchplatform.orchestrator.model.PortfolioOutcome;
import com.researchplatform.orchestrator.model.WebResearchOutcome;
import com.researchplatform.orchestrator.report.SynthesizedReport;

/** Stage names, in execution order, and the state keys they own. */
public final class PipelineKeys {

    public static final String REQUEST           = "request";
    public static final String EXTRACT_INTENT    = "extract_intent";
    public static final String WEB_RESEARCH      = "web_research";
    public static final String MARKET_DATA       = "market_data";
    public static final String PORTFOLIO_LOOKUP  = "portfolio_lookup";
    public static final String TRANSFORM         = "transform";
    public static final String ANALYZE           = "analyze";
    public static final String SYNTHESIZE_REPORT = "synthesize_report";

    public static final StateKey<String> TASK =
        StateKey.of("task", String.class, REQUEST);
    public static final StateKey<Intent> INTENT =
        StateKey.of("intent", Intent.class, EXTRACT_INTENT);
    public static final StateKey<WebResearchOutcome> WEB_RESEARCH_RESULT =
        StateKey.of("web_research", WebResearchOutcome.class, WEB_RESEARCH);
    public static final StateKey<MarketDataOutcome> MARKET_DATA_RESULT =
        StateKey.of("market_data", MarketDataOutcome.class, MARKET_DATA);
    public static final StateKey<PortfolioOutcome> PORTFOLIO =
        StateKey.of("portfolio", PortfolioOutcome.class, PORTFOLIO_LOOKUP);
    public static final StateKey<SeriesFrame> FRAME =
        StateKey.of("frame", SeriesFrame.class, TRANSFORM);
    public static final StateKey<AnalysisOutcome> ANALYSIS =
        StateKey.of("analysis", AnalysisOutcome.class, ANALYZE);
    public static final StateKey<SynthesizedReport> REPORT =
        StateKey.of("report", SynthesizedReport.class, SYNTHESIZE_REPORT);

    private PipelineKeys() {}

    /** True when the extracted intent puts this run in scan mode. */
    public static boolean isScan(PipelineState state) {
        return state.get(INTENT).map(Intent::isScan).orElse(false);
    }
}
