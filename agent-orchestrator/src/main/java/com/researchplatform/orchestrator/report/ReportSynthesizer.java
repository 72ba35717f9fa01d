package com.researchplatform.orchestrator.report;

import com.researchplatform.common.llm.LlmClient;
import com.researchplatform.common.model.Provenance;
import com.researchplatform.common.model.ScanOutcome;
import com.researchplatform.common.model.ScanResult;
import com.researchplatform.common.model.TimeSeries;
import com.researchplatform.orchestrator.model.MarketDataOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Writes the final report from a {@link ReportInput}.
 *
 * <p>Single-symbol input that is insufficient gets {@link #REFUSAL} verbatim, without a model
 * call. Every injected text block is capped with {@link TextBudget}. When the model call fails
 * the report is assembled deterministically from the same inputs.
 */
@Component
public class ReportSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ReportSynthesizer.class);

    public static final String REFUSAL = "I am not sure about this company as I could not find sufficient data.";

    private final LlmClient llmClient;
    private final int webBudget;
    private final int marketBudget;
    private final int portfolioBudget;
    private final int scanBudget;

    public ReportSynthesizer(LlmClient llmClient,
                             @Value("${research.report.web-budget:3000}") int webBudget,
                             @Value("${research.report.market-budget:2000}") int marketBudget,
                             @Value("${research.report.portfolio-budget:2000}") int portfolioBudget,
                             @Value("${research.report.scan-budget:4000}") int scanBudget) {
        this.llmClient = llmClient;
        this.webBudget = webBudget;
        this.marketBudget = marketBudget;
        this.portfolioBudget = portfolioBudget;
        this.scanBudget = scanBudget;
    }

    public Mono<SynthesizedReport> synthesize(ReportInput input) {
        if (input instanceof ReportInput.MarketScan scan) {
            return scanReport(scan);
        }
        return singleSymbolReport((ReportInput.SingleSymbol) input);
    }

    // ── single symbol ─────────────────────────────────────────────────────────

    private Mono<SynthesizedReport> singleSymbolReport(ReportInput.SingleSymbol input) {
        if (input.isInsufficient()) {
            log.info("[Report] Insufficient input, refusing. symbol={}", input.symbol());
            return Mono.just(SynthesizedReport.refusal());
        }
        String web = TextBudget.truncate(input.web().text(), webBudget);
        String market = TextBudget.truncate(input.market().describe(), marketBudget);
        String portfolio = TextBudget.truncate(input.portfolio().describe(), portfolioBudget);
        String insights = input.analysis().insights().isBlank() ? "Not available." : input.analysis().insights();

        return llmClient.complete(singleSymbolPrompt(input, web, market, portfolio, insights))
            .map(reply -> normalize(reply, input))
            .onErrorResume(e -> {
                log.error("[Report] Report call failed, assembling fallback report. symbol={} reason={}",
                    input.symbol(), e.getMessage());
                return Mono.just(new SynthesizedReport(ReportKind.SINGLE_SYMBOL,
                    fallbackSingleSymbol(input, web, market, portfolio, insights), true));
            });
    }

    static SynthesizedReport normalize(String reply, ReportInput.SingleSymbol input) {
        if (reply == null || reply.contains(REFUSAL)) {
            return SynthesizedReport.refusal();
        }
        return new SynthesizedReport(ReportKind.SINGLE_SYMBOL, reply.trim() + sourceFooter(input.market()), false);
    }

    static String sourceFooter(MarketDataOutcome market) {
        if (market instanceof MarketDataOutcome.SeriesData data && data.series() != null) {
            TimeSeries series = data.series();
            return "\n\n---\n_Data source: " + series.provenance().label() + " - " + series.sourceNote() + "_";
        }
        return "\n\n---\n_Data source: market data not available_";
    }

    private static String singleSymbolPrompt(ReportInput.SingleSymbol input, String web, String market,
                                             String portfolio, String insights) {
        return """
            You are a senior financial analyst writing a comprehensive "Alpha Report".
            Combine all available information below into a structured report.

            Original user task: %s
            Target symbol: %s
            ---
            Available information:
            - Web intelligence: %s
            - Market data summary: %s
            - Deep-dive data analysis insights: %s
            - Internal portfolio context: %s
            ---

            First evaluate the available information. If the web intelligence and market data contain
            no meaningful information about the company, reply with exactly:
            "%s"
            and write nothing else.

            Otherwise write the Alpha Report with these sections, concise and cited:
            1. Summary: key findings and the current situation.
            2. Internal Context: the firm's current exposure. If it holds shares, show a markdown table
               (Symbol | Shares | Average Cost); if it holds none, say so in one sentence and do not
               draw a table.
            3. Market Data: a markdown table (Metric | Value | Implication).
            4. Real-Time Intelligence: significant news and filings, with sources.
            5. Sentiment Analysis: Positive, Negative or Neutral, with a short explanation.
            6. Synthesis: actionable conclusions.
            """.formatted(input.task(), input.symbol(), web, market, insights, portfolio, REFUSAL);
    }

    private static String fallbackSingleSymbol(ReportInput.SingleSymbol input, String web, String market,
                                               String portfolio, String insights) {
        return "# Alpha Report: " + input.symbol() + "\n\n"
            + "_Automated synthesis was unavailable; the collected inputs are listed below._\n\n"
            + "## Market Data\n" + market + "\n\n"
            + "## Data Analysis Insights\n" + insights + "\n\n"
            + "## Real-Time Intelligence\n" + web + "\n\n"
            + "## Internal Context\n" + portfolio
            + sourceFooter(input.market());
    }

    // ── market scan ───────────────────────────────────────────────────────────

    private Mono<SynthesizedReport> scanReport(ReportInput.MarketScan input) {
        ScanOutcome scan = input.scan();
        String results = TextBudget.truncate(resultsTable(scan), scanBudget);
        String footer = scanFooter(scan);

        return llmClient.complete(scanPrompt(input.task(), scan, results))
            .map(reply -> new SynthesizedReport(ReportKind.MARKET_SCAN, reply.trim() + footer, false))
            .onErrorResume(e -> {
                log.error("[Report] Scan report call failed, assembling fallback report. reason={}", e.getMessage());
                String text = "# Market Scan Report\n\n"
                    + "_Automated synthesis was unavailable; raw scan results follow._\n\n"
                    + "Criteria: " + scan.scanIntent() + " over " + scan.timeRange().code() + ". " + scan.status()
                    + "\n\n" + results + footer;
                return Mono.just(new SynthesizedReport(ReportKind.MARKET_SCAN, text, true));
            });
    }

    static String resultsTable(ScanOutcome scan) {
        if (scan.isEmpty()) {
            return "No symbols matched.";
        }
        StringBuilder table = new StringBuilder("| Symbol | Price | % Change |\n|---|---|---|");
        for (ScanResult result : scan.results()) {
            table.append(String.format(Locale.ROOT, "%n| %s | %.2f | %+.2f%% |",
                result.symbol(), result.price(), result.changePct()));
        }
        return table.toString();
    }

    private static String scanFooter(ScanOutcome scan) {
        long simulated = scan.results().stream().filter(r -> r.provenance() == Provenance.SIMULATED).count();
        if (simulated == 0) {
            return "";
        }
        return "\n\n---\n_Data source: " + simulated + " of " + scan.results().size()
            + " results use " + Provenance.SIMULATED.label() + " data._";
    }

    private static String scanPrompt(String task, ScanOutcome scan, String results) {
        return """
            You are a senior financial analyst. The user requested a market scan: "%s".

            Scan criteria: %s over %s. %s

            Scan results (from the watchlist):
            %s

            Write a "Market Scan Report":
            1. Summary: briefly explain the criteria and the overall market picture from these results.
            2. Results Table: a markdown table with columns Symbol | Price | %% Change.
            3. Conclusion: highlight the most significant movers.
            """.formatted(task, scan.scanIntent(), scan.timeRange().code(), scan.status(), results);
    }
}
