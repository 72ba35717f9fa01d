package com.researchplatform.orchestrator.report;

import com.researchplatform.analysis.model.AnalysisOutcome;
import com.researchplatform.common.exception.CollaboratorException;
import com.researchplatform.common.llm.LlmClient;
import com.researchplatform.common.model.PriceBar;
import com.researchplatform.common.model.Provenance;
import com.researchplatform.common.model.ScanIntent;
import com.researchplatform.common.model.ScanOutcome;
import com.researchplatform.common.model.ScanResult;
import com.researchplatform.common.model.TimeRange;
import com.researchplatform.common.model.TimeSeries;
import com.researchplatform.orchestrator.model.MarketDataOutcome;
import com.researchplatform.orchestrator.model.PortfolioOutcome;
import com.researchplatform.orchestrator.model.WebResearchOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReportSynthesizerTest {

    private LlmClient llmClient;
    private ReportSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        llmClient = mock(LlmClient.class);
        synthesizer = new ReportSynthesizer(llmClient, 3000, 2000, 2000, 4000);
    }

    private static TimeSeries series(Provenance provenance, String note) {
        LocalDateTime t = LocalDateTime.of(2024, 5, 14, 0, 0);
        return new TimeSeries("AAPL", TimeRange.ONE_WEEK, List.of(
            new PriceBar(t, 100, 102, 99, 101, 1000),
            new PriceBar(t.plusDays(1), 101, 104, 100, 103, 1200)), provenance, note);
    }

    private static ReportInput.SingleSymbol input(String symbol, WebResearchOutcome web, MarketDataOutcome market) {
        return new ReportInput.SingleSymbol("analyze apple", symbol, TimeRange.ONE_WEEK, web, market,
            PortfolioOutcome.skipped(PortfolioOutcome.NO_SYMBOL), AnalysisOutcome.empty("* trend is up"));
    }

    private static WebResearchOutcome webWithContent() {
        return new WebResearchOutcome(List.of("analyze apple"), "Query: analyze apple\n- Apple beats (u): strong", 1, true);
    }

    @Nested
    @DisplayName("single symbol")
    class SingleSymbol {

        @Test
        @DisplayName("unresolved symbol refuses without calling the model")
        void unresolvedSymbolRefuses() {
            StepVerifier.create(synthesizer.synthesize(input(null, webWithContent(),
                    new MarketDataOutcome.Skipped("Skipped."))))
                .assertNext(report -> {
                    assertEquals(ReportKind.REFUSAL, report.kind());
                    assertEquals(ReportSynthesizer.REFUSAL, report.text());
                })
                .verifyComplete();

            verify(llmClient, never()).complete(anyString());
        }

        @Test
        @DisplayName("no web and no market content refuses without calling the model")
        void noContentRefuses() {
            StepVerifier.create(synthesizer.synthesize(input("ZZZZ",
                    WebResearchOutcome.failed(List.of("q"), "down"),
                    new MarketDataOutcome.Skipped("No market data returned."))))
                .assertNext(report -> assertEquals(ReportSynthesizer.REFUSAL, report.text()))
                .verifyComplete();

            verify(llmClient, never()).complete(anyString());
        }

        @Test
        @DisplayName("model reply gets the data source footer")
        void replyGetsFooter() {
            when(llmClient.complete(anyString())).thenReturn(Mono.just("  # Alpha Report\nAll good.  "));

            StepVerifier.create(synthesizer.synthesize(input("AAPL", webWithContent(),
                    new MarketDataOutcome.SeriesData(series(Provenance.LIVE, "Real API (Alpha Vantage)")))))
                .assertNext(report -> {
                    assertEquals(ReportKind.SINGLE_SYMBOL, report.kind());
                    assertFalse(report.fallback());
                    assertTrue(report.text().startsWith("# Alpha Report\nAll good."));
                    assertTrue(report.text().endsWith(
                        "_Data source: Real API (Alpha Vantage) - Real API (Alpha Vantage)_"));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("a reply containing the refusal sentence becomes the exact refusal")
        void refusalReplyIsNormalized() {
            when(llmClient.complete(anyString()))
                .thenReturn(Mono.just("\"" + ReportSynthesizer.REFUSAL + "\"\n"));

            StepVerifier.create(synthesizer.synthesize(input("AAPL", webWithContent(),
                    new MarketDataOutcome.SeriesData(series(Provenance.LIVE, "live")))))
                .assertNext(report -> {
                    assertEquals(ReportKind.REFUSAL, report.kind());
                    assertEquals(ReportSynthesizer.REFUSAL, report.text());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("model failure yields a deterministic fallback report")
        void modelFailureFallsBack() {
            when(llmClient.complete(anyString()))
                .thenReturn(Mono.error(new CollaboratorException("anthropic", "timeout")));

            StepVerifier.create(synthesizer.synthesize(input("AAPL", webWithContent(),
                    new MarketDataOutcome.SeriesData(series(Provenance.SIMULATED, "Mock Data (CODE) - API Limit/Error")))))
                .assertNext(report -> {
                    assertTrue(report.fallback());
                    assertTrue(report.text().startsWith("# Alpha Report: AAPL"));
                    assertTrue(report.text().contains("* trend is up"));
                    assertTrue(report.text().contains("Simulated (Fallback)"));
                })
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("market scan")
    class MarketScan {

        private final ScanOutcome scan = new ScanOutcome(ScanIntent.UPWARD, TimeRange.INTRADAY, List.of(
            new ScanResult("NVDA", 452.1, 3.25, Provenance.LIVE),
            new ScanResult("AAPL", 151.0, 0.5, Provenance.SIMULATED)), "Scanned 2 of 2 symbols.");

        @Test
        void resultsTableListsEverySymbol() {
            String table = ReportSynthesizer.resultsTable(scan);

            assertTrue(table.startsWith("| Symbol | Price | % Change |"));
            assertTrue(table.contains("| NVDA | 452.10 | +3.25% |"));
            assertTrue(table.contains("| AAPL | 151.00 | +0.50% |"));
        }

        @Test
        void simulatedResultsAreCountedInFooter() {
            when(llmClient.complete(anyString())).thenReturn(Mono.just("Scan report"));

            StepVerifier.create(synthesizer.synthesize(new ReportInput.MarketScan("top gainers", scan)))
                .assertNext(report -> {
                    assertEquals(ReportKind.MARKET_SCAN, report.kind());
                    assertTrue(report.text().startsWith("Scan report"));
                    assertTrue(report.text().contains("1 of 2 results use Simulated (Fallback) data."));
                })
                .verifyComplete();
        }

        @Test
        void modelFailureListsRawResults() {
            when(llmClient.complete(anyString()))
                .thenReturn(Mono.error(new CollaboratorException("anthropic", "down")));

            StepVerifier.create(synthesizer.synthesize(new ReportInput.MarketScan("top gainers", scan)))
                .assertNext(report -> {
                    assertTrue(report.fallback());
                    assertTrue(report.text().contains("| NVDA | 452.10 | +3.25% |"));
                })
                .verifyComplete();
        }

        @Test
        void emptyScanSaysNoMatches() {
            ScanOutcome empty = ScanOutcome.empty(ScanIntent.DOWNWARD, TimeRange.ONE_DAY, "Scanned 3 of 3 symbols.");

            assertEquals("No symbols matched.", ReportSynthesizer.resultsTable(empty));
        }
    }
}
