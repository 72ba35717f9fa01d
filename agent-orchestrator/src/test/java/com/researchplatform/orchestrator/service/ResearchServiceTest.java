package com.researchplatform.orchestrator.service;

import com.researchplatform.analysis.model.AnalysisOutcome;
import com.researchplatform.common.model.Intent;
import com.researchplatform.common.model.PriceBar;
import com.researchplatform.common.model.Provenance;
import com.researchplatform.common.model.TimeRange;
import com.researchplatform.common.model.TimeSeries;
import com.researchplatform.orchestrator.logger.PipelineFlowLogger;
import com.researchplatform.orchestrator.model.MarketDataOutcome;
import com.researchplatform.orchestrator.pipeline.PipelineKeys;
import com.researchplatform.orchestrator.pipeline.PipelineStage;
import com.researchplatform.orchestrator.pipeline.PipelineState;
import com.researchplatform.orchestrator.pipeline.ResearchPipelineEngine;
import com.researchplatform.orchestrator.pipeline.StateUpdate;
import com.researchplatform.orchestrator.report.ReportKind;
import com.researchplatform.orchestrator.report.ReportSynthesizer;
import com.researchplatform.orchestrator.report.SynthesizedReport;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResearchServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-14T12:00:00Z"), ZoneOffset.UTC);

    private static PipelineStage stage(String name, StateUpdate update) {
        return new PipelineStage() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Mono<StateUpdate> apply(PipelineState state) {
                return Mono.just(update);
            }
        };
    }

    private static ResearchService service(PipelineStage... stages) {
        PipelineFlowLogger flowLogger = new PipelineFlowLogger();
        return new ResearchService(new ResearchPipelineEngine(List.of(stages), flowLogger), flowLogger, CLOCK);
    }

    @Test
    void assemblesReportFromFinalState() {
        TimeSeries series = new TimeSeries("AAPL", TimeRange.ONE_DAY, List.of(
            new PriceBar(LocalDateTime.of(2024, 5, 14, 0, 0), 1, 2, 0.5, 1.5, 10)), Provenance.LIVE, "live");

        ResearchService service = service(
            stage(PipelineKeys.EXTRACT_INTENT, StateUpdate.of(PipelineKeys.INTENT, Intent.forSymbol("AAPL", TimeRange.ONE_DAY))),
            stage(PipelineKeys.MARKET_DATA, StateUpdate.of(PipelineKeys.MARKET_DATA_RESULT, new MarketDataOutcome.SeriesData(series))),
            stage(PipelineKeys.ANALYZE, StateUpdate.of(PipelineKeys.ANALYSIS, AnalysisOutcome.empty("* flat"))),
            stage(PipelineKeys.SYNTHESIZE_REPORT, StateUpdate.of(PipelineKeys.REPORT,
                new SynthesizedReport(ReportKind.SINGLE_SYMBOL, "report body", false))));

        StepVerifier.create(service.research("analyze apple"))
            .assertNext(report -> {
                assertNotNull(report.traceId());
                assertEquals("analyze apple", report.task());
                assertEquals(ReportKind.SINGLE_SYMBOL, report.kind());
                assertEquals("AAPL", report.symbol());
                assertEquals(TimeRange.ONE_DAY, report.timeRange());
                assertEquals("report body", report.reportText());
                assertEquals(Provenance.LIVE, report.provenance());
                assertEquals("* flat", report.insights());
                assertEquals(CLOCK.instant(), report.generatedAt());
            })
            .verifyComplete();
    }

    @Test
    void pipelineFailureEndsInRefusal() {
        ResearchService service = service(
            stage(PipelineKeys.WEB_RESEARCH, StateUpdate.of(PipelineKeys.INTENT, Intent.none())));

        StepVerifier.create(service.research("analyze apple"))
            .assertNext(report -> {
                assertEquals(ReportKind.REFUSAL, report.kind());
                assertEquals(ReportSynthesizer.REFUSAL, report.reportText());
                assertNull(report.provenance());
            })
            .verifyComplete();
    }
}
