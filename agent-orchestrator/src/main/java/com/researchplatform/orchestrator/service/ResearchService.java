package com.researchplatform.orchestrator.service;

import com.researchplatform.analysis.model.AnalysisOutcome;
import com.researchplatform.common.model.Intent;
import com.researchplatform.common.model.Provenance;
import com.researchplatform.common.model.ScanResult;
import com.researchplatform.common.model.TimeSeries;
import com.researchplatform.common.trace.TraceContextUtil;
import com.researchplatform.orchestrator.logger.PipelineFlowLogger;
import com.researchplatform.orchestrator.model.MarketDataOutcome;
import com.researchplatform.orchestrator.model.ResearchReport;
import com.researchplatform.orchestrator.pipeline.PipelineKeys;
import com.researchplatform.orchestrator.pipeline.PipelineState;
import com.researchplatform.orchestrator.pipeline.ResearchPipelineEngine;
import com.researchplatform.orchestrator.report.ReportKind;
import com.researchplatform.orchestrator.report.SynthesizedReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * Entry point for a research request: seeds the pipeline state with the task, runs every stage,
 * and assembles the {@link ResearchReport}. The returned {@link Mono} does not error; an
 * unexpected failure ends in the refusal report.
 */
@Service
public class ResearchService {

    private static final Logger log = LoggerFactory.getLogger(ResearchService.class);

    private final ResearchPipelineEngine engine;
    private final PipelineFlowLogger flowLogger;
    private final Clock clock;

    public ResearchService(ResearchPipelineEngine engine, PipelineFlowLogger flowLogger, Clock clock) {
        this.engine = engine;
        this.flowLogger = flowLogger;
        this.clock = clock;
    }

    public Mono<ResearchReport> research(String task) {
        String traceId = TraceContextUtil.newTraceId();
        flowLogger.logWithTraceId(PipelineFlowLogger.RUN_STARTED, traceId);

        Mono<ResearchReport> pipeline = engine.run(PipelineState.seed(task))
            .map(state -> assemble(traceId, state))
            .onErrorResume(e -> {
                TraceContextUtil.withMdc(traceId, () ->
                    log.error("[Research] Run failed, returning refusal. traceId={}", traceId, e));
                return Mono.just(refusal(traceId, task));
            })
            .doOnEach(flowLogger.stage(PipelineFlowLogger.RUN_FINISHED));

        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    ResearchReport assemble(String traceId, PipelineState state) {
        Intent intent = state.get(PipelineKeys.INTENT).orElse(Intent.none());
        SynthesizedReport report = state.get(PipelineKeys.REPORT).orElse(SynthesizedReport.refusal());
        AnalysisOutcome analysis = state.get(PipelineKeys.ANALYSIS).orElse(AnalysisOutcome.empty(""));
        MarketDataOutcome market = state.get(PipelineKeys.MARKET_DATA_RESULT).orElse(null);

        Provenance provenance = null;
        String sourceNote = null;
        String scanStatus = null;
        List<ScanResult> scanResults = List.of();
        if (market instanceof MarketDataOutcome.SeriesData data && data.series() != null) {
            TimeSeries series = data.series();
            provenance = series.provenance();
            sourceNote = series.sourceNote();
        } else if (market instanceof MarketDataOutcome.ScanData scanData && scanData.scan() != null) {
            scanStatus = scanData.scan().status();
            scanResults = scanData.scan().results();
        }

        boolean refused = report.kind() == ReportKind.REFUSAL;
        return new ResearchReport(
            traceId,
            state.task(),
            report.kind(),
            intent.symbol(),
            intent.timeRange(),
            report.text(),
            report.fallback(),
            refused ? null : provenance,
            refused ? null : sourceNote,
            scanStatus,
            scanResults,
            refused ? null : analysis.insights(),
            refused ? List.of() : analysis.visualizations(),
            refused ? List.of() : analysis.charts(),
            refused ? List.of() : analysis.skipped(),
            clock.instant());
    }

    private ResearchReport refusal(String traceId, String task) {
        SynthesizedReport refusal = SynthesizedReport.refusal();
        return new ResearchReport(traceId, task, refusal.kind(), null, null, refusal.text(), false,
            null, null, null, List.of(), null, List.of(), List.of(), List.of(), clock.instant());
    }
}
