package com.researchplatform.orchestrator.stage;

import com.researchplatform.analysis.frame.SeriesFrame;
import com.researchplatform.analysis.model.AnalysisOutcome;
import com.researchplatform.analysis.service.AnalysisPipeline;
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
@Order(6)
public class AnalyzeStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeStage.class);

    private final AnalysisPipeline analysisPipeline;

    public AnalyzeStage(AnalysisPipeline analysisPipeline) {
        this.analysisPipeline = analysisPipeline;
    }

    @Override
    public String name() {
        return PipelineKeys.ANALYZE;
    }

    @Override
    public Mono<StateUpdate> apply(PipelineState state) {
        if (PipelineKeys.isScan(state)) {
            return Mono.just(StateUpdate.of(PipelineKeys.ANALYSIS, AnalysisOutcome.empty("")));
        }
        SeriesFrame frame = state.get(PipelineKeys.FRAME).orElse(SeriesFrame.empty(""));
        return analysisPipeline.analyze(frame)
            .onErrorResume(e -> {
                log.error("[Analysis] Sub-pipeline failed, continuing without analysis. reason={}", e.getMessage());
                return Mono.just(AnalysisOutcome.empty(AnalysisOutcome.NO_DATA));
            })
            .map(outcome -> StateUpdate.of(PipelineKeys.ANALYSIS, outcome));
    }
}
