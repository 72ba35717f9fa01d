package com.researchplatform.orchestrator.stage;

import com.researchplatform.orchestrator.pipeline.PipelineKeys;
import com.researchplatform.orchestrator.pipeline.PipelineStage;
import com.researchplatform.orchestrator.pipeline.PipelineState;
import com.researchplatform.orchestrator.pipeline.StateUpdate;
import com.researchplatform.orchestrator.report.ReportInput;
import com.researchplatform.orchestrator.report.ReportSynthesizer;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@Order(7)
public class SynthesizeReportStage implements PipelineStage {

    private final ReportSynthesizer reportSynthesizer;

    public SynthesizeReportStage(ReportSynthesizer reportSynthesizer) {
        this.reportSynthesizer = reportSynthesizer;
    }

    @Override
    public String name() {
        return PipelineKeys.SYNTHESIZE_REPORT;
    }

    @Override
    public Mono<StateUpdate> apply(PipelineState state) {
        return reportSynthesizer.synthesize(ReportInput.from(state))
            .map(report -> StateUpdate.of(PipelineKeys.REPORT, report));
    }
}
