package com.researchplatform.analysis.service;

import com.researchplatform.analysis.chart.ChartRenderService;
import com.researchplatform.analysis.frame.SeriesFrame;
import com.researchplatform.analysis.model.AnalysisOutcome;
import com.researchplatform.analysis.plan.VisualizationPlanner;
import com.researchplatform.analysis.profile.DatasetProfile;
import com.researchplatform.analysis.profile.DatasetProfiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Profile, plan, render. Each step recovers locally, so the returned {@link Mono} completes with
 * an outcome even when the planner is unavailable or every chart is skipped.
 */
@Service
public class AnalysisPipeline {

    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

    private final DatasetProfiler profiler;
    private final VisualizationPlanner planner;
    private final ChartRenderService renderService;

    public AnalysisPipeline(DatasetProfiler profiler, VisualizationPlanner planner, ChartRenderService renderService) {
        this.profiler = profiler;
        this.planner = planner;
        this.renderService = renderService;
    }

    public Mono<AnalysisOutcome> analyze(SeriesFrame frame) {
        if (frame == null || frame.isEmpty()) {
            log.warn("[Analysis] Empty frame, skipping analysis. symbol={}", frame == null ? null : frame.symbol());
            return Mono.just(AnalysisOutcome.empty(AnalysisOutcome.NO_DATA));
        }
        DatasetProfile profile = profiler.profile(frame);
        return planner.plan(profile)
            .flatMap(plan -> Mono.fromCallable(() -> renderService.render(frame, plan.visualizations(),
                    profile.primaryDatetimeColumn()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(rendered -> new AnalysisOutcome(plan.insightsText(), plan.visualizations(),
                    rendered.charts(), rendered.skipped())));
    }
}
