package com.researchplatform.analysis.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchplatform.analysis.chart.BarChartBuilder;
import com.researchplatform.analysis.chart.ChartRenderService;
import com.researchplatform.analysis.chart.HistogramChartBuilder;
import com.researchplatform.analysis.chart.LineChartBuilder;
import com.researchplatform.analysis.chart.ScatterChartBuilder;
import com.researchplatform.analysis.frame.SeriesFrame;
import com.researchplatform.analysis.model.AnalysisOutcome;
import com.researchplatform.analysis.plan.VisualizationPlanner;
import com.researchplatform.analysis.profile.DatasetProfiler;
import com.researchplatform.analysis.support.Frames;
import com.researchplatform.common.llm.LlmClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisPipelineTest {

    private static final String PLAN_REPLY = """
        {"insights": ["Steady climb", "Volume rising", "Tight range"],
         "visualizations": [
           {"type": "line", "columns": ["timestamp", "close"], "title": "Price"},
           {"type": "histogram", "columns": ["volume"], "title": "Volume"},
           {"type": "scatter", "columns": ["open", "close"], "title": "Open vs Close"}]}
        """;

    private AnalysisPipeline pipeline(LlmClient llm) {
        ObjectMapper objectMapper = new ObjectMapper();
        ChartRenderService render = new ChartRenderService(List.of(
            new LineChartBuilder(), new BarChartBuilder(), new ScatterChartBuilder(), new HistogramChartBuilder()));
        return new AnalysisPipeline(new DatasetProfiler(), new VisualizationPlanner(llm, objectMapper), render);
    }

    @Test
    @DisplayName("structured plan → bulleted insights and one chart per entry")
    void structuredPlan() {
        StepVerifier.create(pipeline(prompt -> Mono.just(PLAN_REPLY)).analyze(Frames.daily("AAPL", 20)))
            .assertNext(outcome -> {
                assertEquals("* Steady climb\n* Volume rising\n* Tight range", outcome.insights());
                assertEquals(3, outcome.charts().size());
                assertTrue(outcome.skipped().isEmpty());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("malformed planner reply → default plan, two charts")
    void malformedReply() {
        StepVerifier.create(pipeline(prompt -> Mono.just("Here are my thoughts, no JSON today.")).analyze(Frames.daily("AAPL", 20)))
            .assertNext(outcome -> {
                assertEquals("Analysis generated, but detailed insights could not be parsed.", outcome.insights());
                assertEquals(2, outcome.charts().size());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("planner call failure → default plan")
    void plannerFailure() {
        LlmClient failing = prompt -> Mono.error(new IllegalStateException("timeout"));
        StepVerifier.create(pipeline(failing).analyze(Frames.daily("AAPL", 20)))
            .assertNext(outcome -> assertEquals(2, outcome.visualizations().size()))
            .verifyComplete();
    }

    @Test
    @DisplayName("empty frame → no-data outcome without calling the planner")
    void emptyFrame() {
        AtomicInteger calls = new AtomicInteger();
        LlmClient counting = prompt -> {
            calls.incrementAndGet();
            return Mono.just(PLAN_REPLY);
        };

        StepVerifier.create(pipeline(counting).analyze(SeriesFrame.empty("AAPL")))
            .assertNext(outcome -> {
                assertEquals(AnalysisOutcome.NO_DATA, outcome.insights());
                assertFalse(outcome.hasCharts());
            })
            .verifyComplete();
        assertEquals(0, calls.get());
    }
}
