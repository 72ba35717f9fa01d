package com.researchplatform.analysis.chart;

import com.researchplatform.analysis.frame.SeriesFrame;
import com.researchplatform.analysis.plan.ChartType;
import com.researchplatform.analysis.plan.VisualizationSpec;
import com.researchplatform.analysis.support.Frames;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChartRenderServiceTest {

    private final ChartRenderService service = new ChartRenderService(List.of(
        new LineChartBuilder(), new BarChartBuilder(), new ScatterChartBuilder(), new HistogramChartBuilder()));

    private final SeriesFrame frame = Frames.daily("AAPL", 10);

    private static final VisualizationSpec LINE = new VisualizationSpec("line", List.of("timestamp", "close"), "Price");
    private static final VisualizationSpec HIST = new VisualizationSpec("histogram", List.of("volume"), "Volume");
    private static final VisualizationSpec SCATTER = new VisualizationSpec("scatter", List.of("open", "close"), "Open vs Close");

    @Nested
    @DisplayName("valid plans")
    class Valid {

        @Test
        @DisplayName("one chart per valid entry, in plan order")
        void allRendered() {
            ChartRenderService.RenderResult result = service.render(frame, List.of(LINE, HIST, SCATTER), "timestamp");

            assertEquals(3, result.charts().size());
            assertEquals(List.of(ChartType.LINE, ChartType.HISTOGRAM, ChartType.SCATTER),
                result.charts().stream().map(ChartFigure::type).toList());
            assertTrue(result.skipped().isEmpty());
            assertEquals(10, result.charts().get(0).points().size());
        }

        @Test
        @DisplayName("column names are matched case-insensitively")
        void upperCaseColumns() {
            VisualizationSpec spec = new VisualizationSpec("LINE", List.of("Timestamp", "CLOSE"), "Price");
            assertEquals(1, service.render(frame, List.of(spec), "timestamp").charts().size());
        }

        @Test
        @DisplayName("single-column line chart uses the default x column")
        void defaultX() {
            VisualizationSpec spec = new VisualizationSpec("bar", List.of("volume"), "Volume bars");
            ChartFigure chart = service.render(frame, List.of(spec), "timestamp").charts().get(0);
            assertEquals("timestamp", chart.xColumn());
            assertEquals("volume", chart.yColumn());
        }
    }

    @Nested
    @DisplayName("invalid entries are skipped")
    class Skipped {

        @Test
        @DisplayName("a missing column removes exactly one chart")
        void missingColumn() {
            VisualizationSpec broken = new VisualizationSpec("scatter", List.of("open", "adjusted_close"), "Broken");

            int full = service.render(frame, List.of(LINE, HIST, SCATTER), "timestamp").charts().size();
            ChartRenderService.RenderResult partial = service.render(frame, List.of(LINE, HIST, broken), "timestamp");

            assertEquals(full - 1, partial.charts().size());
            assertEquals(1, partial.skipped().size());
            assertEquals("Broken", partial.skipped().get(0).title());
            assertTrue(partial.skipped().get(0).reason().contains("adjusted_close"));
        }

        @Test
        @DisplayName("unsupported type, bad arity and non-numeric y are recorded, rest still renders")
        void mixedFailures() {
            List<VisualizationSpec> plan = List.of(
                new VisualizationSpec("pie", List.of("volume"), "Pie"),
                new VisualizationSpec("histogram", List.of("open", "close"), "Two-column histogram"),
                new VisualizationSpec("line", List.of("close", "timestamp"), "Datetime on y"),
                LINE);

            ChartRenderService.RenderResult result = service.render(frame, plan, "timestamp");

            assertEquals(1, result.charts().size());
            assertEquals(3, result.skipped().size());
        }
    }
}
