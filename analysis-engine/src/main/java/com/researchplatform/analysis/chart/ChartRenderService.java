package com.researchplatform.analysis.chart;

import com.researchplatform.analysis.frame.SeriesFrame;
import com.researchplatform.analysis.plan.ChartType;
import com.researchplatform.analysis.plan.VisualizationSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns plan entries into {@link ChartFigure}s. An entry with an unknown type, a column the
 * frame lacks, or a builder failure is recorded as a {@link SkippedChart}; the remaining
 * entries are still rendered.
 */
@Service
public class ChartRenderService {

    private static final Logger log = LoggerFactory.getLogger(ChartRenderService.class);

    private final Map<ChartType, ChartBuilder> builders = new EnumMap<>(ChartType.class);

    public ChartRenderService(List<ChartBuilder> builders) {
        builders.forEach(builder -> this.builders.put(builder.type(), builder));
    }

    public RenderResult render(SeriesFrame frame, List<VisualizationSpec> plan, String defaultX) {
        List<ChartFigure> charts = new ArrayList<>();
        List<SkippedChart> skipped = new ArrayList<>();

        for (VisualizationSpec raw : plan) {
            VisualizationSpec spec = lowerCased(raw);
            Optional<ChartBuilder> builder = spec.chartType().map(builders::get);
            if (builder.isEmpty()) {
                skip(skipped, spec, "unsupported chart type '" + spec.type() + "'");
                continue;
            }
            if (spec.columns().isEmpty()) {
                skip(skipped, spec, "no columns given");
                continue;
            }
            List<String> missing = spec.columns().stream().filter(c -> !frame.hasColumn(c)).toList();
            if (!missing.isEmpty()) {
                skip(skipped, spec, "missing columns " + missing);
                continue;
            }
            try {
                charts.add(builder.get().build(frame, spec, defaultX));
            } catch (RuntimeException e) {
                skip(skipped, spec, e.getMessage());
            }
        }
        log.info("[Analysis] Charts rendered. symbol={} charts={} skipped={}", frame.symbol(), charts.size(), skipped.size());
        return new RenderResult(charts, skipped);
    }

    private static VisualizationSpec lowerCased(VisualizationSpec spec) {
        List<String> columns = spec.columns().stream()
            .map(c -> c == null ? "" : c.trim().toLowerCase(Locale.ROOT))
            .toList();
        return new VisualizationSpec(spec.type(), columns, spec.title());
    }

    private static void skip(List<SkippedChart> skipped, VisualizationSpec spec, String reason) {
        log.warn("[Analysis] Chart skipped. title='{}' reason={}", spec.title(), reason);
        skipped.add(new SkippedChart(spec.title(), reason));
    }

    public record RenderResult(List<ChartFigure> charts, List<SkippedChart> skipped) {}
}
