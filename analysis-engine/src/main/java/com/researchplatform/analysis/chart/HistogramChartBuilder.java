package com.researchplatform.analysis.chart;

import com.researchplatform.analysis.frame.SeriesFrame;
import com.researchplatform.analysis.plan.ChartType;
import com.researchplatform.analysis.plan.VisualizationSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/** Equal-width bins over one numeric column, at most {@value #MAX_BINS}. */
@Component
public class HistogramChartBuilder implements ChartBuilder {

    static final int MAX_BINS = 30;

    @Override
    public ChartType type() { return ChartType.HISTOGRAM; }

    @Override
    public ChartFigure build(SeriesFrame frame, VisualizationSpec spec, String defaultX) {
        if (spec.columns().size() != 1) {
            throw new ChartSpecException("histogram takes exactly 1 column, got " + spec.columns().size());
        }
        String column = spec.columns().get(0);
        ChartBuilder.requireNumeric(frame, column);
        return new ChartFigure(type(), spec.title(), column, "count", bin(frame.numeric(column)));
    }

    static List<ChartPoint> bin(List<Double> values) {
        if (values.isEmpty()) return List.of();
        double min = values.stream().mapToDouble(Double::doubleValue).min().orElse(0);
        double max = values.stream().mapToDouble(Double::doubleValue).max().orElse(0);
        int bins = Math.min(MAX_BINS, values.size());
        if (max == min) {
            return List.of(new ChartPoint(min, values.size()));
        }
        double width = (max - min) / bins;
        int[] counts = new int[bins];
        for (double value : values) {
            int index = (int) ((value - min) / width);
            counts[Math.min(index, bins - 1)]++;
        }
        List<ChartPoint> points = new ArrayList<>(bins);
        for (int i = 0; i < bins; i++) {
            points.add(new ChartPoint(min + i * width, counts[i]));
        }
        return points;
    }
}
