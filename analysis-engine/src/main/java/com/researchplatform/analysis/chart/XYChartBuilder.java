package com.researchplatform.analysis.chart;

import com.researchplatform.analysis.frame.SeriesFrame;
import com.researchplatform.analysis.plan.VisualizationSpec;

import java.util.ArrayList;
import java.util.List;

/** Shared x/y mapping for line and bar charts: {@code [x, y]}, or {@code [y]} against the default x. */
abstract class XYChartBuilder implements ChartBuilder {

    @Override
    public ChartFigure build(SeriesFrame frame, VisualizationSpec spec, String defaultX) {
        List<String> columns = spec.columns();
        String x;
        String y;
        if (columns.size() == 2) {
            x = columns.get(0);
            y = columns.get(1);
        } else if (columns.size() == 1) {
            x = defaultX;
            y = columns.get(0);
        } else {
            throw new ChartSpecException(type().wire() + " chart takes 1 or 2 columns, got " + columns.size());
        }
        if (!frame.hasColumn(x)) {
            throw new ChartSpecException("x column '" + x + "' not in frame");
        }
        ChartBuilder.requireNumeric(frame, y);

        List<?> xs = frame.values(x);
        List<Double> ys = frame.numeric(y);
        List<ChartPoint> points = new ArrayList<>(ys.size());
        for (int i = 0; i < ys.size(); i++) {
            points.add(new ChartPoint(xs.get(i), ys.get(i)));
        }
        return new ChartFigure(type(), spec.title(), x, y, points);
    }
}
