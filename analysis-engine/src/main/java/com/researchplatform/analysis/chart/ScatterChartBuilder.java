package com.researchplatform.analysis.chart;

import com.researchplatform.analysis.frame.SeriesFrame;
import com.researchplatform.analysis.plan.ChartType;
import com.researchplatform.analysis.plan.VisualizationSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ScatterChartBuilder implements ChartBuilder {

    @Override
    public ChartType type() { return ChartType.SCATTER; }

    @Override
    public ChartFigure build(SeriesFrame frame, VisualizationSpec spec, String defaultX) {
        if (spec.columns().size() != 2) {
            throw new ChartSpecException("scatter chart takes exactly 2 columns, got " + spec.columns().size());
        }
        String x = spec.columns().get(0);
        String y = spec.columns().get(1);
        ChartBuilder.requireNumeric(frame, x);
        ChartBuilder.requireNumeric(frame, y);

        List<Double> xs = frame.numeric(x);
        List<Double> ys = frame.numeric(y);
        List<ChartPoint> points = new ArrayList<>(xs.size());
        for (int i = 0; i < xs.size(); i++) {
            points.add(new ChartPoint(xs.get(i), ys.get(i)));
        }
        return new ChartFigure(type(), spec.title(), x, y, points);
    }
}
