package com.researchplatform.analysis.chart;

import com.researchplatform.analysis.plan.ChartType;
import org.springframework.stereotype.Component;

@Component
public class LineChartBuilder extends XYChartBuilder {
    @Override
    public ChartType type() { return ChartType.LINE; }
}
