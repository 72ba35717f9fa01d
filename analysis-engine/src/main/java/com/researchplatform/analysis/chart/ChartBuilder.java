package com.researchplatform.analysis.chart;

import com.researchplatform.analysis.frame.SeriesFrame;
import com.researchplatform.analysis.plan.ChartType;
import com.researchplatform.analysis.plan.VisualizationSpec;

/**
 * Strategy interface for one chart type. Implementations are Spring components collected by
 * {@link ChartRenderService}.
 *
 * <p>{@code columns} are already lower-cased and known to exist in the frame. Implementations
 * throw {@link ChartSpecException} for an arity or column-type mismatch.
 */
public interface ChartBuilder {

    ChartType type();

    ChartFigure build(SeriesFrame frame, VisualizationSpec spec, String defaultX);

    static void requireNumeric(SeriesFrame frame, String column) {
        boolean numeric = frame.type(column).map(t -> t.isNumeric()).orElse(false);
        if (!numeric) {
            throw new ChartSpecException("column '" + column + "' is not numeric");
        }
    }
}
