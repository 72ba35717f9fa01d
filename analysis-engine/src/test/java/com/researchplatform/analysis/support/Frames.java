package com.researchplatform.analysis.support;

import com.researchplatform.analysis.frame.SeriesFrame;
import com.researchplatform.common.model.PriceBar;
import com.researchplatform.common.model.Provenance;
import com.researchplatform.common.model.TimeRange;
import com.researchplatform.common.model.TimeSeries;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/** Small fixed frames for analysis tests. */
public final class Frames {

    private Frames() {}

    public static SeriesFrame daily(String symbol, int days) {
        LocalDateTime start = LocalDateTime.of(2024, 5, 1, 0, 0);
        List<PriceBar> bars = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            double close = 100 + i;
            bars.add(new PriceBar(start.plusDays(i), close - 0.5, close + 1, close - 1, close, 1_000L * (i + 1)));
        }
        return SeriesFrame.from(new TimeSeries(symbol, TimeRange.ONE_MONTH, bars, Provenance.LIVE, "live"));
    }
}
