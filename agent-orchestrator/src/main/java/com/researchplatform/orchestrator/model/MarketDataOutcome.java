package com.researchplatform.orchestrator.model;

import com.researchplatform.common.model.PriceBar;
import com.researchplatform.common.model.ScanOutcome;
import com.researchplatform.common.model.TimeSeries;

import java.util.List;
import java.util.Locale;

/**
 * Output of the market data stage: a single-symbol series, a watchlist scan, or nothing.
 */
public sealed interface MarketDataOutcome
    permits MarketDataOutcome.SeriesData, MarketDataOutcome.ScanData, MarketDataOutcome.Skipped {

    boolean hasContent();

    /** Prompt-ready description. */
    String describe();

    record SeriesData(TimeSeries series) implements MarketDataOutcome {

        private static final int RECENT_BARS = 10;

        @Override
        public boolean hasContent() {
            return series != null && !series.isEmpty();
        }

        @Override
        public String describe() {
            if (!hasContent()) return "No market data points returned.";
            List<PriceBar> bars = series.bars();
            PriceBar first = series.first();
            PriceBar last = series.last();
            double high = bars.stream().mapToDouble(PriceBar::high).max().orElse(Double.NaN);
            double low = bars.stream().mapToDouble(PriceBar::low).min().orElse(Double.NaN);
            double change = first.open() > 0 ? (last.close() - first.open()) / first.open() * 100 : 0;

            StringBuilder text = new StringBuilder();
            text.append("Symbol: ").append(series.symbol())
                .append("\nRange: ").append(series.timeRange().code())
                .append("\nSource: ").append(series.provenance().label()).append(" - ").append(series.sourceNote())
                .append("\nBars: ").append(bars.size())
                .append(" (").append(first.timestamp()).append(" to ").append(last.timestamp()).append(')')
                .append(String.format(Locale.ROOT, "%nFirst open: %.2f%nLast close: %.2f%nHigh: %.2f%nLow: %.2f%nChange: %+.2f%%",
                    first.open(), last.close(), high, low, change))
                .append("\nRecent bars (timestamp, open, high, low, close, volume):");
            for (PriceBar bar : bars.subList(Math.max(0, bars.size() - RECENT_BARS), bars.size())) {
                text.append(String.format(Locale.ROOT, "%n%s, %.2f, %.2f, %.2f, %.2f, %d",
                    bar.timestamp(), bar.open(), bar.high(), bar.low(), bar.close(), bar.volume()));
            }
            return text.toString();
        }
    }

    record ScanData(ScanOutcome scan) implements MarketDataOutcome {
        @Override
        public boolean hasContent() {
            return scan != null && !scan.isEmpty();
        }

        @Override
        public String describe() {
            return scan == null ? "No scan performed." : scan.status();
        }
    }

    record Skipped(String reason) implements MarketDataOutcome {
        @Override
        public boolean hasContent() {
            return false;
        }

        @Override
        public String describe() {
            return reason;
        }
    }
}
