package com.researchplatform.monitor.check;

import com.researchplatform.common.model.Alert;
import com.researchplatform.common.model.AlertType;
import com.researchplatform.common.model.PriceBar;
import com.researchplatform.common.model.TimeRange;
import com.researchplatform.common.model.TimeSeries;
import com.researchplatform.marketdata.service.MarketDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fires a MARKET alert when the latest intraday close moved more than the threshold against the
 * close {@code baselineOffset} bars earlier (three 5-minute bars by default, roughly 15 minutes).
 */
@Component
public class MarketMoveCheck implements SymbolCheck {

    private static final Logger log = LoggerFactory.getLogger(MarketMoveCheck.class);

    private final MarketDataService marketDataService;
    private final Clock clock;
    private final double thresholdPct;
    private final int baselineOffset;

    public MarketMoveCheck(MarketDataService marketDataService,
                           Clock clock,
                           @Value("${monitor.price-threshold-pct:0.5}") double thresholdPct,
                           @Value("${monitor.baseline-offset:3}") int baselineOffset) {
        if (baselineOffset < 1) {
            throw new IllegalArgumentException("baseline offset must be positive: " + baselineOffset);
        }
        this.marketDataService = marketDataService;
        this.clock = clock;
        this.thresholdPct = thresholdPct;
        this.baselineOffset = baselineOffset;
    }

    @Override
    public String name() {
        return "market_move";
    }

    @Override
    public Mono<Alert> check(String symbol) {
        return marketDataService.fetch(symbol, TimeRange.INTRADAY)
            .flatMap(series -> Mono.justOrEmpty(evaluate(series, thresholdPct, baselineOffset, clock.instant())));
    }

    static Optional<Alert> evaluate(TimeSeries series, double thresholdPct, int baselineOffset, Instant now) {
        List<PriceBar> bars = series.bars();
        if (bars.size() < baselineOffset + 1) {
            log.debug("[Monitor] Not enough points for move check. symbol={} points={}", series.symbol(), bars.size());
            return Optional.empty();
        }
        PriceBar latest = bars.get(bars.size() - 1);
        PriceBar baseline = bars.get(bars.size() - 1 - baselineOffset);
        if (baseline.close() == 0) {
            return Optional.empty();
        }
        double changePct = (latest.close() - baseline.close()) / baseline.close() * 100;
        if (Math.abs(changePct) <= thresholdPct) {
            return Optional.empty();
        }

        String direction = changePct > 0 ? "UP" : "DOWN";
        String message = String.format(Locale.ROOT, "%s ALERT: %s moved %+.2f%% to $%.2f",
            direction, series.symbol(), changePct, latest.close());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("price", latest.close());
        details.put("change", Math.round(changePct * 100) / 100.0);
        details.put("timestamp", latest.timestamp().toString());
        details.put("source", series.provenance().label());
        return Optional.of(new Alert(now, AlertType.MARKET, series.symbol(), message, details));
    }
}
