package com.researchplatform.marketdata.scan;

import com.researchplatform.common.model.ScanIntent;
import com.researchplatform.common.model.ScanOutcome;
import com.researchplatform.common.model.ScanResult;
import com.researchplatform.common.model.TimeRange;
import com.researchplatform.common.model.TimeSeries;
import com.researchplatform.common.store.WatchlistStore;
import com.researchplatform.marketdata.service.MarketDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ranks a watchlist by percent change over the fetched window.
 *
 * <p>Change is {@code (lastClose - firstOpen) / firstOpen * 100} over whatever window the series
 * covers, so for INTRADAY it is the move across the last ~100 five-minute bars rather than a
 * session open/close. Symbols without usable data are left out.
 */
@Service
public class ScanEngine {

    private static final Logger log = LoggerFactory.getLogger(ScanEngine.class);

    static final String STATUS_NOT_FOUND = "Watchlist not found.";
    static final String STATUS_EMPTY = "Watchlist is empty.";

    private static final Comparator<ScanResult> BY_CHANGE_DESC =
        Comparator.comparingDouble(ScanResult::changePct).reversed().thenComparing(ScanResult::symbol);

    private final MarketDataService marketDataService;
    private final WatchlistStore watchlistStore;
    private final int concurrency;

    public ScanEngine(MarketDataService marketDataService,
                      WatchlistStore watchlistStore,
                      @Value("${research.scan-concurrency:4}") int concurrency) {
        this.marketDataService = marketDataService;
        this.watchlistStore = watchlistStore;
        this.concurrency = Math.max(1, concurrency);
    }

    public Mono<ScanOutcome> scanWatchlist(ScanIntent intent, TimeRange range) {
        TimeRange effective = range == null ? TimeRange.INTRADAY : range;
        return Mono.fromCallable(watchlistStore::load)
            .flatMap(watchlist -> {
                if (watchlist.isEmpty()) {
                    log.warn("[Scan] Watchlist source missing. intent={}", intent);
                    return Mono.just(ScanOutcome.empty(intent, effective, STATUS_NOT_FOUND));
                }
                if (watchlist.get().isEmpty()) {
                    return Mono.just(ScanOutcome.empty(intent, effective, STATUS_EMPTY));
                }
                return scan(watchlist.get(), intent, effective);
            });
    }

    public Mono<ScanOutcome> scan(List<String> watchlist, ScanIntent intent, TimeRange range) {
        TimeRange effective = range == null ? TimeRange.INTRADAY : range;
        ScanIntent effectiveIntent = intent == null ? ScanIntent.ALL : intent;
        log.info("[Scan] Starting. symbols={} intent={} range={}", watchlist.size(), effectiveIntent, effective.code());

        return Flux.fromIterable(watchlist)
            .flatMap(symbol -> evaluate(symbol, effective), concurrency)
            .collectList()
            .map(evaluated -> {
                List<ScanResult> matched = evaluated.stream()
                    .filter(result -> effectiveIntent.accepts(result.changePct()))
                    .sorted(BY_CHANGE_DESC)
                    .toList();
                String status = "Scanned " + evaluated.size() + " of " + watchlist.size() + " symbols.";
                log.info("[Scan] Complete. evaluated={} matched={} intent={}",
                    evaluated.size(), matched.size(), effectiveIntent);
                return new ScanOutcome(effectiveIntent, effective, matched, status);
            });
    }

    private Mono<ScanResult> evaluate(String symbol, TimeRange range) {
        return marketDataService.fetch(symbol, range)
            .flatMap(series -> Mono.justOrEmpty(toResult(series)))
            .onErrorResume(e -> {
                log.warn("[Scan] Symbol excluded. symbol={} reason={}", symbol, e.getMessage());
                return Mono.empty();
            });
    }

    static Optional<ScanResult> toResult(TimeSeries series) {
        return percentChange(series)
            .map(pct -> new ScanResult(series.symbol(), series.last().close(), pct, series.provenance()));
    }

    static Optional<Double> percentChange(TimeSeries series) {
        if (series == null || series.isEmpty()) return Optional.empty();
        double firstOpen = series.first().open();
        double lastClose = series.last().close();
        if (!(firstOpen > 0) || Double.isNaN(lastClose)) return Optional.empty();
        return Optional.of((lastClose - firstOpen) / firstOpen * 100.0);
    }
}
