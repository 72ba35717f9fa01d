package com.researchplatform.marketdata.service;

import com.researchplatform.common.model.TimeRange;
import com.researchplatform.common.model.TimeSeries;
import com.researchplatform.marketdata.provider.MarketDataProvider;
import com.researchplatform.marketdata.synth.MockSeriesSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Single entry point for series data. Tries the live provider and, on any error or empty
 * response, substitutes a simulated series; the returned {@link Mono} never errors.
 */
@Service
public class MarketDataService {

    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    private final MarketDataProvider liveProvider;
    private final MockSeriesSynthesizer synthesizer;
    private final Clock clock;

    public MarketDataService(MarketDataProvider liveProvider, MockSeriesSynthesizer synthesizer, Clock clock) {
        this.liveProvider = liveProvider;
        this.synthesizer = synthesizer;
        this.clock = clock;
    }

    public Mono<TimeSeries> fetch(String symbol, TimeRange range) {
        String normalized = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        TimeRange effective = range == null ? TimeRange.INTRADAY : range;

        return Mono.defer(() -> liveProvider.fetchSeries(normalized, effective))
            .switchIfEmpty(Mono.error(() -> new IllegalStateException("live provider returned no series")))
            .onErrorResume(e -> {
                log.warn("[MarketData] Live fetch failed, using simulated series. symbol={} range={} reason={}",
                    normalized, effective.code(), e.getMessage());
                return Mono.fromSupplier(() ->
                    synthesizer.generate(normalized, effective, LocalDateTime.now(clock), e.getMessage()));
            });
    }
}
