package com.researchplatform.marketdata.client;

import com.researchplatform.common.exception.CollaboratorException;
import com.researchplatform.common.model.PriceBar;
import com.researchplatform.common.model.Provenance;
import com.researchplatform.common.model.TimeRange;
import com.researchplatform.common.model.TimeSeries;
import com.researchplatform.marketdata.model.AlphaVantageTimeSeriesResponse;
import com.researchplatform.marketdata.model.AlphaVantageTimeSeriesResponse.OhlcvData;
import com.researchplatform.marketdata.provider.MarketDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Live {@link MarketDataProvider} backed by the Alpha Vantage REST API.
 *
 * <p>Intraday requests use {@code TIME_SERIES_INTRADAY} at 5-minute resolution. Daily ranges pull
 * the full daily history and trim it with {@link DailyRangeFilter}. A body without a series
 * object (rate-limit note, information message, error message) is reported as a
 * {@link CollaboratorException}.
 */
@Component
public class AlphaVantageClient implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(AlphaVantageClient.class);
    static final String COLLABORATOR = "alpha-vantage";
    static final String SOURCE_NOTE = "Real API (Alpha Vantage)";

    private final WebClient webClient;
    private final Clock clock;
    private final String apiKey;
    private final Duration timeout;

    public AlphaVantageClient(@Qualifier("alphaVantageWebClient") WebClient webClient,
                              Clock clock,
                              @Value("${alpha-vantage.api-key:demo}") String apiKey,
                              @Value("${alpha-vantage.timeout-seconds:30}") long timeoutSeconds) {
        this.webClient = webClient;
        this.clock = clock;
        this.apiKey = apiKey;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public Mono<TimeSeries> fetchSeries(String symbol, TimeRange range) {
        boolean intraday = range.isIntraday();
        log.info("[AlphaVantage] Fetching series. symbol={} range={}", symbol, range.code());
        return webClient.get()
            .uri(uri -> {
                uri.path("/query")
                    .queryParam("function", intraday ? "TIME_SERIES_INTRADAY" : "TIME_SERIES_DAILY")
                    .queryParam("symbol", symbol);
                if (intraday) {
                    uri.queryParam("interval", "5min");
                }
                return uri.queryParam("outputsize", intraday ? "compact" : "full")
                    .queryParam("apikey", apiKey)
                    .build();
            })
            .retrieve()
            .bodyToMono(AlphaVantageTimeSeriesResponse.class)
            .timeout(timeout)
            .map(response -> toSeries(symbol, range, response))
            .onErrorMap(e -> !(e instanceof CollaboratorException),
                e -> new CollaboratorException(COLLABORATOR, "Fetch failed for " + symbol + ": " + e.getMessage(), e))
            .doOnSuccess(series -> log.info("[AlphaVantage] Series fetched. symbol={} range={} bars={}",
                symbol, range.code(), series.size()));
    }

    TimeSeries toSeries(String symbol, TimeRange range, AlphaVantageTimeSeriesResponse response) {
        Map<String, OhlcvData> raw = range.isIntraday() ? response.timeSeries5min() : response.timeSeriesDaily();
        if (raw == null || raw.isEmpty()) {
            throw new CollaboratorException(COLLABORATOR, "No time series for " + symbol + ": " + response.diagnostic());
        }
        if (!range.isIntraday()) {
            raw = DailyRangeFilter.apply(raw, range, LocalDateTime.now(clock));
        }

        TreeMap<LocalDateTime, PriceBar> bars = new TreeMap<>();
        raw.forEach((key, ohlcv) -> {
            Optional<LocalDateTime> timestamp = SeriesTimestamps.parse(key);
            if (timestamp.isEmpty() || ohlcv == null) {
                log.warn("[AlphaVantage] Dropping unconvertible entry. symbol={} key={}", symbol, key);
                return;
            }
            try {
                bars.put(timestamp.get(), new PriceBar(timestamp.get(),
                    ohlcv.openAsDouble(), ohlcv.highAsDouble(), ohlcv.lowAsDouble(),
                    ohlcv.closeAsDouble(), ohlcv.volumeAsLong()));
            } catch (NumberFormatException | NullPointerException e) {
                log.warn("[AlphaVantage] Dropping entry with bad numbers. symbol={} key={} error={}",
                    symbol, key, e.getMessage());
            }
        });
        if (bars.isEmpty()) {
            throw new CollaboratorException(COLLABORATOR, "Series for " + symbol + " converted to zero bars");
        }
        return new TimeSeries(symbol, range, new ArrayList<>(bars.values()), Provenance.LIVE, SOURCE_NOTE);
    }
}
