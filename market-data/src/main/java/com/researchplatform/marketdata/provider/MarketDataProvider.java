package com.researchplatform.marketdata.provider;

import com.researchplatform.common.model.TimeRange;
import com.researchplatform.common.model.TimeSeries;
import reactor.core.publisher.Mono;

/**
 * Strategy interface for the live market-data source. Implementations may fail for any reason;
 * {@link com.researchplatform.marketdata.service.MarketDataService} owns the fallback.
 */
public interface MarketDataProvider {
    Mono<TimeSeries> fetchSeries(String symbol, TimeRange range);
}
