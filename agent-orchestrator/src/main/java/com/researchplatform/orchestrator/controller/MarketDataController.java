package com.researchplatform.orchestrator.controller;

import com.researchplatform.common.model.ScanIntent;
import com.researchplatform.common.model.ScanOutcome;
import com.researchplatform.common.model.TimeRange;
import com.researchplatform.common.model.TimeSeries;
import com.researchplatform.marketdata.scan.ScanEngine;
import com.researchplatform.marketdata.service.MarketDataService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/** Direct access to series data and watchlist scans, outside a research run. */
@RestController
@RequestMapping("/api/v1/market-data")
public class MarketDataController {

    private final MarketDataService marketDataService;
    private final ScanEngine scanEngine;

    public MarketDataController(MarketDataService marketDataService, ScanEngine scanEngine) {
        this.marketDataService = marketDataService;
        this.scanEngine = scanEngine;
    }

    @GetMapping("/series/{symbol}")
    public Mono<ResponseEntity<TimeSeries>> series(@PathVariable String symbol,
                                                   @RequestParam(value = "range", defaultValue = "INTRADAY") String range) {
        TimeRange timeRange = TimeRange.fromCode(range).orElse(null);
        if (timeRange == null) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return marketDataService.fetch(symbol, timeRange).map(ResponseEntity::ok);
    }

    @PostMapping("/scan")
    public Mono<ResponseEntity<ScanOutcome>> scan(@RequestBody(required = false) ScanRequest request) {
        ScanIntent intent = request == null ? ScanIntent.ALL
            : ScanIntent.fromCode(request.scanIntent()).orElse(ScanIntent.ALL);
        TimeRange range = request == null ? TimeRange.INTRADAY
            : TimeRange.fromCode(request.timeRange()).orElse(TimeRange.INTRADAY);
        return scanEngine.scanWatchlist(intent, range).map(ResponseEntity::ok);
    }
}
