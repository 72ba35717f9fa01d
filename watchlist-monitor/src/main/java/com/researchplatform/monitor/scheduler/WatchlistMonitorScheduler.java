package com.researchplatform.monitor.scheduler;

import com.researchplatform.common.store.AlertSink;
import com.researchplatform.common.store.WatchlistStore;
import com.researchplatform.monitor.check.SymbolCheck;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;

/**
 * Polls the watchlist on a fixed interval and runs every {@link SymbolCheck} for each symbol.
 *
 * <p>Each tick is a fresh {@link Mono} whose terminal {@code subscribe()} schedules the next
 * tick, so the loop survives any failure inside a cycle. Symbols are checked in parallel up to
 * {@code monitor.concurrency}; the whole cycle is cut off after {@code monitor.cycle-timeout-seconds}.
 */
@Component
public class WatchlistMonitorScheduler {

    private static final Logger log = LoggerFactory.getLogger(WatchlistMonitorScheduler.class);

    private final WatchlistStore watchlistStore;
    private final List<SymbolCheck> checks;
    private final AlertSink alertSink;
    private final Duration interval;
    private final Duration cycleTimeout;
    private final int concurrency;
    private final boolean enabled;

    private volatile Disposable pending;
    private volatile boolean stopped;

    public WatchlistMonitorScheduler(WatchlistStore watchlistStore,
                                     List<SymbolCheck> checks,
                                     AlertSink alertSink,
                                     @Value("${monitor.interval-seconds:10}") long intervalSeconds,
                                     @Value("${monitor.cycle-timeout-seconds:120}") long cycleTimeoutSeconds,
                                     @Value("${monitor.concurrency:4}") int concurrency,
                                     @Value("${monitor.enabled:true}") boolean enabled) {
        this.watchlistStore = watchlistStore;
        this.checks = List.copyOf(checks);
        this.alertSink = alertSink;
        this.interval = Duration.ofSeconds(intervalSeconds);
        this.cycleTimeout = Duration.ofSeconds(cycleTimeoutSeconds);
        this.concurrency = Math.max(1, concurrency);
        this.enabled = enabled;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("[Monitor] Disabled by configuration.");
            return;
        }
        log.info("[Monitor] Started. intervalSeconds={} checks={} concurrency={}",
            interval.toSeconds(), checks.stream().map(SymbolCheck::name).toList(), concurrency);
        scheduleNextCycle(Duration.ZERO);
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        Disposable current = pending;
        if (current != null) {
            current.dispose();
        }
    }

    private void scheduleNextCycle(Duration delay) {
        if (stopped) return;
        pending = Mono.delay(delay)
            .then(runCycle())
            .subscribe(
                alerts -> scheduleNextCycle(interval),
                err -> {
                    log.error("[Monitor] Cycle failed, rescheduling. reason={}", err.getMessage());
                    scheduleNextCycle(interval);
                });
    }

    /** One tick over the current watchlist. Emits the number of alerts raised. */
    public Mono<Integer> runCycle() {
        return Mono.fromCallable(() -> watchlistStore.load().orElse(List.of()))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(symbols -> {
                if (symbols.isEmpty()) {
                    log.info("[Monitor] Watchlist empty or missing, nothing to check.");
                    return Mono.just(0);
                }
                return Flux.fromIterable(symbols)
                    .map(symbol -> new SymbolCheckTask(symbol, checks, alertSink))
                    .flatMap(SymbolCheckTask::run, concurrency)
                    .reduce(0, Integer::sum)
                    .doOnNext(alerts -> log.info("[Monitor] Cycle complete. symbols={} alerts={}", symbols.size(), alerts));
            })
            .timeout(cycleTimeout);
    }
}
