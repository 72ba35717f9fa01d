package com.researchplatform.monitor.scheduler;

import com.researchplatform.common.model.Alert;
import com.researchplatform.common.store.AlertSink;
import com.researchplatform.monitor.check.SymbolCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * All checks for one symbol in one monitor tick. Each check is isolated: a failing check is
 * logged and contributes no alert, and never stops its siblings.
 */
final class SymbolCheckTask {

    private static final Logger log = LoggerFactory.getLogger(SymbolCheckTask.class);

    private final String symbol;
    private final List<SymbolCheck> checks;
    private final AlertSink alertSink;

    SymbolCheckTask(String symbol, List<SymbolCheck> checks, AlertSink alertSink) {
        this.symbol = symbol;
        this.checks = checks;
        this.alertSink = alertSink;
    }

    String symbol() {
        return symbol;
    }

    /** Runs every check and appends the alerts that fire. Emits the number of alerts recorded. */
    Mono<Integer> run() {
        return Flux.fromIterable(checks)
            .concatMap(this::runCheck)
            .count()
            .map(Long::intValue);
    }

    private Mono<Alert> runCheck(SymbolCheck check) {
        return Mono.defer(() -> check.check(symbol))
            .flatMap(alert -> Mono.fromCallable(() -> {
                    alertSink.append(alert);
                    return alert;
                })
                .subscribeOn(Schedulers.boundedElastic()))
            .doOnNext(alert -> log.info("[Monitor] Alert raised. symbol={} type={} message={}",
                symbol, alert.type(), alert.message()))
            .onErrorResume(e -> {
                log.error("[Monitor] Check failed. symbol={} check={} reason={}", symbol, check.name(), e.getMessage());
                return Mono.empty();
            });
    }
}
