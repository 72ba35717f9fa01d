package com.researchplatform.monitor.check;

import com.researchplatform.common.model.Alert;
import reactor.core.publisher.Mono;

/**
 * One independent condition evaluated per watchlist symbol on every monitor tick.
 * Completes empty when the condition does not fire.
 */
public interface SymbolCheck {

    String name();

    Mono<Alert> check(String symbol);
}
