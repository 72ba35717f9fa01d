package com.researchplatform.common.store;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the externally managed watchlist. Read before every scan and monitor cycle.
 */
public interface WatchlistStore {

    /**
     * @return the ordered symbols, or empty when the watchlist source does not exist
     */
    Optional<List<String>> load();
}
