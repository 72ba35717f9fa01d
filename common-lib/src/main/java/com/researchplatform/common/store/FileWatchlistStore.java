package com.researchplatform.common.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Watchlist persisted as a JSON array of symbol strings, e.g. {@code ["AAPL","MSFT"]}.
 *
 * <p>A missing file is reported as empty. An unreadable file is logged and treated as an empty
 * list so that callers keep running.
 */
public class FileWatchlistStore implements WatchlistStore {

    private static final Logger log = LoggerFactory.getLogger(FileWatchlistStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    public FileWatchlistStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<List<String>> load() {
        if (!Files.exists(path)) {
            log.info("[Watchlist] File not found. path={}", path);
            return Optional.empty();
        }
        try {
            List<String> raw = objectMapper.readValue(path.toFile(), new TypeReference<List<String>>() {});
            List<String> symbols = new ArrayList<>();
            for (String symbol : raw) {
                if (symbol != null && !symbol.isBlank()) {
                    symbols.add(symbol.trim().toUpperCase(Locale.ROOT));
                }
            }
            return Optional.of(List.copyOf(symbols));
        } catch (IOException e) {
            log.error("[Watchlist] Failed to read watchlist. path={}", path, e);
            return Optional.of(List.of());
        }
    }

    public Path path() {
        return path;
    }
}
