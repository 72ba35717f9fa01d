package com.researchplatform.common.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileWatchlistStoreTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void readsAndNormalizesSymbols() throws Exception {
        Path path = tempDir.resolve("watchlist.json");
        Files.writeString(path, "[\"aapl\", \" msft \", \"\", null, \"NVDA\"]");

        assertEquals(Optional.of(List.of("AAPL", "MSFT", "NVDA")), new FileWatchlistStore(path, objectMapper).load());
    }

    @Test
    void missingFileIsAbsent() {
        assertTrue(new FileWatchlistStore(tempDir.resolve("none.json"), objectMapper).load().isEmpty());
    }

    @Test
    void unreadableFileIsEmptyList() throws Exception {
        Path path = tempDir.resolve("watchlist.json");
        Files.writeString(path, "{broken");

        assertEquals(Optional.of(List.of()), new FileWatchlistStore(path, objectMapper).load());
    }
}
