package com.researchplatform.common.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchplatform.common.model.Alert;
import com.researchplatform.common.model.AlertType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class FileAlertLogTest {

    private static final Instant T0 = Instant.parse("2024-05-14T15:00:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static Alert alert(int i) {
        return new Alert(T0.plusSeconds(i), AlertType.MARKET, "S" + i, "alert " + i, Map.of("price", 100.0 + i));
    }

    @Test
    void newestFirstAndCapped() {
        FileAlertLog alertLog = new FileAlertLog(tempDir.resolve("alerts.json"), 3, objectMapper);
        for (int i = 0; i < 5; i++) {
            alertLog.append(alert(i));
        }

        List<Alert> recent = alertLog.recent(10);

        assertEquals(List.of("S4", "S3", "S2"), recent.stream().map(Alert::symbol).toList());
        assertEquals(T0.plusSeconds(4), recent.get(0).timestamp());
        assertEquals(104.0, ((Number) recent.get(0).details().get("price")).doubleValue(), 1e-9);
    }

    @Test
    void survivesNewInstance() {
        Path path = tempDir.resolve("nested/alerts.json");
        new FileAlertLog(path, 100, objectMapper).append(alert(1));

        assertEquals(1, new FileAlertLog(path, 100, objectMapper).recent(20).size());
    }

    @Test
    void unreadableFileStartsFresh() throws Exception {
        Path path = tempDir.resolve("alerts.json");
        Files.writeString(path, "not json");
        FileAlertLog alertLog = new FileAlertLog(path, 100, objectMapper);

        assertTrue(alertLog.recent(5).isEmpty());
        alertLog.append(alert(7));
        assertEquals("S7", alertLog.recent(5).get(0).symbol());
    }

    @Test
    void concurrentAppendsAreNotLost() throws Exception {
        FileAlertLog alertLog = new FileAlertLog(tempDir.resolve("alerts.json"), 100, objectMapper);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 20; i++) {
            int n = i;
            pool.submit(() -> alertLog.append(alert(n)));
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(20, alertLog.recent(100).size());
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class,
            () -> new FileAlertLog(tempDir.resolve("a.json"), 0, objectMapper));
    }
}
