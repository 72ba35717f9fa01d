package com.researchplatform.monitor.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.researchplatform.common.model.Alert;
import com.researchplatform.common.model.AlertType;
import com.researchplatform.common.store.FileAlertLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

class AlertControllerTest {

    @TempDir
    Path tempDir;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        FileAlertLog alertLog = new FileAlertLog(tempDir.resolve("alerts.json"), 100,
            new ObjectMapper().registerModule(new JavaTimeModule()));
        Instant t = Instant.parse("2024-05-14T15:00:00Z");
        alertLog.append(new Alert(t, AlertType.MARKET, "AAA", "UP ALERT: AAA moved +0.60% to $100.60", Map.of("price", 100.6)));
        alertLog.append(new Alert(t.plusSeconds(10), AlertType.NEWS, "BBB", "NEWS ALERT: BBB - merger", Map.of()));
        client = WebTestClient.bindToController(new AlertController(alertLog)).build();
    }

    @Test
    void returnsNewestFirst() {
        client.get().uri("/api/v1/alerts")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(2)
            .jsonPath("$[0].symbol").isEqualTo("BBB")
            .jsonPath("$[1].type").isEqualTo("MARKET");
    }

    @Test
    void honoursLimit() {
        client.get().uri("/api/v1/alerts?limit=1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(1);
    }

    @Test
    void healthIsOk() {
        client.get().uri("/api/v1/alerts/health")
            .exchange()
            .expectStatus().isOk();
    }
}
