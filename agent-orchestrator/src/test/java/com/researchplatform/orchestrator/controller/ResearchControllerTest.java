package com.researchplatform.orchestrator.controller;

import com.researchplatform.orchestrator.model.ResearchReport;
import com.researchplatform.orchestrator.report.ReportKind;
import com.researchplatform.orchestrator.report.ReportSynthesizer;
import com.researchplatform.orchestrator.service.ResearchService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResearchControllerTest {

    private ResearchService researchService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        researchService = mock(ResearchService.class);
        client = WebTestClient.bindToController(new ResearchController(researchService)).build();
    }

    @Test
    void returnsReport() {
        ResearchReport report = new ResearchReport("trace-1", "analyze xyz", ReportKind.REFUSAL, null, null,
            ReportSynthesizer.REFUSAL, false, null, null, null, List.of(), null, List.of(), List.of(), List.of(),
            Instant.parse("2024-05-14T12:00:00Z"));
        when(researchService.research("analyze xyz")).thenReturn(Mono.just(report));

        client.post().uri("/api/v1/research")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("task", "  analyze xyz "))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.traceId").isEqualTo("trace-1")
            .jsonPath("$.kind").isEqualTo("REFUSAL")
            .jsonPath("$.reportText").isEqualTo(ReportSynthesizer.REFUSAL);
    }

    @Test
    void blankTaskIsBadRequest() {
        client.post().uri("/api/v1/research")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("task", "   "))
            .exchange()
            .expectStatus().isBadRequest();

        verify(researchService, never()).research(anyString());
    }

    @Test
    void healthIsOk() {
        client.get().uri("/api/v1/research/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
