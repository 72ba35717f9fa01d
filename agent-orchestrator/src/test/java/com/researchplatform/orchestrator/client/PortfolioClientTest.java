package com.researchplatform.orchestrator.client;

import com.researchplatform.common.exception.CollaboratorException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PortfolioClientTest {

    private final AtomicInteger calls = new AtomicInteger();

    private PortfolioClient clientReturning(String body) {
        WebClient webClient = WebClient.builder()
            .exchangeFunction(request -> {
                calls.incrementAndGet();
                return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
            })
            .build();
        return new PortfolioClient(webClient, 5);
    }

    @Test
    void successfulQueryReturnsRows() {
        String body = """
            {"status": "success", "question": "q", "generated_sql": "SELECT * FROM positions",
             "data": [{"symbol": "AAPL", "shares": 100}]}
            """;

        StepVerifier.create(clientReturning(body).query("What is the current exposure to AAPL?"))
            .assertNext(response -> {
                assertEquals("SELECT * FROM positions", response.generatedQuery());
                assertEquals(100, response.data().get(0).get("shares"));
            })
            .verifyComplete();
    }

    @Test
    void errorStatusFails() {
        StepVerifier.create(clientReturning("{\"status\": \"error\", \"message\": \"db down\"}")
                .query("What is the current exposure to AAPL?"))
            .expectErrorSatisfies(e -> assertTrue(e.getMessage().contains("db down")))
            .verify();
    }

    @Test
    void writeQuestionIsRejectedBeforeSending() {
        StepVerifier.create(clientReturning("{}").query("delete all positions"))
            .expectError(CollaboratorException.class)
            .verify();

        assertEquals(0, calls.get());
    }
}
