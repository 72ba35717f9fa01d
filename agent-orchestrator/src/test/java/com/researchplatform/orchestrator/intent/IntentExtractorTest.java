package com.researchplatform.orchestrator.intent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchplatform.common.exception.CollaboratorException;
import com.researchplatform.common.llm.LlmClient;
import com.researchplatform.common.model.ScanIntent;
import com.researchplatform.common.model.TimeRange;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class IntentExtractorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private IntentExtractor extractorReplying(Mono<String> reply) {
        LlmClient llmClient = prompt -> reply;
        return new IntentExtractor(llmClient, objectMapper);
    }

    @Test
    void structuredReplyIsDecoded() {
        StepVerifier.create(extractorReplying(Mono.just("{\"symbol\":\"MSFT\",\"time_range\":\"3M\"}"))
                .extract("How has Microsoft done this quarter?"))
            .assertNext(intent -> {
                assertEquals("MSFT", intent.symbol());
                assertEquals(TimeRange.THREE_MONTHS, intent.timeRange());
            })
            .verifyComplete();
    }

    @Test
    void freeTextReplyFallsBackToHeuristic() {
        StepVerifier.create(extractorReplying(Mono.just("Top gainers")).extract("who is up today?"))
            .assertNext(intent -> assertEquals(ScanIntent.ALL, intent.scanIntent()))
            .verifyComplete();
    }

    @Test
    void malformedJsonReplyKeepsSymbolInsteadOfScanning() {
        String reply = "{\"symbol\": \"AAPL\", \"scan_intent\": null, \"time_range\": \"1M\",}";

        StepVerifier.create(extractorReplying(Mono.just(reply)).extract("How is Apple doing this month?"))
            .assertNext(intent -> {
                assertEquals("AAPL", intent.symbol());
                assertNull(intent.scanIntent());
                assertEquals(TimeRange.ONE_MONTH, intent.timeRange());
            })
            .verifyComplete();
    }

    @Test
    void unknownScanIntentReplyIsNotTreatedAsScan() {
        StepVerifier.create(extractorReplying(Mono.just("{\"symbol\": null, \"scan_intent\": \"SIDEWAYS\"}"))
                .extract("what is moving sideways?"))
            .assertNext(intent -> {
                assertFalse(intent.hasSymbol());
                assertFalse(intent.isScan());
            })
            .verifyComplete();
    }

    @Test
    void failedCallGivesEmptyIntent() {
        StepVerifier.create(extractorReplying(Mono.error(new CollaboratorException("anthropic", "down")))
                .extract("analyze apple"))
            .assertNext(intent -> {
                assertFalse(intent.hasSymbol());
                assertFalse(intent.isScan());
            })
            .verifyComplete();
    }

    @Test
    void promptCarriesTask() {
        assertTrue(IntentExtractor.buildPrompt("analyze tesla").contains("Request: analyze tesla"));
    }
}
