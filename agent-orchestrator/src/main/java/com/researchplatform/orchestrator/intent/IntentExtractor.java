package com.researchplatform.orchestrator.intent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchplatform.common.json.LlmJson;
import com.researchplatform.common.llm.LlmClient;
import com.researchplatform.common.model.Intent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Turns a free-text task into an {@link Intent} with one model call. A failed call yields
 * {@link Intent#none()}, which ends the run in the refusal report.
 */
@Component
public class IntentExtractor {

    private static final Logger log = LoggerFactory.getLogger(IntentExtractor.class);

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;

    public IntentExtractor(LlmClient llmClient, ObjectMapper objectMapper) {
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
    }

    public Mono<Intent> extract(String task) {
        return llmClient.complete(buildPrompt(task))
            .map(reply -> IntentDecoder.decodeStructured(reply, objectMapper).orElseGet(() -> fallback(reply)))
            .defaultIfEmpty(Intent.none())
            .doOnNext(intent -> log.info("[Intent] Extracted. symbol={} scanIntent={} timeRange={}",
                intent.symbol(), intent.scanIntent(), intent.timeRange().code()))
            .onErrorResume(e -> {
                log.error("[Intent] Extraction call failed, treating as insufficient input. reason={}", e.getMessage());
                return Mono.just(Intent.none());
            });
    }

    private Intent fallback(String reply) {
        if (LlmJson.containsBraces(reply)) {
            Intent salvaged = IntentDecoder.decodeLenient(reply, objectMapper);
            log.warn("[Intent] Malformed JSON reply, lenient decode used. symbol={} scanIntent={}",
                salvaged.symbol(), salvaged.scanIntent());
            return salvaged;
        }
        Intent guessed = IntentDecoder.heuristic(reply);
        log.warn("[Intent] No JSON in reply, heuristic used. symbol={} scanIntent={}",
            guessed.symbol(), guessed.scanIntent());
        return guessed;
    }

    static String buildPrompt(String task) {
        return """
            Read the user's request and extract its intent.

            1. If the user wants to analyze one specific stock, give its ticker symbol (e.g. AAPL).
            2. If the user wants a market scan of the watchlist (top gainers, losers, movers), set
               "scan_intent" to "UPWARD" (gainers), "DOWNWARD" (losers) or "ALL" (everything).
            3. Give the time range the user asked about: one of INTRADAY, 1D, 3D, 1W, 1M, 3M, 1Y.
               Use INTRADAY when none is mentioned.

            Reply with exactly one JSON object and nothing else:
            {"symbol": "AAPL" or null, "scan_intent": "UPWARD" | "DOWNWARD" | "ALL" | null, "time_range": "INTRADAY"}

            Request: %s
            """.formatted(task);
    }
}
