package com.researchplatform.orchestrator.stage;

import com.researchplatform.common.exception.CollaboratorException;
import com.researchplatform.common.model.Intent;
import com.researchplatform.common.model.ScanIntent;
import com.researchplatform.common.model.TimeRange;
import com.researchplatform.orchestrator.client.PortfolioClient;
import com.researchplatform.orchestrator.client.dto.PortfolioResponse;
import com.researchplatform.orchestrator.model.PortfolioOutcome;
import com.researchplatform.orchestrator.pipeline.PipelineKeys;
import com.researchplatform.orchestrator.pipeline.PipelineStates;
import com.researchplatform.orchestrator.pipeline.StateUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PortfolioLookupStageTest {

    private PortfolioClient portfolioClient;
    private PortfolioLookupStage stage;

    @BeforeEach
    void setUp() {
        portfolioClient = mock(PortfolioClient.class);
        stage = new PortfolioLookupStage(portfolioClient);
    }

    private PortfolioOutcome run(Intent intent) {
        StateUpdate update = stage.apply(PipelineStates.of("task", StateUpdate.of(PipelineKeys.INTENT, intent))).block();
        assertNotNull(update);
        return PipelineStates.of("task", update).require(PipelineKeys.PORTFOLIO);
    }

    @Test
    void asksExposureQuestionForSymbol() {
        String question = PortfolioLookupStage.exposureQuestion("AAPL");
        when(portfolioClient.query(question)).thenReturn(Mono.just(new PortfolioResponse(
            "success", question, "SELECT ...", List.of(Map.of("symbol", "AAPL", "shares", 50)), null)));

        PortfolioOutcome outcome = run(Intent.forSymbol("AAPL", TimeRange.INTRADAY));

        assertEquals("What is the current exposure to AAPL?", outcome.question());
        assertEquals(1, outcome.rows().size());
        assertNull(outcome.note());
    }

    @Test
    void nullRowsAreDropped() {
        String question = PortfolioLookupStage.exposureQuestion("MSFT");
        List<Map<String, Object>> rows = Arrays.asList(null, Map.of("symbol", "MSFT", "shares", 10), null);
        when(portfolioClient.query(question)).thenReturn(Mono.just(new PortfolioResponse(
            "success", question, "SELECT ...", rows, null)));

        PortfolioOutcome outcome = run(Intent.forSymbol("MSFT", TimeRange.INTRADAY));

        assertEquals(1, outcome.rows().size());
        assertEquals("MSFT", outcome.rows().get(0).get("symbol"));
    }

    @Test
    void failureIsRecordedNotPropagated() {
        String question = PortfolioLookupStage.exposureQuestion("TSLA");
        when(portfolioClient.query(question)).thenReturn(Mono.error(new CollaboratorException("portfolio", "timeout")));

        PortfolioOutcome outcome = run(Intent.forSymbol("TSLA", TimeRange.INTRADAY));

        assertNotNull(outcome.note());
        assertTrue(outcome.rows().isEmpty());
    }

    @Test
    void scanAndMissingSymbolAreSkipped() {
        assertEquals(PortfolioOutcome.SCAN_SKIPPED, run(Intent.forScan(ScanIntent.ALL, TimeRange.INTRADAY)).note());
        assertEquals(PortfolioOutcome.NO_SYMBOL, run(Intent.none()).note());
        verifyNoInteractions(portfolioClient);
    }
}
