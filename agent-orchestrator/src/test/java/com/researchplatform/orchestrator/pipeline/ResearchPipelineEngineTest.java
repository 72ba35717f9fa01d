package com.researchplatform.orchestrator.pipeline;

import com.researchplatform.common.model.Intent;
import com.researchplatform.common.model.TimeRange;
import com.researchplatform.orchestrator.logger.PipelineFlowLogger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class ResearchPipelineEngineTest {

    private final List<String> executed = new ArrayList<>();

    private PipelineStage stage(String name, Function<PipelineState, Mono<StateUpdate>> body) {
        return new PipelineStage() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Mono<StateUpdate> apply(PipelineState state) {
                executed.add(name);
                return body.apply(state);
            }
        };
    }

    private ResearchPipelineEngine engine(PipelineStage... stages) {
        return new ResearchPipelineEngine(List.of(stages), new PipelineFlowLogger());
    }

    @Test
    @DisplayName("stages run in order and each sees its predecessors' output")
    void runsStagesInOrder() {
        ResearchPipelineEngine engine = engine(
            stage(PipelineKeys.EXTRACT_INTENT, s ->
                Mono.just(StateUpdate.of(PipelineKeys.INTENT, Intent.forSymbol("AAPL", TimeRange.ONE_WEEK)))),
            stage(PipelineKeys.WEB_RESEARCH, s -> {
                assertEquals("AAPL", s.require(PipelineKeys.INTENT).symbol());
                return Mono.just(StateUpdate.empty());
            }));

        StepVerifier.create(engine.run(PipelineState.seed("analyze apple")))
            .assertNext(state -> {
                assertEquals("analyze apple", state.task());
                assertEquals(TimeRange.ONE_WEEK, state.require(PipelineKeys.INTENT).timeRange());
            })
            .verifyComplete();

        assertEquals(List.of(PipelineKeys.EXTRACT_INTENT, PipelineKeys.WEB_RESEARCH), executed);
        assertEquals(List.of(PipelineKeys.EXTRACT_INTENT, PipelineKeys.WEB_RESEARCH), engine.stageNames());
    }

    @Test
    @DisplayName("a stage writing another stage's key fails the run")
    void rejectsForeignKeyWrite() {
        ResearchPipelineEngine engine = engine(
            stage(PipelineKeys.WEB_RESEARCH, s ->
                Mono.just(StateUpdate.of(PipelineKeys.INTENT, Intent.none()))),
            stage(PipelineKeys.MARKET_DATA, s -> Mono.just(StateUpdate.empty())));

        StepVerifier.create(engine.run(PipelineState.seed("task")))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(IllegalStateException.class, e);
                assertTrue(e.getMessage().contains("owned by 'extract_intent'"));
            })
            .verify();

        assertEquals(List.of(PipelineKeys.WEB_RESEARCH), executed);
    }

    @Test
    @DisplayName("an empty stage result leaves the state unchanged")
    void emptyStageResultIsNoOp() {
        ResearchPipelineEngine engine = engine(stage(PipelineKeys.TRANSFORM, s -> Mono.empty()));

        StepVerifier.create(engine.run(PipelineState.seed("task")))
            .assertNext(state -> assertFalse(state.contains(PipelineKeys.FRAME)))
            .verifyComplete();
    }

    @Test
    @DisplayName("a synchronous throw inside a stage surfaces as an error signal")
    void synchronousThrowBecomesError() {
        ResearchPipelineEngine engine = engine(stage(PipelineKeys.ANALYZE, s -> {
            throw new IllegalArgumentException("boom");
        }));

        StepVerifier.create(engine.run(PipelineState.seed("task")))
            .expectError(IllegalArgumentException.class)
            .verify();
    }

    @Test
    void stateUpdateRejectsNullValues() {
        assertThrows(IllegalArgumentException.class, () -> StateUpdate.of(PipelineKeys.INTENT, null));
    }
}
