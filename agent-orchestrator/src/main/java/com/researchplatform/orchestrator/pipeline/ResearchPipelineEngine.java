package com.researchplatform.orchestrator.pipeline;

import com.researchplatform.orchestrator.logger.PipelineFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs the research stages strictly in order, each on the state left by its predecessor.
 *
 * <p>Stage order comes from the injected list (stages carry {@code @Order}). A stage writing a
 * key it does not own is a programming error and fails the run with
 * {@link IllegalStateException}.
 */
@Component
public class ResearchPipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(ResearchPipelineEngine.class);

    private final List<PipelineStage> stages;
    private final PipelineFlowLogger flowLogger;

    public ResearchPipelineEngine(List<PipelineStage> stages, PipelineFlowLogger flowLogger) {
        this.stages = List.copyOf(stages);
        this.flowLogger = flowLogger;
        log.info("[Pipeline] Stages registered. order={}", this.stages.stream().map(PipelineStage::name).toList());
    }

    public Mono<PipelineState> run(PipelineState initial) {
        Mono<PipelineState> chain = Mono.just(initial);
        for (PipelineStage stage : stages) {
            chain = chain.flatMap(state -> runStage(stage, state));
        }
        return chain;
    }

    public List<String> stageNames() {
        return stages.stream().map(PipelineStage::name).toList();
    }

    private Mono<PipelineState> runStage(PipelineStage stage, PipelineState state) {
        return Mono.defer(() -> stage.apply(state))
            .defaultIfEmpty(StateUpdate.empty())
            .map(update -> {
                checkOwnership(stage, update);
                return state.with(update);
            })
            .doOnEach(flowLogger.stage(stage.name()));
    }

    static void checkOwnership(PipelineStage stage, StateUpdate update) {
        for (StateKey<?> key : update.keys()) {
            if (!key.owner().equals(stage.name())) {
                throw new IllegalStateException("Stage '" + stage.name() + "' wrote key '" + key.name()
                    + "' owned by '" + key.owner() + "'");
            }
        }
    }
}
