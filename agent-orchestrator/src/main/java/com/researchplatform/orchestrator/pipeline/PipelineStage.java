package com.researchplatform.orchestrator.pipeline;

import reactor.core.publisher.Mono;

/**
 * One step of the research pipeline: reads the accumulated state and returns the keys it owns.
 * Stages recover from collaborator failures themselves and complete with a fallback value.
 */
public interface PipelineStage {

    /** Stage name; must match the {@link StateKey#owner()} of every key the stage writes. */
    String name();

    Mono<StateUpdate> apply(PipelineState state);
}
