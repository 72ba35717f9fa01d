package com.researchplatform.orchestrator.stage;

import com.researchplatform.orchestrator.intent.IntentExtractor;
import com.researchplatform.orchestrator.pipeline.PipelineKeys;
import com.researchplatform.orchestrator.pipeline.PipelineStage;
import com.researchplatform.orchestrator.pipeline.PipelineState;
import com.researchplatform.orchestrator.pipeline.StateUpdate;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@Order(1)
public class ExtractIntentStage implements PipelineStage {

    private final IntentExtractor intentExtractor;

    public ExtractIntentStage(IntentExtractor intentExtractor) {
        this.intentExtractor = intentExtractor;
    }

    @Override
    public String name() {
        return PipelineKeys.EXTRACT_INTENT;
    }

    @Override
    public Mono<StateUpdate> apply(PipelineState state) {
        return intentExtractor.extract(state.task())
            .map(intent -> StateUpdate.of(PipelineKeys.INTENT, intent));
    }
}
