package com.researchplatform.orchestrator.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable accumulated state of one research run. Created from the task, extended by each
 * stage's {@link StateUpdate}, discarded once the report is assembled.
 */
public final class PipelineState {

    private final Map<StateKey<?>, Object> values;

    private PipelineState(Map<StateKey<?>, Object> values) {
        this.values = values;
    }

    public static PipelineState seed(String task) {
        Map<StateKey<?>, Object> values = new LinkedHashMap<>();
        values.put(PipelineKeys.TASK, task == null ? "" : task);
        return new PipelineState(Collections.unmodifiableMap(values));
    }

    public <T> Optional<T> get(StateKey<T> key) {
        return Optional.ofNullable(values.get(key)).map(key::cast);
    }

    public <T> T require(StateKey<T> key) {
        return get(key).orElseThrow(() -> new IllegalStateException("Missing pipeline state: " + key));
    }

    public boolean contains(StateKey<?> key) {
        return values.containsKey(key);
    }

    public String task() {
        return require(PipelineKeys.TASK);
    }

    PipelineState with(StateUpdate update) {
        if (update.keys().isEmpty()) return this;
        Map<StateKey<?>, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(update.values());
        return new PipelineState(Collections.unmodifiableMap(merged));
    }

    @Override
    public String toString() {
        return "PipelineState" + values.keySet();
    }
}
