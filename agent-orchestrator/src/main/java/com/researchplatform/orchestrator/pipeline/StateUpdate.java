package com.researchplatform.orchestrator.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** Partial state produced by one stage. */
public final class StateUpdate {

    private static final StateUpdate EMPTY = new StateUpdate(Map.of());

    private final Map<StateKey<?>, Object> values;

    private StateUpdate(Map<StateKey<?>, Object> values) {
        this.values = values;
    }

    public static StateUpdate empty() {
        return EMPTY;
    }

    public static <T> StateUpdate of(StateKey<T> key, T value) {
        return empty().and(key, value);
    }

    public <T> StateUpdate and(StateKey<T> key, T value) {
        if (value == null) {
            throw new IllegalArgumentException("State value must not be null. key=" + key.name());
        }
        Map<StateKey<?>, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, key.type().cast(value));
        return new StateUpdate(Collections.unmodifiableMap(copy));
    }

    public Set<StateKey<?>> keys() {
        return values.keySet();
    }

    Map<StateKey<?>, Object> values() {
        return values;
    }
}
