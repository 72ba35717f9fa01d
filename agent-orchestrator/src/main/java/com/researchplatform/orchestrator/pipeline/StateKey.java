package com.researchplatform.orchestrator.pipeline;

import java.util.Objects;

/**
 * Typed key into {@link PipelineState}. Each key names the single stage allowed to write it.
 */
public final class StateKey<T> {

    private final String name;
    private final Class<T> type;
    private final String owner;

    private StateKey(String name, Class<T> type, String owner) {
        this.name = Objects.requireNonNull(name);
        this.type = Objects.requireNonNull(type);
        this.owner = Objects.requireNonNull(owner);
    }

    public static <T> StateKey<T> of(String name, Class<T> type, String owner) {
        return new StateKey<>(name, type, owner);
    }

    public String name() { return name; }

    public Class<T> type() { return type; }

    public String owner() { return owner; }

    T cast(Object value) {
        return type.cast(value);
    }

    @Override
    public String toString() {
        return name + "<" + type.getSimpleName() + ">@" + owner;
    }
}
