package com.vision.flow.operator;

import com.vision.flow.api.OperatorExecutor;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.log4j.Log4j2;

/**
 * Maps node type tags to the {@link OperatorExecutor} that runs them.
 * Safe to register into while runs are in flight.
 */
@Log4j2
public final class OperatorRegistry {
    private final ConcurrentHashMap<String, OperatorExecutor> executors = new ConcurrentHashMap<>();

    public static OperatorRegistry of(OperatorExecutor... executors) {
        OperatorRegistry registry = new OperatorRegistry();
        for (OperatorExecutor e : executors)
            registry.register(e);
        return registry;
    }

    /** @throws IllegalArgumentException if the type is already registered */
    public OperatorRegistry register(OperatorExecutor executor) {
        Objects.requireNonNull(executor, "executor");
        String type = Objects.requireNonNull(executor.operatorType(), "operatorType");
        OperatorExecutor previous = executors.putIfAbsent(type, executor);
        if (previous != null)
            throw new IllegalArgumentException("Operator type already registered: " + type);
        log.debug("Registered operator {} -> {}", type, executor.getClass().getSimpleName());
        return this;
    }

    /** @return the executor, or null if none is registered for the type */
    public OperatorExecutor find(String type) {
        return executors.get(type);
    }

    public boolean contains(String type) {
        return executors.containsKey(type);
    }

    public Set<String> types() {
        return new TreeSet<>(executors.keySet());
    }
}
