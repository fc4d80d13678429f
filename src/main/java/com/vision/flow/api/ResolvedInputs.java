package com.vision.flow.api;

import com.vision.flow.buffer.PooledBuffer;
import com.vision.flow.model.PortValue;

import java.util.Map;
import java.util.Set;

/**
 * Inputs handed to one operator execution: the resolved value of every input
 * port that has one, plus the pooled working buffers checked out for the call.
 *
 * Working buffers belong to the scheduler and are released as soon as
 * {@code execute} returns. Executors must not keep them, or any input, after
 * the call.
 */
public final class ResolvedInputs {
    private final Map<String, PortValue> values;
    private final Map<String, PooledBuffer> workingBuffers;

    public ResolvedInputs(Map<String, PortValue> values, Map<String, PooledBuffer> workingBuffers) {
        this.values = Map.copyOf(values);
        this.workingBuffers = Map.copyOf(workingBuffers);
    }

    public static ResolvedInputs of(Map<String, PortValue> values) {
        return new ResolvedInputs(values, Map.of());
    }

    public boolean has(String port) {
        return values.containsKey(port);
    }

    /** @return the value, or null if the port is unresolved (optional input). */
    public PortValue get(String port) {
        return values.get(port);
    }

    public PortValue require(String port) {
        PortValue v = values.get(port);
        if (v == null)
            throw new IllegalArgumentException("Input '" + port + "' is not resolved");
        return v;
    }

    public Set<String> ports() {
        return values.keySet();
    }

    public Map<String, PortValue> values() {
        return values;
    }

    /** Working buffer for an Image-typed output port, or null. */
    public PooledBuffer workingBuffer(String outputPort) {
        return workingBuffers.get(outputPort);
    }

    public Map<String, PooledBuffer> workingBuffers() {
        return workingBuffers;
    }

    @Override
    public String toString() {
        return "ResolvedInputs" + values.keySet();
    }
}
