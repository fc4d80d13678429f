package com.vision.flow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One operator instance in a flow.
 *
 * A node binds to an operator executor through its {@link #type()} tag and
 * declares its named input and output ports, its parameters and, optionally,
 * the working shape of the image buffers it renders into.
 *
 * Nodes are immutable once built, so a flow can be shared by concurrent runs
 * without synchronization. The only mutable field is {@link #lastExecution()},
 * an atomically replaced snapshot written by the scheduler after each
 * execution; the per-run status table stays the authoritative record.
 *
 * Identity is assigned at build time: either a caller-supplied id (for
 * re-imported flows) or a generated UUID.
 */
public final class Node {
    private final String id;
    private final String name;
    private final String type;
    private final Map<String, Port> inputs;
    private final Map<String, Port> outputs;
    private final Map<String, Parameter> parameters;
    private final boolean enabled;
    private final ShapeKey workingShape;

    private final AtomicReference<LastExecution> lastExecution = new AtomicReference<>(LastExecution.NEVER);

    private Node(Builder b) {
        this.id = b.id != null ? b.id : UUID.randomUUID().toString();
        this.name = b.name != null ? b.name : b.type;
        this.type = b.type;
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(b.inputs));
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(b.outputs));
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(b.parameters));
        this.enabled = b.enabled;
        this.workingShape = b.workingShape;
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    /** Starts a builder pre-filled with this node's definition, including its id. */
    public Builder toBuilder() {
        Builder b = new Builder(type).id(id).name(name).enabled(enabled).workingShape(workingShape);
        b.inputs.putAll(inputs);
        b.outputs.putAll(outputs);
        b.parameters.putAll(parameters);
        return b;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String type() {
        return type;
    }

    public Map<String, Port> inputs() {
        return inputs;
    }

    public Map<String, Port> outputs() {
        return outputs;
    }

    public Port input(String portName) {
        return inputs.get(portName);
    }

    public Port output(String portName) {
        return outputs.get(portName);
    }

    public Map<String, Parameter> parameters() {
        return parameters;
    }

    /**
     * Effective value of a parameter (override, else default).
     *
     * @return the value, or null if the node has no such parameter.
     */
    public PortValue parameter(String name) {
        Parameter p = parameters.get(name);
        return p == null ? null : p.effective();
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Shape of the pooled working buffers this node needs, or null if none. */
    public ShapeKey workingShape() {
        return workingShape;
    }

    public LastExecution lastExecution() {
        return lastExecution.get();
    }

    /** Written by the scheduler only. */
    public void recordExecution(LastExecution execution) {
        lastExecution.set(Objects.requireNonNull(execution));
    }

    @Override
    public String toString() {
        return name + "[" + type + "#" + id + "]";
    }

    /** Fluent builder; ports and parameters keep declaration order. */
    public static final class Builder {
        private final String type;
        private String id;
        private String name;
        private final Map<String, Port> inputs = new LinkedHashMap<>();
        private final Map<String, Port> outputs = new LinkedHashMap<>();
        private final Map<String, Parameter> parameters = new LinkedHashMap<>();
        private boolean enabled = true;
        private ShapeKey workingShape;

        private Builder(String type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        /** Uses a pre-existing id instead of generating one. */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder input(String portName, PortDataType type) {
            return port(Port.input(portName, type));
        }

        public Builder optionalInput(String portName, PortDataType type) {
            return port(Port.optionalInput(portName, type, null));
        }

        public Builder output(String portName, PortDataType type) {
            return port(Port.output(portName, type));
        }

        public Builder port(Port port) {
            Map<String, Port> target = port.isInput() ? inputs : outputs;
            if (target.containsKey(port.name()))
                throw new IllegalArgumentException("Duplicate " + port.direction() + " port: " + port.name());
            target.put(port.name(), port);
            return this;
        }

        public Builder parameter(String name, PortValue defaultValue) {
            parameters.put(name, Parameter.of(name, defaultValue));
            return this;
        }

        /** Overrides the value of a parameter declared earlier. */
        public Builder override(String name, PortValue value) {
            Parameter p = parameters.get(name);
            if (p == null)
                throw new IllegalArgumentException("Unknown parameter: " + name);
            parameters.put(name, p.withValue(value));
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder workingShape(ShapeKey shape) {
            this.workingShape = shape;
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }
}
