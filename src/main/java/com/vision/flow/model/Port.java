package com.vision.flow.model;

import java.util.Objects;

/**
 * A named, typed slot on a node.
 *
 * The name doubles as the port id: it is unique within its node and
 * direction, and connections refer to ports by it. {@code required} only
 * matters for inputs. {@code defaultValue} may be null.
 */
public record Port(String name, PortDirection direction, PortDataType dataType, boolean required,
        PortValue defaultValue) {

    public Port {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(dataType, "dataType");
        if (name.isBlank())
            throw new IllegalArgumentException("Port name must not be blank");
        if (direction == PortDirection.OUTPUT && required)
            throw new IllegalArgumentException("Output port '" + name + "' cannot be required");
        if (defaultValue != null) {
            PortValue typed = defaultValue.as(dataType);
            if (typed == null)
                throw new IllegalArgumentException("Default " + defaultValue.type() + " does not fit port '" + name
                        + "' of type " + dataType);
            defaultValue = typed;
        }
    }

    public static Port input(String name, PortDataType type) {
        return new Port(name, PortDirection.INPUT, type, true, null);
    }

    public static Port optionalInput(String name, PortDataType type, PortValue defaultValue) {
        return new Port(name, PortDirection.INPUT, type, false, defaultValue);
    }

    public static Port output(String name, PortDataType type) {
        return new Port(name, PortDirection.OUTPUT, type, false, null);
    }

    public boolean isInput() {
        return direction == PortDirection.INPUT;
    }
}
