package com.vision.flow.model;

import java.util.Objects;

/**
 * A node parameter: a default plus an optional user override.
 * Both values carry their type tag, so an override of a different type is
 * rejected at construction.
 */
public record Parameter(String name, PortValue defaultValue, PortValue value) {

    public Parameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(defaultValue, "defaultValue");
        if (value != null && value.type() != defaultValue.type())
            throw new IllegalArgumentException("Parameter '" + name + "' is " + defaultValue.type()
                    + " but override is " + value.type());
    }

    public static Parameter of(String name, PortValue defaultValue) {
        return new Parameter(name, defaultValue, null);
    }

    public Parameter withValue(PortValue override) {
        return new Parameter(name, defaultValue, override);
    }

    /** The override if set, otherwise the default. */
    public PortValue effective() {
        return value != null ? value : defaultValue;
    }
}
