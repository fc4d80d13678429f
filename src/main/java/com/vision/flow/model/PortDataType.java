package com.vision.flow.model;

/**
 * Data-type tag carried by ports and port values.
 *
 * {@link #ANY} is a wildcard at edit time: it is compatible with every other
 * tag in both directions. All other tags are only compatible with themselves.
 * A value tagged ANY reaching a typed port is checked against its payload when
 * it is delivered, see {@link PortValue#as(PortDataType)}.
 */
public enum PortDataType {
    IMAGE,
    SCALAR,
    POINT_SET,
    TEXT,
    BOOLEAN,
    ANY;

    public boolean isCompatibleWith(PortDataType other) {
        return this == ANY || other == ANY || this == other;
    }
}
