package com.vision.flow.model;

/** Direction of a {@link Port} relative to its owning node. */
public enum PortDirection {
    INPUT,
    OUTPUT
}
