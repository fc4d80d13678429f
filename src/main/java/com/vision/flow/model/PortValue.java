package com.vision.flow.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A typed value flowing through a port or stored as a node parameter.
 *
 * This is a closed tagged variant: the only way to build one is through the
 * static factories below, one per {@link PortDataType}, so the payload class
 * always matches the tag. Typed accessors fail fast with
 * {@link IllegalStateException} when read under the wrong tag.
 *
 * Payload classes per tag:
 * - IMAGE: {@link ImageFrame}
 * - SCALAR: {@link Double}
 * - POINT_SET: unmodifiable {@code List<Point>}
 * - TEXT: {@link String}
 * - BOOLEAN: {@link Boolean}
 * - ANY: any non-null object
 */
public final class PortValue {
    private final PortDataType type;
    private final Object payload;
    // Same list as payload, kept typed for POINT_SET
    private final List<Point> points;

    private PortValue(PortDataType type, Object payload) {
        this.type = type;
        this.payload = Objects.requireNonNull(payload, "payload");
        this.points = null;
    }

    private PortValue(List<Point> points) {
        this.type = PortDataType.POINT_SET;
        this.points = List.copyOf(points);
        this.payload = this.points;
    }

    public static PortValue image(ImageFrame frame) {
        return new PortValue(PortDataType.IMAGE, frame);
    }

    public static PortValue scalar(double value) {
        return new PortValue(PortDataType.SCALAR, value);
    }

    public static PortValue points(List<Point> points) {
        return new PortValue(points);
    }

    public static PortValue text(String text) {
        return new PortValue(PortDataType.TEXT, text);
    }

    public static PortValue bool(boolean value) {
        return new PortValue(PortDataType.BOOLEAN, value);
    }

    /** Opaque value for ANY-typed ports (e.g. device handles, result records). */
    public static PortValue any(Object value) {
        return new PortValue(PortDataType.ANY, value);
    }

    public PortDataType type() {
        return type;
    }

    /** Raw payload, for ANY-typed consumers. */
    public Object payload() {
        return payload;
    }

    public ImageFrame asImage() {
        return (ImageFrame) expect(PortDataType.IMAGE);
    }

    public double asScalar() {
        return (Double) expect(PortDataType.SCALAR);
    }

    public List<Point> asPoints() {
        expect(PortDataType.POINT_SET);
        return points;
    }

    public String asText() {
        return (String) expect(PortDataType.TEXT);
    }

    public boolean asBoolean() {
        return (Boolean) expect(PortDataType.BOOLEAN);
    }

    /** True if this value may be delivered to a port declared with {@code portType}. */
    public boolean fits(PortDataType portType) {
        return as(portType) != null;
    }

    /**
     * This value as seen by a port declared with {@code portType}.
     *
     * An ANY port takes every value as is, and a matching tag is returned
     * unchanged. A value tagged ANY is retagged when its payload is the
     * payload class of {@code portType} (any {@link Number} for SCALAR).
     *
     * @return the value to deliver, or null if the port could not read it
     */
    public PortValue as(PortDataType portType) {
        if (portType == PortDataType.ANY || portType == type)
            return this;
        if (type != PortDataType.ANY)
            return null;
        switch (portType) {
            case IMAGE:
                return payload instanceof ImageFrame frame ? image(frame) : null;
            case SCALAR:
                return payload instanceof Number number ? scalar(number.doubleValue()) : null;
            case POINT_SET:
                return pointsOf(payload);
            case TEXT:
                return payload instanceof String text ? text(text) : null;
            case BOOLEAN:
                return payload instanceof Boolean flag ? bool(flag) : null;
            default:
                return null;
        }
    }

    private static PortValue pointsOf(Object payload) {
        if (!(payload instanceof List<?> list))
            return null;
        List<Point> points = new ArrayList<>(list.size());
        for (Object o : list) {
            if (!(o instanceof Point p))
                return null;
            points.add(p);
        }
        return points(points);
    }

    private Object expect(PortDataType expected) {
        if (type != expected)
            throw new IllegalStateException("Value is " + type + ", not " + expected);
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PortValue other))
            return false;
        return type == other.type && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + payload.hashCode();
    }

    @Override
    public String toString() {
        return type + "(" + payload + ")";
    }
}
