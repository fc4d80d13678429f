package com.vision.flow.buffer;

import com.vision.flow.model.ShapeKey;

/** No room for a buffer within the budget before the wait ended (timeout, cancellation or shutdown). */
public class PoolExhaustedException extends RuntimeException {
    private final ShapeKey shape;

    public PoolExhaustedException(ShapeKey shape, String message) {
        super("Pool exhausted for " + shape + ": " + message);
        this.shape = shape;
    }

    public ShapeKey shape() {
        return shape;
    }
}
