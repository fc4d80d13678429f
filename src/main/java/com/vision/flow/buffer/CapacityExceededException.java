package com.vision.flow.buffer;

import com.vision.flow.model.ShapeKey;

/**
 * A single buffer request is larger than the pool's whole budget.
 * Raised before any eviction, so the pool is untouched.
 */
public class CapacityExceededException extends RuntimeException {
    private final ShapeKey shape;
    private final long budgetBytes;

    public CapacityExceededException(ShapeKey shape, long budgetBytes) {
        super("Buffer " + shape + " needs " + shape.byteSize() + " bytes, pool budget is " + budgetBytes);
        this.shape = shape;
        this.budgetBytes = budgetBytes;
    }

    public ShapeKey shape() {
        return shape;
    }

    public long budgetBytes() {
        return budgetBytes;
    }
}
