package com.vision.flow.model;

/**
 * Shape/type key of an image buffer: width x height x channels, with a fixed
 * number of bytes per channel element.
 *
 * Two buffers with equal keys are interchangeable, which is what makes them
 * poolable.
 */
public record ShapeKey(int width, int height, int channels, int bytesPerElement) {

    public ShapeKey {
        if (width <= 0 || height <= 0 || channels <= 0 || bytesPerElement <= 0)
            throw new IllegalArgumentException("Shape dimensions must be positive: "
                    + width + "x" + height + "x" + channels + "@" + bytesPerElement);
    }

    /** 8-bit image with the given channel count. */
    public static ShapeKey of8Bit(int width, int height, int channels) {
        return new ShapeKey(width, height, channels, 1);
    }

    /** Total footprint of one buffer of this shape, in bytes. */
    public long byteSize() {
        return (long) width * height * channels * bytesPerElement;
    }

    @Override
    public String toString() {
        return width + "x" + height + "x" + channels + "@" + bytesPerElement + "B";
    }
}
