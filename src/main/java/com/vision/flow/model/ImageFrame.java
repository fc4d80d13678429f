package com.vision.flow.model;

import java.util.Arrays;

/**
 * Heap-side image payload passed between operators.
 *
 * Pixel data is owned by the frame. Operators that render into a pooled
 * working buffer copy the result into a new frame before returning it, since
 * the working buffer goes back to the pool when the node finishes.
 */
public final class ImageFrame {
    private final int width;
    private final int height;
    private final int channels;
    private final byte[] data;

    public ImageFrame(int width, int height, int channels, byte[] data) {
        if (width <= 0 || height <= 0 || channels <= 0)
            throw new IllegalArgumentException("Invalid image dimensions " + width + "x" + height + "x" + channels);
        if (data.length != width * height * channels)
            throw new IllegalArgumentException("Pixel data length " + data.length + " does not match "
                    + width + "x" + height + "x" + channels);
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = data;
    }

    /** Creates a zero-filled frame. */
    public static ImageFrame blank(int width, int height, int channels) {
        return new ImageFrame(width, height, channels, new byte[width * height * channels]);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int channels() {
        return channels;
    }

    public byte[] data() {
        return data;
    }

    public ShapeKey shape() {
        return ShapeKey.of8Bit(width, height, channels);
    }

    public ImageFrame copy() {
        return new ImageFrame(width, height, channels, Arrays.copyOf(data, data.length));
    }

    @Override
    public String toString() {
        return "ImageFrame[" + width + "x" + height + "x" + channels + "]";
    }
}
