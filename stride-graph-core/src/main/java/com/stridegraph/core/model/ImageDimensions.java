package com.stridegraph.core.model;

/**
 * Pixel dimensions of the analyzed diagram image.
 *
 * @param width image width in pixels
 * @param height image height in pixels
 */
public record ImageDimensions(
    double width,
    double height
) {
    /**
     * Compact constructor with validation.
     */
    public ImageDimensions {
        if (!(width > 0.0) || !(height > 0.0) || Double.isInfinite(width) || Double.isInfinite(height)) {
            throw new IllegalArgumentException(
                "Image dimensions must be positive and finite, got " + width + "x" + height);
        }
    }

    /**
     * Dimensions for detections whose boxes are already in unit space.
     *
     * @return 1x1 dimensions
     */
    public static ImageDimensions normalized() {
        return new ImageDimensions(1.0, 1.0);
    }
}
