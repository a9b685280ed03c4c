package com.stridegraph.core.model;

/**
 * Axis-aligned rectangle locating a component in image space.
 *
 * <p>{@code x} and {@code y} are the top-left corner. Inside a {@link DetectedComponent} all
 * values are normalized to the unit square; raw detections may carry pixel values.
 *
 * @param x left edge
 * @param y top edge
 * @param width box width
 * @param height box height
 */
public record BoundingBox(
    double x,
    double y,
    double width,
    double height
) {

    /**
     * Returns the horizontal center.
     *
     * @return center x
     */
    public double centerX() {
        return x + width / 2.0;
    }

    /**
     * Returns the vertical center.
     *
     * @return center y
     */
    public double centerY() {
        return y + height / 2.0;
    }

    /**
     * Returns the box area.
     *
     * @return width times height
     */
    public double area() {
        return width * height;
    }

    /**
     * Returns true when every coordinate is a finite number.
     *
     * @return true if no coordinate is NaN or infinite
     */
    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y)
            && Double.isFinite(width) && Double.isFinite(height);
    }

    /**
     * Scales this box by the given factors.
     *
     * @param scaleX horizontal factor
     * @param scaleY vertical factor
     * @return scaled box
     */
    public BoundingBox scale(double scaleX, double scaleY) {
        return new BoundingBox(x * scaleX, y * scaleY, width * scaleX, height * scaleY);
    }

    /**
     * Computes the Intersection-over-Union with another box.
     *
     * @param other the other box
     * @return IoU in [0,1], or 0 when the union is empty
     */
    public double intersectionOverUnion(BoundingBox other) {
        double left = Math.max(x, other.x);
        double top = Math.max(y, other.y);
        double right = Math.min(x + width, other.x + other.width);
        double bottom = Math.min(y + height, other.y + other.height);

        double intersection = Math.max(0.0, right - left) * Math.max(0.0, bottom - top);
        double union = area() + other.area() - intersection;
        if (union <= 0.0) {
            return 0.0;
        }
        return intersection / union;
    }

    /**
     * Euclidean distance between this box's center and another's.
     *
     * @param other the other box
     * @return center distance
     */
    public double centerDistance(BoundingBox other) {
        return Math.hypot(centerX() - other.centerX(), centerY() - other.centerY());
    }
}
