package github.sarthakdev143.timeline_compiler.model;

/**
 * Normalized placement of a track on the canvas. {@code x} and {@code y} are in [-1, 1] with 0 centered,
 * {@code scale} is a factor and {@code rotation} is clockwise degrees.
 */
public record Transform(double x, double y, double scale, double rotation) {

    public static final Transform IDENTITY = new Transform(0.0, 0.0, 1.0, 0.0);

    private static final double EPSILON = 1e-9;

    public boolean hasPosition() {
        return Math.abs(x) > EPSILON || Math.abs(y) > EPSILON;
    }

    public boolean hasScale() {
        return Math.abs(scale - 1.0) > EPSILON;
    }

    public boolean hasRotation() {
        return Math.abs(rotation) > EPSILON;
    }

    /**
     * Position or scale differs from the identity. Rotation alone does not count.
     */
    public boolean isNonZero() {
        return hasPosition() || hasScale();
    }
}
