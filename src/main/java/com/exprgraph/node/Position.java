package com.exprgraph.node;

/**
 * Normalized layout position. Both coordinates lie in [0, 1].
 */
public record Position(double x, double y) {

    public static final Position CENTER = new Position(0.5, 0.5);

    public Position {
        if (!Double.isFinite(x) || !Double.isFinite(y))
            throw new IllegalArgumentException("Invalid position: (" + x + ", " + y + ")");
        if (x < 0 || x > 1 || y < 0 || y > 1)
            throw new IllegalArgumentException("Position out of range [0,1]: (" + x + ", " + y + ")");
    }

    /**
     * Builds a position, pulling each coordinate back into [0, 1]. Drag gestures
     * overshoot the canvas edge, so moves are clamped rather than rejected.
     */
    public static Position clamped(double x, double y) {
        if (!Double.isFinite(x) || !Double.isFinite(y))
            throw new IllegalArgumentException("Invalid position: (" + x + ", " + y + ")");
        return new Position(clamp(x), clamp(y));
    }

    private static double clamp(double v) {
        return v < 0 ? 0 : (v > 1 ? 1 : v);
    }
}
