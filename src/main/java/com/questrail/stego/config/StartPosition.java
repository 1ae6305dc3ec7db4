package com.questrail.stego.config;

/**
 * StartPosition
 * -----------------------------------------------------------------------------
 * Coarse hint for where traversal begins.
 *
 * <p>A start position is <strong>not</strong> a pixel coordinate. It resolves
 * to a number of pixels that is added to the configured pixel offset before
 * the first visit:</p>
 *
 * <pre>
 *   TOP_LEFT     → 0
 *   TOP_RIGHT    → width
 *   BOTTOM_LEFT  → height
 *   BOTTOM_RIGHT → width + height
 *   CENTER       → (width + height) / 2
 *   At(x, y)     → x * y
 * </pre>
 */
public sealed interface StartPosition
        permits StartPosition.Anchor, StartPosition.At
{
    /**
     * Number of row-major pixels to skip for an image of the given size.
     */
    long baseOffset(int width, int height);

    static StartPosition at(int x, int y) {
        return new At(x, y);
    }

    /**
     * Named anchor positions.
     */
    enum Anchor implements StartPosition
    {
        TOP_LEFT,
        TOP_RIGHT,
        BOTTOM_LEFT,
        BOTTOM_RIGHT,
        CENTER;

        @Override
        public long baseOffset(int width, int height) {
            return switch (this) {
                case TOP_LEFT -> 0L;
                case TOP_RIGHT -> width;
                case BOTTOM_LEFT -> height;
                case BOTTOM_RIGHT -> (long) width + height;
                case CENTER -> ((long) width + height) / 2;
            };
        }
    }

    /**
     * Explicit position; contributes {@code x * y} pixels of skip.
     */
    record At(int x, int y) implements StartPosition
    {
        public At {
            if (x < 0 || y < 0) {
                throw new IllegalArgumentException(
                        "start position coordinates must be non-negative (was " + x + ", " + y + ")");
            }
        }

        @Override
        public long baseOffset(int width, int height) {
            return (long) x * y;
        }
    }
}
