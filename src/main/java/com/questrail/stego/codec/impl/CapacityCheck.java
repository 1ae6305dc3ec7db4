package com.questrail.stego.codec.impl;

import com.questrail.stego.codec.CapacityExceededException;
import com.questrail.stego.config.StegoConfig;

/**
 * CapacityCheck
 * -----------------------------------------------------------------------------
 * Up-front comparison of the visits a payload needs with the visits the
 * {@link TraversalCursor} will actually produce.
 *
 * <p>Both sides are counted exactly as the cursor and the embedder consume
 * them, so a payload that passes this check never exhausts the cursor.</p>
 */
public final class CapacityCheck
{
    private CapacityCheck() {}

    /**
     * Visits needed to embed {@code payloadByteCount} bytes.
     *
     * <p>Each byte is sliced on its own into {@code ceil(8 / bitsPerPixel)}
     * chunks, so this equals {@code ceil(payloadByteCount * 8 / bitsPerPixel)}
     * whenever {@code bitsPerPixel} divides 8.</p>
     */
    public static long requiredPixelVisits(long payloadByteCount, int bitsPerPixel)
    {
        if (payloadByteCount < 0) {
            throw new IllegalArgumentException("payloadByteCount must be non-negative");
        }
        if (bitsPerPixel < StegoConfig.MIN_BITS_PER_PIXEL || bitsPerPixel > StegoConfig.MAX_BITS_PER_PIXEL) {
            throw new IllegalArgumentException("bitsPerPixel must be in range 1–8 (was " + bitsPerPixel + ")");
        }
        final long visitsPerByte = (Byte.SIZE + bitsPerPixel - 1) / bitsPerPixel;
        return payloadByteCount * visitsPerByte;
    }

    /**
     * Visits the traversal can produce for an image of the given size:
     * one pass without spread, the full pixel count with spread.
     */
    public static long availableVisits(StegoConfig config, int width, int height)
    {
        return TraversalCursor.over(config, width, height).maxVisits();
    }

    /**
     * Whole payload bytes that fit under {@code config}.
     */
    public static long capacityBytes(StegoConfig config, int width, int height)
    {
        return availableVisits(config, width, height) / config.visitsPerByte();
    }

    /**
     * @throws CapacityExceededException if {@code payloadByteCount} bytes do not fit
     */
    static void ensureCapacity(long payloadByteCount, StegoConfig config, int width, int height)
    {
        final long required = requiredPixelVisits(payloadByteCount, config.bitsPerPixel());
        final long available = availableVisits(config, width, height);
        if (required > available) {
            throw new CapacityExceededException(required, available, config.spread());
        }
    }
}
