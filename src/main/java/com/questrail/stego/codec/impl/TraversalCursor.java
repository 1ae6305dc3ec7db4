package com.questrail.stego.codec.impl;

import com.questrail.stego.config.StegoConfig;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * TraversalCursor
 * -----------------------------------------------------------------------------
 * Deterministic pixel visitation order for one encode or decode call.
 *
 * <h2>Order</h2>
 * <ol>
 *   <li>The first visit is at row-major index
 *       {@code startPosition.baseOffset(width, height) + pixelOffset}.</li>
 *   <li>Each following visit advances by {@code pixelStride}.</li>
 *   <li>The pass ends when the index reaches the pixel count.</li>
 *   <li>With {@code spread}, traversal wraps to index 0 (the starting skip
 *       is not re-applied) and keeps the same stride. Each wrapped pass walks
 *       one residue class modulo {@code pixelStride}, in order 0, 1, 2, ...,
 *       and the class of the first pass stops short of the starting index.
 *       Every pixel is therefore visited exactly once and the total number of
 *       visits equals the pixel count.</li>
 *   <li>Without {@code spread}, the cursor is exhausted after the first pass.</li>
 * </ol>
 *
 * <p>A cursor is lazy, single-threaded and owned by exactly one call.
 * {@link #reset()} rewinds it to the first visit.</p>
 */
final class TraversalCursor
{
    /**
     * A visited pixel: its coordinates, its row-major index, and the
     * zero-based pass that produced it.
     */
    record PixelAddress(int x, int y, long index, int pass) {}

    private final int width;
    private final long pixelCount;
    private final long start;
    private final int stride;
    private final boolean spread;
    private final long maxVisits;

    private long nextIndex;
    /* exclusive upper bound of the current pass */
    private long limit;
    /* residue walked by the current wrapped pass, -1 during the first pass */
    private long residue;
    private long visited;
    private int pass;

    private TraversalCursor(int width, int height, long start, int stride, boolean spread)
    {
        this.width = width;
        this.pixelCount = (long) width * height;
        this.start = start;
        this.stride = stride;
        this.spread = spread;
        this.maxVisits = spread ? pixelCount : singlePassVisits(pixelCount, start, stride);
        reset();
    }

    /**
     * Creates a cursor for an image of {@code width x height} pixels.
     */
    static TraversalCursor over(StegoConfig config, int width, int height)
    {
        Objects.requireNonNull(config, "config");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                    "Traversal requires at least one pixel (was " + width + "x" + height + ")");
        }
        return new TraversalCursor(width, height, startIndex(config, width, height),
                config.pixelStride(), config.spread());
    }

    /**
     * Row-major index of the first visit, before any wrap.
     */
    static long startIndex(StegoConfig config, int width, int height)
    {
        return config.startPosition().baseOffset(width, height) + config.pixelOffset();
    }

    /**
     * Visits produced by one pass from the configured start, ignoring spread.
     */
    static long singlePassVisits(StegoConfig config, int width, int height)
    {
        return singlePassVisits((long) width * height, startIndex(config, width, height), config.pixelStride());
    }

    private static long singlePassVisits(long pixelCount, long start, int stride)
    {
        if (start >= pixelCount) {
            return 0;
        }
        return (pixelCount - start + stride - 1) / stride;
    }

    /**
     * Upper bound on visits this cursor will produce.
     */
    long maxVisits()
    {
        return maxVisits;
    }

    long visited()
    {
        return visited;
    }

    boolean hasNext()
    {
        return visited < maxVisits;
    }

    PixelAddress next()
    {
        if (!hasNext()) {
            throw new NoSuchElementException("Traversal exhausted after " + visited + " visits");
        }
        if (nextIndex >= limit) {
            wrap();
        }

        final long index = nextIndex;
        nextIndex += stride;
        visited++;

        return new PixelAddress((int) (index % width), (int) (index / width), index, pass);
    }

    /**
     * Zero-based pass of the most recent visit.
     */
    int pass()
    {
        return pass;
    }

    void reset()
    {
        nextIndex = start;
        limit = pixelCount;
        residue = -1;
        visited = 0;
        pass = 0;
    }

    /**
     * Moves to the next residue class that still holds unvisited pixels.
     */
    private void wrap()
    {
        do {
            residue++;
            if (residue >= stride) {
                throw new IllegalStateException("Traversal wrapped past stride " + stride);
            }
            limit = residueLimit(residue);
        } while (residue >= limit);

        nextIndex = residue;
        pass++;
    }

    private long residueLimit(long r)
    {
        // the first pass already covered this class from start onwards
        if (start < pixelCount && r == start % stride) {
            return start;
        }
        return pixelCount;
    }
}
