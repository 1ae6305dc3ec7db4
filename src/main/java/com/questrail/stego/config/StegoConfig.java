package com.questrail.stego.config;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable embedding/extraction configuration shared by both engines.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>bitsPerPixel</b>: low-order bits of the channel byte carrying
 *       payload per visited pixel (1–8, default 1).</li>
 *   <li><b>channel</b>: colour component written/read (default BLUE).</li>
 *   <li><b>pixelOffset</b>: extra row-major pixels skipped before the first
 *       visit (default 0).</li>
 *   <li><b>pixelStride</b>: distance between visited pixels; values below 1
 *       are clamped to 1 (default 1).</li>
 *   <li><b>startPosition</b>: coarse start hint, see {@link StartPosition}
 *       (default TOP_LEFT).</li>
 *   <li><b>spread</b>: allow traversal to wrap past one pass (default false).</li>
 *   <li><b>marker</b>: decode-time terminator; empty disables marker
 *       detection. Ignored by the embedder.</li>
 * </ul>
 */
public record StegoConfig(
        int bitsPerPixel,
        ColorChannel channel,
        int pixelOffset,
        int pixelStride,
        StartPosition startPosition,
        boolean spread,
        byte[] marker
) {
    public static final int MIN_BITS_PER_PIXEL = 1;
    public static final int MAX_BITS_PER_PIXEL = 8;

    public StegoConfig {
        if (bitsPerPixel < MIN_BITS_PER_PIXEL || bitsPerPixel > MAX_BITS_PER_PIXEL) {
            throw new IllegalArgumentException(
                    "bitsPerPixel must be in range " + MIN_BITS_PER_PIXEL + "–" + MAX_BITS_PER_PIXEL
                            + " (was " + bitsPerPixel + ")");
        }
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(startPosition, "startPosition");
        if (pixelOffset < 0) {
            throw new IllegalArgumentException("pixelOffset must be non-negative (was " + pixelOffset + ")");
        }
        pixelStride = Math.max(1, pixelStride);
        marker = marker == null ? new byte[0] : marker.clone();
    }

    public static StegoConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy of the configured marker; empty when none is set.
     */
    @Override
    public byte[] marker() {
        return marker.clone();
    }

    public boolean hasMarker() {
        return marker.length > 0;
    }

    /**
     * Number of pixel visits needed to carry one payload byte.
     */
    public int visitsPerByte() {
        return (Byte.SIZE + bitsPerPixel - 1) / bitsPerPixel;
    }

    public Builder toBuilder() {
        return new Builder()
                .withBitsPerPixel(bitsPerPixel)
                .withChannel(channel)
                .withPixelOffset(pixelOffset)
                .withPixelStride(pixelStride)
                .withStartPosition(startPosition)
                .withSpread(spread)
                .withMarker(marker);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StegoConfig that)) return false;
        return bitsPerPixel == that.bitsPerPixel
                && pixelOffset == that.pixelOffset
                && pixelStride == that.pixelStride
                && spread == that.spread
                && channel == that.channel
                && startPosition.equals(that.startPosition)
                && Arrays.equals(marker, that.marker);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(bitsPerPixel, channel, pixelOffset, pixelStride, startPosition, spread);
        return 31 * result + Arrays.hashCode(marker);
    }

    @Override
    public String toString() {
        return "StegoConfig[bitsPerPixel=" + bitsPerPixel
                + ", channel=" + channel
                + ", pixelOffset=" + pixelOffset
                + ", pixelStride=" + pixelStride
                + ", startPosition=" + startPosition
                + ", spread=" + spread
                + ", markerLength=" + marker.length + "]";
    }

    public static final class Builder {
        private int bitsPerPixel = 1;
        private ColorChannel channel = ColorChannel.BLUE;
        private int pixelOffset = 0;
        private int pixelStride = 1;
        private StartPosition startPosition = StartPosition.Anchor.TOP_LEFT;
        private boolean spread = false;
        private byte[] marker = new byte[0];

        public Builder withBitsPerPixel(int bitsPerPixel) {
            this.bitsPerPixel = bitsPerPixel;
            return this;
        }

        public Builder withChannel(ColorChannel channel) {
            this.channel = channel;
            return this;
        }

        /**
         * Sets the channel from a raw component index.
         *
         * @throws InvalidChannelException if {@code index} is not 0, 1 or 2
         */
        public Builder withChannelIndex(int index) {
            this.channel = ColorChannel.fromIndex(index);
            return this;
        }

        public Builder withPixelOffset(int pixelOffset) {
            this.pixelOffset = pixelOffset;
            return this;
        }

        public Builder withPixelStride(int pixelStride) {
            this.pixelStride = pixelStride;
            return this;
        }

        public Builder withStartPosition(StartPosition startPosition) {
            this.startPosition = startPosition;
            return this;
        }

        public Builder withSpread(boolean spread) {
            this.spread = spread;
            return this;
        }

        public Builder withMarker(byte[] marker) {
            this.marker = marker;
            return this;
        }

        public StegoConfig build() {
            return new StegoConfig(bitsPerPixel, channel, pixelOffset, pixelStride, startPosition, spread, marker);
        }
    }
}
