package com.questrail.stego.image;

import com.questrail.stego.config.ColorChannel;

import java.util.Arrays;
import java.util.Objects;

/**
 * Dense in-memory {@link PixelBuffer} storing three bytes per pixel,
 * interleaved R, G, B in row-major order.
 */
public final class RgbPixelBuffer implements PixelBuffer
{
    private static final int CHANNELS = 3;

    private final int width;
    private final int height;
    private final byte[] samples;

    private RgbPixelBuffer(int width, int height, byte[] samples) {
        this.width = width;
        this.height = height;
        this.samples = samples;
    }

    /**
     * Creates an all-black buffer.
     */
    public static RgbPixelBuffer blank(int width, int height) {
        checkDimensions(width, height);
        return new RgbPixelBuffer(width, height, new byte[Math.multiplyExact(Math.multiplyExact(width, height), CHANNELS)]);
    }

    /**
     * Wraps a copy of interleaved RGB samples.
     *
     * @param samples {@code width * height * 3} bytes, R, G, B per pixel
     */
    public static RgbPixelBuffer fromSamples(int width, int height, byte[] samples) {
        checkDimensions(width, height);
        Objects.requireNonNull(samples, "samples");
        long expected = (long) width * height * CHANNELS;
        if (samples.length != expected) {
            throw new IllegalArgumentException(
                    "Expected " + expected + " RGB samples for " + width + "x" + height + " (was " + samples.length + ")");
        }
        return new RgbPixelBuffer(width, height, samples.clone());
    }

    /**
     * Copies any {@link PixelBuffer} into a dense buffer.
     */
    public static RgbPixelBuffer copyOf(PixelBuffer source) {
        Objects.requireNonNull(source, "source");
        if (source instanceof RgbPixelBuffer dense) {
            return dense.copy();
        }
        RgbPixelBuffer out = blank(source.width(), source.height());
        for (int y = 0; y < source.height(); y++) {
            for (int x = 0; x < source.width(); x++) {
                Rgb rgb = source.getRgb(x, y);
                int i = out.sampleIndex(x, y);
                out.samples[i] = (byte) rgb.red();
                out.samples[i + 1] = (byte) rgb.green();
                out.samples[i + 2] = (byte) rgb.blue();
            }
        }
        return out;
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public int getChannelByte(int x, int y, ColorChannel channel) {
        return samples[sampleIndex(x, y) + channel.index()] & 0xFF;
    }

    @Override
    public void setChannelByte(int x, int y, ColorChannel channel, int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("channel value must be in range 0–255 (was " + value + ")");
        }
        samples[sampleIndex(x, y) + channel.index()] = (byte) value;
    }

    @Override
    public Rgb getRgb(int x, int y) {
        int i = sampleIndex(x, y);
        return new Rgb(samples[i] & 0xFF, samples[i + 1] & 0xFF, samples[i + 2] & 0xFF);
    }

    /**
     * Overwrites all three channels at {@code (x, y)}.
     */
    public void setRgb(int x, int y, Rgb rgb) {
        Objects.requireNonNull(rgb, "rgb");
        int i = sampleIndex(x, y);
        samples[i] = (byte) rgb.red();
        samples[i + 1] = (byte) rgb.green();
        samples[i + 2] = (byte) rgb.blue();
    }

    @Override
    public RgbPixelBuffer copy() {
        return new RgbPixelBuffer(width, height, samples.clone());
    }

    /**
     * Returns a copy of the interleaved RGB samples.
     */
    public byte[] samples() {
        return samples.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RgbPixelBuffer that)) return false;
        return width == that.width && height == that.height && Arrays.equals(samples, that.samples);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(width, height) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "RgbPixelBuffer[" + width + "x" + height + "]";
    }

    private int sampleIndex(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException(
                    "Pixel (" + x + ", " + y + ") outside " + width + "x" + height + " buffer");
        }
        return (y * width + x) * CHANNELS;
    }

    private static void checkDimensions(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                    "Pixel buffer must contain at least one pixel (was " + width + "x" + height + ")");
        }
    }
}
