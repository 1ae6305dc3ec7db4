package com.questrail.stego.image;

import com.questrail.stego.config.ColorChannel;

/**
 * PixelBuffer
 * -----------------------------------------------------------------------------
 * Decoded RGB raster addressed by {@code (x, y)}, with {@code (0, 0)} at the
 * top-left corner. Row-major index {@code i} maps to
 * {@code (i % width, i / width)}.
 *
 * <p>Implementations are not required to be thread-safe.</p>
 */
public interface PixelBuffer
{
    int width();

    int height();

    default long pixelCount() {
        return (long) width() * height();
    }

    /**
     * @return the channel value at {@code (x, y)} as an unsigned byte (0–255)
     */
    int getChannelByte(int x, int y, ColorChannel channel);

    /**
     * Replaces one channel of the pixel at {@code (x, y)}; the other two
     * channels are left untouched.
     *
     * @param value new channel value, 0–255
     */
    void setChannelByte(int x, int y, ColorChannel channel, int value);

    Rgb getRgb(int x, int y);

    /**
     * Returns an independent deep copy of this buffer.
     */
    PixelBuffer copy();
}
