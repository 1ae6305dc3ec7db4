package com.questrail.stego.image;

/**
 * ImageCodec
 * -----------------------------------------------------------------------------
 * Boundary between image container bytes and decoded pixels.
 *
 * <p>Implementations perform container parsing and serialisation only. They
 * must not interpret or alter pixel values beyond what the container format
 * itself requires.</p>
 */
public interface ImageCodec
{
    /**
     * Decode container bytes (JPEG, PNG, BMP, ...) into RGB pixels.
     *
     * @throws InvalidImageException if the bytes are not a readable image
     */
    PixelBuffer load(byte[] imageBytes);

    /**
     * Serialise pixels into the given container format.
     *
     * @throws InvalidImageException if no writer is available or writing fails
     */
    byte[] save(PixelBuffer pixels, ImageFormat format);
}
