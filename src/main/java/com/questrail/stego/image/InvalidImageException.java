package com.questrail.stego.image;

import com.questrail.stego.codec.StegoException;

/**
 * Indicates that image container bytes could not be turned into a
 * {@link PixelBuffer}, or a buffer could not be written back out.
 *
 * <p>All codec-level failures collapse into this single type; the cause, when
 * present, carries the underlying codec or I/O error.</p>
 */
public final class InvalidImageException extends StegoException
{
    public InvalidImageException(String message) {
        super(message);
    }

    public InvalidImageException(String message, Throwable cause) {
        super(message, cause);
    }
}
