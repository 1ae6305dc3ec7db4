package com.questrail.stego.codec;

import com.questrail.stego.config.StegoConfig;
import com.questrail.stego.image.PixelBuffer;
import com.questrail.stego.model.EncodedResult;

/**
 * PayloadEmbedder
 * -----------------------------------------------------------------------------
 * Writes payload bits into the low-order bits of one colour channel.
 *
 * <p>The embedder is responsible only for:</p>
 * <ul>
 *   <li>Checking capacity before any pixel is touched</li>
 *   <li>Slicing payload bytes into per-pixel chunks, LSB first</li>
 *   <li>Writing each chunk into the next pixel the traversal yields</li>
 *   <li>Recording every change, grouped per source byte</li>
 * </ul>
 *
 * <p>The embedder is <strong>not</strong> responsible for parsing or
 * producing image containers. It never mutates the buffer it is given.</p>
 */
public interface PayloadEmbedder
{
    /**
     * Embed {@code payload} into a private copy of {@code source}.
     *
     * @param payload bytes to embed, in order
     * @param config  traversal and bit-width configuration; the marker is ignored
     * @param source  pixel buffer to embed into; left untouched
     * @return the altered copy, the original and the per-byte change log
     * @throws CapacityExceededException if the payload does not fit
     */
    EncodedResult encode(byte[] payload, StegoConfig config, PixelBuffer source);
}
