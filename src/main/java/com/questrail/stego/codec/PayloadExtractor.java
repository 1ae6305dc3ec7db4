package com.questrail.stego.codec;

import com.questrail.stego.config.StegoConfig;
import com.questrail.stego.image.PixelBuffer;
import com.questrail.stego.model.DecodedResult;

/**
 * PayloadExtractor
 * -----------------------------------------------------------------------------
 * Reassembles payload bytes from the low-order bits of one colour channel.
 *
 * <p>Running out of pixels is a normal termination, not a failure. When the
 * configuration carries a marker, extraction stops on the pixel that
 * completes the first exact occurrence of that marker.</p>
 */
public interface PayloadExtractor
{
    /**
     * Extract bytes from {@code source} following the traversal of {@code config}.
     *
     * @return every byte completed before termination, marker bytes included
     */
    DecodedResult decode(StegoConfig config, PixelBuffer source);
}
