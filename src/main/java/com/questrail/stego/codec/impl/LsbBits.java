package com.questrail.stego.codec.impl;

/**
 * LsbBits
 * -----------------------------------------------------------------------------
 * Bit helpers for unsigned byte values held in an {@code int} (0–255).
 *
 * <p>Bit 0 is the least significant bit. A "bit sequence" of length
 * {@code n} is returned packed into the low {@code n} bits of an {@code int},
 * so bit {@code i} of the sequence is {@code (bits >> i) & 1}.</p>
 *
 * <p>Callers guarantee {@code count} in 1–8 and {@code bitOffset + count <= 8}.</p>
 */
final class LsbBits
{
    private LsbBits() {}

    /**
     * Returns the {@code count} low-order bits of {@code value}.
     */
    static int getBits(int value, int count)
    {
        return getBits(value, 0, count);
    }

    /**
     * Returns bits {@code [bitOffset, bitOffset + count)} of {@code value},
     * shifted down so that bit {@code bitOffset} becomes bit 0.
     */
    static int getBits(int value, int bitOffset, int count)
    {
        return (value >>> bitOffset) & mask(count);
    }

    /**
     * Returns {@code value} with bits {@code [bitOffset, bitOffset + count)}
     * replaced by the low {@code count} bits of {@code sourceBits}. All other
     * bits of {@code value} are preserved.
     */
    static int setBits(int value, int bitOffset, int count, int sourceBits)
    {
        final int window = mask(count) << bitOffset;
        return ((value & ~window) | ((sourceBits << bitOffset) & window)) & 0xFF;
    }

    private static int mask(int count)
    {
        return (1 << count) - 1;
    }
}
