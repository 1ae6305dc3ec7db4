package com.questrail.stego.config;

/**
 * ColorChannel
 * -----------------------------------------------------------------------------
 * One colour component of an RGB pixel. Exactly one channel carries payload
 * bits per encode/decode call.
 *
 * <p>The numeric {@link #index()} is the component position inside a packed
 * 3-channel pixel (R=0, G=1, B=2).</p>
 */
public enum ColorChannel
{
    RED(0),
    GREEN(1),
    BLUE(2);

    private final int index;

    ColorChannel(int index) {
        this.index = index;
    }

    public int index() {
        return index;
    }

    /**
     * Resolves a channel supplied as raw data.
     *
     * @param index component position (0, 1 or 2)
     * @return the matching channel
     * @throws InvalidChannelException if {@code index} is not an RGB component
     */
    public static ColorChannel fromIndex(int index) {
        for (ColorChannel channel : values()) {
            if (channel.index == index) {
                return channel;
            }
        }
        throw new InvalidChannelException(index);
    }
}
