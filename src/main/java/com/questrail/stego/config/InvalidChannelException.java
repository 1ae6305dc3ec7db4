package com.questrail.stego.config;

import com.questrail.stego.codec.StegoException;

/**
 * Indicates that a channel index does not name a component of the RGB
 * colour model.
 */
public final class InvalidChannelException extends StegoException
{
    private final int channelIndex;

    public InvalidChannelException(int channelIndex) {
        super("Channel index " + channelIndex + " is outside the RGB colour model (expected 0-2)");
        this.channelIndex = channelIndex;
    }

    public int channelIndex() {
        return channelIndex;
    }
}
