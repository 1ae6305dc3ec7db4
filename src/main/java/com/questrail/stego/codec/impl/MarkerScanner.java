package com.questrail.stego.codec.impl;

import java.util.Objects;

/**
 * MarkerScanner
 * -----------------------------------------------------------------------------
 * Sliding window over the most recent {@code marker.length} completed bytes.
 *
 * <p>States: FILLING until the window holds {@code marker.length} bytes, then
 * FULL; a push that leaves the window byte-for-byte equal to the marker moves
 * the scanner to MATCHED, which is terminal. An empty marker disables the
 * scanner and every push reports no match.</p>
 */
final class MarkerScanner
{
    enum State { DISABLED, FILLING, FULL, MATCHED }

    private final byte[] marker;
    private final byte[] window;

    /* index of the oldest byte in window once it is full */
    private int head;
    private int size;
    private State state;

    MarkerScanner(byte[] marker)
    {
        this.marker = Objects.requireNonNull(marker, "marker").clone();
        this.window = new byte[marker.length];
        this.state = marker.length == 0 ? State.DISABLED : State.FILLING;
    }

    /**
     * Pushes a newly completed byte, evicting the oldest once the window is full.
     *
     * @return true if the window now equals the marker
     */
    boolean push(int completedByte)
    {
        if (state == State.DISABLED) {
            return false;
        }
        if (state == State.MATCHED) {
            throw new IllegalStateException("Marker already matched");
        }

        if (size < window.length) {
            window[(head + size) % window.length] = (byte) completedByte;
            size++;
        } else {
            window[head] = (byte) completedByte;
            head = (head + 1) % window.length;
        }

        if (size < window.length) {
            return false;
        }

        state = matchesMarker() ? State.MATCHED : State.FULL;
        return state == State.MATCHED;
    }

    State state()
    {
        return state;
    }

    int markerLength()
    {
        return marker.length;
    }

    private boolean matchesMarker()
    {
        for (int i = 0; i < marker.length; i++) {
            if (window[(head + i) % window.length] != marker[i]) {
                return false;
            }
        }
        return true;
    }
}
