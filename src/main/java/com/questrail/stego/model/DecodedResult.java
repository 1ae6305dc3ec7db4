package com.questrail.stego.model;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * DecodedResult
 * -----------------------------------------------------------------------------
 * Bytes assembled by a single extraction, in order, together with how the
 * extraction ended.
 *
 * <p>When {@link #hitMarker()} is true the marker's own bytes are the tail of
 * {@link #embeddedData()}. {@link #payloadWithoutMarker()} offers the same
 * bytes with the marker removed.</p>
 */
public final class DecodedResult
{
    private final byte[] data;
    private final boolean hitMarker;
    private final int markerLength;
    private final Duration elapsed;

    /**
     * @param data         assembled bytes, marker included when hit
     * @param hitMarker    whether extraction stopped on a marker match
     * @param markerLength length of the configured marker (0 when none)
     * @param elapsed      wall time spent scanning pixels
     */
    public DecodedResult(byte[] data, boolean hitMarker, int markerLength, Duration elapsed) {
        Objects.requireNonNull(data, "data");
        if (markerLength < 0) {
            throw new IllegalArgumentException("markerLength must be non-negative");
        }
        if (hitMarker && markerLength > data.length) {
            throw new IllegalArgumentException("marker hit but fewer bytes than the marker were decoded");
        }
        this.data = data.clone();
        this.hitMarker = hitMarker;
        this.markerLength = markerLength;
        this.elapsed = Objects.requireNonNull(elapsed, "elapsed");
    }

    /**
     * Raw extracted bytes, marker included.
     */
    public byte[] embeddedData() {
        return data.clone();
    }

    /**
     * Extracted bytes with a matched marker stripped from the end. Identical to
     * {@link #embeddedData()} when no marker was hit.
     */
    public byte[] payloadWithoutMarker() {
        return hitMarker ? Arrays.copyOf(data, data.length - markerLength) : data.clone();
    }

    public boolean hitMarker() {
        return hitMarker;
    }

    public int length() {
        return data.length;
    }

    public Duration elapsed() {
        return elapsed;
    }

    /**
     * Lossy UTF-8 view; malformed sequences become U+FFFD.
     */
    public String asRawText() {
        return new String(data, StandardCharsets.UTF_8);
    }

    /**
     * Strict UTF-8 view.
     *
     * @throws InvalidUtf8Exception if the bytes are not well-formed UTF-8
     */
    public String asText() {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new InvalidUtf8Exception("Extracted payload is not valid UTF-8", e);
        }
    }

    @Override
    public String toString() {
        return "DecodedResult[bytes=" + data.length + ", hitMarker=" + hitMarker + ", elapsed=" + elapsed + "]";
    }
}
