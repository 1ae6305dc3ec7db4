package com.questrail.stego.codec.impl;

import com.questrail.stego.codec.PayloadExtractor;
import com.questrail.stego.config.ColorChannel;
import com.questrail.stego.config.StegoConfig;
import com.questrail.stego.image.PixelBuffer;
import com.questrail.stego.model.DecodedResult;
import com.questrail.stego.observability.DecodeCompletedEvent;
import com.questrail.stego.observability.NullObservabilitySink;
import com.questrail.stego.observability.StegoObservabilitySink;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * DefaultPayloadExtractor
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link PayloadExtractor}.
 *
 * <p>For every pixel the cursor yields, the low bits of the selected channel
 * are placed into the byte under construction at the current bit position.
 * A byte is complete once 8 bits have been placed; completed bytes are
 * appended to the output and, when a marker is configured, pushed through a
 * {@link MarkerScanner}. A match stops the scan before any further pixel is
 * read.</p>
 *
 * <p>Bits left in an incomplete trailing byte when the cursor is exhausted are
 * discarded.</p>
 */
public final class DefaultPayloadExtractor implements PayloadExtractor
{
    private final StegoObservabilitySink observabilitySink;

    public DefaultPayloadExtractor()
    {
        this(NullObservabilitySink.INSTANCE);
    }

    public DefaultPayloadExtractor(StegoObservabilitySink observabilitySink)
    {
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    @Override
    public DecodedResult decode(StegoConfig config, PixelBuffer source)
    {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(source, "source");

        final long startNanos = System.nanoTime();

        final TraversalCursor cursor = TraversalCursor.over(config, source.width(), source.height());
        final MarkerScanner scanner = new MarkerScanner(config.marker());
        final int bitsPerPixel = config.bitsPerPixel();
        final ColorChannel channel = config.channel();

        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        int current = 0;
        int iterCount = 0;
        boolean hitMarker = false;

        while (cursor.hasNext()) {
            final TraversalCursor.PixelAddress at = cursor.next();

            final int count = Math.min(bitsPerPixel, Byte.SIZE - iterCount);
            final int bits = LsbBits.getBits(source.getChannelByte(at.x(), at.y(), channel), count);
            current = LsbBits.setBits(current, iterCount, count, bits);
            iterCount += count;

            if (iterCount == Byte.SIZE) {
                out.write(current);
                if (scanner.push(current)) {
                    hitMarker = true;
                    break;
                }
                current = 0;
                iterCount = 0;
            }
        }

        final Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        final DecodedResult result = new DecodedResult(out.toByteArray(), hitMarker, scanner.markerLength(), elapsed);

        observabilitySink.onDecodeCompleted(new DecodeCompletedEvent(
                Instant.now(), config, result.length(), cursor.visited(), hitMarker, elapsed));

        return result;
    }
}
