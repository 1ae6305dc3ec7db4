package com.questrail.stego.codec.impl;

import com.questrail.stego.codec.CapacityExceededException;
import com.questrail.stego.codec.PayloadEmbedder;
import com.questrail.stego.config.ColorChannel;
import com.questrail.stego.config.StegoConfig;
import com.questrail.stego.image.ImageCodec;
import com.questrail.stego.image.ImageIoCodec;
import com.questrail.stego.image.PixelBuffer;
import com.questrail.stego.image.Rgb;
import com.questrail.stego.image.RgbPixelBuffer;
import com.questrail.stego.model.ByteEncodeMap;
import com.questrail.stego.model.ChangeRecord;
import com.questrail.stego.model.EncodedResult;
import com.questrail.stego.observability.EncodeCompletedEvent;
import com.questrail.stego.observability.NullObservabilitySink;
import com.questrail.stego.observability.StegoErrorEvent;
import com.questrail.stego.observability.StegoObservabilitySink;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DefaultPayloadEmbedder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link PayloadEmbedder}.
 *
 * <p>This embedder performs the following steps, in order:</p>
 * <ol>
 *   <li>Capacity check against the exact cursor consumption (fail fast)</li>
 *   <li>Private copy of the source pixels</li>
 *   <li>For each payload byte, LSB-first chunks of {@code bitsPerPixel} bits,
 *       one per visited pixel, written into the low bits of the selected
 *       channel</li>
 *   <li>One {@link ChangeRecord} per write, grouped into a
 *       {@link ByteEncodeMap} per payload byte</li>
 * </ol>
 *
 * <p>When {@code bitsPerPixel} does not divide 8, the last chunk of each byte
 * is narrower and only that many channel bits are written.</p>
 */
public final class DefaultPayloadEmbedder implements PayloadEmbedder
{
    private final ImageCodec codec;
    private final StegoObservabilitySink observabilitySink;

    public DefaultPayloadEmbedder()
    {
        this(ImageIoCodec.INSTANCE, NullObservabilitySink.INSTANCE);
    }

    /**
     * @param codec             codec handed to results for later serialisation
     * @param observabilitySink receiver of completion and rejection events
     */
    public DefaultPayloadEmbedder(ImageCodec codec, StegoObservabilitySink observabilitySink)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    @Override
    public EncodedResult encode(byte[] payload, StegoConfig config, PixelBuffer source)
    {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(source, "source");
        if (source.pixelCount() == 0) {
            throw new IllegalArgumentException("Source pixel buffer contains no pixels");
        }

        // 1) Capacity: nothing is copied or written on rejection
        try {
            CapacityCheck.ensureCapacity(payload.length, config, source.width(), source.height());
        } catch (CapacityExceededException e) {
            observabilitySink.onError(new StegoErrorEvent(Instant.now(), "encode", e.getMessage(), e));
            throw e;
        }

        // 2) Work on private copies; the caller's buffer is never touched
        final RgbPixelBuffer original = RgbPixelBuffer.copyOf(source);
        final RgbPixelBuffer working = original.copy();

        final TraversalCursor cursor = TraversalCursor.over(config, source.width(), source.height());
        final int bitsPerPixel = config.bitsPerPixel();
        final ColorChannel channel = config.channel();

        final List<ByteEncodeMap> maps = new ArrayList<>(payload.length);
        long changed = 0;

        // 3) Chunk and write, one pixel per chunk
        for (byte b : payload) {
            final int value = b & 0xFF;
            final List<ChangeRecord> records = new ArrayList<>(config.visitsPerByte());

            for (int bitOffset = 0; bitOffset < Byte.SIZE; bitOffset += bitsPerPixel) {
                final int count = Math.min(bitsPerPixel, Byte.SIZE - bitOffset);
                final int chunk = LsbBits.getBits(value, bitOffset, count);

                if (!cursor.hasNext()) {
                    // Unreachable after a passing capacity check
                    throw new CapacityExceededException(
                            CapacityCheck.requiredPixelVisits(payload.length, bitsPerPixel),
                            cursor.visited(), config.spread());
                }
                final TraversalCursor.PixelAddress at = cursor.next();

                final Rgb before = working.getRgb(at.x(), at.y());
                final int channelByte = before.component(channel);
                working.setChannelByte(at.x(), at.y(), channel, LsbBits.setBits(channelByte, 0, count, chunk));
                final Rgb after = working.getRgb(at.x(), at.y());

                final ChangeRecord record = new ChangeRecord(at.x(), at.y(), before, after);
                if (record.isChanged()) {
                    changed++;
                }
                records.add(record);
            }

            maps.add(new ByteEncodeMap(value, records));
        }

        observabilitySink.onEncodeCompleted(new EncodeCompletedEvent(
                Instant.now(), config, payload.length, cursor.visited(), changed,
                cursor.visited() == 0 ? 0 : cursor.pass() + 1));

        return new EncodedResult(working, original, maps, codec);
    }
}
