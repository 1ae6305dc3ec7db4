package com.questrail.stego.codec.impl;

import com.questrail.stego.config.ColorChannel;
import com.questrail.stego.config.StegoConfig;
import com.questrail.stego.image.PixelBuffer;
import com.questrail.stego.image.RgbPixelBuffer;
import com.questrail.stego.model.DecodedResult;
import com.questrail.stego.observability.DecodeCompletedEvent;
import com.questrail.stego.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static com.questrail.stego.codec.impl.DefaultPayloadEmbedderTest.noise;
import static com.questrail.stego.codec.impl.DefaultPayloadEmbedderTest.randomBytes;
import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultPayloadExtractorTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultPayloadExtractor}: byte assembly, exhaustion
 * and marker-based early stop.
 */
final class DefaultPayloadExtractorTest
{
    private final DefaultPayloadEmbedder embedder = new DefaultPayloadEmbedder();
    private final DefaultPayloadExtractor extractor = new DefaultPayloadExtractor();

    @Test
    void readsSingleByteFromBlueLsb()
    {
        RgbPixelBuffer image = RgbPixelBuffer.blank(4, 4);
        int[] bits = { 1, 0, 0, 0, 0, 0, 1, 0 };
        for (int i = 0; i < bits.length; i++) {
            image.setChannelByte(i % 4, i / 4, ColorChannel.BLUE, bits[i]);
        }

        DecodedResult result = extractor.decode(StegoConfig.defaults(), image);

        assertArrayEquals(new byte[] { 0x41, 0x00 }, result.embeddedData());
        assertFalse(result.hitMarker());
    }

    @Test
    void ignoresBitsAboveConfiguredWidth()
    {
        RgbPixelBuffer image = RgbPixelBuffer.blank(4, 1);
        for (int x = 0; x < 4; x++) {
            // high bits set, low two bits = 01
            image.setChannelByte(x, 0, ColorChannel.BLUE, 0b1111_1101);
        }
        StegoConfig config = StegoConfig.builder().withBitsPerPixel(2).build();

        assertArrayEquals(new byte[] { 0b0101_0101 }, extractor.decode(config, image).embeddedData());
    }

    @Test
    void withoutMarkerReturnsFloorOfAvailableBits()
    {
        // 15 pixels, offset 1 → 14 visits of 2 bits = 28 bits → 3 bytes
        StegoConfig config = StegoConfig.builder().withBitsPerPixel(2).withPixelOffset(1).build();

        DecodedResult result = extractor.decode(config, noise(5, 3, 1L));

        assertEquals(3, result.length());
        assertFalse(result.hitMarker());
    }

    @Test
    void withoutMarkerStridedReturnsFloorOfAvailableBits()
    {
        // 100 pixels, stride 3 → 34 visits of 4 bits = 136 bits → 17 bytes
        StegoConfig config = StegoConfig.builder().withBitsPerPixel(4).withPixelStride(3).build();

        assertEquals(17, extractor.decode(config, noise(10, 10, 2L)).length());
    }

    @Test
    void startBeyondImageYieldsNoBytes()
    {
        StegoConfig config = StegoConfig.builder().withPixelOffset(1_000).build();

        DecodedResult result = extractor.decode(config, noise(4, 4, 3L));

        assertEquals(0, result.length());
        assertFalse(result.hitMarker());
    }

    @Test
    void stopsOnMarkerWithoutReadingFurtherPixels()
    {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        DefaultPayloadExtractor recording = new DefaultPayloadExtractor(sink);
        byte[] payload = "abc--def".getBytes(StandardCharsets.US_ASCII);
        PixelBuffer image = embedder.encode(payload, StegoConfig.defaults(), noise(16, 16, 4L)).alteredPixels();

        StegoConfig config = StegoConfig.builder().withMarker(new byte[] { '-', '-' }).build();
        DecodedResult result = recording.decode(config, image);

        assertTrue(result.hitMarker());
        assertArrayEquals("abc--".getBytes(StandardCharsets.US_ASCII), result.embeddedData());
        assertArrayEquals("abc".getBytes(StandardCharsets.US_ASCII), result.payloadWithoutMarker());

        DecodeCompletedEvent event = sink.getEventsOfType(DecodeCompletedEvent.class).get(0);
        assertEquals(40, event.pixelsVisited());
        assertTrue(event.hitMarker());
    }

    @Test
    void absentMarkerRunsToExhaustion()
    {
        StegoConfig config = StegoConfig.builder()
                .withBitsPerPixel(8)
                .withMarker(new byte[] { 0x7F, 0x7F, 0x7F })
                .build();
        RgbPixelBuffer image = RgbPixelBuffer.blank(3, 3);

        DecodedResult result = extractor.decode(config, image);

        assertFalse(result.hitMarker());
        assertEquals(9, result.length());
        assertArrayEquals(result.embeddedData(), result.payloadWithoutMarker());
    }

    @Test
    void markerSpanningWrappedPassIsFound()
    {
        StegoConfig encodeConfig = StegoConfig.builder()
                .withBitsPerPixel(8)
                .withPixelOffset(12)
                .withSpread(true)
                .build();
        byte[] payload = { 1, 2, 3, 4, (byte) 0xEE, (byte) 0xFF };

        PixelBuffer image = embedder.encode(payload, encodeConfig, RgbPixelBuffer.blank(4, 4)).alteredPixels();
        StegoConfig decodeConfig = encodeConfig.toBuilder()
                .withMarker(new byte[] { (byte) 0xEE, (byte) 0xFF })
                .build();

        DecodedResult result = extractor.decode(decodeConfig, image);

        assertTrue(result.hitMarker());
        assertArrayEquals(payload, result.embeddedData());
    }

    @Test
    void stridedSpreadRoundTripKeepsEveryByte()
    {
        StegoConfig encodeConfig = StegoConfig.builder()
                .withBitsPerPixel(8)
                .withPixelStride(2)
                .withSpread(true)
                .build();
        byte[] payload = { 1, 2, 3, 4, 5, 6, 7, 8, 9, (byte) 0xEE };

        PixelBuffer image = embedder.encode(payload, encodeConfig, RgbPixelBuffer.blank(4, 4)).alteredPixels();
        DecodedResult result = extractor.decode(
                encodeConfig.toBuilder().withMarker(new byte[] { (byte) 0xEE }).build(), image);

        assertTrue(result.hitMarker());
        assertArrayEquals(payload, result.embeddedData());
    }

    @Test
    void nonDivisorBitWidthRoundTrips()
    {
        StegoConfig config = StegoConfig.builder().withBitsPerPixel(3).withChannel(ColorChannel.RED).build();
        byte[] payload = randomBytes(20, 8L);

        PixelBuffer image = embedder.encode(payload, config, noise(10, 10, 9L)).alteredPixels();
        DecodedResult result = extractor.decode(config, image);

        // 100 visits / 3 per byte = 33 whole bytes
        assertEquals(33, result.length());
        assertArrayEquals(payload, Arrays.copyOf(result.embeddedData(), payload.length));
    }

    @Test
    void elapsedTimeIsRecorded()
    {
        DecodedResult result = extractor.decode(StegoConfig.defaults(), noise(8, 8, 10L));

        assertFalse(result.elapsed().isNegative());
    }
}
