package com.questrail.stego;

import com.questrail.stego.codec.impl.DefaultPayloadEmbedder;
import com.questrail.stego.codec.impl.DefaultPayloadExtractor;
import com.questrail.stego.config.ColorChannel;
import com.questrail.stego.config.StartPosition;
import com.questrail.stego.config.StegoConfig;
import com.questrail.stego.image.PixelBuffer;
import com.questrail.stego.image.RgbPixelBuffer;
import com.questrail.stego.model.DecodedResult;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Semantic round-trip tests.
 *
 * These tests prove:
 *   payload ++ marker -> pixels -> payload ++ marker
 * for the traversal options that change where bits land.
 */
final class StegoEncodeDecodeRoundTripTest
{
    private static final byte[] PAYLOAD =
            "So full was I of slumber at the moment".getBytes(StandardCharsets.UTF_8);
    private static final byte[] MARKER = { '<', '/', '>' };

    private final DefaultPayloadEmbedder embedder = new DefaultPayloadEmbedder();
    private final DefaultPayloadExtractor extractor = new DefaultPayloadExtractor();

    @Test
    void defaultConfigRoundTrip()
    {
        assertRoundTrip(StegoConfig.defaults());
    }

    @Test
    void twoBitsGreenRoundTrip()
    {
        assertRoundTrip(StegoConfig.builder().withBitsPerPixel(2).withChannel(ColorChannel.GREEN).build());
    }

    @Test
    void fourBitsStridedRoundTrip()
    {
        assertRoundTrip(StegoConfig.builder().withBitsPerPixel(4).withPixelStride(7).withPixelOffset(11).build());
    }

    @Test
    void fullByteRedRoundTrip()
    {
        assertRoundTrip(StegoConfig.builder().withBitsPerPixel(8).withChannel(ColorChannel.RED).build());
    }

    @Test
    void centerStartRoundTrip()
    {
        assertRoundTrip(StegoConfig.builder()
                .withStartPosition(StartPosition.Anchor.CENTER)
                .withBitsPerPixel(2)
                .build());
    }

    @Test
    void explicitStartRoundTrip()
    {
        assertRoundTrip(StegoConfig.builder()
                .withStartPosition(StartPosition.at(12, 20))
                .withBitsPerPixel(4)
                .withPixelStride(2)
                .build());
    }

    @Test
    void spreadWrapRoundTrip()
    {
        // bottom-right start leaves fewer visits than the payload needs in one pass
        assertRoundTrip(StegoConfig.builder()
                .withStartPosition(StartPosition.Anchor.BOTTOM_RIGHT)
                .withPixelOffset(1_000)
                .withSpread(true)
                .build());
    }

    @Test
    void stridedSpreadWrapRoundTrip()
    {
        // 50 visits before the wrap, then indices 0, 3, 6, ... below the start
        assertRoundTrip(StegoConfig.builder()
                .withPixelOffset(1_050)
                .withPixelStride(3)
                .withSpread(true)
                .build());
    }

    private void assertRoundTrip(StegoConfig config)
    {
        byte[] embedded = concat(PAYLOAD, MARKER);
        PixelBuffer cover = noise(40, 30);

        PixelBuffer stego = embedder.encode(embedded, config, cover).alteredPixels();
        DecodedResult decoded = extractor.decode(config.toBuilder().withMarker(MARKER).build(), stego);

        assertTrue(decoded.hitMarker(), config.toString());
        assertArrayEquals(embedded, decoded.embeddedData(), config.toString());
        assertArrayEquals(PAYLOAD, decoded.payloadWithoutMarker());
    }

    private static byte[] concat(byte[] a, byte[] b)
    {
        byte[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    private static PixelBuffer noise(int width, int height)
    {
        byte[] samples = new byte[width * height * 3];
        new Random(1234L).nextBytes(samples);
        return RgbPixelBuffer.fromSamples(width, height, samples);
    }
}
