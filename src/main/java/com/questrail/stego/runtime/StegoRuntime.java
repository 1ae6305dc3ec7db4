package com.questrail.stego.runtime;

import com.questrail.stego.codec.PayloadEmbedder;
import com.questrail.stego.codec.PayloadExtractor;
import com.questrail.stego.codec.impl.CapacityCheck;
import com.questrail.stego.codec.impl.DefaultPayloadEmbedder;
import com.questrail.stego.codec.impl.DefaultPayloadExtractor;
import com.questrail.stego.config.StegoConfig;
import com.questrail.stego.image.ImageCodec;
import com.questrail.stego.image.ImageIoCodec;
import com.questrail.stego.image.InvalidImageException;
import com.questrail.stego.image.PixelBuffer;
import com.questrail.stego.model.DecodedResult;
import com.questrail.stego.model.EncodedResult;
import com.questrail.stego.observability.NullObservabilitySink;
import com.questrail.stego.observability.StegoErrorEvent;
import com.questrail.stego.observability.StegoObservabilitySink;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * StegoRuntime
 * =============================================================================
 * Composition root for the embedding stack: an {@link ImageCodec}, the two
 * engines and an observability sink.
 *
 * <p>Entry points accept image container bytes, streams or paths. Anything
 * that prevents turning the source into pixels is reported as
 * {@link InvalidImageException}; the runtime never guesses formats.</p>
 *
 * <p>The runtime holds no per-call state and is safe to share.</p>
 */
public final class StegoRuntime {
    private final ImageCodec codec;
    private final PayloadEmbedder embedder;
    private final PayloadExtractor extractor;
    private final StegoObservabilitySink observabilitySink;

    private StegoRuntime(
            ImageCodec codec,
            PayloadEmbedder embedder,
            PayloadExtractor extractor,
            StegoObservabilitySink observabilitySink) {
        this.codec = codec;
        this.embedder = embedder;
        this.extractor = extractor;
        this.observabilitySink = observabilitySink;
    }

    /**
     * Runtime with the {@code javax.imageio} codec and no observability.
     */
    public static StegoRuntime createDefault() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ------------------------------------------------------------------------
    // Encode
    // ------------------------------------------------------------------------

    public EncodedResult encode(PixelBuffer pixels, byte[] payload, StegoConfig config) {
        return embedder.encode(payload, config, pixels);
    }

    public EncodedResult encode(byte[] imageBytes, byte[] payload, StegoConfig config) {
        return encode(load(imageBytes, "encode"), payload, config);
    }

    public EncodedResult encode(InputStream image, byte[] payload, StegoConfig config) {
        return encode(readAll(image, "encode"), payload, config);
    }

    public EncodedResult encode(Path image, byte[] payload, StegoConfig config) {
        return encode(readAll(image, "encode"), payload, config);
    }

    /**
     * Embeds {@code text} as UTF-8.
     */
    public EncodedResult encodeText(Path image, String text, StegoConfig config) {
        Objects.requireNonNull(text, "text");
        return encode(image, text.getBytes(StandardCharsets.UTF_8), config);
    }

    // ------------------------------------------------------------------------
    // Decode
    // ------------------------------------------------------------------------

    public DecodedResult decode(PixelBuffer pixels, StegoConfig config) {
        return extractor.decode(config, pixels);
    }

    public DecodedResult decode(byte[] imageBytes, StegoConfig config) {
        return decode(load(imageBytes, "decode"), config);
    }

    public DecodedResult decode(InputStream image, StegoConfig config) {
        return decode(readAll(image, "decode"), config);
    }

    public DecodedResult decode(Path image, StegoConfig config) {
        return decode(readAll(image, "decode"), config);
    }

    // ------------------------------------------------------------------------
    // Capacity
    // ------------------------------------------------------------------------

    /**
     * Whole payload bytes that {@code pixels} can carry under {@code config}.
     */
    public long capacityBytes(PixelBuffer pixels, StegoConfig config) {
        Objects.requireNonNull(pixels, "pixels");
        Objects.requireNonNull(config, "config");
        return CapacityCheck.capacityBytes(config, pixels.width(), pixels.height());
    }

    private PixelBuffer load(byte[] imageBytes, String operation) {
        Objects.requireNonNull(imageBytes, "imageBytes");
        try {
            return codec.load(imageBytes);
        } catch (InvalidImageException e) {
            observabilitySink.onError(new StegoErrorEvent(Instant.now(), operation, e.getMessage(), e));
            throw e;
        } catch (RuntimeException e) {
            // codec defects surface as the single opaque image failure
            InvalidImageException wrapped = new InvalidImageException("Could not decode image", e);
            observabilitySink.onError(new StegoErrorEvent(Instant.now(), operation, wrapped.getMessage(), e));
            throw wrapped;
        }
    }

    private byte[] readAll(InputStream image, String operation) {
        Objects.requireNonNull(image, "image");
        try {
            return image.readAllBytes();
        } catch (IOException e) {
            throw imageReadFailure("Could not read image stream", e, operation);
        }
    }

    private byte[] readAll(Path image, String operation) {
        Objects.requireNonNull(image, "image");
        try {
            return Files.readAllBytes(image);
        } catch (IOException e) {
            throw imageReadFailure("Could not read image file " + image, e, operation);
        }
    }

    private InvalidImageException imageReadFailure(String message, IOException cause, String operation) {
        InvalidImageException e = new InvalidImageException(message, cause);
        observabilitySink.onError(new StegoErrorEvent(Instant.now(), operation, message, cause));
        return e;
    }

    public static final class Builder {
        private ImageCodec codec = ImageIoCodec.INSTANCE;
        private StegoObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withCodec(ImageCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder withObservabilitySink(StegoObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public StegoRuntime build() {
            Objects.requireNonNull(codec, "codec");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            return new StegoRuntime(
                    codec,
                    new DefaultPayloadEmbedder(codec, observabilitySink),
                    new DefaultPayloadExtractor(observabilitySink),
                    observabilitySink);
        }
    }
}
