package com.questrail.stego.model;

import com.questrail.stego.image.ImageCodec;
import com.questrail.stego.image.ImageFormat;
import com.questrail.stego.image.InvalidImageException;
import com.questrail.stego.image.PixelBuffer;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * EncodedResult
 * -----------------------------------------------------------------------------
 * Outcome of a single successful embed: the altered pixels, the untouched
 * original pixels and the per-byte change log.
 *
 * <p>Instances are immutable. Pixel accessors return copies, so callers may
 * modify what they receive without affecting this result.</p>
 */
public final class EncodedResult
{
    private final PixelBuffer altered;
    private final PixelBuffer original;
    private final List<ByteEncodeMap> changes;
    private final ImageCodec codec;

    public EncodedResult(PixelBuffer altered,
                         PixelBuffer original,
                         List<ByteEncodeMap> changes,
                         ImageCodec codec) {
        this.altered = Objects.requireNonNull(altered, "altered").copy();
        this.original = Objects.requireNonNull(original, "original").copy();
        this.changes = List.copyOf(Objects.requireNonNull(changes, "changes"));
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Per-byte change maps, in payload order.
     */
    public List<ByteEncodeMap> changes() {
        return changes;
    }

    /**
     * Number of pixel writes performed, including writes that left the
     * pixel's value as it was.
     */
    public long pixelsVisited() {
        return changes.stream().mapToLong(m -> m.changes().size()).sum();
    }

    /**
     * Number of pixel writes that actually altered a colour.
     */
    public long pixelsChanged() {
        return changes.stream()
                .flatMap(m -> m.changes().stream())
                .filter(ChangeRecord::isChanged)
                .count();
    }

    public PixelBuffer alteredPixels() {
        return altered.copy();
    }

    public PixelBuffer originalPixels() {
        return original.copy();
    }

    /**
     * Serialises the altered pixels.
     *
     * @throws InvalidImageException if the codec cannot produce {@code format}
     */
    public byte[] toBytes(ImageFormat format) {
        return codec.save(altered, format);
    }

    /**
     * Writes the altered pixels to {@code target}. The stream is not closed.
     *
     * @throws InvalidImageException if encoding or writing fails
     */
    public void write(OutputStream target, ImageFormat format) {
        Objects.requireNonNull(target, "target");
        final byte[] bytes = toBytes(format);
        try {
            target.write(bytes);
        } catch (IOException e) {
            throw new InvalidImageException("Could not write encoded image to stream", e);
        }
    }

    /**
     * Writes the altered pixels to a file, replacing any existing content.
     *
     * @throws InvalidImageException if encoding or writing fails
     */
    public void save(Path path, ImageFormat format) {
        Objects.requireNonNull(path, "path");
        final byte[] bytes = toBytes(format);
        try {
            Files.write(path, bytes);
        } catch (IOException e) {
            throw new InvalidImageException("Could not write encoded image to " + path, e);
        }
    }

    @Override
    public String toString() {
        return "EncodedResult[bytes=" + changes.size()
                + ", pixelsVisited=" + pixelsVisited()
                + ", pixelsChanged=" + pixelsChanged() + "]";
    }
}
