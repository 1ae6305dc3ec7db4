package com.questrail.stego.image;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Objects;

/**
 * {@link ImageCodec} backed by {@code javax.imageio}.
 *
 * <p>Any readable image is flattened to 8-bit RGB; alpha is discarded.
 * Output is written from a {@link BufferedImage#TYPE_INT_RGB} raster so that
 * every supported format accepts it.</p>
 */
public final class ImageIoCodec implements ImageCodec
{
    public static final ImageIoCodec INSTANCE = new ImageIoCodec();

    private ImageIoCodec() {}

    @Override
    public PixelBuffer load(byte[] imageBytes) {
        Objects.requireNonNull(imageBytes, "imageBytes");

        final BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException e) {
            throw new InvalidImageException("Could not decode image", e);
        }
        if (image == null) {
            throw new InvalidImageException("Could not decode image: no registered reader accepts the input");
        }

        RgbPixelBuffer pixels = RgbPixelBuffer.blank(image.getWidth(), image.getHeight());
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                pixels.setRgb(x, y, Rgb.fromPacked(image.getRGB(x, y)));
            }
        }
        return pixels;
    }

    @Override
    public byte[] save(PixelBuffer pixels, ImageFormat format) {
        Objects.requireNonNull(pixels, "pixels");
        Objects.requireNonNull(format, "format");

        BufferedImage image = new BufferedImage(pixels.width(), pixels.height(), BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < pixels.height(); y++) {
            for (int x = 0; x < pixels.width(); x++) {
                image.setRGB(x, y, pixels.getRgb(x, y).packed());
            }
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, format.formatName(), out)) {
                throw new InvalidImageException("No image writer available for " + format);
            }
        } catch (IOException e) {
            throw new InvalidImageException("Could not encode image as " + format, e);
        }
        return out.toByteArray();
    }
}
