package com.questrail.stego.image;

/**
 * Container formats an {@link ImageCodec} can write.
 *
 * <p>{@link #JPEG} is lossy: LSB payloads do not survive it.</p>
 */
public enum ImageFormat
{
    JPEG("jpeg"),
    PNG("png"),
    BMP("bmp");

    private final String formatName;

    ImageFormat(String formatName) {
        this.formatName = formatName;
    }

    /**
     * Informal format name as understood by {@code javax.imageio}.
     */
    public String formatName() {
        return formatName;
    }
}
