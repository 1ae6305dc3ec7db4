/**
 * Image Collaborator Boundary
 * =============================================================================
 *
 * <p>Everything that knows about image <em>containers</em> lives here. The
 * embedding engines above this package see only a {@link
 * com.questrail.stego.image.PixelBuffer}:</p>
 *
 * <pre>
 *   byte[] container ──ImageCodec.load──▶ PixelBuffer ──▶ engines
 *   PixelBuffer      ──ImageCodec.save──▶ byte[] container (JPEG | PNG | BMP)
 * </pre>
 *
 * <p>{@link com.questrail.stego.image.ImageIoCodec} is the production adapter.
 * Alternative codecs plug in through {@link com.questrail.stego.image.ImageCodec}
 * without touching the engines.</p>
 */
package com.questrail.stego.image;
