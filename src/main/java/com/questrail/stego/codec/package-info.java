/**
 * Embedding Codec: Engine Ports
 * =============================================================================
 *
 * <p>This package defines the two engine boundaries of the library:</p>
 *
 * <pre>
 *   byte[] payload + PixelBuffer
 *        → PayloadEmbedder    (capacity check, chunking, channel writes)
 *            → EncodedResult  (altered copy + per-byte change log)
 *
 *   PixelBuffer
 *        → PayloadExtractor   (channel reads, byte assembly, marker scan)
 *            → DecodedResult
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Both engines operate on an already-decoded {@code PixelBuffer}. Image
 *       container parsing belongs to {@code com.questrail.stego.image}.</li>
 *   <li>The engines never call each other. They share only the traversal
 *       order and the bit helpers in {@code codec.impl}.</li>
 *   <li>Every call owns its working state; implementations hold no mutable
 *       fields and may be shared freely across threads.</li>
 * </ul>
 */
package com.questrail.stego.codec;
