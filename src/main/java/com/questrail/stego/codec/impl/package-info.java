/**
 * Embedding Codec: Engine Implementation
 * =============================================================================
 *
 * <p>Concrete engines and the pieces they share:</p>
 *
 * <pre>
 *   StegoConfig + image size
 *        → TraversalCursor        (row-major order, offset, stride, spread wrap)
 *
 *   encode:  CapacityCheck → TraversalCursor → LsbBits.setBits → EncodedResult
 *   decode:  TraversalCursor → LsbBits.getBits → MarkerScanner → DecodedResult
 * </pre>
 *
 * <p>Payload bytes are sliced least-significant chunk first. Every per-call
 * object (cursor, scanner, working pixel copy) is created inside the call and
 * discarded with it.</p>
 */
package com.questrail.stego.codec.impl;
