package com.questrail.stego.observability;

import com.questrail.stego.codec.CapacityExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of StegoObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jStegoObservabilitySink implements StegoObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jStegoObservabilitySink.class);

    @Override
    public void onEncodeCompleted(EncodeCompletedEvent event) {
        log.info("Embedded {} bytes: {} pixels visited, {} changed, {} pass(es)",
            event.payloadBytes(),
            event.pixelsVisited(),
            event.pixelsChanged(),
            event.passes());
        log.debug("Encode configuration: {}", event.config());
    }

    @Override
    public void onDecodeCompleted(DecodeCompletedEvent event) {
        log.info("Extracted {} bytes from {} pixels (marker {}) in {} ms",
            event.bytesDecoded(),
            event.pixelsVisited(),
            event.hitMarker() ? "hit" : "not hit",
            event.elapsed().toMillis());
        log.debug("Decode configuration: {}", event.config());
    }

    @Override
    public void onError(StegoErrorEvent event) {
        // capacity rejections are caller errors, not faults
        if (event.cause() instanceof CapacityExceededException) {
            log.warn("{} rejected: {}", event.operation(), event.message());
        } else {
            log.error("{} failed: {}", event.operation(), event.message(), event.cause());
        }
    }
}
