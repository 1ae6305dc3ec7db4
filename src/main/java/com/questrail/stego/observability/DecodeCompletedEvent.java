package com.questrail.stego.observability;

import com.questrail.stego.config.StegoConfig;

import java.time.Duration;
import java.time.Instant;

/**
 * Record describing a finished extraction.
 */
public record DecodeCompletedEvent(
    Instant timestamp,
    StegoConfig config,
    int bytesDecoded,
    long pixelsVisited,
    boolean hitMarker,
    Duration elapsed
) {
}
