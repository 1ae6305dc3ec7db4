package com.questrail.stego.observability;

import com.questrail.stego.config.StegoConfig;

import java.time.Instant;

/**
 * Record describing a successful embed.
 */
public record EncodeCompletedEvent(
    Instant timestamp,
    StegoConfig config,
    int payloadBytes,
    long pixelsVisited,
    long pixelsChanged,
    int passes
) {
}
