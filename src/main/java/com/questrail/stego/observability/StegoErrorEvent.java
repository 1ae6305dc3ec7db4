package com.questrail.stego.observability;

import java.time.Instant;

/**
 * Record representing a rejected or failed operation.
 */
public record StegoErrorEvent(
    Instant timestamp,
    String operation,
    String message,
    Throwable cause
) {
}
