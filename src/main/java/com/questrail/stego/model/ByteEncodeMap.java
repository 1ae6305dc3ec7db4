package com.questrail.stego.model;

import java.util.List;
import java.util.Objects;

/**
 * The pixel writes that carry a single payload byte, in visit order.
 *
 * @param sourceByte the payload byte as an unsigned value (0–255)
 * @param changes    one record per chunk of {@code sourceByte}
 */
public record ByteEncodeMap(int sourceByte, List<ChangeRecord> changes)
{
    public ByteEncodeMap {
        if (sourceByte < 0 || sourceByte > 0xFF) {
            throw new IllegalArgumentException("sourceByte must be in range 0–255 (was " + sourceByte + ")");
        }
        changes = List.copyOf(Objects.requireNonNull(changes, "changes"));
    }
}
