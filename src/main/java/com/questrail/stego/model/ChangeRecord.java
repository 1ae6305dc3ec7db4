package com.questrail.stego.model;

import com.questrail.stego.image.Rgb;

import java.util.Objects;

/**
 * One pixel write performed by the embedder: where it happened and the
 * pixel colour before and after.
 */
public record ChangeRecord(int x, int y, Rgb original, Rgb updated)
{
    public ChangeRecord {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(updated, "updated");
    }

    /**
     * True if the write altered the pixel's colour. Writing a chunk equal to
     * the bits already present leaves the pixel unchanged.
     */
    public boolean isChanged() {
        return !original.equals(updated);
    }
}
