package com.questrail.stego.codec;

/**
 * Indicates that a payload needs more pixel visits than the traversal can
 * provide under the given configuration.
 *
 * <p>Raised before any pixel is written.</p>
 */
public final class CapacityExceededException extends StegoException
{
    private final long requiredVisits;
    private final long availableVisits;

    public CapacityExceededException(long requiredVisits, long availableVisits, boolean spread) {
        super("Payload requires " + requiredVisits + " pixel visits but only "
                + availableVisits + " are available"
                + (spread ? " across all spread passes" : " (spread disabled)"));
        this.requiredVisits = requiredVisits;
        this.availableVisits = availableVisits;
    }

    public long requiredVisits() {
        return requiredVisits;
    }

    public long availableVisits() {
        return availableVisits;
    }
}
