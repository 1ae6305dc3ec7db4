package com.questrail.stego.observability;

/**
 * Receives embedding and extraction observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface StegoObservabilitySink {
    /**
     * Called after a payload has been embedded.
     * @param event the completed encode details
     */
    void onEncodeCompleted(EncodeCompletedEvent event);

    /**
     * Called after an extraction has terminated, by marker or by exhaustion.
     * @param event the completed decode details
     */
    void onDecodeCompleted(DecodeCompletedEvent event);

    /**
     * Called when an operation is rejected or fails.
     * @param event the error event
     */
    void onError(StegoErrorEvent event);
}
