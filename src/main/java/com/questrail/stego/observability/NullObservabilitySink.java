package com.questrail.stego.observability;

/**
 * No-op implementation of StegoObservabilitySink.
 */
public final class NullObservabilitySink implements StegoObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onEncodeCompleted(EncodeCompletedEvent event) {}

    @Override
    public void onDecodeCompleted(DecodeCompletedEvent event) {}

    @Override
    public void onError(StegoErrorEvent event) {}
}
