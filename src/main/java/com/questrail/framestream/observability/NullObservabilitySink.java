package com.questrail.framestream.observability;

/**
 * No-op implementation of StreamObservabilitySink.
 */
public final class NullObservabilitySink implements StreamObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onFrameEncoded(FrameEncodedEvent event) {}

    @Override
    public void onConnectionTransition(ConnectionTransitionEvent event) {}

    @Override
    public void onError(StreamErrorEvent event) {}
}
