package com.questrail.framestream.observability;

/**
 * Main interface for receiving frame stream observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface StreamObservabilitySink {
    /**
     * Called after every encoded frame, whether or not it reached the wire.
     * @param event the frame details
     */
    void onFrameEncoded(FrameEncodedEvent event);

    /**
     * Called when the connection changes phase.
     * @param event the transition details
     */
    void onConnectionTransition(ConnectionTransitionEvent event);

    /**
     * Called when a frame had to be dropped because of an error.
     * @param event the error event
     */
    void onError(StreamErrorEvent event);
}
