package com.questrail.framestream.observability;

import com.questrail.framestream.transport.ConnectionPhase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of StreamObservabilitySink that emits logs via SLF4J.
 *
 * <p>Per-frame events are logged at trace to keep the render thread quiet.
 * Connect attempts that fail are logged at debug, since a missing viewer is
 * the normal state between attempts.</p>
 */
public final class Slf4jStreamObservabilitySink implements StreamObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jStreamObservabilitySink.class);

    @Override
    public void onFrameEncoded(FrameEncodedEvent event) {
        if (log.isTraceEnabled()) {
            log.trace("Frame {}: {} bytes, {} changed blocks, refresh counter {}, delivered={}",
                event.mode(),
                event.wireBytes(),
                event.changedBlocks(),
                event.forcedRefreshCounter(),
                event.delivered());
        }
    }

    @Override
    public void onConnectionTransition(ConnectionTransitionEvent event) {
        if (event.newPhase() == ConnectionPhase.CONNECTING) {
            log.debug("Connecting to viewer at {}", event.remote());
        } else if (event.oldPhase() == ConnectionPhase.CONNECTING
                && event.newPhase() == ConnectionPhase.DISCONNECTED) {
            log.debug("Viewer at {} unreachable: {}", event.remote(), event.reason());
        } else if (event.newPhase() == ConnectionPhase.CONNECTED) {
            log.info("Connected to viewer at {}", event.remote());
        } else {
            log.info("Disconnected from viewer at {}: {}", event.remote(), event.reason());
        }
    }

    @Override
    public void onError(StreamErrorEvent event) {
        log.warn("Dropped {} frame: {}", event.mode(), event.message(), event.cause());
    }
}
