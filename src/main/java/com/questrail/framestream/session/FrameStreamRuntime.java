package com.questrail.framestream.session;

import com.questrail.framestream.api.FrameSource;
import com.questrail.framestream.codec.impl.DefaultEncodedFrameEncoder;
import com.questrail.framestream.compress.FrameCompressor;
import com.questrail.framestream.compress.JpegFrameCompressor;
import com.questrail.framestream.config.StreamRuntimeConfig;
import com.questrail.framestream.observability.NullObservabilitySink;
import com.questrail.framestream.observability.StreamObservabilitySink;
import com.questrail.framestream.transport.ConnectionManager;
import com.questrail.framestream.transport.StreamEndpoint;
import com.questrail.framestream.transport.tcp.netty.NettyTcpStreamEndpoint;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * FrameStreamRuntime
 * =============================================================================
 * Composition root for frame streaming sessions.
 *
 * <p>At most one session is active at a time; starting a new one closes the
 * previous session first.</p>
 */
public final class FrameStreamRuntime {
    private final StreamRuntimeConfig config;
    private final Supplier<StreamEndpoint> endpointFactory;
    private final FrameCompressor compressor;
    private final StreamObservabilitySink observabilitySink;
    private final FrameSource renderer;

    private FrameStreamSession active;

    private FrameStreamRuntime(StreamRuntimeConfig config,
                               Supplier<StreamEndpoint> endpointFactory,
                               FrameCompressor compressor,
                               StreamObservabilitySink observabilitySink,
                               FrameSource renderer) {
        this.config = config;
        this.endpointFactory = endpointFactory;
        this.compressor = compressor;
        this.observabilitySink = observabilitySink;
        this.renderer = renderer;
    }

    /**
     * Start streaming to {@code host} on the configured port.
     */
    public FrameStreamSession startSession(String host) {
        Objects.requireNonNull(host, "host");
        return startSession(new InetSocketAddress(host, config.port()));
    }

    /**
     * Start streaming to {@code target}. No connection is made until the first tick.
     */
    public synchronized FrameStreamSession startSession(InetSocketAddress target) {
        Objects.requireNonNull(target, "target");
        stop();

        ConnectionManager connection = new ConnectionManager(
                endpointFactory.get(), target, config.timingPolicy(), observabilitySink);

        FrameStreamEncoder encoder = new FrameStreamEncoder(
                config.geometry(),
                config.encodingPolicy(),
                connection,
                compressor,
                new DefaultEncodedFrameEncoder(),
                observabilitySink);

        FrameStreamSession session = new FrameStreamSession(encoder, renderer);
        session.register();
        active = session;
        return session;
    }

    /**
     * Close the active session, if any.
     */
    public synchronized void stop() {
        FrameStreamSession s = active;
        active = null;
        if (s != null) {
            s.close();
        }
    }

    public synchronized FrameStreamSession activeSession() {
        return active;
    }

    public StreamRuntimeConfig config() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private StreamRuntimeConfig config = StreamRuntimeConfig.defaults();
        private Supplier<StreamEndpoint> endpointFactory = NettyTcpStreamEndpoint::new;
        private FrameCompressor compressor = new JpegFrameCompressor();
        private StreamObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private FrameSource renderer;

        public Builder withConfig(StreamRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withEndpointFactory(Supplier<StreamEndpoint> factory) {
            this.endpointFactory = factory;
            return this;
        }

        public Builder withCompressor(FrameCompressor compressor) {
            this.compressor = compressor;
            return this;
        }

        public Builder withObservabilitySink(StreamObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withRenderer(FrameSource renderer) {
            this.renderer = renderer;
            return this;
        }

        public FrameStreamRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(endpointFactory, "endpointFactory");
            Objects.requireNonNull(compressor, "compressor");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            return new FrameStreamRuntime(config, endpointFactory, compressor, observabilitySink, renderer);
        }
    }
}
