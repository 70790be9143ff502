package com.questrail.framestream.config;

import com.questrail.framestream.api.FrameGeometry;

import java.util.Objects;

/**
 * Aggregated configuration for a frame streaming session.
 */
public record StreamRuntimeConfig(
    FrameGeometry geometry,
    int port,
    StreamTimingPolicy timingPolicy,
    EncodingPolicy encodingPolicy
) {
    public static final int DEFAULT_PORT = 6543;
    public static final FrameGeometry DEFAULT_GEOMETRY = new FrameGeometry(240, 320);

    public StreamRuntimeConfig {
        Objects.requireNonNull(geometry, "geometry");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(encodingPolicy, "encodingPolicy");
        if (port < 1 || port > 0xFFFF) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    public static StreamRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private FrameGeometry geometry = DEFAULT_GEOMETRY;
        private int port = DEFAULT_PORT;
        private StreamTimingPolicy timingPolicy = StreamTimingPolicy.defaults();
        private EncodingPolicy encodingPolicy = EncodingPolicy.defaults();

        public Builder withGeometry(FrameGeometry geometry) {
            this.geometry = geometry;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withTimingPolicy(StreamTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withEncodingPolicy(EncodingPolicy encodingPolicy) {
            this.encodingPolicy = encodingPolicy;
            return this;
        }

        public StreamRuntimeConfig build() {
            return new StreamRuntimeConfig(geometry, port, timingPolicy, encodingPolicy);
        }
    }
}
