package com.questrail.network.config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for the client and server runtimes.
 *
 * <ul>
 *   <li><b>queuePolicy</b>: per-connection outbound queue limits</li>
 *   <li><b>serviceInterval</b>: spacing of the background drain tick</li>
 *   <li><b>heartbeatInterval</b>: ping cadence of the Netty binding, which
 *       feeds round-trip time and quality</li>
 *   <li><b>maxFrameLength</b>: largest encoded frame the Netty binding sends
 *       or accepts, in bytes</li>
 *   <li><b>bindAddress</b>: server listen address</li>
 * </ul>
 */
public record NetworkRuntimeConfig(
    OutboundQueuePolicy queuePolicy,
    Duration serviceInterval,
    Duration heartbeatInterval,
    int maxFrameLength,
    InetSocketAddress bindAddress
) {
    public NetworkRuntimeConfig {
        Objects.requireNonNull(queuePolicy, "queuePolicy");
        Objects.requireNonNull(serviceInterval, "serviceInterval");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(bindAddress, "bindAddress");

        if (serviceInterval.isNegative() || serviceInterval.isZero()) {
            throw new IllegalArgumentException("serviceInterval must be positive");
        }
        if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        if (maxFrameLength < 16) {
            throw new IllegalArgumentException("maxFrameLength must be at least 16 bytes");
        }
    }

    public static NetworkRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private OutboundQueuePolicy queuePolicy = OutboundQueuePolicy.defaults();
        private Duration serviceInterval = Duration.ofMillis(16);
        private Duration heartbeatInterval = Duration.ofSeconds(1);
        private int maxFrameLength = 1024 * 1024;
        private InetSocketAddress bindAddress = new InetSocketAddress(0);

        public Builder withQueuePolicy(OutboundQueuePolicy queuePolicy) {
            this.queuePolicy = queuePolicy;
            return this;
        }

        public Builder withServiceInterval(Duration serviceInterval) {
            this.serviceInterval = serviceInterval;
            return this;
        }

        public Builder withHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder withMaxFrameLength(int maxFrameLength) {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public NetworkRuntimeConfig build() {
            return new NetworkRuntimeConfig(queuePolicy, serviceInterval, heartbeatInterval,
                    maxFrameLength, bindAddress);
        }
    }
}
