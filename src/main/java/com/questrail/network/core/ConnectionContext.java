package com.questrail.network.core;

import com.questrail.network.config.OutboundQueuePolicy;
import com.questrail.network.dispatch.DispatchBridge;
import com.questrail.network.internal.time.MonotonicClock;
import com.questrail.network.internal.time.SystemMonotonicClock;
import com.questrail.network.internal.time.SystemWallClock;
import com.questrail.network.internal.time.WallClock;
import com.questrail.network.observability.NetworkObservabilitySink;
import com.questrail.network.observability.NullObservabilitySink;

import java.util.Objects;

/**
 * Collaborators shared by every connection of one endpoint.
 */
public record ConnectionContext(
    OutboundQueuePolicy queuePolicy,
    DispatchBridge dispatchBridge,
    NetworkObservabilitySink observabilitySink,
    MonotonicClock clock,
    WallClock wallClock
) {
    public ConnectionContext {
        Objects.requireNonNull(queuePolicy, "queuePolicy");
        Objects.requireNonNull(dispatchBridge, "dispatchBridge");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(wallClock, "wallClock");
        observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Context with system clocks and no observability.
     */
    public static ConnectionContext of(OutboundQueuePolicy queuePolicy, DispatchBridge dispatchBridge) {
        return new ConnectionContext(
                queuePolicy,
                dispatchBridge,
                NullObservabilitySink.INSTANCE,
                SystemMonotonicClock.INSTANCE,
                SystemWallClock.INSTANCE
        );
    }
}
