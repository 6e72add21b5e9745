package com.questrail.network.core;

/**
 * Internal hook for owners of a connection (registry, server) that need to
 * react to lifecycle transitions.
 *
 * <p>Called synchronously on whichever thread caused the transition, while
 * the connection's state lock is held, so implementations must be quick and
 * must not call back into the connection's lifecycle methods. Application
 * code uses {@code ConnectionStatusHandler} instead.</p>
 */
@FunctionalInterface
public interface ConnectionLifecycleListener
{
    ConnectionLifecycleListener NONE = (connection, oldState, newState) -> {};

    void onStateChanged(DefaultNetworkConnection connection,
                        ConnectionState oldState,
                        ConnectionState newState);
}
