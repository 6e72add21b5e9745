package com.questrail.network.dispatch;

/**
 * Receiver of dispatched events. Called only from {@link DispatchBridge#pump()}.
 */
@FunctionalInterface
public interface ConnectionEventTarget
{
    void deliver(ConnectionEvent event);
}
