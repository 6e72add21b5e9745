package com.questrail.network.api;

/**
 * Receives inbound messages of a connection.
 *
 * <p>Invoked only from the thread that pumps the dispatch bridge
 * (conventionally the application's main thread), once per message and in
 * arrival order.</p>
 */
@FunctionalInterface
public interface MessageHandler
{
    /**
     * @param connectionId source connection; on a server this identifies the client
     * @param message      opaque payload text, typically structured data
     */
    void onMessage(ConnectionId connectionId, String message);
}
