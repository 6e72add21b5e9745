package com.questrail.network.transport;

/**
 * Raised when a transport resource cannot be acquired (for example a listen
 * address that cannot be bound). Never raised for per-message send problems.
 */
public class TransportException extends RuntimeException
{
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
