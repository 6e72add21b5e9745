package com.questrail.network.api;

/**
 * ConnectionId
 * -----------------------------------------------------------------------------
 * Opaque unsigned 32-bit identifier of a connection on one endpoint.
 *
 * <p>A client typically holds a single id for its server connection; a server
 * holds one per accepted client. Identifiers are unique among the live
 * connections of an endpoint and never change once assigned.</p>
 *
 * <p>The value {@code 0} is reserved as {@link #INVALID} and is never minted
 * for a real connection.</p>
 */
public record ConnectionId(long value) implements Comparable<ConnectionId>
{
    /** Largest representable identifier (2^32 - 1). */
    public static final long MAX_VALUE = 0xFFFF_FFFFL;

    /** Reserved "no connection" identifier. */
    public static final ConnectionId INVALID = new ConnectionId(0);

    public ConnectionId {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("ConnectionId must be in [0, 2^32-1]: " + value);
        }
    }

    /**
     * Returns the identifier for a non-zero value.
     *
     * @throws IllegalArgumentException if {@code value} is zero or out of range
     */
    public static ConnectionId of(long value) {
        if (value == 0) {
            throw new IllegalArgumentException("ConnectionId 0 is reserved");
        }
        return new ConnectionId(value);
    }

    public boolean isValid() {
        return value != 0;
    }

    @Override
    public int compareTo(ConnectionId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "conn#" + value;
    }
}
