package com.questrail.network.transport;

/**
 * Raw metrics reported by a transport binding.
 *
 * @param rttMillis      current round-trip time in milliseconds
 * @param qualityPercent connection quality derived from packet loss, 0 to 100
 * @param bytesSent      cumulative bytes written
 * @param bytesReceived  cumulative bytes read
 */
public record TransportMetrics(
        long rttMillis,
        double qualityPercent,
        long bytesSent,
        long bytesReceived
) {
    /** Metrics of a binding that has not measured anything yet. */
    public static final TransportMetrics NONE = new TransportMetrics(0, 100.0, 0, 0);

    public TransportMetrics {
        if (rttMillis < 0) {
            throw new IllegalArgumentException("rttMillis must be non-negative");
        }
        if (bytesSent < 0 || bytesReceived < 0) {
            throw new IllegalArgumentException("byte counts must be non-negative");
        }
        qualityPercent = Math.max(0.0, Math.min(100.0, qualityPercent));
    }
}
