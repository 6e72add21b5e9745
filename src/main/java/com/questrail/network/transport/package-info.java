/**
 * Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>library-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP, a WebSocket stack,
 * a game-networking library, or a test double) and the connection core.
 *
 * <h2>Why these ports exist</h2>
 * The connection state machine, outbound queue and dispatch bridge must not
 * depend on any transport library's types. Everything above the ports sees
 * only:
 * <ul>
 *   <li>Payloads as {@code String}</li>
 *   <li>A {@link com.questrail.network.api.Reliability} tag per message</li>
 *   <li>Lifecycle notifications (up/down)</li>
 *   <li>Raw metrics as {@link com.questrail.network.transport.TransportMetrics}</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Never block the caller of {@code send}</li>
 *   <li>Not queue or retry messages on behalf of the connection</li>
 *   <li>Not invoke application handlers</li>
 * </ul>
 *
 * <p>Binding selection happens once, when a connector or acceptor is
 * constructed, never per call.</p>
 */
package com.questrail.network.transport;
