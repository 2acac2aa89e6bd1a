/**
 * RCON Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP, Netty WebSocket,
 * or a test double) and the RCON session.
 *
 * <p>Everything above the transport sees only:</p>
 * <ul>
 *   <li>Complete packet messages as {@code byte[]}</li>
 *   <li>Lifecycle notifications (up, error, down)</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no packet interpretation beyond framing)</li>
 *   <li>Not correlate replies with requests</li>
 *   <li>Not schedule retries or timeouts</li>
 * </ul>
 *
 * <p>{@link com.questrail.rcon.protocol.transport.RconTransportAdapter} is the
 * translation layer from transport callbacks to session calls.</p>
 */
package com.questrail.rcon.protocol.transport;
