/**
 * STOMP Transport Ports
 * =============================================================================
 *
 * These types define the <em>framework-agnostic transport boundary</em>
 * between a concrete WebSocket client (Netty, or a test double) and the STOMP
 * session.
 *
 * <p>Everything above {@link com.questrail.ledgerchat.protocol.stomp.transport.StompTransportAdapter}
 * sees only decoded frames and lifecycle signals. Netty types never leave the
 * {@code transport.ws.netty} package.</p>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of {@link com.questrail.ledgerchat.protocol.stomp.transport.MessageEndpoint} MUST:
 * <ul>
 *   <li>Perform transport I/O only (no STOMP interpretation)</li>
 *   <li>Deliver whole messages, never fragments</li>
 *   <li>Not schedule retries, heart-beats or timeouts</li>
 * </ul>
 */
package com.questrail.ledgerchat.protocol.stomp.transport;
