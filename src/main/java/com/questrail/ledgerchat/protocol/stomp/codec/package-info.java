/**
 * STOMP Codec: Wire-Level Boundary
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for STOMP 1.2
 * frames carried over WebSocket messages. It implements the wire rules of the
 * STOMP 1.2 protocol:</p>
 *
 * <ul>
 *   <li>Command line, header lines, blank line, body</li>
 *   <li>Header value escaping ({@code \\}, {@code \n}, {@code \r}, {@code \c})</li>
 *   <li>{@code content-length} handling</li>
 *   <li>The mandatory NUL terminator</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   WebSocket message bytes
 *        → StompFrameDecoder      (wire rules applied here)
 *            → StompFrame         (unescaped, terminator removed)
 *                → StompConnectionManager
 *                    → SubscriptionRegistry / MessageDispatcher
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Heart-beat messages (EOL only) are recognised by the transport adapter
 *       and never reach the decoder.</li>
 *   <li>The codec is stateless; one call handles exactly one message.</li>
 *   <li>The choice between text and binary WebSocket messages is made by the
 *       transport adapter, not here.</li>
 * </ul>
 */
package com.questrail.ledgerchat.protocol.stomp.codec;
