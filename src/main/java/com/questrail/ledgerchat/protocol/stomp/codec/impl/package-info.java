/**
 * Default STOMP 1.2 codec implementation.
 *
 * <p>{@link com.questrail.ledgerchat.protocol.stomp.codec.impl.DefaultStompFrameEncoder}
 * and {@link com.questrail.ledgerchat.protocol.stomp.codec.impl.DefaultStompFrameDecoder}
 * are exact inverses for every frame the encoder accepts. Both are stateless
 * and safe to share across threads.</p>
 */
package com.questrail.ledgerchat.protocol.stomp.codec.impl;
