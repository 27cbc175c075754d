/**
 * Transport ports.
 * =============================================================================
 *
 * <p>{@link com.aerotravel.realtime.transport.RealtimeTransport} is the boundary
 * between the subscription pool and whatever delivers row changes. Everything
 * above it sees only {@code RowChangePayload} values and
 * {@code ChannelStatus} transitions.</p>
 *
 * <p>{@link com.aerotravel.realtime.transport.WebSocketEndpoint} is the lower
 * boundary used by the Phoenix transport, so that Netty types stay inside
 * {@code transport.netty}.</p>
 *
 * <h2>Constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>not deduplicate or share subscriptions (the pool does that)</li>
 *   <li>not reopen closed subscriptions on their own (the pool's reconnect policy does that)</li>
 *   <li>deliver callbacks for one subscription serially</li>
 * </ul>
 */
package com.aerotravel.realtime.transport;
