package com.aerotravel.realtime.transport;

/**
 * Callback sink for {@link WebSocketEndpoint}.
 *
 * <p>Netty endpoints deliver callbacks on the channel's event loop. The down
 * report caused by {@link WebSocketEndpoint#disconnect(Throwable)} is made on
 * the caller's thread instead.</p>
 */
public interface WebSocketEndpointListener
{
    /**
     * The handshake completed and frames can be sent.
     */
    void onTransportUp();

    /**
     * The connection is gone.
     *
     * @param cause failure detail; {@code null} for an orderly close
     */
    void onTransportDown(Throwable cause);

    /**
     * One complete inbound text frame.
     */
    void onText(String text);
}
