package com.aerotravel.realtime.transport;

/**
 * WebSocketEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a text WebSocket connection.
 *
 * <p>The endpoint moves text frames and reports lifecycle transitions; it does
 * not interpret frames, schedule heartbeats or reconnect. Protocol handling
 * lives in the transport built on top of it.</p>
 *
 * <p>Implementations may be backed by Netty or by a test double.</p>
 */
public interface WebSocketEndpoint
{
    /**
     * Connect and complete the WebSocket handshake. Returns immediately. May be
     * called again after the connection went down, until {@link #stop()}.
     *
     * <p>On success the endpoint MUST call
     * {@link WebSocketEndpointListener#onTransportUp()} once.</p>
     */
    void start();

    /**
     * Close the connection and release all resources.
     *
     * <p>The listener receives {@link WebSocketEndpointListener#onTransportDown(Throwable)}
     * at most once per up/down transition.</p>
     */
    void stop();

    /**
     * Drop the current connection while keeping the endpoint usable;
     * {@link #start()} may be called again afterwards.
     *
     * <p>If the connection was up, the listener receives
     * {@link WebSocketEndpointListener#onTransportDown(Throwable)} with
     * {@code cause} on the calling thread before this method returns. Does
     * nothing when the connection is already down.</p>
     */
    void disconnect(Throwable cause);

    /**
     * Send one text frame. Frames sent while the connection is down are dropped.
     *
     * @return {@code true} if the frame was handed to the connection
     */
    boolean send(String text);

    /**
     * Register the listener. Must be called before {@link #start()}.
     */
    void setListener(WebSocketEndpointListener listener);
}
