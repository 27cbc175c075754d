package com.aerotravel.realtime.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeWebSocketEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link WebSocketEndpoint} implementation.
 *
 * <p>Contains no Phoenix semantics; it only stores outbound frames and lets
 * tests inject inbound frames and connection transitions. {@link #start()} does
 * not bring the connection up unless {@code autoUp} is set.</p>
 */
public final class FakeWebSocketEndpoint implements WebSocketEndpoint {

    private final boolean autoUp;
    private WebSocketEndpointListener listener;
    private final List<String> sent = new ArrayList<>();
    private boolean up;
    private int startCount;
    private int disconnectCount;
    private boolean stopped;

    public FakeWebSocketEndpoint() {
        this(true);
    }

    public FakeWebSocketEndpoint(boolean autoUp) {
        this.autoUp = autoUp;
    }

    @Override
    public void setListener(WebSocketEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        startCount++;
        if (autoUp) {
            bringUp();
        }
    }

    @Override
    public void stop() {
        stopped = true;
        if (up) {
            up = false;
            listener.onTransportDown(null);
        }
    }

    @Override
    public void disconnect(Throwable cause) {
        disconnectCount++;
        if (up) {
            up = false;
            listener.onTransportDown(cause);
        }
    }

    @Override
    public boolean send(String text) {
        Objects.requireNonNull(text, "text");
        if (!up) {
            return false;
        }
        sent.add(text);
        return true;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void bringUp() {
        requireListener();
        up = true;
        listener.onTransportUp();
    }

    public void drop(Throwable cause) {
        requireListener();
        up = false;
        listener.onTransportDown(cause);
    }

    public void inject(String text) {
        requireListener();
        listener.onText(text);
    }

    public List<String> sent() {
        return Collections.unmodifiableList(sent);
    }

    public void clear() {
        sent.clear();
    }

    public int startCount() {
        return startCount;
    }

    public int disconnectCount() {
        return disconnectCount;
    }

    public boolean isUp() {
        return up;
    }

    public boolean isStopped() {
        return stopped;
    }

    private void requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
    }
}
