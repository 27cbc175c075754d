package com.aerotravel.realtime.transport.phoenix;

/**
 * An inbound frame could not be turned into a {@link PhoenixMessage} or a
 * row change.
 *
 * <p>The transport drops such frames and reports them; they never close the
 * connection.</p>
 */
public final class PhoenixDecodeException extends RuntimeException
{
    public PhoenixDecodeException(String message) {
        super(message);
    }

    public PhoenixDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
