package com.aerotravel.realtime.transport;

/**
 * Raised when a transport cannot accept a subscription request at all, for
 * example because it has not been started.
 */
public class RealtimeTransportException extends RuntimeException
{
    public RealtimeTransportException(String message)
    {
        super(message);
    }

    public RealtimeTransportException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
