package com.aerotravel.realtime.domain;

/**
 * A delivered row could not be decoded into its domain type. Raised from a
 * channel listener, so the wrapper reports it as a callback error.
 */
public class RowMappingException extends RuntimeException {

    public RowMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
