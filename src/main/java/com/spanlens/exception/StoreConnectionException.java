package com.spanlens.exception;

/**
 * The span store could not be reached or answered with an unusable response.
 */
public class StoreConnectionException extends SpanLensException {

    public StoreConnectionException(String message) {
        super(message);
    }

    public StoreConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
