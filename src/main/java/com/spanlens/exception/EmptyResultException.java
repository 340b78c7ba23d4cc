package com.spanlens.exception;

/**
 * The query returned no span documents. Not retried; the run is skipped.
 */
public class EmptyResultException extends SpanLensException {

    public EmptyResultException(String message) {
        super(message);
    }
}
