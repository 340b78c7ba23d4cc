package com.spanlens.exception;

/**
 * Base type for failures raised by the analysis pipeline.
 */
public class SpanLensException extends RuntimeException {

    public SpanLensException(String message) {
        super(message);
    }

    public SpanLensException(String message, Throwable cause) {
        super(message, cause);
    }
}
