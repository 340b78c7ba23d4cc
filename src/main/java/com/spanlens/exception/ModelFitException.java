package com.spanlens.exception;

/**
 * The latency model cannot be fitted on the given column (constant or non-finite values).
 */
public class ModelFitException extends SpanLensException {

    public ModelFitException(String message) {
        super(message);
    }
}
