package com.spanlens.exception;

import lombok.Getter;

/**
 * A timestamp string matched none of the supported formats.
 * Record-level: the span is skipped, the batch continues.
 */
@Getter
public class TimestampParseException extends SpanLensException {

    private final String input;

    public TimestampParseException(String input) {
        super("Could not parse timestamp: '" + input + "'");
        this.input = input;
    }
}
