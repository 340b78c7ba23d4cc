package com.spanlens.model;

/**
 * Stages of one analysis run. {@code COMPLETED}, {@code SKIPPED} and {@code FAILED} are terminal.
 */
public enum RunState {
    CONNECT,
    FETCH,
    BUILD,
    DETECT_LATENCY,
    DETECT_ERROR_WINDOWS,
    EMIT,
    COMPLETED,
    SKIPPED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == SKIPPED || this == FAILED;
    }
}
