package com.spanlens.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * A processable span reduced to one row of the latency / error series.
 * Only the three detector outputs are mutable; they stay null until the
 * matching detector has run.
 */
@Getter
@Builder
@ToString
public class Observation {
    private final Instant timestamp;
    private final double latency;       // seconds, never negative
    private final String traceId;
    private final String spanId;
    private final String parentSpanId;
    private final String spanName;
    private final boolean error;
    private final String errorType;
    private final String service;
    private final Map<String, Object> extraAttributes;

    @Setter
    private Boolean latencyAnomaly;
    @Setter
    private Double windowErrorRate;
    @Setter
    private Boolean errorRateAnomaly;
}
