package com.spanlens.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AnomalyWindow {
    Instant windowStart;
    int observationCount;
    int errorCount;
    double windowErrorRate;
    boolean errorRateAnomaly;
}
