package com.spanlens.model;

import lombok.Builder;
import lombok.Data;

/**
 * Per-batch counters from span classification and observation building.
 * Record-level failures end up here instead of being thrown.
 */
@Data
@Builder
public class BuildSummary {
    private int documentCount;
    private int apiCallCount;
    private int processCount;
    private int callCount;
    private int admittedCount;
    private int missingEndCount;
    private int unparseableCount;
    private int negativeLatencyCount;
    private boolean fallbackUsed;

    public int getSkippedCount() {
        return missingEndCount + unparseableCount + negativeLatencyCount;
    }
}
