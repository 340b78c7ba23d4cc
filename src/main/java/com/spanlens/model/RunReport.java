package com.spanlens.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one pipeline run.
 */
@Data
@Builder
public class RunReport {
    private long runNumber;
    private LocalDateTime startedAt;
    private Duration elapsed;
    private RunState finalState;
    // Stage that was active when the run failed or was skipped
    private RunState lastStage;
    private String failureReason;
    private BuildSummary buildSummary;
    private ObservationTable table;
    @Builder.Default
    private List<AnomalyWindow> windows = new ArrayList<>();
    private long latencyAnomalyCount;
    @Builder.Default
    private List<Path> outputFiles = new ArrayList<>();

    public boolean isFailed() {
        return finalState == RunState.FAILED;
    }
}
