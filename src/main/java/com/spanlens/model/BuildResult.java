package com.spanlens.model;

import lombok.Value;

@Value
public class BuildResult {
    ObservationTable table;
    BuildSummary summary;
}
