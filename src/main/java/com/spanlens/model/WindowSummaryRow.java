package com.spanlens.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

@Value
@JsonPropertyOrder({"window_start", "observations", "errors", "window_error_rate", "error_rate_anomaly"})
public class WindowSummaryRow {
    @JsonProperty("window_start")
    String windowStart;
    @JsonProperty("observations")
    int observations;
    @JsonProperty("errors")
    int errors;
    @JsonProperty("window_error_rate")
    double windowErrorRate;
    @JsonProperty("error_rate_anomaly")
    boolean errorRateAnomaly;

    public static WindowSummaryRow from(AnomalyWindow window) {
        return new WindowSummaryRow(window.getWindowStart().toString(), window.getObservationCount(),
                window.getErrorCount(), window.getWindowErrorRate(), window.isErrorRateAnomaly());
    }
}
