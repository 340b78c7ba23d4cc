package com.spanlens.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * One line of the anomaly summary handed to export and visualization.
 * Detector outputs that were never set are written as empty cells.
 */
@Value
@Builder
@JsonPropertyOrder({"timestamp", "latency", "latency_anomaly", "window_error_rate",
        "error_rate_anomaly", "trace_id", "span_id", "service", "error", "error_type"})
public class AnomalySummaryRow {
    @JsonProperty("timestamp")
    String timestamp;
    @JsonProperty("latency")
    double latency;
    @JsonProperty("latency_anomaly")
    Boolean latencyAnomaly;
    @JsonProperty("window_error_rate")
    Double windowErrorRate;
    @JsonProperty("error_rate_anomaly")
    Boolean errorRateAnomaly;
    @JsonProperty("trace_id")
    String traceId;
    @JsonProperty("span_id")
    String spanId;
    @JsonProperty("service")
    String service;
    @JsonProperty("error")
    boolean error;
    @JsonProperty("error_type")
    String errorType;

    public static AnomalySummaryRow from(Observation observation) {
        return AnomalySummaryRow.builder()
                .timestamp(observation.getTimestamp().toString())
                .latency(observation.getLatency())
                .latencyAnomaly(observation.getLatencyAnomaly())
                .windowErrorRate(observation.getWindowErrorRate())
                .errorRateAnomaly(observation.getErrorRateAnomaly())
                .traceId(observation.getTraceId())
                .spanId(observation.getSpanId())
                .service(observation.getService())
                .error(observation.isError())
                .errorType(observation.getErrorType())
                .build();
    }
}
