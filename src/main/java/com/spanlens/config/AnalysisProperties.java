package com.spanlens.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Analysis settings. Bound and validated at startup so a bad range fails
 * before the store is contacted.
 * @author kiransahoo
 */
@Data
@Validated
@ConfigurationProperties(prefix = "spanlens")
public class AnalysisProperties {

    @NotBlank
    private String index = "traces-otel";

    @Min(1)
    private int hours = 24;

    @Min(1)
    private int maxDocs = 10000;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax(value = "1.0", inclusive = false)
    private double contamination = 0.05;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double errorThreshold = 0.2;

    @NotNull
    @DurationUnit(ChronoUnit.MINUTES)
    private Duration windowSize = Duration.ofMinutes(5);

    @NotBlank
    private String outputDir = "./anomaly_results";

    private boolean continuous = false;

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration interval = Duration.ofSeconds(300);

    // How long a stop request waits for an in-flight run
    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration shutdownTimeout = Duration.ofSeconds(60);

    // Isolation forest
    private long seed = 42L;

    @Min(1)
    private int trees = 100;

    @Min(2)
    private int sampleSize = 256;

    @Valid
    private SpanNames spanNames = new SpanNames();

    @Data
    public static class SpanNames {
        @NotBlank
        private String apiCall = "api_call";
        @NotBlank
        private String process = "process_data";
        @NotBlank
        private String callPrefix = "call_";
    }

    @AssertTrue(message = "window-size must be positive")
    public boolean isWindowSizePositive() {
        return windowSize == null || (!windowSize.isNegative() && !windowSize.isZero());
    }

    @AssertTrue(message = "interval must be positive")
    public boolean isIntervalPositive() {
        return interval == null || (!interval.isNegative() && !interval.isZero());
    }
}
