package com.spanlens.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Data
@Validated
@ConfigurationProperties(prefix = "store")
public class StoreProperties {

    // elasticsearch | file
    private String type = "elasticsearch";

    // Full base URL, wins over host/port when set
    private String url;
    private String host = "localhost";
    @Min(1)
    private int port = 9200;
    private String username;
    private String password;

    @Min(1)
    private int connectTimeoutMs = 5000;
    @Min(1)
    private int socketTimeoutMs = 30000;

    @Min(1)
    private int maxAttempts = 3;
    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration backoff = Duration.ofSeconds(2);

    // JSON export read when type=file
    private String file;

    public String getBaseUrl() {
        if (url != null && !url.isBlank()) {
            return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        }
        return String.format("http://%s:%d", host, port);
    }
}
