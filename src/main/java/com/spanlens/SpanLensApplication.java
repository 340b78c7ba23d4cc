package com.spanlens;

import com.spanlens.config.AnalysisProperties;
import com.spanlens.config.ProxyProperties;
import com.spanlens.config.StoreProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * SpanLens - latency and error-rate anomaly detection over stored OTEL spans
 * @author kiransahoo
 */
@SpringBootApplication
@EnableConfigurationProperties({AnalysisProperties.class, StoreProperties.class, ProxyProperties.class})
public class SpanLensApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SpanLensApplication.class, args)));
    }
}
