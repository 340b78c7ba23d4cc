package com.spanlens.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(PropertiesConfig.class);

    @Test
    void defaultsApplyWithoutConfiguration() {
        contextRunner.run(context -> {
            AnalysisProperties analysis = context.getBean(AnalysisProperties.class);
            assertThat(analysis.getIndex()).isEqualTo("traces-otel");
            assertThat(analysis.getHours()).isEqualTo(24);
            assertThat(analysis.getContamination()).isEqualTo(0.05);
            assertThat(analysis.getErrorThreshold()).isEqualTo(0.2);
            assertThat(analysis.getWindowSize()).isEqualTo(Duration.ofMinutes(5));
            assertThat(analysis.getInterval()).isEqualTo(Duration.ofSeconds(300));
            assertThat(analysis.getSpanNames().getApiCall()).isEqualTo("api_call");

            StoreProperties store = context.getBean(StoreProperties.class);
            assertThat(store.getBaseUrl()).isEqualTo("http://localhost:9200");
            assertThat(store.getMaxAttempts()).isEqualTo(3);
        });
    }

    @Test
    void bareNumbersUseMinutesForWindowAndSecondsForInterval() {
        contextRunner
                .withPropertyValues("spanlens.window-size=15", "spanlens.interval=60", "store.backoff=1")
                .run(context -> {
                    AnalysisProperties analysis = context.getBean(AnalysisProperties.class);
                    assertThat(analysis.getWindowSize()).isEqualTo(Duration.ofMinutes(15));
                    assertThat(analysis.getInterval()).isEqualTo(Duration.ofSeconds(60));
                    assertThat(context.getBean(StoreProperties.class).getBackoff()).isEqualTo(Duration.ofSeconds(1));
                });
    }

    @Test
    void contaminationOutsideOpenUnitIntervalIsRejected() {
        contextRunner.withPropertyValues("spanlens.contamination=1.5")
                .run(context -> assertThat(context).hasFailed());
        contextRunner.withPropertyValues("spanlens.contamination=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void errorThresholdIsClosedUnitInterval() {
        contextRunner.withPropertyValues("spanlens.error-threshold=1.0")
                .run(context -> assertThat(context).hasNotFailed());
        contextRunner.withPropertyValues("spanlens.error-threshold=-0.1")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void nonPositiveWindowAndLookbackAreRejected() {
        contextRunner.withPropertyValues("spanlens.window-size=0")
                .run(context -> assertThat(context).hasFailed());
        contextRunner.withPropertyValues("spanlens.hours=0")
                .run(context -> assertThat(context).hasFailed());
        contextRunner.withPropertyValues("spanlens.interval=-5")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties({AnalysisProperties.class, StoreProperties.class})
    static class PropertiesConfig {
    }
}
