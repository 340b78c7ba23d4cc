package com.spanlens.service.pipeline;

import com.spanlens.config.AnalysisProperties;
import com.spanlens.model.RunReport;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Starts the pipeline once the context is up, in single-shot or continuous mode.
 * Exit code is 1 when the last run failed, 0 otherwise.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "spanlens.runner.enabled", havingValue = "true", matchIfMissing = true)
public class AnalysisRunner implements ApplicationRunner, ExitCodeGenerator {

    private final PipelineOrchestrator orchestrator;
    private final AnalysisProperties properties;

    private volatile RunReport lastReport;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Analyzing index {} (last {}h, contamination={}, error threshold={}, window={})",
                properties.getIndex(), properties.getHours(), properties.getContamination(),
                properties.getErrorThreshold(), properties.getWindowSize());

        lastReport = properties.isContinuous()
                ? orchestrator.runContinuously()
                : orchestrator.runOnce();
    }

    @Override
    public int getExitCode() {
        return lastReport != null && lastReport.isFailed() ? 1 : 0;
    }

    @PreDestroy
    public void shutdown() {
        orchestrator.stop();
    }
}
